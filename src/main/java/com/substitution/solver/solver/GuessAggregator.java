package com.substitution.solver.solver;

import java.util.ArrayList;
import java.util.List;

import com.substitution.solver.model.LetterMapping;
import com.substitution.solver.model.Resolution;
import com.substitution.solver.model.ResolutionTable;

/**
 * Terminal receiver of the chain. Records, for each cipher letter, every plain
 * letter any surviving mapping assigned to it, and resolves the table once at
 * the end of the run.
 */
public class GuessAggregator implements MappingReceiver {

    /** Bit i set: plain letter 'a' + i was proposed. */
    private final int[] proposed = new int[LetterMapping.ALPHABET_SIZE];

    private long observed;
    private boolean finalized;

    @Override
    public void receive(LetterMapping mapping) {
        observe(mapping);
    }

    public void observe(LetterMapping mapping) {
        if (finalized) {
            throw new IllegalStateException("Aggregator already finalized; no further mappings accepted");
        }
        observed++;
        for (int c = 0; c < LetterMapping.ALPHABET_SIZE; c++) {
            char plain = mapping.plainFor((char) ('a' + c));
            if (plain != LetterMapping.UNMAPPED) {
                proposed[c] |= 1 << (plain - 'a');
            }
        }
    }

    /**
     * Resolve every cipher letter: one proposal is certain, several are ambiguous,
     * none is unknown. May be called once.
     *
     * @throws IllegalStateException on a second call
     */
    public ResolutionTable finalizeResolution() {
        if (finalized) {
            throw new IllegalStateException("Aggregator already finalized");
        }
        finalized = true;

        List<Resolution> resolutions = new ArrayList<>(LetterMapping.ALPHABET_SIZE);
        for (int mask : proposed) {
            int n = Integer.bitCount(mask);
            if (n == 0) {
                resolutions.add(Resolution.unknown());
            } else if (n == 1) {
                resolutions.add(Resolution.certain((char) ('a' + Integer.numberOfTrailingZeros(mask))));
            } else {
                resolutions.add(Resolution.ambiguous());
            }
        }
        return new ResolutionTable(resolutions);
    }

    public long getObserved() {
        return observed;
    }

    public boolean isFinalized() {
        return finalized;
    }
}
