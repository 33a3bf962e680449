package com.substitution.solver.solver;

import java.util.List;

import com.substitution.solver.model.LetterMapping;
import com.substitution.solver.model.ResolutionTable;

import lombok.Getter;

/**
 * An assembled chain of word stages in front of an aggregator. Driven exactly
 * once by {@link #run()}.
 */
@Getter
public class StageChain {

    private final MappingReceiver entry;

    /** Stages in evaluation order, entry first. */
    private final List<WordStage> stages;

    private final GuessAggregator aggregator;

    private final SearchBudget budget;

    StageChain(MappingReceiver entry, List<WordStage> stages, GuessAggregator aggregator, SearchBudget budget) {
        this.entry = entry;
        this.stages = List.copyOf(stages);
        this.aggregator = aggregator;
        this.budget = budget;
    }

    /**
     * Inject the empty mapping at the entry stage and, once the depth-first
     * traversal has fully unwound, finalize the aggregator.
     *
     * @throws IllegalStateException if the chain has already been run
     */
    public ResolutionTable run() {
        if (aggregator.isFinalized()) {
            throw new IllegalStateException("Stage chain has already been run");
        }
        entry.receive(LetterMapping.empty());
        return aggregator.finalizeResolution();
    }
}
