package com.substitution.solver.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.substitution.solver.model.CipherWord;
import com.substitution.solver.model.LetterMapping;

/**
 * Decides which candidate readings of a cipher word agree with a partial
 * mapping, and what mapping each admissible reading implies. Stateless.
 */
public class WordMatcher {

    /**
     * A candidate is admissible when every already-mapped cipher letter lines up
     * with the candidate's letter, and every unmapped cipher letter lines up with a
     * plain letter nobody else has claimed.
     */
    public boolean isAdmissible(String cipherWord, LetterMapping mapping, String candidate) {
        return match(cipherWord, mapping, candidate);
    }

    /**
     * The inbound mapping extended by the candidate, or empty if the candidate is
     * not admissible.
     */
    public Optional<LetterMapping> extend(String cipherWord, LetterMapping mapping, String candidate) {
        if (!match(cipherWord, mapping, candidate)) {
            return Optional.empty();
        }
        return Optional.of(mapping.extend(cipherWord, candidate));
    }

    /**
     * One extended mapping per admissible candidate, in candidate order.
     */
    public List<LetterMapping> extensions(CipherWord word, LetterMapping mapping) {
        List<LetterMapping> result = new ArrayList<>();
        for (String candidate : word.getCandidates()) {
            extend(word.getText(), mapping, candidate).ifPresent(result::add);
        }
        return result;
    }

    /**
     * New assignments are checked against each other too, so a candidate with a
     * different repetition shape is rejected rather than producing a non-injective
     * mapping.
     */
    private boolean match(String cipherWord, LetterMapping mapping, String candidate) {
        if (cipherWord.length() != candidate.length()) {
            return false;
        }
        char[] assigned = new char[LetterMapping.ALPHABET_SIZE];
        int claimedHere = 0;

        for (int i = 0; i < cipherWord.length(); i++) {
            char cipher = cipherWord.charAt(i);
            char plain = candidate.charAt(i);
            if (plain < 'a' || plain > 'z') {
                return false;
            }

            if (mapping.isMapped(cipher)) {
                if (mapping.plainFor(cipher) != plain) {
                    return false;
                }
                continue;
            }

            int c = cipher - 'a';
            if (assigned[c] != LetterMapping.UNMAPPED) {
                if (assigned[c] != plain) {
                    return false;
                }
                continue;
            }
            int bit = 1 << (plain - 'a');
            if (mapping.isClaimed(plain) || (claimedHere & bit) != 0) {
                return false;
            }
            assigned[c] = plain;
            claimedHere |= bit;
        }
        return true;
    }
}
