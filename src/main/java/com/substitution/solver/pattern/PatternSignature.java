package com.substitution.solver.pattern;

import java.util.List;
import java.util.stream.Collectors;

import lombok.NonNull;
import lombok.Value;

/**
 * Letter-repetition fingerprint of a word. Each position holds the rank of
 * first occurrence of its letter, so "llama" is (1, 1, 2, 3, 2).
 *
 * Pure structure only; computing it belongs to {@link PatternSignatureCalculator}.
 */
@Value
public class PatternSignature {

    @NonNull
    List<Integer> ranks;

    public PatternSignature(@NonNull List<Integer> ranks) {
        this.ranks = List.copyOf(ranks);
    }

    public int length() {
        return ranks.size();
    }

    /**
     * Number of distinct letters in words carrying this signature.
     */
    public int distinctLetters() {
        int max = 0;
        for (int rank : ranks) {
            max = Math.max(max, rank);
        }
        return max;
    }

    @Override
    public String toString() {
        return ranks.stream().map(String::valueOf).collect(Collectors.joining(",", "(", ")"));
    }
}
