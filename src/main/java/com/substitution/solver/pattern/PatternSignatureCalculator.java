package com.substitution.solver.pattern;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Calculates the repetition signature of a word. Two words have the same
 * signature exactly when one can be turned into the other by a letter-for-letter
 * substitution.
 */
public class PatternSignatureCalculator {

    private PatternSignatureCalculator() {
        // Utility class
    }

    /**
     * Scans the word once, giving each newly seen letter the next unused rank and
     * reusing ranks for repeats. Examples:
     * "word" -> (1, 2, 3, 4), "all" -> (1, 2, 2).
     */
    public static PatternSignature calculateSignature(String word) {
        Map<Character, Integer> rankByLetter = new HashMap<>();
        List<Integer> ranks = new ArrayList<>(word.length());

        for (int i = 0; i < word.length(); i++) {
            char ch = Character.toLowerCase(word.charAt(i));
            Integer rank = rankByLetter.get(ch);
            if (rank == null) {
                rank = rankByLetter.size() + 1;
                rankByLetter.put(ch, rank);
            }
            ranks.add(rank);
        }
        return new PatternSignature(ranks);
    }

    /**
     * Check whether two words are substitution images of each other.
     */
    public static boolean isIsomorphic(String first, String second) {
        return first.length() == second.length()
                && calculateSignature(first).equals(calculateSignature(second));
    }
}
