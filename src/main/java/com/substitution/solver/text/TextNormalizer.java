package com.substitution.solver.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility for reducing raw text to the lowercase, letter-only form the solver
 * works on.
 */
public class TextNormalizer {

    private TextNormalizer() {
        // Utility class
    }

    /**
     * Lowercases the input and drops everything outside a-z.
     * Examples: "Test!!" -> "test", "I'm" -> "im".
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = toLowerLetter(text.charAt(i));
            if (ch != 0) {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    /**
     * Splits text on whitespace and normalizes each token, dropping tokens
     * that normalize to nothing (numbers, stray punctuation).
     */
    public static List<String> tokenize(String text) {
        List<String> words = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return words;
        }
        for (String token : text.trim().split("\\s+")) {
            String word = normalize(token);
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    /**
     * Lowercase form of an ASCII letter of either case, or 0 for anything else.
     */
    public static char toLowerLetter(char ch) {
        if (ch >= 'a' && ch <= 'z') {
            return ch;
        }
        if (ch >= 'A' && ch <= 'Z') {
            return (char) (ch - 'A' + 'a');
        }
        return 0;
    }

    /**
     * True for the 26 lowercase ASCII letters only.
     */
    public static boolean isLetter(char ch) {
        return ch >= 'a' && ch <= 'z';
    }
}
