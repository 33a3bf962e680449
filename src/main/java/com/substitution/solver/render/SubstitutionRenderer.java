package com.substitution.solver.render;

import com.substitution.solver.model.LetterMapping;
import com.substitution.solver.text.TextNormalizer;

/**
 * Applies a letter substitution to original, unnormalized text. Case is kept,
 * and anything that is not a letter passes through untouched.
 */
public class SubstitutionRenderer {

    private SubstitutionRenderer() {
        // Utility class
    }

    /**
     * @param substitutions replacement per lowercase letter, indexed from 'a';
     *                      {@link LetterMapping#UNMAPPED} leaves the letter as is
     */
    public static String render(String text, char[] substitutions) {
        if (substitutions.length != LetterMapping.ALPHABET_SIZE) {
            throw new IllegalArgumentException("Expected " + LetterMapping.ALPHABET_SIZE + " substitutions");
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            char lower = TextNormalizer.toLowerLetter(ch);
            char replacement = lower != 0 ? substitutions[lower - 'a'] : LetterMapping.UNMAPPED;

            if (replacement == LetterMapping.UNMAPPED) {
                sb.append(ch);
            } else if (ch != lower) {
                sb.append(Character.toUpperCase(replacement));
            } else {
                sb.append(replacement);
            }
        }
        return sb.toString();
    }

    /**
     * Convenience overload for a plain mapping; unmapped letters pass through.
     */
    public static String render(String text, LetterMapping mapping) {
        char[] substitutions = new char[LetterMapping.ALPHABET_SIZE];
        for (int c = 0; c < substitutions.length; c++) {
            substitutions[c] = mapping.plainFor((char) ('a' + c));
        }
        return render(text, substitutions);
    }
}
