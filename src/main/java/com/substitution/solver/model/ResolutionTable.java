package com.substitution.solver.model;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.EqualsAndHashCode;

/**
 * Resolutions for all 26 cipher letters, produced once per run.
 */
@EqualsAndHashCode
public final class ResolutionTable {

    private final Resolution[] byCipher;

    public ResolutionTable(List<Resolution> resolutions) {
        if (resolutions.size() != LetterMapping.ALPHABET_SIZE) {
            throw new IllegalArgumentException(
                    "Expected " + LetterMapping.ALPHABET_SIZE + " resolutions, got " + resolutions.size());
        }
        this.byCipher = resolutions.toArray(new Resolution[0]);
    }

    public Resolution get(char cipher) {
        int i = cipher - 'a';
        if (i < 0 || i >= LetterMapping.ALPHABET_SIZE) {
            throw new IllegalArgumentException("Not a lowercase letter: '" + cipher + "'");
        }
        return byCipher[i];
    }

    /**
     * Substitution array for the renderer: the certain letter, the placeholder for
     * ambiguous letters, {@link LetterMapping#UNMAPPED} for unknown ones.
     */
    public char[] toSubstitutions(char placeholder) {
        char[] substitutions = new char[LetterMapping.ALPHABET_SIZE];
        for (int i = 0; i < byCipher.length; i++) {
            Resolution r = byCipher[i];
            switch (r.getKind()) {
                case CERTAIN -> substitutions[i] = r.getPlain();
                case AMBIGUOUS -> substitutions[i] = placeholder;
                default -> substitutions[i] = LetterMapping.UNMAPPED;
            }
        }
        return substitutions;
    }

    /**
     * Resolutions of the given letters only, ordered alphabetically.
     */
    public Map<Character, Resolution> restrictTo(String letters) {
        Map<Character, Resolution> result = new LinkedHashMap<>();
        for (char c = 'a'; c <= 'z'; c++) {
            if (letters.indexOf(c) >= 0) {
                result.put(c, get(c));
            }
        }
        return result;
    }

    public long count(Resolution.Kind kind, String letters) {
        return restrictTo(letters).values().stream().filter(r -> r.getKind() == kind).count();
    }

    @Override
    public String toString() {
        return Arrays.toString(byCipher);
    }
}
