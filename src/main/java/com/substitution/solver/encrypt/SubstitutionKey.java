package com.substitution.solver.encrypt;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import com.substitution.solver.model.LetterMapping;
import com.substitution.solver.render.SubstitutionRenderer;

import lombok.EqualsAndHashCode;

/**
 * A complete bijective substitution over the 26 lowercase letters.
 */
@EqualsAndHashCode
public final class SubstitutionKey {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz";

    private final char[] image;

    private SubstitutionKey(char[] image) {
        this.image = image;
    }

    /**
     * Key from its image of "abc...z", e.g. "qwertyuiopasdfghjklzxcvbnm".
     *
     * @throws IllegalArgumentException unless the image is a permutation of a-z
     */
    public static SubstitutionKey of(String image) {
        String lower = image.toLowerCase();
        if (lower.length() != LetterMapping.ALPHABET_SIZE) {
            throw new IllegalArgumentException("Key must have 26 letters, got " + lower.length());
        }
        boolean[] seen = new boolean[LetterMapping.ALPHABET_SIZE];
        for (int i = 0; i < lower.length(); i++) {
            char ch = lower.charAt(i);
            if (ch < 'a' || ch > 'z' || seen[ch - 'a']) {
                throw new IllegalArgumentException("Key is not a permutation of the alphabet: " + image);
            }
            seen[ch - 'a'] = true;
        }
        return new SubstitutionKey(lower.toCharArray());
    }

    /**
     * Uniformly shuffled key.
     */
    public static SubstitutionKey random(Random random) {
        List<Character> letters = new ArrayList<>();
        for (char ch : ALPHABET.toCharArray()) {
            letters.add(ch);
        }
        Collections.shuffle(letters, random);

        char[] image = new char[LetterMapping.ALPHABET_SIZE];
        for (int i = 0; i < image.length; i++) {
            image[i] = letters.get(i);
        }
        return new SubstitutionKey(image);
    }

    public char encipher(char plain) {
        return image[plain - 'a'];
    }

    /**
     * Enciphers text, keeping case and non-letters.
     */
    public String encipher(String text) {
        return SubstitutionRenderer.render(text, image.clone());
    }

    public SubstitutionKey inverse() {
        char[] inverse = new char[LetterMapping.ALPHABET_SIZE];
        for (int i = 0; i < image.length; i++) {
            inverse[image[i] - 'a'] = (char) ('a' + i);
        }
        return new SubstitutionKey(inverse);
    }

    @Override
    public String toString() {
        return new String(image);
    }
}
