package com.substitution.solver.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

import lombok.EqualsAndHashCode;

/**
 * Immutable, injective partial function from cipher letters to plain letters.
 *
 * Extending a mapping always produces a new instance; stages fanning out over
 * the same inbound mapping never observe each other's extensions.
 */
@EqualsAndHashCode
public final class LetterMapping {

    public static final int ALPHABET_SIZE = 26;

    /** Marker for an unmapped cipher letter. */
    public static final char UNMAPPED = '\0';

    private static final LetterMapping EMPTY = new LetterMapping(new char[ALPHABET_SIZE], 0);

    private final char[] plainByCipher;

    @EqualsAndHashCode.Exclude
    private final int claimedPlain;

    private LetterMapping(char[] plainByCipher, int claimedPlain) {
        this.plainByCipher = plainByCipher;
        this.claimedPlain = claimedPlain;
    }

    public static LetterMapping empty() {
        return EMPTY;
    }

    /**
     * Build a mapping from explicit pairs.
     *
     * @throws IllegalArgumentException if a key or value is not a lowercase letter,
     *                                  or two cipher letters share a plain letter
     */
    public static LetterMapping of(Map<Character, Character> pairs) {
        LetterMapping mapping = EMPTY;
        for (Map.Entry<Character, Character> entry : pairs.entrySet()) {
            mapping = mapping.with(entry.getKey(), entry.getValue());
        }
        return mapping;
    }

    public boolean isMapped(char cipher) {
        return plainByCipher[index(cipher)] != UNMAPPED;
    }

    /**
     * Plain letter assigned to the cipher letter, or {@link #UNMAPPED}.
     */
    public char plainFor(char cipher) {
        return plainByCipher[index(cipher)];
    }

    /**
     * True when some cipher letter already maps to this plain letter.
     */
    public boolean isClaimed(char plain) {
        return (claimedPlain & bit(plain)) != 0;
    }

    public int size() {
        return Integer.bitCount(claimedPlain);
    }

    public boolean isEmpty() {
        return claimedPlain == 0;
    }

    /**
     * New mapping with one more assignment. Re-assigning an identical pair returns
     * this instance.
     *
     * @throws IllegalArgumentException if the assignment would break injectivity or
     *                                  overwrite a different existing assignment
     */
    public LetterMapping with(char cipher, char plain) {
        int c = index(cipher);
        char existing = plainByCipher[c];
        if (existing == plain) {
            return this;
        }
        if (existing != UNMAPPED) {
            throw new IllegalArgumentException(
                    "Cipher letter '" + cipher + "' already maps to '" + existing + "', cannot remap to '" + plain + "'");
        }
        if (isClaimed(plain)) {
            throw new IllegalArgumentException(
                    "Plain letter '" + plain + "' is already claimed by another cipher letter");
        }
        char[] copy = plainByCipher.clone();
        copy[c] = plain;
        return new LetterMapping(copy, claimedPlain | bit(plain));
    }

    /**
     * New mapping that additionally assigns every unmapped cipher letter of the
     * word to the letter at the same position in the plain word.
     *
     * @throws IllegalArgumentException if the words differ in length or the
     *                                  assignments conflict with this mapping
     */
    public LetterMapping extend(String cipherWord, String plainWord) {
        if (cipherWord.length() != plainWord.length()) {
            throw new IllegalArgumentException(
                    "Length mismatch: '" + cipherWord + "' vs '" + plainWord + "'");
        }
        char[] copy = plainByCipher.clone();
        int claimed = claimedPlain;
        for (int i = 0; i < cipherWord.length(); i++) {
            int c = index(cipherWord.charAt(i));
            char plain = plainWord.charAt(i);
            if (copy[c] == plain) {
                continue;
            }
            if (copy[c] != UNMAPPED || (claimed & bit(plain)) != 0) {
                throw new IllegalArgumentException(
                        "'" + plainWord + "' is not a consistent reading of '" + cipherWord + "' under " + this);
            }
            copy[c] = plain;
            claimed |= bit(plain);
        }
        return claimed == claimedPlain ? this : new LetterMapping(copy, claimed);
    }

    /**
     * Assignments ordered by cipher letter.
     */
    public Map<Character, Character> asMap() {
        Map<Character, Character> map = new LinkedHashMap<>();
        for (int c = 0; c < ALPHABET_SIZE; c++) {
            if (plainByCipher[c] != UNMAPPED) {
                map.put((char) ('a' + c), plainByCipher[c]);
            }
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public String toString() {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        asMap().forEach((cipher, plain) -> joiner.add(cipher + ":" + plain));
        return joiner.toString();
    }

    private static int index(char letter) {
        int i = letter - 'a';
        if (i < 0 || i >= ALPHABET_SIZE) {
            throw new IllegalArgumentException("Not a lowercase letter: '" + letter + "'");
        }
        return i;
    }

    private static int bit(char letter) {
        return 1 << index(letter);
    }
}
