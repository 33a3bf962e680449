package com.substitution.solver.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Final verdict for one cipher letter.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Resolution {

    private static final Resolution AMBIGUOUS = new Resolution(Kind.AMBIGUOUS, LetterMapping.UNMAPPED);
    private static final Resolution UNKNOWN = new Resolution(Kind.UNKNOWN, LetterMapping.UNMAPPED);

    public enum Kind {
        /** Exactly one plain letter was ever proposed. */
        CERTAIN,
        /** Two or more distinct plain letters were proposed. */
        AMBIGUOUS,
        /** Never proposed. */
        UNKNOWN
    }

    Kind kind;

    /** Only meaningful for {@link Kind#CERTAIN}. */
    char plain;

    public static Resolution certain(char plain) {
        return new Resolution(Kind.CERTAIN, plain);
    }

    public static Resolution ambiguous() {
        return AMBIGUOUS;
    }

    public static Resolution unknown() {
        return UNKNOWN;
    }

    public boolean isCertain() {
        return kind == Kind.CERTAIN;
    }

    public boolean isAmbiguous() {
        return kind == Kind.AMBIGUOUS;
    }

    public boolean isUnknown() {
        return kind == Kind.UNKNOWN;
    }

    @Override
    public String toString() {
        return isCertain() ? "Certain(" + plain + ")" : kind.name().charAt(0) + kind.name().substring(1).toLowerCase();
    }
}
