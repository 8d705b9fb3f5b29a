package com.connect3.core.ai;

/**
 * Flag used to describe the type of value stored in the transposition table.
 */
public enum TTFlag {
    EXACT,
    LOWER_BOUND,
    UPPER_BOUND;

    private static final TTFlag[] VALUES = values();

    /**
     * Returns the flag with the given ordinal, or {@code null} if there is none.
     */
    static TTFlag fromOrdinal(int ordinal) {
        return ordinal >= 0 && ordinal < VALUES.length ? VALUES[ordinal] : null;
    }
}
