package com.connect3.core;

/**
 * The two sides of a Dynamic Connect-3 match. White always moves first.
 */
public enum Player {
    WHITE,
    BLACK;

    public Player opponent() {
        return this == WHITE ? BLACK : WHITE;
    }

    /**
     * Returns {@code +1} for white and {@code -1} for black, the factor that converts a
     * white-perspective score into this side's perspective.
     */
    public int sign() {
        return this == WHITE ? 1 : -1;
    }
}
