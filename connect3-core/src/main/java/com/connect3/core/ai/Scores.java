package com.connect3.core.ai;

/**
 * Score scale shared by the evaluator, the search and the transposition table.
 *
 * <p>A won position is worth {@link #WIN_SCORE} minus the distance to the win in plies, so
 * faster wins compare higher. Anything at or beyond {@link #WIN_THRESHOLD} in absolute value is a
 * proven result; heuristic scores always stay below it.
 */
public final class Scores {

    public static final int WIN_SCORE = 1_000_000;
    public static final int WIN_THRESHOLD = WIN_SCORE - 1_000;
    public static final int INFINITY = WIN_SCORE + 1;

    private Scores() {
    }

    public static int winIn(int ply) {
        return WIN_SCORE - ply;
    }

    public static int lossIn(int ply) {
        return -WIN_SCORE + ply;
    }

    public static boolean isDecisive(int score) {
        return Math.abs(score) >= WIN_THRESHOLD;
    }

    /**
     * Keeps a heuristic score strictly inside the non-decisive range.
     */
    public static int clampHeuristic(long score) {
        long limit = WIN_THRESHOLD - 1L;
        return (int) Math.max(-limit, Math.min(limit, score));
    }

    /**
     * Adds a learned correction to a heuristic score. Proven results are left alone.
     */
    public static int applyBias(int score, int bias) {
        if (bias == 0 || isDecisive(score)) {
            return score;
        }
        return clampHeuristic((long) score + bias);
    }

    /**
     * Converts a root-relative decisive score into a node-relative one before storing it.
     */
    public static int toStored(int score, int ply) {
        if (score >= WIN_THRESHOLD) {
            return score + ply;
        }
        if (score <= -WIN_THRESHOLD) {
            return score - ply;
        }
        return score;
    }

    /**
     * Reverses {@link #toStored(int, int)} for a probe made {@code ply} plies below the root.
     */
    public static int fromStored(int score, int ply) {
        if (score >= WIN_THRESHOLD) {
            return score - ply;
        }
        if (score <= -WIN_THRESHOLD) {
            return score + ply;
        }
        return score;
    }
}
