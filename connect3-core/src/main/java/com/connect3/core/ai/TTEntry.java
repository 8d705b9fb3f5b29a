package com.connect3.core.ai;

import com.connect3.core.Move;
import java.util.Objects;

/**
 * Entry stored inside the transposition table.
 *
 * <p>The search result and the learned correction are kept apart: a deeper search replaces
 * {@link #value()} but carries {@link #bias()} over, so what the learner taught about a position
 * outlives the next re-search of it.
 *
 * @param value    the evaluated value from the perspective of the side to move
 * @param depth    the remaining depth for which the value is valid
 * @param flag     the alpha-beta bound classification for the stored value
 * @param bestMove the encoded move that produced {@link #value()} in the canonical frame, or
 *                 {@link Move#NONE} if unknown
 * @param bias     learned correction added to heuristic values of this position
 */
public record TTEntry(int value, int depth, TTFlag flag, int bestMove, int bias) {

    public TTEntry {
        Objects.requireNonNull(flag, "flag");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative: " + depth);
        }
        if (Scores.isDecisive(bias)) {
            throw new IllegalArgumentException("bias must stay below the win threshold: " + bias);
        }
    }

    public TTEntry(int value, int depth, TTFlag flag, int bestMove) {
        this(value, depth, flag, bestMove, 0);
    }

    /**
     * Returns the stored value with the learned correction applied. Proven results are returned
     * unchanged.
     */
    public int biasedValue() {
        return Scores.applyBias(value, bias);
    }

    TTEntry withBias(int newBias) {
        return new TTEntry(value, depth, flag, bestMove, newBias);
    }
}
