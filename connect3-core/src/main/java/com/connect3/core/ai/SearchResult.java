package com.connect3.core.ai;

import com.connect3.core.Move;
import java.util.Objects;

/**
 * Result payload returned by {@link Searcher} implementations.
 *
 * @param move           the chosen move, taken from the deepest completed iteration
 * @param score          the score of that move from the searching side's point of view
 * @param depthEvaluated the depth of the iteration that produced the move
 * @param visitedNodes   nodes visited across all iterations, including an abandoned one
 * @param timedOut       whether the deadline stopped the deepening early
 * @param telemetry      per-iteration statistics
 */
public record SearchResult(Move move, int score, int depthEvaluated, long visitedNodes, boolean timedOut,
        SearchTelemetry telemetry) {

    public SearchResult {
        Objects.requireNonNull(move, "move");
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }

    public boolean isProvenWin() {
        return score >= Scores.WIN_THRESHOLD;
    }

    public boolean isProvenLoss() {
        return score <= -Scores.WIN_THRESHOLD;
    }
}
