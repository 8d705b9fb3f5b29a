package com.connect3.core.ai.eval;

import com.connect3.core.Board;
import com.connect3.core.Player;
import com.connect3.core.ai.Scores;
import java.util.Objects;

/**
 * Scores positions as the weighted sum of the {@link Feature} values.
 *
 * <p>The result is positive when the position favours white. Won positions return the saturating
 * {@link Scores#WIN_SCORE}, which no heuristic blend can reach.
 */
public final class HeuristicEvaluator {

    /**
     * Fixed-point scale applied to the weighted sum before rounding to an integer score.
     */
    public static final int SCALE = 100;

    private static final Feature[] FEATURES = Feature.values();

    private final WeightVector weights;

    public HeuristicEvaluator() {
        this(WeightVector.defaults());
    }

    public HeuristicEvaluator(WeightVector weights) {
        this.weights = Objects.requireNonNull(weights, "weights");
    }

    public WeightVector weights() {
        return weights;
    }

    /**
     * Returns the score of the board from white's point of view.
     */
    public int evaluate(Board board) {
        Player winner = board.winner();
        if (winner != null) {
            return winner.sign() * Scores.WIN_SCORE;
        }
        double sum = 0.0;
        for (Feature feature : FEATURES) {
            double weight = weights.get(feature);
            if (weight != 0.0) {
                sum += weight * feature.compute(board);
            }
        }
        return Scores.clampHeuristic(Math.round(sum * SCALE));
    }

    /**
     * Returns the score of the board from the given side's point of view.
     */
    public int evaluateFor(Board board, Player player) {
        return player.sign() * evaluate(board);
    }
}
