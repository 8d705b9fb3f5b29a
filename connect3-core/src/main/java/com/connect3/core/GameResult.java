package com.connect3.core;

import java.util.Objects;

/**
 * Final outcome of a match.
 *
 * @param winner      the winning side, or {@code null} for a draw
 * @param termination why the match ended
 */
public record GameResult(Player winner, Termination termination) {

    public GameResult {
        Objects.requireNonNull(termination, "termination");
        if (winner == null && termination.decisive()) {
            throw new IllegalArgumentException(termination + " requires a winner");
        }
        if (winner != null && !termination.decisive()) {
            throw new IllegalArgumentException(termination + " cannot have a winner");
        }
    }

    public static GameResult win(Player winner, Termination termination) {
        return new GameResult(Objects.requireNonNull(winner, "winner"), termination);
    }

    public static GameResult draw(Termination termination) {
        return new GameResult(null, termination);
    }

    public boolean isDraw() {
        return winner == null;
    }

    /**
     * Returns {@code +1} if the side won, {@code -1} if it lost and {@code 0} for a draw.
     */
    public int outcomeFor(Player player) {
        if (winner == null) {
            return 0;
        }
        return winner == player ? 1 : -1;
    }

    public enum Termination {
        THREE_IN_A_ROW(true),
        NO_LEGAL_MOVE(true),
        REPETITION(false),
        PLY_CAP(false);

        private final boolean decisive;

        Termination(boolean decisive) {
            this.decisive = decisive;
        }

        public boolean decisive() {
            return decisive;
        }
    }
}
