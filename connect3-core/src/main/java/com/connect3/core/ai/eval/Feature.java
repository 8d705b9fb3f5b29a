package com.connect3.core.ai.eval;

import com.connect3.core.Board;
import com.connect3.core.BoardSize;
import com.connect3.core.Player;

/**
 * Independent board features combined by {@link HeuristicEvaluator}. Every feature is a pure
 * function of the board and returns a white-minus-black difference, so positive values favour
 * white.
 */
public enum Feature {

    /**
     * Adjacent pairs of own pieces along any straight line.
     */
    RUNS_OF_TWO {
        @Override
        public int compute(Board board) {
            return countPairs(board, Player.WHITE) - countPairs(board, Player.BLACK);
        }
    },

    /**
     * Lines holding two own pieces whose third cell is empty and reachable in one move by another
     * own piece.
     */
    WIN_THREATS {
        @Override
        public int compute(Board board) {
            return countThreats(board, Player.WHITE) - countThreats(board, Player.BLACK);
        }
    },

    /**
     * Closeness of the pieces to the centre of the board.
     */
    CENTRAL_CONTROL {
        @Override
        public int compute(Board board) {
            return centreDistance(board, Player.BLACK) - centreDistance(board, Player.WHITE);
        }
    },

    /**
     * Number of moves available to each side.
     */
    MOBILITY {
        @Override
        public int compute(Board board) {
            return board.mobility(Player.WHITE) - board.mobility(Player.BLACK);
        }
    },

    /**
     * Lines where a single own piece stops two enemy pieces from completing them.
     */
    BLOCKED_LINES {
        @Override
        public int compute(Board board) {
            return countBlocks(board, Player.WHITE) - countBlocks(board, Player.BLACK);
        }
    },

    /**
     * Having the move.
     */
    TEMPO {
        @Override
        public int compute(Board board) {
            return board.sideToMove().sign();
        }
    };

    public abstract int compute(Board board);

    private static int countPairs(Board board, Player player) {
        long pieces = board.pieces(player);
        int count = 0;
        BoardSize size = board.size();
        for (int pair = 0; pair < size.pairCount(); pair++) {
            long mask = size.pairMask(pair);
            if ((pieces & mask) == mask) {
                count++;
            }
        }
        return count;
    }

    private static int countThreats(Board board, Player player) {
        BoardSize size = board.size();
        long own = board.pieces(player);
        long empty = board.emptyCells();
        int count = 0;
        for (int line = 0; line < size.lineCount(); line++) {
            long mask = size.lineMask(line);
            long inLine = own & mask;
            if (Long.bitCount(inLine) != 2) {
                continue;
            }
            long gap = mask & ~inLine;
            if ((gap & empty) == 0L) {
                continue;
            }
            int gapCell = Long.numberOfTrailingZeros(gap);
            if ((size.neighbours(gapCell) & own & ~mask) != 0L) {
                count++;
            }
        }
        return count;
    }

    private static int countBlocks(Board board, Player player) {
        long own = board.pieces(player);
        long enemy = board.pieces(player.opponent());
        int count = 0;
        BoardSize size = board.size();
        for (int line = 0; line < size.lineCount(); line++) {
            long mask = size.lineMask(line);
            if (Long.bitCount(own & mask) == 1 && Long.bitCount(enemy & mask) == 2) {
                count++;
            }
        }
        return count;
    }

    private static int centreDistance(Board board, Player player) {
        long pieces = board.pieces(player);
        int total = 0;
        while (pieces != 0L) {
            int cell = Long.numberOfTrailingZeros(pieces);
            pieces &= pieces - 1;
            total += board.size().centreDistance(cell);
        }
        return total;
    }
}
