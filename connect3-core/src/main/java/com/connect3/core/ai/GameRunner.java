package com.connect3.core.ai;

import com.connect3.core.Board;
import com.connect3.core.BoardSize;
import com.connect3.core.DrawTracker;
import com.connect3.core.GameRecord;
import com.connect3.core.GameResult;
import com.connect3.core.Move;
import com.connect3.core.Player;
import com.connect3.core.ai.eval.HeuristicEvaluator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Plays one match between two {@link Searcher}s and records every ply.
 *
 * <p>A side that cannot move loses. A repeated position or the ply cap ends the match in a draw;
 * a three-in-a-row completed on the capped ply still counts as a win.
 */
public final class GameRunner {

    private static final Logger LOGGER = Logger.getLogger(GameRunner.class.getName());

    private final BoardSize size;
    private final int plyCap;
    private final HeuristicEvaluator evaluator;

    public GameRunner(BoardSize size, int plyCap, HeuristicEvaluator evaluator) {
        this.size = Objects.requireNonNull(size, "size");
        if (plyCap < 1) {
            throw new IllegalArgumentException("Ply cap must be at least 1");
        }
        this.plyCap = plyCap;
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
    }

    public BoardSize size() {
        return size;
    }

    public GameRecord play(Searcher white, Searcher black, Duration budget) {
        return play(white, black, budget, null);
    }

    /**
     * Plays a match from the initial position.
     *
     * @param listener notified after every move, may be {@code null}
     * @throws IllegalStateException if a searcher returns an illegal move
     */
    public GameRecord play(Searcher white, Searcher black, Duration budget, Listener listener) {
        Objects.requireNonNull(white, "white");
        Objects.requireNonNull(black, "black");
        Objects.requireNonNull(budget, "budget");

        Board start = Board.initial(size);
        Board board = start;
        DrawTracker drawTracker = new DrawTracker(plyCap);
        drawTracker.record(board);
        List<GameRecord.Ply> plies = new ArrayList<>();
        GameResult result;

        while (true) {
            Player mover = board.sideToMove();
            Searcher searcher = mover == Player.WHITE ? white : black;
            if (board.legalMoves().isEmpty()) {
                result = GameResult.win(mover.opponent(), GameResult.Termination.NO_LEGAL_MOVE);
                break;
            }
            Move move;
            try {
                move = searcher.chooseMove(board, mover, budget);
            } catch (NoLegalMoveException ex) {
                result = GameResult.win(ex.getSide().opponent(), GameResult.Termination.NO_LEGAL_MOVE);
                break;
            }
            if (!board.isLegal(move)) {
                throw new IllegalStateException(mover + " searcher returned an illegal move: " + move);
            }

            Board next = board.apply(move);
            plies.add(new GameRecord.Ply(move, evaluator.evaluate(next)));
            if (listener != null) {
                listener.onMove(board, move, mover);
            }
            board = next;

            Player winner = board.winner();
            if (winner != null) {
                result = GameResult.win(winner, GameResult.Termination.THREE_IN_A_ROW);
                break;
            }
            Optional<GameResult.Termination> draw = drawTracker.record(board);
            if (draw.isPresent()) {
                result = GameResult.draw(draw.get());
                break;
            }
        }

        GameResult finalResult = result;
        LOGGER.fine(() -> String.format("Match finished after %d plies: %s", plies.size(), finalResult));
        return new GameRecord(start, plies, result);
    }

    /**
     * Receives every move as it is played.
     */
    @FunctionalInterface
    public interface Listener {

        void onMove(Board before, Move move, Player mover);
    }
}
