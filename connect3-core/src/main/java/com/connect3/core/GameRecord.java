package com.connect3.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Completed match: the starting position, every ply with the evaluation recorded right after it,
 * and the final result.
 *
 * @param start  position the match started from
 * @param plies  moves in the order they were played
 * @param result how the match ended
 */
public record GameRecord(Board start, List<Ply> plies, GameResult result) {

    public GameRecord {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(result, "result");
        plies = List.copyOf(Objects.requireNonNull(plies, "plies"));
    }

    /**
     * Replays the record and returns the position after each ply; element {@code i} is the board
     * right after {@code plies().get(i)}.
     *
     * @throws IllegalArgumentException if a recorded move is illegal
     */
    public List<Board> positions() {
        List<Board> boards = new ArrayList<>(plies.size());
        Board board = start;
        for (Ply ply : plies) {
            board = board.apply(ply.move());
            boards.add(board);
        }
        return Collections.unmodifiableList(boards);
    }

    public int length() {
        return plies.size();
    }

    /**
     * One move and the heuristic evaluation of the position it produced.
     *
     * @param move       the move played
     * @param evaluation evaluation of the resulting position, positive favouring white
     */
    public record Ply(Move move, int evaluation) {

        public Ply {
            Objects.requireNonNull(move, "move");
        }
    }
}
