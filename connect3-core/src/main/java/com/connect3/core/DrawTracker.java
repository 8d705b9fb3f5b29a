package com.connect3.core;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Detects drawn matches: the same position with the same side to move occurring for the third
 * time, or the configured ply cap being reached.
 */
public final class DrawTracker {

    public static final int DEFAULT_PLY_CAP = 200;
    public static final int REPETITION_LIMIT = 3;

    private final int plyCap;
    private final Map<PositionKey, Integer> occurrences;

    public DrawTracker() {
        this(DEFAULT_PLY_CAP);
    }

    public DrawTracker(int plyCap) {
        this(plyCap, new HashMap<>());
    }

    private DrawTracker(int plyCap, Map<PositionKey, Integer> occurrences) {
        if (plyCap < 1) {
            throw new IllegalArgumentException("Ply cap must be at least 1");
        }
        this.plyCap = plyCap;
        this.occurrences = occurrences;
    }

    public int plyCap() {
        return plyCap;
    }

    /**
     * Counts the position and reports whether the match is now drawn.
     *
     * @return the draw reason, or empty if play continues
     */
    public Optional<GameResult.Termination> record(Board board) {
        PositionKey key = new PositionKey(board.whiteBits(), board.blackBits(), board.sideToMove());
        int seen = occurrences.merge(key, 1, Integer::sum);
        if (seen >= REPETITION_LIMIT) {
            return Optional.of(GameResult.Termination.REPETITION);
        }
        if (board.ply() >= plyCap) {
            return Optional.of(GameResult.Termination.PLY_CAP);
        }
        return Optional.empty();
    }

    public int occurrences(Board board) {
        return occurrences.getOrDefault(new PositionKey(board.whiteBits(), board.blackBits(), board.sideToMove()), 0);
    }

    public DrawTracker copy() {
        return new DrawTracker(plyCap, new HashMap<>(occurrences));
    }

    private record PositionKey(long white, long black, Player sideToMove) {
    }
}
