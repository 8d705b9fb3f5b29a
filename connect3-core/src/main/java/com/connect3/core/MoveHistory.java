package com.connect3.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Persistent singly linked move list. Appending shares the existing nodes, so every board keeps
 * its full history without copying it.
 */
final class MoveHistory {

    static final MoveHistory EMPTY = new MoveHistory(null, null, 0);

    private final Move move;
    private final MoveHistory previous;
    private final int length;

    private MoveHistory(Move move, MoveHistory previous, int length) {
        this.move = move;
        this.previous = previous;
        this.length = length;
    }

    MoveHistory append(Move next) {
        return new MoveHistory(next, this, length + 1);
    }

    int length() {
        return length;
    }

    Move last() {
        return move;
    }

    List<Move> toList() {
        List<Move> moves = new ArrayList<>(length);
        for (MoveHistory node = this; node.length > 0; node = node.previous) {
            moves.add(node.move);
        }
        Collections.reverse(moves);
        return Collections.unmodifiableList(moves);
    }
}
