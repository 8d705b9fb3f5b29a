package com.connect3.core.ai;

import com.connect3.core.Player;
import java.util.Objects;

/**
 * Signals that the side to move has no legal move. Callers treat this as a loss for that side.
 */
public class NoLegalMoveException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Player side;

    public NoLegalMoveException(Player side) {
        super(Objects.requireNonNull(side, "side") + " has no legal move");
        this.side = side;
    }

    public Player getSide() {
        return side;
    }
}
