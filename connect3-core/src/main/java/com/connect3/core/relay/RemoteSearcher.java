package com.connect3.core.relay;

import com.connect3.core.Board;
import com.connect3.core.Move;
import com.connect3.core.Player;
import com.connect3.core.ai.GameRunner;
import com.connect3.core.ai.SearchConstraints;
import com.connect3.core.ai.SearchResult;
import com.connect3.core.ai.Searcher;
import java.util.Objects;

/**
 * Stands in for the opponent on the other end of a relay. Registered as the match listener, it
 * forwards the local side's moves to the relay; asked for a move, it waits for the relayed one
 * for at most the move's time budget.
 */
public final class RemoteSearcher implements Searcher, GameRunner.Listener {

    private final RelayConnection connection;
    private final Player localSide;

    public RemoteSearcher(RelayConnection connection, Player localSide) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.localSide = Objects.requireNonNull(localSide, "localSide");
    }

    public Player localSide() {
        return localSide;
    }

    @Override
    public void onMove(Board before, Move move, Player mover) {
        if (mover == localSide) {
            connection.sendMove(move);
        }
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if the relayed move is not legal on {@code board}
     */
    @Override
    public SearchResult search(Board board, SearchConstraints constraints) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(constraints, "constraints");
        if (board.sideToMove() == localSide) {
            throw new IllegalStateException("The remote opponent plays " + localSide.opponent());
        }
        Move move = connection.awaitMove(constraints.timeLimit());
        if (!board.isLegal(move)) {
            throw new IllegalStateException("Relay sent an illegal move: " + move.toNotation(board.size()));
        }
        return new SearchResult(move, 0, 0, 0L, false, null);
    }
}
