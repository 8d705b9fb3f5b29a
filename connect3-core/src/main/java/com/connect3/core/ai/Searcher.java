package com.connect3.core.ai;

import com.connect3.core.Board;
import com.connect3.core.Move;
import com.connect3.core.Player;
import java.time.Duration;
import java.util.Objects;

/**
 * Generic interface for anything that picks moves: the local search engine, a remote opponent
 * or a scripted test agent.
 */
public interface Searcher {

    /**
     * Executes a search for the best move on the provided {@link Board} under the supplied
     * {@link SearchConstraints}.
     *
     * @param board       the position to analyse, with the searching side to move
     * @param constraints the limits guiding the search execution
     * @return the result of the search
     * @throws NoLegalMoveException if the side to move cannot move
     */
    SearchResult search(Board board, SearchConstraints constraints) throws NoLegalMoveException;

    /**
     * Picks a move for {@code sideToMove} within the given time budget. A zero budget means the
     * search is only bounded by depth.
     *
     * @throws NoLegalMoveException     if the side to move cannot move
     * @throws IllegalArgumentException if {@code sideToMove} is not the side to move on the board
     */
    default Move chooseMove(Board board, Player sideToMove, Duration timeBudget) throws NoLegalMoveException {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(sideToMove, "sideToMove");
        if (board.sideToMove() != sideToMove) {
            throw new IllegalArgumentException("It is " + board.sideToMove() + "'s turn, not " + sideToMove + "'s");
        }
        return search(board, SearchConstraints.forBudget(timeBudget)).move();
    }
}
