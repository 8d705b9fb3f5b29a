package com.connect3.core.ai.learn;

import com.connect3.core.Move;
import com.connect3.core.Player;

/**
 * The ply the {@link OutcomeLearner} blamed for a lost or drawn match and the bias it applied.
 *
 * @param ply               zero-based index of the blamed move in the record
 * @param move              the blamed move
 * @param mover             the side that played it
 * @param evaluation        the recorded evaluation after the move, white's point of view
 * @param delta             bias added to the resulting position, side to move's point of view
 * @param positionsAdjusted number of table entries actually changed
 */
public record Correction(int ply, Move move, Player mover, int evaluation, int delta, int positionsAdjusted) {
}
