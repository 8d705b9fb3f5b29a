package com.connect3.core.ai.tune;

import com.connect3.core.ai.eval.WeightVector;

/**
 * Plays a short match between two weight vectors.
 */
@FunctionalInterface
public interface Tournament {

    MatchScore play(WeightVector champion, WeightVector challenger, int games);
}
