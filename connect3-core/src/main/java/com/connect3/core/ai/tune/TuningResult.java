package com.connect3.core.ai.tune;

import com.connect3.core.ai.eval.WeightVector;
import java.util.Objects;

/**
 * Outcome of a {@link HillClimber#climb(WeightVector)} run.
 */
public record TuningResult(WeightVector best, int iterations, int improvements) {

    public TuningResult {
        Objects.requireNonNull(best, "best");
    }
}
