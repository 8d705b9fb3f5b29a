package com.connect3.core.ai;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of a {@link Trainer} session.
 *
 * @param initialBudget      per-move think time of the first match, always positive
 * @param budgetIncrement    added to the budget each time the draw streak reaches the threshold
 * @param maxBudget          upper bound of the budget
 * @param stalemateThreshold consecutive draws that trigger a budget increase
 * @param checkpointInterval matches between checkpoints
 * @param checkpointPath     where counters are saved, or {@code null} to keep them in memory
 */
public record TrainerConfig(Duration initialBudget, Duration budgetIncrement, Duration maxBudget,
        int stalemateThreshold, int checkpointInterval, Path checkpointPath) {

    public static final int DEFAULT_STALEMATE_THRESHOLD = 5;
    public static final int DEFAULT_CHECKPOINT_INTERVAL = 10;

    public TrainerConfig {
        Objects.requireNonNull(initialBudget, "initialBudget");
        Objects.requireNonNull(budgetIncrement, "budgetIncrement");
        Objects.requireNonNull(maxBudget, "maxBudget");
        if (initialBudget.isZero() || initialBudget.isNegative()) {
            throw new IllegalArgumentException("initialBudget must be positive: " + initialBudget);
        }
        if (budgetIncrement.isNegative()) {
            throw new IllegalArgumentException("budgetIncrement must not be negative: " + budgetIncrement);
        }
        if (maxBudget.compareTo(initialBudget) < 0) {
            throw new IllegalArgumentException("maxBudget must not be below initialBudget");
        }
        if (stalemateThreshold < 1) {
            throw new IllegalArgumentException("stalemateThreshold must be at least 1");
        }
        if (checkpointInterval < 1) {
            throw new IllegalArgumentException("checkpointInterval must be at least 1");
        }
    }

    /**
     * Settings that grow the budget by its initial value on every escalation, up to ten times that value.
     */
    public static TrainerConfig withBudget(Duration initialBudget) {
        Objects.requireNonNull(initialBudget, "initialBudget");
        return new TrainerConfig(initialBudget, initialBudget, initialBudget.multipliedBy(10),
                DEFAULT_STALEMATE_THRESHOLD, DEFAULT_CHECKPOINT_INTERVAL, null);
    }

    public TrainerConfig withStalemateThreshold(int threshold) {
        return new TrainerConfig(initialBudget, budgetIncrement, maxBudget, threshold, checkpointInterval,
                checkpointPath);
    }

    public TrainerConfig withCheckpointPath(Path path) {
        return new TrainerConfig(initialBudget, budgetIncrement, maxBudget, stalemateThreshold, checkpointInterval,
                path);
    }
}
