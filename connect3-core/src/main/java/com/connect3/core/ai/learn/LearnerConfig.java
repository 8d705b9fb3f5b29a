package com.connect3.core.ai.learn;

/**
 * Tuning knobs of the {@link OutcomeLearner}.
 *
 * @param disagreementThreshold how confident, in evaluation units, a mover must have been for its
 *                              move to count as a misjudgement
 * @param neighbourPlies        how many earlier moves of the same side also receive a (halving)
 *                              share of the correction
 */
public record LearnerConfig(int disagreementThreshold, int neighbourPlies) {

    public static final int DEFAULT_DISAGREEMENT_THRESHOLD = 150;

    public LearnerConfig {
        if (disagreementThreshold < 1) {
            throw new IllegalArgumentException("disagreementThreshold must be positive");
        }
        if (neighbourPlies < 0) {
            throw new IllegalArgumentException("neighbourPlies must not be negative");
        }
    }

    public static LearnerConfig defaults() {
        return new LearnerConfig(DEFAULT_DISAGREEMENT_THRESHOLD, 0);
    }
}
