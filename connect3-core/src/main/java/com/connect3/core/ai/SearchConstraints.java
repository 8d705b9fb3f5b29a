package com.connect3.core.ai;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable search configuration passed to {@link Searcher} implementations. A zero time limit
 * leaves the search bounded by depth only.
 */
public record SearchConstraints(int depthLimit, Duration timeLimit) {

    /**
     * Depth used when a caller only supplies a time budget.
     */
    public static final int DEFAULT_DEPTH_LIMIT = 64;

    public SearchConstraints {
        Objects.requireNonNull(timeLimit, "timeLimit");
        if (depthLimit < 1) {
            throw new IllegalArgumentException("depthLimit must be at least 1");
        }
        if (timeLimit.isNegative()) {
            throw new IllegalArgumentException("timeLimit must not be negative");
        }
    }

    public static SearchConstraints forBudget(Duration timeLimit) {
        return new SearchConstraints(DEFAULT_DEPTH_LIMIT, timeLimit);
    }

    public static SearchConstraints forDepth(int depthLimit) {
        return new SearchConstraints(depthLimit, Duration.ZERO);
    }
}
