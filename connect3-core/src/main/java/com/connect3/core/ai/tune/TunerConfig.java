package com.connect3.core.ai.tune;

/**
 * Settings of a {@link HillClimber} run.
 *
 * @param iterations    maximum number of challengers to try
 * @param patience      consecutive non-improving iterations after which the climb stops
 * @param gamesPerMatch games played between the champion and each challenger
 * @param perturbation  largest change applied to a single weight
 * @param mutationRate  probability that a given weight is perturbed
 * @param maxWeight     upper bound of every weight; the lower bound is zero
 */
public record TunerConfig(int iterations, int patience, int gamesPerMatch, double perturbation,
        double mutationRate, double maxWeight) {

    public TunerConfig {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be at least 1");
        }
        if (patience < 1) {
            throw new IllegalArgumentException("patience must be at least 1");
        }
        if (gamesPerMatch < 1) {
            throw new IllegalArgumentException("gamesPerMatch must be at least 1");
        }
        if (!(perturbation > 0.0) || !Double.isFinite(perturbation)) {
            throw new IllegalArgumentException("perturbation must be positive");
        }
        if (!(mutationRate >= 0.0 && mutationRate <= 1.0)) {
            throw new IllegalArgumentException("mutationRate must lie in [0, 1]");
        }
        if (!(maxWeight > 0.0) || !Double.isFinite(maxWeight)) {
            throw new IllegalArgumentException("maxWeight must be positive");
        }
    }

    public static TunerConfig defaults() {
        return new TunerConfig(100, 20, 2, 0.5, 0.3, 10.0);
    }

    public TunerConfig withIterations(int count) {
        return new TunerConfig(count, patience, gamesPerMatch, perturbation, mutationRate, maxWeight);
    }

    public TunerConfig withGamesPerMatch(int games) {
        return new TunerConfig(iterations, patience, games, perturbation, mutationRate, maxWeight);
    }
}
