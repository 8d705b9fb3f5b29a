package com.connect3.core.ai.tune;

import com.connect3.core.ai.eval.WeightVector;
import java.util.Objects;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Competitive hill climbing over heuristic weights. A perturbed copy of the current best vector
 * challenges it in a short {@link Tournament}, and replaces it only when it wins more games than
 * it loses. The current best is only ever replaced by a vector that beat it.
 */
public final class HillClimber {

    private static final Logger LOGGER = Logger.getLogger(HillClimber.class.getName());

    private final Tournament tournament;
    private final TunerConfig config;
    private final Random random;

    public HillClimber(Tournament tournament, TunerConfig config, Random random) {
        this.tournament = Objects.requireNonNull(tournament, "tournament");
        this.config = Objects.requireNonNull(config, "config");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Climbs from {@code initial} until the iteration budget is spent or {@link
     * TunerConfig#patience()} challengers in a row fail to win.
     */
    public TuningResult climb(WeightVector initial) {
        Objects.requireNonNull(initial, "initial");
        WeightVector best = clamp(initial);
        int iteration = 0;
        int improvements = 0;
        int sinceImprovement = 0;
        while (iteration < config.iterations() && sinceImprovement < config.patience()) {
            iteration++;
            WeightVector challenger = perturb(best);
            MatchScore score = tournament.play(best, challenger, config.gamesPerMatch());
            if (score.challengerWonOutright()) {
                best = challenger;
                improvements++;
                sinceImprovement = 0;
                WeightVector adopted = best;
                int round = iteration;
                LOGGER.info(() -> String.format("Iteration %d: challenger won %s, adopting %s", round, score,
                        adopted));
            } else {
                sinceImprovement++;
                int round = iteration;
                LOGGER.fine(() -> String.format("Iteration %d: champion kept (%s)", round, score));
            }
        }
        TuningResult result = new TuningResult(best, iteration, improvements);
        LOGGER.info(() -> String.format("Tuning stopped after %d iterations with %d improvements: %s",
                result.iterations(), result.improvements(), result.best()));
        return result;
    }

    /**
     * Returns a copy of {@code base} in which each weight moves by at most
     * {@link TunerConfig#perturbation()} with probability {@link TunerConfig#mutationRate()}. At
     * least one weight is always perturbed, and every weight stays within {@code [0, maxWeight]}.
     */
    public WeightVector perturb(WeightVector base) {
        double[] weights = base.toArray();
        boolean changed = false;
        for (int i = 0; i < weights.length; i++) {
            if (random.nextDouble() < config.mutationRate()) {
                weights[i] = nudge(weights[i]);
                changed = true;
            }
        }
        if (!changed) {
            int index = random.nextInt(weights.length);
            weights[index] = nudge(weights[index]);
        }
        return WeightVector.of(weights);
    }

    private double nudge(double weight) {
        double noise = (random.nextDouble() * 2.0 - 1.0) * config.perturbation();
        return clamp(weight + noise);
    }

    private WeightVector clamp(WeightVector vector) {
        double[] weights = vector.toArray();
        for (int i = 0; i < weights.length; i++) {
            weights[i] = clamp(weights[i]);
        }
        return WeightVector.of(weights);
    }

    private double clamp(double weight) {
        return Math.max(0.0, Math.min(config.maxWeight(), weight));
    }
}
