package com.connect3.core.ai.tune;

import com.connect3.core.BoardSize;
import com.connect3.core.ai.eval.WeightVector;
import java.time.Duration;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point for tuning heuristic weights with a {@link HillClimber}.
 */
public final class TunerRunner {

    private static final Logger LOGGER = Logger.getLogger(TunerRunner.class.getName());

    private TunerRunner() {
    }

    public static void main(String[] args) {
        if (args.length < 2 || args.length > 5) {
            printUsage();
            return;
        }
        try {
            int iterations = Integer.parseInt(args[0]);
            long budgetMillis = Long.parseLong(args[1]);
            long seed = System.nanoTime();
            BoardSize size = BoardSize.SMALL;
            int games = TunerConfig.defaults().gamesPerMatch();

            for (int index = 2; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--seed=")) {
                    seed = Long.parseLong(option.substring("--seed=".length()));
                } else if (option.startsWith("--size=")) {
                    size = BoardSize.parse(option.substring("--size=".length()));
                } else if (option.startsWith("--games=")) {
                    games = Integer.parseInt(option.substring("--games=".length()));
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }

            if (budgetMillis < 1L) {
                throw new IllegalArgumentException("budgetMillis must be positive");
            }

            TunerConfig config = TunerConfig.defaults().withIterations(iterations).withGamesPerMatch(games);
            Tournament tournament = new EngineTournament(size, Duration.ofMillis(budgetMillis));
            long usedSeed = seed;
            LOGGER.info(() -> "Tuning with seed " + usedSeed);
            TuningResult result = new HillClimber(tournament, config, new Random(seed)).climb(WeightVector.defaults());
            LOGGER.info(() -> "Best weights: " + result.best());
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: TunerRunner <iterations> <budgetMillis> [--seed=<n>] [--size=small|large] "
                + "[--games=<n>]");
    }
}
