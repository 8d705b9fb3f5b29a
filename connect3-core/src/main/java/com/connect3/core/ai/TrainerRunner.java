package com.connect3.core.ai;

import com.connect3.core.BoardSize;
import com.connect3.core.ai.eval.HeuristicEvaluator;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point for running {@link Trainer} self-play sessions with configurable
 * parameters.
 */
public final class TrainerRunner {

    private static final Logger LOGGER = Logger.getLogger(TrainerRunner.class.getName());

    private TrainerRunner() {
    }

    public static void main(String[] args) {
        if (args.length < 2 || args.length > 6) {
            printUsage();
            return;
        }
        try {
            int gameCount = Integer.parseInt(args[0]);
            long budgetMillis = Long.parseLong(args[1]);
            BoardSize size = BoardSize.SMALL;
            Path tablePath = null;
            Path checkpointPath = null;
            int threshold = TrainerConfig.DEFAULT_STALEMATE_THRESHOLD;

            for (int index = 2; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--size=")) {
                    size = BoardSize.parse(option.substring("--size=".length()));
                } else if (option.startsWith("--table=")) {
                    if (tablePath != null) {
                        throw new IllegalArgumentException("Table path specified more than once");
                    }
                    tablePath = Paths.get(option.substring("--table=".length()));
                } else if (option.startsWith("--threshold=")) {
                    threshold = Integer.parseInt(option.substring("--threshold=".length()));
                } else if (option.startsWith("--checkpoint=")) {
                    checkpointPath = Paths.get(option.substring("--checkpoint=".length()));
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }

            if (gameCount < 0) {
                throw new IllegalArgumentException("gameCount must be non-negative");
            }
            if (budgetMillis < 1L) {
                throw new IllegalArgumentException("budgetMillis must be positive");
            }

            TranspositionTable table = tablePath == null ? new TranspositionTable() : new TranspositionTable(tablePath);
            table.load();
            if (checkpointPath == null) {
                checkpointPath = table.getStoragePath().resolveSibling("trainer-checkpoint.bin");
            }

            TrainerConfig config = TrainerConfig.withBudget(Duration.ofMillis(budgetMillis))
                    .withStalemateThreshold(threshold)
                    .withCheckpointPath(checkpointPath);
            Trainer trainer = Trainer.selfPlay(size, table, new HeuristicEvaluator(), config);

            Thread main = Thread.currentThread();
            Thread shutdownHook = new Thread(() -> {
                trainer.requestStop();
                try {
                    main.join();
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    LOGGER.log(Level.WARNING, "Interrupted while waiting for the current training game", ex);
                }
            }, "trainer-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);

            if (gameCount == 0) {
                trainer.run();
            } else {
                trainer.playGames(gameCount);
            }
            table.close();
            LOGGER.info(() -> String.format("Training finished after %d games (W %d / B %d / D %d)",
                    trainer.getGamesPlayed(), trainer.getWhiteWins(), trainer.getBlackWins(), trainer.getDraws()));
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
        }
    }

    private static void printUsage() {
        System.err.println(
                "Usage: TrainerRunner <gameCount|0 for endless> <budgetMillis> [--size=small|large] "
                        + "[--table=<path>] [--threshold=<draws>] [--checkpoint=<path>]");
    }
}
