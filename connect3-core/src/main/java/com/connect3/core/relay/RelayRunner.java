package com.connect3.core.relay;

import com.connect3.core.BoardSize;
import com.connect3.core.DrawTracker;
import com.connect3.core.GameRecord;
import com.connect3.core.Player;
import com.connect3.core.ai.GameRunner;
import com.connect3.core.ai.NegamaxAI;
import com.connect3.core.ai.Searcher;
import com.connect3.core.ai.TranspositionTable;
import com.connect3.core.ai.eval.HeuristicEvaluator;
import com.connect3.core.ai.learn.OutcomeLearner;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point that plays one match of the local engine against an opponent
 * connected through a move relay. The finished match is handed to the {@link OutcomeLearner}.
 */
public final class RelayRunner {

    private static final Logger LOGGER = Logger.getLogger(RelayRunner.class.getName());

    private RelayRunner() {
    }

    public static void main(String[] args) {
        if (args.length < 5 || args.length > 7) {
            printUsage();
            return;
        }
        try {
            String host = args[0];
            int port = Integer.parseInt(args[1]);
            String gameId = args[2];
            Player localSide = Player.valueOf(args[3].toUpperCase(Locale.ROOT));
            long budgetMillis = Long.parseLong(args[4]);
            BoardSize size = BoardSize.SMALL;
            String tablePath = null;

            for (int index = 5; index < args.length; index++) {
                String option = args[index];
                if (option.startsWith("--size=")) {
                    size = BoardSize.parse(option.substring("--size=".length()));
                } else if (option.startsWith("--table=")) {
                    tablePath = option.substring("--table=".length());
                } else {
                    throw new IllegalArgumentException("Unrecognised argument: " + option);
                }
            }
            if (budgetMillis < 1L) {
                throw new IllegalArgumentException("budgetMillis must be positive");
            }

            HeuristicEvaluator evaluator = new HeuristicEvaluator();
            try (TranspositionTable table = tablePath == null
                    ? new TranspositionTable()
                    : new TranspositionTable(Paths.get(tablePath));
                    RelayConnection connection = RelayConnection.open(host, port, size)) {
                table.load();
                connection.join(gameId, localSide);
                Searcher engine = new NegamaxAI(evaluator, table);
                RemoteSearcher remote = new RemoteSearcher(connection, localSide);
                GameRunner runner = new GameRunner(size, DrawTracker.DEFAULT_PLY_CAP, evaluator);
                GameRecord record = localSide == Player.WHITE
                        ? runner.play(engine, remote, Duration.ofMillis(budgetMillis), remote)
                        : runner.play(remote, engine, Duration.ofMillis(budgetMillis), remote);
                LOGGER.info(() -> String.format("Relay match %s finished after %d plies: %s", gameId,
                        record.length(), record.result()));
                new OutcomeLearner(table).learn(record);
            }
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            printUsage();
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
        } catch (IllegalStateException | UncheckedIOException | IOException ex) {
            LOGGER.log(Level.SEVERE, "Relay match aborted", ex);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: RelayRunner <host> <port> <gameId> <white|black> <budgetMillis> "
                + "[--size=small|large] [--table=<path>]");
    }
}
