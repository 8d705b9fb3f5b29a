package com.connect3.core.ai;

import com.connect3.core.BoardSize;
import com.connect3.core.DrawTracker;
import com.connect3.core.GameRecord;
import com.connect3.core.GameResult;
import com.connect3.core.Player;
import com.connect3.core.ai.eval.HeuristicEvaluator;
import com.connect3.core.ai.learn.OutcomeLearner;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Facilitates self-play training where two searchers play back-to-back matches. Every finished
 * match is handed to the {@link OutcomeLearner}. When the agents keep drawing, the per-move
 * budget grows so that deeper searches can break the stalemate.
 *
 * <p>The table and the counters are checkpointed every few matches and when the session stops,
 * so an interrupted session resumes with what it has learned.
 */
public final class Trainer {

    private static final Logger LOGGER = Logger.getLogger(Trainer.class.getName());

    private final Searcher white;
    private final Searcher black;
    private final GameRunner runner;
    private final OutcomeLearner learner;
    private final TranspositionStore store;
    private final TrainerConfig config;

    private volatile boolean stopRequested;
    private long gamesPlayed;
    private long whiteWins;
    private long blackWins;
    private long draws;
    private int consecutiveDraws;
    private int budgetIncreases;
    private Duration budget;

    public Trainer(Searcher white, Searcher black, GameRunner runner, OutcomeLearner learner,
            TranspositionStore store, TrainerConfig config) {
        this.white = Objects.requireNonNull(white, "white");
        this.black = Objects.requireNonNull(black, "black");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.learner = Objects.requireNonNull(learner, "learner");
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
        this.budget = config.initialBudget();
        resumeFromCheckpoint();
    }

    /**
     * Creates a trainer in which two {@link NegamaxAI} instances share one table.
     */
    public static Trainer selfPlay(BoardSize size, TranspositionTable table, HeuristicEvaluator evaluator,
            TrainerConfig config) {
        NegamaxAI whiteAi = new NegamaxAI(evaluator, table);
        NegamaxAI blackAi = new NegamaxAI(evaluator, table);
        GameRunner runner = new GameRunner(size, DrawTracker.DEFAULT_PLY_CAP, evaluator);
        return new Trainer(whiteAi, blackAi, runner, new OutcomeLearner(table), table, config);
    }

    /**
     * Plays {@code gameCount} matches, or fewer if a stop is requested, then checkpoints.
     */
    public void playGames(int gameCount) {
        if (gameCount < 1) {
            throw new IllegalArgumentException("Game count must be at least 1");
        }
        for (int i = 0; i < gameCount && !stopRequested; i++) {
            playSingleGame();
        }
        checkpoint();
    }

    /**
     * Plays matches until the thread is interrupted or {@link #requestStop()} is called, then
     * checkpoints.
     */
    public void run() {
        while (!stopRequested && !Thread.currentThread().isInterrupted()) {
            playSingleGame();
        }
        checkpoint();
    }

    /**
     * Lets the current match finish and ends the session.
     */
    public void requestStop() {
        stopRequested = true;
    }

    public long getGamesPlayed() {
        return gamesPlayed;
    }

    public long getWhiteWins() {
        return whiteWins;
    }

    public long getBlackWins() {
        return blackWins;
    }

    public long getDraws() {
        return draws;
    }

    public int getConsecutiveDraws() {
        return consecutiveDraws;
    }

    public int getBudgetIncreases() {
        return budgetIncreases;
    }

    public Duration getBudget() {
        return budget;
    }

    /**
     * Flushes the table and saves the counters.
     */
    public void checkpoint() {
        store.flush();
        if (config.checkpointPath() == null) {
            return;
        }
        TrainerCheckpoint checkpoint = new TrainerCheckpoint(gamesPlayed, whiteWins, blackWins, draws,
                consecutiveDraws, budget.toMillis());
        try {
            checkpoint.save(config.checkpointPath());
            LOGGER.fine(() -> "Saved training checkpoint to " + config.checkpointPath());
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Failed to save training checkpoint to " + config.checkpointPath(), ex);
        }
    }

    private void playSingleGame() {
        GameRecord record = runner.play(white, black, budget);
        GameResult result = record.result();
        gamesPlayed++;
        if (result.isDraw()) {
            draws++;
            consecutiveDraws++;
            if (consecutiveDraws >= config.stalemateThreshold()) {
                escalateBudget();
            }
        } else {
            if (result.winner() == Player.WHITE) {
                whiteWins++;
            } else {
                blackWins++;
            }
            consecutiveDraws = 0;
        }

        learner.learn(record);

        final long gameNumber = gamesPlayed;
        LOGGER.info(() -> String.format("Completed training game %d in %d plies: %s (W %d / B %d / D %d, budget=%d ms)",
                gameNumber, record.length(), describe(result), whiteWins, blackWins, draws, budget.toMillis()));

        if (gamesPlayed % config.checkpointInterval() == 0) {
            checkpoint();
        }
    }

    private void escalateBudget() {
        consecutiveDraws = 0;
        Duration increased = budget.plus(config.budgetIncrement());
        if (increased.compareTo(config.maxBudget()) > 0) {
            increased = config.maxBudget();
        }
        if (increased.equals(budget)) {
            LOGGER.info(() -> String.format("Stalemate after %d draws, budget already at its %d ms maximum",
                    config.stalemateThreshold(), budget.toMillis()));
            return;
        }
        Duration previous = budget;
        budget = increased;
        budgetIncreases++;
        LOGGER.info(() -> String.format("Stalemate after %d draws, raising budget from %d ms to %d ms",
                config.stalemateThreshold(), previous.toMillis(), budget.toMillis()));
    }

    private void resumeFromCheckpoint() {
        if (config.checkpointPath() == null) {
            return;
        }
        Optional<TrainerCheckpoint> checkpoint;
        try {
            checkpoint = TrainerCheckpoint.load(config.checkpointPath());
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "Ignoring unreadable training checkpoint " + config.checkpointPath(), ex);
            return;
        }
        checkpoint.ifPresent(saved -> {
            gamesPlayed = saved.gamesPlayed();
            whiteWins = saved.whiteWins();
            blackWins = saved.blackWins();
            draws = saved.draws();
            consecutiveDraws = saved.consecutiveDraws();
            Duration savedBudget = Duration.ofMillis(saved.budgetMillis());
            budget = savedBudget.compareTo(config.maxBudget()) > 0 ? config.maxBudget() : savedBudget;
            LOGGER.info(() -> String.format("Resumed training after %d games with a %d ms budget", gamesPlayed,
                    budget.toMillis()));
        });
    }

    private static String describe(GameResult result) {
        if (result.isDraw()) {
            return "draw by " + result.termination();
        }
        return result.winner() + " won by " + result.termination();
    }
}
