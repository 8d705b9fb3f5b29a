package com.connect3.core.ai.tune;

import com.connect3.core.BoardSize;
import com.connect3.core.DrawTracker;
import com.connect3.core.GameRecord;
import com.connect3.core.Player;
import com.connect3.core.ai.GameRunner;
import com.connect3.core.ai.NegamaxAI;
import com.connect3.core.ai.Searcher;
import com.connect3.core.ai.TranspositionTable;
import com.connect3.core.ai.eval.HeuristicEvaluator;
import com.connect3.core.ai.eval.WeightVector;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Plays {@link NegamaxAI} against {@link NegamaxAI}, each configured with one of the weight
 * vectors. Colours alternate, the champion taking white first, and every game starts with fresh
 * in-memory tables so neither side profits from earlier games.
 */
public final class EngineTournament implements Tournament {

    private static final Logger LOGGER = Logger.getLogger(EngineTournament.class.getName());

    private final BoardSize size;
    private final Duration budget;
    private final int maxDepth;

    public EngineTournament(BoardSize size, Duration budget) {
        this(size, budget, NegamaxAI.DEFAULT_MAX_DEPTH);
    }

    public EngineTournament(BoardSize size, Duration budget, int maxDepth) {
        this.size = Objects.requireNonNull(size, "size");
        this.budget = Objects.requireNonNull(budget, "budget");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Depth must be at least 1");
        }
        this.maxDepth = maxDepth;
    }

    @Override
    public MatchScore play(WeightVector champion, WeightVector challenger, int games) {
        Objects.requireNonNull(champion, "champion");
        Objects.requireNonNull(challenger, "challenger");
        if (games < 1) {
            throw new IllegalArgumentException("Game count must be at least 1");
        }
        int challengerWins = 0;
        int championWins = 0;
        int draws = 0;
        for (int game = 0; game < games; game++) {
            Player challengerSide = game % 2 == 0 ? Player.BLACK : Player.WHITE;
            int outcome = playGame(champion, challenger, challengerSide);
            if (outcome > 0) {
                challengerWins++;
            } else if (outcome < 0) {
                championWins++;
            } else {
                draws++;
            }
        }
        MatchScore score = new MatchScore(challengerWins, championWins, draws);
        LOGGER.fine(() -> "Challenger " + challenger + " scored " + score);
        return score;
    }

    private int playGame(WeightVector champion, WeightVector challenger, Player challengerSide) {
        HeuristicEvaluator championEvaluator = new HeuristicEvaluator(champion);
        try (TranspositionTable championTable = TranspositionTable.inMemory();
                TranspositionTable challengerTable = TranspositionTable.inMemory()) {
            Searcher championAi = new NegamaxAI(championEvaluator, championTable, maxDepth);
            Searcher challengerAi = new NegamaxAI(new HeuristicEvaluator(challenger), challengerTable, maxDepth);
            GameRunner runner = new GameRunner(size, DrawTracker.DEFAULT_PLY_CAP, championEvaluator);
            GameRecord record = challengerSide == Player.WHITE
                    ? runner.play(challengerAi, championAi, budget)
                    : runner.play(championAi, challengerAi, budget);
            return record.result().outcomeFor(challengerSide);
        }
    }
}
