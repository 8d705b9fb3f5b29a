package com.connect3.core.ai.tune;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.connect3.core.BoardSize;
import com.connect3.core.ai.eval.Feature;
import com.connect3.core.ai.eval.WeightVector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;

class HillClimberTest {

    private static final WeightVector TARGET = WeightVector.of(3.0, 7.0, 1.0, 0.5, 5.0, 2.0);

    @Test
    void stopsWhenChallengersKeepDrawing() {
        TunerConfig config = new TunerConfig(100, 5, 2, 0.5, 0.3, 10.0);
        HillClimber climber = new HillClimber((champion, challenger, games) -> new MatchScore(0, 0, games), config,
                new Random(1));

        TuningResult result = climber.climb(WeightVector.defaults());

        assertEquals(5, result.iterations());
        assertEquals(0, result.improvements());
        assertEquals(WeightVector.defaults(), result.best());
    }

    @Test
    void adoptsEveryWinningChallenger() {
        List<WeightVector> challengers = new ArrayList<>();
        Tournament alwaysWins = (champion, challenger, games) -> {
            challengers.add(challenger);
            return new MatchScore(games, 0, 0);
        };
        HillClimber climber = new HillClimber(alwaysWins, new TunerConfig(7, 3, 2, 0.5, 0.3, 10.0), new Random(7));

        TuningResult result = climber.climb(WeightVector.defaults());

        assertEquals(7, result.iterations());
        assertEquals(7, result.improvements());
        assertEquals(challengers.get(challengers.size() - 1), result.best());
    }

    @Test
    void keepsChampionOnTiedMatch() {
        HillClimber climber = new HillClimber((champion, challenger, games) -> new MatchScore(1, 1, 0),
                new TunerConfig(4, 10, 2, 0.5, 0.3, 10.0), new Random(3));

        TuningResult result = climber.climb(WeightVector.defaults());

        assertEquals(4, result.iterations());
        assertEquals(0, result.improvements());
        assertEquals(WeightVector.defaults(), result.best());
    }

    @Test
    void neverRegressesAgainstObjective() {
        List<Double> championDistances = new ArrayList<>();
        Tournament closerWins = (champion, challenger, games) -> {
            championDistances.add(distance(champion));
            return distance(challenger) < distance(champion)
                    ? new MatchScore(games, 0, 0)
                    : new MatchScore(0, games, 0);
        };
        WeightVector start = WeightVector.of(0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
        HillClimber climber = new HillClimber(closerWins, new TunerConfig(300, 300, 1, 0.5, 0.3, 10.0),
                new Random(42));

        TuningResult result = climber.climb(start);

        for (int i = 1; i < championDistances.size(); i++) {
            assertTrue(championDistances.get(i) <= championDistances.get(i - 1),
                    "The champion may only be replaced by a better vector");
        }
        assertTrue(result.improvements() > 0);
        assertTrue(distance(result.best()) < distance(start));
    }

    @Test
    void perturbationStaysWithinBounds() {
        TunerConfig config = new TunerConfig(10, 10, 1, 0.75, 0.5, 1.0);
        HillClimber climber = new HillClimber((champion, challenger, games) -> new MatchScore(0, 0, games), config,
                new Random(11));
        WeightVector base = WeightVector.of(1.0, 0.0, 0.5, 1.0, 0.0, 0.5);

        for (int round = 0; round < 200; round++) {
            for (double weight : climber.perturb(base).toArray()) {
                assertTrue(weight >= 0.0 && weight <= 1.0, "Weight left [0, 1]: " + weight);
            }
        }
    }

    @Test
    void alwaysPerturbsAtLeastOneWeight() {
        TunerConfig config = new TunerConfig(10, 10, 1, 0.5, 0.0, 10.0);
        HillClimber climber = new HillClimber((champion, challenger, games) -> new MatchScore(0, 0, games), config,
                new Random(5));
        WeightVector base = WeightVector.of(5.0, 5.0, 5.0, 5.0, 5.0, 5.0);

        int changed = 0;
        for (int round = 0; round < 50; round++) {
            if (!climber.perturb(base).equals(base)) {
                changed++;
            }
        }

        assertEquals(50, changed);
    }

    @Test
    void clampsInitialVector() {
        HillClimber climber = new HillClimber((champion, challenger, games) -> new MatchScore(0, 0, games),
                new TunerConfig(1, 1, 1, 0.5, 0.3, 2.0), new Random(9));

        TuningResult result = climber.climb(WeightVector.of(5.0, -1.0, 1.0, 1.0, 1.0, 1.0));

        assertEquals(2.0, result.best().get(Feature.RUNS_OF_TWO));
        assertEquals(0.0, result.best().get(Feature.WIN_THREATS));
    }

    @Test
    void engineTournamentPlaysRequestedGames() {
        EngineTournament tournament = new EngineTournament(BoardSize.SMALL, Duration.ZERO, 1);
        WeightVector champion = WeightVector.defaults();
        WeightVector challenger = champion.with(Feature.TEMPO, 1.0);

        MatchScore score = tournament.play(champion, challenger, 2);

        assertEquals(2, score.games());
        assertNotEquals(champion, challenger);
    }

    @Test
    void validatesConfig() {
        assertThrows(IllegalArgumentException.class, () -> new TunerConfig(0, 1, 1, 0.5, 0.3, 10.0));
        assertThrows(IllegalArgumentException.class, () -> new TunerConfig(1, 1, 1, 0.5, 1.5, 10.0));
        assertThrows(IllegalArgumentException.class, () -> new TunerConfig(1, 1, 1, 0.0, 0.3, 10.0));
    }

    private static double distance(WeightVector vector) {
        double[] weights = vector.toArray();
        double[] target = TARGET.toArray();
        double sum = 0.0;
        for (int i = 0; i < weights.length; i++) {
            sum += Math.abs(weights[i] - target[i]);
        }
        return sum;
    }
}
