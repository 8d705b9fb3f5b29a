package com.connect3.core.ai.learn;

import com.connect3.core.Board;
import com.connect3.core.GameRecord;
import com.connect3.core.GameResult;
import com.connect3.core.Move;
import com.connect3.core.Player;
import com.connect3.core.ai.Scores;
import com.connect3.core.ai.TTFlag;
import com.connect3.core.ai.TranspositionStore;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Looks back over a finished match for the move the losing side misjudged and biases the table
 * entry of the position it produced.
 *
 * <p>Scanning from the last ply backwards, the first move whose mover did not win and whose
 * recorded evaluation was at least {@link LearnerConfig#disagreementThreshold()} in the mover's
 * favour is blamed. This is an attribution heuristic, not a proof: the latest disagreement is
 * always the one corrected. Moves of the winning side are never touched.
 */
public final class OutcomeLearner {

    private static final Logger LOGGER = Logger.getLogger(OutcomeLearner.class.getName());

    private final TranspositionStore store;
    private final LearnerConfig config;

    public OutcomeLearner(TranspositionStore store) {
        this(store, LearnerConfig.defaults());
    }

    public OutcomeLearner(TranspositionStore store, LearnerConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.config = Objects.requireNonNull(config, "config");
    }

    public LearnerConfig config() {
        return config;
    }

    /**
     * Applies a correction for the match, if one is warranted, and schedules a flush of the
     * table.
     *
     * @return the applied correction, or empty if no move disagreed with the result
     */
    public Optional<Correction> learn(GameRecord record) {
        Objects.requireNonNull(record, "record");
        GameResult result = record.result();
        List<GameRecord.Ply> plies = record.plies();
        List<Board> positions = record.positions();
        int threshold = config.disagreementThreshold();

        for (int i = plies.size() - 1; i >= 0; i--) {
            Board after = positions.get(i);
            Player mover = after.sideToMove().opponent();
            if (mover == result.winner()) {
                continue;
            }
            int evaluation = plies.get(i).evaluation();
            int view = mover.sign() * evaluation;
            if (view < threshold || Scores.isDecisive(view)) {
                continue;
            }

            int target = result.isDraw() ? 0 : -threshold;
            int delta = (view - target) / 2;
            int adjusted = correct(after, view, delta) ? 1 : 0;
            int share = delta;
            for (int step = 1; step <= config.neighbourPlies(); step++) {
                int earlier = i - 2 * step;
                share /= 2;
                if (earlier < 0 || share == 0) {
                    break;
                }
                int earlierView = mover.sign() * plies.get(earlier).evaluation();
                if (correct(positions.get(earlier), earlierView, share)) {
                    adjusted++;
                }
            }

            Correction correction = new Correction(i, plies.get(i).move(), mover, evaluation, delta, adjusted);
            LOGGER.info(() -> String.format("Blamed ply %d (%s by %s, evaluation %d); biased by %d", correction.ply(),
                    correction.move().toNotation(record.start().size()), correction.mover(), correction.evaluation(),
                    correction.delta()));
            store.flushAsync().whenComplete((ignored, error) -> {
                if (error != null) {
                    LOGGER.log(Level.WARNING, "Failed to flush transposition table after learning", error);
                }
            });
            return Optional.of(correction);
        }

        LOGGER.fine(() -> "No misjudged move found in a " + record.length() + "-ply match");
        return Optional.empty();
    }

    /**
     * Raises the value of {@code position} for its side to move, which is the opponent of the
     * side that misjudged it.
     */
    private boolean correct(Board position, int moverView, int delta) {
        long fingerprint = position.fingerprint();
        if (store.lookup(fingerprint) == null) {
            store.store(fingerprint, -moverView, 0, Move.NONE, TTFlag.EXACT);
        }
        return store.bias(fingerprint, delta);
    }
}
