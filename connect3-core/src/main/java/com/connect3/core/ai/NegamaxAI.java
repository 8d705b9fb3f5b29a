package com.connect3.core.ai;

import com.connect3.core.Board;
import com.connect3.core.BoardSize;
import com.connect3.core.Move;
import com.connect3.core.Player;
import com.connect3.core.Symmetry;
import com.connect3.core.ai.eval.HeuristicEvaluator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Iterative-deepening negamax searcher with alpha-beta pruning and a shared transposition store.
 *
 * <p>Depth 1 always runs to completion so a legal move is available however small the budget.
 * Deeper iterations are abandoned as soon as the deadline passes, and the move of the last
 * completed iteration is returned. Deepening also stops once a forced win or loss is proven.
 *
 * <p>Instances are not thread-safe; use one per agent. The store may be shared.
 */
public final class NegamaxAI implements Searcher {

    private static final Logger LOGGER = Logger.getLogger(NegamaxAI.class.getName());

    public static final int DEFAULT_MAX_DEPTH = SearchConstraints.DEFAULT_DEPTH_LIMIT;
    public static final int DEFAULT_NODE_CHECK_INTERVAL = 1024;

    private final HeuristicEvaluator evaluator;
    private final TranspositionStore table;
    private final int maxDepth;
    private final int nodeCheckInterval;
    private final AtomicBoolean stopRequested = new AtomicBoolean();

    private long lastVisitedNodes;
    private boolean lastTimedOut;

    private long deadline;
    private boolean enforceDeadline;
    private boolean aborted;
    private long nodes;
    private long cutoffs;
    private long transpositionHits;
    private long transpositionStores;

    public NegamaxAI(HeuristicEvaluator evaluator, TranspositionStore table) {
        this(evaluator, table, DEFAULT_MAX_DEPTH);
    }

    public NegamaxAI(HeuristicEvaluator evaluator, TranspositionStore table, int maxDepth) {
        this(evaluator, table, maxDepth, DEFAULT_NODE_CHECK_INTERVAL);
    }

    public NegamaxAI(HeuristicEvaluator evaluator, TranspositionStore table, int maxDepth, int nodeCheckInterval) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Depth must be at least 1");
        }
        if (nodeCheckInterval < 1) {
            throw new IllegalArgumentException("Node check interval must be at least 1");
        }
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.table = Objects.requireNonNull(table, "table");
        this.maxDepth = maxDepth;
        this.nodeCheckInterval = nodeCheckInterval;
        if (table instanceof TranspositionTable) {
            ((TranspositionTable) table).ensureLoaded();
        }
    }

    public long getLastVisitedNodeCount() {
        return lastVisitedNodes;
    }

    public boolean wasLastSearchTimedOut() {
        return lastTimedOut;
    }

    /**
     * Asks the running search to stop at its next check. The search still returns the move of
     * its last completed iteration. A request made before a search starts is discarded.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    @Override
    public SearchResult search(Board board, SearchConstraints constraints) throws NoLegalMoveException {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(constraints, "constraints");

        if (board.isWon()) {
            throw new IllegalStateException("Cannot search moves in a finished game");
        }
        List<Move> rootMoves = board.legalMoves();
        if (rootMoves.isEmpty()) {
            throw new NoLegalMoveException(board.sideToMove());
        }

        stopRequested.set(false);
        int depthLimit = Math.min(maxDepth, constraints.depthLimit());
        long searchStart = System.nanoTime();
        long timeLimitNanos = toTimeLimitNanos(constraints.timeLimit());
        deadline = timeLimitNanos == Long.MAX_VALUE ? Long.MAX_VALUE : saturatingAdd(searchStart, timeLimitNanos);

        long totalVisited = 0L;
        IterationResult lastComplete = null;
        boolean timedOutSearch = false;
        List<SearchTelemetry.Iteration> iterations = new ArrayList<>();

        for (int depth = 1; depth <= depthLimit; depth++) {
            enforceDeadline = depth > 1;
            if (enforceDeadline && shouldStop()) {
                timedOutSearch = true;
                break;
            }
            long iterationStart = System.nanoTime();
            IterationResult iteration = searchRoot(board, rootMoves, depth);
            totalVisited += iteration.visitedNodes;
            if (iteration.aborted) {
                timedOutSearch = true;
                break;
            }
            lastComplete = iteration;
            SearchTelemetry.Iteration stats = new SearchTelemetry.Iteration(depth, iteration.visitedNodes, cutoffs,
                    transpositionHits, transpositionStores, System.nanoTime() - iterationStart, iteration.move,
                    iteration.score);
            iterations.add(stats);
            LOGGER.fine(() -> String.format("Depth %d: best %s score %d (%d nodes, %.1f ms)", stats.depth(),
                    stats.bestMove().toNotation(board.size()), stats.score(), stats.nodes(), stats.elapsedMillis()));
            if (Scores.isDecisive(iteration.score)) {
                break;
            }
        }

        IterationResult finalResult = lastComplete;
        if (finalResult == null) {
            throw new IllegalStateException("Search did not complete any iteration");
        }

        long visited = totalVisited;
        boolean timedOut = timedOutSearch;
        SearchTelemetry telemetry = new SearchTelemetry(iterations);
        LOGGER.fine(() -> String.format("Negamax explored %d nodes (depth=%d, timedOut=%s): %s", visited,
                finalResult.depth, timedOut, telemetry.summary()));

        table.flushAsync().whenComplete((ignored, error) -> {
            if (error != null) {
                LOGGER.log(Level.WARNING, "Failed to flush transposition table", error);
            }
        });

        lastVisitedNodes = visited;
        lastTimedOut = timedOut;
        return new SearchResult(finalResult.move, finalResult.score, finalResult.depth, visited, timedOut, telemetry);
    }

    private IterationResult searchRoot(Board board, List<Move> rootMoves, int depth) {
        aborted = false;
        nodes = 0L;
        cutoffs = 0L;
        transpositionHits = 0L;
        transpositionStores = 0L;

        long key = board.fingerprint();
        Move ttMove = probeMove(board, table.lookup(key));
        List<Move> ordered = orderMoves(rootMoves, ttMove);

        int alpha = -Scores.INFINITY;
        int beta = Scores.INFINITY;
        int bestScore = -Scores.INFINITY;
        Move bestMove = null;

        for (Move move : ordered) {
            int score = -negamax(board.apply(move), depth - 1, 1, -beta, -alpha);
            if (aborted) {
                return new IterationResult(null, 0, depth, nodes, true);
            }
            if (score > bestScore) {
                bestScore = score;
                bestMove = move;
            }
            if (score > alpha) {
                alpha = score;
            }
        }

        storeEntry(board, bestScore, depth, 0, bestMove, TTFlag.EXACT);
        return new IterationResult(bestMove, bestScore, depth, nodes, false);
    }

    private int negamax(Board board, int depth, int ply, int alpha, int beta) {
        nodes++;
        if (enforceDeadline && nodes % nodeCheckInterval == 0 && shouldStop()) {
            aborted = true;
        }
        if (aborted) {
            return 0;
        }

        Player winner = board.winner();
        if (winner != null) {
            return winner == board.sideToMove() ? Scores.winIn(ply) : Scores.lossIn(ply);
        }

        int originalAlpha = alpha;
        long key = board.fingerprint();
        TTEntry cached = table.lookup(key);
        Move ttMove = probeMove(board, cached);
        if (cached != null && ttMove == null && cached.bestMove() != Move.NONE) {
            cached = null;
        }
        int bias = cached == null ? 0 : cached.bias();
        if (cached != null && cached.depth() >= depth) {
            transpositionHits++;
            int value = Scores.applyBias(Scores.fromStored(cached.value(), ply), bias);
            switch (cached.flag()) {
                case EXACT:
                    return value;
                case LOWER_BOUND:
                    alpha = Math.max(alpha, value);
                    break;
                case UPPER_BOUND:
                    beta = Math.min(beta, value);
                    break;
                default:
                    break;
            }
            if (alpha >= beta) {
                return value;
            }
        }

        if (depth <= 0) {
            int evaluation = evaluator.evaluateFor(board, board.sideToMove());
            storeEntry(board, evaluation, 0, ply, null, TTFlag.EXACT);
            return Scores.applyBias(evaluation, bias);
        }

        List<Move> moves = board.legalMoves();
        if (moves.isEmpty()) {
            int loss = Scores.lossIn(ply);
            storeEntry(board, loss, depth, ply, null, TTFlag.EXACT);
            return loss;
        }

        // The stored value stays unbiased, so a learned position is searched with a full window
        // and its exact raw value is stored.
        if (bias != 0) {
            alpha = -Scores.INFINITY;
            beta = Scores.INFINITY;
            originalAlpha = alpha;
        }

        int bestValue = -Scores.INFINITY;
        Move bestMove = null;
        for (Move move : orderMoves(moves, ttMove)) {
            int score = -negamax(board.apply(move), depth - 1, ply + 1, -beta, -alpha);
            if (aborted) {
                return 0;
            }
            if (score > bestValue) {
                bestValue = score;
                bestMove = move;
            }
            if (score > alpha) {
                alpha = score;
            }
            if (alpha >= beta) {
                cutoffs++;
                break;
            }
        }

        TTFlag flag;
        if (bestValue <= originalAlpha) {
            flag = TTFlag.UPPER_BOUND;
        } else if (bestValue >= beta) {
            flag = TTFlag.LOWER_BOUND;
        } else {
            flag = TTFlag.EXACT;
        }
        storeEntry(board, bestValue, depth, ply, bestMove, flag);
        return Scores.applyBias(bestValue, bias);
    }

    /**
     * Maps the stored best move back into the board's own frame. An entry whose move cannot be
     * played here belongs to a different position and is discarded.
     */
    private Move probeMove(Board board, TTEntry entry) {
        if (entry == null || entry.bestMove() == Move.NONE) {
            return null;
        }
        BoardSize size = board.size();
        Move canonical = Move.isValidEncoding(entry.bestMove()) ? Move.decode(entry.bestMove()) : null;
        Move move = null;
        if (canonical != null && canonical.source() < size.cellCount() && canonical.destination() < size.cellCount()) {
            move = Symmetry.apply(size, board.canonicalSymmetry(), canonical);
        }
        if (move == null || !board.isLegal(move)) {
            LOGGER.fine(() -> String.format("Discarding inconsistent transposition entry %016x", board.fingerprint()));
            table.discard(board.fingerprint());
            return null;
        }
        return move;
    }

    private void storeEntry(Board board, int score, int depth, int ply, Move bestMove, TTFlag flag) {
        int encodedMove = bestMove == null
                ? Move.NONE
                : Symmetry.apply(board.size(), board.canonicalSymmetry(), bestMove).encode();
        if (table.store(board.fingerprint(), Scores.toStored(score, ply), depth, encodedMove, flag)) {
            transpositionStores++;
        }
    }

    private static List<Move> orderMoves(List<Move> moves, Move first) {
        if (first == null || moves.get(0).equals(first)) {
            return moves;
        }
        List<Move> ordered = new ArrayList<>(moves.size());
        ordered.add(first);
        for (Move move : moves) {
            if (!move.equals(first)) {
                ordered.add(move);
            }
        }
        return ordered;
    }

    private boolean shouldStop() {
        return stopRequested.get() || (deadline != Long.MAX_VALUE && System.nanoTime() >= deadline);
    }

    private static long toTimeLimitNanos(Duration timeLimit) {
        long nanos = timeLimit.isZero() ? Long.MAX_VALUE : timeLimit.toNanos();
        return nanos <= 0L ? 1L : nanos;
    }

    private static long saturatingAdd(long a, long b) {
        long result = a + b;
        if (((a ^ result) & (b ^ result)) < 0) {
            return Long.MAX_VALUE;
        }
        return result;
    }

    private record IterationResult(Move move, int score, int depth, long visitedNodes, boolean aborted) {
    }
}
