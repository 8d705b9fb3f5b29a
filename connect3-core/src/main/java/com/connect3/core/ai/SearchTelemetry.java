package com.connect3.core.ai;

import com.connect3.core.Move;
import java.util.List;

/**
 * Per-iteration counters of one {@link Searcher#search} call, with their totals.
 */
public final class SearchTelemetry {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(List.of());

    private final List<Iteration> iterations;
    private final long nodes;
    private final long cutoffs;
    private final long transpositionHits;
    private final long transpositionStores;
    private final long elapsedNanos;

    public SearchTelemetry(List<Iteration> iterations) {
        this.iterations = iterations == null ? List.of() : List.copyOf(iterations);
        long nodeSum = 0L;
        long cutoffSum = 0L;
        long hitSum = 0L;
        long storeSum = 0L;
        long elapsedSum = 0L;
        for (Iteration iteration : this.iterations) {
            nodeSum += iteration.nodes();
            cutoffSum += iteration.cutoffs();
            hitSum += iteration.transpositionHits();
            storeSum += iteration.transpositionStores();
            elapsedSum += iteration.elapsedNanos();
        }
        this.nodes = nodeSum;
        this.cutoffs = cutoffSum;
        this.transpositionHits = hitSum;
        this.transpositionStores = storeSum;
        this.elapsedNanos = elapsedSum;
    }

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    public List<Iteration> iterations() {
        return iterations;
    }

    public long totalNodes() {
        return nodes;
    }

    public long totalCutoffs() {
        return cutoffs;
    }

    public long totalTranspositionHits() {
        return transpositionHits;
    }

    public long totalTranspositionStores() {
        return transpositionStores;
    }

    /**
     * One-line digest used in the search log.
     */
    public String summary() {
        return String.format("%d iterations, %d nodes, %d cutoffs, %d table hits, %d table stores in %.1f ms",
                iterations.size(), nodes, cutoffs, transpositionHits, transpositionStores, elapsedNanos / 1_000_000.0);
    }

    /**
     * Statistics of one completed depth iteration.
     */
    public record Iteration(
            int depth,
            long nodes,
            long cutoffs,
            long transpositionHits,
            long transpositionStores,
            long elapsedNanos,
            Move bestMove,
            int score) {

        public double elapsedMillis() {
            return elapsedNanos / 1_000_000.0;
        }
    }
}
