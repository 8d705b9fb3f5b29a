package com.connect3.core.ai;

import java.util.concurrent.CompletableFuture;

/**
 * Cache of search results keyed by position fingerprint, shared by every component that reads
 * or refines learned knowledge.
 */
public interface TranspositionStore {

    /**
     * Returns the entry stored for the fingerprint, or {@code null} if there is none.
     */
    TTEntry lookup(long fingerprint);

    /**
     * Stores a search result unless a deeper one is already present.
     *
     * @return {@code true} if the new result replaced the stored one
     */
    boolean store(long fingerprint, int score, int depth, int bestMove, TTFlag flag);

    /**
     * Adds {@code delta} to the score stored for the fingerprint without a fresh search.
     *
     * @return {@code false} if there is no entry to adjust
     */
    boolean bias(long fingerprint, int delta);

    /**
     * Drops an entry that turned out to be inconsistent with the position probing it.
     */
    void discard(long fingerprint);

    /**
     * Persists every change made since the previous flush.
     */
    CompletableFuture<Void> flushAsync();

    default void flush() {
        flushAsync().join();
    }
}
