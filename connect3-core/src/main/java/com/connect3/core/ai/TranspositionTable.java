package com.connect3.core.ai;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe transposition table that persists across engine runs.
 *
 * <p>Reads are lock-free lookups of immutable {@link TTEntry} records. Writes to one key are
 * serialised through {@link ConcurrentHashMap#compute}, which also applies the depth rule, so a
 * shallow result can never overwrite a deeper one even when two agents share the table.
 *
 * <p>Every changed key is remembered until the next flush, which appends those entries to the
 * journal on a dedicated I/O thread. When the journal has grown well beyond the table it is
 * compacted into a fresh snapshot. Storage failures never reach the caller: the table logs them
 * and keeps working in memory.
 */
public final class TranspositionTable implements TranspositionStore, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(TranspositionTable.class.getName());
    private static final String DEFAULT_FILE_NAME = "transposition-table.bin";
    private static final Path DEFAULT_PATH = Paths.get(System.getProperty("user.home"), ".connect3", DEFAULT_FILE_NAME);
    private static final long COMPACTION_MIN_RECORDS = 4096L;
    private static final CompletableFuture<Void> COMPLETED = CompletableFuture.completedFuture(null);

    private final ConcurrentHashMap<Long, TTEntry> entries = new ConcurrentHashMap<>();
    private final Set<Long> dirty = ConcurrentHashMap.newKeySet();
    private final Path storagePath;
    private final ExecutorService ioExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "transposition-table-io");
        thread.setDaemon(true);
        return thread;
    });
    private final List<Consumer<PersistenceStatus>> listeners = new CopyOnWriteArrayList<>();
    private volatile UpdateEvent lastUpdate;
    private volatile PersistenceStatus persistenceStatus = PersistenceStatus.NOT_LOADED;
    private final Object loadLock = new Object();
    private CompletableFuture<Void> loadFuture;

    // confined to the I/O thread
    private long journalRecords;
    private boolean rewriteRequired;
    private boolean storageLost;

    public TranspositionTable() {
        this(DEFAULT_PATH);
    }

    /**
     * Creates a table backed by the given file, or a purely in-memory table when the path is
     * {@code null}.
     */
    public TranspositionTable(Path storagePath) {
        this.storagePath = storagePath;
    }

    public static TranspositionTable inMemory() {
        return new TranspositionTable(null);
    }

    public Path getStoragePath() {
        return storagePath;
    }

    @Override
    public TTEntry lookup(long fingerprint) {
        return entries.get(fingerprint);
    }

    @Override
    public boolean store(long fingerprint, int score, int depth, int bestMove, TTFlag flag) {
        TTEntry entry = new TTEntry(score, depth, flag, bestMove);
        UpdateContext context = new UpdateContext();
        entries.compute(fingerprint, (ignored, existing) -> {
            context.previous = existing;
            if (existing != null && existing.depth() > entry.depth()) {
                context.stored = existing;
                context.replaced = false;
                return existing;
            }
            TTEntry replacement = existing == null ? entry : entry.withBias(existing.bias());
            context.stored = replacement;
            context.replaced = true;
            return replacement;
        });
        if (context.replaced) {
            dirty.add(fingerprint);
        }
        lastUpdate = new UpdateEvent(fingerprint, context.stored, context.previous, context.replaced, size());
        return context.replaced;
    }

    /**
     * {@inheritDoc}
     *
     * <p>The correction accumulates in {@link TTEntry#bias()} and survives later stores for the
     * same key. Proven wins and losses are never adjusted, and the accumulated bias stays below the
     * decisive range.
     */
    @Override
    public boolean bias(long fingerprint, int delta) {
        UpdateContext context = new UpdateContext();
        entries.computeIfPresent(fingerprint, (ignored, existing) -> {
            context.previous = existing;
            if (Scores.isDecisive(existing.value())) {
                context.stored = existing;
                return existing;
            }
            TTEntry biased = existing.withBias(Scores.clampHeuristic((long) existing.bias() + delta));
            context.stored = biased;
            context.replaced = true;
            return biased;
        });
        if (context.previous == null) {
            return false;
        }
        if (context.replaced) {
            dirty.add(fingerprint);
        }
        lastUpdate = new UpdateEvent(fingerprint, context.stored, context.previous, context.replaced, size());
        return context.replaced;
    }

    @Override
    public void discard(long fingerprint) {
        if (entries.remove(fingerprint) != null) {
            dirty.add(fingerprint);
        }
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns a point-in-time copy of all entries.
     */
    public Map<Long, TTEntry> snapshot() {
        return Map.copyOf(entries);
    }

    public UpdateEvent getLastUpdate() {
        return lastUpdate;
    }

    public PersistenceStatus getPersistenceStatus() {
        return persistenceStatus;
    }

    /**
     * Replaces the in-memory contents with the persisted ones. Loading twice without intervening
     * writes yields the same table. An unreadable file leaves the table empty and
     * {@link PersistenceStatus#DEGRADED}.
     */
    public void load() {
        loadAsync().join();
    }

    /**
     * Loads the table once; later calls return immediately.
     */
    public void ensureLoaded() {
        if (persistenceStatus == PersistenceStatus.NOT_LOADED) {
            load();
        }
    }

    public CompletableFuture<Void> loadAsync() {
        synchronized (loadLock) {
            if (loadFuture != null) {
                return loadFuture;
            }
            CompletableFuture<Void> future = submitPersistenceTask(PersistenceStatus.LOADING, this::loadInternal);
            loadFuture = future;
            future.whenComplete((ignored, error) -> {
                synchronized (loadLock) {
                    if (loadFuture == future) {
                        loadFuture = null;
                    }
                }
            });
            return future;
        }
    }

    @Override
    public CompletableFuture<Void> flushAsync() {
        if (storagePath == null) {
            return COMPLETED;
        }
        return submitPersistenceTask(PersistenceStatus.SAVING, this::flushInternal);
    }

    /**
     * Rewrites the journal so that it holds exactly one record per entry.
     */
    public void compact() {
        if (storagePath == null) {
            return;
        }
        submitPersistenceTask(PersistenceStatus.SAVING, this::compactInternal).join();
    }

    public void addPersistenceListener(Consumer<PersistenceStatus> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Flushes pending changes and stops the I/O thread.
     */
    @Override
    public void close() {
        flush();
        ioExecutor.shutdown();
    }

    private CompletableFuture<Void> submitPersistenceTask(PersistenceStatus runningStatus, Runnable action) {
        return CompletableFuture.runAsync(() -> {
            setPersistenceStatus(runningStatus);
            try {
                action.run();
                setPersistenceStatus(storageLost ? PersistenceStatus.DEGRADED : PersistenceStatus.READY);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "Transposition table storage unavailable, continuing in memory", ex);
                setPersistenceStatus(PersistenceStatus.DEGRADED);
            }
        }, ioExecutor);
    }

    private void loadInternal() {
        if (storagePath == null) {
            return;
        }
        Map<Long, TTEntry> loaded = new HashMap<>();
        TableJournal.ReplayStats stats;
        try {
            stats = TableJournal.replay(storagePath, loaded);
        } catch (IOException | StorageUnavailableException ex) {
            entries.clear();
            dirty.clear();
            lastUpdate = null;
            storageLost = true;
            if (ex instanceof StorageUnavailableException) {
                throw (StorageUnavailableException) ex;
            }
            throw new StorageUnavailableException("Failed to load transposition table from " + storagePath, ex);
        }
        entries.clear();
        dirty.clear();
        entries.putAll(loaded);
        lastUpdate = null;
        storageLost = false;
        journalRecords = stats.records();
        rewriteRequired = stats.truncated() || stats.corrupt() > 0;
        if (stats.truncated()) {
            LOGGER.warning(() -> "Ignoring truncated record at the end of " + storagePath);
        }
        if (stats.corrupt() > 0) {
            LOGGER.warning(() -> String.format("Discarded %d corrupt transposition entries from %s",
                    stats.corrupt(), storagePath));
        }
        LOGGER.info(() -> String.format("Loaded %d transposition entries from %s", loaded.size(), storagePath));
    }

    private void flushInternal() {
        if (storageLost) {
            LOGGER.fine("Skipping flush, storage was unreadable at load time");
            return;
        }
        if (rewriteRequired || journalRecords > Math.max(COMPACTION_MIN_RECORDS, 2L * entries.size())) {
            compactInternal();
            return;
        }
        List<Long> keys = new ArrayList<>(dirty);
        if (keys.isEmpty()) {
            return;
        }
        Map<Long, TTEntry> changes = new LinkedHashMap<>();
        for (Long key : keys) {
            dirty.remove(key);
            changes.put(key, entries.get(key));
        }
        try {
            TableJournal.append(storagePath, changes);
        } catch (IOException ex) {
            dirty.addAll(keys);
            throw new StorageUnavailableException("Failed to flush transposition table to " + storagePath, ex);
        }
        journalRecords += changes.size();
        LOGGER.fine(() -> String.format("Flushed %d transposition entries to %s", changes.size(), storagePath));
    }

    private void compactInternal() {
        if (storageLost) {
            return;
        }
        List<Long> pending = new ArrayList<>(dirty);
        dirty.removeAll(pending);
        Map<Long, TTEntry> snapshot = new HashMap<>(entries);
        try {
            TableJournal.rewrite(storagePath, snapshot);
        } catch (IOException ex) {
            dirty.addAll(pending);
            throw new StorageUnavailableException("Failed to compact transposition table at " + storagePath, ex);
        }
        journalRecords = snapshot.size();
        rewriteRequired = false;
        LOGGER.info(() -> String.format("Saved %d transposition entries to %s", snapshot.size(), storagePath));
    }

    private void setPersistenceStatus(PersistenceStatus status) {
        persistenceStatus = status;
        for (Consumer<PersistenceStatus> listener : listeners) {
            try {
                listener.accept(status);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "Persistence listener failed", ex);
            }
        }
    }

    public record UpdateEvent(long key, TTEntry entry, TTEntry previousEntry, boolean replaced, int sizeAfterUpdate) {
    }

    public enum PersistenceStatus {
        NOT_LOADED,
        LOADING,
        SAVING,
        READY,
        DEGRADED
    }

    private static final class UpdateContext {

        private TTEntry stored;
        private TTEntry previous;
        private boolean replaced;
    }
}
