package com.connect3.core.ai;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertIterableEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.connect3.core.Move;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranspositionTableTest {

    @TempDir
    Path tempDir;

    @Test
    void keepsEntryWithGreaterDepth() {
        TranspositionTable table = TranspositionTable.inMemory();

        assertTrue(table.store(7L, 5, 1, encoded(1, 2), TTFlag.EXACT));
        assertTrue(table.store(7L, 8, 3, encoded(3, 4), TTFlag.LOWER_BOUND));
        assertFalse(table.store(7L, 4, 2, encoded(5, 6), TTFlag.UPPER_BOUND));

        TTEntry entry = table.lookup(7L);
        assertNotNull(entry);
        assertEquals(8, entry.value());
        assertEquals(3, entry.depth());
        assertSame(TTFlag.LOWER_BOUND, entry.flag());
        assertEquals(encoded(3, 4), entry.bestMove());
    }

    @Test
    void equalDepthReplacesTheStoredEntry() {
        TranspositionTable table = TranspositionTable.inMemory();

        table.store(9L, 5, 2, -1, TTFlag.UPPER_BOUND);
        assertTrue(table.store(9L, 6, 2, -1, TTFlag.EXACT));

        assertEquals(6, table.lookup(9L).value());
    }

    @Test
    void concurrentWritersNeverLoseTheDeepestResult() throws Exception {
        TranspositionTable table = TranspositionTable.inMemory();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> tasks = new ArrayList<>();
            for (int worker = 0; worker < 4; worker++) {
                long seed = worker;
                tasks.add(pool.submit(() -> {
                    List<Integer> depths = new ArrayList<>();
                    for (int depth = 0; depth <= 50; depth++) {
                        depths.add(depth);
                    }
                    Collections.shuffle(depths, new Random(seed));
                    for (int depth : depths) {
                        table.store(42L, depth * 10, depth, -1, TTFlag.EXACT);
                    }
                }));
            }
            for (Future<?> task : tasks) {
                task.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(50, table.lookup(42L).depth());
        assertEquals(500, table.lookup(42L).value());
    }

    @Test
    void exposesLastUpdateDetails() {
        TranspositionTable table = TranspositionTable.inMemory();

        table.store(5L, 3, 2, encoded(0, 1), TTFlag.EXACT);

        TranspositionTable.UpdateEvent first = table.getLastUpdate();
        assertNotNull(first);
        assertEquals(5L, first.key());
        assertNull(first.previousEntry());
        assertTrue(first.replaced());
        assertEquals(1, first.sizeAfterUpdate());

        table.store(5L, 9, 1, -1, TTFlag.LOWER_BOUND);

        TranspositionTable.UpdateEvent second = table.getLastUpdate();
        assertFalse(second.replaced(), "Entry should remain unchanged when depth is shallower");
        assertSame(first.entry(), second.entry());
        assertSame(first.entry(), second.previousEntry());
    }

    @Test
    void persistsEntriesToDisk() {
        Path file = tempDir.resolve("table.bin");
        TranspositionTable table = new TranspositionTable(file);
        table.load();
        table.store(21L, 13, 2, encoded(3, 8), TTFlag.EXACT);
        table.store(22L, -7, 1, -1, TTFlag.UPPER_BOUND);
        table.flush();

        TranspositionTable loaded = new TranspositionTable(file);
        loaded.load();

        assertEquals(2, loaded.size());
        assertNull(loaded.getLastUpdate());
        assertEquals(table.snapshot(), loaded.snapshot());
        assertEquals(TranspositionTable.PersistenceStatus.READY, loaded.getPersistenceStatus());
    }

    @Test
    void reloadingWithoutWritesIsIdempotent() {
        Path file = tempDir.resolve("idempotent.bin");
        TranspositionTable writer = new TranspositionTable(file);
        for (long key = 0; key < 20; key++) {
            writer.store(key, (int) key * 3, (int) (key % 5), -1, TTFlag.values()[(int) (key % 3)]);
        }
        writer.flush();

        TranspositionTable table = new TranspositionTable(file);
        table.load();
        Map<Long, TTEntry> first = table.snapshot();
        byte[] bytes = readAll(file);
        table.load();

        assertEquals(first, table.snapshot());
        assertEquals(20, first.size());
        table.flush();
        assertArrayEquals(bytes, readAll(file), "Nothing changed, so nothing is written");
    }

    @Test
    void appendsOnlyChangedEntries() throws IOException {
        Path file = tempDir.resolve("journal.bin");
        TranspositionTable table = new TranspositionTable(file);
        table.store(1L, 10, 1, -1, TTFlag.EXACT);
        table.store(2L, 20, 1, -1, TTFlag.EXACT);
        table.flush();
        long afterFirstFlush = Files.size(file);

        table.store(1L, 11, 2, -1, TTFlag.EXACT);
        table.flush();

        assertEquals(TableJournal.HEADER_BYTES + 2 * TableJournal.RECORD_BYTES, afterFirstFlush);
        assertEquals(afterFirstFlush + TableJournal.RECORD_BYTES, Files.size(file));

        TranspositionTable reloaded = new TranspositionTable(file);
        reloaded.load();
        assertEquals(11, reloaded.lookup(1L).value());
        assertEquals(20, reloaded.lookup(2L).value());
    }

    @Test
    void discardedEntriesStayDeletedAfterReload() {
        Path file = tempDir.resolve("tombstone.bin");
        TranspositionTable table = new TranspositionTable(file);
        table.store(3L, 30, 4, -1, TTFlag.EXACT);
        table.store(4L, 40, 4, -1, TTFlag.EXACT);
        table.flush();

        table.discard(3L);
        table.flush();

        TranspositionTable reloaded = new TranspositionTable(file);
        reloaded.load();
        assertNull(reloaded.lookup(3L));
        assertNotNull(reloaded.lookup(4L));
    }

    @Test
    void compactionKeepsOneRecordPerEntry() throws IOException {
        Path file = tempDir.resolve("compact.bin");
        TranspositionTable table = new TranspositionTable(file);
        for (int depth = 0; depth < 5; depth++) {
            table.store(8L, depth, depth, -1, TTFlag.EXACT);
            table.flush();
        }

        table.compact();

        assertEquals(TableJournal.HEADER_BYTES + TableJournal.RECORD_BYTES, Files.size(file));
        TranspositionTable reloaded = new TranspositionTable(file);
        reloaded.load();
        assertEquals(4, reloaded.lookup(8L).depth());
    }

    @Test
    void ignoresTruncatedTailAndRewritesIt() throws IOException {
        Path file = tempDir.resolve("truncated.bin");
        TranspositionTable writer = new TranspositionTable(file);
        writer.store(1L, 1, 1, -1, TTFlag.EXACT);
        writer.store(2L, 2, 1, -1, TTFlag.EXACT);
        writer.flush();
        Files.write(file, new byte[] {1, 2, 3, 4, 5}, StandardOpenOption.APPEND);

        TranspositionTable table = new TranspositionTable(file);
        table.load();

        assertEquals(2, table.size());
        assertEquals(TranspositionTable.PersistenceStatus.READY, table.getPersistenceStatus());

        table.flush();
        assertEquals(TableJournal.HEADER_BYTES + 2 * TableJournal.RECORD_BYTES, Files.size(file));
    }

    @Test
    void skipsCorruptRecords() throws IOException {
        Path file = tempDir.resolve("corrupt.bin");
        try (DataOutputStream output = new DataOutputStream(Files.newOutputStream(file))) {
            output.writeInt(TableJournal.MAGIC);
            output.writeInt(TableJournal.VERSION);
            writeRecord(output, 1L, 5, 2, (byte) 7, -1, 0);
            writeRecord(output, 2L, 5, -3, (byte) 0, -1, 0);
            writeRecord(output, 3L, 5, 2, (byte) 0, 9 * 64 + 9, 0);
            writeRecord(output, 4L, 6, 2, (byte) 1, encoded(0, 1), 12);
            writeRecord(output, 5L, 6, 2, (byte) 0, -1, Scores.WIN_SCORE);
        }

        TranspositionTable table = new TranspositionTable(file);
        table.load();

        assertEquals(1, table.size());
        assertEquals(new TTEntry(6, 2, TTFlag.LOWER_BOUND, encoded(0, 1), 12), table.lookup(4L));
    }

    @Test
    void unreadableStorageDegradesToMemory() throws IOException {
        Path file = tempDir.resolve("foreign.bin");
        byte[] foreign = {'n', 'o', 't', ' ', 'a', ' ', 't', 'a', 'b', 'l', 'e', '!'};
        Files.write(file, foreign);
        TranspositionTable table = new TranspositionTable(file);

        table.load();

        assertEquals(TranspositionTable.PersistenceStatus.DEGRADED, table.getPersistenceStatus());
        assertEquals(0, table.size());
        table.store(1L, 1, 1, -1, TTFlag.EXACT);
        assertNotNull(table.lookup(1L));
        table.flush();
        assertArrayEquals(foreign, readAll(file), "A file that could not be read must not be overwritten");
    }

    @Test
    void failedFlushDegradesWithoutLosingEntries() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.write(blocker, new byte[] {0});
        TranspositionTable table = new TranspositionTable(blocker.resolve("table.bin"));
        table.load();
        table.store(1L, 1, 1, -1, TTFlag.EXACT);

        table.flush();

        assertEquals(TranspositionTable.PersistenceStatus.DEGRADED, table.getPersistenceStatus());
        assertNotNull(table.lookup(1L));
    }

    @Test
    void biasAdjustsHeuristicScoresOnly() {
        TranspositionTable table = TranspositionTable.inMemory();
        table.store(1L, 10, 3, -1, TTFlag.EXACT);
        table.store(2L, Scores.winIn(3), 3, -1, TTFlag.EXACT);
        table.store(3L, Scores.WIN_THRESHOLD - 10, 3, -1, TTFlag.EXACT);

        assertTrue(table.bias(1L, 5));
        assertFalse(table.bias(2L, -50), "Proven results are not adjusted");
        assertFalse(table.bias(99L, 5), "Missing entries are not created");
        assertTrue(table.bias(3L, 1_000));

        assertEquals(10, table.lookup(1L).value());
        assertEquals(5, table.lookup(1L).bias());
        assertEquals(15, table.lookup(1L).biasedValue());
        assertEquals(3, table.lookup(1L).depth());
        assertEquals(Scores.winIn(3), table.lookup(2L).biasedValue());
        assertFalse(Scores.isDecisive(table.lookup(3L).biasedValue()));
    }

    @Test
    void biasSurvivesDeeperStores() {
        TranspositionTable table = TranspositionTable.inMemory();
        table.store(5L, -400, 0, -1, TTFlag.EXACT);
        table.bias(5L, 275);
        table.bias(5L, 25);

        assertTrue(table.store(5L, -550, 2, encoded(0, 1), TTFlag.EXACT));

        TTEntry entry = table.lookup(5L);
        assertEquals(-550, entry.value());
        assertEquals(2, entry.depth());
        assertEquals(300, entry.bias());
        assertEquals(-250, entry.biasedValue());
    }

    @Test
    void biasIsPersistedWithTheEntry() {
        Path file = tempDir.resolve("bias.bin");
        TranspositionTable table = new TranspositionTable(file);
        table.store(6L, 10, 1, -1, TTFlag.EXACT);
        table.flush();
        table.bias(6L, -40);
        table.flush();

        TranspositionTable reloaded = new TranspositionTable(file);
        reloaded.load();

        assertEquals(new TTEntry(10, 1, TTFlag.EXACT, -1, -40), reloaded.lookup(6L));
    }

    @Test
    void reportsPersistenceStatusUpdates() {
        TranspositionTable table = new TranspositionTable(tempDir.resolve("status.bin"));
        List<TranspositionTable.PersistenceStatus> statuses = Collections.synchronizedList(new ArrayList<>());
        table.addPersistenceListener(statuses::add);

        table.load();
        table.store(1L, 2, 1, -1, TTFlag.EXACT);
        table.flush();

        assertIterableEquals(List.of(
                TranspositionTable.PersistenceStatus.LOADING,
                TranspositionTable.PersistenceStatus.READY,
                TranspositionTable.PersistenceStatus.SAVING,
                TranspositionTable.PersistenceStatus.READY), statuses);
    }

    private static void writeRecord(DataOutputStream output, long key, int score, int depth, byte flag, int move,
            int bias) throws IOException {
        output.writeLong(key);
        output.writeInt(score);
        output.writeInt(depth);
        output.writeByte(flag);
        output.writeInt(move);
        output.writeInt(bias);
    }

    private static byte[] readAll(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new AssertionError("Cannot read " + file, ex);
        }
    }

    private static int encoded(int source, int destination) {
        return new Move(source, destination).encode();
    }
}
