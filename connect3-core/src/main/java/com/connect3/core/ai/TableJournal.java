package com.connect3.core.ai;

import com.connect3.core.Move;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;

/**
 * Binary layout of the persisted transposition table.
 *
 * <p>The file starts with a magic number and a format version, followed by fixed-size records
 * {@code {long key, int score, int depth, byte flag, int bestMove, int bias}}. Records are only ever
 * appended; replaying the file in order and keeping the last record per key reconstructs the
 * table. A flag of {@link #TOMBSTONE} removes the key.
 */
final class TableJournal {

    static final int MAGIC = 0x43335454;
    static final int VERSION = 2;
    static final byte TOMBSTONE = -1;
    static final int MAX_DEPTH = 1024;
    static final long HEADER_BYTES = Integer.BYTES * 2L;
    static final long RECORD_BYTES = Long.BYTES + Integer.BYTES + Integer.BYTES + 1 + Integer.BYTES + Integer.BYTES;

    private TableJournal() {
    }

    /**
     * Replays the journal into {@code target}.
     *
     * @throws IOException                 if the file cannot be read
     * @throws StorageUnavailableException if the header does not belong to this format
     */
    static ReplayStats replay(Path path, Map<Long, TTEntry> target) throws IOException {
        if (!Files.exists(path)) {
            return new ReplayStats(0L, 0, false);
        }
        long fileSize = Files.size(path);
        if (fileSize < HEADER_BYTES) {
            return new ReplayStats(0L, 0, fileSize > 0);
        }
        long recordCount = (fileSize - HEADER_BYTES) / RECORD_BYTES;
        boolean truncated = (fileSize - HEADER_BYTES) % RECORD_BYTES != 0;
        int corrupt = 0;

        try (DataInputStream input = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            int magic = input.readInt();
            int version = input.readInt();
            if (magic != MAGIC || version != VERSION) {
                throw new StorageUnavailableException(String.format(
                        "Unrecognised transposition table format in %s (magic=%08x, version=%d)", path, magic, version),
                        null);
            }
            for (long i = 0; i < recordCount; i++) {
                long key = input.readLong();
                int score = input.readInt();
                int depth = input.readInt();
                byte flagByte = input.readByte();
                int bestMove = input.readInt();
                int bias = input.readInt();
                if (flagByte == TOMBSTONE) {
                    target.remove(key);
                    continue;
                }
                TTFlag flag = TTFlag.fromOrdinal(flagByte);
                if (flag == null || depth < 0 || depth > MAX_DEPTH || !Move.isValidEncoding(bestMove)
                        || Scores.isDecisive(bias)) {
                    corrupt++;
                    target.remove(key);
                    continue;
                }
                target.put(key, new TTEntry(score, depth, flag, bestMove, bias));
            }
        }
        return new ReplayStats(recordCount, corrupt, truncated);
    }

    /**
     * Appends one record per change; a {@code null} value writes a tombstone.
     */
    static void append(Path path, Map<Long, TTEntry> changes) throws IOException {
        prepareDirectory(path);
        boolean needsHeader = !Files.exists(path) || Files.size(path) == 0L;
        try (DataOutputStream output = new DataOutputStream(new BufferedOutputStream(
                Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.APPEND)))) {
            if (needsHeader) {
                writeHeader(output);
            }
            for (Map.Entry<Long, TTEntry> change : changes.entrySet()) {
                writeRecord(output, change.getKey(), change.getValue());
            }
            output.flush();
        }
    }

    /**
     * Writes a fresh journal holding exactly {@code snapshot} and moves it over the old file.
     */
    static void rewrite(Path path, Map<Long, TTEntry> snapshot) throws IOException {
        prepareDirectory(path);
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try (DataOutputStream output = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(temp)))) {
            writeHeader(output);
            for (Map.Entry<Long, TTEntry> entry : snapshot.entrySet()) {
                writeRecord(output, entry.getKey(), entry.getValue());
            }
            output.flush();
        }
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void prepareDirectory(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static void writeHeader(DataOutputStream output) throws IOException {
        output.writeInt(MAGIC);
        output.writeInt(VERSION);
    }

    private static void writeRecord(DataOutputStream output, long key, TTEntry entry) throws IOException {
        output.writeLong(key);
        if (entry == null) {
            output.writeInt(0);
            output.writeInt(0);
            output.writeByte(TOMBSTONE);
            output.writeInt(Move.NONE);
            output.writeInt(0);
            return;
        }
        output.writeInt(entry.value());
        output.writeInt(entry.depth());
        output.writeByte(entry.flag().ordinal());
        output.writeInt(entry.bestMove());
        output.writeInt(entry.bias());
    }

    /**
     * Summary of a replay.
     *
     * @param records   complete records read
     * @param corrupt   records rejected as inconsistent
     * @param truncated whether the file ended inside a record
     */
    record ReplayStats(long records, int corrupt, boolean truncated) {
    }
}
