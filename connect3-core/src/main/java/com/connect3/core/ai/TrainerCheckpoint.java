package com.connect3.core.ai;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Counters of a training session, saved next to the transposition table so an interrupted
 * session resumes where it stopped.
 */
public record TrainerCheckpoint(long gamesPlayed, long whiteWins, long blackWins, long draws,
        int consecutiveDraws, long budgetMillis) {

    private static final int MAGIC = 0x43335443;
    private static final int VERSION = 1;

    public TrainerCheckpoint {
        if (gamesPlayed < 0 || whiteWins < 0 || blackWins < 0 || draws < 0 || consecutiveDraws < 0
                || budgetMillis < 0) {
            throw new IllegalArgumentException("Checkpoint counters must not be negative");
        }
        if (whiteWins + blackWins + draws != gamesPlayed) {
            throw new IllegalArgumentException("Results do not add up to " + gamesPlayed + " games");
        }
    }

    /**
     * Reads a checkpoint, or returns empty if none has been written yet.
     *
     * @throws IOException if the file exists but cannot be read or is not a checkpoint
     */
    public static Optional<TrainerCheckpoint> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try (DataInputStream input = new DataInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            int magic = input.readInt();
            int version = input.readInt();
            if (magic != MAGIC || version != VERSION) {
                throw new IOException("Not a training checkpoint: " + path);
            }
            try {
                return Optional.of(new TrainerCheckpoint(input.readLong(), input.readLong(), input.readLong(),
                        input.readLong(), input.readInt(), input.readLong()));
            } catch (IllegalArgumentException ex) {
                throw new IOException("Inconsistent training checkpoint: " + path, ex);
            }
        }
    }

    /**
     * Writes the checkpoint to a temporary file and moves it into place.
     */
    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        try (DataOutputStream output = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(temp)))) {
            output.writeInt(MAGIC);
            output.writeInt(VERSION);
            output.writeLong(gamesPlayed);
            output.writeLong(whiteWins);
            output.writeLong(blackWins);
            output.writeLong(draws);
            output.writeInt(consecutiveDraws);
            output.writeLong(budgetMillis);
        }
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
