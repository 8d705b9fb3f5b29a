package com.connect3.core.relay;

import com.connect3.core.BoardSize;
import com.connect3.core.Move;
import com.connect3.core.Player;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Blocking, line-based client of a move relay. After {@link #join(String, Player)} the client
 * alternately sends its own moves and waits for the opponent's, one move per line in text
 * notation.
 *
 * <p>Every failure, including a read timeout or the relay closing the connection, surfaces as an
 * {@link UncheckedIOException} and ends the match; nothing is retried.
 */
public final class RelayConnection implements Closeable {

    private static final Logger LOGGER = Logger.getLogger(RelayConnection.class.getName());
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;

    private final Socket socket;
    private final BoardSize size;
    private final BufferedReader reader;
    private final BufferedWriter writer;
    private String lastSent;

    RelayConnection(Socket socket, BoardSize size) throws IOException {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.size = Objects.requireNonNull(size, "size");
        this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
    }

    /**
     * Connects to the relay.
     *
     * @throws UncheckedIOException if the relay cannot be reached
     */
    public static RelayConnection open(String host, int port, BoardSize size) {
        Objects.requireNonNull(host, "host");
        Socket socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), CONNECT_TIMEOUT_MILLIS);
            LOGGER.info(() -> "Connected to relay " + host + ":" + port);
            return new RelayConnection(socket, size);
        } catch (IOException ex) {
            closeQuietly(socket, ex);
            throw new UncheckedIOException("Cannot connect to relay " + host + ":" + port, ex);
        }
    }

    public BoardSize size() {
        return size;
    }

    /**
     * Announces the game to join and the colour this client plays.
     */
    public void join(String gameId, Player side) {
        Objects.requireNonNull(gameId, "gameId");
        Objects.requireNonNull(side, "side");
        if (gameId.isBlank() || gameId.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Game id must be a single non-blank word: '" + gameId + "'");
        }
        writeLine(gameId + " " + side.name().toLowerCase(Locale.ROOT));
    }

    public void sendMove(Move move) {
        Objects.requireNonNull(move, "move");
        lastSent = move.toNotation(size);
        writeLine(lastSent);
    }

    /**
     * Blocks until the relay delivers the opponent's move. An echo of the move this client just
     * sent is skipped.
     *
     * @param timeout how long to wait; zero waits indefinitely
     * @throws UncheckedIOException if the wait times out, the connection drops or the line is not
     *                              a move
     */
    public Move awaitMove(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        try {
            long millis = Math.max(1L, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
            socket.setSoTimeout(timeout.isZero() ? 0 : (int) millis);
            String line = readLine();
            if (line.equalsIgnoreCase(lastSent)) {
                lastSent = null;
                line = readLine();
            }
            try {
                return Move.parse(line, size);
            } catch (IllegalArgumentException ex) {
                throw new IOException("Relay sent something that is not a move: '" + line + "'", ex);
            }
        } catch (SocketTimeoutException ex) {
            throw new UncheckedIOException("No move from the relay within " + timeout.toMillis() + " ms", ex);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }

    private String readLine() throws IOException {
        String line = reader.readLine();
        if (line == null) {
            throw new EOFException("Relay closed the connection");
        }
        String trimmed = line.trim();
        LOGGER.fine(() -> "Relay -> " + trimmed);
        return trimmed;
    }

    private void writeLine(String line) {
        try {
            writer.write(line);
            writer.write('\n');
            writer.flush();
            LOGGER.fine(() -> "Relay <- " + line);
        } catch (IOException ex) {
            throw new UncheckedIOException("Lost connection to relay", ex);
        }
    }

    private static void closeQuietly(Socket socket, IOException cause) {
        try {
            socket.close();
        } catch (IOException closeFailure) {
            cause.addSuppressed(closeFailure);
        }
    }
}
