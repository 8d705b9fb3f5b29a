package com.connect3.core.relay;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.connect3.core.Board;
import com.connect3.core.BoardSize;
import com.connect3.core.Move;
import com.connect3.core.Player;
import com.connect3.core.ai.SearchConstraints;
import com.connect3.core.ai.SearchResult;
import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RelayConnectionTest {

    private ServerSocket server;
    private Socket relaySide;
    private BufferedReader relayReader;
    private RelayConnection connection;

    @BeforeEach
    void connect() throws IOException {
        server = new ServerSocket(0);
        Socket client = new Socket("localhost", server.getLocalPort());
        relaySide = server.accept();
        relaySide.setSoTimeout(5_000);
        relayReader = new BufferedReader(new InputStreamReader(relaySide.getInputStream(), StandardCharsets.UTF_8));
        connection = new RelayConnection(client, BoardSize.SMALL);
    }

    @AfterEach
    void disconnect() throws IOException {
        connection.close();
        relaySide.close();
        server.close();
    }

    @Test
    void joinAnnouncesGameAndColour() throws IOException {
        connection.join("g42", Player.WHITE);

        assertEquals("g42 white", relayReader.readLine());
    }

    @Test
    void rejectsGameIdWithWhitespace() {
        assertThrows(IllegalArgumentException.class, () -> connection.join("two words", Player.BLACK));
        assertThrows(IllegalArgumentException.class, () -> connection.join(" ", Player.BLACK));
    }

    @Test
    void skipsEchoOfOwnMove() throws IOException {
        connection.sendMove(Move.parse("51SW", BoardSize.SMALL));
        assertEquals("51SW", relayReader.readLine());

        relay("51sw\n12E\n");

        assertEquals(Move.parse("12E", BoardSize.SMALL), connection.awaitMove(Duration.ofSeconds(5)));
    }

    @Test
    void timesOutWhenNoMoveArrives() {
        UncheckedIOException ex = assertThrows(UncheckedIOException.class,
                () -> connection.awaitMove(Duration.ofMillis(50)));

        assertInstanceOf(SocketTimeoutException.class, ex.getCause());
        assertTrue(ex.getMessage().contains("50 ms"));
    }

    @Test
    void reportsClosedConnection() throws IOException {
        relaySide.close();

        UncheckedIOException ex = assertThrows(UncheckedIOException.class,
                () -> connection.awaitMove(Duration.ofSeconds(5)));

        assertInstanceOf(EOFException.class, ex.getCause());
    }

    @Test
    void rejectsMalformedLine() throws IOException {
        relay("hello\n");

        UncheckedIOException ex = assertThrows(UncheckedIOException.class,
                () -> connection.awaitMove(Duration.ofSeconds(5)));

        assertTrue(ex.getCause().getMessage().contains("hello"));
    }

    @Test
    void remoteSearcherForwardsOnlyLocalMoves() throws IOException {
        RemoteSearcher remote = new RemoteSearcher(connection, Player.WHITE);
        Board start = Board.initial(BoardSize.SMALL);
        Move whiteMove = new Move(0, 1);
        Board afterWhite = start.apply(whiteMove);

        remote.onMove(afterWhite, new Move(4, 8), Player.BLACK);
        remote.onMove(start, whiteMove, Player.WHITE);

        assertEquals(whiteMove.toNotation(BoardSize.SMALL), relayReader.readLine());
    }

    @Test
    void remoteSearcherReturnsRelayedMove() throws IOException {
        RemoteSearcher remote = new RemoteSearcher(connection, Player.WHITE);
        Board board = Board.initial(BoardSize.SMALL).apply(new Move(0, 1));
        relay("51SW\n");

        SearchResult result = remote.search(board, SearchConstraints.forBudget(Duration.ofSeconds(5)));

        assertEquals(new Move(4, 8), result.move());
    }

    @Test
    void remoteSearcherRejectsIllegalRelayedMove() throws IOException {
        RemoteSearcher remote = new RemoteSearcher(connection, Player.WHITE);
        Board board = Board.initial(BoardSize.SMALL).apply(new Move(0, 1));
        relay("11E\n");

        assertThrows(IllegalStateException.class,
                () -> remote.search(board, SearchConstraints.forBudget(Duration.ofSeconds(5))));
    }

    @Test
    void remoteSearcherDoesNotMoveForLocalSide() {
        RemoteSearcher remote = new RemoteSearcher(connection, Player.WHITE);

        assertThrows(IllegalStateException.class,
                () -> remote.search(Board.initial(BoardSize.SMALL), SearchConstraints.forDepth(1)));
    }

    @Test
    void openFailsForUnreachableRelay() throws IOException {
        int port;
        try (ServerSocket unused = new ServerSocket(0)) {
            port = unused.getLocalPort();
        }

        assertThrows(UncheckedIOException.class, () -> RelayConnection.open("localhost", port, BoardSize.SMALL));
    }

    private void relay(String text) throws IOException {
        OutputStream output = relaySide.getOutputStream();
        output.write(text.getBytes(StandardCharsets.UTF_8));
        output.flush();
    }
}
