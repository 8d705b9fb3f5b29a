package com.connect3.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class GameRecordTest {

    @Test
    void replaysThePositionAfterEveryPly() {
        BoardSize size = BoardSize.SMALL;
        Move first = Move.of(size, 0, 0, Direction.E);
        Move second = Move.of(size, 4, 0, Direction.SW);
        GameRecord record = new GameRecord(Board.initial(size),
                List.of(new GameRecord.Ply(first, 10), new GameRecord.Ply(second, -5)),
                GameResult.draw(GameResult.Termination.PLY_CAP));

        List<Board> positions = record.positions();

        assertEquals(2, record.length());
        assertEquals(2, positions.size());
        assertTrue(positions.get(0).samePosition(Board.initial(size).apply(first)));
        assertTrue(positions.get(1).samePosition(Board.initial(size).apply(first).apply(second)));
    }

    @Test
    void copiesThePlyList() {
        List<GameRecord.Ply> plies = new ArrayList<>();
        plies.add(new GameRecord.Ply(Move.of(BoardSize.SMALL, 0, 0, Direction.E), 0));
        GameRecord record = new GameRecord(Board.initial(BoardSize.SMALL), plies,
                GameResult.win(Player.BLACK, GameResult.Termination.NO_LEGAL_MOVE));

        plies.clear();

        assertEquals(1, record.length());
    }

    @Test
    void resultsMustBeConsistent() {
        assertThrows(IllegalArgumentException.class,
                () -> new GameResult(null, GameResult.Termination.THREE_IN_A_ROW));
        assertThrows(IllegalArgumentException.class,
                () -> new GameResult(Player.WHITE, GameResult.Termination.REPETITION));
        GameResult win = GameResult.win(Player.WHITE, GameResult.Termination.THREE_IN_A_ROW);
        assertEquals(1, win.outcomeFor(Player.WHITE));
        assertEquals(-1, win.outcomeFor(Player.BLACK));
        assertEquals(0, GameResult.draw(GameResult.Termination.REPETITION).outcomeFor(Player.WHITE));
    }
}
