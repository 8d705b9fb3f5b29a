package com.connect3.core;

import java.util.Locale;

/**
 * Relocation of a piece from {@code source} to the adjacent cell {@code destination}.
 *
 * <p>Moves are written as the 1-based column and row of the source followed by the compass
 * direction, for example {@code 11E} or {@code 23SW}.
 *
 * @param source      cell index of the moving piece
 * @param destination cell index the piece moves to
 */
public record Move(int source, int destination) {

    /**
     * Encoded value that stands for "no move" in persisted data.
     */
    public static final int NONE = -1;

    private static final int CELL_LIMIT = 64;

    public Move {
        if (source < 0 || source >= CELL_LIMIT || destination < 0 || destination >= CELL_LIMIT) {
            throw new IllegalArgumentException("Cell index out of range: " + source + " -> " + destination);
        }
        if (source == destination) {
            throw new IllegalArgumentException("Source and destination must differ: " + source);
        }
    }

    public static Move of(BoardSize size, int x, int y, Direction direction) {
        return new Move(size.index(x, y), size.index(x + direction.dx(), y + direction.dy()));
    }

    /**
     * Packs this move into a single non-negative integer.
     */
    public int encode() {
        return source * CELL_LIMIT + destination;
    }

    /**
     * Reverses {@link #encode()}. Returns {@code null} for {@link #NONE}.
     *
     * @throws IllegalArgumentException if the value is not a valid encoding
     */
    public static Move decode(int encoded) {
        if (encoded == NONE) {
            return null;
        }
        if (encoded < 0 || encoded >= CELL_LIMIT * CELL_LIMIT) {
            throw new IllegalArgumentException("Invalid move encoding: " + encoded);
        }
        return new Move(encoded / CELL_LIMIT, encoded % CELL_LIMIT);
    }

    /**
     * Returns {@code true} if {@code encoded} is {@link #NONE} or a value {@link #decode(int)}
     * accepts.
     */
    public static boolean isValidEncoding(int encoded) {
        if (encoded == NONE) {
            return true;
        }
        return encoded >= 0 && encoded < CELL_LIMIT * CELL_LIMIT && encoded / CELL_LIMIT != encoded % CELL_LIMIT;
    }

    public Direction direction(BoardSize size) {
        int dx = size.column(destination) - size.column(source);
        int dy = size.row(destination) - size.row(source);
        Direction direction = Direction.of(dx, dy);
        if (direction == null) {
            throw new IllegalStateException("Cells " + source + " and " + destination + " are not adjacent");
        }
        return direction;
    }

    public String toNotation(BoardSize size) {
        return String.valueOf(size.column(source) + 1) + (size.row(source) + 1) + direction(size).name();
    }

    /**
     * Parses the text notation produced by {@link #toNotation(BoardSize)}.
     *
     * @throws IllegalArgumentException if the text is malformed or leaves the board
     */
    public static Move parse(String text, BoardSize size) {
        if (text == null) {
            throw new IllegalArgumentException("Move text is missing");
        }
        String trimmed = text.trim().toUpperCase(Locale.ROOT);
        if (trimmed.length() < 3 || trimmed.length() > 4
                || !Character.isDigit(trimmed.charAt(0)) || !Character.isDigit(trimmed.charAt(1))) {
            throw new IllegalArgumentException("Invalid move: " + text);
        }
        int x = trimmed.charAt(0) - '1';
        int y = trimmed.charAt(1) - '1';
        Direction direction;
        try {
            direction = Direction.valueOf(trimmed.substring(2));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Invalid direction in move: " + text, ex);
        }
        if (!size.contains(x, y) || !size.contains(x + direction.dx(), y + direction.dy())) {
            throw new IllegalArgumentException("Move leaves the board: " + text);
        }
        return of(size, x, y, direction);
    }
}
