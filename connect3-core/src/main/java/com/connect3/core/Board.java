package com.connect3.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable bitboard representation of a Dynamic Connect-3 position.
 * White and black pieces occupy one bit each in two {@code long} values; the board also tracks
 * whose turn it is, the number of plies played and the move history.
 *
 * <p>Applying a move never mutates the receiver. The history is a persistent list, so a search
 * can keep every explored child around without copying the parent's moves.
 */
public final class Board {

    private final BoardSize size;
    private final long white;
    private final long black;
    private final Player sideToMove;
    private final MoveHistory history;
    private final long fingerprint;
    private final int canonicalSymmetry;

    private Board(BoardSize size, long white, long black, Player sideToMove, MoveHistory history) {
        this.size = size;
        this.white = white;
        this.black = black;
        this.sideToMove = sideToMove;
        this.history = history;

        long best = 0L;
        int bestSymmetry = -1;
        for (int symmetry = 0; symmetry < Symmetry.SYMMETRY_COUNT; symmetry++) {
            long hash = Zobrist.hash(size, Symmetry.apply(size, symmetry, white),
                    Symmetry.apply(size, symmetry, black), sideToMove);
            if (bestSymmetry < 0 || hash < best) {
                best = hash;
                bestSymmetry = symmetry;
            }
        }
        this.fingerprint = best;
        this.canonicalSymmetry = bestSymmetry;
    }

    /**
     * Creates the starting position for the given size with white to move.
     */
    public static Board initial(BoardSize size) {
        Objects.requireNonNull(size, "size");
        return new Board(size, size.whiteStart(), size.blackStart(), Player.WHITE, MoveHistory.EMPTY);
    }

    /**
     * Creates an arbitrary position with an empty history.
     *
     * @throws IllegalArgumentException if the bitboards overlap or leave the board
     */
    public static Board of(BoardSize size, long white, long black, Player sideToMove) {
        Objects.requireNonNull(size, "size");
        Objects.requireNonNull(sideToMove, "sideToMove");
        long allCells = size.cellCount() == 64 ? -1L : (1L << size.cellCount()) - 1;
        if ((white & black) != 0L) {
            throw new IllegalArgumentException("White and black pieces overlap");
        }
        if (((white | black) & ~allCells) != 0L) {
            throw new IllegalArgumentException("Pieces lie outside the " + size + " board");
        }
        return new Board(size, white, black, sideToMove, MoveHistory.EMPTY);
    }

    /**
     * Creates a position from one string per row, using {@code W} for white, {@code B} for black
     * and {@code .} for an empty cell.
     */
    public static Board fromRows(BoardSize size, Player sideToMove, String... rows) {
        if (rows.length != size.height()) {
            throw new IllegalArgumentException("Expected " + size.height() + " rows but got " + rows.length);
        }
        long white = 0L;
        long black = 0L;
        for (int y = 0; y < rows.length; y++) {
            String row = rows[y];
            if (row.length() != size.width()) {
                throw new IllegalArgumentException("Row " + y + " must have " + size.width() + " cells: " + row);
            }
            for (int x = 0; x < row.length(); x++) {
                char c = row.charAt(x);
                long bit = 1L << size.index(x, y);
                if (c == 'W') {
                    white |= bit;
                } else if (c == 'B') {
                    black |= bit;
                } else if (c != '.') {
                    throw new IllegalArgumentException("Unknown cell marker '" + c + "' in row " + y);
                }
            }
        }
        return of(size, white, black, sideToMove);
    }

    public BoardSize size() {
        return size;
    }

    public Player sideToMove() {
        return sideToMove;
    }

    /**
     * Returns the number of moves applied since this position was created.
     */
    public int ply() {
        return history.length();
    }

    /**
     * Returns the moves applied so far, oldest first.
     */
    public List<Move> history() {
        return history.toList();
    }

    /**
     * Returns the most recent move, or {@code null} for a freshly created position.
     */
    public Move lastMove() {
        return history.last();
    }

    public long whiteBits() {
        return white;
    }

    public long blackBits() {
        return black;
    }

    public long pieces(Player player) {
        return player == Player.WHITE ? white : black;
    }

    public int countPieces(Player player) {
        return Long.bitCount(pieces(player));
    }

    public long emptyCells() {
        long allCells = (1L << size.cellCount()) - 1;
        return ~(white | black) & allCells;
    }

    public boolean isEmpty(int index) {
        checkIndex(index);
        return ((white | black) & (1L << index)) == 0L;
    }

    /**
     * Returns the owner of the cell, or {@code null} if it is empty.
     */
    public Player owner(int index) {
        checkIndex(index);
        long bit = 1L << index;
        if ((white & bit) != 0L) {
            return Player.WHITE;
        }
        if ((black & bit) != 0L) {
            return Player.BLACK;
        }
        return null;
    }

    /**
     * Enumerates all legal moves for the side to move, ordered by source cell and then by
     * {@link Direction} order.
     */
    public List<Move> legalMoves() {
        long own = pieces(sideToMove);
        long empty = emptyCells();
        List<Move> moves = new ArrayList<>();
        while (own != 0L) {
            int source = Long.numberOfTrailingZeros(own);
            own &= own - 1;
            long targets = size.neighbours(source) & empty;
            if (targets == 0L) {
                continue;
            }
            int x = size.column(source);
            int y = size.row(source);
            for (Direction direction : Direction.values()) {
                int nx = x + direction.dx();
                int ny = y + direction.dy();
                if (!size.contains(nx, ny)) {
                    continue;
                }
                int destination = size.index(nx, ny);
                if ((targets & (1L << destination)) != 0L) {
                    moves.add(new Move(source, destination));
                }
            }
        }
        return Collections.unmodifiableList(moves);
    }

    /**
     * Returns the number of moves the given side could make if it were its turn.
     */
    public int mobility(Player player) {
        long own = pieces(player);
        long empty = emptyCells();
        int count = 0;
        while (own != 0L) {
            int source = Long.numberOfTrailingZeros(own);
            own &= own - 1;
            count += Long.bitCount(size.neighbours(source) & empty);
        }
        return count;
    }

    public boolean isLegal(Move move) {
        if (move == null || move.source() >= size.cellCount() || move.destination() >= size.cellCount()) {
            return false;
        }
        return (pieces(sideToMove) & (1L << move.source())) != 0L
                && (emptyCells() & (1L << move.destination())) != 0L
                && (size.neighbours(move.source()) & (1L << move.destination())) != 0L;
    }

    /**
     * Returns a new board with the move applied and the turn passed to the opponent.
     *
     * @throws IllegalArgumentException if the move is not legal in this position
     */
    public Board apply(Move move) {
        Objects.requireNonNull(move, "move");
        if (!isLegal(move)) {
            throw new IllegalArgumentException("Illegal move for " + sideToMove + ": " + describe(move));
        }
        long relocation = (1L << move.source()) | (1L << move.destination());
        long nextWhite = sideToMove == Player.WHITE ? white ^ relocation : white;
        long nextBlack = sideToMove == Player.BLACK ? black ^ relocation : black;
        return new Board(size, nextWhite, nextBlack, sideToMove.opponent(), history.append(move));
    }

    /**
     * Returns the side holding three pieces in a straight line, or {@code null} if neither does.
     * The side that just moved is checked first.
     */
    public Player winner() {
        Player justMoved = sideToMove.opponent();
        if (size.hasLine(pieces(justMoved))) {
            return justMoved;
        }
        if (size.hasLine(pieces(sideToMove))) {
            return sideToMove;
        }
        return null;
    }

    public boolean isWon() {
        return winner() != null;
    }

    /**
     * Returns the canonical fingerprint of the grid and the side to move. Positions that differ
     * only by a board symmetry, or that were reached through different move orders, share it.
     */
    public long fingerprint() {
        return fingerprint;
    }

    /**
     * Returns the symmetry that maps this board onto the frame in which {@link #fingerprint()}
     * was computed.
     */
    public int canonicalSymmetry() {
        return canonicalSymmetry;
    }

    /**
     * Returns {@code true} if both boards have the same size, pieces and side to move.
     */
    public boolean samePosition(Board other) {
        return other != null && size == other.size && white == other.white && black == other.black
                && sideToMove == other.sideToMove;
    }

    private String describe(Move move) {
        if (move.source() < size.cellCount() && move.destination() < size.cellCount()
                && (size.neighbours(move.source()) & (1L << move.destination())) != 0L) {
            return move.toNotation(size);
        }
        return move.toString();
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size.cellCount()) {
            throw new IllegalArgumentException("Cell index out of range: " + index);
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (int y = 0; y < size.height(); y++) {
            for (int x = 0; x < size.width(); x++) {
                Player owner = owner(size.index(x, y));
                builder.append(owner == null ? '.' : owner == Player.WHITE ? 'W' : 'B');
            }
            builder.append('\n');
        }
        builder.append(sideToMove).append(" to move");
        return builder.toString();
    }
}
