package com.connect3.core;

import java.util.EnumMap;
import java.util.Map;

/**
 * Utility responsible for the four geometric symmetries of a rectangular board: identity,
 * left-right mirror, top-bottom mirror and the 180° rotation. The game rules are invariant under
 * all of them, so symmetric positions share one transposition entry.
 *
 * <p>Every symmetry is its own inverse, which lets the same permutation map a move into the
 * canonical frame and back out of it.
 */
public final class Symmetry {

    public static final int SYMMETRY_COUNT = 4;
    public static final int IDENTITY = 0;

    private static final Map<BoardSize, int[][]> PERMUTATIONS = new EnumMap<>(BoardSize.class);

    static {
        for (BoardSize size : BoardSize.values()) {
            int width = size.width();
            int height = size.height();
            int[][] permutations = new int[SYMMETRY_COUNT][size.cellCount()];
            for (int index = 0; index < size.cellCount(); index++) {
                int x = size.column(index);
                int y = size.row(index);
                int mirroredX = width - 1 - x;
                int mirroredY = height - 1 - y;
                permutations[0][index] = index;
                permutations[1][index] = mirroredX + y * width;
                permutations[2][index] = x + mirroredY * width;
                permutations[3][index] = mirroredX + mirroredY * width;
            }
            PERMUTATIONS.put(size, permutations);
        }
    }

    private Symmetry() {
    }

    /**
     * Returns the cell that {@code index} is mapped to by the symmetry.
     */
    public static int mapCell(BoardSize size, int symmetry, int index) {
        checkSymmetry(symmetry);
        return PERMUTATIONS.get(size)[symmetry][index];
    }

    /**
     * Applies the specified symmetry permutation to the provided bit mask.
     */
    public static long apply(BoardSize size, int symmetry, long bits) {
        checkSymmetry(symmetry);
        int[] permutation = PERMUTATIONS.get(size)[symmetry];
        long result = 0L;
        long remaining = bits;
        while (remaining != 0L) {
            int bit = Long.numberOfTrailingZeros(remaining);
            remaining &= remaining - 1;
            result |= 1L << permutation[bit];
        }
        return result;
    }

    /**
     * Applies the specified symmetry to both cells of a move.
     */
    public static Move apply(BoardSize size, int symmetry, Move move) {
        checkSymmetry(symmetry);
        int[] permutation = PERMUTATIONS.get(size)[symmetry];
        return new Move(permutation[move.source()], permutation[move.destination()]);
    }

    private static void checkSymmetry(int symmetry) {
        if (symmetry < 0 || symmetry >= SYMMETRY_COUNT) {
            throw new IllegalArgumentException("Symmetry index out of range: " + symmetry);
        }
    }
}
