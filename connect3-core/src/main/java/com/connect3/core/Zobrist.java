package com.connect3.core;

import java.util.EnumMap;
import java.util.Map;
import java.util.SplittableRandom;

/**
 * Zobrist keys for position fingerprints.
 *
 * <p>Every (cell, colour) pair owns a random 64-bit number and the key of a position is the XOR
 * of its occupied cells plus a side-to-move key. The generator is seeded so fingerprints are
 * stable across processes, which the persistent transposition table relies on. Each board size
 * owns its own key set.
 */
final class Zobrist {

    private static final long SEED = 0x436F6E6E65637433L;
    private static final Map<BoardSize, Keys> KEYS = new EnumMap<>(BoardSize.class);

    static {
        SplittableRandom random = new SplittableRandom(SEED);
        for (BoardSize size : BoardSize.values()) {
            long[] white = new long[size.cellCount()];
            long[] black = new long[size.cellCount()];
            for (int cell = 0; cell < size.cellCount(); cell++) {
                white[cell] = random.nextLong();
                black[cell] = random.nextLong();
            }
            KEYS.put(size, new Keys(white, black, random.nextLong()));
        }
    }

    private Zobrist() {
    }

    static long hash(BoardSize size, long whiteBits, long blackBits, Player sideToMove) {
        Keys keys = KEYS.get(size);
        long hash = sideToMove == Player.BLACK ? keys.blackToMove() : 0L;
        hash ^= xorCells(keys.white(), whiteBits);
        hash ^= xorCells(keys.black(), blackBits);
        return hash;
    }

    private static long xorCells(long[] cellKeys, long bits) {
        long hash = 0L;
        long remaining = bits;
        while (remaining != 0L) {
            int cell = Long.numberOfTrailingZeros(remaining);
            remaining &= remaining - 1;
            hash ^= cellKeys[cell];
        }
        return hash;
    }

    private record Keys(long[] white, long[] black, long blackToMove) {
    }
}
