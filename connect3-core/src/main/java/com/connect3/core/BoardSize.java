package com.connect3.core;

import java.util.ArrayList;
import java.util.List;

/**
 * The two supported board geometries together with their precomputed masks. Cells are indexed
 * row by row, {@code index = x + y * width}, so every board fits into a single {@code long}.
 */
public enum BoardSize {

    SMALL(5, 4,
            new int[][] {{0, 0}, {0, 2}, {4, 1}, {4, 3}},
            new int[][] {{0, 1}, {0, 3}, {4, 0}, {4, 2}}),
    LARGE(7, 6,
            new int[][] {{0, 1}, {0, 3}, {6, 2}, {6, 4}},
            new int[][] {{0, 2}, {0, 4}, {6, 1}, {6, 3}});

    public static final int WINNING_LENGTH = 3;

    private final int width;
    private final int height;
    private final long whiteStart;
    private final long blackStart;
    private final long[] neighbourMasks;
    private final long[] lineMasks;
    private final long[] pairMasks;
    private final int[] centreDistances;

    BoardSize(int width, int height, int[][] whiteCells, int[][] blackCells) {
        this.width = width;
        this.height = height;
        this.whiteStart = maskOf(width, whiteCells);
        this.blackStart = maskOf(width, blackCells);
        this.neighbourMasks = buildNeighbourMasks(width, height);
        this.lineMasks = buildRuns(width, height, WINNING_LENGTH);
        this.pairMasks = buildRuns(width, height, 2);
        this.centreDistances = buildCentreDistances(width, height);
    }

    /**
     * Parses a size name case-insensitively, e.g. {@code small}.
     *
     * @throws IllegalArgumentException if the name matches no size
     */
    public static BoardSize parse(String name) {
        for (BoardSize size : values()) {
            if (size.name().equalsIgnoreCase(name)) {
                return size;
            }
        }
        throw new IllegalArgumentException("Unknown board size: " + name);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int cellCount() {
        return width * height;
    }

    public int index(int x, int y) {
        if (!contains(x, y)) {
            throw new IllegalArgumentException("Cell (" + x + ", " + y + ") is outside the " + this + " board");
        }
        return x + y * width;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public int column(int index) {
        return index % width;
    }

    public int row(int index) {
        return index / width;
    }

    public long whiteStart() {
        return whiteStart;
    }

    public long blackStart() {
        return blackStart;
    }

    /**
     * Returns the mask of the up to eight cells surrounding {@code index}.
     */
    public long neighbours(int index) {
        return neighbourMasks[index];
    }

    /**
     * Returns every straight run of {@link #WINNING_LENGTH} cells.
     */
    public long[] lineMasks() {
        return lineMasks.clone();
    }

    /**
     * Returns every straight run of two adjacent cells.
     */
    public long[] pairMasks() {
        return pairMasks.clone();
    }

    /**
     * Returns the Manhattan distance from {@code index} to the board centre, measured in half
     * cells so that even dimensions stay integral.
     */
    public int centreDistance(int index) {
        return centreDistances[index];
    }

    /**
     * Returns {@code true} if the bits contain a complete winning line.
     */
    public boolean hasLine(long pieces) {
        for (long mask : lineMasks) {
            if ((pieces & mask) == mask) {
                return true;
            }
        }
        return false;
    }

    public int lineCount() {
        return lineMasks.length;
    }

    public long lineMask(int line) {
        return lineMasks[line];
    }

    public int pairCount() {
        return pairMasks.length;
    }

    public long pairMask(int pair) {
        return pairMasks[pair];
    }

    private static long maskOf(int width, int[][] cells) {
        long mask = 0L;
        for (int[] cell : cells) {
            mask |= 1L << (cell[0] + cell[1] * width);
        }
        return mask;
    }

    private static long[] buildNeighbourMasks(int width, int height) {
        long[] masks = new long[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                long mask = 0L;
                for (Direction direction : Direction.values()) {
                    int nx = x + direction.dx();
                    int ny = y + direction.dy();
                    if (nx >= 0 && nx < width && ny >= 0 && ny < height) {
                        mask |= 1L << (nx + ny * width);
                    }
                }
                masks[x + y * width] = mask;
            }
        }
        return masks;
    }

    private static long[] buildRuns(int width, int height, int length) {
        // E, S, SE and SW cover every straight line exactly once
        int[][] steps = {{1, 0}, {0, 1}, {1, 1}, {-1, 1}};
        List<Long> runs = new ArrayList<>();
        for (int[] step : steps) {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    int endX = x + step[0] * (length - 1);
                    int endY = y + step[1] * (length - 1);
                    if (endX < 0 || endX >= width || endY >= height) {
                        continue;
                    }
                    long mask = 0L;
                    for (int i = 0; i < length; i++) {
                        mask |= 1L << ((x + step[0] * i) + (y + step[1] * i) * width);
                    }
                    runs.add(mask);
                }
            }
        }
        return runs.stream().mapToLong(Long::longValue).toArray();
    }

    private static int[] buildCentreDistances(int width, int height) {
        int[] distances = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                distances[x + y * width] = Math.abs(2 * x - (width - 1)) + Math.abs(2 * y - (height - 1));
            }
        }
        return distances;
    }
}
