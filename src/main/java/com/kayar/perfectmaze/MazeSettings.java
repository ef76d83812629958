package com.kayar.perfectmaze;

import java.util.Random;

/**
 * Validated maze configuration shared by the command line and the viewer.
 */
public final class MazeSettings {

    private final int rows;
    private final int cols;
    private final int cellWidth;
    private final int cellHeight;
    private final int originX;
    private final int originY;
    private final Long seed; // null = unseeded
    private final long stepMillis;

    public MazeSettings(int rows, int cols, int cellWidth, int cellHeight,
                        int originX, int originY, Long seed, long stepMillis) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Maze dimensions must be positive, got " + rows + "x" + cols);
        }
        if (cellWidth <= 0 || cellHeight <= 0) {
            throw new IllegalArgumentException("Cell size must be positive, got " + cellWidth + "x" + cellHeight);
        }
        if (originX < 0 || originY < 0) {
            throw new IllegalArgumentException("Drawing origin must not be negative, got " + originX + "," + originY);
        }
        if (stepMillis < 0) {
            throw new IllegalArgumentException("Step delay must not be negative, got " + stepMillis);
        }
        this.rows = rows;
        this.cols = cols;
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
        this.originX = originX;
        this.originY = originY;
        this.seed = seed;
        this.stepMillis = stepMillis;
    }

    public Grid newGrid() {
        Random rnd = seed == null ? new Random() : new Random(seed);
        return new Grid(rows, cols, cellWidth, cellHeight, originX, originY, rnd);
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public int getCellWidth() {
        return cellWidth;
    }

    public int getCellHeight() {
        return cellHeight;
    }

    public int getOriginX() {
        return originX;
    }

    public int getOriginY() {
        return originY;
    }

    public Long getSeed() {
        return seed;
    }

    public long getStepMillis() {
        return stepMillis;
    }

    /** Drawing area needed for the grid plus a margin equal to the origin on each side. */
    public int sceneWidth() {
        return originX * 2 + cols * cellWidth;
    }

    public int sceneHeight() {
        return originY * 2 + rows * cellHeight;
    }

    @Override
    public String toString() {
        return rows + "x" + cols + " maze, cells " + cellWidth + "x" + cellHeight
                + ", seed " + (seed == null ? "random" : seed) + ", step " + stepMillis + "ms";
    }
}
