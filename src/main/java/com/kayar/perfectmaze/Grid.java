package com.kayar.perfectmaze;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.stream.Stream;

/**
 * Rectangular grid of {@link Cell}s, indexed [row][col], that is carved into a perfect maze.
 * The entrance is the top-left cell and the exit the bottom-right cell.
 * <p>
 * Pixel geometry (cell size and drawing origin) is carried for renderers only;
 * generation and solving never read it.
 */
public final class Grid {

    public static final int DEFAULT_CELL_SIZE = 50;

    private final int rows;
    private final int cols;
    private final Cell[][] cells;

    private final int cellWidth;
    private final int cellHeight;
    private final int originX;
    private final int originY;

    private final Random random;
    private boolean generated;
    private boolean partiallyCarved;

    public Grid(int rows, int cols) {
        this(rows, cols, new Random());
    }

    public Grid(int rows, int cols, long seed) {
        this(rows, cols, new Random(seed));
    }

    public Grid(int rows, int cols, Random random) {
        this(rows, cols, DEFAULT_CELL_SIZE, DEFAULT_CELL_SIZE, 0, 0, random);
    }

    public Grid(int rows, int cols, int cellWidth, int cellHeight, int originX, int originY, Random random) {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive, got " + rows + "x" + cols);
        }
        if (cellWidth <= 0 || cellHeight <= 0) {
            throw new IllegalArgumentException("Cell size must be positive, got " + cellWidth + "x" + cellHeight);
        }
        this.rows = rows;
        this.cols = cols;
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
        this.originX = originX;
        this.originY = originY;
        this.random = Objects.requireNonNull(random, "random");

        cells = new Cell[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                cells[r][c] = new Cell(r, c);
            }
        }
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

    public Cell cell(int row, int col) {
        if (!inBounds(row, col)) {
            throw new IndexOutOfBoundsException("No cell at (" + row + "," + col + ") in " + rows + "x" + cols + " grid");
        }
        return cells[row][col];
    }

    public Cell entrance() {
        return cells[0][0];
    }

    public Cell exit() {
        return cells[rows - 1][cols - 1];
    }

    public boolean inBounds(int row, int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    public Optional<Cell> neighbor(Cell cell, Direction direction) {
        int r = cell.getRow() + direction.dRow();
        int c = cell.getCol() + direction.dCol();
        return inBounds(r, c) ? Optional.of(cells[r][c]) : Optional.empty();
    }

    /**
     * True when {@code cell} can step towards {@code direction}: the neighbour exists and
     * neither side of the shared edge has a wall.
     */
    public boolean isOpen(Cell cell, Direction direction) {
        if (cell.hasWall(direction)) {
            return false;
        }
        return neighbor(cell, direction)
                .map(n -> !n.hasWall(direction.opposite()))
                .orElse(false);
    }

    /** All cells in row-major order. */
    public Stream<Cell> cells() {
        return Arrays.stream(cells).flatMap(Arrays::stream);
    }

    public boolean isGenerated() {
        return generated;
    }

    /**
     * Carves this grid into a perfect maze without rendering.
     *
     * @throws IllegalStateException if the grid was already generated and not {@link #reset()}
     */
    public void generate() {
        generate(MazeRenderer.NONE);
    }

    /**
     * Carves this grid into a perfect maze, reporting every broken wall to {@code renderer}.
     *
     * @throws IllegalStateException if the grid was already generated, or a previous
     *                               generation was aborted, and the grid was not {@link #reset()}
     */
    public void generate(MazeRenderer renderer) {
        Objects.requireNonNull(renderer, "renderer");
        if (generated) {
            throw new IllegalStateException("Grid " + rows + "x" + cols + " is already generated; reset it first");
        }
        if (partiallyCarved) {
            throw new IllegalStateException("Grid " + rows + "x" + cols + " holds an aborted generation; reset it first");
        }
        // stays set if the renderer aborts carving
        partiallyCarved = true;
        MazeGenerator.carve(this, random, renderer);
        partiallyCarved = false;
        generated = true;
    }

    /**
     * Puts every wall back and clears all visitation marks. The random source keeps its
     * state, so the next generation differs from the previous one.
     */
    public void reset() {
        cells().forEach(cell -> {
            cell.restoreWalls();
            cell.setVisitedGeneration(false);
            cell.setVisitedSolve(false);
        });
        generated = false;
        partiallyCarved = false;
    }

    /** Clears the solver marks only; walls and generation state are left alone. */
    public void resetSolveState() {
        cells().forEach(cell -> cell.setVisitedSolve(false));
    }

    /**
     * Removes the wall between two adjacent cells on both sides.
     */
    void breakWall(Cell a, Cell b) {
        Direction d = Direction.between(a, b);
        a.setWall(d, false);
        b.setWall(d.opposite(), false);
    }

    /**
     * Number of adjacent cell pairs joined by a passage. A perfect maze has rows * cols - 1.
     */
    public int countOpenInternalWalls() {
        int open = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                Cell cell = cells[r][c];
                if (isOpen(cell, Direction.RIGHT)) open++;
                if (isOpen(cell, Direction.DOWN)) open++;
            }
        }
        return open;
    }
}
