package com.kayar.perfectmaze;

import javafx.scene.canvas.GraphicsContext;
import javafx.scene.paint.Color;

/**
 * Draws a grid on a JavaFX canvas using the grid's pixel geometry.
 * Must be used on the JavaFX application thread.
 */
public class MazeCanvasRenderer implements MazeRenderer {

    static final Color BACKGROUND = Color.web("#2c2c2e");
    static final Color WALL = Color.WHITE;
    static final Color MOVE = Color.RED;
    static final Color UNDO = Color.GRAY;
    private static final double LINE_WIDTH = 2;

    private final GraphicsContext g;
    private final Grid grid;

    public MazeCanvasRenderer(GraphicsContext g, Grid grid) {
        this.g = g;
        this.grid = grid;
    }

    /** Clears the canvas and draws every cell fully walled. */
    public void drawClosedGrid() {
        g.setFill(BACKGROUND);
        g.fillRect(0, 0, g.getCanvas().getWidth(), g.getCanvas().getHeight());
        g.setLineWidth(LINE_WIDTH);
        g.setStroke(WALL);
        for (int r = 0; r < grid.getRows(); r++) {
            for (int c = 0; c < grid.getCols(); c++) {
                double x1 = x(c), y1 = y(r);
                g.strokeRect(x1, y1, grid.getCellWidth(), grid.getCellHeight());
            }
        }
    }

    /** Clears the canvas and draws the grid's current walls. */
    public void drawGrid() {
        g.setFill(BACKGROUND);
        g.fillRect(0, 0, g.getCanvas().getWidth(), g.getCanvas().getHeight());
        grid.cells().forEach(cell -> {
            for (Direction d : Direction.values()) {
                edge(cell, d, cell.hasWall(d) ? WALL : BACKGROUND);
            }
        });
    }

    /** Erases the outer edges of the entrance and exit. */
    public void drawOpenings() {
        edge(grid.entrance(), Direction.UP, BACKGROUND);
        edge(grid.exit(), Direction.DOWN, BACKGROUND);
    }

    @Override
    public void onWallBroken(Cell a, Cell b) {
        edge(a, Direction.between(a, b), BACKGROUND);
    }

    @Override
    public void onMove(Cell from, Cell to, boolean backtrack) {
        g.setLineWidth(LINE_WIDTH);
        g.setStroke(backtrack ? UNDO : MOVE);
        g.strokeLine(centerX(from), centerY(from), centerX(to), centerY(to));
    }

    /** Replays one recorded step. */
    public void apply(MazeEvent event) {
        Cell from = grid.cell(event.getFromRow(), event.getFromCol());
        Cell to = grid.cell(event.getToRow(), event.getToCol());
        switch (event.getType()) {
            case WALL_BROKEN -> onWallBroken(from, to);
            case MOVE -> onMove(from, to, false);
            case BACKTRACK -> onMove(from, to, true);
        }
    }

    private void edge(Cell cell, Direction side, Color color) {
        double x1 = x(cell.getCol());
        double y1 = y(cell.getRow());
        double x2 = x1 + grid.getCellWidth();
        double y2 = y1 + grid.getCellHeight();
        g.setLineWidth(LINE_WIDTH);
        g.setStroke(color);
        switch (side) {
            case UP -> g.strokeLine(x1, y1, x2, y1);
            case DOWN -> g.strokeLine(x1, y2, x2, y2);
            case LEFT -> g.strokeLine(x1, y1, x1, y2);
            case RIGHT -> g.strokeLine(x2, y1, x2, y2);
        }
        // erasing an edge also clips the neighbouring walls' end points, restore the corners
        if (color == BACKGROUND) {
            g.setFill(WALL);
            double h = LINE_WIDTH / 2;
            switch (side) {
                case UP -> { corner(x1, y1, h); corner(x2, y1, h); }
                case DOWN -> { corner(x1, y2, h); corner(x2, y2, h); }
                case LEFT -> { corner(x1, y1, h); corner(x1, y2, h); }
                case RIGHT -> { corner(x2, y1, h); corner(x2, y2, h); }
            }
        }
    }

    private void corner(double x, double y, double h) {
        g.fillRect(x - h, y - h, LINE_WIDTH, LINE_WIDTH);
    }

    private double x(int col) {
        return grid.getOriginX() + (double) col * grid.getCellWidth();
    }

    private double y(int row) {
        return grid.getOriginY() + (double) row * grid.getCellHeight();
    }

    private double centerX(Cell cell) {
        return x(cell.getCol()) + grid.getCellWidth() / 2.0;
    }

    private double centerY(Cell cell) {
        return y(cell.getRow()) + grid.getCellHeight() / 2.0;
    }
}
