package com.kayar.perfectmaze;

/**
 * A single square of the maze grid.
 * Wall flags: true = wall, false = passage.
 */
public final class Cell {

    private final int row;
    private final int col;

    private boolean wallTop = true;
    private boolean wallBottom = true;
    private boolean wallLeft = true;
    private boolean wallRight = true;

    // visitation marks, one per phase
    private boolean visitedGeneration;
    private boolean visitedSolve;

    Cell(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public boolean hasWallTop() {
        return wallTop;
    }

    public boolean hasWallBottom() {
        return wallBottom;
    }

    public boolean hasWallLeft() {
        return wallLeft;
    }

    public boolean hasWallRight() {
        return wallRight;
    }

    public boolean hasWall(Direction direction) {
        return switch (direction) {
            case UP -> wallTop;
            case DOWN -> wallBottom;
            case LEFT -> wallLeft;
            case RIGHT -> wallRight;
        };
    }

    void setWall(Direction direction, boolean present) {
        switch (direction) {
            case UP -> wallTop = present;
            case DOWN -> wallBottom = present;
            case LEFT -> wallLeft = present;
            case RIGHT -> wallRight = present;
        }
    }

    public boolean isVisitedGeneration() {
        return visitedGeneration;
    }

    void setVisitedGeneration(boolean visitedGeneration) {
        this.visitedGeneration = visitedGeneration;
    }

    public boolean isVisitedSolve() {
        return visitedSolve;
    }

    void setVisitedSolve(boolean visitedSolve) {
        this.visitedSolve = visitedSolve;
    }

    void restoreWalls() {
        wallTop = true;
        wallBottom = true;
        wallLeft = true;
        wallRight = true;
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + ")";
    }
}
