package com.kayar.perfectmaze;

/**
 * The four grid directions. Declaration order is the order the solver tries them in.
 */
public enum Direction {
    UP(-1, 0),
    DOWN(1, 0),
    LEFT(0, -1),
    RIGHT(0, 1);

    private final int dRow;
    private final int dCol;

    Direction(int dRow, int dCol) {
        this.dRow = dRow;
        this.dCol = dCol;
    }

    public int dRow() {
        return dRow;
    }

    public int dCol() {
        return dCol;
    }

    public Direction opposite() {
        return switch (this) {
            case UP -> DOWN;
            case DOWN -> UP;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
        };
    }

    /**
     * Direction leading from {@code from} to the adjacent cell {@code to}.
     */
    public static Direction between(Cell from, Cell to) {
        int dr = to.getRow() - from.getRow();
        int dc = to.getCol() - from.getCol();
        for (Direction d : values()) {
            if (d.dRow == dr && d.dCol == dc) {
                return d;
            }
        }
        throw new IllegalArgumentException("Cells are not adjacent: " + from + " and " + to);
    }
}
