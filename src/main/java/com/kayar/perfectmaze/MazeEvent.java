package com.kayar.perfectmaze;

/**
 * One recorded renderer callback. Coordinates are copied so a replay does not
 * depend on the live cells.
 */
public final class MazeEvent {

    public enum Type { WALL_BROKEN, MOVE, BACKTRACK }

    private final Type type;
    private final int fromRow;
    private final int fromCol;
    private final int toRow;
    private final int toCol;

    MazeEvent(Type type, Cell from, Cell to) {
        this.type = type;
        this.fromRow = from.getRow();
        this.fromCol = from.getCol();
        this.toRow = to.getRow();
        this.toCol = to.getCol();
    }

    public Type getType() {
        return type;
    }

    public int getFromRow() {
        return fromRow;
    }

    public int getFromCol() {
        return fromCol;
    }

    public int getToRow() {
        return toRow;
    }

    public int getToCol() {
        return toCol;
    }

    @Override
    public String toString() {
        return type + " (" + fromRow + "," + fromCol + ")->(" + toRow + "," + toCol + ")";
    }
}
