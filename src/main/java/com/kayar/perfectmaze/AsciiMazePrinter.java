package com.kayar.perfectmaze;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Prints a grid as text. A 3x5 maze with its path looks like this:
 *
 * <pre>
 * +  +--+--+--+--+
 * | *|        |  |
 * +  +--+  +--+  +
 * | *  *  *|     |
 * +--+--+  +--+  +
 * |       *  *  *|
 * +--+--+--+--+  +
 * </pre>
 */
public final class AsciiMazePrinter {

    private AsciiMazePrinter() {}

    public static String toString(Grid grid) {
        return toString(grid, List.of());
    }

    public static String toString(Grid grid, Collection<Cell> path) {
        StringWriter sw = new StringWriter();
        try (PrintWriter pw = new PrintWriter(sw)) {
            print(grid, path, pw);
        }
        return sw.toString();
    }

    public static void print(Grid grid, Collection<Cell> path, PrintWriter pw) {
        Set<Cell> marked = new HashSet<>(path);
        StringBuilder line = new StringBuilder();
        for (int r = 0; r < grid.getRows(); r++) {
            line.setLength(0);
            for (int c = 0; c < grid.getCols(); c++) {
                line.append('+').append(grid.cell(r, c).hasWallTop() ? "--" : "  ");
            }
            pw.println(line.append('+'));

            line.setLength(0);
            for (int c = 0; c < grid.getCols(); c++) {
                Cell cell = grid.cell(r, c);
                line.append(cell.hasWallLeft() ? '|' : ' ');
                line.append(marked.contains(cell) ? " *" : "  ");
            }
            line.append(grid.cell(r, grid.getCols() - 1).hasWallRight() ? '|' : ' ');
            pw.println(line);
        }
        line.setLength(0);
        for (int c = 0; c < grid.getCols(); c++) {
            line.append('+').append(grid.cell(grid.getRows() - 1, c).hasWallBottom() ? "--" : "  ");
        }
        pw.println(line.append('+'));
        pw.flush();
    }
}
