package com.kayar.perfectmaze;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Randomized depth-first backtracker.
 * Uses an explicit stack so large grids cannot overflow the call stack.
 */
final class MazeGenerator {

    private static final Logger log = LoggerFactory.getLogger(MazeGenerator.class);

    private MazeGenerator() {}

    static void carve(Grid grid, Random rnd, MazeRenderer renderer) {
        Cell start = grid.entrance();
        start.setVisitedGeneration(true);
        Deque<Cell> stack = new ArrayDeque<>();
        stack.push(start);
        int broken = 0;
        while (!stack.isEmpty()) {
            Cell current = stack.peek();
            List<Cell> neighbors = unvisitedNeighbors(grid, current);
            if (neighbors.isEmpty()) {
                stack.pop();
                continue;
            }
            Collections.shuffle(neighbors, rnd);
            Cell next = neighbors.get(0);
            grid.breakWall(current, next);
            next.setVisitedGeneration(true);
            stack.push(next);
            broken++;
            renderer.onWallBroken(current, next);
        }

        // open entrance and exit on the outer boundary
        grid.entrance().setWall(Direction.UP, false);
        grid.exit().setWall(Direction.DOWN, false);

        grid.cells().forEach(cell -> cell.setVisitedGeneration(false));

        log.debug("Carved {}x{} maze, {} walls broken", grid.getRows(), grid.getCols(), broken);
    }

    private static List<Cell> unvisitedNeighbors(Grid grid, Cell cell) {
        List<Cell> n = new ArrayList<>(4);
        for (Direction d : Direction.values()) {
            grid.neighbor(cell, d)
                    .filter(c -> !c.isVisitedGeneration())
                    .ifPresent(n::add);
        }
        return n;
    }
}
