package com.kayar.perfectmaze;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Depth-first search from the entrance to the exit of a {@link Grid}.
 * <p>
 * Directions are tried in {@link Direction} declaration order: up, down, left, right.
 * With the same walls the same path is found every time. The search keeps its own
 * stack of frames instead of recursing, so grid size is bounded by heap only.
 * <p>
 * Solving marks cells with the solve flag and never touches walls. Call
 * {@link Grid#resetSolveState()} (or use {@link #solveFresh(Grid)}) before solving the
 * same grid again.
 */
public class MazeSolver {

    private static final Logger log = LoggerFactory.getLogger(MazeSolver.class);
    private static final Direction[] ORDER = Direction.values();

    private final MazeRenderer renderer;
    private volatile boolean cancelled;

    public MazeSolver() {
        this(MazeRenderer.NONE);
    }

    public MazeSolver(MazeRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    /**
     * Stops a running {@link #solve(Grid)} before its next step. Safe to call from a
     * renderer callback or from another thread. A cancel issued while no run is active
     * stops the next run before its first step. The request is cleared when a run ends.
     */
    public void cancel() {
        cancelled = true;
    }

    public SolveResult solveFresh(Grid grid) {
        grid.resetSolveState();
        return solve(grid);
    }

    public SolveResult solve(Grid grid) {
        try {
            return search(grid);
        } finally {
            cancelled = false;
        }
    }

    private SolveResult search(Grid grid) {
        Cell exit = grid.exit();
        int steps = 0;
        int backtracks = 0;

        Deque<Frame> stack = new ArrayDeque<>();
        Cell start = grid.entrance();
        start.setVisitedSolve(true);
        stack.push(new Frame(start));

        while (!stack.isEmpty()) {
            if (cancelled) {
                log.debug("Solve cancelled after {} steps", steps);
                return SolveResult.cancelled(steps, backtracks);
            }
            Frame frame = stack.peek();
            Cell current = frame.cell;
            if (current == exit) {
                List<Cell> path = new ArrayList<>(stack.size());
                for (Frame f : stack) {
                    path.add(f.cell);
                }
                Collections.reverse(path);
                log.debug("Solved {}x{} maze: path of {} cells, {} steps, {} backtracks",
                        grid.getRows(), grid.getCols(), path.size(), steps, backtracks);
                return SolveResult.solved(path, steps, backtracks);
            }

            if (frame.next < ORDER.length) {
                Direction d = ORDER[frame.next++];
                if (!grid.isOpen(current, d)) {
                    continue;
                }
                Cell next = grid.neighbor(current, d).orElseThrow();
                if (next.isVisitedSolve()) {
                    continue;
                }
                renderer.onMove(current, next, false);
                steps++;
                next.setVisitedSolve(true);
                stack.push(new Frame(next));
            } else {
                // dead end, undo the move that led here
                stack.pop();
                Frame parent = stack.peek();
                if (parent != null) {
                    renderer.onMove(parent.cell, current, true);
                    backtracks++;
                }
            }
        }

        log.debug("No path in {}x{} grid after {} steps", grid.getRows(), grid.getCols(), steps);
        return SolveResult.notSolved(steps, backtracks);
    }

    private static final class Frame {
        final Cell cell;
        int next;

        Frame(Cell cell) {
            this.cell = cell;
        }
    }
}
