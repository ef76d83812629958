package com.kayar.perfectmaze;

import java.util.List;

/**
 * Outcome of a solver run. A grid without a path is a normal result, not an error.
 */
public final class SolveResult {

    private final boolean solved;
    private final boolean cancelled;
    private final List<Cell> path;
    private final int steps;
    private final int backtracks;

    private SolveResult(boolean solved, boolean cancelled, List<Cell> path, int steps, int backtracks) {
        this.solved = solved;
        this.cancelled = cancelled;
        this.path = List.copyOf(path);
        this.steps = steps;
        this.backtracks = backtracks;
    }

    static SolveResult solved(List<Cell> path, int steps, int backtracks) {
        return new SolveResult(true, false, path, steps, backtracks);
    }

    static SolveResult notSolved(int steps, int backtracks) {
        return new SolveResult(false, false, List.of(), steps, backtracks);
    }

    static SolveResult cancelled(int steps, int backtracks) {
        return new SolveResult(false, true, List.of(), steps, backtracks);
    }

    public boolean isSolved() {
        return solved;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /** Cells from entrance to exit; empty unless solved. */
    public List<Cell> path() {
        return path;
    }

    /** Forward moves taken, including those later undone. */
    public int steps() {
        return steps;
    }

    public int backtracks() {
        return backtracks;
    }

    @Override
    public String toString() {
        if (solved) {
            return "solved in " + path.size() + " cells (" + steps + " steps, " + backtracks + " backtracks)";
        }
        return (cancelled ? "cancelled" : "no path") + " after " + steps + " steps, " + backtracks + " backtracks";
    }
}
