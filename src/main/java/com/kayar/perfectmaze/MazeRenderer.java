package com.kayar.perfectmaze;

/**
 * Observer of generation and solving steps. Implementations only watch; they
 * must not change grid state. Exceptions thrown here reach the caller of
 * {@link Grid#generate(MazeRenderer)} or {@link MazeSolver#solve(Grid)} unchanged.
 */
public interface MazeRenderer {

    /** Renderer that ignores every step. */
    MazeRenderer NONE = new MazeRenderer() {
        @Override
        public void onWallBroken(Cell a, Cell b) {
        }

        @Override
        public void onMove(Cell from, Cell to, boolean backtrack) {
        }
    };

    /**
     * Called after the wall shared by two adjacent cells was removed during generation.
     */
    void onWallBroken(Cell a, Cell b);

    /**
     * Called by the solver for each step; {@code backtrack} is true when the step
     * from {@code from} into {@code to} is being undone.
     */
    void onMove(Cell from, Cell to, boolean backtrack);
}
