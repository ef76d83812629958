package com.kayar.perfectmaze;

import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

public class MazeGeneratorTest {

    private static final int[][] SIZES = {{1, 1}, {1, 4}, {4, 1}, {2, 2}, {3, 5}, {10, 14}, {17, 9}, {40, 40}};

    /**
     * A connected grid with exactly cells - 1 passages is a spanning tree.
     */
    @Test
    public void testGeneratedGridIsSpanningTree() {
        for (int[] size : SIZES) {
            for (long seed = 0; seed < 10; seed++) {
                var grid = new Grid(size[0], size[1], seed);
                grid.generate();
                int cells = size[0] * size[1];
                assertEquals(cells - 1, grid.countOpenInternalWalls(),
                             "passages in " + size[0] + "x" + size[1] + " seed " + seed);
                assertEquals(cells, reachableFromEntrance(grid),
                             "reachable cells in " + size[0] + "x" + size[1] + " seed " + seed);
            }
        }
    }

    @Test
    public void testEntranceAndExitAreOpened() {
        for (long seed = 0; seed < 20; seed++) {
            var grid = new Grid(6, 9, seed);
            grid.generate();
            assertFalse(grid.entrance().hasWallTop());
            assertFalse(grid.exit().hasWallBottom());
        }
    }

    @Test
    public void testOtherBoundaryWallsStay() {
        var grid = new Grid(7, 5, 99L);
        grid.generate();
        for (int c = 0; c < grid.getCols(); c++) {
            if (c != 0) assertTrue(grid.cell(0, c).hasWallTop());
            if (c != grid.getCols() - 1) assertTrue(grid.cell(grid.getRows() - 1, c).hasWallBottom());
        }
        for (int r = 0; r < grid.getRows(); r++) {
            assertTrue(grid.cell(r, 0).hasWallLeft());
            assertTrue(grid.cell(r, grid.getCols() - 1).hasWallRight());
        }
    }

    @Test
    public void testSameSeedGivesIdenticalWalls() {
        var a = new Grid(12, 15, 1234L);
        var b = new Grid(12, 15, 1234L);
        a.generate();
        b.generate();
        assertEquals(wallBits(a), wallBits(b));

        var c = new Grid(12, 15, 4321L);
        c.generate();
        assertNotEquals(wallBits(a), wallBits(c));
    }

    @Test
    public void testGenerationFlagsAreCleared() {
        var grid = new Grid(9, 9, 2L);
        grid.generate();
        grid.cells().forEach(cell -> {
            assertFalse(cell.isVisitedGeneration());
            assertFalse(cell.isVisitedSolve());
        });
    }

    @Test
    public void testSingleCell() {
        var grid = new Grid(1, 1, 0L);
        var renderer = mock(MazeRenderer.class);
        grid.generate(renderer);
        assertSame(grid.entrance(), grid.exit());
        assertEquals(0, grid.countOpenInternalWalls());
        assertFalse(grid.entrance().hasWallTop());
        assertFalse(grid.entrance().hasWallBottom());
        assertTrue(grid.entrance().hasWallLeft());
        assertTrue(grid.entrance().hasWallRight());
        verifyNoInteractions(renderer);
    }

    @Test
    public void testSingleRowIsCorridor() {
        for (long seed = 0; seed < 5; seed++) {
            var grid = new Grid(1, 4, seed);
            grid.generate();
            for (int c = 0; c < 3; c++) {
                assertTrue(grid.isOpen(grid.cell(0, c), Direction.RIGHT));
            }
            assertEquals(3, grid.countOpenInternalWalls());
        }
    }

    @Test
    public void testSingleColumnIsCorridor() {
        var grid = new Grid(4, 1, 8L);
        grid.generate();
        for (int r = 0; r < 3; r++) {
            assertTrue(grid.isOpen(grid.cell(r, 0), Direction.DOWN));
        }
    }

    @Test
    public void testRendererSeesEveryBrokenWall() {
        var grid = new Grid(6, 7, 21L);
        var renderer = mock(MazeRenderer.class);
        grid.generate(renderer);
        verify(renderer, times(6 * 7 - 1)).onWallBroken(any(), any());
        verify(renderer, never()).onMove(any(), any(), anyBoolean());
    }

    @Test
    public void testRecordedWallsMatchGrid() {
        var grid = new Grid(5, 5, 3L);
        var recorder = new RecordingRenderer();
        grid.generate(recorder);
        assertEquals(24, recorder.count(MazeEvent.Type.WALL_BROKEN));
        for (var event : recorder.getEvents()) {
            var from = grid.cell(event.getFromRow(), event.getFromCol());
            var to = grid.cell(event.getToRow(), event.getToCol());
            assertTrue(grid.isOpen(from, Direction.between(from, to)), event.toString());
        }
    }

    @Test
    public void testRendererFailurePropagates() {
        var grid = new Grid(4, 4, 1L);
        var renderer = mock(MazeRenderer.class);
        var failure = new IllegalStateException("canvas gone");
        doThrow(failure).when(renderer).onWallBroken(any(), any());

        var thrown = assertThrows(IllegalStateException.class, () -> grid.generate(renderer));
        assertSame(failure, thrown);
        assertFalse(grid.isGenerated());
    }

    /**
     * A renderer failure leaves walls half carved; the grid must be reset before it
     * can be generated again, and then yields a full spanning tree.
     */
    @Test
    public void testAbortedGenerationRequiresReset() {
        for (long seed = 0; seed < 20; seed++) {
            var grid = new Grid(6, 6, seed);
            var breaks = new int[1];
            var failing = new RecordingRenderer() {
                @Override
                public void onWallBroken(Cell a, Cell b) {
                    if (++breaks[0] == 10) {
                        throw new IllegalStateException("canvas gone");
                    }
                }
            };
            assertThrows(IllegalStateException.class, () -> grid.generate(failing));
            var carved = wallBits(grid);

            var ex = assertThrows(IllegalStateException.class, grid::generate, "seed " + seed);
            assertTrue(ex.getMessage().contains("aborted"), ex.getMessage());
            assertEquals(carved, wallBits(grid));
            assertFalse(grid.isGenerated());

            grid.reset();
            grid.generate();
            assertEquals(35, grid.countOpenInternalWalls(), "seed " + seed);
            assertEquals(36, reachableFromEntrance(grid), "seed " + seed);
        }
    }

    @Test
    public void testLargeGridDoesNotOverflowStack() {
        var grid = new Grid(400, 400, 77L);
        grid.generate();
        assertEquals(400 * 400 - 1, grid.countOpenInternalWalls());
    }

    static int reachableFromEntrance(Grid grid) {
        Set<Cell> seen = new HashSet<>();
        var queue = new ArrayDeque<Cell>();
        queue.add(grid.entrance());
        seen.add(grid.entrance());
        while (!queue.isEmpty()) {
            var cell = queue.poll();
            for (Direction d : Direction.values()) {
                if (grid.isOpen(cell, d)) {
                    var next = grid.neighbor(cell, d).orElseThrow();
                    if (seen.add(next)) {
                        queue.add(next);
                    }
                }
            }
        }
        return seen.size();
    }

    static List<Boolean> wallBits(Grid grid) {
        List<Boolean> bits = new ArrayList<>();
        grid.cells().forEach(cell -> {
            for (Direction d : Direction.values()) {
                bits.add(cell.hasWall(d));
            }
        });
        return bits;
    }
}
