package com.kayar.perfectmaze;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
        name = "perfect-maze",
        version = "perfect-maze 1.0",
        description = "Generates a perfect maze with a randomized depth-first backtracker "
                + "and solves it with depth-first search.",
        mixinStandardHelpOptions = true)
public class MazeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MazeCommand.class);

    @Spec
    CommandSpec spec;

    @Option(names = {"-r", "--rows"}, defaultValue = "10", description = "Number of rows (default: ${DEFAULT-VALUE})")
    int rows;

    @Option(names = {"-c", "--cols"}, defaultValue = "14", description = "Number of columns (default: ${DEFAULT-VALUE})")
    int cols;

    @Option(names = "--cell-width", defaultValue = "50", description = "Cell width in pixels (default: ${DEFAULT-VALUE})")
    int cellWidth;

    @Option(names = "--cell-height", defaultValue = "50", description = "Cell height in pixels (default: ${DEFAULT-VALUE})")
    int cellHeight;

    @Option(names = "--origin-x", defaultValue = "50", description = "Left drawing offset (default: ${DEFAULT-VALUE})")
    int originX;

    @Option(names = "--origin-y", defaultValue = "50", description = "Top drawing offset (default: ${DEFAULT-VALUE})")
    int originY;

    @Option(names = {"-s", "--seed"}, description = "Seed for a reproducible maze")
    Long seed;

    @Option(names = "--step-millis", defaultValue = "5", description = "Delay between animated steps (default: ${DEFAULT-VALUE})")
    long stepMillis;

    @Option(names = "--headless", description = "Print the maze and its path as text instead of opening a window")
    boolean headless;

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new MazeCommand());
        cmd.setExecutionExceptionHandler(new ExceptionHandler());
        return cmd;
    }

    @Override
    public Integer call() {
        var settings = new MazeSettings(rows, cols, cellWidth, cellHeight, originX, originY, seed, stepMillis);
        log.info("Starting {}", settings);
        if (!headless) {
            MazeApp.launch(settings);
            return CommandLine.ExitCode.OK;
        }

        Grid grid = settings.newGrid();
        grid.generate();
        SolveResult result = new MazeSolver().solve(grid);

        PrintWriter out = spec.commandLine().getOut();
        AsciiMazePrinter.print(grid, result.path(), out);
        out.println(result);
        out.flush();

        if (!result.isSolved()) {
            log.error("No path found through {}x{} maze", grid.getRows(), grid.getCols());
            return CommandLine.ExitCode.SOFTWARE;
        }
        log.info("Maze {}", result);
        return CommandLine.ExitCode.OK;
    }
}
