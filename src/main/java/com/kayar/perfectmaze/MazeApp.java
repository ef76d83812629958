package com.kayar.perfectmaze;

import com.almasb.fxgl.app.GameApplication;
import com.almasb.fxgl.app.GameSettings;
import javafx.animation.KeyFrame;
import javafx.animation.Timeline;
import javafx.scene.canvas.Canvas;
import javafx.scene.paint.Color;
import javafx.scene.text.Text;
import javafx.util.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.almasb.fxgl.dsl.FXGL.*;

/**
 * Window that animates maze generation and solving.
 * <p>
 * The maze is generated and solved up front with a {@link RecordingRenderer}; the
 * recorded steps are then replayed on a canvas by a {@link Timeline}, one step per
 * key frame. The step delay only affects drawing, never the maze or its path.
 */
public class MazeApp extends GameApplication {

    private static final Logger log = LoggerFactory.getLogger(MazeApp.class);
    private static final int STATUS_HEIGHT = 30;

    // FXGL instantiates the app itself, so settings are handed over statically before launch
    private static MazeSettings settings = new MazeSettings(10, 14, 50, 50, 50, 50, null, 5);

    private Timeline replay;
    private Text status;

    public static void launch(MazeSettings mazeSettings) {
        settings = mazeSettings;
        launch(MazeApp.class, new String[0]);
    }

    @Override
    protected void initSettings(GameSettings gameSettings) {
        gameSettings.setTitle("-=Perfect Maze=-");
        gameSettings.setVersion("1.0");
        gameSettings.setWidth(settings.sceneWidth());
        gameSettings.setHeight(settings.sceneHeight() + STATUS_HEIGHT);
        gameSettings.setMainMenuEnabled(false);
        gameSettings.setGameMenuEnabled(false);
    }

    @Override
    protected void initGame() {
        if (replay != null) {
            replay.stop();
            replay = null;
        }
        getGameScene().clearUINodes();
        getGameScene().setBackgroundColor(MazeCanvasRenderer.BACKGROUND);

        Grid grid = settings.newGrid();
        RecordingRenderer recorder = new RecordingRenderer();
        grid.generate(recorder);
        int carveSteps = recorder.getEvents().size();
        SolveResult result = new MazeSolver(recorder).solve(grid);
        log.info("Maze {}", result);

        Canvas canvas = new Canvas(settings.sceneWidth(), settings.sceneHeight());
        MazeCanvasRenderer renderer = new MazeCanvasRenderer(canvas.getGraphicsContext2D(), grid);
        getGameScene().addUINode(canvas);

        status = new Text(settings.getOriginX(), settings.sceneHeight() + STATUS_HEIGHT / 2.0, "Generating...");
        status.setFill(Color.WHITE);
        getGameScene().addUINode(status);

        List<MazeEvent> events = recorder.getEvents();
        if (settings.getStepMillis() == 0 || events.isEmpty()) {
            renderer.drawGrid();
            events.stream().skip(carveSteps).forEach(renderer::apply);
            showResult(result);
            return;
        }

        renderer.drawClosedGrid();
        final int[] idx = {0};
        replay = new Timeline(new KeyFrame(Duration.millis(settings.getStepMillis()), e -> {
            int i = idx[0]++;
            renderer.apply(events.get(i));
            if (i == carveSteps - 1) {
                renderer.drawOpenings();
                status.setText("Solving...");
            }
            if (i == events.size() - 1) {
                showResult(result);
            }
        }));
        replay.setCycleCount(events.size());
        if (carveSteps == 0) {
            renderer.drawOpenings();
        }
        replay.play();
    }

    private void showResult(SolveResult result) {
        status.setText(result.isSolved()
                ? "Solved: " + result.path().size() + " cells, " + result.backtracks() + " backtracks"
                : "No path found");
    }
}
