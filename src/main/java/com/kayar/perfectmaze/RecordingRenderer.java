package com.kayar.perfectmaze;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects every generation and solving step so it can be replayed later,
 * for example by an animation running on the UI thread.
 */
public class RecordingRenderer implements MazeRenderer {

    private final List<MazeEvent> events = new ArrayList<>();

    @Override
    public void onWallBroken(Cell a, Cell b) {
        events.add(new MazeEvent(MazeEvent.Type.WALL_BROKEN, a, b));
    }

    @Override
    public void onMove(Cell from, Cell to, boolean backtrack) {
        events.add(new MazeEvent(backtrack ? MazeEvent.Type.BACKTRACK : MazeEvent.Type.MOVE, from, to));
    }

    public List<MazeEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public long count(MazeEvent.Type type) {
        return events.stream().filter(e -> e.getType() == type).count();
    }

    public void clear() {
        events.clear();
    }
}
