package com.geotokens.world;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Fans every callback out to the registered listeners, in registration order. */
public class ListenerSet implements WorldListener {

    private final List<WorldListener> listeners = new CopyOnWriteArrayList<>();

    public void add(WorldListener listener) {
        listeners.add(listener);
    }

    @Override
    public void onCellMaterialized(GridCoordinate coordinate, CellState state) {
        for (WorldListener l : listeners) l.onCellMaterialized(coordinate, state);
    }

    @Override
    public void onCellUpdated(GridCoordinate coordinate, CellState state) {
        for (WorldListener l : listeners) l.onCellUpdated(coordinate, state);
    }

    @Override
    public void onCellEvicted(GridCoordinate coordinate) {
        for (WorldListener l : listeners) l.onCellEvicted(coordinate);
    }

    @Override
    public void onHighestValueChanged(int value) {
        for (WorldListener l : listeners) l.onHighestValueChanged(value);
    }

    @Override
    public void onThresholdReached() {
        for (WorldListener l : listeners) l.onThresholdReached();
    }

    @Override
    public void onPlayerMoved(double lat, double lng, GridCoordinate cell) {
        for (WorldListener l : listeners) l.onPlayerMoved(lat, lng, cell);
    }

    @Override
    public void onHeldTokenChanged(PlayerToken token) {
        for (WorldListener l : listeners) l.onHeldTokenChanged(token);
    }
}
