package com.geotokens.world;

/**
 * A materialized cell inside the current view. Cheap wrapper around the
 * coordinate and its current {@link CellState}; dropped on eviction while the
 * state survives in the {@link MutationLedger}.
 */
public class LiveCell {

    private final GridCoordinate coordinate;
    private CellState state;

    LiveCell(GridCoordinate coordinate, CellState state) {
        this.coordinate = coordinate;
        this.state = state;
    }

    public GridCoordinate getCoordinate() { return coordinate; }

    public CellState getState() { return state; }

    void setState(CellState state) {
        this.state = state;
    }

    public boolean hasToken() { return state.hasToken(); }

    public int getValue() { return state.value(); }

    @Override
    public String toString() {
        return "LiveCell" + coordinate + "=" + state.value();
    }
}
