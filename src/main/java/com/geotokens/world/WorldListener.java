package com.geotokens.world;

/**
 * Outbound callbacks for renderers, HUDs and remote clients. Payloads are
 * semantic only; styling is left to the listener.
 */
public interface WorldListener {

    default void onCellMaterialized(GridCoordinate coordinate, CellState state) {}

    default void onCellUpdated(GridCoordinate coordinate, CellState state) {}

    default void onCellEvicted(GridCoordinate coordinate) {}

    default void onHighestValueChanged(int value) {}

    /** Fired once per session, the first time the highest value reaches the win threshold. */
    default void onThresholdReached() {}

    default void onPlayerMoved(double lat, double lng, GridCoordinate cell) {}

    /** {@code token} is null when the player's hand became empty. */
    default void onHeldTokenChanged(PlayerToken token) {}
}
