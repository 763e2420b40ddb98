package com.geotokens.sim;

import com.geotokens.input.Direction;
import com.geotokens.world.GridCoordinate;
import org.joml.Vector2d;

/**
 * Player entity. Holds the continuous position as (lat, lng) in degrees; the
 * grid cell is derived by floor-dividing by the cell size.
 */
public class Player {

    private final Vector2d position = new Vector2d();
    private final double cellSizeDegrees;

    public Player(double lat, double lng, double cellSizeDegrees) {
        this.cellSizeDegrees = cellSizeDegrees;
        position.set(lat, lng);
    }

    public double getLat() { return position.x; }
    public double getLng() { return position.y; }

    public void setPosition(double lat, double lng) {
        position.set(lat, lng);
    }

    public GridCoordinate getCurrentCell() {
        return GridCoordinate.fromLatLng(position.x, position.y, cellSizeDegrees);
    }

    /** Position one cell over in {@code direction}. Does not move the player. */
    public Vector2d stepTarget(Direction direction) {
        return new Vector2d(
            position.x + direction.di() * cellSizeDegrees,
            position.y + direction.dj() * cellSizeDegrees
        );
    }

    public double getCellSizeDegrees() { return cellSizeDegrees; }
}
