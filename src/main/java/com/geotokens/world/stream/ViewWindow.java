package com.geotokens.world.stream;

import com.geotokens.world.GridCoordinate;

/** Inclusive rectangle of grid coordinates. */
public record ViewWindow(int minI, int maxI, int minJ, int maxJ) {

    /** @throws ArithmeticException if the window would leave the int grid */
    public static ViewWindow around(GridCoordinate center, int radius) {
        return new ViewWindow(Math.subtractExact(center.i(), radius), Math.addExact(center.i(), radius),
                              Math.subtractExact(center.j(), radius), Math.addExact(center.j(), radius));
    }

    public boolean contains(GridCoordinate c) {
        return c.i() >= minI && c.i() <= maxI && c.j() >= minJ && c.j() <= maxJ;
    }
}
