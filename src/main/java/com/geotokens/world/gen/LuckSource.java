package com.geotokens.world.gen;

import com.geotokens.world.GridCoordinate;

/**
 * Reproducible pseudo-random value in [0, 1) for a coordinate. Must depend on
 * nothing but the coordinate (and fixed construction parameters).
 */
@FunctionalInterface
public interface LuckSource {

    double luck(GridCoordinate coordinate);
}
