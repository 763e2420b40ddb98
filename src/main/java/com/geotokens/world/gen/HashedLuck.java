package com.geotokens.world.gen;

import com.geotokens.math.Hashing;
import com.geotokens.world.GridCoordinate;

/** Default luck: a seeded integer hash of the coordinate. */
public class HashedLuck implements LuckSource {

    private final long seed;

    public HashedLuck(long seed) {
        this.seed = seed;
    }

    @Override
    public double luck(GridCoordinate coordinate) {
        return Hashing.unit2D(coordinate.i(), coordinate.j(), seed);
    }
}
