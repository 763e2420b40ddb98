package com.geotokens.math;

/** Deterministic hash functions for cell generation. */
public final class Hashing {

    private Hashing() {}

    public static int hash2D(int x, int z, long seed) {
        long h = seed ^ (x * 0x5DEECE66DL) ^ (z * 0x1234567890ABCDEFL);
        h = (h ^ (h >>> 16)) * 0x45D9F3BL;
        h = (h ^ (h >>> 16)) * 0x45D9F3BL;
        return (int) (h ^ (h >>> 16));
    }

    /** Map a 2D hash to a double in [0, 1). */
    public static double unit2D(int x, int z, long seed) {
        return (hash2D(x, z, seed) & 0xFFFFFFFFL) / 4294967296.0;
    }
}
