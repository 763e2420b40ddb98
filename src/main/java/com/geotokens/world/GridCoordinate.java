package com.geotokens.world;

/**
 * Immutable grid cell coordinate (i, j). {@code i} follows latitude,
 * {@code j} follows longitude. Used as map key and sole identity of a cell.
 */
public record GridCoordinate(int i, int j) {

    /** @throws ArithmeticException if the position falls outside the int grid */
    public static GridCoordinate fromLatLng(double lat, double lng, double cellSizeDegrees) {
        return new GridCoordinate(toIndex(lat / cellSizeDegrees), toIndex(lng / cellSizeDegrees));
    }

    private static int toIndex(double cells) {
        double floor = Math.floor(cells);
        if (!(floor >= Integer.MIN_VALUE && floor <= Integer.MAX_VALUE)) {
            throw new ArithmeticException("Grid index out of range: " + cells);
        }
        return (int) floor;
    }

    public static GridCoordinate fromKey(long key) {
        return new GridCoordinate((int) (key >> 32), (int) key);
    }

    /** Pack into a long key (pure math, no allocation). */
    public static long key(int i, int j) {
        return (((long) i) << 32) | (j & 0xFFFFFFFFL);
    }

    public long key() {
        return key(i, j);
    }

    public GridCoordinate offset(int di, int dj) {
        return new GridCoordinate(i + di, j + dj);
    }

    public double centerLat(double cellSizeDegrees) { return (i + 0.5) * cellSizeDegrees; }
    public double centerLng(double cellSizeDegrees) { return (j + 0.5) * cellSizeDegrees; }

    @Override
    public String toString() {
        return "[" + i + ", " + j + "]";
    }
}
