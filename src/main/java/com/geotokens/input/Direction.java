package com.geotokens.input;

/** Single-cell movement steps. {@code di} moves latitude, {@code dj} longitude. */
public enum Direction {
    NORTH(1, 0),
    SOUTH(-1, 0),
    EAST(0, 1),
    WEST(0, -1);

    private final int di;
    private final int dj;

    Direction(int di, int dj) {
        this.di = di;
        this.dj = dj;
    }

    public int di() { return di; }
    public int dj() { return dj; }

    /** Case-insensitive name lookup; null if unknown. */
    public static Direction fromString(String name) {
        if (name == null) return null;
        try {
            return valueOf(name.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
