package com.geotokens.world;

/** Canonical game tuning constants. {@link GameConfig} defaults to these. */
public final class GameConstants {

    /** Edge length of one grid cell, in degrees of latitude/longitude. */
    public static final double CELL_SIZE_DEGREES = 1e-4;

    /** Cells kept live on each side of the player's cell. */
    public static final int VIEWPORT_RADIUS = 24;

    public static final double COLLECTION_RADIUS_METERS = 50.0;

    public static final int WIN_THRESHOLD = 2048;

    // Default start: the classroom the game was first played in
    public static final double ORIGIN_LAT = 36.997936938057016;
    public static final double ORIGIN_LNG = -122.05703507501151;

    // Generator raw value range is [0, RAW_VALUE_RANGE)
    public static final int RAW_VALUE_RANGE = 10;
    public static final int DEAD_VALUE = 3;
    public static final int TOKEN_MIN_VALUE = 1;
    public static final int TOKEN_MAX_VALUE = 4;

    public static final long DEFAULT_SEED = 0L;

    private GameConstants() {}
}
