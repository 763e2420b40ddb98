package com.geotokens.world;

import com.geotokens.math.GeoMath;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Game configuration. Holds every tuneable parameter of the grid, the
 * interaction rules and the control server.
 *
 * All fields are public and default to {@link GameConstants}. A config can be
 * read from a key=value properties file; missing keys keep their defaults and
 * malformed values are logged and ignored.
 */
public class GameConfig {

    private static final Logger LOG = Logger.getLogger(GameConfig.class.getName());

    /** Classpath resource consulted by {@link #loadDefault()}. */
    public static final String DEFAULT_RESOURCE = "/geotokens.properties";

    // ========================================================
    // Grid geometry
    // ========================================================

    /** Cell edge in degrees. Player position is floor-divided by this. */
    public double cellSizeDegrees = GameConstants.CELL_SIZE_DEGREES;

    /** Live window half-size in cells: the window is (2r+1) x (2r+1). */
    public int viewportRadius = GameConstants.VIEWPORT_RADIUS;

    public double originLat = GameConstants.ORIGIN_LAT;
    public double originLng = GameConstants.ORIGIN_LNG;

    // ========================================================
    // Generation
    // ========================================================
    public long seed = GameConstants.DEFAULT_SEED;
    public int deadValue = GameConstants.DEAD_VALUE;
    public int tokenMinValue = GameConstants.TOKEN_MIN_VALUE;
    public int tokenMaxValue = GameConstants.TOKEN_MAX_VALUE;

    // ========================================================
    // Interaction
    // ========================================================
    public double collectionRadiusMeters = GameConstants.COLLECTION_RADIUS_METERS;
    public int winThreshold = GameConstants.WIN_THRESHOLD;

    // ========================================================
    // Control server
    // ========================================================
    public int serverPort = 25566;
    public long tickMillis = 50;

    public GameConfig() {}

    /** Deep copy (all fields are primitives). */
    public GameConfig copy() {
        GameConfig c = new GameConfig();
        c.cellSizeDegrees = cellSizeDegrees;
        c.viewportRadius = viewportRadius;
        c.originLat = originLat;
        c.originLng = originLng;
        c.seed = seed;
        c.deadValue = deadValue;
        c.tokenMinValue = tokenMinValue;
        c.tokenMaxValue = tokenMaxValue;
        c.collectionRadiusMeters = collectionRadiusMeters;
        c.winThreshold = winThreshold;
        c.serverPort = serverPort;
        c.tickMillis = tickMillis;
        return c;
    }

    /**
     * Load the bundled defaults from the classpath, or plain defaults if the
     * resource is absent.
     */
    public static GameConfig loadDefault() {
        Properties props = new Properties();
        try (InputStream is = GameConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is != null) props.load(is);
        } catch (IOException e) {
            LOG.warning("Could not read " + DEFAULT_RESOURCE + ": " + e.getMessage());
        }
        return fromProperties(props);
    }

    /**
     * Load configuration from a properties file, layered over the bundled defaults.
     */
    public static GameConfig load(Path file) throws IOException {
        GameConfig config = loadDefault();
        Properties props = new Properties();
        try (InputStream is = Files.newInputStream(file)) {
            props.load(is);
        }
        config.apply(props);
        return config;
    }

    public static GameConfig fromProperties(Properties props) {
        GameConfig config = new GameConfig();
        config.apply(props);
        return config;
    }

    /** Overwrite fields for every key present in {@code props}. */
    public void apply(Properties props) {
        cellSizeDegrees = readDouble(props, "cellSizeDegrees", cellSizeDegrees);
        viewportRadius = readInt(props, "viewportRadius", viewportRadius);
        originLat = readDouble(props, "originLat", originLat);
        originLng = readDouble(props, "originLng", originLng);
        seed = readLong(props, "seed", seed);
        deadValue = readInt(props, "deadValue", deadValue);
        tokenMinValue = readInt(props, "tokenMinValue", tokenMinValue);
        tokenMaxValue = readInt(props, "tokenMaxValue", tokenMaxValue);
        collectionRadiusMeters = readDouble(props, "collectionRadiusMeters", collectionRadiusMeters);
        winThreshold = readInt(props, "winThreshold", winThreshold);
        serverPort = readInt(props, "serverPort", serverPort);
        tickMillis = readLong(props, "tickMillis", tickMillis);

        if (cellSizeDegrees <= 0) {
            throw new IllegalArgumentException("cellSizeDegrees must be positive: " + cellSizeDegrees);
        }
        if (viewportRadius < 0) {
            throw new IllegalArgumentException("viewportRadius must not be negative: " + viewportRadius);
        }
        // The whole globe plus a window's margin must fit in int grid indices
        if (180.0 / cellSizeDegrees + viewportRadius + 1 >= Integer.MAX_VALUE) {
            throw new IllegalArgumentException("cellSizeDegrees too small for the grid: " + cellSizeDegrees);
        }
        if (!GeoMath.isValidPosition(originLat, originLng)) {
            throw new IllegalArgumentException("Origin out of range: " + originLat + ", " + originLng);
        }
    }

    private static double readDouble(Properties props, String key, double def) {
        String v = props.getProperty(key);
        if (v == null) return def;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            LOG.warning("Ignoring malformed " + key + "=" + v);
            return def;
        }
    }

    private static int readInt(Properties props, String key, int def) {
        String v = props.getProperty(key);
        if (v == null) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            LOG.warning("Ignoring malformed " + key + "=" + v);
            return def;
        }
    }

    private static long readLong(Properties props, String key, long def) {
        String v = props.getProperty(key);
        if (v == null) return def;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            LOG.warning("Ignoring malformed " + key + "=" + v);
            return def;
        }
    }
}
