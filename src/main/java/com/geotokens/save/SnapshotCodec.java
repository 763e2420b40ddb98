package com.geotokens.save;

import com.geotokens.world.CellState;
import com.geotokens.world.GridCoordinate;
import com.geotokens.world.PlayerToken;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Session snapshot as a simple key=value properties blob.
 *
 * <pre>
 *   playerLat=...          player position in degrees
 *   playerLng=...
 *   highestValue=...
 *   held.value=...         only while a token is held
 *   held.i=... held.j=...
 *   cell.&lt;i&gt;.&lt;j&gt;=&lt;value&gt;  one per ledger entry (0 = no token)
 * </pre>
 */
public final class SnapshotCodec {

    private static final String CELL_PREFIX = "cell.";

    private SnapshotCodec() {}

    public static String encode(GameSnapshot snapshot) {
        Properties props = new Properties();
        props.setProperty("playerLat", Double.toString(snapshot.playerLat()));
        props.setProperty("playerLng", Double.toString(snapshot.playerLng()));
        props.setProperty("highestValue", Integer.toString(snapshot.highestValue()));
        PlayerToken held = snapshot.heldToken();
        if (held != null) {
            props.setProperty("held.value", Integer.toString(held.value()));
            props.setProperty("held.i", Integer.toString(held.origin().i()));
            props.setProperty("held.j", Integer.toString(held.origin().j()));
        }
        for (Map.Entry<GridCoordinate, CellState> e : snapshot.ledger().entrySet()) {
            GridCoordinate c = e.getKey();
            props.setProperty(CELL_PREFIX + c.i() + "." + c.j(), Integer.toString(e.getValue().value()));
        }

        StringWriter out = new StringWriter();
        try {
            props.store(out, "GeoTokens session");
        } catch (IOException e) {
            // StringWriter does not throw
            throw new IllegalStateException(e);
        }
        return out.toString();
    }

    /**
     * Parse a blob produced by {@link #encode}.
     *
     * @throws IOException if the blob is missing fields, has malformed numbers
     *                     or breaks the held-token invariant
     */
    public static GameSnapshot decode(String blob) throws IOException {
        if (blob == null || blob.isBlank()) {
            throw new IOException("Empty session blob");
        }
        Properties props = new Properties();
        try {
            props.load(new StringReader(blob));
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed session blob", e);
        }

        try {
            double lat = Double.parseDouble(required(props, "playerLat"));
            double lng = Double.parseDouble(required(props, "playerLng"));
            int highest = Integer.parseInt(required(props, "highestValue"));

            PlayerToken held = null;
            if (props.containsKey("held.value")) {
                held = new PlayerToken(
                    Integer.parseInt(required(props, "held.value")),
                    new GridCoordinate(Integer.parseInt(required(props, "held.i")),
                                       Integer.parseInt(required(props, "held.j"))));
            }

            Map<GridCoordinate, CellState> ledger = new LinkedHashMap<>();
            for (String key : props.stringPropertyNames()) {
                if (!key.startsWith(CELL_PREFIX)) continue;
                ledger.put(parseCellKey(key), CellState.of(Integer.parseInt(props.getProperty(key).trim())));
            }

            GameSnapshot snapshot = new GameSnapshot(ledger, lat, lng, highest, held);
            snapshot.validate();
            return snapshot;
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            throw new IOException("Invalid session blob: " + e.getMessage(), e);
        }
    }

    private static GridCoordinate parseCellKey(String key) {
        String rest = key.substring(CELL_PREFIX.length());
        // i may be negative, so split on the dot that follows it
        int dot = rest.indexOf('.', rest.startsWith("-") ? 1 : 0);
        if (dot < 0) {
            throw new IllegalArgumentException("Bad cell key: " + key);
        }
        return new GridCoordinate(Integer.parseInt(rest.substring(0, dot)),
                                  Integer.parseInt(rest.substring(dot + 1)));
    }

    private static String required(Properties props, String key) throws IOException {
        String v = props.getProperty(key);
        if (v == null) throw new IOException("Missing " + key);
        return v.trim();
    }
}
