package com.geotokens.input;

import java.util.HashMap;
import java.util.Map;

/**
 * Lookup table from input key names (browser-style key values) to movement
 * directions. Arrow keys and WASD are bound by default.
 */
public class MovementKeys {

    private final Map<String, Direction> bindings = new HashMap<>();

    public MovementKeys() {
        bind("ArrowUp", Direction.NORTH);
        bind("ArrowDown", Direction.SOUTH);
        bind("ArrowRight", Direction.EAST);
        bind("ArrowLeft", Direction.WEST);
        bind("w", Direction.NORTH);
        bind("s", Direction.SOUTH);
        bind("d", Direction.EAST);
        bind("a", Direction.WEST);
    }

    public void bind(String key, Direction direction) {
        bindings.put(normalize(key), direction);
    }

    /** Direction bound to {@code key}, or null. */
    public Direction lookup(String key) {
        if (key == null) return null;
        return bindings.get(normalize(key));
    }

    // Single letters are case-insensitive ("W" with shift held still moves north)
    private static String normalize(String key) {
        return key.length() == 1 ? key.toLowerCase() : key;
    }
}
