package com.geotokens.world;

/** The single token the player carries, remembered with the cell it was lifted from. */
public record PlayerToken(int value, GridCoordinate origin) {

    public PlayerToken {
        if (value <= 0) {
            throw new IllegalArgumentException("Held token value must be positive: " + value);
        }
        if (origin == null) {
            throw new IllegalArgumentException("Held token needs an origin cell");
        }
    }
}
