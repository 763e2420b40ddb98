package com.geotokens.sim;

/**
 * What the player could do with one cell right now. A null rejection means
 * the action would be accepted.
 */
public record Affordances(Rejection collectRejection, Rejection doubleRejection,
                          double distanceMeters, int cellValue, int heldValue) {

    public boolean canCollect() { return collectRejection == null; }

    public boolean canDouble() { return doubleRejection == null; }
}
