package com.geotokens.world;

/**
 * Gameplay payload of one cell. A cell holds a token iff its value is
 * positive; 0 means "no token". Immutable, so ledger entries can be shared.
 */
public record CellState(int value) {

    public static final CellState EMPTY = new CellState(0);

    public CellState {
        if (value < 0) {
            throw new IllegalArgumentException("Token value must not be negative: " + value);
        }
    }

    public static CellState of(int value) {
        return value == 0 ? EMPTY : new CellState(value);
    }

    public boolean hasToken() {
        return value > 0;
    }

    /** True if the cell holds a token small enough to double without overflow. */
    public boolean canDouble() {
        return value > 0 && value <= Integer.MAX_VALUE / 2;
    }

    public CellState doubled() {
        if (value == 0) {
            throw new IllegalStateException("Cannot double an empty cell");
        }
        return new CellState(Math.multiplyExact(value, 2));
    }
}
