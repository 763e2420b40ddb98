package com.geotokens.sim;

import com.geotokens.world.GridCoordinate;

/**
 * Outcome of a collect or double attempt. A null {@code rejection} means the
 * action went through. {@code cellValue} is the cell's value after a success
 * (before, on rejection); {@code heldValue} is 0 when nothing is held.
 */
public record InteractionResult(
    Action action,
    GridCoordinate coordinate,
    Rejection rejection,
    double distanceMeters,
    int cellValue,
    int heldValue
) {

    public enum Action { COLLECT, DOUBLE }

    public static InteractionResult success(Action action, GridCoordinate c, double distance,
                                            int cellValue, int heldValue) {
        return new InteractionResult(action, c, null, distance, cellValue, heldValue);
    }

    public static InteractionResult rejected(Action action, GridCoordinate c, Rejection why,
                                             double distance, int cellValue, int heldValue) {
        return new InteractionResult(action, c, why, distance, cellValue, heldValue);
    }

    public boolean isSuccess() {
        return rejection == null;
    }

    /** Status line for the player. */
    public String message() {
        if (rejection == null) {
            return switch (action) {
                case COLLECT -> "Holding: Cell " + coordinate + " → Value: " + heldValue;
                case DOUBLE -> "Double: Cell " + coordinate + " → Value: " + cellValue;
            };
        }
        return switch (rejection) {
            case TOO_FAR -> "Too far! (" + Math.round(distanceMeters) + "m)";
            case NO_TOKEN_HELD -> "No Token to Double!";
            case VALUE_MISMATCH -> "Invalid Double, Need:(" + heldValue + ")";
            case NO_TOKEN_IN_CELL -> "No token in cell " + coordinate;
            case VALUE_TOO_LARGE -> "Value too large to double (" + cellValue + ")";
        };
    }
}
