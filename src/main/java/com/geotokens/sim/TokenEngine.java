package com.geotokens.sim;

import com.geotokens.math.GeoMath;
import com.geotokens.world.CellState;
import com.geotokens.world.CellStore;
import com.geotokens.world.GridCoordinate;
import com.geotokens.world.LiveCell;
import com.geotokens.world.PlayerToken;
import com.geotokens.world.WorldListener;

import java.util.logging.Logger;

/**
 * Collect / double / return-previous rules around the player's single held token.
 *
 * Every attempt re-checks its preconditions against live state; a refused
 * attempt changes nothing and comes back as a rejected {@link InteractionResult}.
 * Acting on a cell that is not live is a caller bug and throws.
 */
public class TokenEngine {

    private static final Logger LOG = Logger.getLogger(TokenEngine.class.getName());

    private final CellStore cells;
    private final Player player;
    private final double collectionRadiusMeters;
    private final WorldListener listener;

    /** Null when the player's hand is empty. */
    private PlayerToken held;

    public TokenEngine(CellStore cells, Player player, double collectionRadiusMeters, WorldListener listener) {
        this.cells = cells;
        this.player = player;
        this.collectionRadiusMeters = collectionRadiusMeters;
        this.listener = listener;
    }

    /**
     * Lift the token out of {@code coordinate}. A token already in hand goes
     * back to the cell it came from first.
     *
     * @throws IllegalStateException if the cell is not live
     */
    public InteractionResult collect(GridCoordinate coordinate) {
        LiveCell cell = requireLive(coordinate);
        double distance = distanceTo(coordinate);
        int value = cell.getValue();
        int heldValue = heldValue();

        Rejection why = collectRejection(cell, distance);
        if (why != null) {
            return InteractionResult.rejected(InteractionResult.Action.COLLECT, coordinate, why,
                distance, value, heldValue);
        }

        if (held != null) {
            cells.store(held.origin(), CellState.of(held.value()));
            LOG.fine(() -> "Returned " + held.value() + " to " + held.origin());
        }
        held = new PlayerToken(value, coordinate);
        cells.setState(coordinate, CellState.EMPTY);
        listener.onHeldTokenChanged(held);
        return InteractionResult.success(InteractionResult.Action.COLLECT, coordinate, distance, 0, value);
    }

    /**
     * Merge the held token into a cell of equal value, doubling it.
     *
     * @throws IllegalStateException if the cell is not live
     */
    public InteractionResult doubleAt(GridCoordinate coordinate) {
        LiveCell cell = requireLive(coordinate);
        double distance = distanceTo(coordinate);
        int value = cell.getValue();
        int heldValue = heldValue();

        Rejection why = doubleRejection(cell, distance);
        if (why != null) {
            return InteractionResult.rejected(InteractionResult.Action.DOUBLE, coordinate, why,
                distance, value, heldValue);
        }

        CellState doubled = cell.getState().doubled();
        cells.setState(coordinate, doubled);
        held = null;
        listener.onHeldTokenChanged(null);
        return InteractionResult.success(InteractionResult.Action.DOUBLE, coordinate, distance,
            doubled.value(), heldValue);
    }

    /** Which actions {@code coordinate} currently allows, without acting. */
    public Affordances affordances(GridCoordinate coordinate) {
        LiveCell cell = requireLive(coordinate);
        double distance = distanceTo(coordinate);
        return new Affordances(collectRejection(cell, distance), doubleRejection(cell, distance),
            distance, cell.getValue(), heldValue());
    }

    private Rejection collectRejection(LiveCell cell, double distance) {
        if (distance > collectionRadiusMeters) return Rejection.TOO_FAR;
        if (!cell.hasToken()) return Rejection.NO_TOKEN_IN_CELL;
        return null;
    }

    private Rejection doubleRejection(LiveCell cell, double distance) {
        if (distance > collectionRadiusMeters) return Rejection.TOO_FAR;
        if (held == null) return Rejection.NO_TOKEN_HELD;
        if (!cell.hasToken()) return Rejection.NO_TOKEN_IN_CELL;
        if (held.value() != cell.getValue()) return Rejection.VALUE_MISMATCH;
        if (!cell.getState().canDouble()) return Rejection.VALUE_TOO_LARGE;
        return null;
    }

    /** Metres from the player to the centre of {@code coordinate}. */
    private double distanceTo(GridCoordinate coordinate) {
        double size = player.getCellSizeDegrees();
        return GeoMath.distanceMeters(player.getLat(), player.getLng(),
            coordinate.centerLat(size), coordinate.centerLng(size));
    }

    private LiveCell requireLive(GridCoordinate coordinate) {
        LiveCell cell = cells.get(coordinate);
        if (cell == null) {
            throw new IllegalStateException("Cell " + coordinate + " is not live");
        }
        return cell;
    }

    private int heldValue() {
        return held == null ? 0 : held.value();
    }

    public PlayerToken getHeld() { return held; }


    /** Put a token in hand from a saved session. Null empties the hand. */
    public void restoreHeld(PlayerToken token) {
        this.held = token;
        listener.onHeldTokenChanged(token);
    }

}
