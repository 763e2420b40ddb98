package com.geotokens.save;

import com.geotokens.math.GeoMath;
import com.geotokens.world.CellState;
import com.geotokens.world.GridCoordinate;
import com.geotokens.world.PlayerToken;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything needed to resume a session: the mutation ledger, the player's
 * position, the highest value seen and the held token (nullable).
 */
public record GameSnapshot(
    Map<GridCoordinate, CellState> ledger,
    double playerLat,
    double playerLng,
    int highestValue,
    PlayerToken heldToken
) {

    public GameSnapshot {
        ledger = Collections.unmodifiableMap(new LinkedHashMap<>(ledger));
    }

    /**
     * Reject snapshots that break the held-token invariant: the origin of a
     * held token must be recorded as empty.
     */
    public void validate() {
        if (highestValue < 0) {
            throw new IllegalArgumentException("Negative highest value: " + highestValue);
        }
        if (!GeoMath.isValidPosition(playerLat, playerLng)) {
            throw new IllegalArgumentException("Player position out of range: " + playerLat + ", " + playerLng);
        }
        if (heldToken != null) {
            CellState origin = ledger.get(heldToken.origin());
            if (origin == null || origin.hasToken()) {
                throw new IllegalArgumentException(
                    "Held token origin " + heldToken.origin() + " is not recorded as empty");
            }
        }
    }
}
