package com.geotokens.world.stream;

import com.geotokens.math.GeoMath;
import com.geotokens.sim.Player;
import com.geotokens.world.CellStore;
import com.geotokens.world.GridCoordinate;
import com.geotokens.world.WorldListener;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Keeps the live cell set equal to the window around the player: loads newly
 * visible cells (closest first) and evicts cells that left the window.
 *
 * Load/evict only runs when the player crosses into a new cell, so repeated
 * moves inside one cell cost nothing and cells that stay visible are never
 * evicted and re-created.
 */
public class ViewManager {

    private static final Logger LOG = Logger.getLogger(ViewManager.class.getName());

    private final CellStore cells;
    private final Player player;
    private final int radius;
    private final WorldListener listener;

    private ViewWindow window;
    private GridCoordinate lastCenter;

    public ViewManager(CellStore cells, Player player, int radius, WorldListener listener) {
        this.cells = cells;
        this.player = player;
        this.radius = radius;
        this.listener = listener;
    }

    public boolean onPlayerMoved(double lat, double lng) {
        if (!GeoMath.isValidPosition(lat, lng)) {
            LOG.warning("Ignoring move to invalid position " + lat + ", " + lng);
            return false;
        }
        player.setPosition(lat, lng);
        GridCoordinate center = player.getCurrentCell();

        if (!center.equals(lastCenter)) {
            lastCenter = center;
            window = ViewWindow.around(center, radius);
            requestCells(center);
            unloadOutside(window);
        }

        listener.onPlayerMoved(lat, lng, center);
        return true;
    }

    /** Recompute the window from the player's current position, even if the cell is unchanged. */
    public void refresh() {
        lastCenter = null;
        onPlayerMoved(player.getLat(), player.getLng());
    }

    /**
     * Materialize every window coordinate that isn't live yet, sorted by
     * distance (closest first).
     */
    private void requestCells(GridCoordinate center) {
        List<GridCoordinate> needed = new ArrayList<>();
        for (int di = -radius; di <= radius; di++) {
            for (int dj = -radius; dj <= radius; dj++) {
                GridCoordinate c = center.offset(di, dj);
                if (!cells.isLive(c)) {
                    needed.add(c);
                }
            }
        }
        needed.sort(Comparator.comparingInt(c -> distSq(c, center)));
        for (GridCoordinate c : needed) {
            cells.materialize(c);
        }
        if (!needed.isEmpty()) {
            LOG.fine("Loaded " + needed.size() + " cells around " + center);
        }
    }

    private void unloadOutside(ViewWindow keep) {
        List<GridCoordinate> toRemove = new ArrayList<>();
        for (GridCoordinate c : cells.liveCoordinates()) {
            if (!keep.contains(c)) {
                toRemove.add(c);
            }
        }
        for (GridCoordinate c : toRemove) {
            cells.evict(c);
        }
        if (!toRemove.isEmpty()) {
            LOG.fine("Unloaded " + toRemove.size() + " cells");
        }
    }

    private static int distSq(GridCoordinate a, GridCoordinate b) {
        int di = a.i() - b.i();
        int dj = a.j() - b.j();
        return di * di + dj * dj;
    }

    /** Null until the first move. */
    public ViewWindow currentWindow() {
        return window;
    }
}
