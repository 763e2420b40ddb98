package com.geotokens.world;

import com.geotokens.world.gen.CellGenerator;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Logger;

/**
 * Owns the live cells of the current view, keyed by packed coordinate.
 * A cell object exists only while visible; its state is resolved from the
 * {@link MutationLedger} first and the {@link CellGenerator} second, and every
 * change is mirrored back into the ledger immediately.
 *
 * Not thread-safe: driven from the game thread only.
 */
public class CellStore {

    private static final Logger LOG = Logger.getLogger(CellStore.class.getName());

    private final Long2ObjectOpenHashMap<LiveCell> live = new Long2ObjectOpenHashMap<>();

    private final CellGenerator generator;
    private final MutationLedger ledger;
    private final HighestValueRecord highest;
    private final WorldListener listener;

    public CellStore(CellGenerator generator, MutationLedger ledger,
                     HighestValueRecord highest, WorldListener listener) {
        this.generator = generator;
        this.ledger = ledger;
        this.highest = highest;
        this.listener = listener;
    }

    /**
     * Return the live cell at {@code coordinate}, creating it if needed.
     * An already-live cell is returned untouched, without consulting the
     * ledger or generator again.
     */
    public LiveCell materialize(GridCoordinate coordinate) {
        long k = coordinate.key();
        LiveCell cell = live.get(k);
        if (cell != null) return cell;

        CellState state = ledger.restore(coordinate).orElseGet(() -> generator.generate(coordinate));
        cell = new LiveCell(coordinate, state);
        live.put(k, cell);
        highest.observe(state.value());
        LOG.fine(() -> "Materialized " + coordinate + " value=" + state.value());
        listener.onCellMaterialized(coordinate, state);
        return cell;
    }

    /**
     * Drop the live cell at {@code coordinate}, snapshotting its state into the
     * ledger first. The snapshot is unconditional, so an evicted cell never
     * relies on regeneration again. No-op if the cell is not live.
     */
    public void evict(GridCoordinate coordinate) {
        LiveCell cell = live.remove(coordinate.key());
        if (cell == null) return;
        ledger.save(coordinate, cell.getState());
        LOG.fine(() -> "Evicted " + coordinate);
        listener.onCellEvicted(coordinate);
    }

    /**
     * Change the state of a live cell and mirror it into the ledger.
     *
     * @throws IllegalStateException if {@code coordinate} is not live
     */
    public void setState(GridCoordinate coordinate, CellState state) {
        LiveCell cell = live.get(coordinate.key());
        if (cell == null) {
            throw new IllegalStateException("setState on non-live cell " + coordinate);
        }
        cell.setState(state);
        ledger.save(coordinate, state);
        highest.observe(state.value());
        listener.onCellUpdated(coordinate, state);
    }

    /**
     * Write a state whether or not the cell is live: live cells go through
     * {@link #setState}, off-screen cells straight into the ledger.
     */
    public void store(GridCoordinate coordinate, CellState state) {
        if (isLive(coordinate)) {
            setState(coordinate, state);
        } else {
            ledger.save(coordinate, state);
            highest.observe(state.value());
        }
    }

    /** Current state of any cell, live or not, without materializing it. */
    public CellState peek(GridCoordinate coordinate) {
        LiveCell cell = live.get(coordinate.key());
        if (cell != null) return cell.getState();
        return ledger.restore(coordinate).orElseGet(() -> generator.generate(coordinate));
    }

    public boolean isLive(GridCoordinate coordinate) {
        return live.containsKey(coordinate.key());
    }

    /** Live cell or null. */
    public LiveCell get(GridCoordinate coordinate) {
        return live.get(coordinate.key());
    }

    public int liveCount() {
        return live.size();
    }

    public Collection<LiveCell> liveCells() {
        return live.values();
    }

    public List<GridCoordinate> liveCoordinates() {
        List<GridCoordinate> result = new ArrayList<>(live.size());
        for (LiveCell cell : live.values()) {
            result.add(cell.getCoordinate());
        }
        return result;
    }

    /**
     * Drop every live cell without snapshotting. Used when the ledger is about
     * to be replaced wholesale (load/reset), so stale states must not leak in.
     */
    public void clear() {
        List<GridCoordinate> coords = liveCoordinates();
        live.clear();
        for (GridCoordinate c : coords) {
            listener.onCellEvicted(c);
        }
    }

    public MutationLedger getLedger() {
        return ledger;
    }
}
