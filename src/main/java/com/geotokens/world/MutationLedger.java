package com.geotokens.world;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Latest known state of every cell that was ever mutated or evicted,
 * independent of whether the cell is currently live. Once a coordinate is in
 * the ledger it wins over the generator.
 *
 * Keys are packed coordinates (see {@link GridCoordinate#key}) so lookups don't box.
 */
public class MutationLedger {

    private final Long2ObjectOpenHashMap<CellState> entries = new Long2ObjectOpenHashMap<>();

    /** Overwrite any prior snapshot for {@code coordinate}. */
    public void save(GridCoordinate coordinate, CellState state) {
        entries.put(coordinate.key(), state);
    }

    /** Empty when the coordinate was never saved; caller falls back to generation. */
    public Optional<CellState> restore(GridCoordinate coordinate) {
        return Optional.ofNullable(entries.get(coordinate.key()));
    }

    public boolean contains(GridCoordinate coordinate) {
        return entries.containsKey(coordinate.key());
    }

    public int size() {
        return entries.size();
    }

    /** Copy of all entries, for export. */
    public Map<GridCoordinate, CellState> entries() {
        Map<GridCoordinate, CellState> copy = new LinkedHashMap<>(entries.size());
        for (Long2ObjectMap.Entry<CellState> e : entries.long2ObjectEntrySet()) {
            copy.put(GridCoordinate.fromKey(e.getLongKey()), e.getValue());
        }
        return copy;
    }

    /** Replace the whole ledger, for import. */
    public void replaceAll(Map<GridCoordinate, CellState> snapshot) {
        entries.clear();
        snapshot.forEach(this::save);
    }

    public void clear() {
        entries.clear();
    }
}
