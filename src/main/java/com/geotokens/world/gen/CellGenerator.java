package com.geotokens.world.gen;

import com.geotokens.world.CellState;
import com.geotokens.world.GameConfig;
import com.geotokens.world.GameConstants;
import com.geotokens.world.GridCoordinate;

/**
 * Derives the initial state of a never-touched cell.
 *
 * The luck value is scaled to a raw integer in [0, 9]. The dead value (3) is
 * remapped to "no token" for sparsity; raw values within the token band
 * (1..4) become a token of that value, anything else an empty cell.
 */
public class CellGenerator {

    private final LuckSource luck;
    private final int deadValue;
    private final int tokenMin;
    private final int tokenMax;

    public CellGenerator(LuckSource luck, GameConfig config) {
        this.luck = luck;
        this.deadValue = config.deadValue;
        this.tokenMin = config.tokenMinValue;
        this.tokenMax = config.tokenMaxValue;
    }

    public static CellGenerator createDefault(GameConfig config) {
        return new CellGenerator(new HashedLuck(config.seed), config);
    }

    public CellState generate(GridCoordinate coordinate) {
        int raw = rawValue(coordinate);
        if (raw == deadValue) raw = 0;
        if (raw >= tokenMin && raw <= tokenMax) {
            return CellState.of(raw);
        }
        return CellState.EMPTY;
    }

    /** Unfiltered generator output in [0, RAW_VALUE_RANGE). */
    public int rawValue(GridCoordinate coordinate) {
        double l = luck.luck(coordinate);
        int raw = (int) Math.floor(l * GameConstants.RAW_VALUE_RANGE);
        // Clamp sources that return exactly 1.0
        return Math.min(Math.max(raw, 0), GameConstants.RAW_VALUE_RANGE - 1);
    }
}
