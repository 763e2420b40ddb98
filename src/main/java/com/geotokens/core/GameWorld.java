package com.geotokens.core;

import com.geotokens.input.Direction;
import com.geotokens.save.GameSnapshot;
import com.geotokens.save.SnapshotCodec;
import com.geotokens.sim.Affordances;
import com.geotokens.sim.InteractionResult;
import com.geotokens.sim.Player;
import com.geotokens.sim.TokenEngine;
import com.geotokens.world.CellState;
import com.geotokens.world.CellStore;
import com.geotokens.world.GameConfig;
import com.geotokens.world.GridCoordinate;
import com.geotokens.world.HighestValueRecord;
import com.geotokens.world.ListenerSet;
import com.geotokens.world.MutationLedger;
import com.geotokens.world.PlayerToken;
import com.geotokens.world.WorldListener;
import com.geotokens.world.gen.CellGenerator;
import com.geotokens.world.stream.ViewManager;
import org.joml.Vector2d;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The game session. Owns the generator, mutation ledger, live cell store,
 * highest-value record, player, token engine and view manager, and is the
 * only entry point for inbound events. Single-threaded.
 */
public class GameWorld {

    private static final Logger LOG = Logger.getLogger(GameWorld.class.getName());

    private final GameConfig config;
    private final ListenerSet listeners = new ListenerSet();

    private final CellGenerator generator;
    private final MutationLedger ledger;
    private final HighestValueRecord highest;
    private final CellStore cells;
    private final Player player;
    private final TokenEngine tokens;
    private final ViewManager view;

    public GameWorld(GameConfig config) {
        this(config, CellGenerator.createDefault(config));
    }

    public GameWorld(GameConfig config, CellGenerator generator) {
        this.config = config;
        this.generator = generator;
        this.ledger = new MutationLedger();
        this.highest = new HighestValueRecord(config.winThreshold, listeners);
        this.cells = new CellStore(generator, ledger, highest, listeners);
        this.player = new Player(config.originLat, config.originLng, config.cellSizeDegrees);
        this.tokens = new TokenEngine(cells, player, config.collectionRadiusMeters, listeners);
        this.view = new ViewManager(cells, player, config.viewportRadius, listeners);
    }

    public void addListener(WorldListener listener) {
        listeners.add(listener);
    }

    // ---- Inbound events ----

    /** Load the window around the player's starting position. */
    public void start() {
        view.refresh();
    }

    /** @return false if the position is off the globe and was ignored */
    public boolean playerMoved(double lat, double lng) {
        return view.onPlayerMoved(lat, lng);
    }

    /** Move the player one cell over. Refused past a pole or the antimeridian. */
    public boolean step(Direction direction) {
        Vector2d target = player.stepTarget(direction);
        return view.onPlayerMoved(target.x, target.y);
    }

    /** @throws IllegalStateException if the cell is not live */
    public InteractionResult attemptCollect(GridCoordinate coordinate) {
        InteractionResult result = tokens.collect(coordinate);
        LOG.fine(result::message);
        return result;
    }

    /** @throws IllegalStateException if the cell is not live */
    public InteractionResult attemptDouble(GridCoordinate coordinate) {
        InteractionResult result = tokens.doubleAt(coordinate);
        LOG.fine(result::message);
        return result;
    }

    public Affordances affordances(GridCoordinate coordinate) {
        return tokens.affordances(coordinate);
    }

    // ---- Persistence ----

    public GameSnapshot exportState() {
        return new GameSnapshot(ledger.entries(), player.getLat(), player.getLng(),
            highest.get(), tokens.getHeld());
    }

    public String exportBlob() {
        return SnapshotCodec.encode(exportState());
    }

    /**
     * Replace the session with {@code snapshot}. An invalid snapshot resets to
     * a fresh start instead of being partially applied.
     *
     * @return true if the snapshot was applied
     */
    public boolean importState(GameSnapshot snapshot) {
        try {
            snapshot.validate();
        } catch (IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Rejected session snapshot, starting fresh", e);
            reset();
            return false;
        }
        cells.clear();
        ledger.replaceAll(snapshot.ledger());
        highest.restore(snapshot.highestValue());
        tokens.restoreHeld(snapshot.heldToken());
        player.setPosition(snapshot.playerLat(), snapshot.playerLng());
        view.refresh();
        LOG.info("Imported session: " + ledger.size() + " ledger entries, highest " + highest.get());
        return true;
    }

    /** Import an encoded blob; corrupt or missing data resets to a fresh start. */
    public boolean importBlob(String blob) {
        GameSnapshot snapshot;
        try {
            snapshot = SnapshotCodec.decode(blob);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Could not decode session, starting fresh", e);
            reset();
            return false;
        }
        return importState(snapshot);
    }

    /** Fresh start: empty ledger, empty hand, highest 0, player at the origin. */
    public void reset() {
        cells.clear();
        ledger.clear();
        highest.restore(0);
        tokens.restoreHeld(null);
        player.setPosition(config.originLat, config.originLng);
        view.refresh();
    }

    // ---- Accessors ----

    /** Current state of any cell, live or not. */
    public CellState cellState(GridCoordinate coordinate) {
        return cells.peek(coordinate);
    }

    public boolean isLive(GridCoordinate coordinate) {
        return cells.isLive(coordinate);
    }

    public PlayerToken getHeldToken() { return tokens.getHeld(); }

    public int getHighestValue() { return highest.get(); }

    public boolean isWon() { return highest.isThresholdReached(); }

    public GameConfig getConfig() { return config; }
    public CellGenerator getGenerator() { return generator; }
    public MutationLedger getLedger() { return ledger; }
    public CellStore getCells() { return cells; }
    public Player getPlayer() { return player; }
}
