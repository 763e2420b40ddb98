package com.geotokens.core;

import com.geotokens.agent.ActionQueue;
import com.geotokens.agent.Messages;
import com.geotokens.input.Direction;
import com.geotokens.input.MovementKeys;
import com.geotokens.save.SaveManager;
import com.geotokens.world.GridCoordinate;
import com.geotokens.world.LiveCell;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Game thread. Each tick drains the {@link ActionQueue} and applies the
 * actions to the {@link GameWorld} one by one, so every event is handled to
 * completion before the next one starts.
 */
public class GameLoop implements Runnable {

    private static final Logger LOG = Logger.getLogger(GameLoop.class.getName());

    private final GameWorld world;
    private final ActionQueue actions;
    private final SaveManager saveManager;
    private final MovementKeys keys;
    private final long tickMillis;

    private volatile boolean running;
    private Thread thread;

    /** {@code saveManager} may be null, in which case save/load are refused. */
    public GameLoop(GameWorld world, ActionQueue actions, SaveManager saveManager, MovementKeys keys) {
        this.world = world;
        this.actions = actions;
        this.saveManager = saveManager;
        this.keys = keys;
        this.tickMillis = world.getConfig().tickMillis;
    }

    public synchronized void start() {
        if (running) return;
        running = true;
        thread = new Thread(this, "GameLoop");
        thread.setDaemon(true);
        thread.start();
    }

    public void stop() {
        running = false;
        Thread t = thread;
        if (t != null) {
            t.interrupt();
            try {
                t.join(2000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void run() {
        LOG.info("Game loop started (" + tickMillis + " ms tick)");
        while (running) {
            tick();
            try {
                Thread.sleep(tickMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        LOG.info("Game loop stopped (" + actions.getTotalProcessed() + " actions processed)");
    }

    /** Apply every pending action. */
    public void tick() {
        actions.drain(this::apply);
    }

    void apply(ActionQueue.GameAction action) {
        try {
            switch (action.type()) {
                case MOVE -> {
                    if (!world.playerMoved(action.lat(), action.lng())) {
                        action.respond(Messages.error("Position out of range: " + action.lat() + ", " + action.lng()));
                    }
                }
                case STEP -> move(Direction.fromString(action.text()), action);
                case KEY -> move(keys.lookup(action.text()), action);
                case COLLECT, DOUBLE, AFFORDANCES -> interact(action);
                case SAVE -> save(action);
                case LOAD -> load(action);
                case RESET -> {
                    world.reset();
                    action.respond(Messages.status("Session reset"));
                }
                case SYNC -> sync(action);
                case LIST_SESSIONS -> listSessions(action);
                case DELETE_SESSION -> deleteSession(action);
            }
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Action " + action.type() + " from " + action.sourceId() + " failed", e);
            action.respond(Messages.error("Internal error: " + e.getMessage()));
        }
    }

    private void move(Direction direction, ActionQueue.GameAction action) {
        if (direction == null) {
            action.respond(Messages.error("Unknown direction: " + action.text()));
            return;
        }
        if (!world.step(direction)) {
            action.respond(Messages.error("Cannot move " + direction.name().toLowerCase() + " from here"));
        }
    }

    private void interact(ActionQueue.GameAction action) {
        GridCoordinate c = new GridCoordinate(action.i(), action.j());
        // Clients are not trusted to only target visible cells
        if (!world.isLive(c)) {
            action.respond(Messages.error("Cell " + c + " is not in view"));
            return;
        }
        switch (action.type()) {
            case COLLECT -> action.respond(Messages.result(world.attemptCollect(c)));
            case DOUBLE -> action.respond(Messages.result(world.attemptDouble(c)));
            default -> action.respond(Messages.affordances(c, world.affordances(c)));
        }
    }

    private void save(ActionQueue.GameAction action) {
        if (saveManager == null) {
            action.respond(Messages.error("Saving is disabled"));
            return;
        }
        try {
            saveManager.save(world);
            action.respond(Messages.status("Saved"));
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Save failed", e);
            action.respond(Messages.error("Save failed: " + e.getMessage()));
        }
    }

    private void load(ActionQueue.GameAction action) {
        if (saveManager == null) {
            action.respond(Messages.error("Saving is disabled"));
            return;
        }
        if (!saveManager.exists()) {
            action.respond(Messages.error("No saved session '" + saveManager.getSessionName() + "'"));
            return;
        }
        boolean loaded = saveManager.load(world);
        action.respond(Messages.status(loaded ? "Loaded" : "No usable save, started fresh"));
    }

    private void listSessions(ActionQueue.GameAction action) {
        if (saveManager == null) {
            action.respond(Messages.error("Saving is disabled"));
            return;
        }
        action.respond(Messages.sessions(saveManager.getSessionName(), saveManager.listSessions()));
    }

    private void deleteSession(ActionQueue.GameAction action) {
        if (saveManager == null) {
            action.respond(Messages.error("Saving is disabled"));
            return;
        }
        try {
            boolean deleted = saveManager.deleteSession(action.text());
            action.respond(deleted
                ? Messages.status("Deleted session '" + action.text() + "'")
                : Messages.error("No session '" + action.text() + "'"));
        } catch (IllegalArgumentException e) {
            action.respond(Messages.error(e.getMessage()));
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Deleting session " + action.text() + " failed", e);
            action.respond(Messages.error("Delete failed: " + e.getMessage()));
        }
    }

    /** Send the whole current view to one client. */
    private void sync(ActionQueue.GameAction action) {
        for (LiveCell cell : world.getCells().liveCells()) {
            action.respond(Messages.cellAdd(cell.getCoordinate(), cell.getState()));
        }
        action.respond(Messages.player(world.getPlayer().getLat(), world.getPlayer().getLng(),
            world.getPlayer().getCurrentCell()));
        action.respond(Messages.held(world.getHeldToken()));
        action.respond(Messages.highest(world.getHighestValue()));
    }
}
