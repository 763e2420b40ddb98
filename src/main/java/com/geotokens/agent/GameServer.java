package com.geotokens.agent;

import com.geotokens.world.CellState;
import com.geotokens.world.GameConfig;
import com.geotokens.world.GridCoordinate;
import com.geotokens.world.PlayerToken;
import com.geotokens.world.WorldListener;
import org.java_websocket.WebSocket;
import org.java_websocket.handshake.ClientHandshake;
import org.java_websocket.server.WebSocketServer;

import java.net.InetSocketAddress;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * WebSocket server for renderer and controller clients.
 * <p>
 * Incoming actions are parsed and routed to the {@link ActionQueue}; world
 * events are broadcast to every connected client as they happen.
 * <p>
 * Thread safety: WebSocket callbacks run on java-websocket threads and only
 * touch the queue. Broadcasts are called from the game loop thread.
 */
public class GameServer extends WebSocketServer implements WorldListener {

    private static final Logger LOG = Logger.getLogger(GameServer.class.getName());

    private final ActionQueue actionQueue;
    private final GameConfig config;
    private final Set<WebSocket> clients = Collections.newSetFromMap(new ConcurrentHashMap<>());

    public GameServer(GameConfig config, ActionQueue actionQueue) {
        super(new InetSocketAddress(config.serverPort));
        this.config = config;
        this.actionQueue = actionQueue;
        setReuseAddr(true);
        setDaemon(true);
    }

    // ---- WebSocket callbacks ----

    @Override
    public void onOpen(WebSocket conn, ClientHandshake handshake) {
        String id = connId(conn);
        clients.add(conn);
        LOG.info("[GameServer] Client connected: " + id + " (total: " + clients.size() + ")");

        try {
            conn.send(Messages.buildHello(config.cellSizeDegrees, config.viewportRadius,
                config.collectionRadiusMeters, config.winThreshold));
        } catch (Exception e) {
            LOG.warning("[GameServer] Failed to send hello to " + id + ": " + e.getMessage());
            return;
        }
        // Current view is sent from the game thread
        actionQueue.enqueue(ActionQueue.GameAction.of(ActionQueue.Type.SYNC, id, replyTo(conn)));
    }

    @Override
    public void onClose(WebSocket conn, int code, String reason, boolean remote) {
        clients.remove(conn);
        LOG.info("[GameServer] Client disconnected: " + connId(conn) +
                 " (code=" + code + ", reason=" + reason + ", total: " + clients.size() + ")");
    }

    @Override
    public void onMessage(WebSocket conn, String message) {
        String sourceId = connId(conn);
        ActionQueue.GameAction action = Messages.parseAction(message, sourceId, replyTo(conn));
        if (action != null) {
            actionQueue.enqueue(action);
        } else {
            LOG.warning("[GameServer] Unrecognized message from " + sourceId + ": " +
                       (message.length() > 100 ? message.substring(0, 100) + "..." : message));
            send(conn, Messages.error("Unrecognized message"));
        }
    }

    @Override
    public void onError(WebSocket conn, Exception ex) {
        String id = conn != null ? connId(conn) : "server";
        LOG.warning("[GameServer] Error (" + id + "): " + ex.getMessage());
    }

    @Override
    public void onStart() {
        LOG.info("[GameServer] WebSocket server started on port " + getPort());
    }

    // ---- World events (called from game loop) ----

    @Override
    public void onCellMaterialized(GridCoordinate coordinate, CellState state) {
        broadcastAll(Messages.cellAdd(coordinate, state));
    }

    @Override
    public void onCellUpdated(GridCoordinate coordinate, CellState state) {
        broadcastAll(Messages.cellUpdate(coordinate, state));
    }

    @Override
    public void onCellEvicted(GridCoordinate coordinate) {
        broadcastAll(Messages.cellRemove(coordinate));
    }

    @Override
    public void onHighestValueChanged(int value) {
        broadcastAll(Messages.highest(value));
    }

    @Override
    public void onThresholdReached() {
        broadcastAll(Messages.win(config.winThreshold));
    }

    @Override
    public void onPlayerMoved(double lat, double lng, GridCoordinate cell) {
        broadcastAll(Messages.player(lat, lng, cell));
    }

    @Override
    public void onHeldTokenChanged(PlayerToken token) {
        broadcastAll(Messages.held(token));
    }

    private void broadcastAll(String message) {
        if (clients.isEmpty()) return;
        for (WebSocket client : clients) {
            send(client, message);
        }
    }

    // ---- Utility ----

    private static Consumer<String> replyTo(WebSocket conn) {
        return msg -> send(conn, msg);
    }

    private static void send(WebSocket conn, String message) {
        try {
            conn.send(message);
        } catch (Exception e) {
            LOG.fine("[GameServer] Failed to send to " + connId(conn) + ": " + e.getMessage());
        }
    }

    /** Get a short identifier for a connection. */
    private static String connId(WebSocket conn) {
        if (conn == null || conn.getRemoteSocketAddress() == null) return "unknown";
        return conn.getRemoteSocketAddress().toString();
    }

    /** Graceful shutdown. */
    public void shutdown() {
        try {
            stop(1000);
            LOG.info("[GameServer] Server stopped");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
