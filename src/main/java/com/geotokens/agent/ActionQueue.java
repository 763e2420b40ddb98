package com.geotokens.agent;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Thread-safe action buffer for client commands.
 * <p>
 * WebSocket threads enqueue actions; the game loop drains them each tick on
 * its own thread, so the game world only ever sees one action at a time.
 */
public class ActionQueue {

    public enum Type { MOVE, STEP, KEY, COLLECT, DOUBLE, AFFORDANCES, SAVE, LOAD, RESET, SYNC, LIST_SESSIONS, DELETE_SESSION }

    /**
     * A single client action with type tag and parameters.
     * {@code reply} receives response messages for the sender; may be null.
     */
    public record GameAction(
        Type type,
        double lat,
        double lng,
        int i,
        int j,
        String text,      // direction, key or session name
        String sourceId,
        Consumer<String> reply
    ) {
        public static GameAction move(double lat, double lng, String src, Consumer<String> reply) {
            return new GameAction(Type.MOVE, lat, lng, 0, 0, null, src, reply);
        }

        public static GameAction step(String direction, String src, Consumer<String> reply) {
            return new GameAction(Type.STEP, 0, 0, 0, 0, direction, src, reply);
        }

        public static GameAction key(String key, String src, Consumer<String> reply) {
            return new GameAction(Type.KEY, 0, 0, 0, 0, key, src, reply);
        }

        /** Action on one cell: collect, double or affordances. */
        public static GameAction cell(Type type, int i, int j, String src, Consumer<String> reply) {
            return new GameAction(type, 0, 0, i, j, null, src, reply);
        }

        public static GameAction deleteSession(String name, String src, Consumer<String> reply) {
            return new GameAction(Type.DELETE_SESSION, 0, 0, 0, 0, name, src, reply);
        }

        public static GameAction of(Type type, String src, Consumer<String> reply) {
            return new GameAction(type, 0, 0, 0, 0, null, src, reply);
        }

        public void respond(String message) {
            if (reply != null) reply.accept(message);
        }
    }

    private final ConcurrentLinkedQueue<GameAction> queue = new ConcurrentLinkedQueue<>();
    private final AtomicLong totalProcessed = new AtomicLong(0);

    /** Enqueue an action from a client. Thread-safe. */
    public void enqueue(GameAction action) {
        queue.add(action);
    }

    /**
     * Drain all queued actions, passing each to the consumer.
     * Called once per tick from the game thread.
     */
    public void drain(Consumer<GameAction> consumer) {
        GameAction action;
        while ((action = queue.poll()) != null) {
            consumer.accept(action);
            totalProcessed.incrementAndGet();
        }
    }

    public long getTotalProcessed() {
        return totalProcessed.get();
    }
}
