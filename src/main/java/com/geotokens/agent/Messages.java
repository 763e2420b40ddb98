package com.geotokens.agent;

import com.geotokens.sim.Affordances;
import com.geotokens.sim.InteractionResult;
import com.geotokens.sim.Rejection;
import com.geotokens.world.CellState;
import com.geotokens.world.GridCoordinate;
import com.geotokens.world.PlayerToken;

import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.function.Consumer;

/**
 * Message schemas for the control protocol.
 * <p>
 * All messages are JSON. This class provides static builders
 * to construct JSON strings without a dependency on a JSON library.
 * <p>
 * Protocol message types:
 * <ul>
 *   <li><b>Server → Client:</b> hello, cell_add, cell_update, cell_remove,
 *       player, held, highest, win, result, affordances, sessions, status, error</li>
 *   <li><b>Client → Server:</b> move, step, key, collect, double, affordances,
 *       save, load, reset, sync, sessions, delete_session</li>
 * </ul>
 */
public final class Messages {

    private Messages() {}

    // ---- JSON Utility helpers ----

    /** Escape a string for JSON. */
    static String jsonStr(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder(s.length() + 2);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    // Full precision: a cell is only 1e-4 degrees wide
    static String jsonNum(double v) {
        if (v == (long) v) return String.valueOf((long) v);
        return Double.toString(v);
    }

    // ---- Hello message (handshake) ----

    public static String buildHello(double cellSizeDegrees, int viewportRadius,
                                    double collectionRadiusMeters, int winThreshold) {
        return "{\"type\":\"hello\",\"version\":\"1.0\""
            + ",\"cell_size\":" + jsonNum(cellSizeDegrees)
            + ",\"viewport_radius\":" + viewportRadius
            + ",\"collection_radius\":" + jsonNum(collectionRadiusMeters)
            + ",\"win_threshold\":" + winThreshold
            + ",\"actions\":[\"move\",\"step\",\"key\",\"collect\",\"double\",\"affordances\","
            + "\"save\",\"load\",\"reset\",\"sync\",\"sessions\",\"delete_session\"]}";
    }

    // ---- World events ----

    public static String cellAdd(GridCoordinate c, CellState state) {
        return cellMessage("cell_add", c, state);
    }

    public static String cellUpdate(GridCoordinate c, CellState state) {
        return cellMessage("cell_update", c, state);
    }

    public static String cellRemove(GridCoordinate c) {
        return "{\"type\":\"cell_remove\",\"i\":" + c.i() + ",\"j\":" + c.j() + "}";
    }

    private static String cellMessage(String type, GridCoordinate c, CellState state) {
        return "{\"type\":" + jsonStr(type)
            + ",\"i\":" + c.i() + ",\"j\":" + c.j()
            + ",\"has_token\":" + state.hasToken()
            + ",\"value\":" + state.value() + "}";
    }

    public static String player(double lat, double lng, GridCoordinate cell) {
        return "{\"type\":\"player\",\"lat\":" + jsonNum(lat) + ",\"lng\":" + jsonNum(lng)
            + ",\"i\":" + cell.i() + ",\"j\":" + cell.j() + "}";
    }

    public static String held(PlayerToken token) {
        if (token == null) return "{\"type\":\"held\",\"value\":null}";
        return "{\"type\":\"held\",\"value\":" + token.value()
            + ",\"i\":" + token.origin().i() + ",\"j\":" + token.origin().j() + "}";
    }

    public static String highest(int value) {
        return "{\"type\":\"highest\",\"value\":" + value + "}";
    }

    public static String win(int threshold) {
        return "{\"type\":\"win\",\"threshold\":" + threshold + "}";
    }

    // ---- Replies ----

    public static String result(InteractionResult r) {
        StringBuilder sb = new StringBuilder(160);
        sb.append("{\"type\":\"result\",\"action\":").append(jsonStr(r.action().name().toLowerCase()));
        sb.append(",\"i\":").append(r.coordinate().i());
        sb.append(",\"j\":").append(r.coordinate().j());
        sb.append(",\"ok\":").append(r.isSuccess());
        sb.append(",\"reason\":").append(r.isSuccess() ? "null" : jsonStr(r.rejection().name()));
        sb.append(",\"distance\":").append(Math.round(r.distanceMeters()));
        sb.append(",\"message\":").append(jsonStr(r.message()));
        sb.append('}');
        return sb.toString();
    }

    /**
     * What a cell allows right now. A hint is null for an allowed action,
     * otherwise the text to show on the disabled button.
     */
    public static String affordances(GridCoordinate c, Affordances a) {
        StringBuilder sb = new StringBuilder(200);
        sb.append("{\"type\":\"affordances\",\"i\":").append(c.i()).append(",\"j\":").append(c.j());
        sb.append(",\"can_collect\":").append(a.canCollect());
        sb.append(",\"can_double\":").append(a.canDouble());
        sb.append(",\"collect_hint\":").append(hint(InteractionResult.Action.COLLECT, c, a.collectRejection(), a));
        sb.append(",\"double_hint\":").append(hint(InteractionResult.Action.DOUBLE, c, a.doubleRejection(), a));
        sb.append(",\"distance\":").append(Math.round(a.distanceMeters()));
        sb.append(",\"value\":").append(a.cellValue());
        sb.append(",\"held\":").append(a.heldValue());
        sb.append('}');
        return sb.toString();
    }

    private static String hint(InteractionResult.Action action, GridCoordinate c, Rejection why, Affordances a) {
        if (why == null) return "null";
        return jsonStr(InteractionResult.rejected(action, c, why, a.distanceMeters(),
            a.cellValue(), a.heldValue()).message());
    }

    public static String sessions(String current, List<String> names) {
        StringBuilder sb = new StringBuilder(64);
        sb.append("{\"type\":\"sessions\",\"current\":").append(jsonStr(current)).append(",\"names\":[");
        for (int n = 0; n < names.size(); n++) {
            if (n > 0) sb.append(',');
            sb.append(jsonStr(names.get(n)));
        }
        sb.append("]}");
        return sb.toString();
    }

    public static String status(String message) {
        return "{\"type\":\"status\",\"message\":" + jsonStr(message) + "}";
    }

    public static String error(String message) {
        return "{\"type\":\"error\",\"message\":" + jsonStr(message) + "}";
    }

    // ---- Action parsing (Client → Server) ----

    /**
     * Parse an incoming JSON action message. Minimal hand-parser to avoid
     * adding a JSON library dependency.
     * <p>
     * Returns null if the message is not a valid action.
     */
    public static ActionQueue.GameAction parseAction(String json, String sourceId, Consumer<String> reply) {
        if (json == null || json.isBlank()) return null;
        json = json.trim();

        String type = extractString(json, "type");
        if (type == null) return null;

        return switch (type) {
            case "move" -> {
                OptionalDouble lat = extractDouble(json, "lat");
                OptionalDouble lng = extractDouble(json, "lng");
                if (lat.isEmpty() || lng.isEmpty()) yield null;
                yield ActionQueue.GameAction.move(lat.getAsDouble(), lng.getAsDouble(), sourceId, reply);
            }
            case "step" -> {
                String dir = extractString(json, "direction");
                yield dir == null ? null : ActionQueue.GameAction.step(dir, sourceId, reply);
            }
            case "key" -> {
                String key = extractString(json, "key");
                yield key == null ? null : ActionQueue.GameAction.key(key, sourceId, reply);
            }
            case "collect" -> cellAction(ActionQueue.Type.COLLECT, json, sourceId, reply);
            case "double" -> cellAction(ActionQueue.Type.DOUBLE, json, sourceId, reply);
            case "affordances" -> cellAction(ActionQueue.Type.AFFORDANCES, json, sourceId, reply);
            case "save" -> ActionQueue.GameAction.of(ActionQueue.Type.SAVE, sourceId, reply);
            case "load" -> ActionQueue.GameAction.of(ActionQueue.Type.LOAD, sourceId, reply);
            case "reset" -> ActionQueue.GameAction.of(ActionQueue.Type.RESET, sourceId, reply);
            case "sync" -> ActionQueue.GameAction.of(ActionQueue.Type.SYNC, sourceId, reply);
            case "sessions" -> ActionQueue.GameAction.of(ActionQueue.Type.LIST_SESSIONS, sourceId, reply);
            case "delete_session" -> {
                String name = extractString(json, "name");
                yield name == null ? null : ActionQueue.GameAction.deleteSession(name, sourceId, reply);
            }
            default -> null;
        };
    }

    private static ActionQueue.GameAction cellAction(ActionQueue.Type type, String json,
                                                     String sourceId, Consumer<String> reply) {
        OptionalInt i = extractInt(json, "i");
        OptionalInt j = extractInt(json, "j");
        if (i.isEmpty() || j.isEmpty()) return null;
        return ActionQueue.GameAction.cell(type, i.getAsInt(), j.getAsInt(), sourceId, reply);
    }

    // ---- Minimal JSON field extractors ----

    static String extractString(String json, String key) {
        String search = "\"" + key + "\"";
        int idx = json.indexOf(search);
        if (idx < 0) return null;
        idx = json.indexOf(':', idx + search.length());
        if (idx < 0) return null;
        idx++;
        // Skip whitespace
        while (idx < json.length() && json.charAt(idx) == ' ') idx++;
        if (idx >= json.length() || json.charAt(idx) != '"') return null;
        idx++; // skip opening quote
        int end = json.indexOf('"', idx);
        if (end < 0) return null;
        return json.substring(idx, end);
    }

    /** Empty if the key is missing or its value is not a finite number. */
    static OptionalDouble extractDouble(String json, String key) {
        String search = "\"" + key + "\"";
        int idx = json.indexOf(search);
        if (idx < 0) return OptionalDouble.empty();
        idx = json.indexOf(':', idx + search.length());
        if (idx < 0) return OptionalDouble.empty();
        idx++;
        while (idx < json.length() && json.charAt(idx) == ' ') idx++;
        int end = idx;
        while (end < json.length() && isNumberChar(json.charAt(end))) end++;
        if (end == idx) return OptionalDouble.empty();
        try {
            double v = Double.parseDouble(json.substring(idx, end));
            return Double.isFinite(v) ? OptionalDouble.of(v) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /** Empty unless the value is a whole number in int range. */
    static OptionalInt extractInt(String json, String key) {
        OptionalDouble v = extractDouble(json, key);
        if (v.isEmpty()) return OptionalInt.empty();
        double d = v.getAsDouble();
        if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) return OptionalInt.empty();
        return OptionalInt.of((int) d);
    }

    private static boolean isNumberChar(char c) {
        return Character.isDigit(c) || c == '.' || c == '-' || c == '+' || c == 'E' || c == 'e';
    }
}
