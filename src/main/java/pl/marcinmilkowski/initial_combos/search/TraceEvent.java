package pl.marcinmilkowski.initial_combos.search;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * One step of a traced search.
 *
 * {@code count} depends on the type: frontier size for "level" and "prune"
 * (after pruning), successors for "expand", result count for "done".
 */
public record TraceEvent(
    Type type,
    int level,
    List<String> words,
    List<String> remaining,
    double score,
    int count
) {

    public enum Type {
        LEVEL, EXPAND, COMPLETE, STUCK, PRUNE, CANCELLED, DONE;

        public String wireName() {
            return name().toLowerCase(java.util.Locale.ROOT);
        }
    }

    public TraceEvent {
        words = List.copyOf(words);
        remaining = List.copyOf(remaining);
    }

    static TraceEvent marker(Type type, int level, int count) {
        return new TraceEvent(type, level, List.of(), List.of(), 0.0, count);
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("event", type.wireName());
        obj.put("level", level);
        if (!words.isEmpty()) {
            obj.put("words", new JSONArray(words));
        }
        if (!remaining.isEmpty()) {
            obj.put("remaining", new JSONArray(remaining));
        }
        if (type == Type.EXPAND || type == Type.COMPLETE || type == Type.STUCK) {
            obj.put("score", score);
        }
        obj.put("count", count);
        return obj;
    }
}
