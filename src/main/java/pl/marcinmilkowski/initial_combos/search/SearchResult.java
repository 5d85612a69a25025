package pl.marcinmilkowski.initial_combos.search;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * Outcome of one search call.
 *
 * A cancelled search still carries the combos finalized before the
 * cancellation was observed; {@link #requireComplete()} turns cancellation
 * into an exception for callers that want all-or-nothing behaviour.
 */
public record SearchResult(
    SearchTarget target,
    List<Combo> combos,
    boolean cancelled,
    int levels,             // Levels expanded (words added along the deepest path)
    long expandedStates,    // Successor states kept after per-level dedup
    int peakFrontier,       // Largest open frontier before pruning
    List<TraceEvent> trace  // Empty unless tracing was requested
) {

    public SearchResult {
        combos = List.copyOf(combos);
        trace = List.copyOf(trace);
    }

    /**
     * The combos, or an exception if the search was cancelled.
     *
     * @throws CancellationRequestedException if the search did not run to completion
     */
    public List<Combo> requireComplete() {
        if (cancelled) {
            throw new CancellationRequestedException(combos, levels);
        }
        return combos;
    }

    /**
     * Best combo, or null when nothing matched.
     */
    public Combo best() {
        return combos.isEmpty() ? null : combos.get(0);
    }

    public JSONObject toJson(boolean includeTrace) {
        JSONObject obj = new JSONObject();
        obj.put("mode", target.mode().wireName());
        obj.put("initials", new JSONArray(target.units()));
        JSONArray comboArray = new JSONArray();
        for (Combo combo : combos) {
            comboArray.add(combo.toJson());
        }
        obj.put("combos", comboArray);
        obj.put("cancelled", cancelled);
        obj.put("levels", levels);
        obj.put("expanded_states", expandedStates);
        if (includeTrace) {
            JSONArray events = new JSONArray();
            for (TraceEvent event : trace) {
                events.add(event.toJson());
            }
            obj.put("trace", events);
        }
        return obj;
    }
}
