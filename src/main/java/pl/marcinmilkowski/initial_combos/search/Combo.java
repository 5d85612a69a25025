package pl.marcinmilkowski.initial_combos.search;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.List;

/**
 * A ranked combination of dictionary words whose initials match a target.
 *
 * {@code coverage} is the fraction of requested initial-units matched; 1.0
 * means the words' initials reproduce the target exactly (in order for
 * sequence mode, as a multiset for bag mode).
 */
public record Combo(
    List<String> words,             // Chosen words, in combo order
    double score,                   // Normalized combo score
    SearchMode mode,                // Mode the combo was found in
    double coverage,                // Matched units / requested units, in [0, 1]
    List<Double> wordScores,        // Per-word scores, parallel to words
    List<String> sources,           // Dictionary of each word, parallel to words
    List<String> matchedInitials    // Initials covered by the words, in combo order
) {

    public Combo {
        words = List.copyOf(words);
        wordScores = List.copyOf(wordScores);
        sources = List.copyOf(sources);
        matchedInitials = List.copyOf(matchedInitials);
        if (coverage < 0.0 || coverage > 1.0) {
            throw new IllegalArgumentException("coverage out of range: " + coverage);
        }
    }

    /**
     * The empty combo that trivially satisfies an empty target.
     */
    public static Combo empty(SearchMode mode) {
        return new Combo(List.of(), 0.0, mode, 1.0, List.of(), List.of(), List.of());
    }

    /**
     * The words joined together, e.g. "결근신상".
     */
    public String combo() {
        return String.join("", words);
    }

    public int wordCount() {
        return words.size();
    }

    public boolean isComplete() {
        return coverage == 1.0;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("combo", combo());
        obj.put("words", new JSONArray(words));
        obj.put("score", score);
        obj.put("mode", mode.wireName());
        obj.put("coverage", coverage);
        obj.put("word_scores", new JSONArray(wordScores));
        obj.put("word_sources", new JSONArray(sources));
        obj.put("matched_initials", new JSONArray(matchedInitials));
        return obj;
    }

    @Override
    public String toString() {
        return String.format("%s %s score=%.3f coverage=%.2f (%s)",
            combo(), words, score, coverage, mode.wireName());
    }
}
