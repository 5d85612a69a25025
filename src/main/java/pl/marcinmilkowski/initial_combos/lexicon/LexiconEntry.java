package pl.marcinmilkowski.initial_combos.lexicon;

import java.util.Comparator;
import java.util.List;

/**
 * A single dictionary word together with its initial-unit sequence.
 *
 * Sorted by score descending, then word, then source, which gives every
 * lookup in the index a deterministic total order.
 */
public record LexiconEntry(
    String word,               // The headword, NFC-normalized
    List<String> initials,     // One initial-unit per syllable, never empty
    double score,              // Dictionary provenance weight, >= 0
    String source              // Dictionary the word came from
) implements Comparable<LexiconEntry> {

    public static final Comparator<LexiconEntry> BY_SCORE = Comparator
        .comparingDouble(LexiconEntry::score).reversed()
        .thenComparing(LexiconEntry::word)
        .thenComparing(LexiconEntry::source);

    public LexiconEntry {
        if (word == null || word.isBlank()) {
            throw new IllegalArgumentException("Entry word must not be blank");
        }
        if (initials == null || initials.isEmpty()) {
            throw new IllegalArgumentException("Entry initials must not be empty: " + word);
        }
        for (String unit : initials) {
            if (unit == null || unit.isBlank()) {
                throw new IllegalArgumentException("Entry initials contain a blank unit: " + word);
            }
        }
        if (Double.isNaN(score) || Double.isInfinite(score) || score < 0) {
            throw new IllegalArgumentException("Entry score must be a finite non-negative number: "
                + word + " score=" + score);
        }
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("Entry source must not be blank: " + word);
        }
        initials = List.copyOf(initials);
    }

    /**
     * Number of initial-units this word covers.
     */
    public int length() {
        return initials.size();
    }

    @Override
    public int compareTo(LexiconEntry other) {
        return BY_SCORE.compare(this, other);
    }

    @Override
    public String toString() {
        return String.format("%s %s score=%.2f (%s)", word, initials, score, source);
    }
}
