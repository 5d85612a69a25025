package pl.marcinmilkowski.initial_combos.lexicon;

import java.util.Locale;

/**
 * How the entry store resolves a word that arrives more than once.
 */
public enum ReconciliationPolicy {
    /** Highest score wins; ties go to the lexicographically smallest source. */
    MAX_SCORE,

    /** The first entry added for a word wins. */
    FIRST_WINS,

    /**
     * Like MAX_SCORE across sources, but a repeated (word, source) pair with a
     * different score or different initials is a conflict.
     */
    REJECT;

    public static ReconciliationPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return MAX_SCORE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown reconciliation policy: " + value, e);
        }
    }
}
