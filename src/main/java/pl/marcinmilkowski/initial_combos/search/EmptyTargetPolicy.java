package pl.marcinmilkowski.initial_combos.search;

import java.util.Locale;

/**
 * What a search does with a target that has no initials.
 */
public enum EmptyTargetPolicy {
    /** Return a single empty combo with full coverage. */
    TRIVIAL,

    /** Fail with {@link EmptyTargetException}. */
    REJECT;

    public static EmptyTargetPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return TRIVIAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown empty target policy: " + value, e);
        }
    }
}
