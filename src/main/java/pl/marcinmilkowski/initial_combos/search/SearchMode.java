package pl.marcinmilkowski.initial_combos.search;

import java.util.Locale;

/**
 * How the requested initials must be matched.
 */
public enum SearchMode {
    /** Initials must be matched in the requested order. */
    SEQUENCE("sequence"),

    /** Initials are an unordered multiset; any word order is acceptable. */
    BAG("bag");

    private final String wireName;

    SearchMode(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static SearchMode fromKeepOrder(boolean keepOrder) {
        return keepOrder ? SEQUENCE : BAG;
    }

    public static SearchMode parse(String value) {
        if (value == null || value.isBlank()) {
            return SEQUENCE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (SearchMode mode : values()) {
            if (mode.wireName.equals(normalized)) {
                return mode;
            }
        }
        throw new InvalidParameterException("Unknown search mode: " + value);
    }
}
