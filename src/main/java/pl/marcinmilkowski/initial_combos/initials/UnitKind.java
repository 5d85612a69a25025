package pl.marcinmilkowski.initial_combos.initials;

import java.util.Locale;

/**
 * What counts as one initial-unit.
 */
public enum UnitKind {
    /** A whole Hangul syllable block: 결근 -> [결, 근] */
    SYLLABLE,

    /** The leading consonant of each syllable: 결근 -> [ㄱ, ㄱ] */
    CHOSEONG;

    /**
     * Parse a config value, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static UnitKind parse(String value) {
        if (value == null || value.isBlank()) {
            return SYLLABLE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown unit kind: " + value, e);
        }
    }
}
