package pl.marcinmilkowski.initial_combos.search;

import java.util.*;

/**
 * The initials a search must cover.
 *
 * Bag targets keep their units sorted, so two bag targets built from the same
 * multiset are equal no matter the order the caller supplied.
 */
public record SearchTarget(SearchMode mode, List<String> units) {

    public SearchTarget {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(units, "units");
        for (String unit : units) {
            if (unit == null || unit.isBlank()) {
                throw new InvalidParameterException("Target contains a blank initial-unit");
            }
        }
        if (mode == SearchMode.BAG) {
            List<String> sorted = new ArrayList<>(units);
            Collections.sort(sorted);
            units = List.copyOf(sorted);
        } else {
            units = List.copyOf(units);
        }
    }

    public static SearchTarget sequence(List<String> units) {
        return new SearchTarget(SearchMode.SEQUENCE, units);
    }

    public static SearchTarget bag(List<String> units) {
        return new SearchTarget(SearchMode.BAG, units);
    }

    public int size() {
        return units.size();
    }

    public boolean isEmpty() {
        return units.isEmpty();
    }

    @Override
    public String toString() {
        return mode.wireName() + units;
    }
}
