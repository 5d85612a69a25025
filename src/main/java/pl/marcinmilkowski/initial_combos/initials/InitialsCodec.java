package pl.marcinmilkowski.initial_combos.initials;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives initial-unit sequences from words.
 *
 * Implementations are pure functions of their input and hold no mutable state,
 * so a single instance can be shared by the loader, the API server and any
 * number of concurrent searches.
 */
public interface InitialsCodec {

    /**
     * Decompose a word into its initial-unit sequence.
     *
     * @param word The word to decompose
     * @return One unit per syllable, never empty for a non-blank word
     * @throws UnsupportedCharacterException if a character cannot be decomposed
     */
    List<String> initialsOf(String word);

    /**
     * Normalize a unit typed by a caller (e.g. a target initial) to the form
     * stored in the index.
     *
     * @throws UnsupportedCharacterException if the unit is not a valid initial-unit
     */
    String normalizeUnit(String unit);

    /**
     * The kind of unit this codec produces.
     */
    UnitKind unitKind();

    /**
     * Take the first initial-unit of each word. Blank words are skipped.
     *
     * @param words Example words, e.g. ["결과", "근처"]
     * @return First unit of each word, e.g. ["결", "근"]
     */
    default List<String> initialsFromWords(List<String> words) {
        List<String> initials = new ArrayList<>();
        if (words == null) {
            return initials;
        }
        for (String word : words) {
            if (word == null || word.isBlank()) {
                continue;
            }
            initials.add(initialsOf(word).get(0));
        }
        return initials;
    }

    /**
     * Normalize every unit of a caller-supplied target.
     */
    default List<String> normalizeUnits(List<String> units) {
        List<String> normalized = new ArrayList<>(units.size());
        for (String unit : units) {
            normalized.add(normalizeUnit(unit));
        }
        return normalized;
    }
}
