package pl.marcinmilkowski.initial_combos.lexicon;

import pl.marcinmilkowski.initial_combos.initials.HangulInitialsCodec;
import pl.marcinmilkowski.initial_combos.initials.InitialsCodec;

import java.util.List;

/**
 * Test helper for building small syllable-mode lexicons.
 */
public class TestLexicon {

    public static final InitialsCodec CODEC = new HangulInitialsCodec();

    public static LexiconEntry entry(String word, double score) {
        return entry(word, score, "표준국어대사전");
    }

    public static LexiconEntry entry(String word, double score, String source) {
        return new LexiconEntry(word, CODEC.initialsOf(word), score, source);
    }

    public static LexiconIndex index(LexiconEntry... entries) {
        return LexiconIndex.build(List.of(entries), ReconciliationPolicy.MAX_SCORE);
    }

    /**
     * The four-word lexicon from the usage examples: 결근, 신상, 결과, 근처.
     */
    public static LexiconIndex basic() {
        return index(
            entry("결근", 2.0),
            entry("신상", 2.0),
            entry("결과", 3.0, "한국어기초사전"),
            entry("근처", 1.0, "우리말샘"));
    }
}
