package pl.marcinmilkowski.initial_combos.lexicon;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LexiconEntry record.
 */
class LexiconEntryTest {

    @Test
    @DisplayName("LexiconEntry should store word, initials, score and source")
    void testBasicFields() {
        LexiconEntry entry = new LexiconEntry("결근", List.of("결", "근"), 2.0, "표준국어대사전");

        assertEquals("결근", entry.word());
        assertEquals(List.of("결", "근"), entry.initials());
        assertEquals(2.0, entry.score(), 0.0001);
        assertEquals("표준국어대사전", entry.source());
        assertEquals(2, entry.length());
    }

    @Test
    @DisplayName("Initials are copied and immutable")
    void testInitialsCopied() {
        List<String> initials = new ArrayList<>(List.of("결", "근"));
        LexiconEntry entry = new LexiconEntry("결근", initials, 1.0, "우리말샘");
        initials.add("신");

        assertEquals(2, entry.length());
        assertThrows(UnsupportedOperationException.class, () -> entry.initials().add("x"));
    }

    @Test
    @DisplayName("Invalid entries are rejected")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new LexiconEntry(" ", List.of("결"), 1.0, "s"));
        assertThrows(IllegalArgumentException.class, () -> new LexiconEntry("결", List.of(), 1.0, "s"));
        assertThrows(IllegalArgumentException.class, () -> new LexiconEntry("결", List.of(" "), 1.0, "s"));
        assertThrows(IllegalArgumentException.class, () -> new LexiconEntry("결", List.of("결"), -1.0, "s"));
        assertThrows(IllegalArgumentException.class, () -> new LexiconEntry("결", List.of("결"), Double.NaN, "s"));
        assertThrows(IllegalArgumentException.class, () -> new LexiconEntry("결", List.of("결"), 1.0, ""));
    }

    @Test
    @DisplayName("Entries sort by score descending, then word")
    void testOrdering() {
        List<LexiconEntry> entries = new ArrayList<>(List.of(
            TestLexicon.entry("근처", 1.0),
            TestLexicon.entry("결과", 3.0),
            TestLexicon.entry("결근", 2.0),
            TestLexicon.entry("가방", 2.0)));
        entries.sort(LexiconEntry.BY_SCORE);

        assertEquals(List.of("결과", "가방", "결근", "근처"),
            entries.stream().map(LexiconEntry::word).toList());
    }
}
