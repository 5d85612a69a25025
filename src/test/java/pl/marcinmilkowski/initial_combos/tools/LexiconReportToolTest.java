package pl.marcinmilkowski.initial_combos.tools;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconIndex;
import pl.marcinmilkowski.initial_combos.lexicon.TestLexicon;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static pl.marcinmilkowski.initial_combos.lexicon.TestLexicon.entry;

/**
 * Unit tests for LexiconReportTool.
 */
class LexiconReportToolTest {

    @Test
    @DisplayName("Report counts entries, lengths and sources")
    @SuppressWarnings("unchecked")
    void testReport() {
        LexiconIndex index = TestLexicon.index(
            entry("결근", 2.0, "표준국어대사전"),
            entry("결근", 1.0, "우리말샘"),
            entry("신경세포", 1.0, "우리말샘"),
            entry("상", 1.0, "한국어기초사전"));

        Map<String, Object> report = LexiconReportTool.report(index, List.of("결근", "없는말"));

        assertEquals(3, report.get("entry_count"));
        Map<String, Integer> histogram = (Map<String, Integer>) report.get("initials_length_histogram");
        assertEquals(Map.of("1", 1, "2", 1, "4", 1), histogram);
        Map<String, Integer> sources = (Map<String, Integer>) report.get("source_coverage");
        assertEquals(2, sources.get("우리말샘"));
        assertEquals(1, sources.get("표준국어대사전"));

        Map<String, Object> probes = (Map<String, Object>) report.get("probes");
        assertEquals(true, ((Map<String, Object>) probes.get("결근")).get("is_word"));
        assertEquals(false, ((Map<String, Object>) probes.get("없는말")).get("is_word"));
    }

    @Test
    @DisplayName("Arguments parse as --key value pairs and flags")
    void testParseArgs() {
        Map<String, String> params = LexiconReportTool.parseArgs(
            new String[]{"--lexicon", "a.jsonl", "--Bag-Mode", "--beam", "8"});

        assertEquals("a.jsonl", params.get("lexicon"));
        assertEquals("true", params.get("bag-mode"));
        assertEquals("8", params.get("beam"));
    }
}
