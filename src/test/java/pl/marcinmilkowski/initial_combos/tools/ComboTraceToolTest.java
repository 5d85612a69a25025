package pl.marcinmilkowski.initial_combos.tools;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.initial_combos.lexicon.TestLexicon;
import pl.marcinmilkowski.initial_combos.search.CombinationSearchEngine;
import pl.marcinmilkowski.initial_combos.search.SearchParameters;
import pl.marcinmilkowski.initial_combos.search.SearchResult;
import pl.marcinmilkowski.initial_combos.search.SearchTarget;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ComboTraceTool output.
 */
class ComboTraceToolTest {

    private SearchResult tracedSearch(List<String> initials) {
        CombinationSearchEngine engine = new CombinationSearchEngine(TestLexicon.basic());
        return engine.search(SearchTarget.sequence(initials), SearchParameters.builder().trace(true).build());
    }

    @Test
    @DisplayName("Rendered report lists combos and trace events")
    void testRender() {
        List<String> lines = ComboTraceTool.render(tracedSearch(List.of("결", "근", "신", "상")), 100);

        assertEquals("Target: [결, 근, 신, 상] (sequence)", lines.get(0));
        assertTrue(lines.stream().anyMatch(l -> l.startsWith("   1. 결근신상")));
        assertTrue(lines.contains("Trace:"));
        assertTrue(lines.stream().anyMatch(l -> l.contains("complete")));
        assertTrue(lines.stream().anyMatch(l -> l.contains("done")));
    }

    @Test
    @DisplayName("Trace output is truncated at the limit and hidden at zero")
    void testTraceLimit() {
        SearchResult result = tracedSearch(List.of("결", "근", "신", "상"));

        List<String> limited = ComboTraceTool.render(result, 1);
        assertTrue(limited.get(limited.size() - 1).contains("more events"));

        List<String> hidden = ComboTraceTool.render(result, 0);
        assertFalse(hidden.contains("Trace:"));
    }

    @Test
    @DisplayName("Empty results are shown as none")
    void testNoCombos() {
        List<String> lines = ComboTraceTool.render(tracedSearch(List.of("하", "늘")), 0);
        assertTrue(lines.contains("  (none)"));
    }
}
