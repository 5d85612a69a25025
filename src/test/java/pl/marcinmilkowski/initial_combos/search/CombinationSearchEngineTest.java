package pl.marcinmilkowski.initial_combos.search;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconEntry;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconIndex;
import pl.marcinmilkowski.initial_combos.lexicon.TestLexicon;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static pl.marcinmilkowski.initial_combos.lexicon.TestLexicon.entry;

/**
 * Unit tests for the beam search engine.
 *
 * Single-syllable words stand for single initials: 가, 나, 다 cover one unit
 * each, 가나다 covers all three.
 */
class CombinationSearchEngineTest {

    private static CombinationSearchEngine engine(LexiconIndex index) {
        return new CombinationSearchEngine(index);
    }

    private static List<List<String>> wordLists(List<Combo> combos) {
        List<List<String>> out = new ArrayList<>();
        for (Combo combo : combos) {
            out.add(combo.words());
        }
        return out;
    }

    @Test
    @DisplayName("A single word covering the whole target outranks the three-word split")
    void testSingleWordCoversTarget() {
        CombinationSearchEngine engine = engine(TestLexicon.index(
            entry("가", 1.0), entry("나", 1.0), entry("다", 1.0), entry("가나다", 1.0)));

        List<Combo> combos = engine.search(List.of("가", "나", "다"), SearchMode.SEQUENCE, 10, 10);

        assertEquals(List.of(List.of("가나다"), List.of("가", "나", "다")), wordLists(combos));
        Combo best = combos.get(0);
        assertEquals(1.0, best.coverage(), 0.0001);
        assertEquals(1.6, best.score(), 0.0001);
        assertEquals(0.6, combos.get(1).score(), 0.0001);
    }

    @Test
    @DisplayName("A dead end yields a partial combo instead of an empty result")
    void testStuckPartialCombo() {
        CombinationSearchEngine engine = engine(TestLexicon.index(
            entry("가", 1.0), entry("나", 1.0), entry("다", 1.0)));

        List<Combo> combos = engine.search(List.of("가", "라"), SearchMode.SEQUENCE, 10, 10);

        assertEquals(1, combos.size());
        assertEquals(List.of("가"), combos.get(0).words());
        assertEquals(0.5, combos.get(0).coverage(), 0.0001);
        assertFalse(combos.get(0).isComplete());
        assertEquals(List.of("가"), combos.get(0).matchedInitials());
    }

    @Test
    @DisplayName("Bag mode collapses permutations into one canonical combo")
    void testBagModeCollapsesPermutations() {
        CombinationSearchEngine engine = engine(TestLexicon.index(
            entry("가", 1.0), entry("나", 1.0), entry("다", 1.0)));

        List<Combo> combos = engine.search(List.of("다", "가", "나"), SearchMode.BAG, 10, 10);

        assertEquals(List.of(List.of("가", "나", "다")), wordLists(combos));
        assertEquals(SearchMode.BAG, combos.get(0).mode());
    }

    @Test
    @DisplayName("A wider beam never finds a worse best combo")
    void testWiderBeamIsNotWorse() {
        LexiconIndex index = TestLexicon.index(
            entry("가", 3.0), entry("가나", 1.5), entry("나", 0.0), entry("다", 2.0));
        CombinationSearchEngine engine = engine(index);
        List<String> target = List.of("가", "나", "다");

        Combo narrow = engine.search(target, SearchMode.SEQUENCE, 1, 10).get(0);
        Combo wide = engine.search(target, SearchMode.SEQUENCE, 10, 10).get(0);

        assertEquals(List.of("가", "나", "다"), narrow.words());
        assertEquals(List.of("가나", "다"), wide.words());
        assertTrue(wide.coverage() >= narrow.coverage());
        assertTrue(wide.score() >= narrow.score());
    }

    @Test
    @DisplayName("Wider beams never lower the best coverage")
    void testWiderBeamCoverage() {
        LexiconIndex index = TestLexicon.index(entry("가", 3.0), entry("가나", 1.0), entry("다", 1.0));
        CombinationSearchEngine engine = engine(index);
        List<String> target = List.of("가", "나", "다");

        Combo narrow = engine.search(target, SearchMode.SEQUENCE, 1, 10).get(0);
        Combo wide = engine.search(target, SearchMode.SEQUENCE, 10, 10).get(0);

        assertEquals(List.of("가"), narrow.words());
        assertEquals(1.0 / 3, narrow.coverage(), 0.0001);
        assertEquals(List.of("가나", "다"), wide.words());
        assertEquals(1.0, wide.coverage(), 0.0001);
    }

    @Test
    @DisplayName("Dead ends kept by a wider beam do not stop the search early")
    void testWiderBeamWithSingleResult() {
        LexiconIndex index = TestLexicon.index(
            entry("가", 10.0), entry("나다", 10.0), entry("라", 10.0), entry("가나", 1.0));
        CombinationSearchEngine engine = engine(index);
        List<String> target = List.of("가", "나", "다", "라");

        Combo narrow = engine.search(target, SearchMode.SEQUENCE, 1, 1).get(0);
        Combo wide = engine.search(target, SearchMode.SEQUENCE, 2, 1).get(0);

        assertEquals(List.of("가", "나다", "라"), narrow.words());
        assertEquals(List.of("가", "나다", "라"), wide.words());
        assertEquals(1.0, wide.coverage(), 0.0001);
        assertTrue(wide.coverage() >= narrow.coverage());
        assertTrue(wide.score() >= narrow.score());
    }

    @Test
    @DisplayName("Non-positive beam width or result count is rejected")
    void testInvalidParameters() {
        CombinationSearchEngine engine = engine(TestLexicon.basic());
        List<String> target = List.of("결", "근");

        assertThrows(InvalidParameterException.class, () -> engine.search(target, SearchMode.SEQUENCE, 10, 0));
        assertThrows(InvalidParameterException.class, () -> engine.search(target, SearchMode.SEQUENCE, 10, -3));
        assertThrows(InvalidParameterException.class, () -> engine.search(target, SearchMode.SEQUENCE, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> engine.search(target, SearchMode.BAG, -1, 10));
    }

    @Test
    @DisplayName("Usage example: 결근 + 신상 in both modes")
    void testUsageExample() {
        CombinationSearchEngine engine = engine(TestLexicon.basic());

        List<Combo> sequence = engine.search(List.of("결", "근", "신", "상"), SearchMode.SEQUENCE, 64, 10);
        assertEquals(List.of("결근", "신상"), sequence.get(0).words());
        assertEquals("결근신상", sequence.get(0).combo());
        assertEquals(1.0, sequence.get(0).coverage(), 0.0001);

        List<Combo> bag = engine.search(List.of("신", "결", "상", "근"), SearchMode.BAG, 64, 10);
        assertEquals(List.of("결근", "신상"), bag.get(0).words());
        assertEquals(1, bag.size());
    }

    @Test
    @DisplayName("Bag combos list longer words first")
    void testBagCanonicalWordOrder() {
        CombinationSearchEngine engine = engine(TestLexicon.index(entry("가", 5.0), entry("나다", 1.0)));

        List<Combo> combos = engine.search(List.of("가", "나", "다"), SearchMode.BAG, 10, 10);

        assertEquals(List.of("나다", "가"), combos.get(0).words());
        assertEquals(List.of("나", "다", "가"), combos.get(0).matchedInitials());
    }

    @Test
    @DisplayName("Identical inputs produce identical results")
    void testDeterminism() {
        LexiconIndex index = TestLexicon.index(
            entry("가", 1.0), entry("나", 1.0), entry("다", 1.0), entry("가나", 1.0),
            entry("나다", 1.0), entry("가나다", 0.5), entry("다가", 1.0));
        CombinationSearchEngine engine = engine(index);

        for (SearchMode mode : SearchMode.values()) {
            SearchTarget target = new SearchTarget(mode, List.of("가", "나", "다", "가"));
            SearchParameters params = SearchParameters.of(3, 5);
            SearchResult first = engine.search(target, params);
            SearchResult second = engine.search(target, params);
            assertEquals(first.combos(), second.combos());
        }
    }

    @Test
    @DisplayName("Combos respect coverage bounds and match the target")
    void testCorrectness() {
        LexiconIndex index = TestLexicon.index(
            entry("가", 1.0), entry("나", 2.0), entry("가나", 1.0), entry("나다", 3.0), entry("다", 0.5));
        CombinationSearchEngine engine = engine(index);
        List<String> units = List.of("가", "나", "다", "나");

        for (Combo combo : engine.search(units, SearchMode.SEQUENCE, 16, 20)) {
            assertTrue(combo.coverage() >= 0.0 && combo.coverage() <= 1.0);
            int matched = combo.matchedInitials().size();
            assertEquals(units.subList(0, matched), combo.matchedInitials());
            assertEquals((double) matched / units.size(), combo.coverage(), 0.0001);
        }

        List<String> sortedUnits = new ArrayList<>(units);
        Collections.sort(sortedUnits);
        for (Combo combo : engine.search(units, SearchMode.BAG, 16, 20)) {
            assertTrue(combo.coverage() >= 0.0 && combo.coverage() <= 1.0);
            if (combo.isComplete()) {
                List<String> matched = new ArrayList<>(combo.matchedInitials());
                Collections.sort(matched);
                assertEquals(sortedUnits, matched);
            }
        }
    }

    @Test
    @DisplayName("Result count never exceeds maxResults")
    void testResultBound() {
        LexiconIndex index = TestLexicon.index(
            entry("가", 1.0), entry("나", 1.0), entry("다", 1.0), entry("라", 1.0),
            entry("가나", 1.0), entry("나다", 1.0), entry("다라", 1.0), entry("가나다", 1.0));
        CombinationSearchEngine engine = engine(index);

        List<Combo> combos = engine.search(List.of("가", "나", "다", "라"), SearchMode.SEQUENCE, 64, 2);
        assertEquals(2, combos.size());
        List<Combo> all = engine.search(List.of("가", "나", "다", "라"), SearchMode.SEQUENCE, 64, 100);
        // 가|나|다|라, 가|나|다라, 가|나다|라, 가나|다|라, 가나|다라, 가나다|라
        assertEquals(6, all.size());
    }

    @Test
    @DisplayName("Bag dedup keeps the frontier at the number of distinct residues")
    void testBagDedupSixUnits() {
        LexiconIndex index = TestLexicon.index(
            entry("가", 1.0), entry("나", 1.0), entry("다", 1.0),
            entry("라", 1.0), entry("마", 1.0), entry("바", 1.0));
        CombinationSearchEngine engine = engine(index);

        SearchResult result = engine.search(
            SearchTarget.bag(List.of("바", "마", "라", "다", "나", "가")), SearchParameters.of(64, 10));

        assertEquals(1, result.combos().size());
        assertEquals(List.of("가", "나", "다", "라", "마", "바"), result.combos().get(0).words());
        // C(6,3) distinct residues at the widest level instead of 6*5*4 orderings
        assertEquals(20, result.peakFrontier());
        assertEquals(6, result.levels());
    }

    @Test
    @DisplayName("Cancellation returns the combos finalized so far")
    void testCancellation() {
        CombinationSearchEngine engine = engine(TestLexicon.index(
            entry("가", 1.0), entry("나", 1.0), entry("다", 1.0), entry("가나다", 1.0)));
        AtomicInteger checks = new AtomicInteger();
        CancellationSignal afterOneLevel = () -> checks.incrementAndGet() > 1;

        SearchResult result = engine.search(SearchTarget.sequence(List.of("가", "나", "다")),
            SearchParameters.defaults(), afterOneLevel);

        assertTrue(result.cancelled());
        assertEquals(1, result.levels());
        assertEquals(List.of(List.of("가나다")), wordLists(result.combos()));
        CancellationRequestedException e = assertThrows(CancellationRequestedException.class,
            result::requireComplete);
        assertEquals(result.combos(), e.getPartialCombos());
    }

    @Test
    @DisplayName("A cancelled token stops the search before the first level")
    void testCancelledToken() {
        CombinationSearchEngine engine = engine(TestLexicon.basic());
        CancellationToken token = new CancellationToken();
        token.cancel();

        SearchResult result = engine.search(SearchTarget.sequence(List.of("결", "근")),
            SearchParameters.defaults(), token);

        assertTrue(result.cancelled());
        assertTrue(result.combos().isEmpty());
        assertEquals(0, result.levels());
    }

    @Test
    @DisplayName("Repeated words can be disallowed")
    void testRepeatedWords() {
        CombinationSearchEngine engine = engine(TestLexicon.index(entry("가", 1.0)));
        SearchTarget target = SearchTarget.sequence(List.of("가", "가"));

        SearchResult allowed = engine.search(target, SearchParameters.defaults());
        assertEquals(List.of("가", "가"), allowed.best().words());

        SearchResult disallowed = engine.search(target,
            SearchParameters.builder().allowRepeatedWords(false).build());
        assertEquals(List.of("가"), disallowed.best().words());
        assertEquals(0.5, disallowed.best().coverage(), 0.0001);
    }

    @Test
    @DisplayName("Empty target yields the trivial combo or fails under REJECT")
    void testEmptyTarget() {
        CombinationSearchEngine engine = engine(TestLexicon.basic());

        SearchResult trivial = engine.search(SearchTarget.sequence(List.of()), SearchParameters.defaults());
        assertEquals(List.of(Combo.empty(SearchMode.SEQUENCE)), trivial.combos());
        assertEquals(1.0, trivial.best().coverage(), 0.0001);

        SearchParameters reject = SearchParameters.builder().emptyTargetPolicy(EmptyTargetPolicy.REJECT).build();
        assertThrows(EmptyTargetException.class,
            () -> engine.search(SearchTarget.bag(List.of()), reject));
    }

    @Test
    @DisplayName("Nothing matches when no word starts the target")
    void testNoMatch() {
        CombinationSearchEngine engine = engine(TestLexicon.basic());
        SearchResult result = engine.search(SearchTarget.sequence(List.of("하", "늘")), SearchParameters.defaults());
        assertTrue(result.combos().isEmpty());
        assertNull(result.best());
    }

    @Test
    @DisplayName("Candidate limit restricts entries taken per trie node")
    void testCandidateLimit() {
        // choseong units: 가 and 고 share the node for ㄱ
        LexiconIndex index = TestLexicon.index(
            new LexiconEntry("가", List.of("ㄱ"), 3.0, "우리말샘"),
            new LexiconEntry("고", List.of("ㄱ"), 1.0, "우리말샘"));
        CombinationSearchEngine engine = engine(index);
        SearchTarget target = SearchTarget.sequence(List.of("ㄱ"));

        SearchParameters one = SearchParameters.builder().candidateLimit(1).build();
        assertEquals(List.of(List.of("가")), wordLists(engine.search(target, one).combos()));
        assertEquals(2, engine.search(target, SearchParameters.defaults()).combos().size());
    }

    @Test
    @DisplayName("Trace records level, expansion, completion and done events")
    void testTrace() {
        CombinationSearchEngine engine = engine(TestLexicon.basic());
        SearchParameters params = SearchParameters.builder().trace(true).build();

        SearchResult result = engine.search(SearchTarget.sequence(List.of("결", "근", "신", "상")), params);

        List<TraceEvent.Type> types = result.trace().stream().map(TraceEvent::type).toList();
        assertEquals(TraceEvent.Type.LEVEL, types.get(0));
        assertTrue(types.contains(TraceEvent.Type.EXPAND));
        assertTrue(types.contains(TraceEvent.Type.COMPLETE));
        assertTrue(types.contains(TraceEvent.Type.PRUNE));
        assertEquals(TraceEvent.Type.DONE, types.get(types.size() - 1));

        assertTrue(engine.search(SearchTarget.sequence(List.of("결")), SearchParameters.defaults())
            .trace().isEmpty());
    }

    @Test
    @DisplayName("Per-word scores and sources line up with the words")
    void testComboDetails() {
        CombinationSearchEngine engine = engine(TestLexicon.basic());
        Combo combo = engine.search(List.of("결", "근", "신", "상"), SearchMode.SEQUENCE, 8, 1).get(0);

        assertEquals(2, combo.wordScores().size());
        assertEquals(2.3, combo.wordScores().get(0), 0.0001);
        assertEquals(2.3, combo.wordScores().get(1), 0.0001);
        assertEquals(List.of("표준국어대사전", "표준국어대사전"), combo.sources());
        assertEquals(2.3 - 0.2, combo.score(), 0.0001);
    }
}
