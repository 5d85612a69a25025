package pl.marcinmilkowski.initial_combos.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconEntry;
import pl.marcinmilkowski.initial_combos.lexicon.LexiconIndex;

import java.util.*;

/**
 * Level-synchronous beam search for word combinations matching a target of initials.
 *
 * <p>Each level adds one word to every state of the frontier. Successors are
 * deduplicated, sorted by cumulative score and cut to the beam width; states
 * that cover the whole target (complete) or cannot be extended (stuck) are
 * finalized as draft combos regardless of the beam width. The search stops when
 * the frontier runs empty, when {@code maxResults} drafts exist, or when the
 * cancellation signal fires at a level boundary.</p>
 *
 * <h2>Candidates</h2>
 * <ul>
 *   <li>Sequence mode: entries whose initials are a prefix of the remaining sequence.</li>
 *   <li>Bag mode: entries whose initials fit inside the remaining multiset. States
 *       are keyed by the sorted residue plus the word multiset, so the k! orders in
 *       which the same k words can be picked collapse into one state.</li>
 * </ul>
 *
 * <p>A narrow beam can miss the globally best combination; widening it trades
 * time for recall.</p>
 *
 * <p>The engine only reads the index and keeps all search state local to the
 * call, so one instance serves concurrent searches.</p>
 *
 * <pre>{@code
 * CombinationSearchEngine engine = new CombinationSearchEngine(index);
 * SearchResult result = engine.search(SearchTarget.bag(List.of("신", "결", "상", "근")),
 *     SearchParameters.of(64, 10));
 * result.combos().forEach(System.out::println);
 * }</pre>
 */
public class CombinationSearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(CombinationSearchEngine.class);

    private final LexiconIndex index;
    private final ScoringPolicy scoringPolicy;

    public CombinationSearchEngine(LexiconIndex index) {
        this(index, DefaultScoringPolicy.DEFAULT);
    }

    public CombinationSearchEngine(LexiconIndex index, ScoringPolicy scoringPolicy) {
        this.index = Objects.requireNonNull(index, "index");
        this.scoringPolicy = Objects.requireNonNull(scoringPolicy, "scoringPolicy");
    }

    /**
     * Search with default options.
     *
     * @throws InvalidParameterException if {@code beamWidth} or {@code maxResults} is not positive
     */
    public List<Combo> search(List<String> initials, SearchMode mode, int beamWidth, int maxResults) {
        SearchParameters params = SearchParameters.of(beamWidth, maxResults);
        return search(new SearchTarget(mode, initials), params).combos();
    }

    public SearchResult search(SearchTarget target, SearchParameters params) {
        return search(target, params, CancellationSignal.NONE);
    }

    /**
     * Run a search.
     *
     * @param target       Initials to cover and the matching mode
     * @param params       Beam width, result count and options
     * @param cancellation Polled before each level; when it fires the combos
     *                     finalized so far are returned with {@code cancelled = true}
     * @throws EmptyTargetException if the target is empty and the policy rejects it
     */
    public SearchResult search(SearchTarget target, SearchParameters params, CancellationSignal cancellation) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(cancellation, "cancellation");

        SearchMode mode = target.mode();
        List<TraceEvent> trace = params.trace() ? new ArrayList<>() : null;

        if (target.isEmpty()) {
            if (params.emptyTargetPolicy() == EmptyTargetPolicy.REJECT) {
                throw new EmptyTargetException();
            }
            record(trace, TraceEvent.marker(TraceEvent.Type.DONE, 0, 1));
            return new SearchResult(target, List.of(Combo.empty(mode)), false, 0, 0, 0, traceOrEmpty(trace));
        }

        int requested = target.size();
        List<BeamState> frontier = List.of(BeamState.initial(target));
        List<Combo> drafts = new ArrayList<>();
        // only full-coverage drafts count toward maxResults
        int completed = 0;
        boolean cancelled = false;
        int level = 0;
        long expanded = 0;
        int peakFrontier = 0;

        while (!frontier.isEmpty() && completed < params.maxResults()) {
            if (cancellation.isCancellationRequested()) {
                cancelled = true;
                record(trace, TraceEvent.marker(TraceEvent.Type.CANCELLED, level, drafts.size()));
                logger.debug("Search {} cancelled at level {} with {} drafts", target, level, drafts.size());
                break;
            }
            level++;
            record(trace, TraceEvent.marker(TraceEvent.Type.LEVEL, level, frontier.size()));

            Map<String, BeamState> successors = new LinkedHashMap<>();
            for (BeamState state : frontier) {
                List<LexiconEntry> candidates = candidatesFor(state, mode, params);
                if (candidates.isEmpty()) {
                    if (!state.words.isEmpty()) {
                        drafts.add(finalizeState(state, mode, requested));
                        record(trace, new TraceEvent(TraceEvent.Type.STUCK, level, state.wordList(),
                            state.remaining, state.cumulativeScore, 0));
                    }
                    continue;
                }
                for (LexiconEntry candidate : candidates) {
                    BeamState next = state.extend(candidate, mode, scoringPolicy.wordScore(candidate));
                    successors.merge(next.key(mode), next,
                        (a, b) -> BeamState.ORDER.compare(a, b) <= 0 ? a : b);
                }
                record(trace, new TraceEvent(TraceEvent.Type.EXPAND, level, state.wordList(),
                    state.remaining, state.cumulativeScore, candidates.size()));
            }
            expanded += successors.size();

            List<BeamState> open = new ArrayList<>();
            for (BeamState state : successors.values()) {
                if (state.isComplete()) {
                    drafts.add(finalizeState(state, mode, requested));
                    completed++;
                    record(trace, new TraceEvent(TraceEvent.Type.COMPLETE, level, state.wordList(),
                        List.of(), state.cumulativeScore, 0));
                } else {
                    open.add(state);
                }
            }
            peakFrontier = Math.max(peakFrontier, open.size());

            open.sort(BeamState.ORDER);
            frontier = open.size() > params.beamWidth()
                ? new ArrayList<>(open.subList(0, params.beamWidth()))
                : open;
            record(trace, TraceEvent.marker(TraceEvent.Type.PRUNE, level, frontier.size()));

            logger.debug("Level {}: {} successors, {} open, {} kept, {} drafts",
                level, successors.size(), open.size(), frontier.size(), drafts.size());
        }

        List<Combo> ranked = ComboRanker.rank(drafts, params.maxResults());
        record(trace, TraceEvent.marker(TraceEvent.Type.DONE, level, ranked.size()));
        return new SearchResult(target, ranked, cancelled, level, expanded, peakFrontier, traceOrEmpty(trace));
    }

    public LexiconIndex getIndex() {
        return index;
    }

    public ScoringPolicy getScoringPolicy() {
        return scoringPolicy;
    }

    private List<LexiconEntry> candidatesFor(BeamState state, SearchMode mode, SearchParameters params) {
        List<LexiconEntry> candidates;
        if (mode == SearchMode.SEQUENCE) {
            candidates = index.entriesAlong(state.remaining, params.candidateLimit());
        } else {
            candidates = index.entriesWithin(countUnits(state.remaining), params.candidateLimit());
        }
        if (params.allowRepeatedWords() || state.words.isEmpty()) {
            return candidates;
        }
        List<LexiconEntry> fresh = new ArrayList<>(candidates.size());
        for (LexiconEntry candidate : candidates) {
            if (!state.containsWord(candidate.word())) {
                fresh.add(candidate);
            }
        }
        return fresh;
    }

    private Combo finalizeState(BeamState state, SearchMode mode, int requested) {
        List<LexiconEntry> chosen = state.words;
        if (mode == SearchMode.BAG) {
            chosen = new ArrayList<>(chosen);
            chosen.sort(BAG_CANONICAL);
        }
        List<String> words = new ArrayList<>(chosen.size());
        List<Double> wordScores = new ArrayList<>(chosen.size());
        List<String> sources = new ArrayList<>(chosen.size());
        List<String> matched = new ArrayList<>();
        for (LexiconEntry entry : chosen) {
            words.add(entry.word());
            wordScores.add(scoringPolicy.wordScore(entry));
            sources.add(entry.source());
            matched.addAll(entry.initials());
        }
        double coverage = (double) (requested - state.remaining.size()) / requested;
        double score = scoringPolicy.comboScore(state.cumulativeScore, chosen.size());
        return new Combo(words, score, mode, coverage, wordScores, sources, matched);
    }

    private static Map<String, Integer> countUnits(List<String> units) {
        Map<String, Integer> counts = new HashMap<>();
        for (String unit : units) {
            counts.merge(unit, 1, Integer::sum);
        }
        return counts;
    }

    private static void record(List<TraceEvent> trace, TraceEvent event) {
        if (trace != null) {
            trace.add(event);
        }
    }

    private static List<TraceEvent> traceOrEmpty(List<TraceEvent> trace) {
        return trace != null ? trace : List.of();
    }

    /** Longer words first, then lexicographic: the word order of bag-mode combos. */
    private static final Comparator<LexiconEntry> BAG_CANONICAL = Comparator
        .comparingInt(LexiconEntry::length).reversed()
        .thenComparing(LexiconEntry::word);
}
