package pl.marcinmilkowski.initial_combos.lexicon;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Reconciled, immutable set of lexicon entries: one entry per word.
 *
 * A word coming from several dictionaries keeps a single entry chosen by the
 * {@link ReconciliationPolicy}; every contributing source is still recorded
 * and available through {@link #sourcesOf(String)}.
 */
public final class EntryStore {

    private static final Logger logger = LoggerFactory.getLogger(EntryStore.class);

    private final List<LexiconEntry> entries;
    private final Map<String, SortedSet<String>> sourcesByWord;

    private EntryStore(List<LexiconEntry> entries, Map<String, SortedSet<String>> sourcesByWord) {
        this.entries = List.copyOf(entries);
        Map<String, SortedSet<String>> frozen = new HashMap<>();
        for (Map.Entry<String, SortedSet<String>> e : sourcesByWord.entrySet()) {
            frozen.put(e.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(e.getValue())));
        }
        this.sourcesByWord = Collections.unmodifiableMap(frozen);
    }

    /**
     * Reconcile a list of raw entries in one go.
     */
    public static EntryStore of(Collection<LexiconEntry> rawEntries, ReconciliationPolicy policy) {
        Builder builder = builder(policy);
        for (LexiconEntry entry : rawEntries) {
            builder.add(entry);
        }
        return builder.build();
    }

    /**
     * Rebuild a store from entries that were already reconciled (e.g. read back
     * from a snapshot) together with their recorded sources.
     *
     * @throws IllegalArgumentException if a word occurs twice
     */
    public static EntryStore restore(List<LexiconEntry> reconciled, Map<String, ? extends Collection<String>> sources) {
        Set<String> seen = new HashSet<>();
        Map<String, SortedSet<String>> merged = new HashMap<>();
        for (LexiconEntry entry : reconciled) {
            if (!seen.add(entry.word())) {
                throw new IllegalArgumentException("Word occurs twice in reconciled entries: " + entry.word());
            }
            SortedSet<String> wordSources = new TreeSet<>();
            Collection<String> recorded = sources.get(entry.word());
            if (recorded != null) {
                wordSources.addAll(recorded);
            }
            wordSources.add(entry.source());
            merged.put(entry.word(), wordSources);
        }
        return new EntryStore(reconciled, merged);
    }

    /**
     * Reconciled entries, in first-seen word order.
     */
    public List<LexiconEntry> entries() {
        return entries;
    }

    /**
     * All sources that contributed a word, sorted; empty if the word is unknown.
     */
    public SortedSet<String> sourcesOf(String word) {
        SortedSet<String> sources = sourcesByWord.get(word);
        return sources != null ? sources : Collections.emptySortedSet();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("EntryStore[%d entries]", entries.size());
    }

    public static Builder builder() {
        return new Builder(ReconciliationPolicy.MAX_SCORE);
    }

    public static Builder builder(ReconciliationPolicy policy) {
        return new Builder(policy);
    }

    /**
     * Accumulates raw entries and reconciles duplicates as they arrive.
     * Not thread-safe; the resulting store is.
     */
    public static final class Builder {
        private final ReconciliationPolicy policy;
        private final Map<String, LexiconEntry> chosen = new LinkedHashMap<>();
        private final Map<String, SortedSet<String>> sources = new HashMap<>();
        private final Map<String, LexiconEntry> bySourceKey = new HashMap<>();
        private int added;
        private int merged;

        private Builder(ReconciliationPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
        }

        /**
         * Add one raw entry.
         *
         * @throws DuplicateSourceConflictException under {@link ReconciliationPolicy#REJECT}
         *         when the (word, source) pair was already added with different data
         */
        public Builder add(LexiconEntry entry) {
            Objects.requireNonNull(entry, "entry");
            added++;

            if (policy == ReconciliationPolicy.REJECT) {
                String key = entry.word() + '\u0000' + entry.source();
                LexiconEntry previous = bySourceKey.putIfAbsent(key, entry);
                if (previous != null && !sameData(previous, entry)) {
                    throw new DuplicateSourceConflictException(previous, entry);
                }
            }

            sources.computeIfAbsent(entry.word(), k -> new TreeSet<>()).add(entry.source());

            LexiconEntry current = chosen.get(entry.word());
            if (current == null) {
                chosen.put(entry.word(), entry);
                return this;
            }
            merged++;
            if (policy != ReconciliationPolicy.FIRST_WINS && prefer(entry, current)) {
                chosen.put(entry.word(), entry);
            }
            return this;
        }

        public Builder addAll(Collection<LexiconEntry> entries) {
            for (LexiconEntry entry : entries) {
                add(entry);
            }
            return this;
        }

        public EntryStore build() {
            if (merged > 0) {
                logger.debug("Reconciled {} duplicate entries ({} raw -> {} words, policy {})",
                    merged, added, chosen.size(), policy);
            }
            return new EntryStore(new ArrayList<>(chosen.values()), sources);
        }

        private static boolean prefer(LexiconEntry candidate, LexiconEntry current) {
            int byScore = Double.compare(candidate.score(), current.score());
            if (byScore != 0) {
                return byScore > 0;
            }
            return candidate.source().compareTo(current.source()) < 0;
        }

        private static boolean sameData(LexiconEntry a, LexiconEntry b) {
            return Double.compare(a.score(), b.score()) == 0 && a.initials().equals(b.initials());
        }
    }
}
