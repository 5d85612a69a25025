package pl.marcinmilkowski.initial_combos.search;

import java.util.*;

/**
 * Orders, deduplicates and truncates draft combos.
 *
 * Order: coverage desc, score desc, word count asc, then the word sequence
 * compared element by element. This is a total order over distinct word
 * sequences, so identical inputs always rank identically.
 */
public final class ComboRanker {

    public static final Comparator<List<String>> WORDS_ORDER = ComboRanker::compareWords;

    public static final Comparator<Combo> RANKING = Comparator
        .comparingDouble(Combo::coverage).reversed()
        .thenComparing(Comparator.comparingDouble(Combo::score).reversed())
        .thenComparingInt(Combo::wordCount)
        .thenComparing(Combo::words, WORDS_ORDER);

    private ComboRanker() {
    }

    /**
     * Rank drafts and keep the best {@code maxResults}.
     * Among drafts with the same word sequence the better-ranked one is kept.
     */
    public static List<Combo> rank(Collection<Combo> drafts, int maxResults) {
        if (maxResults <= 0) {
            throw new InvalidParameterException("maxResults must be > 0, got " + maxResults);
        }
        Map<List<String>, Combo> unique = new HashMap<>();
        for (Combo combo : drafts) {
            unique.merge(combo.words(), combo, (a, b) -> RANKING.compare(a, b) <= 0 ? a : b);
        }
        List<Combo> ranked = new ArrayList<>(unique.values());
        ranked.sort(RANKING);
        if (ranked.size() > maxResults) {
            return List.copyOf(ranked.subList(0, maxResults));
        }
        return List.copyOf(ranked);
    }

    /**
     * Lexicographic comparison of word sequences; a proper prefix sorts first.
     */
    static int compareWords(List<String> a, List<String> b) {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int cmp = a.get(i).compareTo(b.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
