package pl.marcinmilkowski.initial_combos.search;

import pl.marcinmilkowski.initial_combos.lexicon.LexiconEntry;

import java.util.*;

/**
 * One partial combination: the words chosen so far and the initials still to cover.
 * Private to a single search call.
 */
final class BeamState {

    static final Comparator<BeamState> ORDER = Comparator
        .comparingDouble((BeamState s) -> s.cumulativeScore).reversed()
        .thenComparing(BeamState::wordList, ComboRanker.WORDS_ORDER);

    final List<LexiconEntry> words;
    final List<String> remaining;   // ordered suffix (sequence) or sorted residue (bag)
    final double cumulativeScore;
    private List<String> wordList;

    private BeamState(List<LexiconEntry> words, List<String> remaining, double cumulativeScore) {
        this.words = words;
        this.remaining = remaining;
        this.cumulativeScore = cumulativeScore;
    }

    static BeamState initial(SearchTarget target) {
        return new BeamState(List.of(), target.units(), 0.0);
    }

    boolean isComplete() {
        return remaining.isEmpty();
    }

    boolean containsWord(String word) {
        for (LexiconEntry entry : words) {
            if (entry.word().equals(word)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Successor after choosing {@code entry}. The caller guarantees the entry fits.
     */
    BeamState extend(LexiconEntry entry, SearchMode mode, double wordScore) {
        List<String> next;
        if (mode == SearchMode.SEQUENCE) {
            next = List.copyOf(remaining.subList(entry.length(), remaining.size()));
        } else {
            // removing from a sorted list keeps it sorted
            List<String> residue = new ArrayList<>(remaining);
            for (String unit : entry.initials()) {
                residue.remove(unit);
            }
            next = List.copyOf(residue);
        }
        List<LexiconEntry> chosen = new ArrayList<>(words.size() + 1);
        chosen.addAll(words);
        chosen.add(entry);
        return new BeamState(Collections.unmodifiableList(chosen), next, cumulativeScore + wordScore);
    }

    /**
     * Dedup key: the word sequence in sequence mode; residue plus word multiset in bag mode,
     * which merges permutations of the same words.
     */
    String key(SearchMode mode) {
        if (mode == SearchMode.SEQUENCE) {
            return String.join("\u0001", wordList());
        }
        List<String> sortedWords = new ArrayList<>(wordList());
        Collections.sort(sortedWords);
        return String.join("\u0001", remaining) + "\u0000" + String.join("\u0001", sortedWords);
    }

    List<String> wordList() {
        if (wordList == null) {
            List<String> list = new ArrayList<>(words.size());
            for (LexiconEntry entry : words) {
                list.add(entry.word());
            }
            wordList = Collections.unmodifiableList(list);
        }
        return wordList;
    }

    @Override
    public String toString() {
        return wordList() + " remaining=" + remaining + " score=" + cumulativeScore;
    }
}
