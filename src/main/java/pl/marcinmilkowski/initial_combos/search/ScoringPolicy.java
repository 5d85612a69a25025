package pl.marcinmilkowski.initial_combos.search;

import pl.marcinmilkowski.initial_combos.lexicon.LexiconEntry;

/**
 * Turns entry scores into beam and combo scores.
 *
 * {@link #wordScore} must be non-negative so that accumulated beam scores are
 * monotonic along a path.
 */
public interface ScoringPolicy {

    /**
     * Score contributed by one chosen word; added to the beam state's cumulative score.
     */
    double wordScore(LexiconEntry entry);

    /**
     * Final score of a combo from its cumulative word score.
     */
    double comboScore(double cumulativeScore, int wordCount);
}
