package pl.marcinmilkowski.initial_combos.search;

import pl.marcinmilkowski.initial_combos.lexicon.LexiconEntry;

/**
 * Length-normalized scoring.
 *
 * <pre>
 *   wordScore  = entry.score + lengthBonus * (entry.length - 1)
 *   comboScore = cumulative / wordCount - segmentPenalty * (wordCount - 1)
 * </pre>
 *
 * The bonus favours longer words, the mean keeps long combos from winning on
 * accumulated score alone, and the penalty prefers fewer segments among
 * combos of similar quality. An empty combo scores 0.
 */
public record DefaultScoringPolicy(double lengthBonus, double segmentPenalty) implements ScoringPolicy {

    public static final DefaultScoringPolicy DEFAULT = new DefaultScoringPolicy(0.3, 0.2);

    public DefaultScoringPolicy {
        if (lengthBonus < 0 || Double.isNaN(lengthBonus)) {
            throw new IllegalArgumentException("lengthBonus must be >= 0: " + lengthBonus);
        }
        if (segmentPenalty < 0 || Double.isNaN(segmentPenalty)) {
            throw new IllegalArgumentException("segmentPenalty must be >= 0: " + segmentPenalty);
        }
    }

    @Override
    public double wordScore(LexiconEntry entry) {
        return entry.score() + lengthBonus * (entry.length() - 1);
    }

    @Override
    public double comboScore(double cumulativeScore, int wordCount) {
        if (wordCount == 0) {
            return 0.0;
        }
        return cumulativeScore / wordCount - segmentPenalty * (wordCount - 1);
    }
}
