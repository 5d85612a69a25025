package pl.marcinmilkowski.initial_combos.search;

/**
 * Tunables of a single search call. Validated on construction.
 */
public final class SearchParameters {

    public static final int DEFAULT_BEAM_WIDTH = 64;
    public static final int DEFAULT_MAX_RESULTS = 20;

    private final int beamWidth;
    private final int maxResults;
    private final int candidateLimit;
    private final boolean allowRepeatedWords;
    private final EmptyTargetPolicy emptyTargetPolicy;
    private final boolean trace;

    private SearchParameters(Builder b) {
        if (b.beamWidth <= 0) {
            throw new InvalidParameterException("beamWidth must be > 0, got " + b.beamWidth);
        }
        if (b.maxResults <= 0) {
            throw new InvalidParameterException("maxResults must be > 0, got " + b.maxResults);
        }
        if (b.candidateLimit < 0) {
            throw new InvalidParameterException("candidateLimit must be >= 0, got " + b.candidateLimit);
        }
        if (b.emptyTargetPolicy == null) {
            throw new InvalidParameterException("emptyTargetPolicy must not be null");
        }
        this.beamWidth = b.beamWidth;
        this.maxResults = b.maxResults;
        this.candidateLimit = b.candidateLimit;
        this.allowRepeatedWords = b.allowRepeatedWords;
        this.emptyTargetPolicy = b.emptyTargetPolicy;
        this.trace = b.trace;
    }

    /**
     * Defaults with the given beam width and result count.
     *
     * @throws InvalidParameterException if either is not positive
     */
    public static SearchParameters of(int beamWidth, int maxResults) {
        return builder().beamWidth(beamWidth).maxResults(maxResults).build();
    }

    public static SearchParameters defaults() {
        return builder().build();
    }

    /** Maximum open states kept between levels. */
    public int beamWidth() {
        return beamWidth;
    }

    /** Maximum combos returned; also stops the search once that many are finalized. */
    public int maxResults() {
        return maxResults;
    }

    /** Maximum candidates taken from one trie node per state, 0 for all. */
    public int candidateLimit() {
        return candidateLimit;
    }

    /** Whether a word may occur more than once in a combo. */
    public boolean allowRepeatedWords() {
        return allowRepeatedWords;
    }

    public EmptyTargetPolicy emptyTargetPolicy() {
        return emptyTargetPolicy;
    }

    /** Whether to record trace events. */
    public boolean trace() {
        return trace;
    }

    public Builder toBuilder() {
        return new Builder()
            .beamWidth(beamWidth)
            .maxResults(maxResults)
            .candidateLimit(candidateLimit)
            .allowRepeatedWords(allowRepeatedWords)
            .emptyTargetPolicy(emptyTargetPolicy)
            .trace(trace);
    }

    @Override
    public String toString() {
        return String.format("SearchParameters[beam=%d, max=%d, candidates=%d, repeats=%s, empty=%s, trace=%s]",
            beamWidth, maxResults, candidateLimit, allowRepeatedWords, emptyTargetPolicy, trace);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int beamWidth = DEFAULT_BEAM_WIDTH;
        private int maxResults = DEFAULT_MAX_RESULTS;
        private int candidateLimit = 0;
        private boolean allowRepeatedWords = true;
        private EmptyTargetPolicy emptyTargetPolicy = EmptyTargetPolicy.TRIVIAL;
        private boolean trace = false;

        public Builder beamWidth(int beamWidth) {
            this.beamWidth = beamWidth;
            return this;
        }

        public Builder maxResults(int maxResults) {
            this.maxResults = maxResults;
            return this;
        }

        public Builder candidateLimit(int candidateLimit) {
            this.candidateLimit = candidateLimit;
            return this;
        }

        public Builder allowRepeatedWords(boolean allowRepeatedWords) {
            this.allowRepeatedWords = allowRepeatedWords;
            return this;
        }

        public Builder emptyTargetPolicy(EmptyTargetPolicy emptyTargetPolicy) {
            this.emptyTargetPolicy = emptyTargetPolicy;
            return this;
        }

        public Builder trace(boolean trace) {
            this.trace = trace;
            return this;
        }

        public SearchParameters build() {
            return new SearchParameters(this);
        }
    }
}
