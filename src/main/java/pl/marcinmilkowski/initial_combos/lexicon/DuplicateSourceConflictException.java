package pl.marcinmilkowski.initial_combos.lexicon;

/**
 * The same (word, source) pair was added twice with different data and the
 * configured policy does not say which one to keep.
 */
public class DuplicateSourceConflictException extends IllegalStateException {

    private final LexiconEntry existing;
    private final LexiconEntry incoming;

    public DuplicateSourceConflictException(LexiconEntry existing, LexiconEntry incoming) {
        super("Conflicting duplicate for word '" + existing.word() + "' from source '"
            + existing.source() + "': " + existing + " vs " + incoming);
        this.existing = existing;
        this.incoming = incoming;
    }

    public LexiconEntry getExisting() {
        return existing;
    }

    public LexiconEntry getIncoming() {
        return incoming;
    }
}
