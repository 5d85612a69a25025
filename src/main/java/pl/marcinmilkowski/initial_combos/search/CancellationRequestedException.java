package pl.marcinmilkowski.initial_combos.search;

import java.util.List;

/**
 * A search was stopped by its cancellation signal before it finished.
 * Carries the combos that had already been finalized.
 */
public class CancellationRequestedException extends RuntimeException {

    private final transient List<Combo> partialCombos;

    public CancellationRequestedException(List<Combo> partialCombos, int levels) {
        super("Search cancelled after " + levels + " level(s) with "
            + partialCombos.size() + " finalized combo(s)");
        this.partialCombos = List.copyOf(partialCombos);
    }

    public List<Combo> getPartialCombos() {
        return partialCombos;
    }
}
