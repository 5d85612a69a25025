package pl.marcinmilkowski.initial_combos.search;

/**
 * Raised for an empty target when {@link EmptyTargetPolicy#REJECT} is configured.
 */
public class EmptyTargetException extends IllegalArgumentException {

    public EmptyTargetException() {
        super("Search target has no initials");
    }
}
