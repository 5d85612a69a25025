package pl.marcinmilkowski.initial_combos.search;

/**
 * A search parameter is out of range (beam width, result count, candidate limit, ...).
 */
public class InvalidParameterException extends IllegalArgumentException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
