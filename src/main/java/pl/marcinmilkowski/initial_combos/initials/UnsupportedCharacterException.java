package pl.marcinmilkowski.initial_combos.initials;

/**
 * Thrown when a syllable cannot be decomposed into an initial-unit.
 */
public class UnsupportedCharacterException extends IllegalArgumentException {

    private final String input;
    private final int position;

    public UnsupportedCharacterException(String input, int position) {
        super(String.format("Unsupported character '%s' (U+%04X) at position %d in \"%s\"",
            new String(Character.toChars(input.codePointAt(position))),
            input.codePointAt(position), position, input));
        this.input = input;
        this.position = position;
    }

    public UnsupportedCharacterException(String message) {
        super(message);
        this.input = null;
        this.position = -1;
    }

    public String getInput() {
        return input;
    }

    public int getPosition() {
        return position;
    }
}
