package ch.animalgame.animalgameengine.domain.exception;

/**
 * Thrown when a square name is not a letter {@code a}-{@code g} followed by a digit {@code 1}-{@code 7}.
 */
public class InvalidNotationException extends IllegalArgumentException {

    public InvalidNotationException(String notation) {
        super("Invalid square notation: " + (notation == null ? "null" : "'" + notation + "'"));
    }
}
