package statement;

/**
 * Thrown when an input is not a well-formed statement list at all. Nothing is
 * synthesized for such an input.
 */
public class StatementTreeException extends Exception {

    public StatementTreeException(String message) {
        super(message);
    }

    public StatementTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
