package synthesis;

/**
 * A jump statement has no structural target, e.g. {@code break} outside any loop
 * or switch.
 */
public class StructuralException extends Exception {

    public StructuralException(String message) {
        super(message);
    }
}
