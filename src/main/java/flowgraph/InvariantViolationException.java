package flowgraph;

/**
 * A structural guarantee of the flow graph was broken. This signals a defect in
 * the code that built the graph, never a problem with the input.
 */
public class InvariantViolationException extends IllegalStateException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
