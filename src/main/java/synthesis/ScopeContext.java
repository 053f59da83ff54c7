package synthesis;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stack of the loops and switches enclosing the statement being synthesized.
 * Frames are pushed before a body is walked and popped when the walk returns.
 * A labeled jump resolves against the frame carrying that label; an unlabeled
 * one against the innermost suitable frame.
 */
public class ScopeContext {
    private final Deque<ScopeFrame> frames = new ArrayDeque<>();

    /**
     * @param condition resolves to the loop condition node; may create it on first use
     * @param name      source label of the loop, or null
     */
    public void pushLoop(Continuation condition, Continuation breakTarget, String name) {
        frames.push(ScopeFrame.loop(condition, breakTarget, name));
    }

    public void pushSwitch(Continuation breakTarget, String name) {
        frames.push(ScopeFrame.switchFrame(breakTarget, name));
    }

    public void pop() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("No scope frame to pop");
        }
        frames.pop();
    }

    public int depth() {
        return frames.size();
    }

    /**
     * @param label target of a labeled break, or null
     * @return the continuation of the labeled statement, or of the innermost loop or
     *         switch when {@code label} is null
     */
    public Continuation resolveBreak(String label) throws StructuralException {
        if (label == null) {
            ScopeFrame frame = frames.peek();
            if (frame == null) {
                throw new StructuralException("break outside of a loop or switch");
            }
            return frame.getBreakTarget();
        }
        for (ScopeFrame frame : frames) {
            if (frame.isNamed(label)) {
                return frame.getBreakTarget();
            }
        }
        throw new StructuralException("break to unknown label '" + label + "'");
    }

    /**
     * @param label target of a labeled continue, or null
     * @return the condition of the labeled loop, or of the innermost loop when
     *         {@code label} is null; switch frames are skipped
     */
    public Continuation resolveContinue(String label) throws StructuralException {
        for (ScopeFrame frame : frames) {
            if (label != null && frame.isNamed(label)) {
                if (frame.getKind() != ScopeFrame.Kind.LOOP) {
                    throw new StructuralException("continue to '" + label + "', which is not a loop");
                }
                return frame.getContinueTarget();
            }
            if (label == null && frame.getKind() == ScopeFrame.Kind.LOOP) {
                return frame.getContinueTarget();
            }
        }
        throw new StructuralException(label == null
                ? "continue outside of a loop"
                : "continue to unknown label '" + label + "'");
    }
}
