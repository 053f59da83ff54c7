package synthesis;

/**
 * Break/continue targets of one enclosing loop or switch.
 */
final class ScopeFrame {

    enum Kind { LOOP, SWITCH }

    private final Kind kind;
    private final Continuation breakTarget;
    private final Continuation continueTarget;
    private final String name;

    private ScopeFrame(Kind kind, Continuation breakTarget, Continuation continueTarget, String name) {
        this.kind = kind;
        this.breakTarget = breakTarget;
        this.continueTarget = continueTarget;
        this.name = name;
    }

    static ScopeFrame loop(Continuation condition, Continuation breakTarget, String name) {
        return new ScopeFrame(Kind.LOOP, breakTarget, condition, name);
    }

    static ScopeFrame switchFrame(Continuation breakTarget, String name) {
        return new ScopeFrame(Kind.SWITCH, breakTarget, null, name);
    }

    Kind getKind() { return kind; }
    Continuation getBreakTarget() { return breakTarget; }

    /** Condition of the loop; null for a switch frame. */
    Continuation getContinueTarget() { return continueTarget; }

    boolean isNamed(String label) {
        return label.equals(name);
    }
}
