package statement;

import java.util.Objects;

/**
 * A recoverable problem found while converting one function. The graph is
 * still produced; diagnostics travel next to it.
 */
public final class Diagnostic {
    private final DiagnosticKind kind;
    private final String message;
    private final StatementNode statement;

    public Diagnostic(DiagnosticKind kind, String message, StatementNode statement) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.message = message;
        this.statement = statement;
    }

    public DiagnosticKind getKind() { return kind; }
    public String getMessage() { return message; }

    /** May be null when the problem is not tied to one statement. */
    public StatementNode getStatement() { return statement; }

    @Override
    public String toString() {
        return kind + ": " + message + (statement == null ? "" : " [" + statement + "]");
    }
}
