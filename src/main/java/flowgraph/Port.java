package flowgraph;

import java.util.Objects;

/**
 * Outgoing connection point of a node. A node has at most one edge per port.
 */
public final class Port {

    public enum Kind { NEXT, TRUE, FALSE, CASE, DEFAULT }

    public static final Port NEXT = new Port(Kind.NEXT, null);
    public static final Port TRUE = new Port(Kind.TRUE, null);
    public static final Port FALSE = new Port(Kind.FALSE, null);
    public static final Port DEFAULT = new Port(Kind.DEFAULT, null);

    private final Kind kind;
    private final String caseValue;

    private Port(Kind kind, String caseValue) {
        this.kind = kind;
        this.caseValue = caseValue;
    }

    public static Port caseOf(String value) {
        return new Port(Kind.CASE, Objects.requireNonNull(value, "value"));
    }

    public Kind getKind() { return kind; }

    /** Only set for {@link Kind#CASE}. */
    public String getCaseValue() { return caseValue; }

    /**
     * Parses the document form written by {@link #toString()}.
     */
    public static Port parse(String text) {
        switch (text) {
            case "Next": return NEXT;
            case "True": return TRUE;
            case "False": return FALSE;
            case "Default": return DEFAULT;
            default:
                if (text.startsWith("Case(") && text.endsWith(")")) {
                    return caseOf(text.substring(5, text.length() - 1));
                }
                throw new IllegalArgumentException("Unknown port: " + text);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Port)) return false;
        Port other = (Port) obj;
        return kind == other.kind && Objects.equals(caseValue, other.caseValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, caseValue);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NEXT: return "Next";
            case TRUE: return "True";
            case FALSE: return "False";
            case DEFAULT: return "Default";
            default: return "Case(" + caseValue + ")";
        }
    }
}
