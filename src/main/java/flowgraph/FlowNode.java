package flowgraph;

import java.util.Objects;

public final class FlowNode {
    private final int id;
    private final NodeKind kind;
    private final String label;
    private final boolean terminal;

    public FlowNode(int id, NodeKind kind, String label, boolean terminal) {
        this.id = id;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.label = label == null ? "" : label;
        this.terminal = terminal;
    }

    public int getId() { return id; }
    public NodeKind getKind() { return kind; }
    public String getLabel() { return label; }

    /**
     * Return sinks and break/continue proxies: nodes that end the flow of the
     * construct they belong to.
     */
    public boolean isTerminal() { return terminal; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FlowNode)) return false;
        FlowNode other = (FlowNode) obj;
        return id == other.id && kind == other.kind && terminal == other.terminal && label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, kind, label, terminal);
    }

    @Override
    public String toString() {
        return id + ":" + kind.getDisplayName() + "(" + label + ")";
    }
}
