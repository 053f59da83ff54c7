package flowgraph;

import java.util.Objects;

public final class FlowEdge {
    private final int fromId;
    private final Port fromPort;
    private final int toId;
    private final String label;

    public FlowEdge(int fromId, Port fromPort, int toId, String label) {
        this.fromId = fromId;
        this.fromPort = Objects.requireNonNull(fromPort, "fromPort");
        this.toId = toId;
        this.label = label;
    }

    public int getFromId() { return fromId; }
    public Port getFromPort() { return fromPort; }
    public int getToId() { return toId; }

    /** May be null. */
    public String getLabel() { return label; }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FlowEdge)) return false;
        FlowEdge other = (FlowEdge) obj;
        return fromId == other.fromId && toId == other.toId
                && fromPort.equals(other.fromPort) && Objects.equals(label, other.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromId, fromPort, toId, label);
    }

    @Override
    public String toString() {
        return fromId + " -" + fromPort + "-> " + toId;
    }
}
