package flowgraph;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Immutable result of one conversion: nodes addressed by id, plus an edge list.
 */
public final class FlowGraph {
    private final List<FlowNode> nodes;
    private final List<FlowEdge> edges;
    private final Map<Integer, FlowNode> nodesById = new HashMap<>();
    private final Map<Integer, List<FlowEdge>> outgoing = new HashMap<>();
    private final Map<Integer, List<FlowEdge>> incoming = new HashMap<>();

    public FlowGraph(List<FlowNode> nodes, List<FlowEdge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        for (FlowNode node : this.nodes) {
            if (nodesById.put(node.getId(), node) != null) {
                throw new InvariantViolationException("Duplicate node id " + node.getId());
            }
        }
        for (FlowEdge edge : this.edges) {
            outgoing.computeIfAbsent(edge.getFromId(), k -> new ArrayList<>()).add(edge);
            incoming.computeIfAbsent(edge.getToId(), k -> new ArrayList<>()).add(edge);
        }
    }

    public List<FlowNode> getNodes() { return nodes; }
    public List<FlowEdge> getEdges() { return edges; }

    public FlowNode getNode(int id) {
        FlowNode node = nodesById.get(id);
        if (node == null) {
            throw new NoSuchElementException("No node with id " + id);
        }
        return node;
    }

    public boolean containsNode(int id) {
        return nodesById.containsKey(id);
    }

    public List<FlowEdge> getOutgoing(int id) {
        return outgoing.getOrDefault(id, List.of());
    }

    public List<FlowEdge> getIncoming(int id) {
        return incoming.getOrDefault(id, List.of());
    }

    public int outDegree(int id) {
        return getOutgoing(id).size();
    }

    public int inDegree(int id) {
        return getIncoming(id).size();
    }

    /**
     * @return the target of the edge leaving {@code id} on {@code port}, if any
     */
    public Optional<FlowNode> successor(int id, Port port) {
        return getOutgoing(id).stream()
                .filter(edge -> edge.getFromPort().equals(port))
                .map(edge -> getNode(edge.getToId()))
                .findFirst();
    }

    public List<FlowNode> nodesOfKind(NodeKind kind) {
        return nodes.stream().filter(node -> node.getKind() == kind).collect(Collectors.toList());
    }

    public FlowNode getStart() {
        List<FlowNode> starts = nodesOfKind(NodeKind.START);
        if (starts.size() != 1) {
            throw new InvariantViolationException("Expected exactly one start node, found " + starts.size());
        }
        return starts.get(0);
    }

    /**
     * Human readable dump, one node or edge per line.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder("Nodes:\n");
        for (FlowNode node : nodes) {
            sb.append("  ").append(node).append('\n');
        }
        sb.append("Edges:\n");
        for (FlowEdge edge : edges) {
            sb.append("  ").append(edge);
            if (edge.getLabel() != null) {
                sb.append(" [").append(edge.getLabel()).append(']');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FlowGraph)) return false;
        FlowGraph other = (FlowGraph) obj;
        return nodes.equals(other.nodes) && new HashSet<>(edges).equals(new HashSet<>(other.edges));
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, new HashSet<>(edges));
    }
}
