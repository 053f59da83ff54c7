package flowgraph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Owns the nodes and edges of one conversion. Ids are allocated in creation
 * order. Nodes and edges are only ever appended; once {@link #freeze()} has
 * been called the store refuses any further change.
 */
public class FlowGraphStore {
    private static final Logger logger = LoggerFactory.getLogger(FlowGraphStore.class);

    private final List<FlowNode> nodes = new ArrayList<>();
    private final List<FlowEdge> edges = new ArrayList<>();
    // (node id, port) pairs already used
    private final List<Set<Port>> usedPorts = new ArrayList<>();
    private boolean frozen;

    public int createNode(NodeKind kind, String label) {
        return addNode(kind, label, false);
    }

    /**
     * Creates a node that ends the flow of its construct: a return sink or a
     * break/continue proxy.
     */
    public int createTerminalNode(NodeKind kind, String label) {
        return addNode(kind, label, true);
    }

    private int addNode(NodeKind kind, String label, boolean terminal) {
        checkMutable();
        int id = nodes.size();
        nodes.add(new FlowNode(id, kind, label, terminal));
        usedPorts.add(new HashSet<>());
        logger.debug("node {} {} '{}'", id, kind.getDisplayName(), label);
        return id;
    }

    /**
     * @throws InvariantViolationException when {@code fromId} already has an edge on
     *                                     {@code port} or either id is unknown
     */
    public void addEdge(int fromId, Port port, int toId, String label) {
        checkMutable();
        checkId(fromId);
        checkId(toId);
        if (!usedPorts.get(fromId).add(port)) {
            throw new InvariantViolationException(
                    "DuplicatePort: node " + nodes.get(fromId) + " already has an edge on port " + port);
        }
        edges.add(new FlowEdge(fromId, port, toId, label));
        logger.debug("edge {} -{}-> {}", fromId, port, toId);
    }

    public void addEdge(int fromId, Port port, int toId) {
        addEdge(fromId, port, toId, null);
    }

    public FlowNode getNode(int id) {
        checkId(id);
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Returns the finished graph. The store must not be used afterwards.
     */
    public FlowGraph freeze() {
        checkMutable();
        frozen = true;
        return new FlowGraph(nodes, edges);
    }

    private void checkId(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new InvariantViolationException("Unknown node id " + id);
        }
    }

    private void checkMutable() {
        if (frozen) {
            throw new InvariantViolationException("Flow graph store is frozen");
        }
    }
}
