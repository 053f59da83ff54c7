package flowgraph;

import java.util.*;

/**
 * Verifies the structural guarantees every synthesized graph must satisfy:
 * a single start, exact out-degrees per node kind and no orphan nodes.
 */
public final class GraphInvariantChecker {

    private GraphInvariantChecker() {
    }

    /**
     * @throws InvariantViolationException listing every violation found
     */
    public static void verify(FlowGraph graph) {
        List<String> violations = findViolations(graph);
        if (!violations.isEmpty()) {
            throw new InvariantViolationException(String.join("; ", violations));
        }
    }

    public static List<String> findViolations(FlowGraph graph) {
        List<String> violations = new ArrayList<>();

        for (FlowEdge edge : graph.getEdges()) {
            if (!graph.containsNode(edge.getFromId()) || !graph.containsNode(edge.getToId())) {
                violations.add("edge " + edge + " references an unknown node");
            }
        }

        List<FlowNode> starts = graph.nodesOfKind(NodeKind.START);
        if (starts.size() != 1) {
            violations.add("expected exactly one start node, found " + starts.size());
        }

        for (FlowNode node : graph.getNodes()) {
            List<FlowEdge> out = graph.getOutgoing(node.getId());
            switch (node.getKind()) {
                case START:
                    if (graph.inDegree(node.getId()) != 0) {
                        violations.add("start node " + node + " has incoming edges");
                    }
                    requireSingleNext(node, out, violations);
                    break;
                case END:
                    if (!out.isEmpty()) {
                        violations.add("end node " + node + " has outgoing edges");
                    }
                    break;
                case PROCESS:
                case IO:
                    if (node.isTerminal() && out.isEmpty()) {
                        break;
                    }
                    requireSingleNext(node, out, violations);
                    break;
                case DECISION:
                    checkDecision(node, out, violations);
                    break;
                default:
                    break;
            }
            if (node.getKind() != NodeKind.START && graph.inDegree(node.getId()) == 0) {
                violations.add("orphan node " + node);
            }
        }
        return violations;
    }

    private static void requireSingleNext(FlowNode node, List<FlowEdge> out, List<String> violations) {
        if (out.size() != 1 || out.get(0).getFromPort().getKind() != Port.Kind.NEXT) {
            violations.add("node " + node + " must have exactly one Next edge, has " + out);
        }
    }

    private static void checkDecision(FlowNode node, List<FlowEdge> out, List<String> violations) {
        boolean multiWay = out.stream().anyMatch(edge -> isSwitchPort(edge.getFromPort()));
        if (multiWay) {
            long defaults = out.stream().filter(edge -> edge.getFromPort().equals(Port.DEFAULT)).count();
            boolean foreign = out.stream().anyMatch(edge -> !isSwitchPort(edge.getFromPort()));
            // a switch always has exactly one default exit, synthetic or written
            if (foreign || defaults != 1) {
                violations.add("switch node " + node + " has invalid ports " + out);
            }
            return;
        }
        Set<Port> ports = new HashSet<>();
        out.forEach(edge -> ports.add(edge.getFromPort()));
        if (out.size() != 2 || !ports.equals(Set.of(Port.TRUE, Port.FALSE))) {
            violations.add("decision node " + node + " must have exactly True and False edges, has " + out);
        }
    }

    private static boolean isSwitchPort(Port port) {
        return port.getKind() == Port.Kind.CASE || port.getKind() == Port.Kind.DEFAULT;
    }
}
