package flowgraph;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphInvariantCheckerTest {

    @Test
    void testWellFormedGraphPasses() {
        List<FlowNode> nodes = List.of(
                node(0, NodeKind.START, "Start"),
                node(1, NodeKind.DECISION, "x"),
                node(2, NodeKind.PROCESS, "a"),
                node(3, NodeKind.END, "End"));
        List<FlowEdge> edges = List.of(
                edge(0, Port.NEXT, 1),
                edge(1, Port.TRUE, 2),
                edge(1, Port.FALSE, 3),
                edge(2, Port.NEXT, 3));

        FlowGraph graph = new FlowGraph(nodes, edges);
        assertTrue(GraphInvariantChecker.findViolations(graph).isEmpty());
        assertDoesNotThrow(() -> GraphInvariantChecker.verify(graph));
    }

    @Test
    void testDecisionMissingFalseEdge() {
        FlowGraph graph = new FlowGraph(
                List.of(node(0, NodeKind.START, "Start"), node(1, NodeKind.DECISION, "x"),
                        node(2, NodeKind.END, "End")),
                List.of(edge(0, Port.NEXT, 1), edge(1, Port.TRUE, 2)));

        List<String> violations = GraphInvariantChecker.findViolations(graph);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("True and False"));
    }

    @Test
    void testOrphanNodeIsReported() {
        FlowGraph graph = new FlowGraph(
                List.of(node(0, NodeKind.START, "Start"), node(1, NodeKind.END, "End"),
                        node(2, NodeKind.PROCESS, "lost")),
                List.of(edge(0, Port.NEXT, 1), edge(2, Port.NEXT, 1)));

        List<String> violations = GraphInvariantChecker.findViolations(graph);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).startsWith("orphan"));
        assertThrows(InvariantViolationException.class, () -> GraphInvariantChecker.verify(graph));
    }

    @Test
    void testProcessNodeWithoutSuccessor() {
        FlowGraph graph = new FlowGraph(
                List.of(node(0, NodeKind.START, "Start"), node(1, NodeKind.PROCESS, "a")),
                List.of(edge(0, Port.NEXT, 1)));

        assertFalse(GraphInvariantChecker.findViolations(graph).isEmpty());
    }

    @Test
    void testTerminalProcessNodeMayHaveNoSuccessor() {
        FlowGraph graph = new FlowGraph(
                List.of(node(0, NodeKind.START, "Start"), new FlowNode(1, NodeKind.PROCESS, "break", true)),
                List.of(edge(0, Port.NEXT, 1)));

        assertTrue(GraphInvariantChecker.findViolations(graph).isEmpty());
    }

    @Test
    void testEndNodeWithOutgoingEdge() {
        FlowGraph graph = new FlowGraph(
                List.of(node(0, NodeKind.START, "Start"), node(1, NodeKind.END, "End"),
                        node(2, NodeKind.PROCESS, "after")),
                List.of(edge(0, Port.NEXT, 1), edge(1, Port.NEXT, 2), edge(2, Port.NEXT, 1)));

        List<String> violations = GraphInvariantChecker.findViolations(graph);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).startsWith("end node"));
    }

    @Test
    void testSwitchWithTwoDefaultsOrMixedPorts() {
        List<FlowNode> nodes = List.of(
                node(0, NodeKind.START, "Start"),
                node(1, NodeKind.DECISION, "k"),
                node(2, NodeKind.END, "End"));
        List<FlowEdge> mixed = new ArrayList<>(List.of(
                edge(0, Port.NEXT, 1),
                edge(1, Port.caseOf("1"), 2),
                edge(1, Port.TRUE, 2)));

        assertEquals(1, GraphInvariantChecker.findViolations(new FlowGraph(nodes, mixed)).size());

        List<FlowEdge> valid = List.of(
                edge(0, Port.NEXT, 1),
                edge(1, Port.caseOf("1"), 2),
                edge(1, Port.caseOf("2"), 2),
                edge(1, Port.DEFAULT, 2));
        assertTrue(GraphInvariantChecker.findViolations(new FlowGraph(nodes, valid)).isEmpty());
    }

    @Test
    void testSwitchWithoutDefaultIsReported() {
        FlowGraph graph = new FlowGraph(
                List.of(node(0, NodeKind.START, "Start"), node(1, NodeKind.DECISION, "k"),
                        node(2, NodeKind.END, "End")),
                List.of(edge(0, Port.NEXT, 1), edge(1, Port.caseOf("1"), 2), edge(1, Port.caseOf("2"), 2)));

        List<String> violations = GraphInvariantChecker.findViolations(graph);
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).startsWith("switch node"));
        assertThrows(InvariantViolationException.class, () -> GraphInvariantChecker.verify(graph));
    }

    @Test
    void testMissingOrDuplicateStart() {
        FlowGraph noStart = new FlowGraph(List.of(node(0, NodeKind.END, "End")), List.of());
        assertTrue(GraphInvariantChecker.findViolations(noStart).stream()
                .anyMatch(v -> v.contains("exactly one start")));

        FlowGraph twoStarts = new FlowGraph(
                List.of(node(0, NodeKind.START, "Start"), node(1, NodeKind.START, "Start"),
                        node(2, NodeKind.END, "End")),
                List.of(edge(0, Port.NEXT, 2), edge(1, Port.NEXT, 2)));
        assertTrue(GraphInvariantChecker.findViolations(twoStarts).stream()
                .anyMatch(v -> v.contains("exactly one start")));
    }

    @Test
    void testEdgeToUnknownNode() {
        FlowGraph graph = new FlowGraph(
                List.of(node(0, NodeKind.START, "Start")),
                List.of(edge(0, Port.NEXT, 9)));

        assertTrue(GraphInvariantChecker.findViolations(graph).stream()
                .anyMatch(v -> v.contains("unknown node")));
    }

    // Helper methods

    private static FlowNode node(int id, NodeKind kind, String label) {
        return new FlowNode(id, kind, label, false);
    }

    private static FlowEdge edge(int from, Port port, int to) {
        return new FlowEdge(from, port, to, null);
    }
}
