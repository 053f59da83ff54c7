package layout;

import flowgraph.FlowEdge;
import flowgraph.FlowGraph;
import flowgraph.FlowNode;
import flowgraph.Port;

import java.util.*;

/**
 * Assigns every node a grid position. A depth-first spanning tree is taken
 * from the start node; the fall-through successor of a node (Next, False or
 * Default) sits directly below it, the True and Case successors are shifted to
 * the right by the width of the subtrees already placed beside it. Each
 * subtree owns a disjoint column range, so no two nodes share a cell.
 */
public class LayoutAssigner {

    private final double originX;
    private final double originY;
    private final double columnSpacing;
    private final double rowSpacing;

    public LayoutAssigner(double originX, double originY, double columnSpacing, double rowSpacing) {
        this.originX = originX;
        this.originY = originY;
        this.columnSpacing = columnSpacing;
        this.rowSpacing = rowSpacing;
    }

    public Layout assign(FlowGraph graph) {
        Map<Integer, List<Integer>> treeChildren = new HashMap<>();
        Set<Integer> visited = new HashSet<>();
        List<Integer> roots = new ArrayList<>();
        List<Integer> preorder = new ArrayList<>();

        List<FlowNode> nodes = graph.getNodes();
        int startId = nodes.stream()
                .filter(node -> graph.inDegree(node.getId()) == 0)
                .map(FlowNode::getId)
                .findFirst()
                .orElse(nodes.isEmpty() ? -1 : nodes.get(0).getId());
        if (startId >= 0) {
            roots.add(startId);
            buildTree(graph, startId, visited, treeChildren, preorder);
        }
        // nodes the start cannot reach (only in hand-made graphs) get their own trees
        for (FlowNode node : nodes) {
            if (!visited.contains(node.getId())) {
                roots.add(node.getId());
                buildTree(graph, node.getId(), visited, treeChildren, preorder);
            }
        }

        Map<Integer, Integer> widths = measure(preorder, treeChildren);
        Map<Integer, Integer> columns = new HashMap<>();
        int column = 0;
        for (int root : roots) {
            columns.put(root, column);
            column += widths.get(root);
        }
        Map<Integer, Position> positions = place(preorder, roots, columns, treeChildren, widths);
        return new Layout(positions, column * columnSpacing);
    }

    // A node of the spanning tree whose outgoing edges are still being explored.
    private static final class PendingNode {
        final int nodeId;
        final Iterator<FlowEdge> edges;

        PendingNode(int nodeId, Iterator<FlowEdge> edges) {
            this.nodeId = nodeId;
            this.edges = edges;
        }
    }

    /**
     * Depth-first walk with an explicit stack, so graph depth is bounded by heap
     * rather than by the call stack. Appends the tree's nodes to {@code preorder}.
     */
    private void buildTree(FlowGraph graph, int rootId, Set<Integer> visited,
                           Map<Integer, List<Integer>> treeChildren, List<Integer> preorder) {
        Deque<PendingNode> stack = new ArrayDeque<>();
        visited.add(rootId);
        preorder.add(rootId);
        treeChildren.put(rootId, new ArrayList<>());
        stack.push(new PendingNode(rootId, orderedSuccessors(graph, rootId).iterator()));

        while (!stack.isEmpty()) {
            PendingNode pending = stack.peek();
            if (!pending.edges.hasNext()) {
                stack.pop();
                continue;
            }
            int target = pending.edges.next().getToId();
            if (visited.add(target)) {
                treeChildren.get(pending.nodeId).add(target);
                preorder.add(target);
                treeChildren.put(target, new ArrayList<>());
                stack.push(new PendingNode(target, orderedSuccessors(graph, target).iterator()));
            }
        }
    }

    /**
     * Fall-through edge first, then the branches in creation order.
     */
    private List<FlowEdge> orderedSuccessors(FlowGraph graph, int nodeId) {
        List<FlowEdge> ordered = new ArrayList<>();
        List<FlowEdge> sides = new ArrayList<>();
        for (FlowEdge edge : graph.getOutgoing(nodeId)) {
            if (isFallThrough(edge.getFromPort())) {
                ordered.add(edge);
            } else {
                sides.add(edge);
            }
        }
        ordered.addAll(sides);
        return ordered;
    }

    private static boolean isFallThrough(Port port) {
        Port.Kind kind = port.getKind();
        return kind == Port.Kind.NEXT || kind == Port.Kind.FALSE || kind == Port.Kind.DEFAULT;
    }

    // children follow their parent in preorder, so walking it backwards measures them first
    private Map<Integer, Integer> measure(List<Integer> preorder, Map<Integer, List<Integer>> treeChildren) {
        Map<Integer, Integer> widths = new HashMap<>();
        for (int i = preorder.size() - 1; i >= 0; i--) {
            int nodeId = preorder.get(i);
            int width = 0;
            for (int child : treeChildren.get(nodeId)) {
                width += widths.get(child);
            }
            widths.put(nodeId, Math.max(1, width));
        }
        return widths;
    }

    private Map<Integer, Position> place(List<Integer> preorder, List<Integer> roots, Map<Integer, Integer> columns,
                                         Map<Integer, List<Integer>> treeChildren, Map<Integer, Integer> widths) {
        Map<Integer, Integer> rows = new HashMap<>();
        for (int root : roots) {
            rows.put(root, 0);
        }
        Map<Integer, Position> positions = new LinkedHashMap<>();
        for (int nodeId : preorder) {
            int column = columns.get(nodeId);
            int row = rows.get(nodeId);
            positions.put(nodeId, new Position(originX + column * columnSpacing, originY + row * rowSpacing));
            int childColumn = column;
            for (int child : treeChildren.get(nodeId)) {
                columns.put(child, childColumn);
                rows.put(child, row + 1);
                childColumn += widths.get(child);
            }
        }
        return positions;
    }
}
