package document;

import flowgraph.FlowGraph;
import layout.Layout;

/**
 * A finished graph with its layout, named after the function it was built from.
 */
public final class FunctionGraph {
    private final String name;
    private final FlowGraph graph;
    private final Layout layout;

    public FunctionGraph(String name, FlowGraph graph, Layout layout) {
        this.name = name;
        this.graph = graph;
        this.layout = layout;
    }

    public String getName() { return name; }
    public FlowGraph getGraph() { return graph; }
    public Layout getLayout() { return layout; }
}
