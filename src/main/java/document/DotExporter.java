package document;

import flowgraph.FlowEdge;
import flowgraph.FlowGraph;
import flowgraph.FlowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a flow graph as Graphviz DOT, one shape per node kind.
 */
public class DotExporter {
    private static final Logger logger = LoggerFactory.getLogger(DotExporter.class);

    public String toDot(FlowGraph graph) {
        StringWriter out = new StringWriter();
        write(graph, out);
        return out.toString();
    }

    public void export(FlowGraph graph, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(graph, writer);
        }
        logger.info("Flow graph exported to: {}", path);
    }

    private void write(FlowGraph graph, Writer target) {
        PrintWriter writer = new PrintWriter(target);
        writer.println("digraph CFG {");
        for (FlowNode node : graph.getNodes()) {
            writer.printf("  \"n%d\" [label=\"%s\", shape=%s];%n", node.getId(), escape(node.getLabel()), shapeOf(node));
        }
        for (FlowEdge edge : graph.getEdges()) {
            if (edge.getLabel() == null) {
                writer.printf("  \"n%d\" -> \"n%d\";%n", edge.getFromId(), edge.getToId());
            } else {
                writer.printf("  \"n%d\" -> \"n%d\" [label=\"%s\"];%n",
                        edge.getFromId(), edge.getToId(), escape(edge.getLabel()));
            }
        }
        writer.println("}");
        writer.flush();
    }

    private static String shapeOf(FlowNode node) {
        switch (node.getKind()) {
            case START:
            case END:
                return "ellipse";
            case DECISION:
                return "diamond";
            case IO:
                return "parallelogram";
            default:
                return "box";
        }
    }

    private static String escape(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
