package document;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import flowgraph.*;
import layout.Layout;
import layout.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Converts flow graphs to and from the JSON flowchart document, and merges the
 * graphs of several functions into one document.
 */
public class FlowGraphDocuments {
    private static final Logger logger = LoggerFactory.getLogger(FlowGraphDocuments.class);

    // every node has a single entry point
    static final String ENTRY_PORT = "Next";
    private static final String NAMESPACE_SEPARATOR = ".";

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    public FlowchartDocument toDocument(FlowGraph graph, Layout layout) {
        return toDocument(graph, layout, "", 0);
    }

    private FlowchartDocument toDocument(FlowGraph graph, Layout layout, String prefix, double offsetX) {
        FlowchartDocument document = new FlowchartDocument();
        for (FlowNode node : graph.getNodes()) {
            Position position = layout.positionOf(node.getId()).orElse(new Position(0, 0));
            document.nodes.add(new FlowchartDocument.NodeEntry(prefix + node.getId(),
                    node.getKind().getDisplayName(), node.getLabel(),
                    position.getX() + offsetX, position.getY(), node.isTerminal()));
        }
        for (FlowEdge edge : graph.getEdges()) {
            document.edges.add(new FlowchartDocument.EdgeEntry(prefix + edge.getFromId(),
                    edge.getFromPort().toString(), prefix + edge.getToId(), ENTRY_PORT, edge.getLabel()));
        }
        return document;
    }

    /**
     * Concatenates the graphs of several functions. Node ids are prefixed with the
     * function name and every function is shifted right past the previous ones.
     */
    public FlowchartDocument merge(List<FunctionGraph> functions, double functionOffsetX) {
        FlowchartDocument merged = new FlowchartDocument();
        Set<String> names = new HashSet<>();
        double offsetX = 0;
        for (FunctionGraph function : functions) {
            String name = function.getName();
            int suffix = 2;
            while (!names.add(name)) {
                name = function.getName() + "_" + suffix++;
            }
            FlowchartDocument part = toDocument(function.getGraph(), function.getLayout(),
                    name + NAMESPACE_SEPARATOR, offsetX);
            merged.nodes.addAll(part.nodes);
            merged.edges.addAll(part.edges);
            offsetX += function.getLayout().getWidth() + functionOffsetX;
        }
        logger.debug("Merged {} functions into {} nodes", functions.size(), merged.nodes.size());
        return merged;
    }

    /**
     * Rebuilds the graph of a single-function document. Layout coordinates are
     * not part of the graph and are dropped.
     *
     * @throws JsonParseException when the document does not describe a graph
     */
    public FlowGraph toGraph(FlowchartDocument document) {
        if (document == null || document.nodes == null || document.edges == null) {
            throw new JsonParseException("Document must contain 'nodes' and 'edges'");
        }
        List<FlowNode> nodes = new ArrayList<>();
        for (FlowchartDocument.NodeEntry entry : document.nodes) {
            NodeKind kind;
            try {
                kind = NodeKind.fromDisplayName(entry.kind);
            } catch (IllegalArgumentException e) {
                throw new JsonParseException(e.getMessage(), e);
            }
            nodes.add(new FlowNode(parseId(entry.id), kind, entry.label, Boolean.TRUE.equals(entry.terminal)));
        }
        List<FlowEdge> edges = new ArrayList<>();
        for (FlowchartDocument.EdgeEntry entry : document.edges) {
            Port port;
            try {
                port = Port.parse(entry.fromPort);
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new JsonParseException("Invalid port '" + entry.fromPort + "'", e);
            }
            edges.add(new FlowEdge(parseId(entry.fromId), port, parseId(entry.toId), entry.label));
        }
        try {
            return new FlowGraph(nodes, edges);
        } catch (InvariantViolationException e) {
            throw new JsonParseException(e.getMessage(), e);
        }
    }

    private static int parseId(String id) {
        try {
            return Integer.parseInt(id);
        } catch (NumberFormatException e) {
            throw new JsonParseException("Node id '" + id + "' is not a single-function id", e);
        }
    }

    public String toJson(FlowchartDocument document) {
        return gson.toJson(document);
    }

    public FlowchartDocument fromJson(String json) {
        return gson.fromJson(json, FlowchartDocument.class);
    }

    public FlowchartDocument read(Reader reader) {
        return gson.fromJson(reader, FlowchartDocument.class);
    }

    public void write(FlowchartDocument document, Writer writer) {
        gson.toJson(document, writer);
    }

    public void write(FlowchartDocument document, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            write(document, writer);
        }
        logger.info("Flowchart written to {}", path);
    }
}
