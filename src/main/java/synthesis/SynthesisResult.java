package synthesis;

import flowgraph.FlowGraph;
import statement.Diagnostic;
import statement.DiagnosticKind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A best-effort graph together with the recoverable problems found while
 * building it.
 */
public final class SynthesisResult {
    private final FlowGraph graph;
    private final List<Diagnostic> diagnostics;

    public SynthesisResult(FlowGraph graph, List<Diagnostic> diagnostics) {
        this.graph = graph;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public FlowGraph getGraph() { return graph; }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }

    public List<Diagnostic> getDiagnostics(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.getKind() == kind).collect(Collectors.toList());
    }
}
