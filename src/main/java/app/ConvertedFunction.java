package app;

import document.FunctionGraph;
import statement.Diagnostic;
import synthesis.SynthesisResult;

import java.util.List;

/**
 * Everything produced for one function: the laid out graph and its diagnostics.
 */
public final class ConvertedFunction {
    private final FunctionGraph functionGraph;
    private final List<Diagnostic> diagnostics;

    public ConvertedFunction(FunctionGraph functionGraph, SynthesisResult result) {
        this.functionGraph = functionGraph;
        this.diagnostics = result.getDiagnostics();
    }

    public String getName() { return functionGraph.getName(); }
    public FunctionGraph getFunctionGraph() { return functionGraph; }
    public List<Diagnostic> getDiagnostics() { return diagnostics; }
}
