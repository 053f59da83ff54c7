package app;

import document.FlowchartDocument;
import flowgraph.FlowGraph;
import flowgraph.NodeKind;
import org.junit.jupiter.api.Test;
import statement.DiagnosticKind;
import statement.FunctionBody;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static statement.StatementNode.*;

class FlowchartConverterTest {

    @Test
    void testConvertProducesLayoutForEveryNode() {
        FlowchartConverter converter = new FlowchartConverter(FlowchartSettings.load());

        ConvertedFunction converted = converter.convert(new FunctionBody("f", List.of(
                ifStmt("x", List.of(process("a"))),
                process("b"))));

        FlowGraph graph = converted.getFunctionGraph().getGraph();
        assertEquals("f", converted.getName());
        assertTrue(converted.getDiagnostics().isEmpty());
        graph.getNodes().forEach(node ->
                assertTrue(converted.getFunctionGraph().getLayout().positionOf(node.getId()).isPresent()));
        assertEquals(-4600, converted.getFunctionGraph().getLayout().positionOf(0).orElseThrow().getX());
    }

    @Test
    void testConvertAllKeepsInputOrder() {
        FlowchartConverter converter = new FlowchartConverter(FlowchartSettings.load().setParallelism(4));
        List<FunctionBody> functions = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            functions.add(new FunctionBody("f" + i, List.of(
                    whileLoop("i < " + i, List.of(assignment("i++"))),
                    returnStmt("return " + i))));
        }

        List<ConvertedFunction> converted = converter.convertAll(functions);

        assertEquals(functions.stream().map(FunctionBody::getName).collect(Collectors.toList()),
                converted.stream().map(ConvertedFunction::getName).collect(Collectors.toList()));
        for (int i = 0; i < 20; i++) {
            FlowGraph graph = converted.get(i).getFunctionGraph().getGraph();
            assertEquals("return " + i, graph.nodesOfKind(NodeKind.END).get(0).getLabel());
        }
    }

    @Test
    void testDiagnosticsTravelWithTheirFunction() {
        FlowchartConverter converter = new FlowchartConverter(FlowchartSettings.load());

        List<ConvertedFunction> converted = converter.convertAll(List.of(
                new FunctionBody("clean", List.of(process("a"))),
                new FunctionBody("broken", List.of(breakStmt(), process("lost")))));

        assertTrue(converted.get(0).getDiagnostics().isEmpty());
        List<DiagnosticKind> kinds = converted.get(1).getDiagnostics().stream()
                .map(d -> d.getKind())
                .collect(Collectors.toList());
        assertEquals(List.of(DiagnosticKind.STRUCTURAL_ERROR, DiagnosticKind.UNREACHABLE_CODE), kinds);
    }

    @Test
    void testInputLoopsCollapseWhenEnabled() {
        FunctionBody function = new FunctionBody("read", List.of(
                whileLoop("more", List.of(input("read x"))),
                output("print x")));

        FlowGraph plain = new FlowchartConverter(FlowchartSettings.load())
                .convert(function).getFunctionGraph().getGraph();
        FlowGraph collapsed = new FlowchartConverter(FlowchartSettings.load().setCollapseInputLoops(true))
                .convert(function).getFunctionGraph().getGraph();

        assertEquals(1, plain.nodesOfKind(NodeKind.DECISION).size());
        assertEquals(0, collapsed.nodesOfKind(NodeKind.DECISION).size());
        assertEquals(2, collapsed.nodesOfKind(NodeKind.IO).size());
    }

    @Test
    void testDocumentIdsPlainForOneFunctionNamespacedForMany() {
        FlowchartConverter converter = new FlowchartConverter(FlowchartSettings.load());
        ConvertedFunction f = converter.convert(new FunctionBody("f", List.of(process("a"))));
        ConvertedFunction g = converter.convert(new FunctionBody("g", List.of(process("b"))));

        FlowchartDocument single = converter.toDocument(List.of(f));
        assertEquals("0", single.nodes.get(0).id);

        FlowchartDocument merged = converter.toDocument(List.of(f, g));
        assertEquals(6, merged.nodes.size());
        assertEquals("f.0", merged.nodes.get(0).id);
        assertEquals("g.0", merged.nodes.get(3).id);
        assertTrue(merged.nodes.get(3).x > merged.nodes.get(0).x);
    }
}
