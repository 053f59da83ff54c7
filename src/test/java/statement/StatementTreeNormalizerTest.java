package statement;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static statement.StatementNode.*;

class StatementTreeNormalizerTest {

    private List<Diagnostic> diagnostics;
    private StatementTreeNormalizer normalizer;

    @BeforeEach
    void setUp() {
        diagnostics = new ArrayList<>();
        normalizer = new StatementTreeNormalizer(diagnostics);
    }

    @Test
    void testBlocksAreSpliced() {
        List<StatementNode> result = normalizer.normalize(List.of(
                process("a"),
                block(List.of(process("b"), block(List.of(process("c"))))),
                process("d")));

        assertEquals(List.of("a", "b", "c", "d"), labels(result));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testElseIfChainBecomesNestedIf() {
        List<StatementNode> result = normalizer.normalize(List.of(
                ifStmt("a", List.of(process("A"))),
                elseIf("b", List.of(process("B"))),
                elseIf("c", List.of(process("C"))),
                elseStmt(List.of(process("D"))),
                process("after")));

        assertEquals(2, result.size());
        StatementNode first = result.get(0);
        assertEquals(StatementTag.IF, first.getTag());
        assertEquals("a", first.getLabel());

        StatementNode second = single(first.getBlock(StatementNode.ELSE));
        assertEquals(StatementTag.IF, second.getTag());
        assertEquals("b", second.getLabel());

        StatementNode third = single(second.getBlock(StatementNode.ELSE));
        assertEquals("c", third.getLabel());
        assertEquals(List.of("C"), labels(third.getBlock(StatementNode.THEN)));
        assertEquals(List.of("D"), labels(third.getBlock(StatementNode.ELSE)));

        assertEquals("after", result.get(1).getLabel());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testIfWithoutElseKeepsNoElseBlock() {
        StatementNode result = single(normalizer.normalize(List.of(ifStmt("x", List.of(process("a"))))));

        assertFalse(result.hasBlock(StatementNode.ELSE));
    }

    @Test
    void testMissingBlocksAreReportedAndEmpty() {
        List<StatementNode> result = normalizer.normalize(List.of(
                new StatementNode(StatementTag.IF, "x", null, null),
                new StatementNode(StatementTag.WHILE_LOOP, "y", null, null),
                new StatementNode(StatementTag.SWITCH, "z", null, null)));

        assertEquals(3, diagnostics.size());
        assertTrue(diagnostics.stream().allMatch(d -> d.getKind() == DiagnosticKind.MALFORMED_TREE));
        assertTrue(result.get(0).getBlock(StatementNode.THEN).isEmpty());
        assertTrue(result.get(1).hasBlock(StatementNode.LOOP_BODY));
        // a switch always gets its default
        assertEquals(StatementTag.DEFAULT, single(result.get(2).getBlock(StatementNode.CASE_BODIES)).getTag());
    }

    @Test
    void testDanglingElseIfIsTreatedAsIf() {
        StatementNode result = single(normalizer.normalize(List.of(elseIf("x", List.of(process("a"))))));

        assertEquals(StatementTag.IF, result.getTag());
        assertEquals(1, diagnostics.size());
    }

    @Test
    void testDanglingElseBodyIsKeptInline() {
        List<StatementNode> result = normalizer.normalize(List.of(
                process("a"),
                elseStmt(List.of(process("b"))),
                caseOf("1", List.of(process("c")))));

        assertEquals(List.of("a", "b", "c"), labels(result));
        assertEquals(2, diagnostics.size());
    }

    @Test
    void testSwitchGetsSyntheticDefault() {
        StatementNode result = single(normalizer.normalize(List.of(
                switchStmt("k", List.of(caseOf("1", List.of(process("a"))))))));

        List<StatementNode> cases = result.getBlock(StatementNode.CASE_BODIES);
        assertEquals(2, cases.size());
        assertEquals(StatementTag.DEFAULT, cases.get(1).getTag());
        assertTrue(cases.get(1).getBlock(StatementNode.THEN).isEmpty());
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testDuplicateSwitchLabelsAreDropped() {
        StatementNode result = single(normalizer.normalize(List.of(
                switchStmt("k", List.of(
                        caseOf("1", List.of(process("a"))),
                        caseOf("1", List.of(process("b"))),
                        defaultCase(List.of(process("c"))),
                        defaultCase(List.of(process("d"))))))));

        List<StatementNode> cases = result.getBlock(StatementNode.CASE_BODIES);
        assertEquals(2, cases.size());
        assertEquals(List.of("a"), labels(cases.get(0).getBlock(StatementNode.THEN)));
        assertEquals(List.of("c"), labels(cases.get(1).getBlock(StatementNode.THEN)));
        assertEquals(2, diagnostics.size());
    }

    @Test
    void testStatementsBetweenLabelsJoinPrecedingCase() {
        StatementNode result = single(normalizer.normalize(List.of(
                switchStmt("k", List.of(
                        caseOf("1", List.of(process("a"))),
                        process("b"),
                        breakStmt(),
                        defaultCase(List.of()))))));

        List<StatementNode> cases = result.getBlock(StatementNode.CASE_BODIES);
        assertEquals(List.of("a", "b", "break"), labels(cases.get(0).getBlock(StatementNode.THEN)));
        assertTrue(diagnostics.isEmpty());
    }

    @Test
    void testResultSharesNoInstancesWithInput() {
        StatementNode a = process("a");
        StatementNode loop = whileLoop("x", List.of(a));
        List<StatementNode> result = normalizer.normalize(List.of(loop, a));

        assertNotSame(loop, result.get(0));
        assertNotSame(a, result.get(1));
        assertNotSame(result.get(1), result.get(0).getBlock(StatementNode.LOOP_BODY).get(0));
    }

    @Test
    void testJumpLabelsSurviveNormalization() {
        List<StatementNode> result = normalizer.normalize(List.of(
                doWhileLoop("more", List.of(
                        block(List.of(continueStmt("retry"))),
                        switchStmt("k", List.of(caseOf("1", List.of(breakStmt("pick"))))).withJumpLabel("pick")))
                        .withJumpLabel("retry")));

        StatementNode loop = result.get(0);
        assertEquals(StatementTag.DO_WHILE_LOOP, loop.getTag());
        assertEquals("retry", loop.getJumpLabel());
        List<StatementNode> body = loop.getBlock(LOOP_BODY);
        assertEquals("retry", body.get(0).getJumpLabel());
        assertEquals("continue retry", body.get(0).getLabel());
        StatementNode selector = body.get(1);
        assertEquals("pick", selector.getJumpLabel());
        assertEquals("pick", selector.getBlock(CASE_BODIES).get(0).getBlock(THEN).get(0).getJumpLabel());
    }

    @Test
    void testLeafStatementsDropStrayChildren() {
        StatementNode odd = new StatementNode(StatementTag.GENERIC, "a", null,
                Map.of(StatementNode.THEN, List.of(process("hidden"))));

        assertTrue(single(normalizer.normalize(List.of(odd))).getChildren().isEmpty());
    }

    // Helper methods

    private static List<String> labels(List<StatementNode> statements) {
        return statements.stream().map(StatementNode::getLabel).collect(Collectors.toList());
    }

    private static StatementNode single(List<StatementNode> statements) {
        assertEquals(1, statements.size(), "expected a single statement: " + statements);
        return statements.get(0);
    }
}
