package synthesis;

import flowgraph.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statement.*;

import java.util.*;

/**
 * Builds the control-flow graph of one function body in a single recursive
 * walk. Every construct is handed the continuation it must link to when it
 * completes normally, so branch ends are wired to their reconvergence point at
 * the moment they are created and no edge is ever added after the fact.
 *
 * <p>A statement's head node is created lazily, the first time a predecessor
 * resolves the continuation that leads to it. Statements nothing can reach
 * therefore never get a node; they are reported as unreachable instead.
 *
 * <p>Instances are immutable and may be shared between threads; each call to
 * {@link #synthesize(List)} works on its own store and scope context.
 */
public class CfgSynthesizer {
    private static final Logger logger = LoggerFactory.getLogger(CfgSynthesizer.class);

    private final FlowLabels labels;
    private final boolean verifyInvariants;

    public CfgSynthesizer() {
        this(FlowLabels.DEFAULT, true);
    }

    public CfgSynthesizer(FlowLabels labels, boolean verifyInvariants) {
        this.labels = labels;
        this.verifyInvariants = verifyInvariants;
    }

    /**
     * Normalizes and converts one function body.
     *
     * @throws InvariantViolationException if the produced graph breaks a structural guarantee
     */
    public SynthesisResult synthesize(List<StatementNode> statements) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        List<StatementNode> normalized = new StatementTreeNormalizer(diagnostics).normalize(statements);
        FlowGraph graph = new Conversion(diagnostics).run(normalized);
        if (verifyInvariants) {
            GraphInvariantChecker.verify(graph);
        }
        logger.debug("Synthesized {} nodes, {} edges, {} diagnostics",
                graph.getNodes().size(), graph.getEdges().size(), diagnostics.size());
        return new SynthesisResult(graph, diagnostics);
    }

    public SynthesisResult synthesize(FunctionBody function) {
        logger.debug("Synthesizing function {}", function.getName());
        return synthesize(function.getStatements());
    }

    // Entry of a sequence and whether control can leave it through its continuation.
    private static final class SequenceOutcome {
        final int entry;
        final boolean fallsThrough;

        SequenceOutcome(int entry, boolean fallsThrough) {
            this.entry = entry;
            this.fallsThrough = fallsThrough;
        }
    }

    /**
     * State of a single conversion.
     */
    private final class Conversion {
        private final FlowGraphStore store = new FlowGraphStore();
        private final ScopeContext scope = new ScopeContext();
        private final List<Diagnostic> diagnostics;
        private final Map<StatementNode, Integer> heads = new IdentityHashMap<>();
        private int endNode = -1;

        Conversion(List<Diagnostic> diagnostics) {
            this.diagnostics = diagnostics;
        }

        FlowGraph run(List<StatementNode> statements) {
            int start = store.createNode(NodeKind.START, labels.getStart());
            SequenceOutcome body = processSequence(statements, this::endNode);
            store.addEdge(start, Port.NEXT, body.entry);
            return store.freeze();
        }

        private int endNode() {
            if (endNode < 0) {
                endNode = store.createNode(NodeKind.END, labels.getEnd());
            }
            return endNode;
        }

        private int headOf(StatementNode stmt) {
            Integer head = heads.get(stmt);
            if (head == null) {
                head = createHead(stmt);
                heads.put(stmt, head);
            }
            return head;
        }

        private Continuation headContinuation(StatementNode stmt) {
            return () -> headOf(stmt);
        }

        private int createHead(StatementNode stmt) {
            switch (stmt.getTag()) {
                case GENERIC:
                case ASSIGNMENT:
                case CALL:
                    return store.createNode(NodeKind.PROCESS, stmt.getLabel());
                case INPUT:
                case OUTPUT:
                    return store.createNode(NodeKind.IO, stmt.getLabel());
                case RETURN:
                    return store.createTerminalNode(NodeKind.END, stmt.getLabel());
                case BREAK:
                    return store.createTerminalNode(NodeKind.PROCESS, jumpLabel("break", stmt));
                case CONTINUE:
                    return store.createTerminalNode(NodeKind.PROCESS, jumpLabel("continue", stmt));
                case DO_WHILE_LOOP:
                    // the body is entered before the condition is ever tested
                    List<StatementNode> body = stmt.getBlock(StatementNode.LOOP_BODY);
                    if (!body.isEmpty()) {
                        return headOf(body.get(0));
                    }
                    return store.createNode(NodeKind.DECISION, stmt.getLabel());
                case IF:
                case SWITCH:
                case FOR_LOOP:
                case WHILE_LOOP:
                    return store.createNode(NodeKind.DECISION, stmt.getLabel());
                default:
                    throw new InvariantViolationException("Statement was not normalized: " + stmt);
            }
        }

        private String jumpLabel(String keyword, StatementNode stmt) {
            return stmt.getJumpLabel() == null ? keyword : keyword + " " + stmt.getJumpLabel();
        }

        /**
         * Walks {@code statements} left to right. Statement i continues at the head of
         * statement i+1, the last one at {@code continuation}.
         */
        private SequenceOutcome processSequence(List<StatementNode> statements, Continuation continuation) {
            if (statements.isEmpty()) {
                return new SequenceOutcome(continuation.resolve(), true);
            }
            int entry = headOf(statements.get(0));
            for (int i = 0; i < statements.size(); i++) {
                StatementNode stmt = statements.get(i);
                boolean last = i == statements.size() - 1;
                TrackingContinuation next = new TrackingContinuation(
                        last ? continuation : headContinuation(statements.get(i + 1)));

                OptionalInt pendingTail = processStatement(stmt, heads.get(stmt), next);
                if (pendingTail.isPresent()) {
                    store.addEdge(pendingTail.getAsInt(), Port.NEXT, next.resolve());
                }

                if (last) {
                    return new SequenceOutcome(entry, next.isUsed());
                }
                if (!next.isUsed()) {
                    reportUnreachable(stmt, statements.subList(i + 1, statements.size()));
                    break;
                }
            }
            return new SequenceOutcome(entry, false);
        }

        /**
         * @return the node still waiting for its {@code Next} edge, or empty when the
         *         statement wired all of its exits itself
         */
        private OptionalInt processStatement(StatementNode stmt, int head, Continuation next) {
            switch (stmt.getTag()) {
                case RETURN:
                    return OptionalInt.empty();
                case BREAK:
                    store.addEdge(head, Port.NEXT, breakTarget(stmt));
                    return OptionalInt.empty();
                case CONTINUE:
                    store.addEdge(head, Port.NEXT, continueTarget(stmt));
                    return OptionalInt.empty();
                case IF:
                    processIf(stmt, head, next);
                    return OptionalInt.empty();
                case FOR_LOOP:
                case WHILE_LOOP:
                    processLoop(stmt, head, next);
                    return OptionalInt.empty();
                case DO_WHILE_LOOP:
                    processDoWhile(stmt, head, next);
                    return OptionalInt.empty();
                case SWITCH:
                    processSwitch(stmt, head, next);
                    return OptionalInt.empty();
                default:
                    return OptionalInt.of(head);
            }
        }

        private int breakTarget(StatementNode stmt) {
            try {
                return scope.resolveBreak(stmt.getJumpLabel()).resolve();
            } catch (StructuralException e) {
                report(DiagnosticKind.STRUCTURAL_ERROR, e.getMessage() + ", routed to the end", stmt);
                return endNode();
            }
        }

        private int continueTarget(StatementNode stmt) {
            try {
                return scope.resolveContinue(stmt.getJumpLabel()).resolve();
            } catch (StructuralException e) {
                report(DiagnosticKind.STRUCTURAL_ERROR, e.getMessage() + ", routed to the end", stmt);
                return endNode();
            }
        }

        private void processIf(StatementNode stmt, int decision, Continuation next) {
            SequenceOutcome thenBranch = processSequence(stmt.getBlock(StatementNode.THEN), next);
            store.addEdge(decision, Port.TRUE, thenBranch.entry, labels.getTrueLabel());

            int falseTarget;
            if (stmt.hasBlock(StatementNode.ELSE)) {
                falseTarget = processSequence(stmt.getBlock(StatementNode.ELSE), next).entry;
            } else {
                falseTarget = next.resolve();
            }
            store.addEdge(decision, Port.FALSE, falseTarget, labels.getFalseLabel());
        }

        private void processLoop(StatementNode stmt, int condition, Continuation next) {
            SequenceOutcome body;
            scope.pushLoop(Continuation.node(condition), next, stmt.getJumpLabel());
            try {
                body = processSequence(stmt.getBlock(StatementNode.LOOP_BODY), Continuation.node(condition));
            } finally {
                scope.pop();
            }
            // an empty body leaves the condition looping onto itself
            store.addEdge(condition, Port.TRUE, body.entry, labels.getTrueLabel());
            store.addEdge(condition, Port.FALSE, next.resolve(), labels.getFalseLabel());
        }

        /**
         * The body runs first and ends at the condition, whose {@code True} edge leads
         * back to the body entry. The condition node is created only once the body or a
         * {@code continue} reaches it.
         */
        private void processDoWhile(StatementNode stmt, int entry, Continuation next) {
            List<StatementNode> body = stmt.getBlock(StatementNode.LOOP_BODY);
            if (body.isEmpty()) {
                processLoop(stmt, entry, next);
                return;
            }
            int[] condition = {-1};
            Continuation conditionNode = () -> {
                if (condition[0] < 0) {
                    condition[0] = store.createNode(NodeKind.DECISION, stmt.getLabel());
                }
                return condition[0];
            };

            scope.pushLoop(conditionNode, next, stmt.getJumpLabel());
            try {
                processSequence(body, conditionNode);
            } finally {
                scope.pop();
            }
            if (condition[0] >= 0) {
                store.addEdge(condition[0], Port.TRUE, entry, labels.getTrueLabel());
                store.addEdge(condition[0], Port.FALSE, next.resolve(), labels.getFalseLabel());
            }
        }

        /**
         * Case bodies fall through into the next body unless they end with a
         * {@code break} of this switch; the trailing break itself gets no node.
         */
        private void processSwitch(StatementNode stmt, int selector, Continuation next) {
            List<StatementNode> cases = stmt.getBlock(StatementNode.CASE_BODIES);
            int count = cases.size();
            List<List<StatementNode>> bodies = new ArrayList<>(count);
            boolean[] endsWithBreak = new boolean[count];
            for (int j = 0; j < count; j++) {
                List<StatementNode> body = cases.get(j).getBlock(StatementNode.THEN);
                if (!body.isEmpty() && leavesSwitch(body.get(body.size() - 1), stmt)) {
                    endsWithBreak[j] = true;
                    body = body.subList(0, body.size() - 1);
                }
                bodies.add(body);
            }

            // built back to front: a body's exit is the entry of the following one
            Continuation[] exits = new Continuation[count];
            Continuation following = next;
            for (int j = count - 1; j >= 0; j--) {
                exits[j] = endsWithBreak[j] ? next : following;
                following = bodies.get(j).isEmpty() ? exits[j] : headContinuation(bodies.get(j).get(0));
            }

            scope.pushSwitch(next, stmt.getJumpLabel());
            try {
                for (int j = 0; j < count; j++) {
                    StatementNode label = cases.get(j);
                    SequenceOutcome body = processSequence(bodies.get(j), exits[j]);
                    if (label.getTag() == StatementTag.DEFAULT) {
                        store.addEdge(selector, Port.DEFAULT, body.entry, labels.getDefaultLabel());
                    } else {
                        store.addEdge(selector, Port.caseOf(label.getLabel()), body.entry, label.getLabel());
                    }
                }
            } finally {
                scope.pop();
            }
        }

        // a break naming an enclosing statement is an ordinary jump, not the case exit
        private boolean leavesSwitch(StatementNode last, StatementNode switchStmt) {
            if (last.getTag() != StatementTag.BREAK) {
                return false;
            }
            return last.getJumpLabel() == null || last.getJumpLabel().equals(switchStmt.getJumpLabel());
        }

        private void reportUnreachable(StatementNode divergent, List<StatementNode> omitted) {
            report(DiagnosticKind.UNREACHABLE_CODE, omitted.size() + " unreachable statement(s) after '"
                    + divergent.getLabel() + "' omitted", omitted.get(0));
        }

        private void report(DiagnosticKind kind, String message, StatementNode stmt) {
            Diagnostic diagnostic = new Diagnostic(kind, message, stmt);
            logger.warn("{}", diagnostic);
            diagnostics.add(diagnostic);
        }
    }
}
