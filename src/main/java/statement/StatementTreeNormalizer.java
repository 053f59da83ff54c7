package statement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Rewrites a classified statement list into the canonical shape the
 * synthesizer walks:
 * <ul>
 *   <li>{@code Block} statements are spliced into the enclosing list,</li>
 *   <li>{@code ElseIf}/{@code Else} siblings following an {@code If} become its nested else chain,</li>
 *   <li>missing {@code then}/{@code loopBody}/{@code caseBodies} blocks become empty blocks,</li>
 *   <li>every switch ends up with exactly one {@code Default} and unique case values.</li>
 * </ul>
 * Every statement of the result is a fresh instance, so no node is shared
 * between two positions of the tree.
 */
public class StatementTreeNormalizer {
    private static final Logger logger = LoggerFactory.getLogger(StatementTreeNormalizer.class);

    private final List<Diagnostic> diagnostics;

    public StatementTreeNormalizer(List<Diagnostic> diagnostics) {
        this.diagnostics = diagnostics;
    }

    public List<StatementNode> normalize(List<StatementNode> statements) {
        List<StatementNode> result = new ArrayList<>();
        int i = 0;
        while (i < statements.size()) {
            StatementNode stmt = statements.get(i);
            switch (stmt.getTag()) {
                case BLOCK:
                    result.addAll(normalize(stmt.getBlock(StatementNode.THEN)));
                    i++;
                    break;
                case IF:
                    i = normalizeIfChain(statements, i, result);
                    break;
                case ELSE_IF:
                    report(DiagnosticKind.MALFORMED_TREE, "else-if without a preceding if, treated as if", stmt);
                    i = normalizeIfChain(statements, i, result);
                    break;
                case ELSE:
                case CASE:
                case DEFAULT:
                    report(DiagnosticKind.MALFORMED_TREE,
                            stmt.getTag().getDisplayName() + " outside its construct, body kept inline", stmt);
                    result.addAll(normalize(stmt.getBlock(StatementNode.THEN)));
                    i++;
                    break;
                case SWITCH:
                    result.add(normalizeSwitch(stmt));
                    i++;
                    break;
                case FOR_LOOP:
                case WHILE_LOOP:
                case DO_WHILE_LOOP:
                    result.add(normalizeLoop(stmt));
                    i++;
                    break;
                default:
                    result.add(new StatementNode(stmt.getTag(), stmt.getLabel(), stmt.getSourceText(), null,
                            stmt.getJumpLabel()));
                    i++;
                    break;
            }
        }
        return result;
    }

    /**
     * Normalizes the if at {@code start} together with any ElseIf/Else siblings
     * that directly follow it.
     *
     * @return index of the first statement after the chain
     */
    private int normalizeIfChain(List<StatementNode> statements, int start, List<StatementNode> out) {
        StatementNode head = statements.get(start);
        List<StatementNode> links = new ArrayList<>();
        StatementNode trailingElse = null;
        int i = start + 1;
        if (!head.hasBlock(StatementNode.ELSE)) {
            while (i < statements.size() && statements.get(i).getTag() == StatementTag.ELSE_IF) {
                links.add(statements.get(i));
                i++;
            }
            if (i < statements.size() && statements.get(i).getTag() == StatementTag.ELSE) {
                trailingElse = statements.get(i);
                i++;
            }
        }

        List<StatementNode> elseBlock = null;
        if (trailingElse != null) {
            elseBlock = normalize(trailingElse.getBlock(StatementNode.THEN));
        }
        for (int k = links.size() - 1; k >= 0; k--) {
            StatementNode link = links.get(k);
            elseBlock = List.of(buildIf(link, elseBlock));
        }
        if (head.hasBlock(StatementNode.ELSE)) {
            elseBlock = normalize(head.getBlock(StatementNode.ELSE));
        }
        out.add(buildIf(head, elseBlock));
        return i;
    }

    private StatementNode buildIf(StatementNode stmt, List<StatementNode> elseBlock) {
        Map<String, List<StatementNode>> blocks = new LinkedHashMap<>();
        blocks.put(StatementNode.THEN, normalize(requireBlock(stmt, StatementNode.THEN)));
        if (elseBlock != null) {
            blocks.put(StatementNode.ELSE, elseBlock);
        }
        return new StatementNode(StatementTag.IF, stmt.getLabel(), stmt.getSourceText(), blocks);
    }

    private StatementNode normalizeLoop(StatementNode stmt) {
        List<StatementNode> body = normalize(requireBlock(stmt, StatementNode.LOOP_BODY));
        return new StatementNode(stmt.getTag(), stmt.getLabel(), stmt.getSourceText(),
                Map.of(StatementNode.LOOP_BODY, body), stmt.getJumpLabel());
    }

    private StatementNode normalizeSwitch(StatementNode stmt) {
        List<StatementNode> entries = requireBlock(stmt, StatementNode.CASE_BODIES);
        List<StatementNode> cases = new ArrayList<>();
        Set<String> seenValues = new HashSet<>();
        boolean hasDefault = false;
        // statements that appear between labels are appended to the preceding case
        List<StatementNode> stray = new ArrayList<>();

        for (StatementNode entry : entries) {
            if (!entry.getTag().isSwitchLabel()) {
                if (cases.isEmpty()) {
                    report(DiagnosticKind.MALFORMED_TREE, "statement before the first case label dropped", entry);
                } else {
                    stray.add(entry);
                }
                continue;
            }
            flushStray(cases, stray);
            if (entry.getTag() == StatementTag.DEFAULT) {
                if (hasDefault) {
                    report(DiagnosticKind.MALFORMED_TREE, "duplicate default label dropped", entry);
                    continue;
                }
                hasDefault = true;
            } else if (!seenValues.add(entry.getLabel())) {
                report(DiagnosticKind.MALFORMED_TREE, "duplicate case label '" + entry.getLabel() + "' dropped", entry);
                continue;
            }
            cases.add(new StatementNode(entry.getTag(), entry.getLabel(), entry.getSourceText(),
                    Map.of(StatementNode.THEN, normalize(entry.getBlock(StatementNode.THEN)))));
        }
        flushStray(cases, stray);

        if (!hasDefault) {
            cases.add(new StatementNode(StatementTag.DEFAULT, "default", "default:",
                    Map.of(StatementNode.THEN, List.of())));
        }
        return new StatementNode(StatementTag.SWITCH, stmt.getLabel(), stmt.getSourceText(),
                Map.of(StatementNode.CASE_BODIES, cases), stmt.getJumpLabel());
    }

    private void flushStray(List<StatementNode> cases, List<StatementNode> stray) {
        if (stray.isEmpty()) {
            return;
        }
        StatementNode last = cases.remove(cases.size() - 1);
        List<StatementNode> body = new ArrayList<>(last.getBlock(StatementNode.THEN));
        body.addAll(normalize(stray));
        cases.add(last.withChildren(Map.of(StatementNode.THEN, body)));
        stray.clear();
    }

    private List<StatementNode> requireBlock(StatementNode stmt, String name) {
        if (!stmt.hasBlock(name)) {
            report(DiagnosticKind.MALFORMED_TREE, "missing '" + name + "' block, treated as empty", stmt);
        }
        return stmt.getBlock(name);
    }

    private void report(DiagnosticKind kind, String message, StatementNode stmt) {
        Diagnostic diagnostic = new Diagnostic(kind, message, stmt);
        logger.warn("{}", diagnostic);
        diagnostics.add(diagnostic);
    }
}
