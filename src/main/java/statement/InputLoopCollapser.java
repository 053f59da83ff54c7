package statement;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Optional display transform: a small loop that only exists to read input
 * ({@code while (cin >> x) { ... }}) is drawn as its single input statement.
 * Runs on the tree as classified, before synthesis normalizes it; blocks are
 * looked through when counting. The synthesized graph keeps all of its
 * structural guarantees.
 */
public class InputLoopCollapser {
    private static final Logger logger = LoggerFactory.getLogger(InputLoopCollapser.class);

    private final int threshold;

    /**
     * @param threshold maximum number of statements (nested ones included) a loop body may
     *                  hold and still be collapsed
     */
    public InputLoopCollapser(int threshold) {
        this.threshold = threshold;
    }

    public List<StatementNode> collapse(List<StatementNode> statements) {
        List<StatementNode> result = new ArrayList<>(statements.size());
        for (StatementNode stmt : statements) {
            result.add(collapseStatement(stmt));
        }
        return result;
    }

    private StatementNode collapseStatement(StatementNode stmt) {
        if (stmt.getTag().isLoop()) {
            List<StatementNode> body = stmt.getBlock(StatementNode.LOOP_BODY);
            StatementNode input = findInput(body);
            if (input != null && countStatements(body) <= threshold) {
                logger.debug("Collapsing input loop '{}' into '{}'", stmt.getLabel(), input.getLabel());
                return new StatementNode(StatementTag.INPUT, input.getLabel(), stmt.getSourceText(), null);
            }
        }
        if (stmt.getChildren().isEmpty()) {
            return stmt;
        }
        Map<String, List<StatementNode>> blocks = new LinkedHashMap<>();
        for (Map.Entry<String, List<StatementNode>> entry : stmt.getChildren().entrySet()) {
            blocks.put(entry.getKey(), collapse(entry.getValue()));
        }
        return stmt.withChildren(blocks);
    }

    private StatementNode findInput(List<StatementNode> statements) {
        for (StatementNode stmt : statements) {
            if (stmt.getTag() == StatementTag.INPUT) {
                return stmt;
            }
            for (List<StatementNode> block : stmt.getChildren().values()) {
                StatementNode nested = findInput(block);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    static int countStatements(List<StatementNode> statements) {
        int count = 0;
        for (StatementNode stmt : statements) {
            if (stmt.getTag() == StatementTag.BLOCK) {
                count += countStatements(stmt.getBlock(StatementNode.THEN));
                continue;
            }
            count++;
            for (List<StatementNode> block : stmt.getChildren().values()) {
                count += countStatements(block);
            }
        }
        return count;
    }
}
