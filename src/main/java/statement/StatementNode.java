package statement;

import java.util.*;

/**
 * One classified statement of a function body. Instances are immutable; the
 * named child blocks keep their insertion order.
 */
public final class StatementNode {

    public static final String THEN = "then";
    public static final String ELSE = "else";
    public static final String LOOP_BODY = "loopBody";
    public static final String CASE_BODIES = "caseBodies";

    private final StatementTag tag;
    private final String label;
    private final String sourceText;
    private final Map<String, List<StatementNode>> children;
    private final String jumpLabel;

    public StatementNode(StatementTag tag, String label, String sourceText,
                         Map<String, List<StatementNode>> children) {
        this(tag, label, sourceText, children, null);
    }

    /**
     * @param jumpLabel source label: the name a loop or switch is labeled with, or the
     *                  name a break/continue refers to; null when there is none
     */
    public StatementNode(StatementTag tag, String label, String sourceText,
                         Map<String, List<StatementNode>> children, String jumpLabel) {
        this.jumpLabel = jumpLabel;
        this.tag = Objects.requireNonNull(tag, "tag");
        this.label = label == null ? "" : label.replace("\n", " ").trim();
        this.sourceText = sourceText == null ? this.label : sourceText;
        Map<String, List<StatementNode>> copy = new LinkedHashMap<>();
        if (children != null) {
            for (Map.Entry<String, List<StatementNode>> entry : children.entrySet()) {
                copy.put(entry.getKey(), List.copyOf(entry.getValue()));
            }
        }
        this.children = Collections.unmodifiableMap(copy);
    }

    public StatementTag getTag() { return tag; }
    public String getLabel() { return label; }
    public String getSourceText() { return sourceText; }
    public Map<String, List<StatementNode>> getChildren() { return children; }
    public String getJumpLabel() { return jumpLabel; }

    public boolean hasBlock(String name) {
        return children.containsKey(name);
    }

    /**
     * @return the named block, or an empty list when it is absent
     */
    public List<StatementNode> getBlock(String name) {
        return children.getOrDefault(name, List.of());
    }

    /**
     * Returns a copy of this statement with its child blocks replaced.
     */
    public StatementNode withChildren(Map<String, List<StatementNode>> newChildren) {
        return new StatementNode(tag, label, sourceText, newChildren, jumpLabel);
    }

    public StatementNode withTag(StatementTag newTag) {
        return new StatementNode(newTag, label, sourceText, children, jumpLabel);
    }

    public StatementNode withJumpLabel(String newJumpLabel) {
        return new StatementNode(tag, label, sourceText, children, newJumpLabel);
    }

    @Override
    public String toString() {
        return tag.getDisplayName() + "(" + label + ")";
    }

    // Factories used by the front ends and tests.

    public static StatementNode of(StatementTag tag, String label) {
        return new StatementNode(tag, label, label, null);
    }

    public static StatementNode process(String label) {
        return of(StatementTag.GENERIC, label);
    }

    public static StatementNode assignment(String label) {
        return of(StatementTag.ASSIGNMENT, label);
    }

    public static StatementNode call(String label) {
        return of(StatementTag.CALL, label);
    }

    public static StatementNode input(String label) {
        return of(StatementTag.INPUT, label);
    }

    public static StatementNode output(String label) {
        return of(StatementTag.OUTPUT, label);
    }

    public static StatementNode returnStmt(String label) {
        return of(StatementTag.RETURN, label);
    }

    public static StatementNode breakStmt() {
        return of(StatementTag.BREAK, "break");
    }

    public static StatementNode continueStmt() {
        return of(StatementTag.CONTINUE, "continue");
    }

    public static StatementNode breakStmt(String target) {
        return new StatementNode(StatementTag.BREAK, "break " + target, "break " + target + ";", null, target);
    }

    public static StatementNode continueStmt(String target) {
        return new StatementNode(StatementTag.CONTINUE, "continue " + target, "continue " + target + ";", null, target);
    }

    public static StatementNode block(List<StatementNode> body) {
        return new StatementNode(StatementTag.BLOCK, "", "", Map.of(THEN, body));
    }

    public static StatementNode ifStmt(String condition, List<StatementNode> thenBlock) {
        return new StatementNode(StatementTag.IF, condition, "if (" + condition + ")", Map.of(THEN, thenBlock));
    }

    public static StatementNode ifElse(String condition, List<StatementNode> thenBlock,
                                       List<StatementNode> elseBlock) {
        Map<String, List<StatementNode>> blocks = new LinkedHashMap<>();
        blocks.put(THEN, thenBlock);
        blocks.put(ELSE, elseBlock);
        return new StatementNode(StatementTag.IF, condition, "if (" + condition + ")", blocks);
    }

    public static StatementNode elseIf(String condition, List<StatementNode> thenBlock) {
        return new StatementNode(StatementTag.ELSE_IF, condition, "else if (" + condition + ")",
                Map.of(THEN, thenBlock));
    }

    public static StatementNode elseStmt(List<StatementNode> body) {
        return new StatementNode(StatementTag.ELSE, "else", "else", Map.of(THEN, body));
    }

    public static StatementNode whileLoop(String condition, List<StatementNode> body) {
        return new StatementNode(StatementTag.WHILE_LOOP, condition, "while (" + condition + ")",
                Map.of(LOOP_BODY, body));
    }

    public static StatementNode doWhileLoop(String condition, List<StatementNode> body) {
        return new StatementNode(StatementTag.DO_WHILE_LOOP, condition, "do ... while (" + condition + ")",
                Map.of(LOOP_BODY, body));
    }

    public static StatementNode forLoop(String header, List<StatementNode> body) {
        return new StatementNode(StatementTag.FOR_LOOP, header, "for (" + header + ")",
                Map.of(LOOP_BODY, body));
    }

    public static StatementNode switchStmt(String selector, List<StatementNode> cases) {
        return new StatementNode(StatementTag.SWITCH, selector, "switch (" + selector + ")",
                Map.of(CASE_BODIES, cases));
    }

    public static StatementNode caseOf(String value, List<StatementNode> body) {
        return new StatementNode(StatementTag.CASE, value, "case " + value + ":", Map.of(THEN, body));
    }

    public static StatementNode defaultCase(List<StatementNode> body) {
        return new StatementNode(StatementTag.DEFAULT, "default", "default:", Map.of(THEN, body));
    }
}
