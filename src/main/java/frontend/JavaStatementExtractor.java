package frontend;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import statement.FunctionBody;
import statement.StatementNode;
import statement.StatementTag;
import statement.StatementTreeException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Classifies the statements of Java methods into statement trees. Declarations
 * without an initializer are dropped, console reads become Input statements and
 * {@code System.out}/{@code System.err} prints become Output statements.
 */
public class JavaStatementExtractor {
    private static final Logger logger = LoggerFactory.getLogger(JavaStatementExtractor.class);

    private static final Set<String> INPUT_METHODS = Set.of(
            "readLine", "nextInt", "nextLine", "nextDouble", "nextLong", "nextFloat",
            "nextBoolean", "nextShort", "nextByte");
    private static final Set<String> OUTPUT_METHODS = Set.of("print", "println", "printf", "format");

    private final JavaParser parser;

    public JavaStatementExtractor() {
        ParserConfiguration config = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        this.parser = new JavaParser(config);
    }

    public List<FunctionBody> extract(Path sourcePath) throws IOException, StatementTreeException {
        return extract(Files.readString(sourcePath, StandardCharsets.UTF_8));
    }

    /**
     * @return one function per method or constructor with a body, in source order
     */
    public List<FunctionBody> extract(String source) throws StatementTreeException {
        ParseResult<CompilationUnit> result = parser.parse(source);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String problems = result.getProblems().stream()
                    .map(problem -> problem.getVerboseMessage())
                    .collect(Collectors.joining("; "));
            throw new StatementTreeException("Source does not parse: " + problems);
        }
        CompilationUnit cu = result.getResult().get();

        List<FunctionBody> functions = new ArrayList<>();
        for (CallableDeclaration<?> callable : cu.findAll(CallableDeclaration.class)) {
            Optional<BlockStmt> body = bodyOf(callable);
            if (body.isEmpty()) {
                continue;
            }
            String name = callable.getNameAsString();
            functions.add(new FunctionBody(name, convertBlock(body.get())));
            logger.debug("Extracted method {}", name);
        }
        return functions;
    }

    private static Optional<BlockStmt> bodyOf(CallableDeclaration<?> callable) {
        if (callable instanceof MethodDeclaration) {
            return ((MethodDeclaration) callable).getBody();
        }
        if (callable instanceof ConstructorDeclaration) {
            return Optional.of(((ConstructorDeclaration) callable).getBody());
        }
        return Optional.empty();
    }

    private List<StatementNode> convertBlock(BlockStmt block) {
        List<StatementNode> result = new ArrayList<>();
        for (Statement stmt : block.getStatements()) {
            convert(stmt, result);
        }
        return result;
    }

    // a braced body is the block itself, not a block nested in it
    private List<StatementNode> convertBody(Statement stmt) {
        if (stmt.isBlockStmt()) {
            return convertBlock(stmt.asBlockStmt());
        }
        List<StatementNode> result = new ArrayList<>();
        convert(stmt, result);
        return result;
    }

    private void convert(Statement stmt, List<StatementNode> out) {
        if (stmt.isBlockStmt()) {
            out.add(StatementNode.block(convertBlock(stmt.asBlockStmt())));
        } else if (stmt.isIfStmt()) {
            out.add(convertIf(stmt.asIfStmt()));
        } else if (stmt.isWhileStmt()) {
            WhileStmt whileStmt = stmt.asWhileStmt();
            out.add(loop(StatementTag.WHILE_LOOP, whileStmt.getCondition().toString(),
                    "while (" + whileStmt.getCondition() + ")", convertBody(whileStmt.getBody())));
        } else if (stmt.isForStmt()) {
            out.add(convertFor(stmt.asForStmt()));
        } else if (stmt.isForEachStmt()) {
            ForEachStmt forEach = stmt.asForEachStmt();
            String header = forEach.getVariable() + " : " + forEach.getIterable();
            out.add(loop(StatementTag.FOR_LOOP, header, "for (" + header + ")", convertBody(forEach.getBody())));
        } else if (stmt.isDoStmt()) {
            DoStmt doStmt = stmt.asDoStmt();
            out.add(loop(StatementTag.DO_WHILE_LOOP, doStmt.getCondition().toString(),
                    "do ... while (" + doStmt.getCondition() + ")", convertBody(doStmt.getBody())));
        } else if (stmt.isSwitchStmt()) {
            out.add(convertSwitch(stmt.asSwitchStmt()));
        } else if (stmt.isReturnStmt()) {
            out.add(leaf(StatementTag.RETURN, stmt.asReturnStmt().getExpression()
                    .map(expr -> "return " + expr).orElse("return"), stmt));
        } else if (stmt.isThrowStmt()) {
            out.add(leaf(StatementTag.RETURN, "throw " + stmt.asThrowStmt().getExpression(), stmt));
        } else if (stmt.isBreakStmt()) {
            out.add(jump(StatementTag.BREAK, "break", stmt.asBreakStmt().getLabel(), stmt));
        } else if (stmt.isContinueStmt()) {
            out.add(jump(StatementTag.CONTINUE, "continue", stmt.asContinueStmt().getLabel(), stmt));
        } else if (stmt.isTryStmt()) {
            TryStmt tryStmt = stmt.asTryStmt();
            out.add(StatementNode.block(convertBlock(tryStmt.getTryBlock())));
            tryStmt.getFinallyBlock().ifPresent(block -> out.add(StatementNode.block(convertBlock(block))));
        } else if (stmt.isLabeledStmt()) {
            convertLabeled(stmt.asLabeledStmt(), out);
        } else if (stmt.isSynchronizedStmt()) {
            out.add(StatementNode.block(convertBlock(stmt.asSynchronizedStmt().getBody())));
        } else if (stmt.isExpressionStmt()) {
            StatementNode node = convertExpression(stmt.asExpressionStmt());
            if (node != null) {
                out.add(node);
            }
        } else if (stmt.isEmptyStmt() || stmt.isLocalClassDeclarationStmt() || stmt.isLocalRecordDeclarationStmt()) {
            logger.trace("Skipping {}", stmt.getClass().getSimpleName());
        } else {
            out.add(leaf(StatementTag.GENERIC, stripSemicolon(stmt.toString()), stmt));
        }
    }

    /**
     * Only loops and switches keep their label. A label on any other statement is
     * dropped, so a jump naming it is later reported as a structural error.
     */
    private void convertLabeled(LabeledStmt labeled, List<StatementNode> out) {
        String label = labeled.getLabel().asString();
        List<StatementNode> inner = new ArrayList<>();
        convert(labeled.getStatement(), inner);
        for (StatementNode node : inner) {
            boolean target = node.getTag().isLoop() || node.getTag() == StatementTag.SWITCH;
            out.add(target ? node.withJumpLabel(label) : node);
        }
    }

    private StatementNode convertIf(IfStmt ifStmt) {
        Map<String, List<StatementNode>> blocks = new LinkedHashMap<>();
        blocks.put(StatementNode.THEN, convertBody(ifStmt.getThenStmt()));
        ifStmt.getElseStmt().ifPresent(elseStmt -> blocks.put(StatementNode.ELSE, convertBody(elseStmt)));
        String condition = ifStmt.getCondition().toString();
        return new StatementNode(StatementTag.IF, condition, "if (" + condition + ")", blocks);
    }

    private StatementNode convertFor(ForStmt forStmt) {
        String init = forStmt.getInitialization().stream().map(Object::toString).collect(Collectors.joining(", "));
        String compare = forStmt.getCompare().map(Object::toString).orElse("true");
        String update = forStmt.getUpdate().stream().map(Object::toString).collect(Collectors.joining(", "));
        String header = init + "; " + compare + "; " + update;
        return loop(StatementTag.FOR_LOOP, header, "for (" + header + ")", convertBody(forStmt.getBody()));
    }

    /**
     * Arrow entries never fall through, so they get an explicit break; an entry with
     * several labels becomes one empty case per extra label.
     */
    private StatementNode convertSwitch(SwitchStmt switchStmt) {
        List<StatementNode> cases = new ArrayList<>();
        for (SwitchEntry entry : switchStmt.getEntries()) {
            List<StatementNode> body = new ArrayList<>();
            for (Statement stmt : entry.getStatements()) {
                convert(stmt, body);
            }
            if (entry.getType() != SwitchEntry.Type.STATEMENT_GROUP) {
                body.add(StatementNode.breakStmt());
            }
            if (entry.getLabels().isEmpty()) {
                cases.add(StatementNode.defaultCase(body));
                continue;
            }
            List<Expression> labels = entry.getLabels();
            for (int i = 0; i < labels.size(); i++) {
                boolean lastLabel = i == labels.size() - 1;
                cases.add(StatementNode.caseOf(labels.get(i).toString(), lastLabel ? body : List.of()));
            }
        }
        String selector = switchStmt.getSelector().toString();
        return new StatementNode(StatementTag.SWITCH, selector, "switch (" + selector + ")",
                Map.of(StatementNode.CASE_BODIES, cases));
    }

    private StatementNode convertExpression(ExpressionStmt stmt) {
        Expression expr = stmt.getExpression();
        if (expr.isVariableDeclarationExpr()
                && expr.asVariableDeclarationExpr().getVariables().stream().noneMatch(v -> v.getInitializer().isPresent())) {
            return null;
        }

        List<MethodCallExpr> calls = expr.findAll(MethodCallExpr.class);
        if (calls.stream().anyMatch(JavaStatementExtractor::isInputCall)) {
            return leaf(StatementTag.INPUT, "input " + assignedNames(expr), stmt);
        }
        if (expr.isMethodCallExpr() && isOutputCall(expr.asMethodCallExpr())) {
            String arguments = expr.asMethodCallExpr().getArguments().stream()
                    .map(Object::toString).collect(Collectors.joining(", "));
            return leaf(StatementTag.OUTPUT, "output " + arguments, stmt);
        }
        if (expr.isVariableDeclarationExpr()) {
            return leaf(StatementTag.ASSIGNMENT, expr.asVariableDeclarationExpr().getVariables().stream()
                    .filter(v -> v.getInitializer().isPresent())
                    .map(v -> v.getNameAsString() + " = " + v.getInitializer().get())
                    .collect(Collectors.joining(", ")), stmt);
        }
        if (expr.isAssignExpr() || expr.isUnaryExpr()) {
            return leaf(StatementTag.ASSIGNMENT, expr.toString(), stmt);
        }
        if (expr.isMethodCallExpr()) {
            return leaf(StatementTag.CALL, expr.toString(), stmt);
        }
        return leaf(StatementTag.GENERIC, expr.toString(), stmt);
    }

    static boolean isInputCall(MethodCallExpr call) {
        String name = call.getNameAsString();
        if (INPUT_METHODS.contains(name)) {
            return true;
        }
        if ((name.equals("read") || name.equals("next")) && call.getScope().isPresent()) {
            String scope = call.getScope().get().toString().toLowerCase(Locale.ROOT);
            return scope.equals("system.in") || scope.contains("scanner") || scope.contains("reader")
                    || scope.equals("in") || scope.equals("sc");
        }
        return false;
    }

    static boolean isOutputCall(MethodCallExpr call) {
        if (!OUTPUT_METHODS.contains(call.getNameAsString()) || call.getScope().isEmpty()) {
            return false;
        }
        String scope = call.getScope().get().toString();
        return scope.equals("System.out") || scope.equals("System.err");
    }

    private static String assignedNames(Expression expr) {
        if (expr.isVariableDeclarationExpr()) {
            return expr.asVariableDeclarationExpr().getVariables().stream()
                    .map(v -> v.getNameAsString()).collect(Collectors.joining(", "));
        }
        if (expr.isAssignExpr()) {
            return expr.asAssignExpr().getTarget().toString();
        }
        return expr.toString();
    }

    private static StatementNode loop(StatementTag tag, String label, String sourceText, List<StatementNode> body) {
        return new StatementNode(tag, label, sourceText, Map.of(StatementNode.LOOP_BODY, body));
    }

    private static StatementNode jump(StatementTag tag, String keyword, Optional<SimpleName> target, Statement source) {
        if (target.isEmpty()) {
            return leaf(tag, keyword, source);
        }
        String name = target.get().asString();
        return new StatementNode(tag, keyword + " " + name, source.toString(), null, name);
    }

    private static StatementNode leaf(StatementTag tag, String label, Statement source) {
        return new StatementNode(tag, label, source.toString(), null);
    }

    private static String stripSemicolon(String text) {
        String trimmed = text.trim();
        return trimmed.endsWith(";") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
