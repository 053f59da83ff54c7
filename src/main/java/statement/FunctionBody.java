package statement;

import java.util.List;
import java.util.Objects;

/**
 * The classified statement list of one function, converted independently of
 * every other function.
 */
public final class FunctionBody {
    private final String name;
    private final List<StatementNode> statements;

    public FunctionBody(String name, List<StatementNode> statements) {
        this.name = Objects.requireNonNull(name, "name");
        this.statements = List.copyOf(statements);
    }

    public String getName() { return name; }
    public List<StatementNode> getStatements() { return statements; }

    @Override
    public String toString() {
        return name + " (" + statements.size() + " statements)";
    }
}
