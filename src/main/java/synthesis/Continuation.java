package synthesis;

/**
 * What executes next once a construct finishes normally. Resolving a
 * continuation yields a node id and may create that node on first use: a
 * statement's head node, or the synthetic end node.
 */
@FunctionalInterface
public interface Continuation {

    int resolve();

    static Continuation node(int id) {
        return () -> id;
    }
}
