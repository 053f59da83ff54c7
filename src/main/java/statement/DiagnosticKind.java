package statement;

public enum DiagnosticKind {
    /** break or continue with no enclosing target */
    STRUCTURAL_ERROR,
    /** missing or misplaced child block, repaired by treating it as empty */
    MALFORMED_TREE,
    /** statements after a construct that never completes normally */
    UNREACHABLE_CODE
}
