package statement;

/**
 * Closed set of statement kinds a classifier can hand to the synthesizer.
 */
public enum StatementTag {
    BLOCK("Block"),
    INPUT("Input"),
    OUTPUT("Output"),
    IF("If"),
    ELSE_IF("ElseIf"),
    ELSE("Else"),
    SWITCH("Switch"),
    CASE("Case"),
    DEFAULT("Default"),
    FOR_LOOP("ForLoop"),
    WHILE_LOOP("WhileLoop"),
    DO_WHILE_LOOP("DoWhileLoop"),
    RETURN("Return"),
    BREAK("Break"),
    CONTINUE("Continue"),
    CALL("Call"),
    ASSIGNMENT("Assignment"),
    GENERIC("Generic");

    private final String displayName;

    StatementTag(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isLoop() {
        return this == FOR_LOOP || this == WHILE_LOOP || this == DO_WHILE_LOOP;
    }

    public boolean isSwitchLabel() {
        return this == CASE || this == DEFAULT;
    }

    /**
     * Looks up a tag by its display name ("ForLoop") or constant name ("FOR_LOOP").
     *
     * @return the tag, or null when the name is unknown
     */
    public static StatementTag fromName(String name) {
        if (name == null) {
            return null;
        }
        for (StatementTag tag : values()) {
            if (tag.displayName.equalsIgnoreCase(name) || tag.name().equalsIgnoreCase(name)) {
                return tag;
            }
        }
        return null;
    }
}
