package flowgraph;

public enum NodeKind {
    START("Start"),
    END("End"),
    PROCESS("Process"),
    IO("IO"),
    DECISION("Decision");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static NodeKind fromDisplayName(String name) {
        for (NodeKind kind : values()) {
            if (kind.displayName.equals(name)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + name);
    }
}
