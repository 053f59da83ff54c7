package synthesis;

/**
 * Display text of the synthetic nodes and of decision edges.
 */
public final class FlowLabels {

    public static final FlowLabels DEFAULT =
            new FlowLabels("Start", "End", "yes", "no", "default");

    private final String start;
    private final String end;
    private final String trueLabel;
    private final String falseLabel;
    private final String defaultLabel;

    public FlowLabels(String start, String end, String trueLabel, String falseLabel, String defaultLabel) {
        this.start = start;
        this.end = end;
        this.trueLabel = trueLabel;
        this.falseLabel = falseLabel;
        this.defaultLabel = defaultLabel;
    }

    public String getStart() { return start; }
    public String getEnd() { return end; }
    public String getTrueLabel() { return trueLabel; }
    public String getFalseLabel() { return falseLabel; }
    public String getDefaultLabel() { return defaultLabel; }
}
