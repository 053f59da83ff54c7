package document;

import java.util.ArrayList;
import java.util.List;

/**
 * Serialized form of one or more flow graphs, handed to the diagram renderer.
 * Field names are the JSON keys.
 */
public class FlowchartDocument {

    public static class NodeEntry {
        public String id;
        public String kind;
        public String label;
        public double x;
        public double y;
        // absent unless true
        public Boolean terminal;

        public NodeEntry() {
        }

        public NodeEntry(String id, String kind, String label, double x, double y, boolean terminal) {
            this.id = id;
            this.kind = kind;
            this.label = label;
            this.x = x;
            this.y = y;
            this.terminal = terminal ? Boolean.TRUE : null;
        }
    }

    public static class EdgeEntry {
        public String fromId;
        public String fromPort;
        public String toId;
        public String toPort;
        public String label;

        public EdgeEntry() {
        }

        public EdgeEntry(String fromId, String fromPort, String toId, String toPort, String label) {
            this.fromId = fromId;
            this.fromPort = fromPort;
            this.toId = toId;
            this.toPort = toPort;
            this.label = label;
        }
    }

    public List<NodeEntry> nodes = new ArrayList<>();
    public List<EdgeEntry> edges = new ArrayList<>();
}
