package layout;

import java.util.*;

/**
 * Node positions of one graph plus the horizontal extent they cover.
 */
public final class Layout {
    private final Map<Integer, Position> positions;
    private final double width;

    public Layout(Map<Integer, Position> positions, double width) {
        this.positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
        this.width = width;
    }

    public Map<Integer, Position> getPositions() { return positions; }

    public Optional<Position> positionOf(int nodeId) {
        return Optional.ofNullable(positions.get(nodeId));
    }

    /** Horizontal space occupied, used to place the next function beside this one. */
    public double getWidth() { return width; }
}
