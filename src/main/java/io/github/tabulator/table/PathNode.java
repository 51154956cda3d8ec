package io.github.tabulator.table;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One segment of a field path.
 *
 * <p>Nodes form a trie keyed by field name. Array elements share their array's node, so every
 * record contributes to the same namespace. A node carries the reserved width computed by
 * {@link StructureAnalyzer} and, once placed, the header row and column it owns.</p>
 */
public final class PathNode {

    static final int UNPLACED = -1;

    private final String key;
    private final PathNode parent;
    private final Map<String, PathNode> children = new LinkedHashMap<>();

    private boolean leaf;
    private int width = 1;
    private int headerRow = UNPLACED;
    private int column = UNPLACED;

    private PathNode(String key, PathNode parent) {
        this.key = key;
        this.parent = parent;
    }

    static PathNode root() {
        return new PathNode("", null);
    }

    /**
     * Returns the child with the given key, creating it on first use.
     */
    PathNode child(String childKey) {
        return children.computeIfAbsent(childKey, k -> new PathNode(k, this));
    }

    public String key() {
        return key;
    }

    public PathNode parent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public Collection<PathNode> children() {
        return Collections.unmodifiableCollection(children.values());
    }

    public PathNode findChild(String childKey) {
        return children.get(childKey);
    }

    /**
     * True when some record holds a scalar (or an empty container) at this path.
     */
    public boolean isLeaf() {
        return leaf;
    }

    void markLeaf() {
        this.leaf = true;
    }

    /**
     * Number of columns this path occupies; at least 1.
     */
    public int width() {
        return width;
    }

    void width(int width) {
        this.width = Math.max(1, width);
    }

    public boolean isPlaced() {
        return column != UNPLACED;
    }

    public int column() {
        return column;
    }

    public int headerRow() {
        return headerRow;
    }

    void place(int row, int col) {
        this.headerRow = row;
        this.column = col;
    }

    /**
     * True when {@code col} falls inside {@code [column, column + width)}.
     */
    boolean covers(int col) {
        return isPlaced() && col >= column && col < column + width;
    }

    /**
     * Dotted path from the root, e.g. {@code arrayField.name}. The root is the empty string.
     */
    public String path() {
        return pathFrom(null);
    }

    /**
     * Dotted path relative to an ancestor (exclusive). A null ancestor means the root.
     */
    public String pathFrom(PathNode ancestor) {
        Deque<String> segments = new ArrayDeque<>();
        PathNode node = this;
        while (node != null && !node.isRoot() && node != ancestor) {
            segments.push(node.key);
            node = node.parent;
        }
        return String.join(".", segments);
    }

    @Override
    public String toString() {
        return path() + (isPlaced() ? "@" + headerRow + ":" + column : "") + "[" + width + "]";
    }
}
