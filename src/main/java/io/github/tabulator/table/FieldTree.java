package io.github.tabulator.table;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The union of all field paths found in an input, as a trie of {@link PathNode}s annotated with
 * reserved widths.
 */
public final class FieldTree {

    private final PathNode root;

    FieldTree(PathNode root) {
        this.root = root;
    }

    public PathNode root() {
        return root;
    }

    /**
     * Looks a node up by its segments, or returns null.
     */
    public PathNode find(String... segments) {
        PathNode node = root;
        for (String segment : segments) {
            node = node.findChild(segment);
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    /**
     * Reserved width of a path given by its segments; 1 for unknown paths.
     */
    public int width(String... segments) {
        PathNode node = find(segments);
        return node == null ? 1 : node.width();
    }

    /**
     * Dotted path to width for every compound path, in discovery order.
     */
    public Map<String, Integer> widths() {
        Map<String, Integer> result = new LinkedHashMap<>();
        collectWidths(root, result);
        return result;
    }

    private static void collectWidths(PathNode node, Map<String, Integer> result) {
        for (PathNode child : node.children()) {
            if (!child.children().isEmpty()) {
                result.put(child.path(), child.width());
                collectWidths(child, result);
            }
        }
    }
}
