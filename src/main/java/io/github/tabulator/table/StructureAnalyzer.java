package io.github.tabulator.table;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Map;

/**
 * Read-only pre-pass that computes how many columns every compound path needs.
 *
 * <p>Every record of the input contributes to one shared path namespace: array indices never
 * appear in a path. The width of a compound path is the number of leaf paths below it across
 * all records, so a field present in only one record still reserves its column under the
 * parent in every record.</p>
 */
public class StructureAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(StructureAnalyzer.class);

    /**
     * Builds the path trie for {@code root} and annotates it with reserved widths.
     */
    public FieldTree analyze(JsonNode root) {
        PathNode rootNode = PathNode.root();
        if (root != null) {
            collect(root, rootNode);
        }
        int leaves = computeWidth(rootNode);
        LOG.debug("Analyzed input structure: {} leaf paths", leaves);
        return new FieldTree(rootNode);
    }

    private void collect(JsonNode value, PathNode node) {
        if (value.isObject()) {
            if (value.isEmpty()) {
                markLeaf(node);
                return;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                collect(field.getValue(), node.child(field.getKey()));
            }
        } else if (value.isArray()) {
            if (value.isEmpty()) {
                markLeaf(node);
                return;
            }
            for (JsonNode element : value) {
                collect(element, node);
            }
        } else {
            markLeaf(node);
        }
    }

    private static void markLeaf(PathNode node) {
        if (!node.isRoot()) {
            node.markLeaf();
        }
    }

    /**
     * Post-order: sets each node's width to its leaf-descendant count (minimum 1) and returns
     * the number of leaf paths strictly below {@code node}.
     */
    private static int computeWidth(PathNode node) {
        int below = 0;
        for (PathNode child : node.children()) {
            below += computeWidth(child);
            if (child.isLeaf()) {
                below++;
            }
        }
        node.width(below);
        return below;
    }
}
