package io.github.tabulator.table;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.tabulator.options.ConversionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Recursive traversal of a value tree that populates a {@link TableBuilder}.
 *
 * <p>Depth 0 is the top-level array whose elements are the records, depth 1 is a record.
 * Objects deeper than a record open a child header level. Array elements below the record
 * level are laid out as sub-records: the first element shares the enclosing row, each further
 * element starts on the row after everything the previous elements of that array wrote.</p>
 */
public class TreeWalker {

    private static final Logger LOG = LoggerFactory.getLogger(TreeWalker.class);

    private final TableBuilder builder;
    private final FieldTree tree;

    public TreeWalker(TableBuilder builder, FieldTree tree) {
        this.builder = builder;
        this.tree = tree;
    }

    /**
     * Walks a whole document. The document is expected to be the array of records.
     */
    public void walk(JsonNode document) {
        walk(document, tree.root(), false, 0);
    }

    void walk(JsonNode value, PathNode node, boolean sameLine, int depth) {
        switch (value.getNodeType()) {
            case OBJECT:
                if (depth == 1 && countNonEmptyArrays(value) > 1) {
                    walkParallelArrays(value, node, sameLine, depth);
                } else {
                    walkObject(value, node, sameLine, depth);
                }
                break;
            case ARRAY:
                if (!node.isRoot()) {
                    builder.getOrCreateHeader(node);
                }
                walkArray(value, node, sameLine, depth);
                break;
            default:
                walkScalar(value, node, sameLine);
                break;
        }
    }

    private void walkObject(JsonNode object, PathNode node, boolean sameLine, int depth) {
        if (!node.isRoot()) {
            builder.getOrCreateHeader(node);
        }
        boolean nested = depth > 1;
        if (nested) {
            builder.enterChildHeaderLevel();
        }
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            walk(field.getValue(), node.child(field.getKey()), sameLine, depth + 1);
            sameLine = true;
        }
        if (nested) {
            builder.exitChildHeaderLevel();
        }
    }

    private void walkArray(JsonNode array, PathNode node, boolean sameLine, int depth) {
        if (depth == 0) {
            for (JsonNode record : array) {
                builder.beginRecord();
                walk(record, node, false, 1);
            }
            return;
        }
        walkElements(array, node, depth);
    }

    /**
     * Lays out the elements of a nested array as stacked sub-records from the current base line
     * and returns the rows each element occupied.
     */
    private List<RowSpan> walkElements(JsonNode array, PathNode node, int depth) {
        List<RowSpan> spans = new ArrayList<>(array.size());
        if (array.isEmpty()) {
            return spans;
        }
        RowCursor cursor = builder.cursor();
        int anchorRow = builder.ensureRecordRow();
        RowCursor.Mark outer = cursor.mark();
        cursor.highWater(anchorRow);

        int start = anchorRow;
        for (int i = 0; i < array.size(); i++) {
            if (i > 0) {
                start = cursor.highWater() + 1;
                cursor.anchor(start);
            }
            walk(array.get(i), node, i == 0, depth + 1);
            spans.add(new RowSpan(start, cursor.highWater() + 1));
        }
        cursor.restore(outer);
        return spans;
    }

    private void walkScalar(JsonNode value, PathNode node, boolean sameLine) {
        int column = builder.getOrCreateHeader(node);
        String rendered = render(value);
        builder.inject(column, sameLine, rendered);
        if (LOG.isTraceEnabled()) {
            LOG.trace("Injected {} -> {}\n{}", node.path(), rendered,
                    new TableRenderer(ConversionOptions.fixedWidth()).render(builder));
        }
    }

    /**
     * Booleans render as {@code true}/{@code false}, null as {@code null}, everything else in its
     * natural text form.
     */
    static String render(JsonNode value) {
        if (value.isBoolean()) {
            return value.booleanValue() ? "true" : "false";
        }
        if (value.isNull()) {
            return "null";
        }
        return value.asText();
    }

    // ==================== Records with several arrays ====================

    /**
     * A record with more than one non-empty array. Scalar and object fields are written first;
     * then complex arrays (elements are objects or arrays) are stacked as sub-records and
     * primitive arrays fill one row per value from the record row. When all arrays are of the
     * same kind they are walked index by index, element {@code i} of every array sharing a row.
     */
    private void walkParallelArrays(JsonNode record, PathNode node, boolean sameLine, int depth) {
        List<String> keys = new ArrayList<>();
        record.fieldNames().forEachRemaining(keys::add);

        // Columns follow document order regardless of the order fields are walked in.
        for (String key : keys) {
            builder.getOrCreateHeader(node.child(key));
        }

        List<String> complex = new ArrayList<>();
        List<String> primitive = new ArrayList<>();
        for (String key : keys) {
            JsonNode value = record.get(key);
            if (value.isArray() && !value.isEmpty()) {
                JsonNode first = value.get(0);
                if (first.isContainerNode()) {
                    complex.add(key);
                } else {
                    primitive.add(key);
                }
            } else {
                walk(value, node.child(key), sameLine, depth + 1);
                sameLine = true;
            }
        }

        int recordRow = builder.ensureRecordRow();
        RowCursor.Mark recordMark = builder.cursor().mark();

        if (!complex.isEmpty() && !primitive.isEmpty()) {
            for (String key : complex) {
                List<RowSpan> spans = walkElements(record.get(key), node.child(key), depth + 1);
                LOG.trace("Array '{}' occupies rows {}", key, spans);
            }
            for (String key : primitive) {
                walkElements(record.get(key), node.child(key), depth + 1);
            }
        } else {
            List<String> arrays = complex.isEmpty() ? primitive : complex;
            walkIndexSynchronous(record, node, arrays, recordRow, depth);
        }
        builder.cursor().restore(recordMark);
    }

    private void walkIndexSynchronous(JsonNode record, PathNode node, List<String> arrays,
                                      int recordRow, int depth) {
        int longest = 0;
        for (String key : arrays) {
            longest = Math.max(longest, record.get(key).size());
        }
        RowCursor cursor = builder.cursor();
        int start = recordRow;
        for (int i = 0; i < longest; i++) {
            cursor.anchor(start);
            for (String key : arrays) {
                JsonNode array = record.get(key);
                if (i < array.size()) {
                    PathNode child = node.child(key);
                    walk(array.get(i), child, true, depth + 2);
                }
            }
            start = cursor.highWater() + 1;
        }
    }

    private static int countNonEmptyArrays(JsonNode object) {
        int count = 0;
        for (JsonNode value : object) {
            if (value.isArray() && !value.isEmpty()) {
                count++;
            }
        }
        return count;
    }
}
