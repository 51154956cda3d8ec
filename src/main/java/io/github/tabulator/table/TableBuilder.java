package io.github.tabulator.table;

import io.github.tabulator.HeaderPlacementException;
import io.github.tabulator.options.HeaderPlacementPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The mutable grid of one conversion: a header region of one or more rows holding column labels
 * and a data region holding cell values.
 *
 * <p>Columns are only ever appended, and every row is padded lazily to {@link #columnCount()},
 * so inserting a column or a row never moves an existing cell. Header rows and data rows are
 * indexed independently.</p>
 *
 * <p>Not thread-safe; create one per conversion.</p>
 */
public class TableBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(TableBuilder.class);

    private final HeaderPlacementPolicy placementPolicy;
    private final List<List<HeaderCell>> headerRows = new ArrayList<>();
    private final List<List<String>> dataRows = new ArrayList<>();
    private final RowCursor cursor = new RowCursor();

    private int columnCount;
    private int currentHeaderLevel;

    public TableBuilder() {
        this(HeaderPlacementPolicy.APPEND_TO_ROW);
    }

    public TableBuilder(HeaderPlacementPolicy placementPolicy) {
        this.placementPolicy = placementPolicy;
        this.headerRows.add(new ArrayList<>());
    }

    // ==================== Header placement ====================

    /**
     * Returns the column owned by {@code node}, placing it in the current header row first if
     * it has no column yet.
     *
     * <p>At the top level the path reserves {@code width} contiguous columns at the end of the
     * grid. A nested path takes the first slot of its parent's span not covered by a sibling
     * already placed; a full span appends at the end of the row instead.</p>
     *
     * @throws HeaderPlacementException if the parent owns no column and the policy is FAIL
     */
    public int getOrCreateHeader(PathNode node) {
        if (node.isPlaced()) {
            return node.column();
        }
        if (node.isRoot()) {
            return placeAtEnd(node, 1);
        }
        if (currentHeaderLevel == 0) {
            return placeAtEnd(node, node.width());
        }

        PathNode parent = node.parent();
        if (parent.isRoot() || !parent.isPlaced() || parent.headerRow() > currentHeaderLevel) {
            if (placementPolicy == HeaderPlacementPolicy.FAIL) {
                throw new HeaderPlacementException(node.path(), parent.path());
            }
            LOG.debug("No column for parent '{}' of '{}', appending at end of header row {}",
                    parent.path(), node.path(), currentHeaderLevel);
            return placeAtEnd(node, node.width());
        }

        int spanEnd = parent.column() + parent.width();
        int slot = firstFreeSlot(parent, parent.column(), spanEnd);
        if (slot < 0) {
            LOG.debug("Span of '{}' is full, appending '{}' at end of header row {}",
                    parent.path(), node.path(), currentHeaderLevel);
            return placeAtEnd(node, node.width());
        }
        ensureColumns(slot + 1);
        place(node, slot);
        return slot;
    }

    /**
     * Scans {@code [from, to)} for a column not covered by any placed sibling and not already
     * labelled in the current header row. Returns -1 when the span is full.
     */
    private int firstFreeSlot(PathNode parent, int from, int to) {
        int slot = from;
        while (slot < to) {
            int skipTo = slot;
            for (PathNode sibling : parent.children()) {
                if (sibling.covers(slot)) {
                    skipTo = sibling.column() + sibling.width();
                    break;
                }
            }
            if (skipTo == slot && headerCell(currentHeaderLevel, slot) != null) {
                skipTo = slot + 1;
            }
            if (skipTo == slot) {
                return slot;
            }
            slot = skipTo;
        }
        return -1;
    }

    private int placeAtEnd(PathNode node, int width) {
        int col = columnCount;
        columnCount += width;
        place(node, col);
        return col;
    }

    private void place(PathNode node, int col) {
        while (headerRows.size() <= currentHeaderLevel) {
            headerRows.add(new ArrayList<>());
        }
        List<HeaderCell> row = headerRows.get(currentHeaderLevel);
        padTo(row, col + 1);
        row.set(col, new HeaderCell(node));
        node.place(currentHeaderLevel, col);
    }

    private void ensureColumns(int count) {
        columnCount = Math.max(columnCount, count);
    }

    /**
     * Moves header resolution one level down. The header row itself is added once a label is
     * placed in it.
     */
    public void enterChildHeaderLevel() {
        currentHeaderLevel++;
    }

    public void exitChildHeaderLevel() {
        currentHeaderLevel = Math.max(0, currentHeaderLevel - 1);
    }

    public int currentHeaderLevel() {
        return currentHeaderLevel;
    }

    /**
     * Relabels every header cell relative to its nearest ancestor labelled in a row above, so
     * nested headers show only their own segment.
     */
    public void deduplicateHeaders() {
        for (int y = 0; y < headerRows.size(); y++) {
            for (HeaderCell cell : headerRows.get(y)) {
                if (cell == null) {
                    continue;
                }
                PathNode ancestor = cell.node.parent();
                while (ancestor != null && !ancestor.isRoot()
                        && !(ancestor.isPlaced() && ancestor.headerRow() < y)) {
                    ancestor = ancestor.parent();
                }
                if (ancestor != null && !ancestor.isRoot()) {
                    cell.label = cell.node.pathFrom(ancestor);
                }
            }
        }
    }

    // ==================== Data injection ====================

    /**
     * The next injected value starts a new record row.
     */
    public void beginRecord() {
        cursor.beginRecord();
    }

    /**
     * Writes {@code value} into {@code column}. A {@code sameLine} value goes to the record's base
     * line if that cell is still blank, otherwise it stays on the current line; any other value
     * moves on to the next line.
     */
    public void inject(int column, boolean sameLine, String value) {
        consumeNewRecord();
        int row;
        if (sameLine) {
            ensureRow(cursor.baseLine());
            row = cell(cursor.baseLine(), column) == null ? cursor.toBaseLine() : cursor.stay();
        } else {
            row = cursor.nextLine();
        }
        ensureRow(row);
        List<String> cells = dataRows.get(row);
        padTo(cells, column + 1);
        cells.set(column, value);
        ensureColumns(column + 1);
        cursor.wrote(row);
    }

    /**
     * Opens the pending record row if any and returns the current base line.
     */
    public int ensureRecordRow() {
        consumeNewRecord();
        ensureRow(cursor.baseLine());
        return cursor.baseLine();
    }

    private void consumeNewRecord() {
        if (cursor.isNewRecordPending()) {
            cursor.startRecord(dataRows.size());
        }
    }

    private void ensureRow(int row) {
        while (dataRows.size() <= row) {
            dataRows.add(new ArrayList<>());
        }
    }

    public RowCursor cursor() {
        return cursor;
    }

    // ==================== Read access ====================

    public int headerRowCount() {
        return headerRows.size();
    }

    public int dataRowCount() {
        return dataRows.size();
    }

    public int columnCount() {
        return columnCount;
    }

    /**
     * Header label at {@code (row, col)}, or null for a blank cell.
     */
    public String headerLabel(int row, int col) {
        HeaderCell cell = headerCell(row, col);
        return cell == null ? null : cell.label;
    }

    private HeaderCell headerCell(int row, int col) {
        if (row >= headerRows.size()) {
            return null;
        }
        List<HeaderCell> cells = headerRows.get(row);
        return col < cells.size() ? cells.get(col) : null;
    }

    /**
     * Data value at {@code (row, col)}, or null for a blank cell.
     */
    public String cell(int row, int col) {
        if (row >= dataRows.size()) {
            return null;
        }
        List<String> cells = dataRows.get(row);
        return col < cells.size() ? cells.get(col) : null;
    }

    /**
     * Every row, header rows first, each exactly {@link #columnCount()} cells wide.
     */
    public List<String[]> rows() {
        List<String[]> result = new ArrayList<>(headerRows.size() + dataRows.size());
        for (int y = 0; y < headerRows.size(); y++) {
            String[] row = new String[columnCount];
            for (int x = 0; x < columnCount; x++) {
                row[x] = headerLabel(y, x);
            }
            result.add(row);
        }
        for (int y = 0; y < dataRows.size(); y++) {
            String[] row = new String[columnCount];
            for (int x = 0; x < columnCount; x++) {
                row[x] = cell(y, x);
            }
            result.add(row);
        }
        return result;
    }

    private static <T> void padTo(List<T> row, int size) {
        while (row.size() < size) {
            row.add(null);
        }
    }

    private static final class HeaderCell {
        private final PathNode node;
        private String label;

        private HeaderCell(PathNode node) {
            this.node = node;
            this.label = node.path();
        }
    }
}
