package io.github.tabulator.table;

/**
 * Half-open range of data rows {@code [start, end)} occupied by one array element.
 */
public record RowSpan(int start, int end) {

    public int size() {
        return end - start;
    }

    @Override
    public String toString() {
        return "[" + start + "-" + end + ")";
    }
}
