package io.github.tabulator.options;

/**
 * What to do when a nested path must be placed but its parent path owns no header column.
 */
public enum HeaderPlacementPolicy {
    /** Append the path as a new column at the end of the current header row */
    APPEND_TO_ROW,
    /** Throw a {@link io.github.tabulator.HeaderPlacementException} */
    FAIL
}
