package io.github.tabulator;

/**
 * Thrown under {@link io.github.tabulator.options.HeaderPlacementPolicy#FAIL} when a nested
 * path has to be placed but its parent path owns no header column.
 */
public class HeaderPlacementException extends TabulationException {

    private final String parentPath;

    public HeaderPlacementException(String fieldPath, String parentPath) {
        super(fieldPath, "Parent path not found: " + parentPath);
        this.parentPath = parentPath;
    }

    /**
     * Returns the parent path that could not be located in any header row.
     */
    public String getParentPath() {
        return parentPath;
    }
}
