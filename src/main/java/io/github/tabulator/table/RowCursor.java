package io.github.tabulator.table;

/**
 * Row position state of a {@link TableBuilder}.
 *
 * <p>{@code baseLine} is the row anchoring the current record (or sub-record),
 * {@code currentLine} is where the last value landed. A freshly anchored line has not received
 * a value yet, so the next value that does not share the base line lands on it instead of
 * advancing past it. {@code currentLine >= baseLine} always holds.</p>
 */
public final class RowCursor {

    private int baseLine;
    private int currentLine;
    private boolean fresh = true;
    private int highWater = -1;
    private int writes;
    private boolean newRecord;

    /**
     * Requests a new record: the next injected value starts a brand-new row.
     */
    void beginRecord() {
        newRecord = true;
    }

    boolean isNewRecordPending() {
        return newRecord;
    }

    /**
     * Consumes the pending new-record request, anchoring on {@code row}.
     */
    void startRecord(int row) {
        baseLine = row;
        currentLine = row;
        fresh = true;
        highWater = row - 1;
        newRecord = false;
    }

    /**
     * Re-anchors a sub-record on {@code row}. The row counts as used for high-water purposes.
     */
    void anchor(int row) {
        baseLine = row;
        currentLine = row;
        fresh = true;
        highWater = row;
    }

    /**
     * Picks the line for a value that does not share the base line.
     */
    int nextLine() {
        if (fresh) {
            fresh = false;
        } else {
            currentLine++;
        }
        return currentLine;
    }

    /**
     * Moves to the base line for a value that shares it.
     */
    int toBaseLine() {
        currentLine = baseLine;
        fresh = false;
        return currentLine;
    }

    /**
     * Stays on the current line for a value whose base-line cell is already taken.
     */
    int stay() {
        fresh = false;
        return currentLine;
    }

    void wrote(int row) {
        highWater = Math.max(highWater, row);
        writes++;
    }

    public int baseLine() {
        return baseLine;
    }

    public int currentLine() {
        return currentLine;
    }

    /**
     * Highest data row written since the last anchor.
     */
    public int highWater() {
        return highWater;
    }

    void highWater(int row) {
        this.highWater = row;
    }

    /**
     * Snapshot of the anchor, restored with {@link #restore(Mark)}.
     */
    public Mark mark() {
        return new Mark(baseLine, currentLine, fresh, highWater, writes);
    }

    /**
     * Returns to the anchor captured by {@code mark}. The high-water mark keeps the maximum of
     * both states; the current line is only rolled back when nothing was written in between.
     */
    public void restore(Mark mark) {
        baseLine = mark.baseLine();
        highWater = Math.max(highWater, mark.highWater());
        if (writes == mark.writes()) {
            currentLine = mark.currentLine();
            fresh = mark.fresh();
        } else if (currentLine < baseLine) {
            currentLine = baseLine;
        }
    }

    @Override
    public String toString() {
        return "RowCursor{base=" + baseLine + ", current=" + currentLine + ", fresh=" + fresh
                + ", highWater=" + highWater + ", newRecord=" + newRecord + '}';
    }

    /**
     * Saved cursor anchor.
     */
    public record Mark(int baseLine, int currentLine, boolean fresh, int highWater, int writes) {
    }
}
