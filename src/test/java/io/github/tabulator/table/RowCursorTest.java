package io.github.tabulator.table;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RowCursorTest {

    @Test
    @DisplayName("first value after an anchor lands on the anchored row")
    void freshLineIsUsedFirst() {
        RowCursor cursor = new RowCursor();
        cursor.startRecord(4);

        assertThat(cursor.nextLine()).isEqualTo(4);
        assertThat(cursor.nextLine()).isEqualTo(5);
        assertThat(cursor.baseLine()).isEqualTo(4);
    }

    @Test
    @DisplayName("beginRecord is pending until a record is started")
    void pendingRecord() {
        RowCursor cursor = new RowCursor();
        cursor.beginRecord();
        assertThat(cursor.isNewRecordPending()).isTrue();

        cursor.startRecord(0);
        assertThat(cursor.isNewRecordPending()).isFalse();
        assertThat(cursor.highWater()).isEqualTo(-1);
    }

    @Test
    @DisplayName("toBaseLine moves back to the anchor")
    void toBaseLine() {
        RowCursor cursor = new RowCursor();
        cursor.startRecord(2);
        cursor.nextLine();
        cursor.nextLine();

        assertThat(cursor.currentLine()).isEqualTo(3);
        assertThat(cursor.toBaseLine()).isEqualTo(2);
        assertThat(cursor.stay()).isEqualTo(2);
    }

    @Test
    @DisplayName("restore without writes rolls the current line back")
    void restoreWithoutWrites() {
        RowCursor cursor = new RowCursor();
        cursor.startRecord(0);
        RowCursor.Mark mark = cursor.mark();

        cursor.anchor(7);
        cursor.restore(mark);

        assertThat(cursor.baseLine()).isZero();
        assertThat(cursor.currentLine()).isZero();
        assertThat(cursor.nextLine()).isZero();
        assertThat(cursor.highWater()).isEqualTo(7);
    }

    @Test
    @DisplayName("restore after writes keeps the current line and the high-water mark")
    void restoreAfterWrites() {
        RowCursor cursor = new RowCursor();
        cursor.startRecord(0);
        cursor.wrote(cursor.nextLine());
        RowCursor.Mark mark = cursor.mark();

        cursor.anchor(3);
        cursor.wrote(cursor.nextLine());
        cursor.restore(mark);

        assertThat(cursor.baseLine()).isZero();
        assertThat(cursor.currentLine()).isEqualTo(3);
        assertThat(cursor.highWater()).isEqualTo(3);
        assertThat(cursor.nextLine()).isEqualTo(4);
    }
}
