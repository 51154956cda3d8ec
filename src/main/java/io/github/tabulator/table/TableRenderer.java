package io.github.tabulator.table;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;
import io.github.tabulator.options.ConversionOptions;
import io.github.tabulator.options.LiteralReplacement;

import java.util.List;

/**
 * Renders a finished {@link TableBuilder} as text.
 *
 * <p>Each cell goes through the literal replacements, is wrapped in the cell delimiters when it
 * contains an escape trigger character, and is optionally right-padded to the widest rendered
 * cell of its column. Every line, the last one included, ends with the line terminator.</p>
 */
public class TableRenderer {

    private final ConversionOptions options;
    private final CharMatcher escapeTriggers;

    public TableRenderer(ConversionOptions options) {
        this.options = options;
        String triggers = options.getEscapeTriggerChars();
        this.escapeTriggers = triggers == null ? CharMatcher.none() : CharMatcher.anyOf(triggers);
    }

    public String render(TableBuilder table) {
        int columns = table.columnCount();
        if (columns == 0) {
            return "";
        }
        List<String[]> rows = table.rows();
        String[][] rendered = new String[rows.size()][];
        int[] widths = new int[columns];
        for (int y = 0; y < rows.size(); y++) {
            String[] source = rows.get(y);
            String[] cells = new String[columns];
            for (int x = 0; x < columns; x++) {
                cells[x] = renderCell(source[x]);
                widths[x] = Math.max(widths[x], cells[x].length());
            }
            rendered[y] = cells;
        }

        String delimiter = options.getColumnDelimiter();
        String terminator = options.getLineTerminator();
        StringBuilder sb = new StringBuilder();
        int separatorPos = 0;
        int maxLineLength = 0;
        for (int y = 0; y < rendered.length; y++) {
            int lineStart = sb.length();
            String[] cells = rendered[y];
            for (int x = 0; x < columns; x++) {
                if (x > 0) {
                    sb.append(delimiter);
                }
                sb.append(options.isPadCellsToColumnWidth()
                        ? Strings.padEnd(cells[x], widths[x], ' ')
                        : cells[x]);
            }
            maxLineLength = Math.max(maxLineLength, sb.length() - lineStart);
            sb.append(terminator);
            if (y == table.headerRowCount() - 1) {
                separatorPos = sb.length();
            }
        }

        String separator = options.getHeaderSeparator();
        if (separator != null) {
            String line = Strings.repeat(separator, maxLineLength).substring(0, maxLineLength);
            sb.insert(separatorPos, line + terminator);
        }
        return sb.toString();
    }

    /**
     * Renders one cell without padding. A blank cell renders as the empty string.
     */
    String renderCell(String value) {
        String text = value == null ? "" : value;
        for (LiteralReplacement replacement : options.getLiteralReplacements()) {
            text = replacement.apply(text);
        }
        if (!escapeTriggers.matchesAnyOf(text)) {
            return text;
        }
        return Strings.nullToEmpty(options.getCellLeftDelimiter())
                + text
                + Strings.nullToEmpty(options.getCellRightDelimiter());
    }
}
