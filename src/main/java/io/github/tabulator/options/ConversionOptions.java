package io.github.tabulator.options;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Rendering options for a table conversion.
 *
 * <p>This class uses the builder pattern for configuration and is immutable
 * once constructed. Two presets cover the common cases: {@link #delimited()}
 * and {@link #fixedWidth()}.</p>
 */
public final class ConversionOptions {

    public static final String DEFAULT_COLUMN_DELIMITER = ",";
    public static final String DEFAULT_WRAP = "\"";
    public static final String DEFAULT_LINE_TERMINATOR = "\n";

    // Cell layout
    private final String columnDelimiter;
    private final String cellLeftDelimiter;
    private final String cellRightDelimiter;
    private final String escapeTriggerChars;

    // Text rewriting
    private final List<LiteralReplacement> literalReplacements;

    // Table layout
    private final String headerSeparator;
    private final boolean padCellsToColumnWidth;
    private final boolean deduplicateHeaders;
    private final String lineTerminator;

    // Header placement
    private final HeaderPlacementPolicy headerPlacementPolicy;

    private ConversionOptions(Builder builder) {
        this.columnDelimiter = builder.columnDelimiter;
        this.cellLeftDelimiter = builder.cellLeftDelimiter;
        this.cellRightDelimiter = builder.cellRightDelimiter;
        this.escapeTriggerChars = builder.escapeTriggerCharsSet
                ? builder.escapeTriggerChars
                : defaultEscapeTriggers(builder);
        this.literalReplacements = builder.literalReplacementsSet
                ? ImmutableList.copyOf(builder.literalReplacements)
                : defaultReplacements(builder);
        this.headerSeparator = builder.headerSeparator;
        this.padCellsToColumnWidth = builder.padCellsToColumnWidth;
        this.deduplicateHeaders = builder.deduplicateHeaders;
        this.lineTerminator = builder.lineTerminator;
        this.headerPlacementPolicy = builder.headerPlacementPolicy;
    }

    private static String defaultEscapeTriggers(Builder builder) {
        if (builder.cellLeftDelimiter == null && builder.cellRightDelimiter == null) {
            return null;
        }
        StringBuilder triggers = new StringBuilder("\n");
        if (builder.cellLeftDelimiter != null) {
            triggers.append(builder.cellLeftDelimiter);
        }
        if (builder.cellRightDelimiter != null && !builder.cellRightDelimiter.equals(builder.cellLeftDelimiter)) {
            triggers.append(builder.cellRightDelimiter);
        }
        triggers.append(builder.columnDelimiter);
        return triggers.toString();
    }

    private static List<LiteralReplacement> defaultReplacements(Builder builder) {
        if (builder.cellRightDelimiter == null) {
            return ImmutableList.of();
        }
        String wrap = builder.cellRightDelimiter;
        return ImmutableList.of(new LiteralReplacement(wrap, wrap + wrap));
    }

    /**
     * Returns a builder with default settings (the delimited layout).
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the default configuration, identical to {@link #delimited()}.
     */
    public static ConversionOptions defaults() {
        return builder().build();
    }

    /**
     * Delimiter-separated preset: comma between cells, cells wrapped in quotes when they contain a
     * line break, a quote or a comma, embedded quotes doubled, no padding, no header separator.
     */
    public static ConversionOptions delimited() {
        return builder()
                .columnDelimiter(",")
                .cellLeftDelimiter("\"")
                .cellRightDelimiter("\"")
                .escapeTriggerChars("\n\",")
                .literalReplacements(List.of(new LiteralReplacement("\"", "\"\"")))
                .headerSeparator(null)
                .padCellsToColumnWidth(false)
                .build();
    }

    /**
     * Fixed-width preset: pipe between cells, no wrapping, every cell padded to its column width
     * and a line of dashes after the header rows.
     */
    public static ConversionOptions fixedWidth() {
        return builder()
                .columnDelimiter("|")
                .cellLeftDelimiter(null)
                .cellRightDelimiter(null)
                .escapeTriggerChars(null)
                .literalReplacements(List.of())
                .headerSeparator("-")
                .padCellsToColumnWidth(true)
                .build();
    }

    /**
     * Returns a builder initialised with this instance's values.
     */
    public Builder toBuilder() {
        return builder()
                .columnDelimiter(columnDelimiter)
                .cellLeftDelimiter(cellLeftDelimiter)
                .cellRightDelimiter(cellRightDelimiter)
                .escapeTriggerChars(escapeTriggerChars)
                .literalReplacements(literalReplacements)
                .headerSeparator(headerSeparator)
                .padCellsToColumnWidth(padCellsToColumnWidth)
                .deduplicateHeaders(deduplicateHeaders)
                .lineTerminator(lineTerminator)
                .headerPlacementPolicy(headerPlacementPolicy);
    }

    // Getters

    public String getColumnDelimiter() {
        return columnDelimiter;
    }

    /**
     * Returns the text written before an escaped cell, or null for none.
     */
    public String getCellLeftDelimiter() {
        return cellLeftDelimiter;
    }

    /**
     * Returns the text written after an escaped cell, or null for none.
     */
    public String getCellRightDelimiter() {
        return cellRightDelimiter;
    }

    /**
     * Returns the characters that force a cell to be wrapped, or null when nothing is wrapped.
     */
    public String getEscapeTriggerChars() {
        return escapeTriggerChars;
    }

    public List<LiteralReplacement> getLiteralReplacements() {
        return literalReplacements;
    }

    /**
     * Returns the text repeated to form the line after the header rows, or null for no such line.
     */
    public String getHeaderSeparator() {
        return headerSeparator;
    }

    public boolean isPadCellsToColumnWidth() {
        return padCellsToColumnWidth;
    }

    public boolean isDeduplicateHeaders() {
        return deduplicateHeaders;
    }

    public String getLineTerminator() {
        return lineTerminator;
    }

    public HeaderPlacementPolicy getHeaderPlacementPolicy() {
        return headerPlacementPolicy;
    }

    @Override
    public String toString() {
        return "ConversionOptions{columnDelimiter='" + columnDelimiter + '\''
                + ", wrap=" + cellLeftDelimiter + "/" + cellRightDelimiter
                + ", headerSeparator=" + headerSeparator
                + ", replacements=" + literalReplacements
                + ", padding=" + padCellsToColumnWidth
                + ", deduplicateHeaders=" + deduplicateHeaders
                + ", placement=" + headerPlacementPolicy + '}';
    }

    // Builder

    public static final class Builder {
        private String columnDelimiter = DEFAULT_COLUMN_DELIMITER;
        private String cellLeftDelimiter = DEFAULT_WRAP;
        private String cellRightDelimiter = DEFAULT_WRAP;
        private String escapeTriggerChars;
        private boolean escapeTriggerCharsSet = false;
        private List<LiteralReplacement> literalReplacements = List.of();
        private boolean literalReplacementsSet = false;
        private String headerSeparator = null;
        private boolean padCellsToColumnWidth = false;
        private boolean deduplicateHeaders = true;
        private String lineTerminator = DEFAULT_LINE_TERMINATOR;
        private HeaderPlacementPolicy headerPlacementPolicy = HeaderPlacementPolicy.APPEND_TO_ROW;

        public Builder columnDelimiter(String delimiter) {
            Preconditions.checkArgument(delimiter != null, "Column delimiter must not be null");
            this.columnDelimiter = delimiter;
            return this;
        }

        public Builder cellLeftDelimiter(String delimiter) {
            this.cellLeftDelimiter = Strings.emptyToNull(delimiter);
            return this;
        }

        public Builder cellRightDelimiter(String delimiter) {
            this.cellRightDelimiter = Strings.emptyToNull(delimiter);
            return this;
        }

        /**
         * Sets both wrap delimiters at once.
         */
        public Builder cellWrap(String wrap) {
            return cellLeftDelimiter(wrap).cellRightDelimiter(wrap);
        }

        /**
         * Sets the characters that force wrapping. When never called, the triggers are derived
         * from the line break, the wrap delimiters and the column delimiter.
         */
        public Builder escapeTriggerChars(String chars) {
            this.escapeTriggerChars = Strings.emptyToNull(chars);
            this.escapeTriggerCharsSet = true;
            return this;
        }

        /**
         * Sets the ordered replacement list. When never called, the right wrap delimiter is doubled.
         */
        public Builder literalReplacements(List<LiteralReplacement> replacements) {
            this.literalReplacements = replacements == null ? List.of() : replacements;
            this.literalReplacementsSet = true;
            return this;
        }

        public Builder headerSeparator(String separator) {
            this.headerSeparator = Strings.emptyToNull(separator);
            return this;
        }

        public Builder padCellsToColumnWidth(boolean pad) {
            this.padCellsToColumnWidth = pad;
            return this;
        }

        public Builder deduplicateHeaders(boolean deduplicate) {
            this.deduplicateHeaders = deduplicate;
            return this;
        }

        public Builder lineTerminator(String terminator) {
            Preconditions.checkArgument(terminator != null && !terminator.isEmpty(),
                    "Line terminator must not be empty");
            this.lineTerminator = terminator;
            return this;
        }

        public Builder headerPlacementPolicy(HeaderPlacementPolicy policy) {
            Preconditions.checkArgument(policy != null, "Header placement policy must not be null");
            this.headerPlacementPolicy = policy;
            return this;
        }

        public ConversionOptions build() {
            return new ConversionOptions(this);
        }
    }
}
