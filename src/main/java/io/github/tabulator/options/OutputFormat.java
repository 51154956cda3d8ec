package io.github.tabulator.options;

import java.util.Locale;

/**
 * Named output formats, each backed by a {@link ConversionOptions} preset.
 */
public enum OutputFormat {
    /** Delimiter-separated values: comma, quote wrapping, no padding */
    CSV,
    /** Fixed-width table: pipe separated, padded cells, dashed header separator */
    MARKDOWN;

    /**
     * Returns the preset options for this format.
     */
    public ConversionOptions preset() {
        return this == MARKDOWN ? ConversionOptions.fixedWidth() : ConversionOptions.delimited();
    }

    /**
     * Parses a format name case-insensitively ("csv", "markdown").
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static OutputFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            return CSV;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown format: " + name + " (expected csv or markdown)", e);
        }
    }
}
