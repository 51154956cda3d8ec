package io.github.tabulator.options;

import com.google.common.base.Preconditions;

/**
 * An exact substring substitution applied to every cell before escaping is evaluated.
 *
 * <p>The textual form {@code from==>to} is accepted for compatibility with tool parameters,
 * e.g. {@code "==>""} turns every quote into a doubled quote.</p>
 */
public record LiteralReplacement(String from, String to) {

    public static final String SEPARATOR = "==>";

    public LiteralReplacement {
        Preconditions.checkArgument(from != null && !from.isEmpty(), "Replacement source must not be empty");
        Preconditions.checkArgument(to != null, "Replacement target must not be null");
    }

    /**
     * Parses {@code from==>to}. The first separator splits the two sides.
     *
     * @throws IllegalArgumentException if the separator is missing or the source is empty
     */
    public static LiteralReplacement parse(String text) {
        Preconditions.checkArgument(text != null, "Replacement must not be null");
        int idx = text.indexOf(SEPARATOR);
        if (idx < 0) {
            throw new IllegalArgumentException(
                    "Replacement '" + text + "' must have the form <from>" + SEPARATOR + "<to>");
        }
        return new LiteralReplacement(text.substring(0, idx), text.substring(idx + SEPARATOR.length()));
    }

    public String apply(String value) {
        return value.replace(from, to);
    }

    @Override
    public String toString() {
        return from + SEPARATOR + to;
    }
}
