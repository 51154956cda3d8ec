package io.github.tabulator.options;

import com.google.common.base.Splitter;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration helper that builds {@link ConversionOptions} from a properties file or from
 * environment variables.
 *
 * <p>Both sources start from the preset of the configured format and override only the keys
 * that are present.</p>
 */
public final class ConversionOptionsConfig {

    public static final String DEFAULT_CONFIG_FILE = "tabulator.properties";

    // Property keys
    static final String FORMAT = "tabulator.format";
    static final String COLUMN_DELIMITER = "tabulator.column.delimiter";
    static final String CELL_LEFT_DELIMITER = "tabulator.cell.left.delimiter";
    static final String CELL_RIGHT_DELIMITER = "tabulator.cell.right.delimiter";
    static final String ESCAPE_CHARS = "tabulator.escape.chars";
    static final String HEADER_SEPARATOR = "tabulator.header.separator";
    static final String REPLACEMENTS = "tabulator.replacements";
    static final String PADDING = "tabulator.padding";
    static final String DEDUPLICATE_HEADERS = "tabulator.deduplicate.headers";
    static final String LINE_TERMINATOR = "tabulator.line.terminator";
    static final String HEADER_PLACEMENT = "tabulator.header.placement";

    /** Replacements in configuration are separated by this character, e.g. {@code "==>""|a==>b}. */
    static final char REPLACEMENT_LIST_SEPARATOR = '|';

    private ConversionOptionsConfig() {
    }

    /**
     * Create options from a classpath properties file.
     */
    public static ConversionOptions fromProperties(String propertiesFile) throws IOException {
        return fromProperties(loadProperties(propertiesFile));
    }

    /**
     * Create options from the default classpath properties file.
     */
    public static ConversionOptions fromDefaultProperties() throws IOException {
        return fromProperties(DEFAULT_CONFIG_FILE);
    }

    /**
     * Create options from already loaded properties.
     */
    public static ConversionOptions fromProperties(Properties props) {
        return createOptions(props::getProperty);
    }

    /**
     * Create options from the process environment.
     */
    public static ConversionOptions fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Create options from an environment map. Property keys map to upper-case names with dots
     * replaced by underscores, e.g. {@code tabulator.column.delimiter} is read from
     * {@code TABULATOR_COLUMN_DELIMITER}.
     */
    public static ConversionOptions fromEnvironment(Map<String, String> env) {
        return createOptions(key -> env.get(toEnvironmentName(key)));
    }

    static String toEnvironmentName(String propertyKey) {
        return propertyKey.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    private static ConversionOptions createOptions(Function<String, String> source) {
        OutputFormat format = OutputFormat.fromName(source.apply(FORMAT));
        ConversionOptions.Builder builder = format.preset().toBuilder();

        String columnDelimiter = source.apply(COLUMN_DELIMITER);
        if (columnDelimiter != null) {
            builder.columnDelimiter(columnDelimiter);
        }

        String left = source.apply(CELL_LEFT_DELIMITER);
        if (left != null) {
            builder.cellLeftDelimiter(left);
        }

        String right = source.apply(CELL_RIGHT_DELIMITER);
        if (right != null) {
            builder.cellRightDelimiter(right);
        }

        String escapeChars = source.apply(ESCAPE_CHARS);
        if (escapeChars != null) {
            builder.escapeTriggerChars(escapeChars);
        }

        String headerSeparator = source.apply(HEADER_SEPARATOR);
        if (headerSeparator != null) {
            builder.headerSeparator(headerSeparator);
        }

        String replacements = source.apply(REPLACEMENTS);
        if (replacements != null) {
            builder.literalReplacements(parseReplacements(replacements));
        }

        String padding = source.apply(PADDING);
        if (padding != null) {
            builder.padCellsToColumnWidth(Boolean.parseBoolean(padding.trim()));
        }

        String deduplicate = source.apply(DEDUPLICATE_HEADERS);
        if (deduplicate != null) {
            builder.deduplicateHeaders(Boolean.parseBoolean(deduplicate.trim()));
        }

        String lineTerminator = source.apply(LINE_TERMINATOR);
        if (lineTerminator != null) {
            builder.lineTerminator(lineTerminator);
        }

        String placement = source.apply(HEADER_PLACEMENT);
        if (placement != null) {
            builder.headerPlacementPolicy(
                    HeaderPlacementPolicy.valueOf(placement.trim().toUpperCase(Locale.ROOT)));
        }

        return builder.build();
    }

    static List<LiteralReplacement> parseReplacements(String value) {
        List<LiteralReplacement> result = new ArrayList<>();
        for (String part : Splitter.on(REPLACEMENT_LIST_SEPARATOR).omitEmptyStrings().split(value)) {
            result.add(LiteralReplacement.parse(part));
        }
        return result;
    }

    private static Properties loadProperties(String filename) throws IOException {
        Properties props = new Properties();

        try (InputStream is = ConversionOptionsConfig.class
                .getClassLoader().getResourceAsStream(filename)) {
            if (is != null) {
                props.load(is);
            } else {
                throw new IOException("Properties file not found: " + filename);
            }
        }

        return props;
    }
}
