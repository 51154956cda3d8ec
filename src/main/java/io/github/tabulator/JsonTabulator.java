package io.github.tabulator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.github.tabulator.options.ConversionOptions;
import io.github.tabulator.table.FieldTree;
import io.github.tabulator.table.StructureAnalyzer;
import io.github.tabulator.table.TableBuilder;
import io.github.tabulator.table.TableRenderer;
import io.github.tabulator.table.TreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JsonTabulator - Converts a tree of JSON records into a delimited or fixed-width table.
 *
 * <p>Nested objects become stacked header rows, nested arrays become extra data rows below
 * their record. A single object is treated as a one-element array of records.</p>
 *
 * <p>Conversion is a pure function of its arguments; the class holds no per-call state and is
 * safe to share.</p>
 */
public final class JsonTabulator {

    private static final Logger LOG = LoggerFactory.getLogger(JsonTabulator.class);

    // Thread-safe ObjectMapper for JSON processing
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private JsonTabulator() {
    }

    /**
     * Converts a parsed value with the given options.
     *
     * @throws InvalidInputException if {@code value} is null
     * @throws HeaderPlacementException under the FAIL placement policy
     */
    public static String convert(JsonNode value, ConversionOptions options) {
        if (value == null) {
            throw new InvalidInputException("Input value must not be null");
        }
        if (options == null) {
            options = ConversionOptions.defaults();
        }
        JsonNode records = asRecords(value);

        FieldTree tree = new StructureAnalyzer().analyze(records);
        TableBuilder table = new TableBuilder(options.getHeaderPlacementPolicy());
        new TreeWalker(table, tree).walk(records);
        if (options.isDeduplicateHeaders()) {
            table.deduplicateHeaders();
        }
        String result = new TableRenderer(options).render(table);

        LOG.debug("Tabulated {} records: {} header rows, {} data rows, {} columns",
                records.size(), table.headerRowCount(), table.dataRowCount(), table.columnCount());
        return result;
    }

    /**
     * Parses {@code json} and converts it with the given options.
     *
     * @throws InvalidInputException if the text is not valid JSON
     */
    public static String convert(String json, ConversionOptions options) {
        return convert(parse(json), options);
    }

    /**
     * Converts with the delimited (CSV) preset.
     */
    public static String toCsv(String json) {
        return convert(json, ConversionOptions.delimited());
    }

    /**
     * Converts with the fixed-width (Markdown-like) preset.
     */
    public static String toMarkdown(String json) {
        return convert(json, ConversionOptions.fixedWidth());
    }

    public static JsonNode parse(String json) {
        if (json == null || json.trim().isEmpty()) {
            throw new InvalidInputException("Input JSON must not be empty");
        }
        try {
            return OBJECT_MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode asRecords(JsonNode value) {
        if (value.isArray()) {
            return value;
        }
        ArrayNode wrapper = OBJECT_MAPPER.createArrayNode();
        wrapper.add(value);
        return wrapper;
    }
}
