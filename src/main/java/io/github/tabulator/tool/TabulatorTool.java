package io.github.tabulator.tool;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.tabulator.JsonTabulator;
import io.github.tabulator.TabulationException;
import io.github.tabulator.files.FileConversionReport;
import io.github.tabulator.files.FileConversionService;
import io.github.tabulator.options.ConversionOptions;
import io.github.tabulator.options.LiteralReplacement;
import io.github.tabulator.options.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parameter-map entry point that dispatches to text mode or file mode.
 *
 * <p>Text mode takes an already parsed object or array in {@code json_data} and returns the
 * rendered table. File mode takes {@code input_file_path} and {@code output_file_path} and
 * returns a JSON report. Every failure is reported as a JSON object with an {@code error}
 * field instead of being thrown.</p>
 *
 * <p>The selected format's preset is the starting point; each rendering parameter present in
 * the map overrides it.</p>
 */
public class TabulatorTool {

    private static final Logger LOG = LoggerFactory.getLogger(TabulatorTool.class);

    // Parameter names
    public static final String JSON_DATA = "json_data";
    public static final String INPUT_FILE_PATH = "input_file_path";
    public static final String OUTPUT_FILE_PATH = "output_file_path";
    public static final String FORMAT = "format";
    public static final String COLUMN_DELIMITER = "column_delimiter";
    public static final String CELL_LEFT_DELIMITER = "cell_left_delimiter";
    public static final String CELL_RIGHT_DELIMITER = "cell_right_delimiter";
    public static final String ESCAPE_CHARS = "line_chars_need_to_be_escaped_with_cell_delimiter";
    public static final String HEADER_DELIMITER = "header_delimiter";
    public static final String LINE_REPLACEMENTS = "line_replacements";
    public static final String PADDING = "padding_to_max_cell_length";
    public static final String REMOVE_HEADER_DUPLICATES = "remove_headers_duplicates";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final FileConversionService fileService;

    public TabulatorTool() {
        this(new FileConversionService());
    }

    public TabulatorTool(FileConversionService fileService) {
        this.fileService = fileService;
    }

    /**
     * Runs one conversion and returns either the table (text mode) or a JSON document.
     */
    public String run(JsonNode parameters) {
        try {
            if (parameters == null || !parameters.isObject()) {
                return error("Parameters must be a JSON object");
            }
            String inputPath = textParameter(parameters, INPUT_FILE_PATH);
            String outputPath = textParameter(parameters, OUTPUT_FILE_PATH);
            JsonNode jsonData = parameters.get(JSON_DATA);

            boolean fileMode = inputPath != null && outputPath != null;
            boolean textMode = isProvided(jsonData);

            if (fileMode && textMode) {
                return error("Cannot use both Text Mode (json_data) and File Mode (input_file_path, "
                        + "output_file_path) parameters simultaneously. Choose one mode.");
            }
            if (!fileMode && !textMode) {
                return error("No input provided. Use Text Mode (json_data parameter) or File Mode "
                        + "(input_file_path and output_file_path parameters).");
            }

            OutputFormat format = OutputFormat.fromName(textParameter(parameters, FORMAT));
            ConversionOptions options = buildOptions(format, parameters);

            if (fileMode) {
                return runFileMode(inputPath, outputPath, format, options);
            }
            if (!jsonData.isContainerNode()) {
                return error("json_data must be an object or array, not "
                        + jsonData.getNodeType().name().toLowerCase(Locale.ROOT)
                        + ". Use File Mode for processing JSON strings.");
            }
            return JsonTabulator.convert(jsonData, options);
        } catch (TabulationException | IllegalArgumentException e) {
            LOG.debug("Conversion failed: {}", e.getMessage());
            return error(e.getMessage());
        }
    }

    private String runFileMode(String inputPath, String outputPath, OutputFormat format,
                               ConversionOptions options) {
        try {
            FileConversionReport report =
                    fileService.convert(Path.of(inputPath), Path.of(outputPath), format, options);

            ObjectNode response = OBJECT_MAPPER.createObjectNode();
            response.put("mode", "file");
            response.put("success", true);
            response.put("message", report.message());
            ObjectNode input = response.putObject("input_file");
            input.put("path", report.inputFile().toString());
            input.put("size", report.inputSize().formatted());
            ObjectNode output = response.putObject("output_file");
            output.put("path", report.outputFile().toString());
            output.put("size", report.outputSize().formatted());
            output.put("format", format.name().toLowerCase(Locale.ROOT));
            return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(response);
        } catch (IOException | TabulationException | IllegalArgumentException e) {
            LOG.debug("File conversion of {} failed", inputPath, e);
            ObjectNode response = OBJECT_MAPPER.createObjectNode();
            response.put("mode", "file");
            response.put("success", false);
            response.put("error", describe(e));
            response.put(INPUT_FILE_PATH, inputPath);
            response.put(OUTPUT_FILE_PATH, outputPath);
            return write(response);
        }
    }

    /**
     * Starts from the format preset and applies every rendering parameter that is present.
     * An explicit JSON null clears the wrap delimiters, the escape characters and the header
     * separator.
     */
    static ConversionOptions buildOptions(OutputFormat format, JsonNode parameters) {
        ConversionOptions.Builder builder = format.preset().toBuilder();
        if (parameters.hasNonNull(COLUMN_DELIMITER)) {
            builder.columnDelimiter(parameters.get(COLUMN_DELIMITER).asText());
        }
        if (parameters.has(CELL_LEFT_DELIMITER)) {
            builder.cellLeftDelimiter(nullableText(parameters.get(CELL_LEFT_DELIMITER)));
        }
        if (parameters.has(CELL_RIGHT_DELIMITER)) {
            builder.cellRightDelimiter(nullableText(parameters.get(CELL_RIGHT_DELIMITER)));
        }
        if (parameters.has(ESCAPE_CHARS)) {
            builder.escapeTriggerChars(nullableText(parameters.get(ESCAPE_CHARS)));
        }
        if (parameters.has(HEADER_DELIMITER)) {
            builder.headerSeparator(nullableText(parameters.get(HEADER_DELIMITER)));
        }
        if (parameters.has(LINE_REPLACEMENTS)) {
            builder.literalReplacements(parseReplacements(parameters.get(LINE_REPLACEMENTS)));
        }
        if (parameters.hasNonNull(PADDING)) {
            builder.padCellsToColumnWidth(parameters.get(PADDING).asBoolean());
        }
        if (parameters.hasNonNull(REMOVE_HEADER_DUPLICATES)) {
            builder.deduplicateHeaders(parameters.get(REMOVE_HEADER_DUPLICATES).asBoolean());
        }
        return builder.build();
    }

    private static List<LiteralReplacement> parseReplacements(JsonNode value) {
        List<LiteralReplacement> replacements = new ArrayList<>();
        if (value == null || value.isNull()) {
            return replacements;
        }
        if (!value.isArray()) {
            throw new IllegalArgumentException(LINE_REPLACEMENTS + " must be an array of strings");
        }
        for (JsonNode item : value) {
            replacements.add(LiteralReplacement.parse(item.asText()));
        }
        return replacements;
    }

    /**
     * Absent, null, empty containers, empty strings, false and zero all count as not provided.
     */
    static boolean isProvided(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isContainerNode()) {
            return value.size() > 0;
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() != 0;
        }
        return true;
    }

    private static String textParameter(JsonNode parameters, String name) {
        JsonNode value = parameters.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    private static String nullableText(JsonNode value) {
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : message;
    }

    private static String error(String message) {
        ObjectNode response = OBJECT_MAPPER.createObjectNode();
        response.put("error", message);
        return write(response);
    }

    private static String write(ObjectNode response) {
        try {
            return OBJECT_MAPPER.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
