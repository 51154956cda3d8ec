package io.github.tabulator.files;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.tabulator.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads an input document from disk into a value tree.
 *
 * <p>Files ending in {@code .yaml} or {@code .yml} are parsed with SnakeYAML, everything else
 * as JSON. Content is always decoded as UTF-8.</p>
 */
public class DocumentReader {

    private static final Logger LOG = LoggerFactory.getLogger(DocumentReader.class);

    private final ObjectMapper mapper;

    public DocumentReader() {
        this(new ObjectMapper());
    }

    public DocumentReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Reads and parses {@code file}.
     *
     * @throws InvalidInputException if the file is missing, is not a regular file, or does not parse
     * @throws IOException if reading fails
     */
    public JsonNode read(Path file) throws IOException {
        Path absolute = file.toAbsolutePath().normalize();
        if (!Files.exists(absolute)) {
            throw new InvalidInputException("Input file not found: " + absolute);
        }
        if (!Files.isRegularFile(absolute)) {
            throw new InvalidInputException("Path is not a file: " + absolute);
        }

        String content = Files.readString(absolute, StandardCharsets.UTF_8);
        LOG.debug("Read {} characters from {}", content.length(), absolute);

        if (isYaml(absolute)) {
            return parseYaml(absolute, content);
        }
        try {
            return mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException(
                    "Invalid JSON in file " + absolute + ": " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode parseYaml(Path file, String content) {
        Object loaded;
        try {
            loaded = new Yaml().load(content);
        } catch (YAMLException e) {
            throw new InvalidInputException("Invalid YAML in file " + file + ": " + e.getMessage(), e);
        }
        if (loaded == null) {
            throw new InvalidInputException("Empty YAML document in file " + file);
        }
        return mapper.valueToTree(loaded);
    }

    static boolean isYaml(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml");
    }
}
