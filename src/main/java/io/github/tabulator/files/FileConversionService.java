package io.github.tabulator.files;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.tabulator.JsonTabulator;
import io.github.tabulator.options.ConversionOptions;
import io.github.tabulator.options.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File mode: reads a document, converts it and writes the table next to wherever the caller
 * asks, creating missing parent directories.
 */
public class FileConversionService {

    private static final Logger LOG = LoggerFactory.getLogger(FileConversionService.class);

    private final DocumentReader reader;

    public FileConversionService() {
        this(new DocumentReader());
    }

    public FileConversionService(DocumentReader reader) {
        this.reader = reader;
    }

    /**
     * Converts with the preset of {@code format}.
     */
    public FileConversionReport convert(Path input, Path output, OutputFormat format) throws IOException {
        return convert(input, output, format, format.preset());
    }

    public FileConversionReport convert(Path input, Path output, OutputFormat format,
                                        ConversionOptions options) throws IOException {
        Path inputPath = input.toAbsolutePath().normalize();
        Path outputPath = output.toAbsolutePath().normalize();

        FileSizeInfo inputSize = FileSizeInfo.of(inputPath);
        JsonNode document = reader.read(inputPath);
        String table = JsonTabulator.convert(document, options);

        Path parent = outputPath.getParent();
        if (parent != null && !Files.exists(parent)) {
            LOG.debug("Creating output directory {}", parent);
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, table, StandardCharsets.UTF_8);

        FileSizeInfo outputSize = FileSizeInfo.of(outputPath);
        LOG.debug("Converted {} ({}) to {} ({})", inputPath, inputSize, outputPath, outputSize);
        return new FileConversionReport(inputPath, inputSize, outputPath, outputSize, format);
    }
}
