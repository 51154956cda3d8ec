package io.github.tabulator.files;

import io.github.tabulator.options.OutputFormat;

import java.nio.file.Path;

/**
 * Outcome of one file conversion: absolute paths and sizes of both sides.
 */
public record FileConversionReport(Path inputFile, FileSizeInfo inputSize,
                                   Path outputFile, FileSizeInfo outputSize,
                                   OutputFormat format) {

    public String message() {
        return "Successfully converted JSON to " + format.name();
    }
}
