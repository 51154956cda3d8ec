package io.github.tabulator.files;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Size of a file on disk with a human readable rendering.
 */
public record FileSizeInfo(boolean exists, long sizeBytes) {

    private static final long KB = 1024;
    private static final long MB = 1024 * 1024;

    public static FileSizeInfo of(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            return missing();
        }
        return new FileSizeInfo(true, Files.size(file));
    }

    public static FileSizeInfo missing() {
        return new FileSizeInfo(false, 0);
    }

    /**
     * {@code N bytes} below one kilobyte, then {@code x.y KB}, then {@code x.y MB};
     * {@code unknown} for a missing file.
     */
    public String formatted() {
        if (!exists) {
            return "unknown";
        }
        if (sizeBytes < KB) {
            return sizeBytes + " bytes";
        }
        if (sizeBytes < MB) {
            return String.format(Locale.ROOT, "%.1f KB", sizeBytes / (double) KB);
        }
        return String.format(Locale.ROOT, "%.1f MB", sizeBytes / (double) MB);
    }

    @Override
    public String toString() {
        return formatted();
    }
}
