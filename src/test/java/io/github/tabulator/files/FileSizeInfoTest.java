package io.github.tabulator.files;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class FileSizeInfoTest {

    @ParameterizedTest
    @CsvSource({
            "0, 0 bytes",
            "1023, 1023 bytes",
            "1024, 1.0 KB",
            "1536, 1.5 KB",
            "1048576, 1.0 MB",
            "2621440, 2.5 MB"
    })
    @DisplayName("formats sizes in bytes, KB and MB")
    void formatted(long bytes, String expected) {
        assertThat(new FileSizeInfo(true, bytes).formatted()).isEqualTo(expected);
    }

    @Test
    @DisplayName("missing file has unknown size")
    void missing(@TempDir Path dir) throws Exception {
        FileSizeInfo info = FileSizeInfo.of(dir.resolve("nothing"));

        assertThat(info.exists()).isFalse();
        assertThat(info.formatted()).isEqualTo("unknown");
    }

    @Test
    @DisplayName("reads the size of an existing file")
    void existing(@TempDir Path dir) throws Exception {
        Path file = Files.write(dir.resolve("f.bin"), new byte[2048]);

        assertThat(FileSizeInfo.of(file)).isEqualTo(new FileSizeInfo(true, 2048));
        assertThat(FileSizeInfo.of(file)).hasToString("2.0 KB");
    }
}
