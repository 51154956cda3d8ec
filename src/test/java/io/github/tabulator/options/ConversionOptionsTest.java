package io.github.tabulator.options;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for option presets, derived defaults and their textual helpers.
 */
class ConversionOptionsTest {

    // ==================== Presets ====================

    @Nested
    @DisplayName("Presets")
    class Presets {

        @Test
        @DisplayName("delimited preset")
        void delimited() {
            ConversionOptions options = ConversionOptions.delimited();

            assertThat(options.getColumnDelimiter()).isEqualTo(",");
            assertThat(options.getCellLeftDelimiter()).isEqualTo("\"");
            assertThat(options.getCellRightDelimiter()).isEqualTo("\"");
            assertThat(options.getEscapeTriggerChars()).isEqualTo("\n\",");
            assertThat(options.getLiteralReplacements()).containsExactly(new LiteralReplacement("\"", "\"\""));
            assertThat(options.getHeaderSeparator()).isNull();
            assertThat(options.isPadCellsToColumnWidth()).isFalse();
            assertThat(options.isDeduplicateHeaders()).isTrue();
            assertThat(options.getLineTerminator()).isEqualTo("\n");
            assertThat(options.getHeaderPlacementPolicy()).isEqualTo(HeaderPlacementPolicy.APPEND_TO_ROW);
        }

        @Test
        @DisplayName("fixed-width preset")
        void fixedWidth() {
            ConversionOptions options = ConversionOptions.fixedWidth();

            assertThat(options.getColumnDelimiter()).isEqualTo("|");
            assertThat(options.getCellLeftDelimiter()).isNull();
            assertThat(options.getCellRightDelimiter()).isNull();
            assertThat(options.getEscapeTriggerChars()).isNull();
            assertThat(options.getLiteralReplacements()).isEmpty();
            assertThat(options.getHeaderSeparator()).isEqualTo("-");
            assertThat(options.isPadCellsToColumnWidth()).isTrue();
        }

        @Test
        @DisplayName("defaults match the delimited preset")
        void defaultsMatchDelimited() {
            ConversionOptions defaults = ConversionOptions.defaults();
            ConversionOptions delimited = ConversionOptions.delimited();

            assertThat(defaults.toString()).isEqualTo(delimited.toString());
            assertThat(defaults.getEscapeTriggerChars()).isEqualTo(delimited.getEscapeTriggerChars());
        }

        @Test
        @DisplayName("toBuilder copies every value")
        void toBuilderCopies() {
            ConversionOptions original = ConversionOptions.fixedWidth().toBuilder()
                    .lineTerminator("\r\n")
                    .deduplicateHeaders(false)
                    .headerPlacementPolicy(HeaderPlacementPolicy.FAIL)
                    .build();

            ConversionOptions copy = original.toBuilder().build();

            assertThat(copy.toString()).isEqualTo(original.toString());
            assertThat(copy.getLineTerminator()).isEqualTo("\r\n");
            assertThat(copy.getEscapeTriggerChars()).isNull();
        }
    }

    // ==================== Derived defaults ====================

    @Nested
    @DisplayName("Derived defaults")
    class DerivedDefaults {

        @Test
        @DisplayName("escape triggers and replacements follow the wrap delimiters")
        void followWrapDelimiters() {
            ConversionOptions options = ConversionOptions.builder()
                    .columnDelimiter(";")
                    .cellLeftDelimiter("[")
                    .cellRightDelimiter("]")
                    .build();

            assertThat(options.getEscapeTriggerChars()).isEqualTo("\n[];");
            assertThat(options.getLiteralReplacements()).containsExactly(new LiteralReplacement("]", "]]"));
        }

        @Test
        @DisplayName("no wrap delimiters means no triggers and no replacements")
        void noWrap() {
            ConversionOptions options = ConversionOptions.builder().cellWrap("").build();

            assertThat(options.getCellLeftDelimiter()).isNull();
            assertThat(options.getEscapeTriggerChars()).isNull();
            assertThat(options.getLiteralReplacements()).isEmpty();
        }

        @Test
        @DisplayName("empty line terminator is rejected")
        void emptyLineTerminator() {
            assertThatThrownBy(() -> ConversionOptions.builder().lineTerminator(""))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("null column delimiter is rejected")
        void nullColumnDelimiter() {
            assertThatThrownBy(() -> ConversionOptions.builder().columnDelimiter(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ==================== Literal replacements ====================

    @Nested
    @DisplayName("LiteralReplacement")
    class Replacements {

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "a==>b|a|b",
                "a==>b==>c|a|b==>c",
                "x==>|x|''"
        })
        @DisplayName("parses from==>to on the first separator")
        void parse(String text, String from, String to) {
            LiteralReplacement replacement = LiteralReplacement.parse(text);

            assertThat(replacement.from()).isEqualTo(from);
            assertThat(replacement.to()).isEqualTo(to);
        }

        @Test
        @DisplayName("quote doubling")
        void quoteDoubling() {
            LiteralReplacement replacement = LiteralReplacement.parse("\"==>\"\"");

            assertThat(replacement.apply("a\"b")).isEqualTo("a\"\"b");
            assertThat(replacement).hasToString("\"==>\"\"");
        }

        @Test
        @DisplayName("missing separator or empty source is rejected")
        void invalid() {
            assertThatThrownBy(() -> LiteralReplacement.parse("nope"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("<from>==><to>");
            assertThatThrownBy(() -> LiteralReplacement.parse("==>x"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    // ==================== Output formats ====================

    @Nested
    @DisplayName("OutputFormat")
    class Formats {

        @Test
        @DisplayName("names are case-insensitive and default to CSV")
        void fromName() {
            assertThat(OutputFormat.fromName("Markdown")).isEqualTo(OutputFormat.MARKDOWN);
            assertThat(OutputFormat.fromName(" csv ")).isEqualTo(OutputFormat.CSV);
            assertThat(OutputFormat.fromName(null)).isEqualTo(OutputFormat.CSV);
            assertThat(OutputFormat.fromName("")).isEqualTo(OutputFormat.CSV);
        }

        @Test
        @DisplayName("unknown names are rejected")
        void unknownName() {
            assertThatThrownBy(() -> OutputFormat.fromName("xml"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Unknown format: xml");
        }

        @Test
        @DisplayName("each format maps to its preset")
        void presets() {
            assertThat(OutputFormat.MARKDOWN.preset().isPadCellsToColumnWidth()).isTrue();
            assertThat(OutputFormat.CSV.preset().getColumnDelimiter()).isEqualTo(",");
        }
    }
}
