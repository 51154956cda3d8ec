package io.github.tabulator.table;

import io.github.tabulator.options.ConversionOptions;
import io.github.tabulator.options.LiteralReplacement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TableRendererTest {

    private static TableBuilder twoByTwo() {
        PathNode root = PathNode.root();
        TableBuilder table = new TableBuilder();
        table.getOrCreateHeader(root.child("a"));
        table.getOrCreateHeader(root.child("bb"));
        table.beginRecord();
        table.inject(0, false, "xyz");
        table.inject(1, true, "1");
        return table;
    }

    @Test
    @DisplayName("fixed-width pads every cell and separates the header")
    void fixedWidth() {
        String text = new TableRenderer(ConversionOptions.fixedWidth()).render(twoByTwo());

        assertThat(text).isEqualTo("a  |bb\n------\nxyz|1 \n");
    }

    @Test
    @DisplayName("a multi-character separator is cut to the longest line")
    void multiCharacterSeparator() {
        ConversionOptions options = ConversionOptions.fixedWidth().toBuilder()
                .headerSeparator("=-")
                .build();

        assertThat(new TableRenderer(options).render(twoByTwo()))
                .isEqualTo("a  |bb\n=-=-=-\nxyz|1 \n");
    }

    @Test
    @DisplayName("delimited output is not padded")
    void delimited() {
        assertThat(new TableRenderer(ConversionOptions.delimited()).render(twoByTwo()))
                .isEqualTo("a,bb\nxyz,1\n");
    }

    @Test
    @DisplayName("an empty table renders as the empty string")
    void emptyTable() {
        assertThat(new TableRenderer(ConversionOptions.fixedWidth()).render(new TableBuilder())).isEmpty();
    }

    @Test
    @DisplayName("quotes are doubled and the cell is wrapped")
    void quoteEscaping() {
        TableRenderer renderer = new TableRenderer(ConversionOptions.delimited());

        assertThat(renderer.renderCell("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
        assertThat(renderer.renderCell("plain")).isEqualTo("plain");
        assertThat(renderer.renderCell(null)).isEmpty();
    }

    @Test
    @DisplayName("the escape check sees the replaced text")
    void replacementsRunBeforeEscapeCheck() {
        ConversionOptions options = ConversionOptions.builder()
                .cellLeftDelimiter("[")
                .cellRightDelimiter("]")
                .escapeTriggerChars(",")
                .literalReplacements(List.of(new LiteralReplacement(";", ",")))
                .build();
        TableRenderer renderer = new TableRenderer(options);

        assertThat(renderer.renderCell("a;b")).isEqualTo("[a,b]");
        assertThat(renderer.renderCell("ab")).isEqualTo("ab");
    }

    @Test
    @DisplayName("without wrap delimiters a triggering cell is left as is")
    void noWrapDelimiters() {
        ConversionOptions options = ConversionOptions.builder()
                .cellWrap(null)
                .escapeTriggerChars(",")
                .literalReplacements(List.of())
                .build();

        assertThat(new TableRenderer(options).renderCell("a,b")).isEqualTo("a,b");
    }
}
