package io.github.tabulator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.tabulator.options.ConversionOptions;
import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for flat record conversion using jqwik.
 */
class TabulatorPropertiesTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Property
    @Label("conversion is deterministic")
    void deterministic(@ForAll("records") List<Map<String, String>> records) {
        JsonNode value = MAPPER.valueToTree(records);

        assertThat(JsonTabulator.convert(value, ConversionOptions.fixedWidth()))
                .isEqualTo(JsonTabulator.convert(value, ConversionOptions.fixedWidth()));
    }

    @Property
    @Label("header row is the union of keys in first-seen order")
    void headerIsKeyUnion(@ForAll("records") List<Map<String, String>> records) {
        JsonNode value = MAPPER.valueToTree(records);
        Set<String> union = new LinkedHashSet<>();
        for (JsonNode record : value) {
            record.fieldNames().forEachRemaining(union::add);
        }

        String[] lines = JsonTabulator.convert(value, ConversionOptions.delimited()).split("\n");

        assertThat(lines[0]).isEqualTo(String.join(",", union));
        assertThat(lines).hasSize(records.size() + 1);
    }

    @Property
    @Label("every record keeps its values under its own keys")
    void valuesStayInTheirColumns(@ForAll("records") List<Map<String, String>> records) {
        JsonNode value = MAPPER.valueToTree(records);

        String[] lines = JsonTabulator.convert(value, ConversionOptions.delimited()).split("\n");
        List<String> header = List.of(lines[0].split(",", -1));

        for (int i = 0; i < records.size(); i++) {
            String[] cells = lines[i + 1].split(",", -1);
            JsonNode record = value.get(i);
            for (int col = 0; col < header.size(); col++) {
                JsonNode cell = record.get(header.get(col));
                assertThat(cells[col]).isEqualTo(cell == null ? "" : cell.asText());
            }
        }
    }

    @Property
    @Label("fixed-width lines all have the same length")
    void fixedWidthLinesAligned(@ForAll("records") List<Map<String, String>> records) {
        String text = JsonTabulator.convert(MAPPER.valueToTree(records), ConversionOptions.fixedWidth());

        List<Integer> lengths = new ArrayList<>();
        for (String line : text.split("\n")) {
            lengths.add(line.length());
        }
        assertThat(lengths).containsOnly(lengths.get(0));
    }

    @Provide
    Arbitrary<List<Map<String, String>>> records() {
        Arbitrary<String> keys = Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(5);
        Arbitrary<String> values = Arbitraries.strings().alpha().numeric().ofMinLength(1).ofMaxLength(8);
        return Arbitraries.maps(keys, values).ofMinSize(1).ofMaxSize(4)
                .list().ofMinSize(1).ofMaxSize(6);
    }
}
