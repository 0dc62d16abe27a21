package dev.flowdoctor.codec;

import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.FlowDocument;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.RawRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FlowCsvCodecTest {

    @Test
    void quotedCellKeepsCommasAndDoubledQuotes() {
        List<RawRow> rows = FlowCsvCodec.parse("1,D,Start,,,,,,\"Hello, \"\"friend\"\"\",button");

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).cell(Column.MESSAGE)).isEqualTo("Hello, \"friend\"");
        assertThat(rows.get(0).cell(Column.RICH_TYPE)).isEqualTo("button");
    }

    @Test
    void quotedCellMaySpanLines() {
        List<RawRow> rows = FlowCsvCodec.parse("1,D,Start,,,,,,\"line one\nline two\",button");

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).cell(Column.MESSAGE)).isEqualTo("line one\nline two");
        assertThat(rows.get(0).size()).isEqualTo(10);
    }

    @Test
    void strayQuoteIsClosedWhenNextLineStartsANode() {
        List<RawRow> rows = FlowCsvCodec.parse("1,D,Start,,,,,,\"Unclosed\n2,D,Next");

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).cell(Column.MESSAGE)).isEqualTo("Unclosed");
        assertThat(rows.get(1).lineNumber()).isEqualTo(2);
        assertThat(rows.get(1).cells()).containsExactly("2", "D", "Next");
    }

    @Test
    void stripsByteOrderMarkAndSkipsBlankLines() {
        String text = "\uFEFF" + String.join(",", Column.headers()) + "\n\n1,D,Start\n";

        List<RawRow> rows = FlowCsvCodec.parse(text);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).isHeader()).isTrue();
        assertThat(rows.get(1).cell(Column.NODE_NUMBER)).isEqualTo("1");
        assertThat(rows.get(1).lineNumber()).isEqualTo(3);
    }

    @Test
    void keepsWhateverCellCountTheLineHad() {
        assertThat(FlowCsvCodec.parse("1,D").get(0).size()).isEqualTo(2);
        assertThat(FlowCsvCodec.parse("1,D,,,,,,,,,,,,,,,,,,,,,,,,,,,").get(0).size()).isEqualTo(29);
    }

    @Test
    void emptyInputHasNoRows() {
        assertThat(FlowCsvCodec.parse("")).isEmpty();
        assertThat(FlowCsvCodec.parse(null)).isEmpty();
    }

    @Test
    void writeEmitsHeaderThenOneQuotedRowPerNode() {
        var document = FlowDocument.of(FlowNode.Decision.of(1, "Start", "Hi, there"));

        String csv = FlowCsvCodec.write(document);

        List<String> lines = csv.lines().toList();
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).isEqualTo(String.join(",", Column.headers()));
        assertThat(lines.get(1)).startsWith("1,D,Start,").contains("\"Hi, there\"");
    }

    @Test
    void writtenDocumentParsesBackToSameCells() {
        var node = FlowNode.Decision.of(7, "Ask", "Say \"yes\", or no\nplease")
            .withRich("button", "Yes~8|No~9");

        String csv = FlowCsvCodec.write(FlowDocument.of(node));
        List<RawRow> rows = FlowCsvCodec.parse(csv);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(1).cells()).isEqualTo(RecordMapper.toRow(node, 2).cells());
    }

    @Test
    void reserializedMalformedInputParsesToSameCells() {
        List<String> inputs = List.of(
            "1,D,Start,,,,,,\"Unclosed\n2,D,Next",
            "1,D,Start,,,,,,Say \"hi\" now,button",
            "1,D,,,,,,,,,,,,,,,,,,,,,,,,,,,",
            "\uFEFF" + String.join(",", Column.headers()) + "\n\n1,D,Start\n",
            "1,D,Start,,,,,,one\rtwo\r\n2,D,Next",
            "1,D,Start,,,,,,\"line one\nline two\",button");

        for (String input : inputs) {
            List<List<String>> parsed = cells(FlowCsvCodec.parse(input));
            List<List<String>> reparsed = cells(FlowCsvCodec.parse(FlowCsvCodec.serialize(FlowCsvCodec.parse(input))));

            assertThat(reparsed).as("round trip of %s", input).isEqualTo(parsed);
        }
    }

    private static List<List<String>> cells(List<RawRow> rows) {
        return rows.stream().map(RawRow::cells).toList();
    }
}
