package dev.flowdoctor.engine;

import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.RawRow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnNormalizerTest {

    @Test
    void padsShortRows() {
        var result = ColumnNormalizer.normalize(RawRow.of(2, "1", "D", "Start"));

        assertThat(result.row().size()).isEqualTo(Column.COUNT);
        assertThat(result.originalWidth()).isEqualTo(3);
        assertThat(result.changed()).isTrue();
        assertThat(result.row().cell(Column.NODE_NAME)).isEqualTo("Start");
    }

    @Test
    void leavesExactRowsAlone() {
        RawRow row = new RawRow(2, blank(Column.COUNT));

        var result = ColumnNormalizer.normalize(row);

        assertThat(result.changed()).isFalse();
        assertThat(result.row()).isSameAs(row);
    }

    @Test
    void dropsEmptyTrailingCells() {
        List<String> cells = blank(Column.COUNT + 2);
        cells.set(0, "1");

        var result = ColumnNormalizer.normalize(new RawRow(2, cells));

        assertThat(result.row().size()).isEqualTo(Column.COUNT);
        assertThat(result.change()).isEqualTo("dropped 2 empty trailing cells");
    }

    @Test
    void mergesOverflowBackIntoSplitJson() {
        List<String> cells = blank(Column.COUNT);
        cells.set(0, "1");
        cells.set(1, "D");
        cells.set(Column.RICH_CONTENT.index(), "{\"a\":1");
        cells.add(Column.RICH_CONTENT.index() + 1, "\"b\":2}");
        cells.set(cells.size() - 1, "css");

        var result = ColumnNormalizer.normalize(new RawRow(2, cells));

        assertThat(result.row().size()).isEqualTo(Column.COUNT);
        assertThat(result.row().cell(Column.RICH_CONTENT)).isEqualTo("{\"a\":1,\"b\":2}");
        assertThat(result.row().cell(Column.CSS_CLASSNAME)).isEqualTo("css");
        assertThat(result.change()).contains("Rich Asset Content");
    }

    @Test
    void mergesOverflowIntoMessageWhenThereIsNoJson() {
        List<String> cells = blank(Column.COUNT);
        cells.set(0, "1");
        cells.set(1, "D");
        cells.set(Column.MESSAGE.index(), "Hello");
        cells.add(Column.MESSAGE.index() + 1, " world");
        cells.set(cells.size() - 1, "css");

        var result = ColumnNormalizer.normalize(new RawRow(2, cells));

        assertThat(result.row().cell(Column.MESSAGE)).isEqualTo("Hello, world");
        assertThat(result.row().cell(Column.CSS_CLASSNAME)).isEqualTo("css");
    }

    private static List<String> blank(int count) {
        return new ArrayList<>(Collections.nCopies(count, ""));
    }
}
