package dev.flowdoctor.engine;

import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.NodeKind;
import dev.flowdoctor.model.RawRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Brings a row to exactly 26 cells.
 *
 * <p>Short rows are padded. Trailing empty cells beyond the last column are dropped. Remaining
 * overflow is assumed to come from an unquoted comma inside one cell: it is merged back into the
 * first cell at or after the kind's JSON column (Rich Asset Content for Decisions, Parameter Input
 * for Actions) that starts with {@code {}, or else into the free-text column (Message or
 * Description).
 */
public final class ColumnNormalizer {

    private ColumnNormalizer() {}

    /**
     * @param row           the normalized row
     * @param originalWidth cell count before normalization
     * @param change        what was done, empty when the row was already 26 wide
     */
    public record Result(RawRow row, int originalWidth, String change) {
        public boolean changed() {
            return !change.isEmpty();
        }
    }

    public static Result normalize(RawRow row) {
        int width = row.size();
        if (width == Column.COUNT) {
            return new Result(row, width, "");
        }
        var cells = new ArrayList<>(row.cells());
        if (width < Column.COUNT) {
            while (cells.size() < Column.COUNT) {
                cells.add("");
            }
            return new Result(row.withCells(cells), width,
                "padded %d missing cells".formatted(Column.COUNT - width));
        }

        while (cells.size() > Column.COUNT && cells.get(cells.size() - 1).isBlank()) {
            cells.remove(cells.size() - 1);
        }
        int overflow = cells.size() - Column.COUNT;
        if (overflow == 0) {
            return new Result(row.withCells(cells), width, "dropped %d empty trailing cells".formatted(width - Column.COUNT));
        }

        NodeKind kind = NodeKind.fromCode(row.cell(Column.NODE_TYPE)).orElse(NodeKind.DECISION);
        Column jsonColumn = kind == NodeKind.ACTION ? Column.PARAM_INPUT : Column.RICH_CONTENT;
        Column textColumn = kind == NodeKind.ACTION ? Column.DESCRIPTION : Column.MESSAGE;

        int target = -1;
        for (int i = jsonColumn.index(); i < cells.size() - overflow; i++) {
            if (cells.get(i).trim().startsWith("{")) {
                target = i;
                break;
            }
        }
        Column mergedInto = target >= 0 ? Column.at(target) : textColumn;
        if (target < 0) {
            target = textColumn.index();
        }

        List<String> merged = new ArrayList<>(cells.subList(0, target));
        merged.add(String.join(",", cells.subList(target, target + overflow + 1)));
        merged.addAll(cells.subList(target + overflow + 1, cells.size()));
        return new Result(row.withCells(merged), width,
            "merged %d overflow cells into %s".formatted(overflow, mergedInto.header()));
    }
}
