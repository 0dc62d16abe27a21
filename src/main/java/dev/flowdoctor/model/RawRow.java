package dev.flowdoctor.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One physical line of flow CSV split into untyped cells.
 * The cell count is whatever the line contained; nothing is validated here.
 */
public record RawRow(int lineNumber, List<String> cells) {

    public RawRow {
        cells = List.copyOf(cells);
    }

    public static RawRow of(int lineNumber, String... cells) {
        return new RawRow(lineNumber, List.of(cells));
    }

    public int size() {
        return cells.size();
    }

    /** Cell at index, or empty string when the row is too short. */
    public String cell(int index) {
        return index < cells.size() ? cells.get(index) : "";
    }

    public String cell(Column column) {
        return cell(column.index());
    }

    public boolean isHeader() {
        return !cells.isEmpty() && Column.NODE_NUMBER.header().equalsIgnoreCase(cells.get(0).trim());
    }

    public RawRow withCells(List<String> newCells) {
        return new RawRow(lineNumber, newCells);
    }

    public RawRow with(Column column, String value) {
        var copy = new ArrayList<>(cells);
        while (copy.size() <= column.index()) {
            copy.add("");
        }
        copy.set(column.index(), value);
        return new RawRow(lineNumber, copy);
    }

    public static RawRow header() {
        return new RawRow(1, Column.headers());
    }
}
