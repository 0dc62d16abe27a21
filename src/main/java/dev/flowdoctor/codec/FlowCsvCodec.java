package dev.flowdoctor.codec;

import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.FlowDocument;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.RawRow;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tokenizer and writer for the flow CSV dialect.
 *
 * <p>Parsing never fails. Each line is one row; a double quote at the start of a cell opens a
 * quoted cell in which {@code ""} is a literal quote and commas are data. A quoted cell may span
 * lines, unless the next line already looks like the start of a new node row, in which case the
 * stray quote is closed at the line end. Rows are returned with whatever cell count they had.
 */
public final class FlowCsvCodec {

    private static final char BOM = '\uFEFF';
    private static final Pattern ROW_START = Pattern.compile("^\\s*-?\\d{1,6}\\s*,\\s*[DAda]\\s*,");

    private FlowCsvCodec() {}

    public static List<RawRow> parse(String text) {
        var rows = new ArrayList<RawRow>();
        if (text == null || text.isEmpty()) {
            return rows;
        }
        String input = text.charAt(0) == BOM ? text.substring(1) : text;

        var cells = new ArrayList<String>();
        var cell = new StringBuilder();
        boolean inQuotes = false;
        boolean cellStart = true;
        int line = 1;
        int rowLine = 1;

        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < input.length() && input.charAt(i + 1) == '"') {
                        cell.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else if (c == '\n' || (c == '\r' && next(input, i) == '\n')) {
                    int newline = c == '\r' ? i + 1 : i;
                    if (continuesQuotedCell(input, newline + 1, cells.size())) {
                        if (c == '\r') {
                            i++;
                        }
                        cell.append('\n');
                        line++;
                    } else {
                        inQuotes = false;
                        i = newline;
                        endRow(rows, cells, cell, rowLine);
                        cells = new ArrayList<>();
                        cell = new StringBuilder();
                        cellStart = true;
                        line++;
                        rowLine = line;
                    }
                } else {
                    cell.append(c);
                }
                continue;
            }
            switch (c) {
                case ',' -> {
                    cells.add(cell.toString());
                    cell = new StringBuilder();
                    cellStart = true;
                }
                case '\r' -> {
                    if (next(input, i) != '\n') {
                        cell.append(c);
                        cellStart = false;
                    }
                }
                case '\n' -> {
                    endRow(rows, cells, cell, rowLine);
                    cells = new ArrayList<>();
                    cell = new StringBuilder();
                    cellStart = true;
                    line++;
                    rowLine = line;
                }
                case '"' -> {
                    if (cellStart) {
                        inQuotes = true;
                    } else {
                        cell.append(c);
                    }
                    cellStart = false;
                }
                default -> {
                    cell.append(c);
                    cellStart = false;
                }
            }
        }
        endRow(rows, cells, cell, rowLine);
        return rows;
    }

    /** One row as a line of text, quoting cells that need it. */
    public static String serialize(RawRow row) {
        return row.cells().stream().map(FlowCsvCodec::quote).collect(Collectors.joining(","));
    }

    public static String serialize(List<RawRow> rows) {
        return rows.stream().map(FlowCsvCodec::serialize).collect(Collectors.joining("\n"));
    }

    /** Header row followed by one canonical row per node, in document order. */
    public static String write(FlowDocument document) {
        var rows = new ArrayList<RawRow>();
        rows.add(RawRow.header());
        int line = 2;
        for (FlowNode node : document.nodes()) {
            rows.add(RecordMapper.toRow(node, line++));
        }
        return serialize(rows);
    }

    static String quote(String cell) {
        if (cell.indexOf(',') < 0 && cell.indexOf('"') < 0
            && cell.indexOf('\n') < 0 && cell.indexOf('\r') < 0) {
            return cell;
        }
        return "\"" + cell.replace("\"", "\"\"") + "\"";
    }

    private static char next(String input, int i) {
        return i + 1 < input.length() ? input.charAt(i + 1) : 0;
    }

    private static boolean continuesQuotedCell(String input, int nextLineStart, int cellsSoFar) {
        if (nextLineStart >= input.length() || cellsSoFar >= Column.COUNT) {
            return false;
        }
        int end = input.indexOf('\n', nextLineStart);
        String nextLine = end < 0 ? input.substring(nextLineStart) : input.substring(nextLineStart, end);
        return !ROW_START.matcher(nextLine).find();
    }

    private static void endRow(List<RawRow> rows, List<String> cells, StringBuilder cell, int lineNumber) {
        cells.add(cell.toString());
        boolean blank = cells.size() == 1 && cells.get(0).isBlank();
        if (!blank) {
            rows.add(new RawRow(lineNumber, cells));
        }
    }
}
