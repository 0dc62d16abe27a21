package dev.flowdoctor.refine;

import dev.flowdoctor.codec.FlowCsvCodec;
import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.RawRow;
import dev.flowdoctor.model.RefinementSettings;

import java.util.List;

/**
 * Rejects generated documents that are structurally worse than their input: too many rows added
 * or removed, or too many rows with the wrong column count.
 */
public final class RefinementGuardRails {

    private final RefinementSettings settings;

    public RefinementGuardRails(RefinementSettings settings) {
        this.settings = settings;
    }

    /** Outcome of a check; {@code reason} is empty when accepted. */
    public record Verdict(boolean accepted, String reason) {
        static Verdict accept() {
            return new Verdict(true, "");
        }

        static Verdict reject(String reason) {
            return new Verdict(false, reason);
        }
    }

    public Verdict check(String before, String after) {
        List<RawRow> afterRows = FlowCsvCodec.parse(after);
        int beforeCount = nodeRows(FlowCsvCodec.parse(before));
        int afterCount = nodeRows(afterRows);
        int difference = Math.abs(afterCount - beforeCount);
        double ratio = beforeCount == 0 ? (afterCount == 0 ? 0.0 : 1.0) : (double) difference / beforeCount;
        if (ratio > settings.rowChangeRatio() && difference > settings.rowChangeAbsolute()) {
            return Verdict.reject("row count changed too much (%d -> %d, %.1f%%)"
                .formatted(beforeCount, afterCount, ratio * 100));
        }

        long misaligned = afterRows.stream()
            .filter(row -> !row.isHeader())
            .filter(row -> row.size() != Column.COUNT)
            .count();
        if (misaligned > settings.misalignedRowLimit()) {
            return Verdict.reject("%d rows have a column count other than %d".formatted(misaligned, Column.COUNT));
        }
        return Verdict.accept();
    }

    /** Rows other than the header; a quoted cell spanning several lines is still one row. */
    static int nodeRows(List<RawRow> rows) {
        return (int) rows.stream().filter(row -> !row.isHeader()).count();
    }
}
