package dev.flowdoctor.model;

import java.util.Comparator;

/**
 * One finding of the structural validator.
 *
 * @param nodeId  the node concerned, or {@link #DOCUMENT} for row- and document-level findings
 * @param field   the column concerned; may be null for whole-row findings
 * @param kind    what is wrong
 * @param payload the offending token or value, enough for a repair rule to act on
 * @param message human-readable description
 */
public record Diagnostic(int nodeId, Column field, DiagnosticKind kind, String payload, String message) {

    public static final int DOCUMENT = Integer.MIN_VALUE;

    public static final Comparator<Diagnostic> ORDER = Comparator
        .comparingInt(Diagnostic::nodeId)
        .thenComparingInt(d -> d.field() == null ? -1 : d.field().ordinal())
        .thenComparing(Diagnostic::kind)
        .thenComparing(Diagnostic::payload);

    public Diagnostic {
        payload = payload == null ? "" : payload;
        message = message == null ? "" : message;
    }

    public static Diagnostic of(int nodeId, Column field, DiagnosticKind kind, String payload, String message) {
        return new Diagnostic(nodeId, field, kind, payload, message);
    }

    public ErrorCategory category() {
        return kind.category();
    }

    @Override
    public String toString() {
        String where = nodeId == DOCUMENT ? "document" : "node " + nodeId;
        String column = field == null ? "" : " [" + field.header() + "]";
        return "%s%s %s: %s".formatted(where, column, kind, message);
    }
}
