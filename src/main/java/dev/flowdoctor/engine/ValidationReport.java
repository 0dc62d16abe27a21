package dev.flowdoctor.engine;

import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.RawRow;

import java.util.List;

/**
 * Output of the structural validator.
 *
 * @param records     typed nodes, in input order; ids may repeat
 * @param malformed   rows dropped because they are not nodes
 * @param diagnostics findings in deterministic order
 */
public record ValidationReport(List<FlowNode> records, List<RawRow> malformed, List<Diagnostic> diagnostics) {

    public ValidationReport {
        records = List.copyOf(records);
        malformed = List.copyOf(malformed);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isClean() {
        return diagnostics.isEmpty();
    }

    public List<Diagnostic> ofKind(DiagnosticKind kind) {
        return diagnostics.stream().filter(d -> d.kind() == kind).toList();
    }

    public boolean has(DiagnosticKind kind) {
        return diagnostics.stream().anyMatch(d -> d.kind() == kind);
    }
}
