package dev.flowdoctor.repair;

import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;

import java.util.List;
import java.util.function.BiConsumer;

/**
 * The one deterministic fix for a diagnostic kind.
 *
 * <p>A rule re-checks the current state of each node it is pointed at and does nothing when the
 * problem is already gone, so applying it twice with the same diagnostics changes nothing.
 */
public interface RepairRule {

    DiagnosticKind kind();

    void apply(RepairContext context, List<Diagnostic> diagnostics);

    static RepairRule of(DiagnosticKind kind, BiConsumer<RepairContext, List<Diagnostic>> body) {
        return new RepairRule() {
            @Override
            public DiagnosticKind kind() {
                return kind;
            }

            @Override
            public void apply(RepairContext context, List<Diagnostic> diagnostics) {
                body.accept(context, diagnostics);
            }
        };
    }
}
