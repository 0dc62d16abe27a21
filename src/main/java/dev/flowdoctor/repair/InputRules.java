package dev.flowdoctor.repair;

import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;

import java.util.List;
import java.util.Locale;

/**
 * Row-level problems. The validator already normalized, dropped or typed these rows while
 * reading them, so the rules only record what was done to the input.
 */
final class InputRules {

    private InputRules() {}

    static List<RepairRule> rules() {
        return List.of(
            RepairRule.of(DiagnosticKind.COLUMN_COUNT, InputRules::columnCount),
            RepairRule.of(DiagnosticKind.NON_INTEGER_ID, InputRules::nonIntegerId),
            RepairRule.of(DiagnosticKind.UNKNOWN_NODE_TYPE, InputRules::unknownNodeType),
            RepairRule.of(DiagnosticKind.INVALID_FLAG, InputRules::invalidFlag),
            RepairRule.of(DiagnosticKind.CROSS_KIND_FIELD, InputRules::crossKindField)
        );
    }

    static void columnCount(RepairContext context, List<Diagnostic> diagnostics) {
        diagnostics.forEach(d -> context.fix(d.nodeId(), d.message()));
    }

    static void nonIntegerId(RepairContext context, List<Diagnostic> diagnostics) {
        diagnostics.forEach(d -> context.note("Dropped " + d.message()));
    }

    static void unknownNodeType(RepairContext context, List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            context.node(d.nodeId()).ifPresent(node -> context.fix(d.nodeId(),
                "node type '%s' set to %s".formatted(d.payload(), node.kind().code())));
        }
    }

    static void invalidFlag(RepairContext context, List<Diagnostic> diagnostics) {
        diagnostics.forEach(d -> context.fix(d.nodeId(),
            "cleared invalid %s value '%s'".formatted(d.field().header(), d.payload())));
    }

    static void crossKindField(RepairContext context, List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            context.node(d.nodeId()).ifPresent(node -> context.fix(d.nodeId(),
                "cleared %s ('%s'), which %s nodes cannot carry"
                    .formatted(d.field().header(), d.payload(), node.kind().name().toLowerCase(Locale.ROOT))));
        }
    }
}
