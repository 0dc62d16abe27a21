package dev.flowdoctor.repair;

import dev.flowdoctor.allocate.RemapResult;
import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;
import dev.flowdoctor.model.FlowDocument;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.SystemNodes;

import java.util.HashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Whole-document invariants: unique ids, the entry node and the system nodes.
 */
final class DocumentRules {

    static final String ENTRY_MESSAGE = "Hi! How can I help you today?";

    private DocumentRules() {}

    static List<RepairRule> rules() {
        return List.of(
            RepairRule.of(DiagnosticKind.DUPLICATE_ID, DocumentRules::duplicateIds),
            RepairRule.of(DiagnosticKind.MISSING_ENTRY_NODE, DocumentRules::missingEntryNode),
            RepairRule.of(DiagnosticKind.MISSING_SYSTEM_NODE, DocumentRules::missingSystemNodes)
        );
    }

    static void duplicateIds(RepairContext context, List<Diagnostic> diagnostics) {
        Set<Integer> seen = new HashSet<>();
        boolean duplicates = context.nodes().stream().anyMatch(n -> !seen.add(n.id()));
        if (!duplicates) {
            return;
        }
        RemapResult rechecked = context.allocator().recheck(context.nodes());
        context.replaceAll(rechecked.records());
        rechecked.warnings().forEach(context::note);
    }

    static void missingEntryNode(RepairContext context, List<Diagnostic> diagnostics) {
        Set<Integer> ids = context.ids();
        if (ids.contains(FlowDocument.ENTRY_NODE)) {
            return;
        }
        OptionalInt target = SystemNodes.menuNode(ids);
        if (target.isEmpty()) {
            target = ids.stream()
                .filter(id -> id > FlowDocument.ENTRY_NODE && !SystemNodes.isReserved(id))
                .mapToInt(Integer::intValue)
                .findFirst();
        }
        FlowNode.Decision entry = FlowNode.Decision.of(FlowDocument.ENTRY_NODE, "Start", ENTRY_MESSAGE);
        if (target.isPresent()) {
            entry = entry.withNextNodes(List.of(target.getAsInt()));
        } else {
            entry = entry.withRich("button", "Talk to Agent~" + SystemNodes.AGENT_TRANSFER).withAnswerRequired(true);
        }
        context.addFirst(entry);
        context.note(target.isPresent()
            ? "Injected missing entry node 1 routing to %d".formatted(target.getAsInt())
            : "Injected missing entry node 1 offering agent transfer");
    }

    static void missingSystemNodes(RepairContext context, List<Diagnostic> diagnostics) {
        for (Diagnostic d : diagnostics) {
            int id = d.nodeId();
            FlowNode template = SystemNodes.required().get(id);
            if (template == null || context.ids().contains(id)) {
                continue;
            }
            context.add(template);
            context.note("Injected missing required system node %d".formatted(id));
        }
    }
}
