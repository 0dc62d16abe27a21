package dev.flowdoctor.repair;

import dev.flowdoctor.allocate.NodeAllocator;
import dev.flowdoctor.engine.ValidationReport;
import dev.flowdoctor.model.CommandOutputContract;
import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;
import dev.flowdoctor.model.FlowNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Applies one deterministic rule per diagnostic kind, in a fixed order: row-level records first,
 * then document invariants, rich content, routing, references and finally variables. Later rules
 * see the nodes earlier rules produced, so fallbacks resolve against injected system nodes.
 */
public final class RepairEngine {

    private static final Logger log = LoggerFactory.getLogger(RepairEngine.class);

    static final List<DiagnosticKind> APPLICATION_ORDER = List.of(
        DiagnosticKind.COLUMN_COUNT,
        DiagnosticKind.NON_INTEGER_ID,
        DiagnosticKind.UNKNOWN_NODE_TYPE,
        DiagnosticKind.INVALID_FLAG,
        DiagnosticKind.CROSS_KIND_FIELD,
        DiagnosticKind.DUPLICATE_ID,
        DiagnosticKind.MISSING_ENTRY_NODE,
        DiagnosticKind.MISSING_SYSTEM_NODE,
        DiagnosticKind.MALFORMED_RICH_JSON,
        DiagnosticKind.ROOT_LEVEL_DEST,
        DiagnosticKind.RICH_TYPE_MISMATCH,
        DiagnosticKind.DEST_TYPE,
        DiagnosticKind.PIPE_FORMAT,
        DiagnosticKind.PICKER_CONSTRAINT,
        DiagnosticKind.FILE_UPLOAD_PROPERTIES,
        DiagnosticKind.DYNAMIC_EMBED,
        DiagnosticKind.TRANSFER_WITH_NEXT_NODES,
        DiagnosticKind.NLU_MULTI_DESTINATION,
        DiagnosticKind.EMPTY_COMMAND,
        DiagnosticKind.MISSING_DECISION_VARIABLE,
        DiagnosticKind.MALFORMED_PARAM_INPUT,
        DiagnosticKind.ROUTING_GAP,
        DiagnosticKind.MISSING_ERROR_PATH,
        DiagnosticKind.NON_INTEGER_REFERENCE,
        DiagnosticKind.DEAD_END,
        DiagnosticKind.ORPHAN_REFERENCE,
        DiagnosticKind.VARIABLE_CASE,
        DiagnosticKind.UNDECLARED_ASSIGNED_VARIABLE,
        DiagnosticKind.UNBOUND_VARIABLE
    );

    private final List<RepairRule> rules;
    private final CommandOutputContract contract;
    private final NodeAllocator allocator;

    public RepairEngine(CommandOutputContract contract, NodeAllocator allocator) {
        this.contract = contract;
        this.allocator = allocator;
        this.rules = inApplicationOrder(Stream.of(
                InputRules.rules(),
                DocumentRules.rules(),
                RichContentRules.rules(),
                RoutingRules.rules(),
                VariableRules.rules())
            .flatMap(List::stream)
            .toList());
    }

    public static RepairEngine withDefaults() {
        return new RepairEngine(CommandOutputContract.builtIn(), NodeAllocator.withDefaultBands());
    }

    public List<RepairRule> rules() {
        return rules;
    }

    public RepairResult repair(ValidationReport report) {
        return repair(report.records(), report.diagnostics());
    }

    /**
     * Repair the records for the given diagnostics. The input list is not modified.
     */
    public RepairResult repair(List<FlowNode> records, List<Diagnostic> diagnostics) {
        Map<DiagnosticKind, List<Diagnostic>> byKind = new EnumMap<>(DiagnosticKind.class);
        for (Diagnostic diagnostic : diagnostics) {
            byKind.computeIfAbsent(diagnostic.kind(), k -> new ArrayList<>()).add(diagnostic);
        }

        RepairContext context = new RepairContext(records, contract, allocator);
        for (RepairRule rule : rules) {
            List<Diagnostic> found = byKind.get(rule.kind());
            if (found == null) {
                continue;
            }
            int before = context.fixLog().size();
            rule.apply(context, found);
            log.debug("{}: {} diagnostic(s), {} fix(es)", rule.kind(), found.size(),
                context.fixLog().size() - before);
        }

        if (!context.fixLog().isEmpty()) {
            log.info("Applied {} fix(es) for {} diagnostic(s)", context.fixLog().size(), diagnostics.size());
        }
        return new RepairResult(context.nodes(), context.fixLog());
    }

    private static List<RepairRule> inApplicationOrder(List<RepairRule> available) {
        requireOneRulePerKind(available);
        Map<DiagnosticKind, RepairRule> byKind = new EnumMap<>(DiagnosticKind.class);
        available.forEach(rule -> byKind.put(rule.kind(), rule));
        return APPLICATION_ORDER.stream().map(byKind::get).toList();
    }

    private static void requireOneRulePerKind(List<RepairRule> rules) {
        Map<DiagnosticKind, Integer> counts = new EnumMap<>(DiagnosticKind.class);
        rules.forEach(rule -> counts.merge(rule.kind(), 1, Integer::sum));
        for (DiagnosticKind kind : DiagnosticKind.values()) {
            int count = counts.getOrDefault(kind, 0);
            if (count != 1) {
                throw new IllegalStateException("Expected exactly one repair rule for %s, found %d".formatted(kind, count));
            }
        }
    }
}
