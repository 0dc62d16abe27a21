package dev.flowdoctor.engine;

import dev.flowdoctor.codec.RecordMapper;
import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.CommandOutputContract;
import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;
import dev.flowdoctor.model.FlowDocument;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.NodeIds;
import dev.flowdoctor.model.NodeKind;
import dev.flowdoctor.model.RawRow;
import dev.flowdoctor.model.Reference;
import dev.flowdoctor.model.SystemNodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Types raw rows and reports every structural problem it finds. Never mutates its input, and
 * returns identical diagnostics, in identical order, for identical input.
 */
public final class StructuralValidator {

    private static final Logger log = LoggerFactory.getLogger(StructuralValidator.class);

    private static final int PAYLOAD_PREVIEW = 40;

    private final CommandOutputContract contract;

    public StructuralValidator(CommandOutputContract contract) {
        this.contract = contract;
    }

    public static StructuralValidator withBuiltInContract() {
        return new StructuralValidator(CommandOutputContract.builtIn());
    }

    public CommandOutputContract contract() {
        return contract;
    }

    /**
     * Validate parsed rows. Header rows are skipped; rows whose node number is not a bare integer
     * are dropped into {@link ValidationReport#malformed()}.
     */
    public ValidationReport validate(List<RawRow> rows) {
        var records = new ArrayList<FlowNode>();
        var malformed = new ArrayList<RawRow>();
        var diagnostics = new ArrayList<Diagnostic>();

        for (RawRow raw : rows) {
            if (raw.isHeader()) {
                continue;
            }
            OptionalInt parsedId = NodeIds.parse(raw.cell(Column.NODE_NUMBER));
            if (parsedId.isEmpty()) {
                malformed.add(raw);
                String cell = raw.cell(Column.NODE_NUMBER).trim();
                diagnostics.add(Diagnostic.of(Diagnostic.DOCUMENT, Column.NODE_NUMBER, DiagnosticKind.NON_INTEGER_ID,
                    "line %d: %s".formatted(raw.lineNumber(), preview(cell)),
                    "row at line %d: node number '%s' is not an integer"
                        .formatted(raw.lineNumber(), preview(cell))));
                continue;
            }
            int id = parsedId.getAsInt();

            ColumnNormalizer.Result normalized = ColumnNormalizer.normalize(raw);
            RawRow row = normalized.row();
            if (normalized.changed()) {
                diagnostics.add(Diagnostic.of(id, null, DiagnosticKind.COLUMN_COUNT,
                    Integer.toString(normalized.originalWidth()),
                    "row had %d columns instead of %d, %s"
                        .formatted(normalized.originalWidth(), Column.COUNT, normalized.change())));
            }

            NodeKind kind = kindOf(id, row, diagnostics);
            checkRow(id, kind, row, diagnostics);
            records.add(RecordMapper.toNode(id, kind, row));
        }

        diagnostics.addAll(checkNodes(records));
        List<Diagnostic> ordered = diagnostics.stream().distinct().sorted(Diagnostic.ORDER).toList();
        log.debug("Validated {} rows: {} nodes, {} malformed, {} diagnostics",
            rows.size(), records.size(), malformed.size(), ordered.size());
        return new ValidationReport(records, malformed, ordered);
    }

    /**
     * Node-level and graph-level checks only, for documents that are already typed.
     */
    public ValidationReport validateNodes(List<FlowNode> nodes) {
        List<Diagnostic> ordered = checkNodes(nodes).stream().distinct().sorted(Diagnostic.ORDER).toList();
        return new ValidationReport(nodes, List.of(), ordered);
    }

    public ValidationReport validate(FlowDocument document) {
        return validateNodes(document.nodes());
    }

    private List<Diagnostic> checkNodes(List<FlowNode> nodes) {
        var diagnostics = new ArrayList<Diagnostic>();

        Map<Integer, Integer> counts = new LinkedHashMap<>();
        nodes.forEach(n -> counts.merge(n.id(), 1, Integer::sum));
        counts.forEach((id, count) -> {
            if (count > 1) {
                diagnostics.add(Diagnostic.of(id, Column.NODE_NUMBER, DiagnosticKind.DUPLICATE_ID,
                    Integer.toString(count), "node id %d is used by %d rows".formatted(id, count)));
            }
        });

        if (!counts.containsKey(FlowDocument.ENTRY_NODE)) {
            diagnostics.add(Diagnostic.of(FlowDocument.ENTRY_NODE, null, DiagnosticKind.MISSING_ENTRY_NODE, "",
                "entry node 1 is missing"));
        }
        for (int systemId : SystemNodes.required().keySet()) {
            if (!counts.containsKey(systemId)) {
                diagnostics.add(Diagnostic.of(systemId, null, DiagnosticKind.MISSING_SYSTEM_NODE,
                    Integer.toString(systemId), "required system node %d is missing".formatted(systemId)));
            }
        }

        for (FlowNode node : nodes) {
            diagnostics.addAll(NodeChecks.check(node, contract));
        }

        ReferenceGraph graph = ReferenceGraph.of(nodes);
        for (Reference orphan : graph.orphans()) {
            diagnostics.add(Diagnostic.of(orphan.source(), orphan.column(), DiagnosticKind.ORPHAN_REFERENCE,
                Integer.toString(orphan.target()),
                "%s references missing node %d".formatted(orphan.site(), orphan.target())));
        }
        for (FlowNode node : nodes) {
            if (node instanceof FlowNode.Decision d && isDeadEnd(d)) {
                diagnostics.add(Diagnostic.of(d.id(), Column.NEXT_NODES, DiagnosticKind.DEAD_END, "",
                    "decision node has no way to proceed"));
            }
        }

        diagnostics.addAll(VariableScope.analyze(nodes));
        return diagnostics;
    }

    public static boolean isDeadEnd(FlowNode.Decision d) {
        if (d.id() == SystemNodes.END_CHAT || d.hasBehavior(SystemNodes.XFER_TO_AGENT)) {
            return false;
        }
        return Reference.of(d).isEmpty();
    }

    private static NodeKind kindOf(int id, RawRow row, List<Diagnostic> diagnostics) {
        String rawType = row.cell(Column.NODE_TYPE).trim();
        Optional<NodeKind> declared = NodeKind.fromCode(rawType);
        if (declared.isPresent()) {
            return declared.get();
        }
        boolean looksLikeAction = !row.cell(Column.COMMAND).isBlank()
            || !row.cell(Column.WHAT_NEXT).isBlank()
            || !row.cell(Column.DECISION_VARIABLE).isBlank();
        NodeKind inferred = looksLikeAction ? NodeKind.ACTION : NodeKind.DECISION;
        diagnostics.add(Diagnostic.of(id, Column.NODE_TYPE, DiagnosticKind.UNKNOWN_NODE_TYPE, rawType,
            "node type '%s' is not D or A, read as %s".formatted(rawType, inferred.code())));
        return inferred;
    }

    private static void checkRow(int id, NodeKind kind, RawRow row, List<Diagnostic> diagnostics) {
        for (Column column : Column.values()) {
            String value = row.cell(column);
            if (!column.belongsTo(kind) && !value.isBlank()) {
                diagnostics.add(Diagnostic.of(id, column, DiagnosticKind.CROSS_KIND_FIELD, value,
                    "%s is not a %s field".formatted(column.header(), kind.name().toLowerCase(Locale.ROOT))));
            }
        }
        if (kind == NodeKind.DECISION) {
            for (Column flag : List.of(Column.NLU_DISABLED, Column.ANSWER_REQUIRED)) {
                RecordMapper.flag(row.cell(flag)).rejected().forEach(value ->
                    diagnostics.add(Diagnostic.of(id, flag, DiagnosticKind.INVALID_FLAG, value,
                        "%s must be 1, 0 or empty, found '%s'".formatted(flag.header(), value))));
            }
            RecordMapper.idList(row.cell(Column.NEXT_NODES)).rejected().forEach(token ->
                diagnostics.add(nonInteger(id, Column.NEXT_NODES, token)));
        } else {
            RecordMapper.routes(row.cell(Column.WHAT_NEXT)).rejected().forEach(token ->
                diagnostics.add(nonInteger(id, Column.WHAT_NEXT, token)));
            RecordMapper.nodeInput(row.cell(Column.NODE_INPUT)).rejected().forEach(token ->
                diagnostics.add(nonInteger(id, Column.NODE_INPUT, token)));
        }
    }

    private static Diagnostic nonInteger(int id, Column column, String token) {
        return Diagnostic.of(id, column, DiagnosticKind.NON_INTEGER_REFERENCE, token,
            "'%s' is not a valid node reference".formatted(token));
    }

    private static String preview(String text) {
        return text.length() <= PAYLOAD_PREVIEW ? text : text.substring(0, PAYLOAD_PREVIEW) + "...";
    }
}
