package dev.flowdoctor.refine;

import dev.flowdoctor.backend.ExternalError;
import dev.flowdoctor.codec.FlowCsvCodec;
import dev.flowdoctor.codec.RecordMapper;
import dev.flowdoctor.engine.ButtonText;
import dev.flowdoctor.engine.NodeChecks;
import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.NodeIds;
import dev.flowdoctor.model.RawRow;
import dev.flowdoctor.model.Route;
import dev.flowdoctor.model.SystemNodes;
import dev.flowdoctor.repair.ParamInputs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Narrow fixes keyed on the wording of a validator error. Each heuristic edits only the cells
 * the error points at; an error no heuristic recognizes leaves the document unchanged.
 */
public final class ProgrammaticFixer {

    private static final Logger log = LoggerFactory.getLogger(ProgrammaticFixer.class);

    static final String DEFAULT_DECISION_VARIABLE = "success";

    /**
     * Apply the heuristic matching the error, if any.
     *
     * @return the fixed document, or {@code csv} itself when nothing applied
     */
    public String fix(String csv, ExternalError error) {
        String description = error.message().toLowerCase(Locale.ROOT);
        Optional<Column> field = Column.byName(error.field());

        if (description.contains("pipe character") || description.contains("button construction")) {
            return rewriteRows(csv, row -> fixButtonText(row, error.fieldEntry()));
        }
        if (description.contains("nlu disabled") && description.contains("one child")) {
            return rewriteNode(csv, error, row -> row.with(Column.NLU_DISABLED, ""));
        }
        if (field.filter(Column.PARAM_INPUT::equals).isPresent()
            && (description.contains("json input error") || description.contains("expecting property name")
                || description.contains("expecting input"))) {
            return rewriteNode(csv, error, ProgrammaticFixer::fixParamInput);
        }
        if (description.contains("dir_field")) {
            return rewriteNode(csv, error, ProgrammaticFixer::fixDecisionVariable);
        }
        if (description.contains("capital letters")) {
            return rewriteNode(csv, error, ProgrammaticFixer::fixVariableCase);
        }
        if (description.contains("ans_req") && description.contains("1")) {
            return rewriteNode(csv, error, row -> row.with(Column.ANSWER_REQUIRED, "1"));
        }
        if (description.contains("not an integer") && field.filter(Column.NODE_NUMBER::equals).isPresent()) {
            return dropNonIntegerRows(csv);
        }
        return csv;
    }

    /**
     * Whether the error's node still holds the offending text. Checks only the reported column
     * when it is known. Errors without a node or without field content cannot be verified and
     * count as gone.
     */
    public boolean isErrorStillPresent(String csv, ExternalError error) {
        if (error.nodeId() == null || error.fieldEntry().isEmpty()) {
            return false;
        }
        Optional<Column> column = Column.byName(error.field());
        for (RawRow row : FlowCsvCodec.parse(csv)) {
            if (!isNode(row, error.nodeId())) {
                continue;
            }
            if (column.isPresent()) {
                return row.cell(column.get()).contains(error.fieldEntry());
            }
            return row.cells().stream().anyMatch(cell -> cell.contains(error.fieldEntry()));
        }
        return false;
    }

    private static RawRow fixButtonText(RawRow row, String entry) {
        String content = row.cell(Column.RICH_CONTENT);
        if (content.isEmpty() || entry.isEmpty() || !content.contains(entry)) {
            return row;
        }
        String normalized = ButtonText.normalize(content);
        return normalized.equals(content) ? row : row.with(Column.RICH_CONTENT, normalized);
    }

    private static RawRow fixParamInput(RawRow row) {
        String param = row.cell(Column.PARAM_INPUT).trim();
        if (param.isEmpty()) {
            return row;
        }
        Optional<String> normalized = ParamInputs.normalize(param);
        if (normalized.isEmpty()) {
            log.debug("Parameter Input of node {} is unrecoverable, leaving it for the repairer",
                row.cell(Column.NODE_NUMBER));
            return row;
        }
        return row.with(Column.PARAM_INPUT, normalized.get());
    }

    private static RawRow fixDecisionVariable(RawRow row) {
        RawRow fixed = row.with(Column.DECISION_VARIABLE, DEFAULT_DECISION_VARIABLE);
        List<Route> routes = RecordMapper.routes(row.cell(Column.WHAT_NEXT)).value();
        boolean routesOnSuccess = routes.stream().anyMatch(r -> "true".equalsIgnoreCase(r.value()));
        if (routesOnSuccess) {
            return fixed;
        }
        int target = routes.stream()
            .filter(r -> !r.isError())
            .mapToInt(Route::target)
            .findFirst()
            .orElse(SystemNodes.RETURN_TO_MENU);
        List<Route> rewritten = List.of(
            new Route("true", target),
            new Route("false", SystemNodes.ERROR_MESSAGE),
            new Route("error", SystemNodes.ERROR_MESSAGE));
        return fixed.with(Column.WHAT_NEXT, RecordMapper.renderRoutes(rewritten));
    }

    private static RawRow fixVariableCase(RawRow row) {
        String variables = row.cell(Column.VARIABLE).trim();
        if (variables.isEmpty()) {
            return row;
        }
        String canonical = RecordMapper.variables(variables).stream()
            .map(NodeChecks::canonicalVariable)
            .distinct()
            .collect(Collectors.joining(","));
        return row.with(Column.VARIABLE, canonical);
    }

    private static String dropNonIntegerRows(String csv) {
        List<RawRow> rows = FlowCsvCodec.parse(csv);
        var kept = new ArrayList<RawRow>();
        for (RawRow row : rows) {
            if (row.isHeader() || NodeIds.parse(row.cell(Column.NODE_NUMBER)).isPresent()) {
                kept.add(row);
            } else {
                log.debug("Dropping row at line {} with node number '{}'", row.lineNumber(), row.cell(Column.NODE_NUMBER));
            }
        }
        return kept.size() == rows.size() ? csv : FlowCsvCodec.serialize(kept);
    }

    private static String rewriteNode(String csv, ExternalError error, UnaryOperator<RawRow> change) {
        if (error.nodeId() == null) {
            return csv;
        }
        int nodeId = error.nodeId();
        return rewriteRows(csv, row -> isNode(row, nodeId) ? change.apply(row) : row);
    }

    private static String rewriteRows(String csv, UnaryOperator<RawRow> change) {
        List<RawRow> rows = FlowCsvCodec.parse(csv);
        var rewritten = new ArrayList<RawRow>(rows.size());
        boolean changed = false;
        for (RawRow row : rows) {
            RawRow updated = row.isHeader() ? row : change.apply(row);
            changed |= !updated.equals(row);
            rewritten.add(updated);
        }
        return changed ? FlowCsvCodec.serialize(rewritten) : csv;
    }

    private static boolean isNode(RawRow row, int nodeId) {
        OptionalInt id = NodeIds.parse(row.cell(Column.NODE_NUMBER));
        return id.isPresent() && id.getAsInt() == nodeId;
    }
}
