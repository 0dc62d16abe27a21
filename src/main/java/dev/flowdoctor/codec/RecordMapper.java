package dev.flowdoctor.codec;

import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.NodeIds;
import dev.flowdoctor.model.NodeKind;
import dev.flowdoctor.model.NodeMeta;
import dev.flowdoctor.model.RawRow;
import dev.flowdoctor.model.Route;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Converts between 26-cell rows and typed nodes.
 *
 * <p>Cell parsers are lenient: next nodes and node input accept {@code ,} or {@code |} separators,
 * and tokens that cannot be read are reported as rejected instead of failing. Rendering is
 * canonical: lists joined with {@code |}, behaviors and variables with {@code ,}, flags as
 * {@code 1}/{@code 0}/empty.
 */
public final class RecordMapper {

    private static final Pattern LIST_SEPARATOR = Pattern.compile("[,|]");
    private static final Set<String> TRUE_FLAGS = Set.of("1", "true", "yes", "y");
    private static final Set<String> FALSE_FLAGS = Set.of("0", "false", "no", "n");

    private RecordMapper() {}

    /**
     * A parsed cell plus the tokens that could not be read.
     */
    public record Parsed<T>(T value, List<String> rejected) {
        public Parsed {
            rejected = List.copyOf(rejected);
        }

        public boolean clean() {
            return rejected.isEmpty();
        }
    }

    public static FlowNode toNode(int id, NodeKind kind, RawRow row) {
        NodeMeta meta = new NodeMeta(
            row.cell(Column.INTENT).trim(),
            row.cell(Column.NODE_TAGS).trim(),
            row.cell(Column.SKILL_TAG).trim(),
            variables(row.cell(Column.VARIABLE)),
            row.cell(Column.PLATFORM_FLAG).trim(),
            row.cell(Column.FLOWS).trim(),
            row.cell(Column.CSS_CLASSNAME).trim());
        String name = row.cell(Column.NODE_NAME).trim();
        if (kind == NodeKind.DECISION) {
            return new FlowNode.Decision(id, name, meta,
                row.cell(Column.ENTITY_TYPE).trim(),
                row.cell(Column.ENTITY).trim(),
                flag(row.cell(Column.NLU_DISABLED)).value(),
                idList(row.cell(Column.NEXT_NODES)).value(),
                row.cell(Column.MESSAGE),
                row.cell(Column.RICH_TYPE).trim(),
                row.cell(Column.RICH_CONTENT).trim(),
                flag(row.cell(Column.ANSWER_REQUIRED)).value(),
                tokens(row.cell(Column.BEHAVIORS)));
        }
        return new FlowNode.Action(id, name, meta,
            row.cell(Column.COMMAND).trim(),
            row.cell(Column.DESCRIPTION),
            row.cell(Column.OUTPUT).trim(),
            nodeInput(row.cell(Column.NODE_INPUT)).value(),
            row.cell(Column.PARAM_INPUT).trim(),
            row.cell(Column.DECISION_VARIABLE).trim(),
            routes(row.cell(Column.WHAT_NEXT)).value());
    }

    public static RawRow toRow(FlowNode node, int lineNumber) {
        String[] cells = new String[Column.COUNT];
        Arrays.fill(cells, "");
        cells[Column.NODE_NUMBER.index()] = Integer.toString(node.id());
        cells[Column.NODE_TYPE.index()] = node.kind().code();
        cells[Column.NODE_NAME.index()] = node.name();

        NodeMeta meta = node.meta();
        cells[Column.INTENT.index()] = meta.intent();
        cells[Column.NODE_TAGS.index()] = meta.tags();
        cells[Column.SKILL_TAG.index()] = meta.skillTag();
        cells[Column.VARIABLE.index()] = String.join(",", meta.variables());
        cells[Column.PLATFORM_FLAG.index()] = meta.platformFlag();
        cells[Column.FLOWS.index()] = meta.flows();
        cells[Column.CSS_CLASSNAME.index()] = meta.cssClass();

        if (node instanceof FlowNode.Decision d) {
            cells[Column.ENTITY_TYPE.index()] = d.entityType();
            cells[Column.ENTITY.index()] = d.entity();
            cells[Column.NLU_DISABLED.index()] = renderFlag(d.nluDisabled());
            cells[Column.NEXT_NODES.index()] = renderIds(d.nextNodes());
            cells[Column.MESSAGE.index()] = d.message();
            cells[Column.RICH_TYPE.index()] = d.richType();
            cells[Column.RICH_CONTENT.index()] = d.richContent();
            cells[Column.ANSWER_REQUIRED.index()] = renderFlag(d.answerRequired());
            cells[Column.BEHAVIORS.index()] = String.join(",", d.behaviors());
        } else if (node instanceof FlowNode.Action a) {
            cells[Column.COMMAND.index()] = a.command();
            cells[Column.DESCRIPTION.index()] = a.description();
            cells[Column.OUTPUT.index()] = a.outputVar();
            cells[Column.NODE_INPUT.index()] = renderNodeInput(a.nodeInput());
            cells[Column.PARAM_INPUT.index()] = a.paramInput();
            cells[Column.DECISION_VARIABLE.index()] = a.decisionVar();
            cells[Column.WHAT_NEXT.index()] = renderRoutes(a.whatNext());
        }
        return new RawRow(lineNumber, List.of(cells));
    }

    /** {@code 1/true/yes} and {@code 0/false/no}; empty is null; anything else is rejected and null. */
    public static Parsed<Boolean> flag(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (value.isEmpty()) {
            return new Parsed<>(null, List.of());
        }
        if (TRUE_FLAGS.contains(value)) {
            return new Parsed<>(Boolean.TRUE, List.of());
        }
        if (FALSE_FLAGS.contains(value)) {
            return new Parsed<>(Boolean.FALSE, List.of());
        }
        return new Parsed<>(null, List.of(raw.trim()));
    }

    public static Parsed<List<Integer>> idList(String raw) {
        var ids = new ArrayList<Integer>();
        var rejected = new ArrayList<String>();
        for (String token : split(raw)) {
            OptionalInt id = NodeIds.parse(token);
            if (id.isPresent()) {
                ids.add(id.getAsInt());
            } else {
                rejected.add(token);
            }
        }
        return new Parsed<>(ids, rejected);
    }

    public static Parsed<List<Route>> routes(String raw) {
        var routes = new ArrayList<Route>();
        var rejected = new ArrayList<String>();
        for (String token : split(raw)) {
            int tilde = token.lastIndexOf('~');
            OptionalInt target = tilde < 0 ? OptionalInt.empty() : NodeIds.parse(token.substring(tilde + 1));
            String value = tilde < 0 ? "" : token.substring(0, tilde).trim();
            if (target.isPresent() && !value.isEmpty()) {
                routes.add(new Route(value, target.getAsInt()));
            } else {
                rejected.add(token);
            }
        }
        return new Parsed<>(routes, rejected);
    }

    /** {@code NAME:nodeId} pairs. */
    public static Parsed<Map<String, Integer>> nodeInput(String raw) {
        var bindings = new LinkedHashMap<String, Integer>();
        var rejected = new ArrayList<String>();
        for (String token : split(raw)) {
            int colon = token.lastIndexOf(':');
            OptionalInt source = colon < 0 ? OptionalInt.empty() : NodeIds.parse(token.substring(colon + 1));
            String name = colon < 0 ? "" : token.substring(0, colon).trim();
            if (source.isPresent() && !name.isEmpty()) {
                bindings.put(name, source.getAsInt());
            } else {
                rejected.add(token);
            }
        }
        return new Parsed<>(bindings, rejected);
    }

    public static Set<String> tokens(String raw) {
        return new LinkedHashSet<>(split(raw));
    }

    public static Set<String> variables(String raw) {
        return new LinkedHashSet<>(split(raw));
    }

    public static String renderFlag(Boolean value) {
        if (value == null) {
            return "";
        }
        return value ? "1" : "0";
    }

    public static String renderIds(List<Integer> ids) {
        return ids.stream().map(String::valueOf).collect(Collectors.joining("|"));
    }

    public static String renderRoutes(List<Route> routes) {
        return routes.stream().map(Route::render).collect(Collectors.joining("|"));
    }

    public static String renderNodeInput(Map<String, Integer> bindings) {
        return bindings.entrySet().stream()
            .map(e -> e.getKey() + ":" + e.getValue())
            .collect(Collectors.joining("|"));
    }

    private static List<String> split(String raw) {
        var tokens = new ArrayList<String>();
        if (raw == null || raw.isBlank()) {
            return tokens;
        }
        for (String token : LIST_SEPARATOR.split(raw)) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                tokens.add(trimmed);
            }
        }
        return tokens;
    }
}
