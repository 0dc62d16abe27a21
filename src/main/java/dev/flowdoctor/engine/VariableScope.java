package dev.flowdoctor.engine;

import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.SystemVariables;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Variable availability, walked in ascending node id order.
 *
 * <p>A name is available at node N when a node with id at most N declares it in its Variable
 * column, when N binds it through Node Input, or when it is a system variable. Names compare
 * case-insensitively.
 */
public final class VariableScope {

    public static final Pattern REFERENCE = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)\\}");

    private VariableScope() {}

    /** {@code {NAME}} references in the text, in order of appearance, without duplicates. */
    public static List<String> references(String text) {
        var names = new LinkedHashSet<String>();
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        Matcher matcher = REFERENCE.matcher(text);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return List.copyOf(names);
    }

    /** Fields of a node that may reference variables, with their current text. */
    public static Map<Column, String> referencingFields(FlowNode node) {
        if (node instanceof FlowNode.Decision d) {
            return Map.of(Column.MESSAGE, d.message(), Column.RICH_CONTENT, d.richContent());
        }
        FlowNode.Action a = (FlowNode.Action) node;
        return Map.of(Column.PARAM_INPUT, a.paramInput());
    }

    public static List<Diagnostic> analyze(List<FlowNode> nodes) {
        var diagnostics = new ArrayList<Diagnostic>();
        var declared = new HashSet<String>();
        SystemVariables.NAMES.forEach(name -> declared.add(key(name)));

        List<FlowNode> ordered = nodes.stream().sorted(Comparator.comparingInt(FlowNode::id)).toList();
        int i = 0;
        while (i < ordered.size()) {
            int id = ordered.get(i).id();
            int end = i;
            while (end < ordered.size() && ordered.get(end).id() == id) {
                ordered.get(end).meta().variables().forEach(v -> declared.add(key(v)));
                end++;
            }
            for (FlowNode node : ordered.subList(i, end)) {
                Set<String> local = new HashSet<>(declared);
                if (node instanceof FlowNode.Action a) {
                    a.nodeInput().keySet().forEach(name -> local.add(key(name)));
                }
                for (Column field : List.of(Column.MESSAGE, Column.RICH_CONTENT, Column.PARAM_INPUT)) {
                    String text = referencingFields(node).get(field);
                    if (text == null) {
                        continue;
                    }
                    for (String name : references(text)) {
                        if (!local.contains(key(name))) {
                            diagnostics.add(Diagnostic.of(id, field, DiagnosticKind.UNBOUND_VARIABLE, name,
                                "variable {%s} is not available at this node".formatted(name)));
                        }
                    }
                }
            }
            i = end;
        }
        return diagnostics;
    }

    static String key(String name) {
        return name.trim().toUpperCase(Locale.ROOT);
    }
}
