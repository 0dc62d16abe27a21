package dev.flowdoctor.repair;

import com.fasterxml.jackson.databind.JsonNode;
import dev.flowdoctor.engine.NodeChecks;
import dev.flowdoctor.engine.VariableScope;
import dev.flowdoctor.json.LenientJson;
import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;
import dev.flowdoctor.model.FlowNode;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static dev.flowdoctor.repair.RichContentRules.distinctNodes;

/**
 * Parameter input JSON and variable declarations, bindings and references.
 */
final class VariableRules {

    private VariableRules() {}

    static List<RepairRule> rules() {
        return List.of(
            RepairRule.of(DiagnosticKind.MALFORMED_PARAM_INPUT, VariableRules::malformedParamInput),
            RepairRule.of(DiagnosticKind.VARIABLE_CASE, VariableRules::variableCase),
            RepairRule.of(DiagnosticKind.UNDECLARED_ASSIGNED_VARIABLE, VariableRules::undeclaredAssigned),
            RepairRule.of(DiagnosticKind.UNBOUND_VARIABLE, VariableRules::unbound)
        );
    }

    static void malformedParamInput(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                if (!(node instanceof FlowNode.Action a) || a.paramInput().isBlank()
                    || LenientJson.parseStrict(a.paramInput().trim()).map(JsonNode::isObject).orElse(false)) {
                    return;
                }
                Optional<String> normalized = ParamInputs.normalize(a.paramInput());
                if (normalized.isEmpty()) {
                    return;
                }
                context.updateAction(id, an -> an.withParamInput(normalized.get()),
                    "repaired Parameter Input JSON: " + normalized.get());
            });
        }
    }

    static void variableCase(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                var canonical = new LinkedHashSet<String>();
                node.meta().variables().forEach(v -> canonical.add(NodeChecks.canonicalVariable(v)));
                if (canonical.equals(node.meta().variables())) {
                    return;
                }
                context.update(id, n -> n.withMeta(n.meta().withVariables(canonical)),
                    "converted Variable to ALL_CAPS: " + String.join(",", canonical));
            });
        }
    }

    static void undeclaredAssigned(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                if (!(node instanceof FlowNode.Action a)) {
                    return;
                }
                Set<String> declared = new LinkedHashSet<>();
                a.meta().variables().forEach(v -> declared.add(NodeChecks.canonicalVariable(v)));
                var variables = new LinkedHashSet<>(a.meta().variables());
                var added = new LinkedHashSet<String>();
                for (String key : NodeChecks.assignedVariables(a)) {
                    String canonical = NodeChecks.canonicalVariable(key);
                    if (!declared.contains(canonical)) {
                        variables.add(canonical);
                        declared.add(canonical);
                        added.add(canonical);
                    }
                }
                if (added.isEmpty()) {
                    return;
                }
                context.updateAction(id, an -> an.withMeta(an.meta().withVariables(variables)),
                    "declared assigned variable%s %s".formatted(added.size() == 1 ? "" : "s", String.join(", ", added)));
            });
        }
    }

    /**
     * Binds a parameter-input reference to the nearest earlier Decision that asked the user for an
     * answer. References that cannot be bound are removed from the text.
     */
    static void unbound(RepairContext context, List<Diagnostic> diagnostics) {
        Set<String> stillUnbound = new LinkedHashSet<>();
        VariableScope.analyze(context.nodes()).forEach(d -> stillUnbound.add(unboundKey(d)));

        for (Diagnostic diagnostic : diagnostics) {
            if (!stillUnbound.remove(unboundKey(diagnostic))) {
                continue;
            }
            int id = diagnostic.nodeId();
            String name = diagnostic.payload();
            if (diagnostic.field() == Column.PARAM_INPUT) {
                Optional<FlowNode.Decision> prior = nearestPriorQuestion(context.nodes(), id);
                if (prior.isPresent()) {
                    int priorId = prior.get().id();
                    context.updateAction(id, a -> {
                        Map<String, Integer> inputs = new LinkedHashMap<>(a.nodeInput());
                        inputs.put(name, priorId);
                        return a.withNodeInput(inputs);
                    }, "bound {%s} to the answer of node %d".formatted(name, priorId));
                    continue;
                }
            }
            context.update(id, node -> stripReference(node, diagnostic.field(), name),
                "removed unavailable variable {%s} from %s".formatted(name,
                    diagnostic.field() == null ? "node" : diagnostic.field().header()));
        }
    }

    private static Optional<FlowNode.Decision> nearestPriorQuestion(List<FlowNode> nodes, int id) {
        return nodes.stream()
            .filter(n -> n.id() < id)
            .filter(n -> n instanceof FlowNode.Decision)
            .map(n -> (FlowNode.Decision) n)
            .filter(FlowNode.Decision::isAnswerRequired)
            .max(Comparator.comparingInt(FlowNode.Decision::id));
    }

    private static FlowNode stripReference(FlowNode node, Column field, String name) {
        String token = "{" + name + "}";
        if (node instanceof FlowNode.Decision d) {
            if (field == Column.MESSAGE) {
                return d.withMessage(strip(d.message(), token));
            }
            if (field == Column.RICH_CONTENT) {
                return d.withRichContent(d.richContent().replace(token, ""));
            }
        } else if (node instanceof FlowNode.Action a && field == Column.PARAM_INPUT) {
            return a.withParamInput(a.paramInput().replace(token, ""));
        }
        return node;
    }

    private static String strip(String text, String token) {
        return text.replace(token, "").replaceAll(" {2,}", " ").trim();
    }

    private static String unboundKey(Diagnostic diagnostic) {
        return diagnostic.nodeId() + "|" + diagnostic.field() + "|" + diagnostic.payload().toUpperCase(Locale.ROOT);
    }
}
