package dev.flowdoctor.repair;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.flowdoctor.engine.NodeChecks;
import dev.flowdoctor.engine.StructuralValidator;
import dev.flowdoctor.json.LenientJson;
import dev.flowdoctor.model.Button;
import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.NodeIds;
import dev.flowdoctor.model.Reference;
import dev.flowdoctor.model.References;
import dev.flowdoctor.model.RichContent;
import dev.flowdoctor.model.RichTypes;
import dev.flowdoctor.model.Route;
import dev.flowdoctor.model.SystemNodes;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static dev.flowdoctor.repair.RichContentRules.distinctNodes;

/**
 * Where nodes go next: transfers, NLU-disabled fan-out, Action routing and references to nodes
 * that do not exist.
 */
final class RoutingRules {

    static final String PLACEHOLDER_PARAMS = "{\"set\":{\"PLACEHOLDER\":\"true\"}}";
    static final String DEFAULT_DECISION_VARIABLE = "success";

    private RoutingRules() {}

    static List<RepairRule> rules() {
        return List.of(
            RepairRule.of(DiagnosticKind.TRANSFER_WITH_NEXT_NODES, RoutingRules::transferWithNextNodes),
            RepairRule.of(DiagnosticKind.NLU_MULTI_DESTINATION, RoutingRules::nluMultiDestination),
            RepairRule.of(DiagnosticKind.EMPTY_COMMAND, RoutingRules::emptyCommand),
            RepairRule.of(DiagnosticKind.MISSING_DECISION_VARIABLE, RoutingRules::missingDecisionVariable),
            RepairRule.of(DiagnosticKind.ROUTING_GAP, RoutingRules::routingGap),
            RepairRule.of(DiagnosticKind.MISSING_ERROR_PATH, RoutingRules::missingErrorPath),
            RepairRule.of(DiagnosticKind.NON_INTEGER_REFERENCE, RoutingRules::nonIntegerReference),
            RepairRule.of(DiagnosticKind.DEAD_END, RoutingRules::deadEnd),
            RepairRule.of(DiagnosticKind.ORPHAN_REFERENCE, RoutingRules::orphanReference)
        );
    }

    static void transferWithNextNodes(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.updateDecision(id, d -> d.hasBehavior(SystemNodes.XFER_TO_AGENT) ? d.withNextNodes(List.of()) : d,
                "cleared Next Nodes of " + SystemNodes.XFER_TO_AGENT + " node");
        }
    }

    /**
     * Dynamic embeds must stay NLU disabled, so they keep their first next node. Every other node
     * gets NLU re-enabled.
     */
    static void nluMultiDestination(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                if (!(node instanceof FlowNode.Decision d) || !d.isNluDisabled()) {
                    return;
                }
                if (RichTypes.isDynamicEmbed(d)) {
                    Set<Integer> distinct = new LinkedHashSet<>(d.nextNodes());
                    if (distinct.size() > 1) {
                        int first = distinct.iterator().next();
                        context.updateDecision(id, dn -> dn.withNextNodes(List.of(first)),
                            "dynamic embed kept next node %d of %d destinations".formatted(first, distinct.size()));
                    }
                    return;
                }
                int count = NodeChecks.destinations(d).size();
                if (count > 1) {
                    context.updateDecision(id, dn -> dn.withNluDisabled(null),
                        "cleared NLU Disabled (had %d distinct destinations, max 1 allowed)".formatted(count));
                }
            });
        }
    }

    static void emptyCommand(RepairContext context, List<Diagnostic> diagnostics) {
        Set<Integer> ids = context.ids();
        for (int id : distinctNodes(diagnostics)) {
            context.updateAction(id, a -> {
                if (!a.command().isBlank()) {
                    return a;
                }
                FlowNode.Action fixed = a.withCommand(NodeChecks.ASSIGN_COMMAND);
                if (fixed.paramInput().isBlank()) {
                    fixed = fixed.withParamInput(PLACEHOLDER_PARAMS);
                }
                if (fixed.decisionVar().isBlank()) {
                    fixed = fixed.withDecisionVar(DEFAULT_DECISION_VARIABLE);
                }
                var routes = new ArrayList<>(fixed.whatNext());
                if (!fixed.routes("true")) {
                    int target = firstNonErrorTarget(fixed)
                        .orElseGet(() -> FallbackResolver.menuOrEntry(ids, a.id()));
                    routes.add(0, new Route("true", target));
                }
                if (!fixed.routes("error")) {
                    routes.add(new Route("error", SystemNodes.ERROR_MESSAGE));
                }
                return fixed.withWhatNext(routes);
            }, "added " + NodeChecks.ASSIGN_COMMAND + " to empty Action command");
        }
    }

    static void missingDecisionVariable(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                if (!(node instanceof FlowNode.Action a) || a.whatNext().isEmpty() || !a.decisionVar().isBlank()) {
                    return;
                }
                String variable = a.outputVar().isBlank() ? DEFAULT_DECISION_VARIABLE : a.outputVar().trim();
                context.updateAction(id, an -> an.withDecisionVar(variable),
                    "added missing Decision Variable \"%s\"".formatted(variable));
            });
        }
    }

    static void routingGap(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                if (!(node instanceof FlowNode.Action a)) {
                    return;
                }
                List<String> missing = context.contract().outputs(a.command()).orElse(List.of()).stream()
                    .filter(value -> !a.routes(value))
                    .toList();
                if (missing.isEmpty()) {
                    return;
                }
                int target = firstNonErrorTarget(a).orElse(SystemNodes.ERROR_MESSAGE);
                var routes = new ArrayList<>(a.whatNext());
                missing.forEach(value -> routes.add(new Route(value, target)));
                context.updateAction(id, an -> an.withWhatNext(routes),
                    "routed %s output%s %s to %d".formatted(a.command(), missing.size() == 1 ? "" : "s",
                        String.join(", ", missing), target));
            });
        }
    }

    static void missingErrorPath(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.updateAction(id, a -> {
                if (a.id() == SystemNodes.ERROR_HANDLER || a.routes("error")
                    || context.contract().declaresError(a.command())) {
                    return a;
                }
                var routes = new ArrayList<>(a.whatNext());
                routes.add(new Route("error", SystemNodes.ERROR_MESSAGE));
                return a.withWhatNext(routes);
            }, "added missing error~%d to What Next".formatted(SystemNodes.ERROR_MESSAGE));
        }
    }

    /**
     * Non-integer button destinations are pointed at the menu. Tokens in Next Nodes, What Next and
     * Node Input were dropped while the row was read; those are only recorded.
     */
    static void nonIntegerReference(RepairContext context, List<Diagnostic> diagnostics) {
        for (Diagnostic diagnostic : diagnostics) {
            int id = diagnostic.nodeId();
            if (diagnostic.field() != Column.RICH_CONTENT) {
                context.fix(id, "dropped non-integer %s entry '%s'"
                    .formatted(diagnostic.field() == null ? "reference" : diagnostic.field().header(),
                        diagnostic.payload()));
                continue;
            }
            int fallback = FallbackResolver.forInvalid(context.ids(), id);
            context.updateDecision(id, d -> d.withRichContent(replaceInvalidDest(d, diagnostic.payload(), fallback)),
                "button destination '%s' replaced with %d".formatted(diagnostic.payload(), fallback));
        }
    }

    static void deadEnd(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            Set<Integer> ids = context.ids();
            int menu = FallbackResolver.menuOrEntry(ids, id);
            context.node(id).ifPresent(node -> {
                if (!(node instanceof FlowNode.Decision d) || !StructuralValidator.isDeadEnd(d)) {
                    return;
                }
                if (d.richContent().isBlank()) {
                    String buttons = "Back to Menu~%d|Talk to Agent~%d".formatted(menu, SystemNodes.AGENT_TRANSFER);
                    context.updateDecision(id, dn -> dn.withRich(RichTypes.BUTTON, buttons).withAnswerRequired(true),
                        "added recovery buttons to dead-end Decision node");
                } else {
                    int next = menu == id ? SystemNodes.AGENT_TRANSFER : menu;
                    context.updateDecision(id, dn -> dn.withNextNodes(List.of(next)),
                        "dead-end Decision node now continues to %d".formatted(next));
                }
            });
        }
    }

    static void orphanReference(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            Set<Integer> ids = context.ids();
            Set<Integer> missing = new TreeSet<>();
            context.nodesWithId(id).forEach(node -> Reference.of(node).stream()
                .map(Reference::target)
                .filter(target -> !ids.contains(target))
                .forEach(missing::add));
            if (missing.isEmpty()) {
                continue;
            }
            var replaced = new ArrayList<String>();
            for (int target : missing) {
                replaced.add("%d -> %d".formatted(target, FallbackResolver.forOrphan(ids, id, target)));
            }
            context.update(id, node -> References.retarget(node,
                    target -> ids.contains(target) ? target : FallbackResolver.forOrphan(ids, id, target)),
                "replaced orphan reference%s %s".formatted(missing.size() == 1 ? "" : "s",
                    String.join(", ", replaced)));
        }
    }

    private static Optional<Integer> firstNonErrorTarget(FlowNode.Action action) {
        return action.whatNext().stream().filter(r -> !r.isError()).map(Route::target).findFirst();
    }

    private static String replaceInvalidDest(FlowNode.Decision d, String invalid, int fallback) {
        RichContent rich = RichContent.parse(d.richContent());
        if (rich instanceof RichContent.Pipe pipe) {
            var buttons = new ArrayList<Button>();
            for (Button button : pipe.buttons()) {
                buttons.add(button.dest().equals(invalid.trim()) && button.target().isEmpty()
                    ? button.withDest(fallback) : button);
            }
            return pipe.withButtons(buttons).render();
        }
        if (rich instanceof RichContent.Json json && json.hasOptions()) {
            ObjectNode object = json.object();
            for (JsonNode option : object.path("options")) {
                JsonNode dest = option.get("dest");
                if (option instanceof ObjectNode optionObject && dest != null
                    && dest.asText().trim().equals(invalid.trim()) && NodeIds.parse(dest.asText()).isEmpty()) {
                    optionObject.put("dest", fallback);
                }
            }
            return LenientJson.write(object);
        }
        return d.richContent();
    }
}
