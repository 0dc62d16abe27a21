package dev.flowdoctor.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.flowdoctor.codec.RecordMapper;
import dev.flowdoctor.json.JsonRecovery;
import dev.flowdoctor.json.LenientJson;
import dev.flowdoctor.model.Button;
import dev.flowdoctor.model.Column;
import dev.flowdoctor.model.CommandOutputContract;
import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.NodeIds;
import dev.flowdoctor.model.RichContent;
import dev.flowdoctor.model.RichTypes;
import dev.flowdoctor.model.SystemNodes;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks that look at one node at a time: rich content format, picker and embed constraints,
 * command routing and variable declarations.
 */
public final class NodeChecks {

    public static final String ASSIGN_COMMAND = "SysAssignVariable";

    private static final Pattern VARIABLE_SEPARATOR = Pattern.compile("[\\s-]+");

    private NodeChecks() {}

    public static List<Diagnostic> check(FlowNode node, CommandOutputContract contract) {
        var out = new ArrayList<Diagnostic>();
        if (node instanceof FlowNode.Decision d) {
            checkRichContent(d, out);
            checkInputConstraints(d, out);
            checkRouting(d, out);
        } else if (node instanceof FlowNode.Action a) {
            checkCommand(a, contract, out);
            checkParamInput(a, out);
        }
        checkVariables(node, out);
        return out;
    }

    /** UPPER_SNAKE form of a declared variable name. */
    public static String canonicalVariable(String name) {
        return VARIABLE_SEPARATOR.matcher(name.trim()).replaceAll("_").toUpperCase(Locale.ROOT);
    }

    /** Keys of the {@code set} object of a SysAssignVariable parameter input. */
    public static List<String> assignedVariables(FlowNode.Action action) {
        var keys = new ArrayList<String>();
        if (!ASSIGN_COMMAND.equalsIgnoreCase(action.command()) || action.paramInput().isBlank()) {
            return keys;
        }
        JsonRecovery recovery = LenientJson.recover(action.paramInput());
        if (recovery instanceof JsonRecovery.Parsed parsed) {
            JsonNode set = parsed.value().path("set");
            if (set.isObject()) {
                set.fieldNames().forEachRemaining(keys::add);
            }
        }
        return keys;
    }

    /** Distinct destinations of a decision: next nodes and button destinations. */
    public static Set<String> destinations(FlowNode.Decision decision) {
        var destinations = new LinkedHashSet<String>();
        decision.nextNodes().forEach(id -> destinations.add(Integer.toString(id)));
        buttons(decision).stream()
            .map(Button::dest)
            .filter(dest -> !dest.isBlank())
            .forEach(destinations::add);
        return destinations;
    }

    public static List<Button> buttons(FlowNode.Decision decision) {
        RichContent rich = RichContent.parse(decision.richContent());
        if (rich instanceof RichContent.Pipe pipe) {
            return pipe.buttons();
        }
        if (rich instanceof RichContent.Json json) {
            return json.options();
        }
        return List.of();
    }

    private static void checkRichContent(FlowNode.Decision d, List<Diagnostic> out) {
        String type = RichTypes.normalize(d.richType());
        RichContent rich = RichContent.parse(d.richContent());

        if (RichTypes.BUTTONS.equals(type) && rich instanceof RichContent.Pipe) {
            out.add(Diagnostic.of(d.id(), Column.RICH_TYPE, DiagnosticKind.RICH_TYPE_MISMATCH, RichTypes.BUTTONS,
                "pipe-format buttons must use rich type 'button'"));
        }
        if (RichTypes.BUTTON.equals(type) && rich instanceof RichContent.Json json && json.hasOptions()) {
            out.add(Diagnostic.of(d.id(), Column.RICH_TYPE, DiagnosticKind.RICH_TYPE_MISMATCH, RichTypes.BUTTON,
                "rich type 'button' expects pipe-format content, found JSON options"));
        }

        if (rich instanceof RichContent.Malformed) {
            out.add(Diagnostic.of(d.id(), Column.RICH_CONTENT, DiagnosticKind.MALFORMED_RICH_JSON, d.richContent(),
                "rich asset content is not valid JSON"));
        } else if (rich instanceof RichContent.Json json) {
            if (json.hasRootDest()) {
                out.add(Diagnostic.of(d.id(), Column.RICH_CONTENT, DiagnosticKind.ROOT_LEVEL_DEST,
                    json.object().get("dest").asText(), "'dest' belongs inside each option, not at the root"));
            }
            checkOptionDestinations(d, type, json, out);
        } else if (rich instanceof RichContent.Pipe pipe) {
            List<String> defects = ButtonText.defects(d.richContent());
            if (!defects.isEmpty()) {
                out.add(Diagnostic.of(d.id(), Column.RICH_CONTENT, DiagnosticKind.PIPE_FORMAT,
                    String.join(", ", defects), "button text is malformed: " + String.join(", ", defects)));
            }
            if (type.isEmpty() || RichTypes.BUTTON.equals(type)) {
                for (Button button : pipe.buttons()) {
                    if (button.target().isEmpty() && !button.label().contains("~")) {
                        out.add(Diagnostic.of(d.id(), Column.RICH_CONTENT, DiagnosticKind.NON_INTEGER_REFERENCE,
                            button.dest(), "button '%s' has a non-integer destination '%s'"
                                .formatted(button.label(), button.dest())));
                    }
                }
            }
        }
    }

    private static void checkOptionDestinations(FlowNode.Decision d, String type, RichContent.Json json,
                                                List<Diagnostic> out) {
        JsonNode options = json.object().path("options");
        if (!options.isArray()) {
            return;
        }
        for (JsonNode option : options) {
            JsonNode dest = option.get("dest");
            if (dest == null || dest.isNull()) {
                continue;
            }
            if (RichTypes.STRING_DEST.contains(type) && dest.isNumber()) {
                out.add(Diagnostic.of(d.id(), Column.RICH_CONTENT, DiagnosticKind.DEST_TYPE, dest.asText(),
                    "%s destinations must be strings".formatted(type)));
            } else if (RichTypes.NUMERIC_DEST.contains(type) && dest.isTextual()) {
                if (NodeIds.isBareInteger(dest.asText())) {
                    out.add(Diagnostic.of(d.id(), Column.RICH_CONTENT, DiagnosticKind.DEST_TYPE, dest.asText(),
                        "%s destinations must be integers".formatted(type)));
                } else {
                    out.add(Diagnostic.of(d.id(), Column.RICH_CONTENT, DiagnosticKind.NON_INTEGER_REFERENCE,
                        dest.asText(), "option '%s' has a non-integer destination '%s'"
                            .formatted(option.path("label").asText(), dest.asText())));
                }
            }
        }
    }

    private static void checkInputConstraints(FlowNode.Decision d, List<Diagnostic> out) {
        String type = RichTypes.normalize(d.richType());
        if (RichTypes.PICKERS.contains(type)) {
            var violations = new ArrayList<String>();
            if (!d.isAnswerRequired()) {
                violations.add("answer required");
            }
            if (!d.hasBehavior(SystemNodes.DISABLE_INPUT)) {
                violations.add(SystemNodes.DISABLE_INPUT);
            }
            if (RichTypes.DATE_TIME.contains(type)) {
                if (!d.message().isBlank()) {
                    violations.add("message column must be empty");
                }
                if (!isStaticMessage(RichContent.parse(d.richContent()))) {
                    violations.add("static JSON with message");
                }
            }
            if (!violations.isEmpty()) {
                out.add(Diagnostic.of(d.id(), Column.RICH_TYPE, DiagnosticKind.PICKER_CONSTRAINT,
                    String.join(", ", violations), "%s needs: %s".formatted(type, String.join(", ", violations))));
            }
        }
        if (RichTypes.FILE_UPLOAD.equals(type) && !hasUploadProperties(RichContent.parse(d.richContent()))) {
            out.add(Diagnostic.of(d.id(), Column.RICH_CONTENT, DiagnosticKind.FILE_UPLOAD_PROPERTIES, "",
                "file_upload content needs type, upload_label and cancel_label"));
        }
        if (RichTypes.isDynamicEmbed(d) && (!d.isNluDisabled() || !d.hasBehavior(SystemNodes.DISABLE_INPUT))) {
            out.add(Diagnostic.of(d.id(), Column.NLU_DISABLED, DiagnosticKind.DYNAMIC_EMBED, "",
                "dynamic embeds need NLU disabled and " + SystemNodes.DISABLE_INPUT));
        }
    }

    private static void checkRouting(FlowNode.Decision d, List<Diagnostic> out) {
        if (d.hasBehavior(SystemNodes.XFER_TO_AGENT) && !d.nextNodes().isEmpty()) {
            out.add(Diagnostic.of(d.id(), Column.NEXT_NODES, DiagnosticKind.TRANSFER_WITH_NEXT_NODES,
                RecordMapper.renderIds(d.nextNodes()), "agent transfer nodes cannot have next nodes"));
        }
        if (d.isNluDisabled()) {
            int count = RichTypes.isDynamicEmbed(d)
                ? new LinkedHashSet<>(d.nextNodes()).size()
                : destinations(d).size();
            if (count > 1) {
                out.add(Diagnostic.of(d.id(), Column.NLU_DISABLED, DiagnosticKind.NLU_MULTI_DESTINATION,
                    Integer.toString(count),
                    "NLU disabled allows one destination, found %d".formatted(count)));
            }
        }
    }

    private static void checkCommand(FlowNode.Action a, CommandOutputContract contract, List<Diagnostic> out) {
        if (a.command().isBlank()) {
            out.add(Diagnostic.of(a.id(), Column.COMMAND, DiagnosticKind.EMPTY_COMMAND, "",
                "action node has no command"));
            return;
        }
        if (!a.whatNext().isEmpty() && a.decisionVar().isBlank()) {
            out.add(Diagnostic.of(a.id(), Column.DECISION_VARIABLE, DiagnosticKind.MISSING_DECISION_VARIABLE, "",
                "routing by What Next needs a decision variable"));
        }
        Optional<List<String>> outputs = contract.outputs(a.command());
        outputs.ifPresent(values -> values.stream()
            .filter(value -> !a.routes(value))
            .forEach(value -> out.add(Diagnostic.of(a.id(), Column.WHAT_NEXT, DiagnosticKind.ROUTING_GAP, value,
                "%s can return '%s' but What Next does not route it".formatted(a.command(), value)))));
        if (a.id() != SystemNodes.ERROR_HANDLER && !a.routes("error") && !contract.declaresError(a.command())) {
            out.add(Diagnostic.of(a.id(), Column.WHAT_NEXT, DiagnosticKind.MISSING_ERROR_PATH, "error",
                "action has no error route"));
        }
    }

    private static void checkParamInput(FlowNode.Action a, List<Diagnostic> out) {
        String param = a.paramInput().trim();
        if (param.isEmpty()) {
            return;
        }
        Optional<JsonNode> parsed = LenientJson.parseStrict(param);
        if (parsed.isEmpty() || !parsed.get().isObject()) {
            out.add(Diagnostic.of(a.id(), Column.PARAM_INPUT, DiagnosticKind.MALFORMED_PARAM_INPUT, param,
                "parameter input must be a JSON object"));
        }
    }

    private static void checkVariables(FlowNode node, List<Diagnostic> out) {
        var declared = new LinkedHashSet<String>();
        for (String variable : node.meta().variables()) {
            String canonical = canonicalVariable(variable);
            declared.add(canonical);
            if (!canonical.equals(variable)) {
                out.add(Diagnostic.of(node.id(), Column.VARIABLE, DiagnosticKind.VARIABLE_CASE, variable,
                    "variable '%s' must be written as %s".formatted(variable, canonical)));
            }
        }
        if (node instanceof FlowNode.Action a) {
            for (String key : assignedVariables(a)) {
                if (!declared.contains(canonicalVariable(key))) {
                    out.add(Diagnostic.of(a.id(), Column.VARIABLE, DiagnosticKind.UNDECLARED_ASSIGNED_VARIABLE, key,
                        "assigned variable '%s' is not declared in the Variable column".formatted(key)));
                }
            }
        }
    }

    static boolean isStaticMessage(RichContent rich) {
        if (!(rich instanceof RichContent.Json json)) {
            return false;
        }
        JsonNode message = json.object().get("message");
        return json.type().map("static"::equals).orElse(false)
            && message != null && message.isTextual() && !message.asText().isBlank();
    }

    static boolean hasUploadProperties(RichContent rich) {
        if (!(rich instanceof RichContent.Json json)) {
            return false;
        }
        var object = json.object();
        return object.hasNonNull("type") && object.hasNonNull("upload_label") && object.hasNonNull("cancel_label");
    }
}
