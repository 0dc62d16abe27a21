package dev.flowdoctor.repair;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.flowdoctor.engine.ButtonText;
import dev.flowdoctor.json.JsonRecovery;
import dev.flowdoctor.json.LenientJson;
import dev.flowdoctor.model.Diagnostic;
import dev.flowdoctor.model.DiagnosticKind;
import dev.flowdoctor.model.FlowNode;
import dev.flowdoctor.model.NodeIds;
import dev.flowdoctor.model.RichContent;
import dev.flowdoctor.model.RichTypes;
import dev.flowdoctor.model.SystemNodes;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * Rich asset content: JSON recovery, format conversions and the constraints of pickers,
 * uploads and dynamic embeds.
 */
final class RichContentRules {

    static final String UPLOAD_TYPE = "action_node";
    static final String UPLOAD_LABEL = "Upload file";
    static final String CANCEL_LABEL = "Skip";

    private RichContentRules() {}

    static List<RepairRule> rules() {
        return List.of(
            RepairRule.of(DiagnosticKind.MALFORMED_RICH_JSON, RichContentRules::malformedJson),
            RepairRule.of(DiagnosticKind.ROOT_LEVEL_DEST, RichContentRules::rootLevelDest),
            RepairRule.of(DiagnosticKind.RICH_TYPE_MISMATCH, RichContentRules::typeMismatch),
            RepairRule.of(DiagnosticKind.DEST_TYPE, RichContentRules::destType),
            RepairRule.of(DiagnosticKind.PIPE_FORMAT, RichContentRules::pipeFormat),
            RepairRule.of(DiagnosticKind.PICKER_CONSTRAINT, RichContentRules::pickerConstraints),
            RepairRule.of(DiagnosticKind.FILE_UPLOAD_PROPERTIES, RichContentRules::fileUpload),
            RepairRule.of(DiagnosticKind.DYNAMIC_EMBED, RichContentRules::dynamicEmbed)
        );
    }

    static void malformedJson(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                if (!(node instanceof FlowNode.Decision d)
                    || !(RichContent.parse(d.richContent()) instanceof RichContent.Malformed)) {
                    return;
                }
                if (!(LenientJson.recover(d.richContent()) instanceof JsonRecovery.Parsed parsed)) {
                    return;
                }
                JsonNode value = parsed.value();
                String repaired;
                if (value.isObject()) {
                    repaired = parsed.json();
                } else if (value.isArray()) {
                    ObjectNode wrapper = LenientJson.mapper().createObjectNode();
                    wrapper.put("type", "static");
                    wrapper.set("options", value);
                    repaired = LenientJson.write(wrapper);
                } else {
                    return;
                }
                String steps = parsed.steps().isEmpty() ? "wrapped options array" : String.join(", ", parsed.steps());
                context.updateDecision(id, dn -> dn.withRichContent(repaired),
                    "repaired rich asset JSON (%s)".formatted(steps));
            });
        }
    }

    static void rootLevelDest(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                if (!(node instanceof FlowNode.Decision d)
                    || !(RichContent.parse(d.richContent()) instanceof RichContent.Json json)
                    || !json.hasRootDest()) {
                    return;
                }
                ObjectNode object = json.object();
                JsonNode rootDest = object.remove("dest");
                boolean stringDests = RichTypes.STRING_DEST.contains(RichTypes.normalize(d.richType()));
                for (JsonNode option : object.path("options")) {
                    if (option instanceof ObjectNode optionObject && !optionObject.hasNonNull("dest")) {
                        putDest(optionObject, rootDest.asText(), stringDests);
                    }
                }
                String repaired = LenientJson.write(object);
                context.updateDecision(id, dn -> dn.withRichContent(repaired),
                    "moved root-level dest %s into the options".formatted(rootDest.asText()));
            });
        }
    }

    static void typeMismatch(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                if (!(node instanceof FlowNode.Decision d)) {
                    return;
                }
                String type = RichTypes.normalize(d.richType());
                RichContent rich = RichContent.parse(d.richContent());
                if (RichTypes.BUTTONS.equals(type) && rich instanceof RichContent.Pipe) {
                    context.updateDecision(id, dn -> dn.withRich(RichTypes.BUTTON, dn.richContent()),
                        "rich type 'buttons' changed to 'button' for pipe-format content");
                } else if (RichTypes.BUTTON.equals(type) && rich instanceof RichContent.Json json && json.hasOptions()) {
                    String pipe = RichContent.renderPipe(json.options());
                    JsonNode message = json.object().get("message");
                    boolean moveMessage = d.message().isBlank() && message != null && message.isTextual();
                    context.updateDecision(id, dn -> {
                        FlowNode.Decision converted = dn.withRichContent(pipe);
                        return moveMessage ? converted.withMessage(message.asText()) : converted;
                    }, "converted JSON options to pipe-format buttons '%s'%s".formatted(pipe,
                        moveMessage ? ", JSON message moved to Message" : ""));
                }
            });
        }
    }

    static void destType(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                if (!(node instanceof FlowNode.Decision d)
                    || !(RichContent.parse(d.richContent()) instanceof RichContent.Json json)) {
                    return;
                }
                String type = RichTypes.normalize(d.richType());
                boolean stringDests = RichTypes.STRING_DEST.contains(type);
                if (!stringDests && !RichTypes.NUMERIC_DEST.contains(type)) {
                    return;
                }
                ObjectNode object = json.object();
                for (JsonNode option : object.path("options")) {
                    if (option instanceof ObjectNode optionObject && optionObject.hasNonNull("dest")) {
                        putDest(optionObject, optionObject.get("dest").asText(), stringDests);
                    }
                }
                String repaired = LenientJson.write(object);
                context.updateDecision(id, dn -> dn.withRichContent(repaired),
                    "%s option destinations written as %s".formatted(type, stringDests ? "strings" : "integers"));
            });
        }
    }

    static void pipeFormat(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                if (node instanceof FlowNode.Decision d) {
                    String normalized = ButtonText.normalize(d.richContent());
                    context.updateDecision(id, dn -> dn.withRichContent(normalized),
                        "button text '%s' rewritten as '%s'".formatted(d.richContent(), normalized));
                }
            });
        }
    }

    static void pickerConstraints(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                if (!(node instanceof FlowNode.Decision d)) {
                    return;
                }
                String type = RichTypes.normalize(d.richType());
                if (!RichTypes.PICKERS.contains(type)) {
                    return;
                }
                var notes = new ArrayList<String>();
                FlowNode.Decision fixed = d;
                if (!fixed.isAnswerRequired()) {
                    fixed = fixed.withAnswerRequired(true);
                    notes.add("answer required set");
                }
                if (!fixed.hasBehavior(SystemNodes.DISABLE_INPUT)) {
                    fixed = fixed.plusBehavior(SystemNodes.DISABLE_INPUT);
                    notes.add(SystemNodes.DISABLE_INPUT + " added");
                }
                if (RichTypes.DATE_TIME.contains(type)) {
                    fixed = staticPickerContent(fixed, type, notes);
                }
                FlowNode.Decision result = fixed;
                context.updateDecision(id, dn -> result, "%s: %s".formatted(type, String.join(", ", notes)));
            });
        }
    }

    static void fileUpload(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.node(id).ifPresent(node -> {
                if (!(node instanceof FlowNode.Decision d) || !RichTypes.is(d, RichTypes.FILE_UPLOAD)) {
                    return;
                }
                ObjectNode object = objectOrNew(d.richContent());
                var added = new ArrayList<String>();
                putIfMissing(object, "type", UPLOAD_TYPE, added);
                putIfMissing(object, "upload_label", UPLOAD_LABEL, added);
                putIfMissing(object, "cancel_label", CANCEL_LABEL, added);
                String repaired = LenientJson.write(object);
                context.updateDecision(id, dn -> dn.withRichContent(repaired),
                    "file_upload properties added: " + String.join(", ", added));
            });
        }
    }

    static void dynamicEmbed(RepairContext context, List<Diagnostic> diagnostics) {
        for (int id : distinctNodes(diagnostics)) {
            context.updateDecision(id, d -> RichTypes.isDynamicEmbed(d)
                    ? d.withNluDisabled(true).plusBehavior(SystemNodes.DISABLE_INPUT)
                    : d,
                "dynamic embed set to NLU disabled with " + SystemNodes.DISABLE_INPUT);
        }
    }

    private static FlowNode.Decision staticPickerContent(FlowNode.Decision d, String type, List<String> notes) {
        ObjectNode object = objectOrNew(d.richContent());
        if (!"static".equals(object.path("type").asText())) {
            object.put("type", "static");
        }
        String columnMessage = d.message().trim();
        JsonNode jsonMessage = object.get("message");
        boolean hasJsonMessage = jsonMessage != null && jsonMessage.isTextual() && !jsonMessage.asText().isBlank();
        if (!hasJsonMessage) {
            object.put("message", columnMessage.isEmpty() ? RichTypes.defaultPickerMessage(type) : columnMessage);
            if (!columnMessage.isEmpty()) {
                notes.add("message moved into rich asset JSON");
            }
        } else if (!columnMessage.isEmpty()) {
            notes.add("Message column '%s' dropped, rich asset JSON already has a message".formatted(columnMessage));
        }
        String content = LenientJson.write(object);
        if (!content.equals(d.richContent())) {
            notes.add("rich asset content set to " + content);
        }
        return d.withMessage("").withRichContent(content);
    }

    private static ObjectNode objectOrNew(String richContent) {
        RichContent rich = RichContent.parse(richContent);
        if (rich instanceof RichContent.Json json) {
            return json.object();
        }
        if (rich instanceof RichContent.Malformed
            && LenientJson.recover(richContent) instanceof JsonRecovery.Parsed parsed
            && parsed.value() instanceof ObjectNode object) {
            return object;
        }
        return LenientJson.mapper().createObjectNode();
    }

    private static void putIfMissing(ObjectNode object, String field, String value, List<String> added) {
        if (!object.hasNonNull(field)) {
            object.put(field, value);
            added.add(field);
        }
    }

    private static void putDest(ObjectNode option, String dest, boolean asString) {
        OptionalInt id = NodeIds.parse(dest);
        if (!asString && id.isPresent()) {
            option.put("dest", id.getAsInt());
        } else {
            option.put("dest", dest.trim());
        }
    }

    static List<Integer> distinctNodes(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::nodeId).distinct().toList();
    }
}
