package dev.flowdoctor.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.function.IntUnaryOperator;

/**
 * Rewrites every reference of a node through an id mapping: next nodes, what-next targets, and
 * button destinations in both pipe and JSON form. JSON destinations keep their string or number form.
 */
public final class References {

    private References() {}

    public static FlowNode retarget(FlowNode node, IntUnaryOperator mapping) {
        if (node instanceof FlowNode.Decision d) {
            return retarget(d, mapping);
        }
        FlowNode.Action a = (FlowNode.Action) node;
        var routes = new ArrayList<Route>();
        a.whatNext().forEach(r -> routes.add(new Route(r.value(), mapping.applyAsInt(r.target()))));
        return a.withWhatNext(routes);
    }

    public static FlowNode.Decision retarget(FlowNode.Decision d, IntUnaryOperator mapping) {
        var next = new ArrayList<Integer>();
        d.nextNodes().forEach(id -> next.add(mapping.applyAsInt(id)));
        return d.withNextNodes(next).withRichContent(retargetRich(d.richContent(), mapping));
    }

    /** Node Input bindings pointing at renumbered nodes. */
    public static FlowNode retargetInputs(FlowNode node, IntUnaryOperator mapping) {
        if (!(node instanceof FlowNode.Action a) || a.nodeInput().isEmpty()) {
            return node;
        }
        Map<String, Integer> inputs = new LinkedHashMap<>();
        a.nodeInput().forEach((name, id) -> inputs.put(name, mapping.applyAsInt(id)));
        return a.withNodeInput(inputs);
    }

    public static String retargetRich(String richContent, IntUnaryOperator mapping) {
        RichContent rich = RichContent.parse(richContent);
        if (rich instanceof RichContent.Pipe pipe) {
            var buttons = new ArrayList<Button>();
            boolean changed = false;
            for (Button button : pipe.buttons()) {
                OptionalInt target = button.target();
                if (target.isPresent() && mapping.applyAsInt(target.getAsInt()) != target.getAsInt()) {
                    buttons.add(button.withDest(mapping.applyAsInt(target.getAsInt())));
                    changed = true;
                } else {
                    buttons.add(button);
                }
            }
            return changed ? pipe.withButtons(buttons).render() : richContent;
        }
        if (rich instanceof RichContent.Json json && json.hasOptions()) {
            ObjectNode object = json.object();
            boolean changed = false;
            for (JsonNode option : object.path("options")) {
                if (!(option instanceof ObjectNode optionObject)) {
                    continue;
                }
                JsonNode dest = optionObject.get("dest");
                OptionalInt target = dest == null ? OptionalInt.empty() : NodeIds.parse(dest.asText());
                if (target.isEmpty()) {
                    continue;
                }
                int mapped = mapping.applyAsInt(target.getAsInt());
                if (mapped == target.getAsInt()) {
                    continue;
                }
                if (dest.isTextual()) {
                    optionObject.put("dest", Integer.toString(mapped));
                } else {
                    optionObject.put("dest", mapped);
                }
                changed = true;
            }
            return changed ? new RichContent.Json(object).render() : richContent;
        }
        return richContent;
    }

    /** Ids a node points at, in column order. */
    public static List<Integer> targets(FlowNode node) {
        return Reference.of(node).stream().map(Reference::target).toList();
    }
}
