package dev.flowdoctor.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.flowdoctor.json.LenientJson;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Typed view over the Rich Asset Content column.
 * Either plain-pipe buttons ({@code label~dest|label~dest}) or a JSON object,
 * usually carrying an {@code options} array of {@code {label, dest}} objects.
 */
public sealed interface RichContent {

    record Empty() implements RichContent {}

    /** {@code label~dest} segments separated by {@code |}. */
    record Pipe(List<Button> buttons) implements RichContent {
        public Pipe {
            buttons = List.copyOf(buttons);
        }

        public Pipe withButtons(List<Button> newButtons) {
            return new Pipe(newButtons);
        }

        public String render() {
            return buttons.stream().map(Button::render).collect(Collectors.joining("|"));
        }
    }

    /** A strictly valid JSON object. The tree is copied on access. */
    record Json(ObjectNode object) implements RichContent {
        public Json {
            object = object.deepCopy();
        }

        @Override
        public ObjectNode object() {
            return object.deepCopy();
        }

        public boolean hasOptions() {
            return object.path("options").isArray();
        }

        public List<Button> options() {
            var buttons = new ArrayList<Button>();
            JsonNode options = object.path("options");
            if (options.isArray()) {
                for (JsonNode option : options) {
                    buttons.add(new Button(option.path("label").asText(""), destText(option.get("dest"))));
                }
            }
            return buttons;
        }

        public Optional<String> type() {
            JsonNode type = object.get("type");
            return type != null && type.isTextual() ? Optional.of(type.asText()) : Optional.empty();
        }

        public boolean hasRootDest() {
            return object.has("dest") && hasOptions();
        }

        public String render() {
            return LenientJson.write(object);
        }
    }

    /** Starts like JSON but does not parse strictly. */
    record Malformed(String raw) implements RichContent {}

    /** Anything else: free text, a single URL, a template name. */
    record Text(String raw) implements RichContent {}

    static RichContent parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return new Empty();
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("\"{") || trimmed.startsWith("[")) {
            Optional<JsonNode> node = LenientJson.parseStrict(trimmed);
            if (node.isPresent() && node.get().isObject()) {
                return new Json((ObjectNode) node.get());
            }
            return new Malformed(raw);
        }
        if (trimmed.contains("~")) {
            return new Pipe(parsePipe(trimmed));
        }
        return new Text(raw);
    }

    static List<Button> parsePipe(String text) {
        var buttons = new ArrayList<Button>();
        for (String segment : text.split("\\|")) {
            if (segment.isBlank()) {
                continue;
            }
            int tilde = segment.lastIndexOf('~');
            if (tilde < 0) {
                buttons.add(new Button(segment, ""));
            } else {
                buttons.add(new Button(segment.substring(0, tilde), segment.substring(tilde + 1)));
            }
        }
        return buttons;
    }

    static String renderPipe(List<Button> buttons) {
        return new Pipe(buttons).render();
    }

    /**
     * Build a JSON options object preserving label/destination pairs.
     * Destinations that parse as integers are written as numbers unless {@code stringDests}.
     */
    static Json optionsObject(List<Button> buttons, boolean stringDests) {
        ObjectNode object = LenientJson.mapper().createObjectNode();
        object.put("type", "static");
        ArrayNode options = object.putArray("options");
        for (Button button : buttons) {
            ObjectNode option = options.addObject();
            option.put("label", button.label());
            var target = button.target();
            if (target.isPresent() && !stringDests) {
                option.put("dest", target.getAsInt());
            } else {
                option.put("dest", button.dest());
            }
        }
        return new Json(object);
    }

    private static String destText(JsonNode dest) {
        if (dest == null || dest.isNull()) {
            return "";
        }
        return dest.asText();
    }
}
