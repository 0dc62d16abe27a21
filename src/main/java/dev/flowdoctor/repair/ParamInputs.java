package dev.flowdoctor.repair;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.flowdoctor.json.JsonRecovery;
import dev.flowdoctor.json.LenientJson;

import java.util.Optional;

/**
 * Parameter Input must be a single JSON object. Quoted objects are unwrapped, a bare array is
 * wrapped as {@code {"items":[...]}}, and anything else goes through {@link LenientJson#recover}.
 */
public final class ParamInputs {

    static final String ARRAY_FIELD = "items";

    private ParamInputs() {}

    /**
     * Strict JSON object text for the input, or empty when it cannot be recovered.
     */
    public static Optional<String> normalize(String paramInput) {
        if (paramInput == null || paramInput.isBlank()) {
            return Optional.empty();
        }
        if (!(LenientJson.recover(paramInput) instanceof JsonRecovery.Parsed parsed)) {
            return Optional.empty();
        }
        JsonNode value = parsed.value();
        if (value.isObject()) {
            return Optional.of(parsed.json());
        }
        if (value.isArray()) {
            ObjectNode wrapper = LenientJson.mapper().createObjectNode();
            wrapper.set(ARRAY_FIELD, value);
            return Optional.of(LenientJson.write(wrapper));
        }
        return Optional.empty();
    }
}
