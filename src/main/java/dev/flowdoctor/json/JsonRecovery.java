package dev.flowdoctor.json;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Result of recovering JSON from generator output.
 */
public sealed interface JsonRecovery {

    /**
     * The text parsed, possibly after clean-up.
     *
     * @param value the parsed tree
     * @param json  the strict, compact rendering of {@code value}
     * @param steps the clean-up steps that were needed; empty when the input was already valid
     */
    record Parsed(JsonNode value, String json, List<String> steps) implements JsonRecovery {
        public Parsed {
            steps = List.copyOf(steps);
        }

        public boolean repaired() {
            return !steps.isEmpty();
        }
    }

    record Unrecoverable(String reason, String original) implements JsonRecovery {}

    default boolean isParsed() {
        return this instanceof Parsed;
    }
}
