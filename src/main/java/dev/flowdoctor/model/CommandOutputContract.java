package dev.flowdoctor.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of the values each built-in Action command can write to its decision variable.
 * Every value listed for a command must be routed by that node's What Next column.
 */
public final class CommandOutputContract {

    public static final String RESOURCE = "/command-outputs.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, List<String>> outputs;

    public CommandOutputContract(Map<String, List<String>> outputs) {
        var copy = new LinkedHashMap<String, List<String>>();
        outputs.forEach((command, values) -> copy.put(command, List.copyOf(values)));
        this.outputs = Collections.unmodifiableMap(copy);
    }

    /**
     * The contract shipped with the engine.
     */
    public static CommandOutputContract builtIn() {
        try (InputStream in = CommandOutputContract.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            return new CommandOutputContract(parse(MAPPER.readTree(in)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    /**
     * A copy extended with the contracts in a JSON file of the form {@code {"Command": ["v1", "v2"]}}.
     * Entries in the file replace built-in entries of the same command.
     */
    public CommandOutputContract mergedWith(Path file) throws IOException {
        var merged = new LinkedHashMap<>(outputs);
        merged.putAll(parse(MAPPER.readTree(file.toFile())));
        return new CommandOutputContract(merged);
    }

    public Optional<List<String>> outputs(String command) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }
        List<String> exact = outputs.get(command.trim());
        if (exact != null) {
            return Optional.of(exact);
        }
        String wanted = command.trim().toLowerCase(Locale.ROOT);
        return outputs.entrySet().stream()
            .filter(e -> e.getKey().toLowerCase(Locale.ROOT).equals(wanted))
            .map(Map.Entry::getValue)
            .findFirst();
    }

    /** True when the command's own outputs already include {@code error}. */
    public boolean declaresError(String command) {
        return outputs(command).map(values -> values.contains("error")).orElse(false);
    }

    private static Map<String, List<String>> parse(JsonNode root) {
        var parsed = new LinkedHashMap<String, List<String>>();
        if (root == null || !root.isObject()) {
            return parsed;
        }
        for (var entry : root.properties()) {
            var values = new ArrayList<String>();
            entry.getValue().forEach(v -> values.add(v.asText()));
            parsed.put(entry.getKey(), values);
        }
        return parsed;
    }
}
