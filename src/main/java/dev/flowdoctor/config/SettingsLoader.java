package dev.flowdoctor.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowdoctor.model.AllocationBands;
import dev.flowdoctor.model.RefinementSettings;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Loads settings from JSON. Every key is optional and falls back to its default:
 *
 * <pre>
 * {
 *   "refinement": {"maxIterations": 5, "stuckThreshold": 2, "rowChangeRatio": 0.05,
 *                  "rowChangeAbsolute": 3, "misalignedRowLimit": 5, "concurrency": 3,
 *                  "validatorTimeoutSeconds": 60, "repairerTimeoutSeconds": 180, "sanitizePasses": 3},
 *   "allocation": {"flowBase": 300, "flowBandSize": 100}
 * }
 * </pre>
 */
public final class SettingsLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SettingsLoader() {}

    public static Settings loadFromFile(Path path) throws IOException {
        return parseSettings(MAPPER.readTree(path.toFile()));
    }

    public static Settings loadFromString(String json) throws IOException {
        return parseSettings(MAPPER.readTree(json));
    }

    private static Settings parseSettings(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Settings must be a JSON object");
        }
        return new Settings(parseRefinement(root.get("refinement")), parseBands(root.get("allocation")));
    }

    private static RefinementSettings parseRefinement(JsonNode node) {
        if (node == null) {
            return RefinementSettings.defaults();
        }
        int maxIterations = node.has("maxIterations")
            ? node.get("maxIterations").asInt() : RefinementSettings.DEFAULT_MAX_ITERATIONS;
        int stuckThreshold = node.has("stuckThreshold")
            ? node.get("stuckThreshold").asInt() : RefinementSettings.DEFAULT_STUCK_THRESHOLD;
        double rowChangeRatio = node.has("rowChangeRatio")
            ? node.get("rowChangeRatio").asDouble() : RefinementSettings.DEFAULT_ROW_CHANGE_RATIO;
        int rowChangeAbsolute = node.has("rowChangeAbsolute")
            ? node.get("rowChangeAbsolute").asInt() : RefinementSettings.DEFAULT_ROW_CHANGE_ABSOLUTE;
        int misalignedRowLimit = node.has("misalignedRowLimit")
            ? node.get("misalignedRowLimit").asInt() : RefinementSettings.DEFAULT_MISALIGNED_ROW_LIMIT;
        int concurrency = node.has("concurrency")
            ? node.get("concurrency").asInt() : RefinementSettings.DEFAULT_CONCURRENCY;
        Duration validatorTimeout = node.has("validatorTimeoutSeconds")
            ? Duration.ofSeconds(node.get("validatorTimeoutSeconds").asLong())
            : RefinementSettings.DEFAULT_VALIDATOR_TIMEOUT;
        Duration repairerTimeout = node.has("repairerTimeoutSeconds")
            ? Duration.ofSeconds(node.get("repairerTimeoutSeconds").asLong())
            : RefinementSettings.DEFAULT_REPAIRER_TIMEOUT;
        int sanitizePasses = node.has("sanitizePasses")
            ? node.get("sanitizePasses").asInt() : RefinementSettings.DEFAULT_SANITIZE_PASSES;
        return new RefinementSettings(maxIterations, stuckThreshold, rowChangeRatio, rowChangeAbsolute,
            misalignedRowLimit, concurrency, validatorTimeout, repairerTimeout, sanitizePasses);
    }

    private static AllocationBands parseBands(JsonNode node) {
        AllocationBands defaults = AllocationBands.defaults();
        if (node == null) {
            return defaults;
        }
        int flowBase = node.has("flowBase")
            ? node.get("flowBase").asInt() : AllocationBands.DEFAULT_FLOW_BASE;
        int flowBandSize = node.has("flowBandSize")
            ? node.get("flowBandSize").asInt() : AllocationBands.DEFAULT_FLOW_BAND_SIZE;
        return new AllocationBands(defaults.startupStart(), defaults.startupEnd(),
            defaults.menuStart(), defaults.menuEnd(), flowBase, flowBandSize);
    }
}
