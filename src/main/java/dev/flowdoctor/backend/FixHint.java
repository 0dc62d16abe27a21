package dev.flowdoctor.backend;

/**
 * A fix that worked before for errors with the same signature.
 *
 * @param confidence successes divided by attempts, in [0, 1]
 */
public record FixHint(String signature, String category, String fixDescription, double confidence) {

    public String render() {
        return "- [%s] %s (confidence %d%%)".formatted(category, fixDescription, Math.round(confidence * 100));
    }
}
