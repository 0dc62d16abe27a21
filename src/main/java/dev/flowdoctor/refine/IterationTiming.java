package dev.flowdoctor.refine;

/**
 * Wall-clock milliseconds spent in each phase of one iteration.
 */
public record IterationTiming(
    int iteration,
    long sanitizeMillis,
    long validatorMillis,
    long repairerMillis,
    long totalMillis,
    int errorsIn,
    int errorsOut
) {
    public String summary() {
        return "iteration %d: sanitize %d ms | validator %d ms | repairer %d ms | total %d ms | errors %d -> %d"
            .formatted(iteration, sanitizeMillis, validatorMillis, repairerMillis, totalMillis, errorsIn, errorsOut);
    }
}
