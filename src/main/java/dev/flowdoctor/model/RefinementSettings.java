package dev.flowdoctor.model;

import java.time.Duration;

/**
 * Limits and thresholds for one refinement session.
 */
public record RefinementSettings(
    int maxIterations,
    int stuckThreshold,
    double rowChangeRatio,
    int rowChangeAbsolute,
    int misalignedRowLimit,
    int concurrency,
    Duration validatorTimeout,
    Duration repairerTimeout,
    int sanitizePasses
) {
    public static final int DEFAULT_MAX_ITERATIONS = 5;
    public static final int DEFAULT_STUCK_THRESHOLD = 2;
    public static final double DEFAULT_ROW_CHANGE_RATIO = 0.05;
    public static final int DEFAULT_ROW_CHANGE_ABSOLUTE = 3;
    public static final int DEFAULT_MISALIGNED_ROW_LIMIT = 5;
    public static final int DEFAULT_CONCURRENCY = 3;
    public static final Duration DEFAULT_VALIDATOR_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_REPAIRER_TIMEOUT = Duration.ofSeconds(180);
    public static final int DEFAULT_SANITIZE_PASSES = 3;

    public RefinementSettings {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be at least 1, got " + maxIterations);
        }
        if (stuckThreshold < 1) {
            throw new IllegalArgumentException("stuckThreshold must be at least 1, got " + stuckThreshold);
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, got " + concurrency);
        }
        if (sanitizePasses < 1) {
            throw new IllegalArgumentException("sanitizePasses must be at least 1, got " + sanitizePasses);
        }
    }

    public static RefinementSettings defaults() {
        return new RefinementSettings(DEFAULT_MAX_ITERATIONS, DEFAULT_STUCK_THRESHOLD,
            DEFAULT_ROW_CHANGE_RATIO, DEFAULT_ROW_CHANGE_ABSOLUTE, DEFAULT_MISALIGNED_ROW_LIMIT,
            DEFAULT_CONCURRENCY, DEFAULT_VALIDATOR_TIMEOUT, DEFAULT_REPAIRER_TIMEOUT,
            DEFAULT_SANITIZE_PASSES);
    }

    public RefinementSettings withMaxIterations(int value) {
        return new RefinementSettings(value, stuckThreshold, rowChangeRatio, rowChangeAbsolute,
            misalignedRowLimit, concurrency, validatorTimeout, repairerTimeout, sanitizePasses);
    }

    public RefinementSettings withConcurrency(int value) {
        return new RefinementSettings(maxIterations, stuckThreshold, rowChangeRatio, rowChangeAbsolute,
            misalignedRowLimit, value, validatorTimeout, repairerTimeout, sanitizePasses);
    }

    public RefinementSettings withTimeouts(Duration validator, Duration repairer) {
        return new RefinementSettings(maxIterations, stuckThreshold, rowChangeRatio, rowChangeAbsolute,
            misalignedRowLimit, concurrency, validator, repairer, sanitizePasses);
    }
}
