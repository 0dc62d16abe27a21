package dev.flowdoctor.refine;

import dev.flowdoctor.backend.ExternalError;

import java.util.List;

/**
 * Outcome of a refinement session.
 *
 * @param status          ACCEPTED, EXHAUSTED or STUCK
 * @param csv             the best document reached
 * @param iterations      validator round trips made
 * @param fixesMade       every fix applied, deterministic and generative, in order
 * @param remainingErrors errors of the last validation; empty when accepted
 * @param versionId       validator's version id for an accepted document, else null
 * @param timings         one entry per iteration
 */
public record RefinementResult(
    RefinementState status,
    String csv,
    int iterations,
    List<String> fixesMade,
    List<ExternalError> remainingErrors,
    String versionId,
    List<IterationTiming> timings
) {
    public RefinementResult {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Result status must be terminal, got " + status);
        }
        fixesMade = List.copyOf(fixesMade);
        remainingErrors = List.copyOf(remainingErrors);
        timings = List.copyOf(timings);
    }

    public boolean isAccepted() {
        return status == RefinementState.ACCEPTED;
    }
}
