package dev.flowdoctor.backend;

import java.util.List;

/**
 * Verdict of the semantic validator. {@code versionId} is present only for accepted documents.
 */
public record ValidationResponse(boolean valid, List<ExternalError> errors, String versionId) {

    public ValidationResponse {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ValidationResponse accepted(String versionId) {
        return new ValidationResponse(true, List.of(), versionId);
    }

    public static ValidationResponse rejected(List<ExternalError> errors) {
        return new ValidationResponse(false, errors, null);
    }
}
