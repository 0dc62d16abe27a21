package dev.flowdoctor.backend;

import java.util.List;

/**
 * Remembers which validator errors occurred and which fixes resolved them.
 */
public interface ErrorLearningStore {

    /** Record an occurrence and return the id of its pattern. */
    String logPattern(ExternalError error, String documentSnapshot);

    void logFixAttempt(String patternId, String fixDescription, boolean succeeded);

    List<FixHint> getKnownFixes(List<ExternalError> errors);
}
