package dev.flowdoctor.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Wraps a learning store so that its failures never reach the refinement loop. Failures are
 * logged at WARN and answered with "no result".
 */
public final class BestEffortLearningStore implements ErrorLearningStore {

    private static final Logger log = LoggerFactory.getLogger(BestEffortLearningStore.class);

    private final ErrorLearningStore delegate;

    public BestEffortLearningStore(ErrorLearningStore delegate) {
        this.delegate = delegate;
    }

    /** @return the pattern id, or null when the store failed */
    @Override
    public String logPattern(ExternalError error, String documentSnapshot) {
        try {
            return delegate.logPattern(error, documentSnapshot);
        } catch (RuntimeException e) {
            log.warn("Failed to log error pattern for '{}': {}", error.describe(), e.getMessage());
            return null;
        }
    }

    @Override
    public void logFixAttempt(String patternId, String fixDescription, boolean succeeded) {
        if (patternId == null) {
            return;
        }
        try {
            delegate.logFixAttempt(patternId, fixDescription, succeeded);
        } catch (RuntimeException e) {
            log.warn("Failed to log fix attempt for {}: {}", patternId, e.getMessage());
        }
    }

    @Override
    public List<FixHint> getKnownFixes(List<ExternalError> errors) {
        try {
            return delegate.getKnownFixes(errors);
        } catch (RuntimeException e) {
            log.warn("Failed to query known fixes: {}", e.getMessage());
            return List.of();
        }
    }
}
