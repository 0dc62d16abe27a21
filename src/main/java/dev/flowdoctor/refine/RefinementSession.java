package dev.flowdoctor.refine;

import dev.flowdoctor.backend.ExternalError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one refinement session. Confined to the thread running the session.
 */
public final class RefinementSession {

    private static final Logger log = LoggerFactory.getLogger(RefinementSession.class);

    private final String label;
    private final long startTime;
    private final StuckLoopDetector stuckLoopDetector;
    private final List<String> fixesMade = new ArrayList<>();
    private final List<IterationTiming> timings = new ArrayList<>();
    private final Map<String, String> patternIds = new HashMap<>();
    private RefinementState state;
    private String csv;
    private int iteration;
    private List<ExternalError> lastErrors = List.of();

    public RefinementSession(String label, String csv, int stuckThreshold) {
        this.label = label;
        this.csv = csv;
        this.stuckLoopDetector = new StuckLoopDetector(stuckThreshold);
        this.state = RefinementState.SANITIZING;
        this.startTime = System.currentTimeMillis();
    }

    public String label() { return label; }
    public RefinementState state() { return state; }
    public String csv() { return csv; }
    public int iteration() { return iteration; }
    public long startTime() { return startTime; }
    public List<ExternalError> lastErrors() { return lastErrors; }
    public StuckLoopDetector stuckLoopDetector() { return stuckLoopDetector; }
    public List<String> fixesMade() { return Collections.unmodifiableList(fixesMade); }
    public List<IterationTiming> timings() { return Collections.unmodifiableList(timings); }

    public int nextIteration() {
        return ++iteration;
    }

    public void transitionTo(RefinementState next) {
        log.info("[{}] iteration {}: {} -> {}", label, iteration, state, next);
        this.state = next;
    }

    public void updateCsv(String newCsv) {
        this.csv = newCsv;
    }

    public void addFix(String fix) {
        fixesMade.add(fix);
    }

    public void addFixes(List<String> fixes) {
        fixesMade.addAll(fixes);
    }

    /** The last few fixes, as a description for the learning store. */
    public String recentFixes(int count) {
        int from = Math.max(0, fixesMade.size() - count);
        return String.join("; ", fixesMade.subList(from, fixesMade.size()));
    }

    public void setLastErrors(List<ExternalError> errors) {
        this.lastErrors = List.copyOf(errors);
    }

    public String patternId(String signature) {
        return patternIds.get(signature);
    }

    public boolean hasPattern(String signature) {
        return patternIds.containsKey(signature);
    }

    public void rememberPattern(String signature, String patternId) {
        patternIds.put(signature, patternId);
    }

    public void recordTiming(IterationTiming timing) {
        timings.add(timing);
        log.debug("[{}] {}", label, timing.summary());
    }

    public RefinementResult finish(RefinementState status, String versionId) {
        transitionTo(status);
        List<ExternalError> remaining = status == RefinementState.ACCEPTED ? List.of() : lastErrors;
        return new RefinementResult(status, csv, iteration, fixesMade, remaining, versionId, timings);
    }
}
