package dev.flowdoctor.refine;

import dev.flowdoctor.allocate.NodeAllocator;
import dev.flowdoctor.backend.BestEffortLearningStore;
import dev.flowdoctor.backend.Credentials;
import dev.flowdoctor.backend.ErrorLearningStore;
import dev.flowdoctor.backend.ErrorSignatures;
import dev.flowdoctor.backend.ExternalError;
import dev.flowdoctor.backend.ExternalServiceException;
import dev.flowdoctor.backend.FixHint;
import dev.flowdoctor.backend.GenerativeRepairer;
import dev.flowdoctor.backend.RepairProposal;
import dev.flowdoctor.backend.SemanticValidator;
import dev.flowdoctor.backend.ValidationResponse;
import dev.flowdoctor.engine.StructuralValidator;
import dev.flowdoctor.model.RefinementSettings;
import dev.flowdoctor.repair.RepairEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Drives a flow document to acceptance by the semantic validator: sanitize, validate, fix what the
 * heuristics can, ask the generative repairer for the rest, verify its output, and repeat until
 * accepted, out of iterations, or stuck.
 *
 * <p>Validator failures end the session with an {@link ExternalServiceException}. Repairer
 * failures are logged and the iteration goes on with programmatic fixes only.
 */
public final class RefinementOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RefinementOrchestrator.class);

    static final String VALIDATOR = "semantic validator";
    static final String REPAIRER = "generative repairer";
    static final int RECENT_FIXES = 5;

    private final SemanticValidator validator;
    private final GenerativeRepairer repairer;
    private final ErrorLearningStore learningStore;
    private final Sanitizer sanitizer;
    private final ProgrammaticFixer fixer;
    private final RefinementGuardRails guardRails;
    private final RefinementSettings settings;

    public RefinementOrchestrator(SemanticValidator validator, GenerativeRepairer repairer,
                                  ErrorLearningStore learningStore, RefinementSettings settings) {
        this(validator, repairer, learningStore, settings,
            new Sanitizer(StructuralValidator.withBuiltInContract(), RepairEngine.withDefaults(),
                NodeAllocator.withDefaultBands(), settings.sanitizePasses()));
    }

    public RefinementOrchestrator(SemanticValidator validator, GenerativeRepairer repairer,
                                  ErrorLearningStore learningStore, RefinementSettings settings,
                                  Sanitizer sanitizer) {
        this.validator = validator;
        this.repairer = repairer;
        this.learningStore = new BestEffortLearningStore(learningStore);
        this.sanitizer = sanitizer;
        this.fixer = new ProgrammaticFixer();
        this.guardRails = new RefinementGuardRails(settings);
        this.settings = settings;
    }

    public RefinementSettings settings() {
        return settings;
    }

    public RefinementResult refine(String csv, Credentials credentials) {
        return refine("session", csv, credentials);
    }

    /**
     * Run one session to completion.
     *
     * @throws ExternalServiceException when the semantic validator fails or rejects the credentials
     */
    public RefinementResult refine(String label, String csv, Credentials credentials) {
        var session = new RefinementSession(label, csv, settings.stuckThreshold());
        try (var runner = new ExternalCallRunner()) {
            RefinementResult result = run(session, credentials, runner);
            logSummary(session, result);
            return result;
        } catch (ExternalServiceException e) {
            log.error("[{}] Session aborted in iteration {}: {}", label, session.iteration(), e.getMessage());
            throw e;
        }
    }

    public CompletableFuture<RefinementResult> refineAsync(String label, String csv, Credentials credentials,
                                                           Executor executor) {
        return CompletableFuture.supplyAsync(() -> refine(label, csv, credentials), executor);
    }

    private RefinementResult run(RefinementSession session, Credentials credentials, ExternalCallRunner runner) {
        while (session.iteration() < settings.maxIterations()) {
            int iteration = session.nextIteration();
            long iterationStart = System.nanoTime();

            session.transitionTo(RefinementState.SANITIZING);
            long phaseStart = System.nanoTime();
            Sanitizer.Sanitized sanitized = sanitizer.sanitize(session.csv());
            if (sanitized.changed()) {
                log.info("[{}] Sanitizer applied {} fix(es) in iteration {}", session.label(),
                    sanitized.fixLog().size(), iteration);
                session.addFixes(sanitized.fixLog());
            }
            session.updateCsv(sanitized.csv());
            long sanitizeMillis = millisSince(phaseStart);

            session.transitionTo(RefinementState.EXTERNAL_VALIDATING);
            phaseStart = System.nanoTime();
            String document = session.csv();
            ValidationResponse response = runner.call(VALIDATOR, settings.validatorTimeout(),
                () -> validator.validate(document, credentials));
            long validatorMillis = millisSince(phaseStart);
            int errorsIn = session.lastErrors().size();

            if (response.valid()) {
                recordOutcomes(session, List.of());
                session.recordTiming(new IterationTiming(iteration, sanitizeMillis, validatorMillis, 0,
                    millisSince(iterationStart), errorsIn, 0));
                log.info("[{}] Accepted in iteration {}", session.label(), iteration);
                return session.finish(RefinementState.ACCEPTED, response.versionId());
            }

            List<ExternalError> errors = response.errors();
            log.info("[{}] Validator reported {} error(s) in iteration {}", session.label(), errors.size(), iteration);
            logPatterns(session, errors);
            recordOutcomes(session, errors);
            session.setLastErrors(errors);

            StuckLoopDetector.Observation observation = session.stuckLoopDetector().observe(signatures(errors));
            if (observation.stuck()) {
                log.warn("[{}] Same {} error(s) as the previous iteration ({} consecutive)", session.label(),
                    errors.size(), observation.consecutiveStuck());
            }
            if (observation.shouldStop()) {
                session.recordTiming(new IterationTiming(iteration, sanitizeMillis, validatorMillis, 0,
                    millisSince(iterationStart), errorsIn, errors.size()));
                log.warn("[{}] Stopping after {} consecutive stuck iterations", session.label(),
                    observation.consecutiveStuck());
                return session.finish(RefinementState.STUCK, null);
            }
            if (iteration >= settings.maxIterations()) {
                session.recordTiming(new IterationTiming(iteration, sanitizeMillis, validatorMillis, 0,
                    millisSince(iterationStart), errorsIn, errors.size()));
                break;
            }

            List<ExternalError> forRepairer = fixProgrammatically(session, errors);

            long repairerMillis = 0;
            if (forRepairer.isEmpty()) {
                log.info("[{}] No errors left for the repairer, re-validating", session.label());
            } else {
                session.transitionTo(RefinementState.AI_REFINING);
                phaseStart = System.nanoTime();
                refineWithRepairer(session, runner, errors, forRepairer);
                repairerMillis = millisSince(phaseStart);
            }
            session.recordTiming(new IterationTiming(iteration, sanitizeMillis, validatorMillis, repairerMillis,
                millisSince(iterationStart), errorsIn, errors.size()));
        }
        log.warn("[{}] Exhausted {} iteration(s) with {} error(s) left", session.label(),
            settings.maxIterations(), session.lastErrors().size());
        return session.finish(RefinementState.EXHAUSTED, null);
    }

    /**
     * Applies the heuristic fix for every error that has one. Returns the errors that need the
     * repairer: no heuristic applied and the signature is not known to be unfixable.
     */
    private List<ExternalError> fixProgrammatically(RefinementSession session, List<ExternalError> errors) {
        session.transitionTo(RefinementState.CLASSIFYING);
        var forRepairer = new ArrayList<ExternalError>();
        var fixable = new ArrayList<ExternalError>();
        for (ExternalError error : errors) {
            if (!fixer.fix(session.csv(), error).equals(session.csv())) {
                fixable.add(error);
            } else if (!session.stuckLoopDetector().isUnfixable(ErrorSignatures.normalize(error))) {
                forRepairer.add(error);
            }
        }

        session.transitionTo(RefinementState.PROGRAMMATIC_FIXING);
        for (ExternalError error : fixable) {
            String fixed = fixer.fix(session.csv(), error);
            if (!fixed.equals(session.csv())) {
                session.updateCsv(fixed);
                session.addFix("Programmatic fix for " + error.describe());
            }
        }
        log.info("[{}] Programmatic fixes: {}/{} error(s), {} left for the repairer", session.label(),
            fixable.size(), errors.size(), forRepairer.size());
        return forRepairer;
    }

    private void refineWithRepairer(RefinementSession session, ExternalCallRunner runner,
                                    List<ExternalError> errors, List<ExternalError> forRepairer) {
        List<FixHint> hints = learningStore.getKnownFixes(forRepairer);
        if (!hints.isEmpty()) {
            log.info("[{}] Passing {} known fix(es) to the repairer", session.label(), hints.size());
        }
        String document = session.csv();
        int iteration = session.iteration();
        RepairProposal proposal;
        try {
            proposal = runner.call(REPAIRER, settings.repairerTimeout(),
                () -> repairer.propose(document, forRepairer, iteration, hints));
        } catch (ExternalServiceException e) {
            log.warn("[{}] Repairer failed in iteration {}, continuing with programmatic fixes only: {}",
                session.label(), iteration, e.getMessage());
            return;
        }

        session.transitionTo(RefinementState.VERIFYING);
        RefinementGuardRails.Verdict verdict = guardRails.check(document, proposal.csv());
        String candidate;
        if (verdict.accepted()) {
            candidate = proposal.csv();
            session.addFixes(proposal.fixesMade());
        } else {
            log.warn("[{}] Rejected repairer output: {}", session.label(), verdict.reason());
            session.addFix("REJECTED: " + verdict.reason());
            candidate = document;
        }

        for (ExternalError error : errors) {
            if (!fixer.isErrorStillPresent(candidate, error)) {
                continue;
            }
            String fixed = fixer.fix(candidate, error);
            if (!fixed.equals(candidate)) {
                candidate = fixed;
                session.addFix("Programmatic fallback fix for " + error.describe());
            } else {
                log.debug("[{}] Still present after repair: {}", session.label(), error.describe());
            }
        }
        if (!proposal.stillBroken().isEmpty()) {
            log.info("[{}] Repairer could not fix: {}", session.label(), proposal.stillBroken());
        }
        session.updateCsv(candidate);
    }

    private void logPatterns(RefinementSession session, List<ExternalError> errors) {
        for (ExternalError error : errors) {
            String signature = ErrorSignatures.normalize(error);
            if (session.hasPattern(signature)) {
                continue;
            }
            String patternId = learningStore.logPattern(error, session.csv());
            if (patternId != null) {
                session.rememberPattern(signature, patternId);
            }
        }
    }

    /** Errors of the previous validation count as fixed when their signature is gone. */
    private void recordOutcomes(RefinementSession session, List<ExternalError> current) {
        if (session.lastErrors().isEmpty()) {
            return;
        }
        Set<String> currentSignatures = signatures(current);
        String fixes = session.recentFixes(RECENT_FIXES);
        for (String signature : signatures(session.lastErrors())) {
            learningStore.logFixAttempt(session.patternId(signature), fixes, !currentSignatures.contains(signature));
        }
    }

    private static Set<String> signatures(List<ExternalError> errors) {
        var signatures = new LinkedHashSet<String>();
        errors.forEach(e -> signatures.add(ErrorSignatures.normalize(e)));
        return signatures;
    }

    private static void logSummary(RefinementSession session, RefinementResult result) {
        long total = System.currentTimeMillis() - session.startTime();
        log.info("[{}] {} after {} iteration(s) in {} ms, {} fix(es), {} error(s) left", session.label(),
            result.status(), result.iterations(), total, result.fixesMade().size(), result.remainingErrors().size());
        long sanitize = 0;
        long validation = 0;
        long repair = 0;
        for (IterationTiming timing : result.timings()) {
            log.info("[{}] {}", session.label(), timing.summary());
            sanitize += timing.sanitizeMillis();
            validation += timing.validatorMillis();
            repair += timing.repairerMillis();
        }
        log.info("[{}] totals: sanitize {} ms | validator {} ms | repairer {} ms", session.label(),
            sanitize, validation, repair);
    }

    private static long millisSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
