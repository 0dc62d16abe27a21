package dev.flowdoctor.backend;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Error patterns and fix statistics kept for the life of the process. Thread-safe; sessions of a
 * parallel refinement share one instance.
 */
public final class InMemoryErrorLearningStore implements ErrorLearningStore {

    private final Map<String, ErrorPattern> patternsBySignature = new LinkedHashMap<>();
    private final Map<String, ErrorPattern> patternsById = new HashMap<>();
    private int nextId = 1;

    /** One recorded error shape. */
    public static final class ErrorPattern {
        private final String id;
        private final String signature;
        private final String category;
        private int occurrences;
        private final Map<String, FixStats> fixes = new LinkedHashMap<>();

        ErrorPattern(String id, String signature, String category) {
            this.id = id;
            this.signature = signature;
            this.category = category;
        }

        public String id() { return id; }
        public String signature() { return signature; }
        public String category() { return category; }
        public int occurrences() { return occurrences; }
    }

    private static final class FixStats {
        int attempts;
        int successes;

        double confidence() {
            return attempts == 0 ? 0.0 : (double) successes / attempts;
        }
    }

    @Override
    public synchronized String logPattern(ExternalError error, String documentSnapshot) {
        String signature = ErrorSignatures.normalize(error);
        ErrorPattern pattern = patternsBySignature.computeIfAbsent(signature, s -> {
            ErrorPattern created = new ErrorPattern("pattern-" + nextId++, s, ErrorSignatures.categorize(error));
            patternsById.put(created.id(), created);
            return created;
        });
        pattern.occurrences++;
        return pattern.id();
    }

    @Override
    public synchronized void logFixAttempt(String patternId, String fixDescription, boolean succeeded) {
        ErrorPattern pattern = patternsById.get(patternId);
        if (pattern == null) {
            throw new IllegalArgumentException("Unknown error pattern: " + patternId);
        }
        FixStats stats = pattern.fixes.computeIfAbsent(fixDescription, d -> new FixStats());
        stats.attempts++;
        if (succeeded) {
            stats.successes++;
        }
    }

    /**
     * Fixes that succeeded at least once for the errors' signatures, best first.
     */
    @Override
    public synchronized List<FixHint> getKnownFixes(List<ExternalError> errors) {
        Set<String> signatures = new LinkedHashSet<>();
        errors.forEach(e -> signatures.add(ErrorSignatures.normalize(e)));

        var hints = new ArrayList<FixHint>();
        for (String signature : signatures) {
            ErrorPattern pattern = patternsBySignature.get(signature);
            if (pattern == null) {
                continue;
            }
            pattern.fixes.forEach((description, stats) -> {
                if (stats.successes > 0) {
                    hints.add(new FixHint(signature, pattern.category(), description, stats.confidence()));
                }
            });
        }
        hints.sort(Comparator.comparingDouble(FixHint::confidence).reversed());
        return hints;
    }

    public synchronized int patternCount() {
        return patternsBySignature.size();
    }

    public synchronized ErrorPattern pattern(String signature) {
        return patternsBySignature.get(signature);
    }
}
