package dev.flowdoctor.refine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Compares the error signatures of consecutive validations. An iteration is stuck when its
 * signature set is non-empty and equal to the previous one; its signatures become unfixable and
 * are no longer sent to the generative repairer. The session stops once the number of consecutive
 * stuck iterations reaches the threshold.
 */
public final class StuckLoopDetector {

    private final int threshold;
    private final Set<String> unfixable = new LinkedHashSet<>();
    private Set<String> previous;
    private int consecutiveStuck;

    public StuckLoopDetector(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be at least 1, got " + threshold);
        }
        this.threshold = threshold;
    }

    /** What one observation concluded. */
    public record Observation(boolean stuck, int consecutiveStuck, boolean shouldStop) {}

    public Observation observe(Set<String> signatures) {
        boolean stuck = previous != null && !signatures.isEmpty() && previous.equals(signatures);
        if (stuck) {
            consecutiveStuck++;
            unfixable.addAll(signatures);
        } else {
            consecutiveStuck = 0;
        }
        previous = Set.copyOf(signatures);
        return new Observation(stuck, consecutiveStuck, consecutiveStuck >= threshold);
    }

    public boolean isUnfixable(String signature) {
        return unfixable.contains(signature);
    }

    public Set<String> unfixable() {
        return Collections.unmodifiableSet(unfixable);
    }
}
