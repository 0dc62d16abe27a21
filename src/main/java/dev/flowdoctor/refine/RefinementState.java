package dev.flowdoctor.refine;

/**
 * States of one refinement session. {@link #ACCEPTED}, {@link #EXHAUSTED} and {@link #STUCK} end it.
 */
public enum RefinementState {
    SANITIZING,
    EXTERNAL_VALIDATING,
    ACCEPTED,
    CLASSIFYING,
    PROGRAMMATIC_FIXING,
    AI_REFINING,
    VERIFYING,
    EXHAUSTED,
    STUCK;

    public boolean isTerminal() {
        return this == ACCEPTED || this == EXHAUSTED || this == STUCK;
    }
}
