package com.phillippitts.simrecon.domain;

/**
 * Lifecycle of a single job.
 *
 * <pre>
 * PENDING → CONFIG_RESOLVED → WORKSPACE_PREPARED → INVOKING → POST_PROCESSING → CLEANUP → DONE
 *    any non-terminal state → FAILED
 * </pre>
 */
public enum JobState {
    PENDING,
    CONFIG_RESOLVED,
    WORKSPACE_PREPARED,
    INVOKING,
    POST_PROCESSING,
    CLEANUP,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /**
     * Only the immediate successor is reachable, plus FAILED from any non-terminal state.
     */
    public boolean canTransitionTo(JobState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
