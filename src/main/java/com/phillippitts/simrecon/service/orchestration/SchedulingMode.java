package com.phillippitts.simrecon.service.orchestration;

/**
 * How a batch of jobs is scheduled. Exactly one mode applies to a batch.
 */
public enum SchedulingMode {
    /** One job, run synchronously on the caller thread. */
    SINGLE,
    /** Jobs run one after another on the caller thread, in order. */
    SEQUENTIAL,
    /** Invocation phases on one worker, post-processing phases on another. */
    PAIRED_PARALLEL,
    /** Whole jobs submitted to a caller-owned executor. */
    POOLED;

    /**
     * Picks the mode for a batch. A caller-supplied pool takes precedence over
     * {@code parallelProcess}.
     */
    public static SchedulingMode select(int jobCount, boolean parallelProcess, boolean hasPool) {
        if (hasPool) {
            return POOLED;
        }
        if (jobCount <= 1) {
            return SINGLE;
        }
        return parallelProcess ? PAIRED_PARALLEL : SEQUENTIAL;
    }
}
