package com.phillippitts.simrecon.domain;

/**
 * User-visible result of a job.
 */
public enum JobOutcome {
    SUCCEEDED,
    /** Finished, but some channels were skipped because they had no configuration. */
    PARTIALLY_SUCCEEDED,
    FAILED
}
