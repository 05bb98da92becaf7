package com.phillippitts.simrecon.exception;

import java.util.List;

/**
 * Raised once a batch has finished when one or more of its jobs failed.
 * Each job failure is attached as a suppressed exception.
 */
public class BatchProcessingException extends SimReconException {

    private final List<String> failedJobs;

    public BatchProcessingException(List<String> failedJobs, List<Throwable> causes) {
        super(failedJobs.size() + " job(s) failed: " + String.join(", ", failedJobs));
        this.failedJobs = List.copyOf(failedJobs);
        causes.forEach(this::addSuppressed);
    }

    public List<String> getFailedJobs() {
        return failedJobs;
    }
}
