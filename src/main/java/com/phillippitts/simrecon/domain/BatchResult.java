package com.phillippitts.simrecon.domain;

import com.phillippitts.simrecon.exception.BatchProcessingException;

import java.util.List;

/**
 * Per-job outcomes of a batch, in submission order.
 */
public record BatchResult(List<JobResult> results) {

    public BatchResult {
        results = List.copyOf(results);
    }

    public List<JobResult> failures() {
        return results.stream().filter(JobResult::isFailed).toList();
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(JobResult::isFailed);
    }

    /**
     * Raises a single exception describing every failed job, or returns normally.
     *
     * @throws BatchProcessingException when at least one job failed
     */
    public void throwIfFailed() {
        List<JobResult> failed = failures();
        if (failed.isEmpty()) {
            return;
        }
        throw new BatchProcessingException(
                failed.stream().map(r -> r.jobId() + " (" + r.source() + ")").toList(),
                failed.stream().map(JobResult::failure).filter(t -> t != null).toList());
    }
}
