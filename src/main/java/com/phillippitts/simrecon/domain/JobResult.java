package com.phillippitts.simrecon.domain;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Outcome of one job, as reported to the caller once its batch completes.
 *
 * @param jobId unique job identifier
 * @param source input file of the job
 * @param outcome user-visible outcome
 * @param finalState state the job ended in ({@link JobState#DONE} or {@link JobState#FAILED})
 * @param outputs files written by the job (empty on failure)
 * @param skippedWavelengths channels skipped under partial processing
 * @param failure cause of failure, or {@code null}
 * @param duration wall-clock duration of the job
 */
public record JobResult(
        String jobId,
        Path source,
        JobOutcome outcome,
        JobState finalState,
        List<Path> outputs,
        List<Integer> skippedWavelengths,
        Throwable failure,
        Duration duration
) {
    public JobResult {
        outputs = List.copyOf(outputs);
        skippedWavelengths = List.copyOf(skippedWavelengths);
    }

    public boolean isFailed() {
        return outcome == JobOutcome.FAILED;
    }
}
