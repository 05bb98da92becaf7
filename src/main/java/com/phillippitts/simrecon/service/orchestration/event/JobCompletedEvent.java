package com.phillippitts.simrecon.service.orchestration.event;

import com.phillippitts.simrecon.domain.JobResult;

import java.time.Instant;

/**
 * Emitted after every job, whether it succeeded or not.
 *
 * @param result final job result
 * @param jobType "reconstruction" or "otf"
 * @param timestamp when the job completed
 */
public record JobCompletedEvent(
        JobResult result,
        String jobType,
        Instant timestamp
) {}
