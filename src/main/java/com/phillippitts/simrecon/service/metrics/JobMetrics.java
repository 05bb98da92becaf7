package com.phillippitts.simrecon.service.metrics;

import com.phillippitts.simrecon.domain.JobResult;
import com.phillippitts.simrecon.service.orchestration.event.JobCompletedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Records job metrics from {@link JobCompletedEvent}s.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>simrecon.job.duration - wall-clock job duration by type and outcome</li>
 *   <li>simrecon.job.outcome - job count by type and outcome</li>
 *   <li>simrecon.job.skipped.channels - channels skipped under partial processing</li>
 * </ul>
 */
@Component
public class JobMetrics {

    private static final String METRIC_PREFIX = "simrecon.job";

    private final MeterRegistry registry;

    public JobMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @EventListener
    public void onJobCompleted(JobCompletedEvent event) {
        JobResult result = event.result();
        String outcome = result.outcome().name().toLowerCase(Locale.ROOT);

        Timer.builder(METRIC_PREFIX + ".duration")
                .description("Wall-clock duration of a job")
                .tag("type", event.jobType())
                .tag("outcome", outcome)
                .register(registry)
                .record(result.duration());

        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of jobs by outcome")
                .tag("type", event.jobType())
                .tag("outcome", outcome)
                .register(registry)
                .increment();

        if (!result.skippedWavelengths().isEmpty()) {
            Counter.builder(METRIC_PREFIX + ".skipped.channels")
                    .description("Channels skipped because no OTF was available")
                    .tag("type", event.jobType())
                    .register(registry)
                    .increment(result.skippedWavelengths().size());
        }
    }
}
