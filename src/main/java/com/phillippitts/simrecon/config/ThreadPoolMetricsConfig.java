package com.phillippitts.simrecon.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes queue depth and activity of the paired-parallel workers via Micrometer.
 *
 * <p>Gauges, tagged {@code worker=invocation|post-processing}:
 * <ul>
 *   <li>simrecon.worker.active - tasks currently executing (0 or 1)</li>
 *   <li>simrecon.worker.queued - phases waiting for the worker</li>
 *   <li>simrecon.worker.completed - cumulative completed phases</li>
 * </ul>
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    @Bean
    public MeterBinder workerMetrics(
            @Qualifier("invocationExecutor") ThreadPoolTaskExecutor invocationExecutor,
            @Qualifier("postProcessingExecutor") ThreadPoolTaskExecutor postProcessingExecutor) {
        Map<String, ThreadPoolTaskExecutor> workers = Map.of(
                "invocation", invocationExecutor,
                "post-processing", postProcessingExecutor);
        return registry -> {
            workers.forEach((name, worker) -> {
                ThreadPoolExecutor executor = worker.getThreadPoolExecutor();
                Gauge.builder("simrecon.worker.active", executor, ThreadPoolExecutor::getActiveCount)
                        .description("Phases currently executing on the worker")
                        .tag("worker", name)
                        .register(registry);
                Gauge.builder("simrecon.worker.queued", executor, e -> e.getQueue().size())
                        .description("Phases waiting for the worker")
                        .tag("worker", name)
                        .register(registry);
                Gauge.builder("simrecon.worker.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                        .description("Cumulative count of completed phases")
                        .tag("worker", name)
                        .register(registry);
            });
            LOG.debug("Worker metrics registered: simrecon.worker.*");
        };
    }
}
