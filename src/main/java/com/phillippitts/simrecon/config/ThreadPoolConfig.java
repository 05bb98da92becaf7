package com.phillippitts.simrecon.config;

import com.phillippitts.simrecon.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * The two single-thread workers used by paired-parallel scheduling.
 *
 * <p>One worker runs job invocation phases, the other post-processing phases, so the next
 * job's engine run overlaps the previous job's output writing. Both queues are unbounded
 * and FIFO, which keeps jobs in submission order on each worker.
 *
 * <p>MDC propagation: the Log4j2 ThreadContext of the submitting thread is copied to the
 * worker so {@code jobId} appears in worker logs.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    @Bean(name = "invocationExecutor")
    public ThreadPoolTaskExecutor invocationExecutor() {
        return singleThreadWorker(threadPoolProperties.getInvocation());
    }

    @Bean(name = "postProcessingExecutor")
    public ThreadPoolTaskExecutor postProcessingExecutor() {
        return singleThreadWorker(threadPoolProperties.getPostProcessing());
    }

    private static ThreadPoolTaskExecutor singleThreadWorker(ThreadPoolProperties.WorkerProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(props.getAwaitTerminationSeconds());
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitter's ThreadContext into the task and restores the worker's afterwards.
     */
    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
