package com.phillippitts.simrecon.config.properties;

import com.phillippitts.simrecon.util.ProcessTimeouts;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the paired-parallel workers.
 *
 * <p>Each worker is a single thread; only naming and shutdown behaviour are tunable.
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private WorkerProperties invocation = new WorkerProperties("simrecon-invoke-");
    private WorkerProperties postProcessing = new WorkerProperties("simrecon-post-");

    public WorkerProperties getInvocation() {
        return invocation;
    }

    public void setInvocation(WorkerProperties invocation) {
        this.invocation = invocation;
    }

    public WorkerProperties getPostProcessing() {
        return postProcessing;
    }

    public void setPostProcessing(WorkerProperties postProcessing) {
        this.postProcessing = postProcessing;
    }

    /**
     * Single-thread worker configuration.
     */
    public static class WorkerProperties {
        private String threadNamePrefix;
        private int awaitTerminationSeconds = (int) ProcessTimeouts.WORKER_SHUTDOWN_TIMEOUT.toSeconds();

        public WorkerProperties() {
            this("simrecon-worker-");
        }

        public WorkerProperties(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }
    }
}
