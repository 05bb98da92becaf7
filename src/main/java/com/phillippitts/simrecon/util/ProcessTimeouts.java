package com.phillippitts.simrecon.util;

import java.time.Duration;

/**
 * Standard durations for tearing down engine processes and worker pools.
 *
 * <p>These bound cleanup only. Engine runs themselves are never timed out by this
 * application; callers that need a deadline must enforce it around the engine.
 *
 * @see com.phillippitts.simrecon.service.engine.ProcessSimEngine
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Wait after {@link Process#destroy()} before escalating to a forcible kill.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Wait after {@link Process#destroyForcibly()} before giving up on the process.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Wait for in-flight phase tasks when the paired workers are shut down.
     */
    public static final Duration WORKER_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
