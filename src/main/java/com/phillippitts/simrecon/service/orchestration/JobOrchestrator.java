package com.phillippitts.simrecon.service.orchestration;

import com.phillippitts.simrecon.domain.BatchResult;
import com.phillippitts.simrecon.domain.JobResult;
import com.phillippitts.simrecon.service.orchestration.event.JobCompletedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a batch of independent jobs under one {@link SchedulingMode}.
 *
 * <p>One job's failure never aborts its siblings: every job yields a {@link JobResult} and
 * the batch result lists them in submission order. A {@link JobCompletedEvent} is published
 * for each job from the calling thread once its result is known.
 *
 * <p>Caller-supplied pools are used as-is and never shut down here. The paired workers are
 * application-scoped single-thread executors.
 */
@Service
public class JobOrchestrator {

    private static final Logger LOG = LogManager.getLogger(JobOrchestrator.class);

    private final Executor invocationWorker;
    private final Executor postProcessingWorker;
    private final ApplicationEventPublisher publisher;

    public JobOrchestrator(@Qualifier("invocationExecutor") Executor invocationWorker,
                           @Qualifier("postProcessingExecutor") Executor postProcessingWorker,
                           ApplicationEventPublisher publisher) {
        this.invocationWorker = Objects.requireNonNull(invocationWorker, "invocationWorker");
        this.postProcessingWorker = Objects.requireNonNull(postProcessingWorker, "postProcessingWorker");
        this.publisher = publisher;
    }

    /**
     * Runs {@code jobs} and waits for all of them.
     *
     * @param pool caller-owned executor, required for {@link SchedulingMode#POOLED}
     */
    public BatchResult runAll(List<? extends AbstractSimJob> jobs, SchedulingMode mode, Executor pool) {
        Objects.requireNonNull(jobs, "jobs");
        Objects.requireNonNull(mode, "mode");
        LOG.info("Running {} job(s) in {} mode", jobs.size(), mode);

        List<JobResult> results;
        switch (mode) {
            case SINGLE:
            case SEQUENTIAL:
                results = runSequential(jobs);
                break;
            case PAIRED_PARALLEL:
                results = runPaired(jobs);
                break;
            case POOLED:
                if (pool == null) {
                    throw new IllegalArgumentException("POOLED mode requires an executor");
                }
                results = runPooled(jobs, pool);
                break;
            default:
                throw new IllegalStateException("Unknown scheduling mode: " + mode);
        }

        BatchResult batch = new BatchResult(results);
        if (batch.hasFailures()) {
            LOG.warn("{} of {} job(s) failed", batch.failures().size(), results.size());
        } else {
            LOG.info("All {} job(s) completed", results.size());
        }
        return batch;
    }

    /**
     * Chooses the mode for {@code jobCount} jobs; a pool wins over {@code parallelProcess}.
     */
    public SchedulingMode selectMode(int jobCount, boolean parallelProcess, Executor pool) {
        if (pool != null && parallelProcess) {
            LOG.warn("Executor supplied; ignoring parallel processing flag");
        }
        return SchedulingMode.select(jobCount, parallelProcess, pool != null);
    }

    private List<JobResult> runSequential(List<? extends AbstractSimJob> jobs) {
        List<JobResult> results = new ArrayList<>(jobs.size());
        for (AbstractSimJob job : jobs) {
            results.add(completed(job, job.run()));
        }
        return results;
    }

    private List<JobResult> runPaired(List<? extends AbstractSimJob> jobs) {
        List<CompletableFuture<JobResult>> futures = new ArrayList<>(jobs.size());
        for (AbstractSimJob job : jobs) {
            try {
                futures.add(CompletableFuture
                        .runAsync(job::invocationPhase, invocationWorker)
                        .thenApplyAsync(ignored -> job.completionPhase(), postProcessingWorker));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.failedFuture(e));
            }
        }
        return awaitAll(jobs, futures);
    }

    private List<JobResult> runPooled(List<? extends AbstractSimJob> jobs, Executor pool) {
        List<CompletableFuture<JobResult>> futures = new ArrayList<>(jobs.size());
        for (AbstractSimJob job : jobs) {
            try {
                futures.add(CompletableFuture.supplyAsync(job::run, pool));
            } catch (RejectedExecutionException e) {
                futures.add(CompletableFuture.failedFuture(e));
            }
        }
        return awaitAll(jobs, futures);
    }

    private List<JobResult> awaitAll(List<? extends AbstractSimJob> jobs, List<CompletableFuture<JobResult>> futures) {
        List<JobResult> results = new ArrayList<>(jobs.size());
        for (int i = 0; i < jobs.size(); i++) {
            AbstractSimJob job = jobs.get(i);
            JobResult result;
            try {
                result = futures.get(i).join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOG.error("Job {} could not be scheduled: {}", job.jobId(), cause.toString());
                result = job.abort(cause);
            }
            results.add(completed(job, result));
        }
        return results;
    }

    private JobResult completed(AbstractSimJob job, JobResult result) {
        if (publisher != null) {
            publisher.publishEvent(new JobCompletedEvent(result, job.jobType(), Instant.now()));
        }
        return result;
    }
}
