package com.phillippitts.simrecon.service.orchestration;

import com.phillippitts.simrecon.domain.JobOutcome;
import com.phillippitts.simrecon.domain.JobResult;
import com.phillippitts.simrecon.domain.JobState;
import com.phillippitts.simrecon.domain.OutputType;
import com.phillippitts.simrecon.service.files.OutputPathRequest;
import com.phillippitts.simrecon.service.files.PathAllocator;
import com.phillippitts.simrecon.service.files.TextFileCombiner;
import com.phillippitts.simrecon.service.workspace.TemporaryWorkspace;
import com.phillippitts.simrecon.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One unit of work tied to a single input file, split into two phases so that schedulers can
 * run them on different threads.
 *
 * <ul>
 *   <li>{@link #invocationPhase()}: resolve, prepare the workspace, run the engine</li>
 *   <li>{@link #completionPhase()}: post-process, release resources, build the result</li>
 * </ul>
 *
 * <p>Neither phase throws for job failures. A failure moves the job to FAILED, later steps
 * are skipped, resources are still released, and the failure is reported in the
 * {@link JobResult}. Every phase runs with {@code jobId} in the Log4j2 ThreadContext.
 */
public abstract class AbstractSimJob {

    private static final Logger LOG = LogManager.getLogger(AbstractSimJob.class);

    public static final String JOB_ID_KEY = "jobId";

    private final String jobId;
    private final Path source;
    private final JobCollaborators collaborators;
    private final JobStateMachine state = new JobStateMachine();
    private final List<Path> outputs = new ArrayList<>();
    private final List<Integer> skippedWavelengths = new ArrayList<>();
    private volatile long startNanos;
    private volatile TemporaryWorkspace workspace;

    protected AbstractSimJob(Path source, JobCollaborators collaborators) {
        this.jobId = UUID.randomUUID().toString().substring(0, 8);
        this.source = Objects.requireNonNull(source, "source");
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
    }

    public String jobId() {
        return jobId;
    }

    public Path source() {
        return source;
    }

    public JobStateMachine state() {
        return state;
    }

    /**
     * Short job kind used in events and metrics tags.
     */
    public abstract String jobType();

    /**
     * Resolves configuration and prepares the workspace, then runs the engine.
     */
    public final void invocationPhase() {
        withJobContext(() -> {
            startNanos = System.nanoTime();
            if (state.current().isTerminal()) {
                return;
            }
            try {
                resolve();
                state.advance(JobState.CONFIG_RESOLVED);
                workspace = createWorkspace();
                state.advance(JobState.WORKSPACE_PREPARED);
                state.advance(JobState.INVOKING);
                invoke();
            } catch (RuntimeException e) {
                markFailed(e);
            }
        });
    }

    /**
     * Post-processes (unless the job already failed), releases the workspace and reports.
     */
    public final JobResult completionPhase() {
        withJobContext(() -> {
            if (!state.isFailed()) {
                try {
                    state.advance(JobState.POST_PROCESSING);
                    postProcess();
                    state.advance(JobState.CLEANUP);
                } catch (RuntimeException e) {
                    markFailed(e);
                }
            }
            releaseWorkspace();
            if (!state.isFailed()) {
                state.advance(JobState.DONE);
                LOG.info("Job {} finished for {} ({} output(s))", jobId, source.getFileName(), outputs.size());
            }
        });
        return result();
    }

    /**
     * Runs both phases on the calling thread.
     */
    public final JobResult run() {
        invocationPhase();
        return completionPhase();
    }

    /**
     * Fails the job from outside (for example when a scheduler could not run a phase) and
     * completes it so its resources are released.
     */
    public final JobResult abort(Throwable cause) {
        withJobContext(() -> markFailed(cause));
        return completionPhase();
    }

    protected abstract void resolve();

    /**
     * Parent directory of this job's workspace.
     */
    protected abstract Path workspaceParent();

    protected abstract boolean deleteWorkspace();

    protected abstract boolean ignoreCleanupErrors();

    protected abstract void invoke();

    protected abstract void postProcess();

    protected final TemporaryWorkspace workspace() {
        TemporaryWorkspace current = workspace;
        if (current == null) {
            throw new IllegalStateException("Workspace not prepared for job " + jobId);
        }
        return current;
    }

    protected final JobCollaborators collaborators() {
        return collaborators;
    }

    protected final String sourceStem() {
        return PathAllocator.stemOf(source);
    }

    protected final void addOutput(Path output) {
        outputs.add(output);
    }

    protected final void skipWavelength(int wavelength) {
        skippedWavelengths.add(wavelength);
    }

    /**
     * Allocates a final output path; unique unless {@code overwrite}.
     */
    protected final Path allocateOutput(OutputType type, String suffix, Integer wavelength,
                                        Path outputDirectory, boolean overwrite) {
        OutputPathRequest request = OutputPathRequest.builder(source, type, suffix)
                .outputDirectory(outputDirectory)
                .wavelength(wavelength)
                .ensureUnique(!overwrite)
                .build();
        return collaborators.pathAllocator().createOutputPath(request);
    }

    /**
     * Concatenates the per-channel engine logs that were actually written into one log file.
     */
    protected final void writeCombinedLog(Path logFile, List<Path> channelLogs) {
        List<Path> existing = channelLogs.stream().filter(Files::isRegularFile).toList();
        if (existing.isEmpty()) {
            LOG.debug("No engine logs captured for job {}", jobId);
            return;
        }
        TextFileCombiner.combine(logFile, "Job " + jobId + " (" + source + ")", existing);
        LOG.info("Engine log written to {}", logFile);
    }

    private TemporaryWorkspace createWorkspace() {
        return TemporaryWorkspace.builder(workspaceParent())
                .name(sourceStem() + "_" + jobId)
                .delete(deleteWorkspace())
                .ignoreCleanupErrors(ignoreCleanupErrors())
                .pathAllocator(collaborators.pathAllocator())
                .create();
    }

    private void releaseWorkspace() {
        TemporaryWorkspace current = workspace;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (RuntimeException e) {
            if (state.isFailed()) {
                state.failure().addSuppressed(e);
            } else {
                markFailed(e);
            }
        }
    }

    private void markFailed(Throwable cause) {
        JobState failedIn = state.current();
        if (state.fail(cause)) {
            LOG.error("Job {} failed during {} for {}: {}", jobId, failedIn, source, cause.getMessage(), cause);
        }
    }

    private JobResult result() {
        JobState finalState = state.current();
        JobOutcome outcome;
        if (finalState != JobState.DONE) {
            outcome = JobOutcome.FAILED;
        } else if (skippedWavelengths.isEmpty()) {
            outcome = JobOutcome.SUCCEEDED;
        } else {
            outcome = JobOutcome.PARTIALLY_SUCCEEDED;
        }
        List<Path> written = outcome == JobOutcome.FAILED ? List.of() : outputs;
        return new JobResult(jobId, source, outcome, finalState, written, skippedWavelengths,
                state.failure(), TimeUtils.elapsed(startNanos));
    }

    private void withJobContext(Runnable body) {
        String previous = ThreadContext.get(JOB_ID_KEY);
        ThreadContext.put(JOB_ID_KEY, jobId);
        try {
            body.run();
        } finally {
            if (previous == null) {
                ThreadContext.remove(JOB_ID_KEY);
            } else {
                ThreadContext.put(JOB_ID_KEY, previous);
            }
        }
    }
}
