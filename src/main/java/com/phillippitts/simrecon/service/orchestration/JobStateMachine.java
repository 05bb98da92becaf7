package com.phillippitts.simrecon.service.orchestration;

import com.phillippitts.simrecon.domain.JobState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe lifecycle tracker for one job.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * PENDING → CONFIG_RESOLVED → WORKSPACE_PREPARED → INVOKING → POST_PROCESSING → CLEANUP → DONE
 * any non-terminal state → FAILED (via fail)
 * </pre>
 *
 * <p>Phases of a paired-parallel job run on different workers, so every access goes through
 * a {@link ReentrantLock}.
 */
public final class JobStateMachine {

    private final Lock lock = new ReentrantLock();
    private final List<JobState> history = new ArrayList<>();
    private JobState current = JobState.PENDING;
    private Throwable failure;

    public JobStateMachine() {
        history.add(JobState.PENDING);
    }

    /**
     * Moves to the next forward state.
     *
     * @throws IllegalStateException if {@code next} is not the immediate successor
     */
    public void advance(JobState next) {
        Objects.requireNonNull(next, "next");
        if (next == JobState.FAILED) {
            throw new IllegalArgumentException("Use fail(cause) to enter FAILED");
        }
        lock.lock();
        try {
            if (!current.canTransitionTo(next)) {
                throw new IllegalStateException("Illegal job transition " + current + " -> " + next);
            }
            current = next;
            history.add(next);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a failure and moves to FAILED.
     *
     * @return {@code false} if the job had already reached a terminal state
     */
    public boolean fail(Throwable cause) {
        lock.lock();
        try {
            if (current.isTerminal()) {
                return false;
            }
            failure = cause;
            current = JobState.FAILED;
            history.add(JobState.FAILED);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public JobState current() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFailed() {
        return current() == JobState.FAILED;
    }

    /**
     * @return cause recorded by {@link #fail}, or {@code null}
     */
    public Throwable failure() {
        lock.lock();
        try {
            return failure;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return every state visited, in order, starting with PENDING
     */
    public List<JobState> history() {
        lock.lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.unlock();
        }
    }
}
