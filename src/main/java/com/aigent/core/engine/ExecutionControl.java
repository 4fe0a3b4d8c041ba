package com.aigent.core.engine;

import com.aigent.core.model.WorkflowState;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation flag and deadline carried by one workflow execution.
 * <p>
 * Checked before every agent call. Cancelling also interrupts bounded agent calls in flight;
 * calls made inline (no deadline configured) finish on their own.
 */
public class ExecutionControl {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final int timeoutSeconds;
    private volatile long deadlineNanos;
    private volatile boolean started;

    /**
     * @param timeoutSeconds overall deadline measured from {@link #start()}; 0 for none
     */
    public ExecutionControl(int timeoutSeconds) {
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException("timeoutSeconds must not be negative: " + timeoutSeconds);
        }
        this.timeoutSeconds = timeoutSeconds;
    }

    public static ExecutionControl unbounded() {
        return new ExecutionControl(0);
    }

    /** Starts the deadline clock. Calling it again has no effect. */
    public synchronized void start() {
        if (started) {
            return;
        }
        if (timeoutSeconds > 0) {
            deadlineNanos = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        }
        started = true;
    }

    public int timeoutSeconds() {
        return timeoutSeconds;
    }

    public boolean hasDeadline() {
        return started && timeoutSeconds > 0;
    }

    /**
     * Nanoseconds left before the deadline, or {@link Long#MAX_VALUE} when there is none.
     */
    public long remainingNanos() {
        return hasDeadline() ? deadlineNanos - System.nanoTime() : Long.MAX_VALUE;
    }

    public boolean isExpired() {
        return hasDeadline() && remainingNanos() <= 0;
    }

    /**
     * Requests cancellation.
     *
     * @return false if the execution was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws WorkflowAbortedException if the execution was cancelled or its deadline passed
     */
    public void checkpoint() {
        if (cancelled.get()) {
            throw new WorkflowAbortedException(WorkflowState.CANCELLED, "Workflow cancelled");
        }
        if (isExpired()) {
            throw new WorkflowAbortedException(WorkflowState.TIMED_OUT,
                    "Workflow timed out after " + timeoutSeconds + " seconds");
        }
    }

    void track(Future<?> future) {
        inFlight.add(future);
        // cancel() may have run between submit and add
        if (cancelled.get()) {
            future.cancel(true);
        }
    }

    void untrack(Future<?> future) {
        inFlight.remove(future);
    }
}
