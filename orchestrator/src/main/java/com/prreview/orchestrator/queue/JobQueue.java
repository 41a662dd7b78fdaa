package com.prreview.orchestrator.queue;

import java.util.UUID;

/**
 * Hands review jobs to workers for asynchronous execution.
 *
 * Delivery is at-least-once: the same task id may be delivered again
 * (see {@link PendingTaskRedispatcher}), so job handlers must be idempotent.
 */
public interface JobQueue {

    /**
     * Enqueue a job. Returns once the job is accepted; execution happens later
     * on a worker thread.
     *
     * @throws DispatchException if the queue cannot accept the job
     */
    void enqueue(ReviewJob job);

    /**
     * Best-effort request to stop a job that has not started yet.
     *
     * @return true if the job was still waiting and will now never run;
     *         false if it is unknown, already running, or finished
     */
    boolean cancel(UUID taskId);

    /** True while the job is waiting in the queue or running. */
    boolean isTracked(UUID taskId);
}
