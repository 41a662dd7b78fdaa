package com.prreview.orchestrator.queue;

import com.prreview.orchestrator.pipeline.ReviewPipeline;
import com.prreview.orchestrator.pipeline.TaskOutcome;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process job queue backed by a fixed worker pool.
 *
 * Each worker runs one pipeline at a time; the pool size caps how many
 * reviews (and so how many GitHub and Claude calls) run concurrently.
 * The backlog is bounded: when it is full, enqueue fails with
 * {@link DispatchException} instead of growing without limit.
 *
 * The queue is volatile. Jobs lost on restart are picked up again by
 * {@link PendingTaskRedispatcher}.
 */
@Component
public class ExecutorJobQueue implements JobQueue {

    private static final Logger log = LoggerFactory.getLogger(ExecutorJobQueue.class);

    private enum State { QUEUED, RUNNING, CANCELLED, DONE }

    private final ReviewPipeline     pipeline;
    private final ThreadPoolExecutor workers;
    private final ConcurrentHashMap<UUID, QueuedJob> jobs = new ConcurrentHashMap<>();

    public ExecutorJobQueue(ReviewPipeline pipeline,
                            @Value("${review.worker.count:4}") int workerCount,
                            @Value("${review.worker.queue-capacity:100}") int queueCapacity) {
        this.pipeline = pipeline;
        this.workers  = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                new WorkerThreadFactory());
        log.info("Review queue started with {} workers, capacity {}", workerCount, queueCapacity);
    }

    // ------------------------------------------------------------------
    // JobQueue
    // ------------------------------------------------------------------

    @Override
    public void enqueue(ReviewJob job) {
        QueuedJob queued = new QueuedJob(job);
        if (jobs.putIfAbsent(job.taskId(), queued) != null) {
            log.info("Task {} is already queued or running, ignoring duplicate enqueue", job.taskId());
            return;
        }
        try {
            workers.execute(queued);
        } catch (RejectedExecutionException e) {
            jobs.remove(job.taskId(), queued);
            throw new DispatchException("Review queue unavailable: cannot accept task " + job.taskId(), e);
        }
        log.debug("Enqueued {}", job);
    }

    @Override
    public boolean cancel(UUID taskId) {
        QueuedJob queued = jobs.get(taskId);
        if (queued == null) {
            return false;
        }
        if (!queued.state.compareAndSet(State.QUEUED, State.CANCELLED)) {
            log.info("Task {} is already {}, cancel has no effect", taskId, queued.state.get());
            return false;
        }
        workers.remove(queued);
        jobs.remove(taskId, queued);
        log.info("Task {} cancelled before start", taskId);
        return true;
    }

    @Override
    public boolean isTracked(UUID taskId) {
        return jobs.containsKey(taskId);
    }

    /** Number of jobs waiting for a worker. */
    public int backlog() {
        return workers.getQueue().size();
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Review workers did not stop within 30s, interrupting");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    // ------------------------------------------------------------------
    // Worker side
    // ------------------------------------------------------------------

    private void report(TaskOutcome outcome) {
        switch (outcome.result()) {
            case FAILED -> log.error("Task {} failed ({}): {}",
                    outcome.taskId(), outcome.errorKind(), outcome.message());
            case SKIPPED -> log.info("Task {} skipped: {}", outcome.taskId(), outcome.message());
            case COMPLETED -> log.info("Task {} completed", outcome.taskId());
        }
    }

    /**
     * A job plus its claim state. Worker and cancel() race on the
     * QUEUED → RUNNING / QUEUED → CANCELLED transition; exactly one wins.
     */
    private final class QueuedJob implements Runnable {

        private final ReviewJob job;
        private final AtomicReference<State> state = new AtomicReference<>(State.QUEUED);

        QueuedJob(ReviewJob job) {
            this.job = job;
        }

        @Override
        public void run() {
            if (!state.compareAndSet(State.QUEUED, State.RUNNING)) {
                return;
            }
            try {
                report(pipeline.execute(job));
            } catch (RuntimeException e) {
                log.error("Unhandled error in review worker for task {}: {}",
                        job.taskId(), e.getMessage(), e);
            } finally {
                state.set(State.DONE);
                jobs.remove(job.taskId(), this);
            }
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "review-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
