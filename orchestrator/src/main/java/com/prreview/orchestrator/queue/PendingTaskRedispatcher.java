package com.prreview.orchestrator.queue;

import com.prreview.orchestrator.model.ReviewTask;
import com.prreview.orchestrator.model.TaskStatus;
import com.prreview.orchestrator.repository.ReviewTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Redelivers PENDING tasks whose job the queue no longer holds.
 *
 * The in-process queue loses its contents on restart, which would leave
 * PENDING rows that never run. Every tick, tasks that have been PENDING for
 * longer than stale-after and are not tracked by the queue are enqueued
 * again, without a credential.
 *
 * PROCESSING rows orphaned by a killed worker are not touched here.
 */
@Component
@EnableScheduling
public class PendingTaskRedispatcher {

    private static final Logger log = LoggerFactory.getLogger(PendingTaskRedispatcher.class);

    private final ReviewTaskRepository taskRepo;
    private final JobQueue             jobQueue;
    private final Duration             staleAfter;
    private final boolean              enabled;

    public PendingTaskRedispatcher(ReviewTaskRepository taskRepo,
                                   JobQueue jobQueue,
                                   @Value("${review.redispatch.stale-after:PT10M}") Duration staleAfter,
                                   @Value("${review.redispatch.enabled:true}") boolean enabled) {
        this.taskRepo   = taskRepo;
        this.jobQueue   = jobQueue;
        this.staleAfter = staleAfter;
        this.enabled    = enabled;
    }

    /**
     * Tick: re-enqueue stale PENDING tasks.
     *
     * @return number of tasks enqueued again
     */
    @Scheduled(fixedDelayString = "${review.redispatch.delay-ms:60000}",
               initialDelayString = "${review.redispatch.initial-delay-ms:30000}")
    public int redispatchStale() {
        if (!enabled) {
            return 0;
        }
        Instant cutoff = Instant.now().minus(staleAfter);
        List<ReviewTask> stale = taskRepo.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
                TaskStatus.PENDING, cutoff);

        int requeued = 0;
        for (ReviewTask task : stale) {
            if (jobQueue.isTracked(task.getId())) {
                continue;
            }
            try {
                jobQueue.enqueue(ReviewJob.withoutCredential(task.getId(), task.getRepoUrl(), task.getPrNumber()));
                requeued++;
                log.warn("Redelivering task {} (PENDING since {})", task.getId(), task.getCreatedAt());
            } catch (DispatchException e) {
                log.warn("Queue full while redelivering stale tasks, retrying next tick: {}", e.getMessage());
                break;
            }
        }
        return requeued;
    }
}
