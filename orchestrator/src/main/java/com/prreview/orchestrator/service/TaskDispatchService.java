package com.prreview.orchestrator.service;

import com.prreview.orchestrator.model.ReviewTask;
import com.prreview.orchestrator.queue.DispatchException;
import com.prreview.orchestrator.queue.JobQueue;
import com.prreview.orchestrator.queue.ReviewJob;
import com.prreview.orchestrator.repository.ReviewTaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Submission and cancellation of review tasks.
 *
 * submit() writes the PENDING row first and commits it, then enqueues.
 * The row must be visible before a worker can pick the job up; if the
 * enqueue fails, the row is deleted again so no PENDING task exists
 * without a job behind it.
 */
@Service
public class TaskDispatchService {

    private static final Logger log = LoggerFactory.getLogger(TaskDispatchService.class);

    private final ReviewTaskRepository taskRepo;
    private final JobQueue             jobQueue;

    public TaskDispatchService(ReviewTaskRepository taskRepo, JobQueue jobQueue) {
        this.taskRepo = taskRepo;
        this.jobQueue = jobQueue;
    }

    /**
     * Create a PENDING task and enqueue its review.
     *
     * @param githubToken optional; passed to the worker, never stored
     * @throws InvalidRequestException if repoUrl is blank or prNumber is not positive
     * @throws DispatchException       if the queue rejected the job (the task is removed)
     */
    public ReviewTask submit(String repoUrl, Integer prNumber, String githubToken) {
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new InvalidRequestException("repoUrl is required");
        }
        if (prNumber == null || prNumber < 1) {
            throw new InvalidRequestException("prNumber must be a positive integer");
        }

        ReviewTask task = taskRepo.save(new ReviewTask(UUID.randomUUID(), repoUrl.strip(), prNumber));

        try {
            jobQueue.enqueue(new ReviewJob(task.getId(), task.getRepoUrl(), task.getPrNumber(), githubToken));
        } catch (DispatchException e) {
            log.error("Could not enqueue task {}, removing its record: {}", task.getId(), e.getMessage());
            rollback(task);
            throw e;
        }

        log.info("Task {} PENDING ({}#{})", task.getId(), task.getRepoUrl(), task.getPrNumber());
        return task;
    }

    /**
     * Best-effort cancel of a job that has not started. Never throws; the
     * task record is not touched.
     */
    public boolean cancel(UUID taskId) {
        try {
            return jobQueue.cancel(taskId);
        } catch (RuntimeException e) {
            log.warn("Could not cancel queued job for task {}: {}", taskId, e.getMessage());
            return false;
        }
    }

    private void rollback(ReviewTask task) {
        try {
            taskRepo.deleteById(task.getId());
        } catch (RuntimeException e) {
            log.error("Could not remove orphaned PENDING task {}; the redispatcher will retry it: {}",
                    task.getId(), e.getMessage(), e);
        }
    }
}
