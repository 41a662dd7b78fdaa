package com.prreview.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prreview.orchestrator.model.PullRequestSummary;
import com.prreview.orchestrator.model.ReviewTask;
import com.prreview.orchestrator.model.TaskStatus;
import com.prreview.orchestrator.repository.ReviewTaskRepository;
import com.prreview.orchestrator.review.ReviewResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable state transitions of a review task, as driven by the pipeline.
 *
 * Each method is one transaction that loads the row, applies the transition
 * on the entity and saves it. A row deleted while its job was queued or
 * running is not recreated.
 */
@Service
public class TaskLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(TaskLifecycleService.class);

    private final ReviewTaskRepository taskRepo;
    private final ObjectMapper         objectMapper;

    public TaskLifecycleService(ReviewTaskRepository taskRepo, ObjectMapper objectMapper) {
        this.taskRepo     = taskRepo;
        this.objectMapper = objectMapper;
    }

    /**
     * Move the task to PROCESSING and return it.
     *
     * A task that is already terminal is returned unchanged so the caller can
     * drop a duplicate delivery. Empty when the row does not exist.
     */
    @Transactional
    public Optional<ReviewTask> begin(UUID taskId) {
        Optional<ReviewTask> opt = taskRepo.findById(taskId);
        if (opt.isEmpty()) {
            return opt;
        }
        ReviewTask task = opt.get();
        if (task.getStatus().isTerminal()) {
            return opt;
        }
        if (task.getStatus() == TaskStatus.PROCESSING) {
            log.warn("Task {} redelivered while PROCESSING, running it again", taskId);
        }
        task.markProcessing(Instant.now());
        ReviewTask saved = taskRepo.save(task);
        log.info("Task {} PROCESSING ({}#{})", taskId, task.getRepoUrl(), task.getPrNumber());
        return Optional.of(saved);
    }

    /** Persist stage: COMPLETED + results + PR metadata in one update. */
    @Transactional
    public void complete(UUID taskId, ReviewResults results, PullRequestSummary summary) {
        Optional<ReviewTask> opt = taskRepo.findById(taskId);
        if (opt.isEmpty()) {
            log.warn("Task {} was deleted before its results could be saved", taskId);
            return;
        }
        ReviewTask task = opt.get();
        task.markCompleted(Instant.now(), toJson(results), summary);
        taskRepo.save(task);
        log.info("Task {} COMPLETED ({} files, review {})",
                taskId, summary.filesCount(), results.review() != null ? "available" : "unavailable");
    }

    /**
     * Record a fatal failure.
     *
     * A task that never got past PENDING (its PROCESSING write failed) passes
     * through PROCESSING first so the status sequence stays intact. A task that
     * is already COMPLETED is left alone.
     */
    @Transactional
    public void fail(UUID taskId, String errorMessage) {
        Optional<ReviewTask> opt = taskRepo.findById(taskId);
        if (opt.isEmpty()) {
            log.warn("Task {} was deleted before its failure could be recorded", taskId);
            return;
        }
        ReviewTask task = opt.get();
        if (task.getStatus() == TaskStatus.COMPLETED) {
            log.warn("Task {} is already COMPLETED; not overwriting with failure: {}", taskId, errorMessage);
            return;
        }
        Instant now = Instant.now();
        if (task.getStatus() == TaskStatus.PENDING) {
            task.markProcessing(now);
        }
        task.markFailed(now, errorMessage);
        taskRepo.save(task);
        log.info("Task {} FAILED: {}", taskId, errorMessage);
    }

    private String toJson(ReviewResults results) {
        try {
            return objectMapper.writeValueAsString(results);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise review results: " + e.getMessage(), e);
        }
    }
}
