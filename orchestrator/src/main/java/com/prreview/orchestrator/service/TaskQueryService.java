package com.prreview.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prreview.orchestrator.model.ReviewTask;
import com.prreview.orchestrator.model.TaskStatus;
import com.prreview.orchestrator.queue.ProgressRegistry;
import com.prreview.orchestrator.repository.ReviewTaskRepository;
import com.prreview.orchestrator.review.ReviewReport;
import com.prreview.orchestrator.review.ReviewResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Read side of the task store, plus deletion.
 *
 * Status queries combine the durable row with live progress. Progress is
 * only looked up while the row says PROCESSING, and a failed lookup just
 * leaves progress out; it never fails the query.
 */
@Service
public class TaskQueryService {

    private static final Logger log = LoggerFactory.getLogger(TaskQueryService.class);

    static final int MAX_PER_PAGE = 100;

    private final ReviewTaskRepository taskRepo;
    private final ProgressRegistry     progress;
    private final TaskDispatchService  dispatcher;
    private final ObjectMapper         objectMapper;

    public TaskQueryService(ReviewTaskRepository taskRepo,
                            ProgressRegistry progress,
                            TaskDispatchService dispatcher,
                            ObjectMapper objectMapper) {
        this.taskRepo     = taskRepo;
        this.progress     = progress;
        this.dispatcher   = dispatcher;
        this.objectMapper = objectMapper;
    }

    @Transactional(readOnly = true)
    public TaskStatusView getStatus(UUID taskId) {
        ReviewTask task = load(taskId);
        ProgressInfo live = task.getStatus() == TaskStatus.PROCESSING ? liveProgress(taskId) : null;
        return TaskStatusView.from(task, live);
    }

    /**
     * Review findings of a completed task.
     *
     * @throws InvalidTaskStateException unless the task is COMPLETED
     */
    @Transactional(readOnly = true)
    public TaskResultsView getResults(UUID taskId) {
        ReviewTask task = load(taskId);
        if (task.getStatus() != TaskStatus.COMPLETED) {
            throw new InvalidTaskStateException(
                    "Task not completed. Current status: " + task.getStatus(), task.getStatus());
        }
        return new TaskResultsView(task.getId(), task.getStatus(), task.getCompletedAt(), readReview(task));
    }

    /**
     * One page of tasks, newest first.
     *
     * @param page    1-based page number
     * @param perPage 1..100
     * @param status  optional filter; null lists every task
     */
    @Transactional(readOnly = true)
    public TaskPage listTasks(int page, int perPage, TaskStatus status) {
        if (page < 1) {
            throw new InvalidRequestException("page must be >= 1");
        }
        if (perPage < 1 || perPage > MAX_PER_PAGE) {
            throw new InvalidRequestException("perPage must be between 1 and " + MAX_PER_PAGE);
        }
        PageRequest request = PageRequest.of(page - 1, perPage, Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<ReviewTask> result = status == null
                ? taskRepo.findAll(request)
                : taskRepo.findByStatus(status, request);

        long total = result.getTotalElements();
        int pages = (int) ((total + perPage - 1) / perPage);
        return new TaskPage(
                result.getContent().stream().map(TaskListItem::from).toList(),
                total,
                page,
                perPage,
                pages);
    }

    /**
     * Delete a task. A PENDING task's queued job is cancelled first on a
     * best-effort basis; a running job is left to finish.
     */
    @Transactional
    public void deleteTask(UUID taskId) {
        ReviewTask task = load(taskId);
        if (task.getStatus() == TaskStatus.PENDING) {
            boolean cancelled = dispatcher.cancel(taskId);
            log.info("Task {} deleted while PENDING (queued job cancelled: {})", taskId, cancelled);
        }
        taskRepo.delete(task);
        log.info("Task {} deleted", taskId);
    }

    @Transactional(readOnly = true)
    public TaskStats getStats() {
        long total      = taskRepo.count();
        long pending    = taskRepo.countByStatus(TaskStatus.PENDING);
        long processing = taskRepo.countByStatus(TaskStatus.PROCESSING);
        long completed  = taskRepo.countByStatus(TaskStatus.COMPLETED);
        long failed     = taskRepo.countByStatus(TaskStatus.FAILED);
        return new TaskStats(total, pending, processing, completed, failed, successRate(completed, total));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private ReviewTask load(UUID taskId) {
        return taskRepo.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private ProgressInfo liveProgress(UUID taskId) {
        try {
            return progress.find(taskId)
                    .map(p -> new ProgressInfo(p.current(), p.total(), p.phase()))
                    .orElse(null);
        } catch (RuntimeException e) {
            log.warn("Could not read live progress for task {}: {}", taskId, e.getMessage());
            return null;
        }
    }

    private ReviewReport readReview(ReviewTask task) {
        String json = task.getResultsJson();
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ReviewResults.class).review();
        } catch (Exception e) {
            throw new IllegalStateException("Stored results for task " + task.getId() + " are unreadable", e);
        }
    }

    static double successRate(long completed, long total) {
        if (total == 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(completed * 100.0 / total)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
