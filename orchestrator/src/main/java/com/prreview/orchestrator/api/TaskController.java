package com.prreview.orchestrator.api;

import com.prreview.orchestrator.api.dto.SubmitTaskRequest;
import com.prreview.orchestrator.api.dto.SubmitTaskResponse;
import com.prreview.orchestrator.model.ReviewTask;
import com.prreview.orchestrator.model.TaskStatus;
import com.prreview.orchestrator.queue.DispatchException;
import com.prreview.orchestrator.service.InvalidRequestException;
import com.prreview.orchestrator.service.InvalidTaskStateException;
import com.prreview.orchestrator.service.TaskDispatchService;
import com.prreview.orchestrator.service.TaskNotFoundException;
import com.prreview.orchestrator.service.TaskPage;
import com.prreview.orchestrator.service.TaskQueryService;
import com.prreview.orchestrator.service.TaskResultsView;
import com.prreview.orchestrator.service.TaskStats;
import com.prreview.orchestrator.service.TaskStatusView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for review tasks.
 *
 * GET    /                       health check
 * POST   /api/v1/analyze         submit a pull request for review
 * GET    /api/v1/status/{id}     poll status and live progress
 * GET    /api/v1/results/{id}    review findings of a completed task
 * GET    /api/v1/tasks           paged task list, newest first
 * DELETE /api/v1/tasks/{id}      delete a task (cancels it if still queued)
 * GET    /api/v1/stats           counts per status and success rate
 *
 * Errors are returned as {"detail": "..."}.
 */
@RestController
public class TaskController {

    private final TaskDispatchService dispatchService;
    private final TaskQueryService    queryService;

    public TaskController(TaskDispatchService dispatchService, TaskQueryService queryService) {
        this.dispatchService = dispatchService;
        this.queryService    = queryService;
    }

    @GetMapping("/")
    public Map<String, String> health() {
        return Map.of("message", "AI Code Review System is running", "status", "healthy");
    }

    /**
     * Submit a pull request for review.
     *
     * Example:
     *   curl -X POST http://localhost:8080/api/v1/analyze \
     *     -H "Content-Type: application/json" \
     *     -d '{"repoUrl":"https://github.com/apache/commons-lang","prNumber":42}'
     */
    @PostMapping("/api/v1/analyze")
    public ResponseEntity<SubmitTaskResponse> submit(@RequestBody SubmitTaskRequest req) {
        ReviewTask task = dispatchService.submit(req.repoUrl(), req.prNumber(), req.githubToken());
        return ResponseEntity.status(HttpStatus.CREATED).body(SubmitTaskResponse.from(task));
    }

    @GetMapping("/api/v1/status/{id}")
    public TaskStatusView getStatus(@PathVariable UUID id) {
        return queryService.getStatus(id);
    }

    /**
     * HTTP 200  task is COMPLETED (results may be null if the AI review failed)
     * HTTP 400  task is not COMPLETED yet, or FAILED
     * HTTP 404  unknown id
     */
    @GetMapping("/api/v1/results/{id}")
    public TaskResultsView getResults(@PathVariable UUID id) {
        return queryService.getResults(id);
    }

    @GetMapping("/api/v1/tasks")
    public TaskPage listTasks(@RequestParam(defaultValue = "1") int page,
                              @RequestParam(defaultValue = "10") int perPage,
                              @RequestParam(required = false) String status) {
        return queryService.listTasks(page, perPage, parseStatus(status));
    }

    @DeleteMapping("/api/v1/tasks/{id}")
    public Map<String, String> deleteTask(@PathVariable UUID id) {
        queryService.deleteTask(id);
        return Map.of("message", "Task " + id + " deleted successfully");
    }

    @GetMapping("/api/v1/stats")
    public TaskStats getStats() {
        return queryService.getStats();
    }

    // ------------------------------------------------------------------
    // Error mapping
    // ------------------------------------------------------------------

    @ExceptionHandler(TaskNotFoundException.class)
    ResponseEntity<Map<String, String>> notFound(TaskNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "Task not found");
    }

    @ExceptionHandler(InvalidTaskStateException.class)
    ResponseEntity<Map<String, String>> invalidState(InvalidTaskStateException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(InvalidRequestException.class)
    ResponseEntity<Map<String, String>> invalidRequest(InvalidRequestException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage());
    }

    @ExceptionHandler(DispatchException.class)
    ResponseEntity<Map<String, String>> dispatchFailed(DispatchException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "Failed to start analysis: " + e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String detail) {
        return ResponseEntity.status(status).body(Map.of("detail", detail));
    }

    /** Accepts "completed" as well as "COMPLETED". */
    private static TaskStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return TaskStatus.valueOf(status.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unknown status: " + status);
        }
    }
}
