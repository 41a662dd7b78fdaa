package com.prreview.orchestrator.pipeline;

import com.prreview.orchestrator.github.ChangedFile;
import com.prreview.orchestrator.github.GitHubException;
import com.prreview.orchestrator.github.InvalidRepositoryException;
import com.prreview.orchestrator.github.PullRequestMetadata;
import com.prreview.orchestrator.github.PullRequestSource;
import com.prreview.orchestrator.github.PullRequestSourceFactory;
import com.prreview.orchestrator.model.PullRequestSummary;
import com.prreview.orchestrator.model.ReviewTask;
import com.prreview.orchestrator.pipeline.TaskOutcome.ErrorKind;
import com.prreview.orchestrator.queue.ProgressRegistry;
import com.prreview.orchestrator.queue.ReviewJob;
import com.prreview.orchestrator.review.ReviewGenerator;
import com.prreview.orchestrator.review.ReviewInput;
import com.prreview.orchestrator.review.ReviewReport;
import com.prreview.orchestrator.review.ReviewResults;
import com.prreview.orchestrator.service.TaskLifecycleService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the review pipeline for one task:
 *
 *   1. INITIALIZE  parse the repository URL and open a GitHub client
 *   2. FETCH       PR metadata and changed files
 *   3. ANALYZE     build the review input and ask the review generator
 *   4. PERSIST     write COMPLETED with results and PR metadata
 *
 * Progress for a stage is published before the stage starts, so a status
 * query never sees a phase behind the stage that is actually running.
 *
 * Failure policy:
 *   - any error in INITIALIZE, FETCH or PERSIST fails the task;
 *   - an error from the review generator does not: the task completes with
 *     review = null and the PR data gathered so far.
 *
 * Failures are recorded in one place ({@link #recordFailure}) and returned
 * to the caller as a {@link TaskOutcome} rather than thrown.
 */
@Component
public class ReviewPipeline {

    private static final Logger log = LoggerFactory.getLogger(ReviewPipeline.class);

    private final TaskLifecycleService     lifecycle;
    private final ProgressRegistry         progress;
    private final PullRequestSourceFactory sourceFactory;
    private final ReviewGenerator          reviewGenerator;
    private final MeterRegistry            meterRegistry;

    public ReviewPipeline(TaskLifecycleService lifecycle,
                          ProgressRegistry progress,
                          PullRequestSourceFactory sourceFactory,
                          ReviewGenerator reviewGenerator,
                          MeterRegistry meterRegistry) {
        this.lifecycle       = lifecycle;
        this.progress        = progress;
        this.sourceFactory   = sourceFactory;
        this.reviewGenerator = reviewGenerator;
        this.meterRegistry   = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry point: called by a queue worker for each delivered job
    // ------------------------------------------------------------------

    /**
     * Execute the pipeline for one job. Blocks until the task reaches a
     * terminal state (or the delivery is skipped). Never throws for task
     * failures; they are reported through the returned outcome.
     */
    public TaskOutcome execute(ReviewJob job) {
        MDC.put("taskId", job.taskId().toString());
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcomeTag = "error";
        try {
            log.info("Starting review pipeline for {}#{}", job.repoUrl(), job.prNumber());
            TaskOutcome outcome = run(job);
            outcomeTag = outcome.result().name().toLowerCase();
            return outcome;
        } finally {
            sample.stop(meterRegistry.timer("review.pipeline.duration", "outcome", outcomeTag));
            meterRegistry.counter("review.tasks.outcome", "outcome", outcomeTag).increment();
            MDC.remove("taskId");
        }
    }

    private TaskOutcome run(ReviewJob job) {
        UUID taskId = job.taskId();
        try {
            Optional<ReviewTask> claimed = lifecycle.begin(taskId);
            if (claimed.isEmpty()) {
                log.warn("Task {} has no record (deleted?), skipping", taskId);
                return TaskOutcome.skipped(taskId, "Task record not found");
            }
            if (claimed.get().getStatus().isTerminal()) {
                log.info("Task {} is already {}, ignoring duplicate delivery",
                        taskId, claimed.get().getStatus());
                return TaskOutcome.skipped(taskId, "Task already " + claimed.get().getStatus());
            }

            // 1. Initialize
            enter(taskId, PipelineStage.INITIALIZE);
            PullRequestSource source = sourceFactory.open(job.repoUrl(), job.githubToken());

            // 2. Fetch
            enter(taskId, PipelineStage.FETCH);
            PullRequestMetadata metadata = source.getMetadata(job.prNumber());
            List<ChangedFile> files = source.getChangedFiles(job.prNumber());

            // 3. Analyze
            enter(taskId, PipelineStage.ANALYZE);
            ReviewInput input = ReviewInput.of(metadata, files);
            ReviewReport review = generateReview(taskId, input);

            // 4. Persist
            enter(taskId, PipelineStage.PERSIST);
            lifecycle.complete(taskId, ReviewResults.of(input, review), summarize(metadata, files));

            progress.complete(taskId);
            return TaskOutcome.completed(taskId);
        } catch (Exception e) {
            return recordFailure(taskId, e);
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void enter(UUID taskId, PipelineStage stage) {
        progress.publish(taskId, stage.step(), PipelineStage.TOTAL, stage.label());
        log.debug("Task {} stage {}/{}: {}", taskId, stage.step(), PipelineStage.TOTAL, stage.label());
    }

    /** Review generator errors are absorbed into a null review. */
    private ReviewReport generateReview(UUID taskId, ReviewInput input) {
        try {
            return reviewGenerator.review(input);
        } catch (Exception e) {
            log.warn("AI review failed for task {}, continuing without review: {}",
                    taskId, describe(e));
            meterRegistry.counter("review.generation.failures").increment();
            return null;
        }
    }

    /**
     * The single failure-recording step: FAILED record, terminal progress
     * notice, failure outcome. A failure to write the record is logged and
     * does not hide the original error.
     */
    private TaskOutcome recordFailure(UUID taskId, Exception cause) {
        String message = describe(cause);
        ErrorKind kind = classify(cause);
        log.error("Task {} failed ({}): {}", taskId, kind, message, cause);

        try {
            lifecycle.fail(taskId, message);
        } catch (Exception dbError) {
            log.error("Failed to update database with error for task {}: {}",
                    taskId, dbError.getMessage(), dbError);
        }
        progress.fail(taskId, message);
        return TaskOutcome.failed(taskId, kind, message);
    }

    private static PullRequestSummary summarize(PullRequestMetadata metadata, List<ChangedFile> files) {
        return new PullRequestSummary(
                metadata.title(),
                metadata.author(),
                files.size(),
                files.stream().mapToInt(ChangedFile::addedLines).sum(),
                files.stream().mapToInt(ChangedFile::removedLines).sum());
    }

    private static ErrorKind classify(Exception e) {
        if (e instanceof InvalidRepositoryException) return ErrorKind.VALIDATION;
        if (e instanceof GitHubException)            return ErrorKind.TRANSPORT;
        return ErrorKind.UNEXPECTED;
    }

    // Message only, never the stack trace.
    private static String describe(Exception e) {
        String msg = e.getMessage();
        return (msg == null || msg.isBlank()) ? e.getClass().getSimpleName() : msg;
    }
}
