package com.prreview.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One submitted pull-request review.
 *
 * The id is assigned at submission time (not by the database) because it is
 * also the key of the queued job and of the live progress entry.
 *
 * State changes go through the mark* methods, which enforce the transitions
 * declared on {@link TaskStatus} and set each timestamp exactly once.
 *
 * DB table: review_tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "review_tasks")
public class ReviewTask {

    @Id
    private UUID id;

    @Column(name = "repo_url", nullable = false, updatable = false)
    private String repoUrl;

    @Column(name = "pr_number", nullable = false, updatable = false)
    private int prNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // Only set while FAILED.
    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // ReviewResults serialised as JSON. Only set while COMPLETED.
    @Column(name = "results_json", columnDefinition = "TEXT")
    private String resultsJson;

    // Pull-request metadata, filled in when the task completes.
    @Column(name = "pr_title", columnDefinition = "TEXT")
    private String prTitle;

    @Column(name = "author")
    private String author;

    @Column(name = "files_count")
    private Integer filesCount;

    @Column(name = "additions")
    private Integer additions;

    @Column(name = "deletions")
    private Integer deletions;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected ReviewTask() {}   // required by JPA

    public ReviewTask(UUID id, String repoUrl, int prNumber) {
        this.id       = id;
        this.repoUrl  = repoUrl;
        this.prNumber = prNumber;
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    /** PENDING → PROCESSING. Re-entering PROCESSING keeps the original start time. */
    public void markProcessing(Instant now) {
        transitionTo(TaskStatus.PROCESSING);
        if (startedAt == null) {
            startedAt = now;
        }
    }

    /**
     * PROCESSING → COMPLETED with the aggregated results and PR metadata.
     * Writing COMPLETED again replaces the results but keeps completedAt.
     */
    public void markCompleted(Instant now, String resultsJson, PullRequestSummary summary) {
        transitionTo(TaskStatus.COMPLETED);
        if (completedAt == null) {
            completedAt = now;
        }
        this.resultsJson  = resultsJson;
        this.errorMessage = null;
        this.prTitle      = summary.title();
        this.author       = summary.author();
        this.filesCount   = summary.filesCount();
        this.additions    = summary.additions();
        this.deletions    = summary.deletions();
    }

    /** PROCESSING → FAILED. Writing FAILED again replaces the message but keeps completedAt. */
    public void markFailed(Instant now, String errorMessage) {
        transitionTo(TaskStatus.FAILED);
        if (completedAt == null) {
            completedAt = now;
        }
        this.errorMessage = errorMessage;
        this.resultsJson  = null;
    }

    private void transitionTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Task " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID       getId()           { return id; }
    public String     getRepoUrl()      { return repoUrl; }
    public int        getPrNumber()     { return prNumber; }
    public TaskStatus getStatus()       { return status; }
    public Instant    getCreatedAt()    { return createdAt; }
    public Instant    getStartedAt()    { return startedAt; }
    public Instant    getCompletedAt()  { return completedAt; }
    public String     getErrorMessage() { return errorMessage; }
    public String     getResultsJson()  { return resultsJson; }
    public String     getPrTitle()      { return prTitle; }
    public String     getAuthor()       { return author; }
    public Integer    getFilesCount()   { return filesCount; }
    public Integer    getAdditions()    { return additions; }
    public Integer    getDeletions()    { return deletions; }
}
