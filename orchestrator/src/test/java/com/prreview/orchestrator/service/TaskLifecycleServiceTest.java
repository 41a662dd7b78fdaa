package com.prreview.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prreview.orchestrator.model.PullRequestSummary;
import com.prreview.orchestrator.model.ReviewTask;
import com.prreview.orchestrator.model.TaskStatus;
import com.prreview.orchestrator.repository.ReviewTaskRepository;
import com.prreview.orchestrator.review.CodeChange;
import com.prreview.orchestrator.review.PrInfo;
import com.prreview.orchestrator.review.ReviewResults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskLifecycleServiceTest {

    @Mock ReviewTaskRepository taskRepo;

    TaskLifecycleService service;

    final UUID taskId = UUID.randomUUID();

    static final PullRequestSummary SUMMARY = new PullRequestSummary("Title", "bob", 1, 2, 3);
    static final ReviewResults RESULTS = new ReviewResults(
            new PrInfo("Title", null), List.of(new CodeChange("a.py", "py", "+x")), null);

    @BeforeEach
    void setUp() {
        service = new TaskLifecycleService(taskRepo, new ObjectMapper());
    }

    @Test
    void begin_pendingTask_movesToProcessing() {
        ReviewTask task = pending();
        when(taskRepo.findById(taskId)).thenReturn(Optional.of(task));
        when(taskRepo.save(task)).thenReturn(task);

        Optional<ReviewTask> claimed = service.begin(taskId);

        assertThat(claimed).isPresent();
        assertThat(claimed.get().getStatus()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(claimed.get().getStartedAt()).isNotNull();
    }

    @Test
    void begin_missingTask_returnsEmpty() {
        when(taskRepo.findById(taskId)).thenReturn(Optional.empty());

        assertThat(service.begin(taskId)).isEmpty();
        verify(taskRepo, never()).save(any());
    }

    @Test
    void begin_terminalTask_returnedUnchanged() {
        ReviewTask task = pending();
        task.markProcessing(Instant.now());
        task.markFailed(Instant.now(), "boom");
        when(taskRepo.findById(taskId)).thenReturn(Optional.of(task));

        Optional<ReviewTask> claimed = service.begin(taskId);

        assertThat(claimed).containsSame(task);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        verify(taskRepo, never()).save(any());
    }

    @Test
    void complete_writesResultsAsJson() {
        ReviewTask task = pending();
        task.markProcessing(Instant.now());
        when(taskRepo.findById(taskId)).thenReturn(Optional.of(task));

        service.complete(taskId, RESULTS, SUMMARY);

        verify(taskRepo).save(task);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(task.getResultsJson())
                .contains("\"prInfo\"")
                .contains("\"codeChanges\"")
                .contains("\"review\":null");
        assertThat(task.getAuthor()).isEqualTo("bob");
    }

    @Test
    void complete_deletedTask_isNotRecreated() {
        when(taskRepo.findById(taskId)).thenReturn(Optional.empty());

        service.complete(taskId, RESULTS, SUMMARY);

        verify(taskRepo, never()).save(any());
    }

    @Test
    void fail_pendingTask_passesThroughProcessing() {
        ReviewTask task = pending();
        when(taskRepo.findById(taskId)).thenReturn(Optional.of(task));

        service.fail(taskId, "GitHub API error");

        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getStartedAt()).isNotNull();
        assertThat(task.getCompletedAt()).isNotNull();
        assertThat(task.getErrorMessage()).isEqualTo("GitHub API error");
        verify(taskRepo).save(task);
    }

    @Test
    void fail_completedTask_isLeftAlone() {
        ReviewTask task = pending();
        task.markProcessing(Instant.now());
        task.markCompleted(Instant.now(), "{}", SUMMARY);
        when(taskRepo.findById(taskId)).thenReturn(Optional.of(task));

        service.fail(taskId, "late failure");

        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        verify(taskRepo, never()).save(any());
    }

    private ReviewTask pending() {
        return new ReviewTask(taskId, "https://github.com/org/repo", 5);
    }
}
