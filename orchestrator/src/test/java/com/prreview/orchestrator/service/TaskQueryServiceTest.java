package com.prreview.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prreview.orchestrator.model.PullRequestSummary;
import com.prreview.orchestrator.model.ReviewTask;
import com.prreview.orchestrator.model.TaskStatus;
import com.prreview.orchestrator.queue.ProgressRegistry;
import com.prreview.orchestrator.queue.TaskProgress;
import com.prreview.orchestrator.repository.ReviewTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TaskQueryService. The repository and dispatcher are mocked;
 * the progress registry is real.
 */
@ExtendWith(MockitoExtension.class)
class TaskQueryServiceTest {

    @Mock ReviewTaskRepository taskRepo;
    @Mock TaskDispatchService  dispatcher;

    ProgressRegistry progress;
    TaskQueryService service;

    @BeforeEach
    void setUp() {
        progress = new ProgressRegistry();
        service  = new TaskQueryService(taskRepo, progress, dispatcher, new ObjectMapper());
    }

    // ------------------------------------------------------------------
    // getStatus()
    // ------------------------------------------------------------------

    @Test
    void getStatus_processing_includesLiveProgress() {
        ReviewTask task = processing();
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));
        progress.publish(task.getId(), 2, 4, "Fetching PR data");

        TaskStatusView view = service.getStatus(task.getId());

        assertThat(view.status()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(view.progress()).isEqualTo(new ProgressInfo(2, 4, "Fetching PR data"));
    }

    @Test
    void getStatus_processingWithoutProgress_hasNullProgress() {
        ReviewTask task = processing();
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));

        assertThat(service.getStatus(task.getId()).progress()).isNull();
    }

    @Test
    void getStatus_completed_ignoresStaleProgress() {
        ReviewTask task = completed("{}");
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));
        progress.publish(task.getId(), 4, 4, "Saving results");   // worker has not cleared it yet

        TaskStatusView view = service.getStatus(task.getId());

        assertThat(view.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(view.progress()).isNull();
        assertThat(view.prTitle()).isEqualTo("Fix it");
        assertThat(view.filesCount()).isEqualTo(2);
    }

    @Test
    void getStatus_progressLookupFails_statusStillReturned() {
        ProgressRegistry broken = mock(ProgressRegistry.class);
        when(broken.find(any())).thenThrow(new IllegalStateException("registry unavailable"));
        service = new TaskQueryService(taskRepo, broken, dispatcher, new ObjectMapper());
        ReviewTask task = processing();
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));

        TaskStatusView view = service.getStatus(task.getId());

        assertThat(view.status()).isEqualTo(TaskStatus.PROCESSING);
        assertThat(view.progress()).isNull();
    }

    @Test
    void getStatus_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(taskRepo.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getStatus(id))
                .isInstanceOf(TaskNotFoundException.class)
                .hasMessageContaining(id.toString());
    }

    // ------------------------------------------------------------------
    // getResults()
    // ------------------------------------------------------------------

    @Test
    void getResults_completed_returnsReview() {
        ReviewTask task = completed("""
                {"prInfo":{"title":"Fix it","description":null},
                 "codeChanges":[{"filename":"a.py","language":"py","diff":"+x"}],
                 "review":{"files":[{"name":"a.py","issues":[
                     {"type":"bug","line":1,"description":"d","suggestion":"s"}]}],
                           "summary":{"totalFiles":1,"totalIssues":1,"criticalIssues":1}}}
                """);
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));

        TaskResultsView view = service.getResults(task.getId());

        assertThat(view.status()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(view.completedAt()).isNotNull();
        assertThat(view.results()).isNotNull();
        assertThat(view.results().summary().criticalIssues()).isEqualTo(1);
        assertThat(view.results().files().get(0).issues().get(0).type()).isEqualTo("bug");
    }

    @Test
    void getResults_completedWithoutReview_returnsNullResults() {
        ReviewTask task = completed("{\"prInfo\":{\"title\":\"Fix it\"},\"codeChanges\":[],\"review\":null}");
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));

        assertThat(service.getResults(task.getId()).results()).isNull();
    }

    @ParameterizedTest
    @EnumSource(value = TaskStatus.class, names = {"PENDING", "PROCESSING", "FAILED"})
    void getResults_notCompleted_throwsInvalidState(TaskStatus status) {
        ReviewTask task = inStatus(status);
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));

        assertThatThrownBy(() -> service.getResults(task.getId()))
                .isInstanceOf(InvalidTaskStateException.class)
                .hasMessage("Task not completed. Current status: " + status);
    }

    // ------------------------------------------------------------------
    // listTasks()
    // ------------------------------------------------------------------

    @Test
    void listTasks_secondPage_computesPagesAndSortsNewestFirst() {
        List<ReviewTask> pageContent = IntStream.range(0, 5).mapToObj(i -> inStatus(TaskStatus.PENDING)).toList();
        when(taskRepo.findAll(any(Pageable.class)))
                .thenAnswer(inv -> new PageImpl<>(pageContent, inv.getArgument(0), 12));

        TaskPage page = service.listTasks(2, 5, null);

        assertThat(page.tasks()).hasSize(5);
        assertThat(page.total()).isEqualTo(12);
        assertThat(page.page()).isEqualTo(2);
        assertThat(page.perPage()).isEqualTo(5);
        assertThat(page.pages()).isEqualTo(3);

        ArgumentCaptor<Pageable> request = ArgumentCaptor.forClass(Pageable.class);
        verify(taskRepo).findAll(request.capture());
        assertThat(request.getValue().getPageNumber()).isEqualTo(1);
        assertThat(request.getValue().getSort().getOrderFor("createdAt").getDirection())
                .isEqualTo(Sort.Direction.DESC);
    }

    @Test
    void listTasks_withStatus_usesFilteredQuery() {
        when(taskRepo.findByStatus(eq(TaskStatus.FAILED), any()))
                .thenAnswer(inv -> new PageImpl<>(List.of(), inv.getArgument(1), 0));

        TaskPage page = service.listTasks(1, 10, TaskStatus.FAILED);

        assertThat(page.tasks()).isEmpty();
        assertThat(page.pages()).isZero();
        verify(taskRepo, never()).findAll(any(Pageable.class));
    }

    @Test
    void listTasks_invalidPaging_rejected() {
        assertThatThrownBy(() -> service.listTasks(0, 10, null)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.listTasks(1, 0, null)).isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> service.listTasks(1, 101, null)).isInstanceOf(InvalidRequestException.class);
        verifyNoInteractions(taskRepo);
    }

    // ------------------------------------------------------------------
    // deleteTask()
    // ------------------------------------------------------------------

    @Test
    void deleteTask_pending_cancelsQueuedJobThenDeletes() {
        ReviewTask task = inStatus(TaskStatus.PENDING);
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));

        service.deleteTask(task.getId());

        verify(dispatcher).cancel(task.getId());
        verify(taskRepo).delete(task);
    }

    @Test
    void deleteTask_completed_deletesWithoutCancel() {
        ReviewTask task = completed("{}");
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));

        service.deleteTask(task.getId());

        verify(dispatcher, never()).cancel(any());
        verify(taskRepo).delete(task);
    }

    @Test
    void deleteTask_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(taskRepo.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.deleteTask(id)).isInstanceOf(TaskNotFoundException.class);
        verify(taskRepo, never()).delete(any());
    }

    // ------------------------------------------------------------------
    // getStats()
    // ------------------------------------------------------------------

    @Test
    void getStats_countsPerStatusAndSuccessRate() {
        when(taskRepo.count()).thenReturn(4L);
        when(taskRepo.countByStatus(TaskStatus.PENDING)).thenReturn(0L);
        when(taskRepo.countByStatus(TaskStatus.PROCESSING)).thenReturn(1L);
        when(taskRepo.countByStatus(TaskStatus.COMPLETED)).thenReturn(2L);
        when(taskRepo.countByStatus(TaskStatus.FAILED)).thenReturn(1L);

        TaskStats stats = service.getStats();

        assertThat(stats).isEqualTo(new TaskStats(4, 0, 1, 2, 1, 50.0));
    }

    @Test
    void successRate_roundsToTwoDecimalsAndHandlesEmptyStore() {
        assertThat(TaskQueryService.successRate(0, 0)).isEqualTo(0.0);
        assertThat(TaskQueryService.successRate(1, 3)).isEqualTo(33.33);
        assertThat(TaskQueryService.successRate(2, 3)).isEqualTo(66.67);
        assertThat(TaskQueryService.successRate(5, 5)).isEqualTo(100.0);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ReviewTask processing() {
        return inStatus(TaskStatus.PROCESSING);
    }

    private static ReviewTask completed(String resultsJson) {
        ReviewTask task = inStatus(TaskStatus.PROCESSING);
        task.markCompleted(Instant.now(), resultsJson, new PullRequestSummary("Fix it", "carol", 2, 10, 4));
        return task;
    }

    private static ReviewTask inStatus(TaskStatus status) {
        ReviewTask task = new ReviewTask(UUID.randomUUID(), "https://github.com/org/repo", 9);
        if (status == TaskStatus.PENDING) {
            return task;
        }
        task.markProcessing(Instant.now());
        if (status == TaskStatus.FAILED) {
            task.markFailed(Instant.now(), "boom");
        } else if (status == TaskStatus.COMPLETED) {
            task.markCompleted(Instant.now(), "{}", new PullRequestSummary("t", "a", 0, 0, 0));
        }
        return task;
    }
}
