package com.prreview.orchestrator.repository;

import com.prreview.orchestrator.model.ReviewTask;
import com.prreview.orchestrator.model.TaskStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the review_tasks table.
 *
 * Spring Data JPA generates the implementation at startup:
 * we only declare the method signatures we need.
 */
public interface ReviewTaskRepository extends JpaRepository<ReviewTask, UUID> {

    /** Paged listing filtered by status; ordering comes from the Pageable. */
    Page<ReviewTask> findByStatus(TaskStatus status, Pageable pageable);

    long countByStatus(TaskStatus status);

    /**
     * PENDING tasks older than 'cutoff', oldest first.
     * The redispatcher uses this to find jobs the queue has lost.
     */
    List<ReviewTask> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(TaskStatus status, Instant cutoff);
}
