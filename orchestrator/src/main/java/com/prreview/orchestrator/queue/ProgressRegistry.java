package com.prreview.orchestrator.queue;

import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory live progress, keyed by task id.
 *
 * Written only by the worker that runs the task; read by any number of
 * status queries. Reads never block on the writer.
 *
 * Entries disappear when a task completes. A failed task leaves a terminal
 * notice that expires after {@link #TERMINAL_TTL}.
 */
@Component
public class ProgressRegistry {

    static final Duration TERMINAL_TTL = Duration.ofMinutes(10);

    private final ConcurrentHashMap<UUID, TaskProgress> entries = new ConcurrentHashMap<>();

    public void publish(UUID taskId, int current, int total, String phase) {
        entries.put(taskId, TaskProgress.step(current, total, phase));
    }

    /** The task finished successfully; live progress no longer exists. */
    public void complete(UUID taskId) {
        entries.remove(taskId);
    }

    /** The task failed; replace its progress with a terminal notice. */
    public void fail(UUID taskId, String message) {
        entries.put(taskId, TaskProgress.failed(message));
        pruneExpired();
    }

    /** Live (non-terminal) progress for the task, if any. */
    public Optional<TaskProgress> find(UUID taskId) {
        TaskProgress progress = entries.get(taskId);
        if (progress == null || progress.terminal()) {
            return Optional.empty();
        }
        return Optional.of(progress);
    }

    /** Latest entry including terminal notices. */
    public Optional<TaskProgress> latest(UUID taskId) {
        return Optional.ofNullable(entries.get(taskId));
    }

    private void pruneExpired() {
        Instant cutoff = Instant.now().minus(TERMINAL_TTL);
        entries.entrySet().removeIf(e -> e.getValue().terminal() && e.getValue().updatedAt().isBefore(cutoff));
    }
}
