package com.prreview.orchestrator.service;

/** Task counts per status and the share of all tasks that completed, in percent. */
public record TaskStats(
        long   totalTasks,
        long   pendingTasks,
        long   processingTasks,
        long   completedTasks,
        long   failedTasks,
        double successRate
) {}
