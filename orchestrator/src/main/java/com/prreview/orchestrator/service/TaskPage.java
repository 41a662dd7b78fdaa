package com.prreview.orchestrator.service;

import java.util.List;

/** One page of tasks, newest first. page is 1-based; pages = ceil(total / perPage). */
public record TaskPage(List<TaskListItem> tasks, long total, int page, int perPage, int pages) {}
