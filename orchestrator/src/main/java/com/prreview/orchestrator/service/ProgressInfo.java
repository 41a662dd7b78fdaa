package com.prreview.orchestrator.service;

/** Live progress as shown in a status view: step current of total, and the phase label. */
public record ProgressInfo(int current, int total, String status) {}
