package com.prreview.orchestrator.pipeline;

/**
 * The four fixed stages of a review, in execution order.
 * step is 1-based and the label is what status queries show as the phase.
 */
public enum PipelineStage {
    INITIALIZE(1, "Initializing GitHub analyzer"),
    FETCH(2,      "Fetching PR data"),
    ANALYZE(3,    "Running AI code review"),
    PERSIST(4,    "Saving results");

    public static final int TOTAL = values().length;

    private final int    step;
    private final String label;

    PipelineStage(int step, String label) {
        this.step  = step;
        this.label = label;
    }

    public int    step()  { return step; }
    public String label() { return label; }
}
