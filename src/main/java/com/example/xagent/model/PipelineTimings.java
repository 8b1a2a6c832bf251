package com.example.xagent.model;

/**
 * Per-stage timing for one pipeline run (in seconds).
 *
 * @param resolutionSeconds  Domain resolution, including synthesis when it happened
 * @param refinementSeconds  All requirements/tasks/quality-gate iterations
 */
public record PipelineTimings(
        double resolutionSeconds,
        double refinementSeconds
) {
    public double totalSeconds() {
        return resolutionSeconds + refinementSeconds;
    }
}
