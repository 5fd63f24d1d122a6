package com.modelgate.tracking;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of one run as the tracking service reports it. Params and the final metric
 * values are fixed once the run is finished.
 */
public record TrackedRun(
        String runId,
        String runName,
        String experimentName,
        RunStatus status,
        Instant startTime,
        Instant endTime,
        Map<String, String> params,
        Map<String, Double> metrics,
        Map<String, String> tags,
        List<String> artifacts) {
    public TrackedRun {
        params = params == null ? Map.of() : Map.copyOf(params);
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    public boolean isFinished() {
        return status == RunStatus.FINISHED;
    }
}
