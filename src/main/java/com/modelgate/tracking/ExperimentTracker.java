package com.modelgate.tracking;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client contract for the external run-logging service. Runs are opened, written to and closed
 * through this interface; a run finished as {@link RunStatus#FAILED} has its artifacts discarded.
 */
public interface ExperimentTracker {

    String startRun(String runName, Map<String, String> tags) throws IOException;

    void logParams(String runId, Map<String, String> params) throws IOException;

    void logMetrics(String runId, List<MetricPoint> points) throws IOException;

    default void logMetrics(String runId, Map<String, Double> metrics) throws IOException {
        long now = System.currentTimeMillis();
        logMetrics(runId, metrics.entrySet().stream()
                .map(entry -> new MetricPoint(entry.getKey(), entry.getValue(), 0L, now))
                .toList());
    }

    void setTag(String runId, String key, String value) throws IOException;

    void logArtifact(String runId, String artifactPath, byte[] content) throws IOException;

    boolean hasArtifact(String runId, String artifactPath) throws IOException;

    Optional<byte[]> readArtifact(String runId, String artifactPath) throws IOException;

    void finishRun(String runId, RunStatus status) throws IOException;

    /**
     * @throws RunNotFoundException when the tracking service has no run with this id
     */
    TrackedRun getRun(String runId) throws IOException;

    default String artifactUri(String runId, String artifactPath) {
        return "runs:/" + runId + "/" + artifactPath;
    }
}
