package com.modelgate.pipeline;

import java.util.Map;

public record TrainingOutcome(String runId, ModelArtifact artifact, Map<String, Double> metrics) {
    public TrainingOutcome {
        metrics = Map.copyOf(metrics);
    }
}
