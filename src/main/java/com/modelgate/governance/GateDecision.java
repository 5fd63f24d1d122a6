package com.modelgate.governance;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of evaluating one run under one policy. Stored append-only against the run id and
 * looked up by promotions without recomputation.
 */
public record GateDecision(
        String decisionId,
        String runId,
        boolean passed,
        List<GateReason> reasons,
        BaselineComparison baseline,
        Map<String, Double> metrics,
        String policyFingerprint,
        String datasetFingerprint,
        String evaluationRunId,
        List<FeatureAttribution> attributions,
        Instant evaluatedAt) {
    public GateDecision {
        reasons = reasons == null ? List.of() : List.copyOf(reasons);
        metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        attributions = attributions == null ? List.of() : List.copyOf(attributions);
    }

    public List<String> reasonMessages() {
        return reasons.stream().map(GateReason::message).toList();
    }
}
