package com.modelgate.governance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Candidate against a registered baseline version, both scored on the same evaluation rows.
 * {@code deltas} holds candidate minus baseline per metric.
 */
public record BaselineComparison(
        String modelName,
        int baselineVersion,
        String baselineRunId,
        String primaryMetric,
        double candidateValue,
        double baselineValue,
        double tolerance,
        boolean regressed,
        Map<String, Double> baselineMetrics,
        Map<String, Double> deltas) {
    public BaselineComparison {
        baselineMetrics = baselineMetrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(baselineMetrics));
        deltas = deltas == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(deltas));
    }
}
