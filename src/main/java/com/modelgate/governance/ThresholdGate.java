package com.modelgate.governance;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ThresholdGate {

    /**
     * Checks every threshold, in policy order, without stopping at the first violation.
     *
     * @throws MetricComputationException when a thresholded metric is absent from the metric set
     */
    public List<GateReason> check(Map<String, Double> metrics, EvaluationPolicy policy) {
        List<GateReason> reasons = new ArrayList<>();
        for (MetricThreshold threshold : policy.thresholds()) {
            double actual = MetricCalculator.require(metrics, threshold.metric());
            if (threshold.min() != null && actual < threshold.min()) {
                reasons.add(new GateReason(
                        GateReason.Type.THRESHOLD_VIOLATION,
                        threshold.metric(),
                        actual,
                        threshold.min(),
                        threshold.metric() + " below " + formatBound(threshold.min())));
            }
            if (threshold.max() != null && actual > threshold.max()) {
                reasons.add(new GateReason(
                        GateReason.Type.THRESHOLD_VIOLATION,
                        threshold.metric(),
                        actual,
                        threshold.max(),
                        threshold.metric() + " above " + formatBound(threshold.max())));
            }
        }
        return reasons;
    }

    /** At least two decimals: 0.8 prints as {@code 0.80}, 0.455 as {@code 0.455}. */
    static String formatBound(double bound) {
        BigDecimal decimal = BigDecimal.valueOf(bound).stripTrailingZeros();
        return decimal.setScale(Math.max(2, decimal.scale())).toPlainString();
    }
}
