package com.modelgate.governance;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.modelgate.runtime.AppConfig;
import com.modelgate.runtime.ConfigException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ThresholdGateTest {

    private final ThresholdGate gate = new ThresholdGate();

    @Test
    void shouldReportOnlyViolatedThresholds() {
        EvaluationPolicy policy = new EvaluationPolicy(List.of(
                MetricThreshold.atLeast("auc", 0.80),
                MetricThreshold.atLeast("accuracy", 0.85)), "f1_score", 0.0);

        List<GateReason> reasons = gate.check(Map.of("auc", 0.78, "accuracy", 0.90), policy);

        assertEquals(List.of("auc below 0.80"), reasons.stream().map(GateReason::message).toList());
        assertEquals(GateReason.Type.THRESHOLD_VIOLATION, reasons.get(0).type());
        assertEquals(0.78, reasons.get(0).actual());
        assertEquals(0.80, reasons.get(0).bound());
    }

    @Test
    void shouldCollectEveryViolationInPolicyOrder() {
        EvaluationPolicy policy = new EvaluationPolicy(List.of(
                MetricThreshold.atMost("log_loss", 0.45),
                new MetricThreshold("accuracy", 0.85, 0.99)), "f1_score", 0.0);

        List<GateReason> reasons = gate.check(Map.of("log_loss", 0.6, "accuracy", 0.995), policy);

        assertEquals(List.of("log_loss above 0.45", "accuracy above 0.99"),
                reasons.stream().map(GateReason::message).toList());
    }

    @Test
    void shouldPassOnBoundaryValues() {
        EvaluationPolicy policy = new EvaluationPolicy(List.of(
                MetricThreshold.atLeast("auc", 0.80),
                MetricThreshold.atMost("error", 0.2)), "f1_score", 0.0);

        assertTrue(gate.check(Map.of("auc", 0.80, "error", 0.2), policy).isEmpty());
    }

    @Test
    void shouldFailWhenThresholdedMetricIsMissing() {
        EvaluationPolicy policy = new EvaluationPolicy(List.of(MetricThreshold.atLeast("auc", 0.8)), null, 0.0);

        assertThrows(MetricComputationException.class, () -> gate.check(Map.of("accuracy", 0.9), policy));
    }

    @Test
    void shouldResolveBareThresholdDirectionByMetric() {
        AppConfig.ThresholdConfig bare = new AppConfig.ThresholdConfig();
        bare.setValue(0.3);

        assertEquals(MetricThreshold.atMost("log_loss", 0.3), MetricThreshold.from("logloss", bare));
        assertEquals(MetricThreshold.atLeast("recall", 0.3), MetricThreshold.from("recall", bare));
        assertThrows(ConfigException.class, () -> MetricThreshold.from("recall", new AppConfig.ThresholdConfig()));
        assertThrows(ConfigException.class, () -> MetricThreshold.from("sharpe_ratio", bare));
    }

    @Test
    void shouldFormatBoundsWithAtLeastTwoDecimals() {
        assertEquals("0.80", ThresholdGate.formatBound(0.8));
        assertEquals("0.455", ThresholdGate.formatBound(0.455));
        assertEquals("1.00", ThresholdGate.formatBound(1.0));
    }
}
