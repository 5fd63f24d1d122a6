package com.modelgate.governance;

import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricCalculatorTest {

    private final MetricCalculator calculator = new MetricCalculator();

    @Test
    void shouldComputeFullMetricSet() {
        int[] labels = { 0, 0, 1, 1 };
        double[] probabilities = { 0.1, 0.4, 0.35, 0.8 };

        Map<String, Double> metrics = calculator.computeAll(labels, probabilities);

        assertEquals(4.0, metrics.get("example_count"));
        assertEquals(0.75, metrics.get("auc"), 1e-12);
        assertEquals(0.75, metrics.get("accuracy"), 1e-12);
        assertEquals(0.25, metrics.get("error"), 1e-12);
        assertEquals(1.0, metrics.get("precision"), 1e-12);
        assertEquals(0.5, metrics.get("recall"), 1e-12);
        assertEquals(2.0 / 3.0, metrics.get("f1_score"), 1e-12);
        double expectedLogLoss = -(Math.log(0.9) + Math.log(0.6) + Math.log(0.35) + Math.log(0.8)) / 4.0;
        assertEquals(expectedLogLoss, metrics.get("log_loss"), 1e-12);
    }

    @Test
    void shouldAverageTiedScoresInAuc() {
        Map<String, Double> metrics = calculator.computeAll(new int[] { 0, 1, 0, 1 },
                new double[] { 0.5, 0.5, 0.2, 0.9 });

        assertEquals(0.875, metrics.get("auc"), 1e-12);
    }

    @Test
    void shouldLeaveAucOutForSingleClassLabels() {
        Map<String, Double> metrics = calculator.computeAll(new int[] { 1, 1, 1 }, new double[] { 0.9, 0.8, 0.3 });

        assertFalse(metrics.containsKey("auc"));
        assertEquals(2.0 / 3.0, metrics.get("accuracy"), 1e-12);
        MetricComputationException error = assertThrows(MetricComputationException.class,
                () -> MetricCalculator.require(metrics, "roc_auc"));
        assertTrue(error.getMessage().contains("auc"));
    }

    @Test
    void shouldRejectEmptyEvaluationSet() {
        assertThrows(MetricComputationException.class, () -> calculator.computeAll(new int[0], new double[0]));
    }

    @Test
    void shouldCanonicaliseMetricAliases() {
        assertEquals("f1_score", MetricCalculator.canonical("F1"));
        assertEquals("log_loss", MetricCalculator.canonical("logloss"));
        assertEquals("auc", MetricCalculator.canonical("roc_auc"));
        assertTrue(MetricCalculator.isErrorMetric("logloss"));
        assertFalse(MetricCalculator.isErrorMetric("recall"));
        assertFalse(MetricCalculator.isKnown("sharpe_ratio"));
        assertThrows(MetricComputationException.class,
                () -> MetricCalculator.require(Map.of("accuracy", 0.9), "sharpe_ratio"));
    }

    @Test
    void shouldReportZeroPrecisionWithoutPredictedPositives() {
        Map<String, Double> metrics = calculator.computeAll(new int[] { 0, 1 }, new double[] { 0.1, 0.2 });

        assertEquals(0.0, metrics.get("precision"));
        assertEquals(0.0, metrics.get("f1_score"));
    }
}
