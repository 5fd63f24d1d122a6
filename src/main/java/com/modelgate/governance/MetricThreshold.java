package com.modelgate.governance;

import com.modelgate.runtime.AppConfig;
import com.modelgate.runtime.ConfigException;

/**
 * Bound on one metric. A bare configured value is a minimum, or a maximum for error-type
 * metrics.
 */
public record MetricThreshold(String metric, Double min, Double max) {

    public MetricThreshold {
        metric = MetricCalculator.canonical(metric);
        if (min == null && max == null) {
            throw new ConfigException("Threshold for " + metric + " needs a min or max bound");
        }
        if (min != null && max != null && min > max) {
            throw new ConfigException("Threshold for " + metric + " has min " + min + " above max " + max);
        }
    }

    public static MetricThreshold atLeast(String metric, double min) {
        return new MetricThreshold(metric, min, null);
    }

    public static MetricThreshold atMost(String metric, double max) {
        return new MetricThreshold(metric, null, max);
    }

    public static MetricThreshold from(String metric, AppConfig.ThresholdConfig config) {
        if (!MetricCalculator.isKnown(metric)) {
            throw new ConfigException("Unknown threshold metric: " + metric);
        }
        if (config.getValue() != null) {
            return MetricCalculator.isErrorMetric(metric)
                    ? atMost(metric, config.getValue())
                    : atLeast(metric, config.getValue());
        }
        return new MetricThreshold(metric, config.getMin(), config.getMax());
    }
}
