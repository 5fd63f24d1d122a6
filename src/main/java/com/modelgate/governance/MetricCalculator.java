package com.modelgate.governance;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelgate.pipeline.BinaryScores;

/**
 * Evaluation metric set for a binary classifier. Metric names are canonicalised so thresholds
 * may use the common aliases ({@code roc_auc}, {@code f1}, {@code logloss}, ...).
 */
public class MetricCalculator {
    private static final Logger log = LoggerFactory.getLogger(MetricCalculator.class);

    public static final List<String> METRICS = List.of(
            "example_count", "accuracy", "precision", "recall", "f1_score", "auc", "log_loss", "error");
    private static final Set<String> ERROR_METRICS = Set.of("log_loss", "error");
    private static final Map<String, String> ALIASES = Map.of(
            "accuracy_score", "accuracy",
            "precision_score", "precision",
            "recall_score", "recall",
            "f1", "f1_score",
            "roc_auc", "auc",
            "logloss", "log_loss");

    public static String canonical(String metric) {
        if (metric == null) {
            throw new MetricComputationException("Metric name is required");
        }
        String normalized = metric.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(normalized, normalized);
    }

    public static boolean isKnown(String metric) {
        return METRICS.contains(canonical(metric));
    }

    /** Error-type metrics are better when lower and are bounded from above. */
    public static boolean isErrorMetric(String metric) {
        return ERROR_METRICS.contains(canonical(metric));
    }

    /**
     * Every metric computable on these rows. AUC is left out when the labels hold one class
     * only; callers that require it get a {@link MetricComputationException} from
     * {@link #require}.
     */
    public Map<String, Double> computeAll(int[] labels, double[] probabilities) {
        if (labels.length == 0) {
            throw new MetricComputationException("Evaluation dataset has no rows");
        }
        Map<String, Double> metrics = new LinkedHashMap<>();
        for (String metric : METRICS) {
            double value = compute(metric, labels, probabilities);
            if (Double.isNaN(value)) {
                log.warn("Metric {} is undefined on this dataset and was not computed", metric);
                continue;
            }
            metrics.put(metric, value);
        }
        return metrics;
    }

    public static double require(Map<String, Double> metrics, String metric) {
        String name = canonical(metric);
        if (!METRICS.contains(name)) {
            throw new MetricComputationException("Unknown metric: " + metric);
        }
        Double value = metrics.get(name);
        if (value == null) {
            throw new MetricComputationException("Metric " + name + " cannot be computed from the evaluation labels");
        }
        return value;
    }

    double compute(String metric, int[] labels, double[] probabilities) {
        int truePositives = 0;
        int falsePositives = 0;
        int falseNegatives = 0;
        for (int i = 0; i < labels.length; i++) {
            int predicted = BinaryScores.predict(probabilities[i]);
            if (predicted == 1 && labels[i] == 1) {
                truePositives++;
            } else if (predicted == 1) {
                falsePositives++;
            } else if (labels[i] == 1) {
                falseNegatives++;
            }
        }
        return switch (canonical(metric)) {
            case "example_count" -> labels.length;
            case "accuracy" -> BinaryScores.accuracy(labels, probabilities);
            case "error" -> BinaryScores.errorRate(labels, probabilities);
            case "precision" -> ratio(truePositives, truePositives + falsePositives);
            case "recall" -> ratio(truePositives, truePositives + falseNegatives);
            case "f1_score" -> ratio(2 * truePositives, 2 * truePositives + falsePositives + falseNegatives);
            case "auc" -> BinaryScores.auc(labels, probabilities);
            case "log_loss" -> BinaryScores.logLoss(labels, probabilities);
            default -> throw new MetricComputationException("Unknown metric: " + metric);
        };
    }

    private static double ratio(int numerator, int denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
