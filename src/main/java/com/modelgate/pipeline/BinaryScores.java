package com.modelgate.pipeline;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Scoring functions over 0/1 labels and positive-class probabilities, shared by the boosting
 * loop and the evaluation gate.
 */
public final class BinaryScores {
    public static final double PROBABILITY_EPSILON = 1e-15;

    private BinaryScores() {
    }

    public static double logLoss(int[] labels, double[] probabilities) {
        double total = 0.0;
        for (int i = 0; i < labels.length; i++) {
            double p = Math.min(1.0 - PROBABILITY_EPSILON, Math.max(PROBABILITY_EPSILON, probabilities[i]));
            total += labels[i] == 1 ? -Math.log(p) : -Math.log(1.0 - p);
        }
        return labels.length == 0 ? Double.NaN : total / labels.length;
    }

    public static double errorRate(int[] labels, double[] probabilities) {
        return labels.length == 0 ? Double.NaN : 1.0 - accuracy(labels, probabilities);
    }

    public static double accuracy(int[] labels, double[] probabilities) {
        if (labels.length == 0) {
            return Double.NaN;
        }
        int correct = 0;
        for (int i = 0; i < labels.length; i++) {
            if (predict(probabilities[i]) == labels[i]) {
                correct++;
            }
        }
        return (double) correct / labels.length;
    }

    public static int predict(double probability) {
        return probability >= 0.5 ? 1 : 0;
    }

    /**
     * Area under the ROC curve as the Mann-Whitney rank statistic, ties sharing their average
     * rank. NaN when only one class is present.
     */
    public static double auc(int[] labels, double[] scores) {
        int n = labels.length;
        long positives = Arrays.stream(labels).filter(label -> label == 1).count();
        long negatives = n - positives;
        if (positives == 0 || negatives == 0) {
            return Double.NaN;
        }
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> scores[i]));

        double positiveRankSum = 0.0;
        int start = 0;
        while (start < n) {
            int end = start;
            while (end + 1 < n && scores[order[end + 1]] == scores[order[start]]) {
                end++;
            }
            double averageRank = (start + end) / 2.0 + 1.0;
            for (int k = start; k <= end; k++) {
                if (labels[order[k]] == 1) {
                    positiveRankSum += averageRank;
                }
            }
            start = end + 1;
        }
        return (positiveRankSum - positives * (positives + 1) / 2.0) / ((double) positives * negatives);
    }

    /** Training-time eval metric by its booster name: logloss, auc or error. */
    public static double evalMetric(String name, int[] labels, double[] probabilities) {
        return switch (name) {
            case "logloss" -> logLoss(labels, probabilities);
            case "auc" -> auc(labels, probabilities);
            case "error" -> errorRate(labels, probabilities);
            default -> throw new IllegalArgumentException("Unsupported eval metric: " + name);
        };
    }

    public static boolean higherIsBetter(String evalMetric) {
        return "auc".equals(evalMetric);
    }
}
