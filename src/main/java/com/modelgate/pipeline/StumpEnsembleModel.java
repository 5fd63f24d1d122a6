package com.modelgate.pipeline;

import java.util.List;

/**
 * Sum of depth-one regression trees on top of a constant log-odds base margin.
 */
public record StumpEnsembleModel(int featureCount, double baseMargin, List<Stump> stumps) implements TrainedModel {
    public StumpEnsembleModel {
        stumps = stumps == null ? List.of() : List.copyOf(stumps);
    }

    @Override
    public double margin(double[] features) {
        double margin = baseMargin;
        for (Stump stump : stumps) {
            margin += stump.value(features[stump.feature()]);
        }
        return margin;
    }

    @Override
    public double[] contributions(double[] features) {
        double[] contributions = new double[featureCount];
        for (Stump stump : stumps) {
            contributions[stump.feature()] += stump.value(features[stump.feature()]) - stump.expectedValue();
        }
        return contributions;
    }

    @Override
    public double[] importance() {
        double[] importance = new double[featureCount];
        for (Stump stump : stumps) {
            importance[stump.feature()] += stump.gain();
        }
        return importance;
    }

    public StumpEnsembleModel truncate(int rounds) {
        return new StumpEnsembleModel(featureCount, baseMargin, stumps.subList(0, Math.min(rounds, stumps.size())));
    }

    /**
     * One split: values strictly below {@code threshold} take {@code leftValue}.
     * {@code leftFraction} is the share of training rows that went left.
     */
    public record Stump(int feature, double threshold, double leftValue, double rightValue, double leftFraction,
            double gain) {

        public double value(double x) {
            return x < threshold ? leftValue : rightValue;
        }

        public double expectedValue() {
            return leftFraction * leftValue + (1.0 - leftFraction) * rightValue;
        }
    }
}
