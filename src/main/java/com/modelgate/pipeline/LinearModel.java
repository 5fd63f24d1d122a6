package com.modelgate.pipeline;

/**
 * Logistic regression over standardised features: {@code bias + sum(w * (x - mean) / scale)}.
 */
public record LinearModel(double bias, double[] weights, double[] means, double[] scales) implements TrainedModel {

    @Override
    public double margin(double[] features) {
        double margin = bias;
        for (int i = 0; i < weights.length; i++) {
            margin += weights[i] * standardise(features, i);
        }
        return margin;
    }

    @Override
    public double[] contributions(double[] features) {
        double[] contributions = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            contributions[i] = weights[i] * standardise(features, i);
        }
        return contributions;
    }

    @Override
    public double[] importance() {
        double[] importance = new double[weights.length];
        for (int i = 0; i < weights.length; i++) {
            importance[i] = Math.abs(weights[i]);
        }
        return importance;
    }

    private double standardise(double[] features, int i) {
        return (features[i] - means[i]) / scales[i];
    }
}
