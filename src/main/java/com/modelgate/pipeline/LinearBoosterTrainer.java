package com.modelgate.pipeline;

import java.util.Arrays;

/**
 * gblinear backend: L2-regularised logistic regression fitted by full-batch gradient descent on
 * standardised features.
 */
public class LinearBoosterTrainer extends AbstractBoostingTrainer {

    @Override
    public String name() {
        return "gblinear";
    }

    @Override
    protected BoostingState start(TrainingData train, TrainingData validation,
            TrainingHyperparameters hyperparameters) {
        return new LinearState(train, validation, hyperparameters);
    }

    private static final class LinearState implements BoostingState {
        private final TrainingData train;
        private final TrainingData validation;
        private final double learningRate;
        private final double lambda;
        private final double[] means;
        private final double[] scales;
        private final double[] weights;
        private double bias;
        private final double[] trainMargins;
        private final double[] validationMargins;

        LinearState(TrainingData train, TrainingData validation, TrainingHyperparameters hyperparameters) {
            this.train = train;
            this.validation = validation == null ? new TrainingData(new double[0][0], new int[0]) : validation;
            this.learningRate = hyperparameters.learningRate();
            this.lambda = hyperparameters.l2Regularization();
            int featureCount = train.features()[0].length;
            this.means = new double[featureCount];
            this.scales = new double[featureCount];
            standardisation(train.features(), means, scales);
            this.weights = new double[featureCount];
            this.bias = baseMargin(train.labels());
            this.trainMargins = new double[train.size()];
            this.validationMargins = new double[this.validation.size()];
            Arrays.fill(trainMargins, bias);
            Arrays.fill(validationMargins, bias);
        }

        @Override
        public boolean step() {
            int n = train.size();
            double[][] x = train.features();
            double[] weightGradient = new double[weights.length];
            double biasGradient = 0.0;
            for (int i = 0; i < n; i++) {
                double residual = TrainedModel.sigmoid(trainMargins[i]) - train.labels()[i];
                biasGradient += residual;
                for (int f = 0; f < weights.length; f++) {
                    weightGradient[f] += residual * (x[i][f] - means[f]) / scales[f];
                }
            }
            for (int f = 0; f < weights.length; f++) {
                weights[f] -= learningRate * (weightGradient[f] + lambda * weights[f]) / n;
            }
            bias -= learningRate * biasGradient / n;

            LinearModel current = (LinearModel) snapshot();
            for (int i = 0; i < n; i++) {
                trainMargins[i] = current.margin(x[i]);
            }
            double[][] validationRows = validation.features();
            for (int i = 0; i < validationMargins.length; i++) {
                validationMargins[i] = current.margin(validationRows[i]);
            }
            return true;
        }

        @Override
        public double[] trainMargins() {
            return trainMargins;
        }

        @Override
        public double[] validationMargins() {
            return validationMargins;
        }

        @Override
        public TrainedModel snapshot() {
            return new LinearModel(bias, weights.clone(), means.clone(), scales.clone());
        }
    }

    static void standardisation(double[][] x, double[] means, double[] scales) {
        int n = x.length;
        for (double[] row : x) {
            for (int f = 0; f < means.length; f++) {
                means[f] += row[f] / n;
            }
        }
        for (double[] row : x) {
            for (int f = 0; f < scales.length; f++) {
                double delta = row[f] - means[f];
                scales[f] += delta * delta / n;
            }
        }
        for (int f = 0; f < scales.length; f++) {
            scales[f] = scales[f] > 0.0 ? Math.sqrt(scales[f]) : 1.0;
        }
    }
}
