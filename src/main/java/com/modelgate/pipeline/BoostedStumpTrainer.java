package com.modelgate.pipeline;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * gbtree backend: Newton boosting of depth-one trees on the logistic loss with L2-regularised
 * leaf weights.
 */
public class BoostedStumpTrainer extends AbstractBoostingTrainer {
    static final int MAX_CANDIDATE_SPLITS = 256;
    private static final double MIN_HESSIAN = 1e-16;
    private static final double MIN_GAIN = 1e-12;

    @Override
    public String name() {
        return "gbtree";
    }

    @Override
    protected BoostingState start(TrainingData train, TrainingData validation,
            TrainingHyperparameters hyperparameters) {
        return new StumpState(train, validation, hyperparameters);
    }

    private static final class StumpState implements BoostingState {
        private final TrainingData train;
        private final TrainingData validation;
        private final double learningRate;
        private final double lambda;
        private final int featureCount;
        private final double baseMargin;
        private final int[][] sortedRows;
        private final int[][] candidatePositions;
        private final double[] trainMargins;
        private final double[] validationMargins;
        private final List<StumpEnsembleModel.Stump> stumps = new ArrayList<>();

        StumpState(TrainingData train, TrainingData validation, TrainingHyperparameters hyperparameters) {
            this.train = train;
            this.validation = validation == null ? new TrainingData(new double[0][0], new int[0]) : validation;
            this.learningRate = hyperparameters.learningRate();
            this.lambda = hyperparameters.l2Regularization();
            this.featureCount = train.features()[0].length;
            this.baseMargin = baseMargin(train.labels());
            this.sortedRows = new int[featureCount][];
            this.candidatePositions = new int[featureCount][];
            for (int f = 0; f < featureCount; f++) {
                sortedRows[f] = sortByFeature(train.features(), f);
                candidatePositions[f] = candidates(train.features(), sortedRows[f], f);
            }
            this.trainMargins = new double[train.size()];
            Arrays.fill(trainMargins, baseMargin);
            this.validationMargins = new double[this.validation.size()];
            Arrays.fill(validationMargins, baseMargin);
        }

        @Override
        public boolean step() {
            int n = train.size();
            double[] gradients = new double[n];
            double[] hessians = new double[n];
            double totalGradient = 0.0;
            double totalHessian = 0.0;
            for (int i = 0; i < n; i++) {
                double p = TrainedModel.sigmoid(trainMargins[i]);
                gradients[i] = p - train.labels()[i];
                hessians[i] = Math.max(p * (1.0 - p), MIN_HESSIAN);
                totalGradient += gradients[i];
                totalHessian += hessians[i];
            }
            double parentScore = totalGradient * totalGradient / (totalHessian + lambda);

            double bestGain = MIN_GAIN;
            int bestFeature = -1;
            int bestPosition = -1;
            double bestLeftGradient = 0.0;
            double bestLeftHessian = 0.0;
            for (int f = 0; f < featureCount; f++) {
                int[] rows = sortedRows[f];
                int[] positions = candidatePositions[f];
                double leftGradient = 0.0;
                double leftHessian = 0.0;
                int next = 0;
                for (int k = 0; k < rows.length && next < positions.length; k++) {
                    leftGradient += gradients[rows[k]];
                    leftHessian += hessians[rows[k]];
                    if (k != positions[next]) {
                        continue;
                    }
                    next++;
                    double rightGradient = totalGradient - leftGradient;
                    double rightHessian = totalHessian - leftHessian;
                    double gain = leftGradient * leftGradient / (leftHessian + lambda)
                            + rightGradient * rightGradient / (rightHessian + lambda)
                            - parentScore;
                    if (gain > bestGain) {
                        bestGain = gain;
                        bestFeature = f;
                        bestPosition = k;
                        bestLeftGradient = leftGradient;
                        bestLeftHessian = leftHessian;
                    }
                }
            }
            if (bestFeature < 0) {
                return false;
            }

            double[][] x = train.features();
            int[] rows = sortedRows[bestFeature];
            double threshold = (x[rows[bestPosition]][bestFeature] + x[rows[bestPosition + 1]][bestFeature]) / 2.0;
            double leftValue = -learningRate * bestLeftGradient / (bestLeftHessian + lambda);
            double rightValue = -learningRate * (totalGradient - bestLeftGradient)
                    / (totalHessian - bestLeftHessian + lambda);
            StumpEnsembleModel.Stump stump = new StumpEnsembleModel.Stump(
                    bestFeature, threshold, leftValue, rightValue, (bestPosition + 1.0) / n, bestGain);
            stumps.add(stump);

            for (int i = 0; i < n; i++) {
                trainMargins[i] += stump.value(x[i][bestFeature]);
            }
            double[][] validationRows = validation.features();
            for (int i = 0; i < validationMargins.length; i++) {
                validationMargins[i] += stump.value(validationRows[i][bestFeature]);
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
            return new StumpEnsembleModel(featureCount, baseMargin, stumps);
        }
    }

    private static int[] sortByFeature(double[][] x, int feature) {
        return IntStream.range(0, x.length)
                .boxed()
                .sorted(Comparator.comparingDouble(row -> x[row][feature]))
                .mapToInt(Integer::intValue)
                .toArray();
    }

    /**
     * Positions in sorted order after which a split may fall: every boundary between distinct
     * values, thinned to roughly quantile-spaced boundaries for high-cardinality features.
     */
    static int[] candidates(double[][] x, int[] sorted, int feature) {
        int n = sorted.length;
        List<Integer> boundaries = new ArrayList<>();
        for (int k = 0; k + 1 < n; k++) {
            if (x[sorted[k]][feature] != x[sorted[k + 1]][feature]) {
                boundaries.add(k);
            }
        }
        if (boundaries.size() < MAX_CANDIDATE_SPLITS) {
            return boundaries.stream().mapToInt(Integer::intValue).toArray();
        }
        List<Integer> thinned = new ArrayList<>();
        long lastBucket = -1;
        for (int position : boundaries) {
            long bucket = (long) (position + 1) * MAX_CANDIDATE_SPLITS / n;
            if (bucket > lastBucket) {
                thinned.add(position);
                lastBucket = bucket;
            }
        }
        return thinned.stream().mapToInt(Integer::intValue).toArray();
    }
}
