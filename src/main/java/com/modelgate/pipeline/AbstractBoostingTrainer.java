package com.modelgate.pipeline;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared boosting loop: one round at a time, per-round metrics on the train and validation
 * rows, early stopping on the first eval metric and truncation to the best round.
 */
public abstract class AbstractBoostingTrainer implements ModelTrainer {
    private static final Logger log = LoggerFactory.getLogger(AbstractBoostingTrainer.class);

    protected abstract BoostingState start(TrainingData train, TrainingData validation,
            TrainingHyperparameters hyperparameters);

    @Override
    public TrainerResult fit(TrainingData train, TrainingData validation, TrainingHyperparameters hyperparameters,
            IterationListener listener) throws IOException {
        if (train.size() == 0) {
            throw new TrainingException("No training rows");
        }
        BoostingState state = start(train, validation, hyperparameters);
        boolean hasValidation = validation != null && validation.size() > 0;
        String stoppingMetric = hyperparameters.primaryEvalMetric();
        String stoppingKey = (hasValidation ? "validation-" : "train-") + stoppingMetric;

        TrainedModel bestModel = state.snapshot();
        double bestScore = Double.NaN;
        int bestIteration = -1;
        int roundsRun = 0;
        boolean stoppedEarly = false;

        for (int iteration = 0; iteration < hyperparameters.numRounds(); iteration++) {
            if (!state.step()) {
                log.debug("{} found no further improving update after {} rounds", name(), iteration);
                break;
            }
            roundsRun = iteration + 1;

            Map<String, Double> metrics = new LinkedHashMap<>();
            for (String metric : hyperparameters.evalMetrics()) {
                metrics.put("train-" + metric,
                        BinaryScores.evalMetric(metric, train.labels(), probabilities(state.trainMargins(), iteration)));
            }
            if (hasValidation) {
                for (String metric : hyperparameters.evalMetrics()) {
                    metrics.put("validation-" + metric, BinaryScores.evalMetric(metric, validation.labels(),
                            probabilities(state.validationMargins(), iteration)));
                }
            }
            listener.onIteration(iteration, metrics);

            double score = metrics.get(stoppingKey);
            if (improves(stoppingMetric, score, bestScore)) {
                bestScore = score;
                bestIteration = iteration;
                bestModel = state.snapshot();
            } else if (hyperparameters.earlyStoppingRounds() > 0
                    && iteration - bestIteration >= hyperparameters.earlyStoppingRounds()) {
                log.info("Early stopping at round {}: best {}={} at round {}", iteration, stoppingKey, bestScore,
                        bestIteration);
                stoppedEarly = true;
                break;
            }
        }
        return new TrainerResult(bestModel, bestIteration, roundsRun, stoppedEarly);
    }

    static boolean improves(String metric, double candidate, double best) {
        if (Double.isNaN(candidate)) {
            return false;
        }
        if (Double.isNaN(best)) {
            return true;
        }
        return BinaryScores.higherIsBetter(metric) ? candidate > best : candidate < best;
    }

    private static double[] probabilities(double[] margins, int iteration) {
        double[] probabilities = new double[margins.length];
        for (int i = 0; i < margins.length; i++) {
            if (!Double.isFinite(margins[i])) {
                throw new TrainingException("Training did not converge: non-finite margin at round " + iteration);
            }
            probabilities[i] = TrainedModel.sigmoid(margins[i]);
        }
        return probabilities;
    }

    static double baseMargin(int[] labels) {
        double positives = 0;
        for (int label : labels) {
            positives += label;
        }
        double rate = Math.min(1.0 - 1e-6, Math.max(1e-6, positives / labels.length));
        return Math.log(rate / (1.0 - rate));
    }

    /** Mutable state of one fit. */
    protected interface BoostingState {

        /** Runs one boosting round; false when no update improves the objective. */
        boolean step();

        double[] trainMargins();

        double[] validationMargins();

        TrainedModel snapshot();
    }
}
