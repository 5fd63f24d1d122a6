package com.modelgate.pipeline;

import java.io.IOException;

/**
 * Booster backend. Implementations fit a binary classifier on encoded rows, report per-round
 * metrics and return the model truncated to its best round.
 */
public interface ModelTrainer {

    String name();

    TrainerResult fit(TrainingData train, TrainingData validation, TrainingHyperparameters hyperparameters,
            IterationListener listener) throws IOException;

    record TrainingData(double[][] features, int[] labels) {
        public int size() {
            return labels.length;
        }
    }

    /**
     * @param bestIteration zero-based round the model was truncated to, -1 if no round improved
     *                      on the base margin
     */
    record TrainerResult(TrainedModel model, int bestIteration, int roundsRun, boolean stoppedEarly) {
    }
}
