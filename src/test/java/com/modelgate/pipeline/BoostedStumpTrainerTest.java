package com.modelgate.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoostedStumpTrainerTest {

    private final BoostedStumpTrainer trainer = new BoostedStumpTrainer();

    @Test
    void shouldSeparateThresholdData() throws Exception {
        ModelTrainer.TrainingData train = thresholdData(0, false);
        ModelTrainer.TrainingData validation = thresholdData(1, false);
        List<Map<String, Double>> rounds = new ArrayList<>();

        ModelTrainer.TrainerResult result = trainer.fit(train, validation, hyperparameters(20, 5),
                (iteration, metrics) -> rounds.add(metrics));

        assertEquals(20, result.roundsRun());
        assertEquals(20, rounds.size());
        assertEquals(List.of("train-logloss", "train-auc", "validation-logloss", "validation-auc"),
                List.copyOf(rounds.get(0).keySet()));
        assertTrue(rounds.get(19).get("validation-logloss") < rounds.get(0).get("validation-logloss"));
        assertEquals(1.0, accuracy(result.model(), validation));
        assertFalse(result.stoppedEarly());
    }

    @Test
    void shouldStopEarlyAndKeepBestRound() throws Exception {
        ModelTrainer.TrainingData train = thresholdData(0, false);
        ModelTrainer.TrainingData inverted = thresholdData(1, true);

        ModelTrainer.TrainerResult result = trainer.fit(train, inverted, hyperparameters(50, 3), IterationListener.NONE);

        assertTrue(result.stoppedEarly());
        assertEquals(0, result.bestIteration());
        assertEquals(4, result.roundsRun());
        assertEquals(1, ((StumpEnsembleModel) result.model()).stumps().size());
    }

    @Test
    void shouldStopWhenNoSplitImproves() throws Exception {
        double[][] constant = new double[10][1];
        int[] labels = { 0, 1, 0, 1, 0, 1, 0, 1, 1, 1 };

        ModelTrainer.TrainerResult result = trainer.fit(new ModelTrainer.TrainingData(constant, labels), null,
                hyperparameters(10, 0), IterationListener.NONE);

        assertEquals(0, result.roundsRun());
        assertEquals(-1, result.bestIteration());
        assertEquals(0.6, result.model().predictProbability(new double[] { 0.0 }), 1e-6);
    }

    @Test
    void shouldAttributeImportanceToSplittingFeature() throws Exception {
        double[][] features = new double[40][2];
        int[] labels = new int[40];
        for (int i = 0; i < 40; i++) {
            features[i][0] = (i * 7) % 3;
            features[i][1] = i;
            labels[i] = i < 20 ? 1 : 0;
        }

        ModelTrainer.TrainerResult result = trainer.fit(new ModelTrainer.TrainingData(features, labels), null,
                hyperparameters(5, 0), IterationListener.NONE);

        double[] importance = result.model().importance();
        assertTrue(importance[1] > importance[0]);
        double[] contributions = result.model().contributions(features[0]);
        assertTrue(contributions[1] > 0.0);
    }

    @Test
    void shouldThinCandidateSplitsForManyDistinctValues() {
        double[][] x = new double[2000][1];
        int[] sorted = new int[2000];
        for (int i = 0; i < 2000; i++) {
            x[i][0] = i;
            sorted[i] = i;
        }

        int[] candidates = BoostedStumpTrainer.candidates(x, sorted, 0);

        assertTrue(candidates.length <= BoostedStumpTrainer.MAX_CANDIDATE_SPLITS + 1, "" + candidates.length);
        assertTrue(candidates.length >= BoostedStumpTrainer.MAX_CANDIDATE_SPLITS / 2, "" + candidates.length);
    }

    @Test
    void shouldPropagateListenerFailure() {
        assertThrows(IOException.class, () -> trainer.fit(thresholdData(0, false), null, hyperparameters(5, 0),
                (iteration, metrics) -> {
                    throw new IOException("tracking store unavailable");
                }));
    }

    @Test
    void shouldRejectEmptyTrainingSet() {
        ModelTrainer.TrainingData empty = new ModelTrainer.TrainingData(new double[0][0], new int[0]);

        assertThrows(TrainingException.class,
                () -> trainer.fit(empty, null, hyperparameters(5, 0), IterationListener.NONE));
    }

    static TrainingHyperparameters hyperparameters(int rounds, int earlyStopping) {
        return new TrainingHyperparameters("gbtree", "binary:logistic", List.of("logloss", "auc"), "cpu", rounds,
                0.3, 1.0, earlyStopping, 0.2, 1L);
    }

    /** Rows 0..99 of the given parity; label 1 below 49, flipped when inverted. */
    static ModelTrainer.TrainingData thresholdData(int parity, boolean inverted) {
        double[][] features = new double[50][1];
        int[] labels = new int[50];
        for (int i = 0; i < 50; i++) {
            int x = 2 * i + parity;
            features[i][0] = x;
            boolean positive = x < 49;
            labels[i] = positive != inverted ? 1 : 0;
        }
        return new ModelTrainer.TrainingData(features, labels);
    }

    static double accuracy(TrainedModel model, ModelTrainer.TrainingData data) {
        double[] probabilities = new double[data.size()];
        for (int i = 0; i < data.size(); i++) {
            probabilities[i] = model.predictProbability(data.features()[i]);
        }
        return BinaryScores.accuracy(data.labels(), probabilities);
    }
}
