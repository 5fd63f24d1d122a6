package com.modelgate.pipeline;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinearBoosterTrainerTest {

    private final LinearBoosterTrainer trainer = new LinearBoosterTrainer();

    @Test
    void shouldLearnNegativeWeightForDecreasingRisk() throws Exception {
        ModelTrainer.TrainingData train = BoostedStumpTrainerTest.thresholdData(0, false);
        ModelTrainer.TrainingData validation = BoostedStumpTrainerTest.thresholdData(1, false);
        TrainingHyperparameters hyperparameters = new TrainingHyperparameters("gblinear", "binary:logistic",
                List.of("logloss"), "cpu", 50, 0.3, 1.0, 5, 0.2, 1L);

        ModelTrainer.TrainerResult result = trainer.fit(train, validation, hyperparameters, IterationListener.NONE);

        LinearModel model = (LinearModel) result.model();
        assertTrue(model.weights()[0] < 0.0);
        assertTrue(BoostedStumpTrainerTest.accuracy(model, validation) >= 0.95);
        assertEquals(model.importance()[0], Math.abs(model.weights()[0]));
        assertEquals("gblinear", trainer.name());
    }

    @Test
    void shouldStandardiseWithUnitScaleForConstantColumns() {
        double[][] x = { { 1.0, 5.0 }, { 3.0, 5.0 } };
        double[] means = new double[2];
        double[] scales = new double[2];

        LinearBoosterTrainer.standardisation(x, means, scales);

        assertArrayEquals(new double[] { 2.0, 5.0 }, means, 1e-12);
        assertArrayEquals(new double[] { 1.0, 1.0 }, scales, 1e-12);
    }
}
