package com.modelgate.pipeline;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.modelgate.runtime.AppConfig;

public record TrainingHyperparameters(
        String booster,
        String objective,
        List<String> evalMetrics,
        String device,
        int numRounds,
        double learningRate,
        double l2Regularization,
        int earlyStoppingRounds,
        double validationFraction,
        long seed) {

    public TrainingHyperparameters {
        evalMetrics = evalMetrics == null || evalMetrics.isEmpty() ? List.of("logloss") : List.copyOf(evalMetrics);
    }

    public static TrainingHyperparameters defaults() {
        return new TrainingHyperparameters("gbtree", "binary:logistic", List.of("logloss", "auc"), "cpu",
                100, 0.3, 1.0, 10, 0.2, 42L);
    }

    public static TrainingHyperparameters from(AppConfig.HyperparametersConfig config) {
        return new TrainingHyperparameters(
                config.getBooster(),
                config.getObjective(),
                config.getEvalMetrics(),
                config.getDevice(),
                config.getNumRounds(),
                config.getLearningRate(),
                config.getL2Regularization(),
                config.getEarlyStoppingRounds(),
                config.getValidationFraction(),
                config.getSeed());
    }

    public String primaryEvalMetric() {
        return evalMetrics.get(0);
    }

    public TrainingHyperparameters withDevice(String resolvedDevice) {
        return new TrainingHyperparameters(booster, objective, evalMetrics, resolvedDevice, numRounds, learningRate,
                l2Regularization, earlyStoppingRounds, validationFraction, seed);
    }

    /** Flat string view logged as run params. */
    public Map<String, String> toParams() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("booster", booster);
        params.put("objective", objective);
        params.put("eval_metric", String.join(",", evalMetrics));
        params.put("device", device);
        params.put("num_boost_round", Integer.toString(numRounds));
        params.put("learning_rate", Double.toString(learningRate));
        params.put("lambda", Double.toString(l2Regularization));
        params.put("early_stopping_rounds", Integer.toString(earlyStoppingRounds));
        params.put("validation_fraction", Double.toString(validationFraction));
        params.put("seed", Long.toString(seed));
        return params;
    }
}
