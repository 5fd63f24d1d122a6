package com.modelgate.pipeline;

import com.modelgate.runtime.ConfigException;

public final class ModelTrainers {
    private ModelTrainers() {
    }

    public static ModelTrainer forBooster(String booster) {
        if (booster == null) {
            throw new ConfigException("Booster is required");
        }
        return switch (booster) {
            case "gbtree" -> new BoostedStumpTrainer();
            case "gblinear" -> new LinearBoosterTrainer();
            default -> throw new ConfigException("Unsupported booster: " + booster);
        };
    }
}
