package com.modelgate.pipeline;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Fitted binary classifier over encoded feature vectors. Output is a log-odds margin for the
 * positive class.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StumpEnsembleModel.class, name = "stump_ensemble"),
        @JsonSubTypes.Type(value = LinearModel.class, name = "linear")
})
public interface TrainedModel {

    double margin(double[] features);

    /**
     * Additive per-feature share of the margin relative to the training average; the values sum
     * to {@code margin(features)} minus the expected margin.
     */
    double[] contributions(double[] features);

    /** Non-negative importance per feature, in encoder order. */
    double[] importance();

    default double predictProbability(double[] features) {
        return sigmoid(margin(features));
    }

    static double sigmoid(double margin) {
        return 1.0 / (1.0 + Math.exp(-margin));
    }
}
