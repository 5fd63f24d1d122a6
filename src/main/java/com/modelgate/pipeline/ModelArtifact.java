package com.modelgate.pipeline;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.modelgate.ingest.TabularDataset;

/**
 * Everything needed to score raw rows: feature encodings, label mapping and the fitted model.
 * Stored as {@code <artifactPath>/model.json} inside the training run.
 */
public record ModelArtifact(
        int formatVersion,
        String trainer,
        String targetColumn,
        LabelEncoding labels,
        List<FeatureEncoding> features,
        TrainingHyperparameters hyperparameters,
        String datasetFingerprint,
        Instant trainedAt,
        TrainedModel model) {
    public static final int FORMAT_VERSION = 1;
    public static final String FILE_NAME = "model.json";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public ModelArtifact {
        features = features == null ? List.of() : List.copyOf(features);
    }

    public static String location(String artifactPath) {
        String prefix = artifactPath == null || artifactPath.isBlank() ? "model" : artifactPath.replaceAll("/+$", "");
        return prefix + "/" + FILE_NAME;
    }

    public static ModelArtifact fromJson(byte[] json) throws IOException {
        ModelArtifact artifact = MAPPER.readValue(json, ModelArtifact.class);
        if (artifact.formatVersion() != FORMAT_VERSION || artifact.model() == null || artifact.labels() == null) {
            throw new IOException("Unsupported or incomplete model artifact (format " + artifact.formatVersion() + ")");
        }
        return artifact;
    }

    public byte[] toJson() throws IOException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsBytes(this);
    }

    public FeatureEncoder encoder() {
        return new FeatureEncoder(features);
    }

    public List<String> featureNames() {
        return features.stream().map(FeatureEncoding::name).toList();
    }

    /** Positive-class probability per dataset row. */
    public double[] score(TabularDataset dataset) {
        return score(encoder().transform(dataset));
    }

    public double[] score(double[][] encoded) {
        double[] probabilities = new double[encoded.length];
        for (int i = 0; i < encoded.length; i++) {
            probabilities[i] = model.predictProbability(encoded[i]);
        }
        return probabilities;
    }
}
