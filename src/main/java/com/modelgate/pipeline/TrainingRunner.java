package com.modelgate.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelgate.ingest.CsvDatasetReader;
import com.modelgate.ingest.TabularDataset;
import com.modelgate.runtime.AppConfig;
import com.modelgate.runtime.ConfigException;
import com.modelgate.tracking.ExperimentTracker;
import com.modelgate.tracking.MetricPoint;
import com.modelgate.tracking.RunStatus;

/**
 * Opens a tracked run, fits the configured booster and stores the resulting model artifact in
 * the run. A failure at any point after the run is opened closes it as FAILED.
 */
public class TrainingRunner {
    private static final Logger log = LoggerFactory.getLogger(TrainingRunner.class);
    static final int TOP_FEATURES = 10;

    private final ExperimentTracker tracker;
    private final CsvDatasetReader reader;
    private final Function<String, ModelTrainer> trainers;
    private final Clock clock;

    public TrainingRunner(ExperimentTracker tracker) {
        this(tracker, new CsvDatasetReader(), ModelTrainers::forBooster, Clock.systemUTC());
    }

    TrainingRunner(ExperimentTracker tracker, CsvDatasetReader reader, Function<String, ModelTrainer> trainers,
            Clock clock) {
        this.tracker = tracker;
        this.reader = reader;
        this.trainers = trainers;
        this.clock = clock;
    }

    public TrainingOutcome train(Path datasetPath, AppConfig config) throws IOException {
        AppConfig.FeaturesConfig features = config.getFeatures();
        TabularDataset dataset = reader.read(datasetPath);
        requireColumns(dataset, features);

        TrainingHyperparameters hyperparameters = resolveDevice(
                TrainingHyperparameters.from(config.getModel().getHyperparameters()));
        ModelTrainer trainer = trainers.apply(hyperparameters.booster());

        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("task", "training");
        tags.put("booster", hyperparameters.booster());
        tags.put("dataset_fingerprint", dataset.fingerprint());
        String runId = tracker.startRun("train-" + hyperparameters.booster() + "-" + clock.millis(), tags);
        try {
            TrainingOutcome outcome = trainInRun(runId, datasetPath, dataset, features, hyperparameters, trainer,
                    config.getModel().getArtifactPath());
            tracker.finishRun(runId, RunStatus.FINISHED);
            log.info("Training run {} finished: {}", runId, outcome.metrics());
            return outcome;
        } catch (IOException | RuntimeException e) {
            markFailed(runId, e);
            throw new TrainingException(runId, "Training run " + runId + " failed: " + e.getMessage(), e);
        }
    }

    private TrainingOutcome trainInRun(String runId, Path datasetPath, TabularDataset dataset,
            AppConfig.FeaturesConfig features, TrainingHyperparameters hyperparameters, ModelTrainer trainer,
            String artifactPath) throws IOException {
        TabularDataset labelled = dropUnlabelled(dataset, features.getTargetColumn());
        LabelEncoding labels;
        try {
            labels = LabelEncoding.fit(labelled.column(features.getTargetColumn()), features.getPositiveLabel());
        } catch (IllegalArgumentException e) {
            throw new TrainingException(e.getMessage());
        }

        int[] allLabels = labelled.column(features.getTargetColumn()).stream().mapToInt(labels::encode).toArray();
        Split split = stratifiedSplit(allLabels, hyperparameters.validationFraction(), hyperparameters.seed());
        TabularDataset trainRows = labelled.select(split.train());
        TabularDataset validationRows = labelled.select(split.validation());

        Map<String, String> params = new LinkedHashMap<>(hyperparameters.toParams());
        params.put("dataset_path", datasetPath.toString());
        params.put("dataset_rows", Integer.toString(labelled.size()));
        params.put("train_rows", Integer.toString(trainRows.size()));
        params.put("validation_rows", Integer.toString(validationRows.size()));
        params.put("target_column", features.getTargetColumn());
        params.put("features", String.join(",", features.getTrainingFeatures()));
        params.put("positive_label", labels.positive());
        tracker.logParams(runId, params);

        FeatureEncoder encoder = FeatureEncoder.fit(trainRows, features.getTrainingFeatures());
        ModelTrainer.TrainingData train = new ModelTrainer.TrainingData(
                encoder.transform(trainRows), select(allLabels, split.train()));
        ModelTrainer.TrainingData validation = new ModelTrainer.TrainingData(
                encoder.transform(validationRows), select(allLabels, split.validation()));

        ModelTrainer.TrainerResult result = trainer.fit(train, validation, hyperparameters,
                (iteration, metrics) -> tracker.logMetrics(runId, toPoints(metrics, iteration)));
        TrainedModel model = result.model();

        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("train_accuracy", accuracy(model, train));
        if (validation.size() > 0) {
            metrics.put("validation_accuracy", accuracy(model, validation));
        }
        metrics.put("best_iteration", (double) result.bestIteration());
        metrics.put("rounds_run", (double) result.roundsRun());
        metrics.putAll(topFeatureImportance(encoder.featureNames(), model.importance()));
        tracker.logMetrics(runId, toPoints(metrics, Math.max(0, result.roundsRun())));

        ModelArtifact artifact = new ModelArtifact(
                ModelArtifact.FORMAT_VERSION,
                trainer.name(),
                features.getTargetColumn(),
                labels,
                encoder.encodings(),
                hyperparameters,
                dataset.fingerprint(),
                clock.instant(),
                model);
        tracker.logArtifact(runId, ModelArtifact.location(artifactPath), artifact.toJson());
        return new TrainingOutcome(runId, artifact, metrics);
    }

    private void markFailed(String runId, Exception failure) {
        try {
            tracker.finishRun(runId, RunStatus.FAILED);
        } catch (IOException | RuntimeException closeFailure) {
            log.warn("Could not mark run {} as failed", runId, closeFailure);
            failure.addSuppressed(closeFailure);
        }
    }

    private static void requireColumns(TabularDataset dataset, AppConfig.FeaturesConfig features) {
        List<String> missing = new ArrayList<>();
        if (!dataset.hasColumn(features.getTargetColumn())) {
            missing.add(features.getTargetColumn());
        }
        for (String feature : features.getTrainingFeatures()) {
            if (!dataset.hasColumn(feature)) {
                missing.add(feature);
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigException("Training data " + dataset.source() + " lacks configured columns " + missing);
        }
    }

    private static TabularDataset dropUnlabelled(TabularDataset dataset, String targetColumn) {
        List<Integer> labelled = new ArrayList<>();
        List<String> values = dataset.column(targetColumn);
        for (int i = 0; i < values.size(); i++) {
            if (!values.get(i).isBlank()) {
                labelled.add(i);
            }
        }
        if (labelled.size() < values.size()) {
            log.warn("Ignoring {} rows without a {} label", values.size() - labelled.size(), targetColumn);
        }
        return dataset.select(labelled);
    }

    private TrainingHyperparameters resolveDevice(TrainingHyperparameters hyperparameters) {
        String device = hyperparameters.device();
        if (device != null && !"cpu".equalsIgnoreCase(device)) {
            log.warn("Device '{}' is not available to the built-in boosters, falling back to cpu", device);
            return hyperparameters.withDevice("cpu");
        }
        return hyperparameters;
    }

    /**
     * Seeded per-class shuffle; each class with at least two rows contributes at least one
     * validation row and keeps at least one training row.
     */
    static Split stratifiedSplit(int[] labels, double validationFraction, long seed) {
        Random random = new Random(seed);
        List<Integer> train = new ArrayList<>();
        List<Integer> validation = new ArrayList<>();
        for (int label = 0; label <= 1; label++) {
            List<Integer> members = new ArrayList<>();
            for (int i = 0; i < labels.length; i++) {
                if (labels[i] == label) {
                    members.add(i);
                }
            }
            Collections.shuffle(members, random);
            int holdOut = (int) Math.round(members.size() * validationFraction);
            if (members.size() >= 2) {
                holdOut = Math.max(1, Math.min(members.size() - 1, holdOut));
            } else {
                holdOut = 0;
            }
            validation.addAll(members.subList(0, holdOut));
            train.addAll(members.subList(holdOut, members.size()));
        }
        train.sort(Comparator.naturalOrder());
        validation.sort(Comparator.naturalOrder());
        return new Split(train, validation);
    }

    static Map<String, Double> topFeatureImportance(List<String> names, double[] importance) {
        double total = 0.0;
        for (double value : importance) {
            total += value;
        }
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < importance.length; i++) {
            order.add(i);
        }
        order.sort(Comparator.comparingDouble((Integer i) -> importance[i]).reversed()
                .thenComparing(i -> names.get(i)));
        Map<String, Double> top = new LinkedHashMap<>();
        for (int i : order.subList(0, Math.min(TOP_FEATURES, order.size()))) {
            top.put("feature_importance/" + names.get(i), total > 0.0 ? importance[i] / total : 0.0);
        }
        return top;
    }

    private List<MetricPoint> toPoints(Map<String, Double> metrics, long step) {
        long now = clock.millis();
        return metrics.entrySet().stream()
                .map(entry -> new MetricPoint(entry.getKey(), entry.getValue(), step, now))
                .toList();
    }

    private static double accuracy(TrainedModel model, ModelTrainer.TrainingData data) {
        double[] probabilities = new double[data.size()];
        for (int i = 0; i < data.size(); i++) {
            probabilities[i] = model.predictProbability(data.features()[i]);
        }
        return BinaryScores.accuracy(data.labels(), probabilities);
    }

    private static int[] select(int[] values, List<Integer> indexes) {
        return indexes.stream().mapToInt(i -> values[i]).toArray();
    }

    record Split(List<Integer> train, List<Integer> validation) {
    }
}
