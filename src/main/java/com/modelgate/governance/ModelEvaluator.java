package com.modelgate.governance;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.modelgate.ingest.CsvDatasetReader;
import com.modelgate.ingest.TabularDataset;
import com.modelgate.pipeline.ModelArtifact;
import com.modelgate.tracking.ExperimentTracker;
import com.modelgate.tracking.RunStatus;

/**
 * Scores a trained run on held-out rows, applies the threshold and baseline rules and stores the
 * resulting {@link GateDecision}. Each evaluation is also recorded as its own tracker run.
 */
public class ModelEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ModelEvaluator.class);
    static final String DECISION_ARTIFACT = "gate_decision.json";
    static final String PREDICTIONS_ARTIFACT = "predictions.csv";

    private final ExperimentTracker tracker;
    private final GateDecisionStore decisions;
    private final BaselineSource baselines;
    private final ArtifactLoader artifacts;
    private final CsvDatasetReader reader;
    private final MetricCalculator calculator = new MetricCalculator();
    private final ThresholdGate gate = new ThresholdGate();
    private final PredictionWriter predictionWriter = new PredictionWriter();
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public ModelEvaluator(ExperimentTracker tracker, GateDecisionStore decisions, BaselineSource baselines) {
        this(tracker, decisions, baselines, new CsvDatasetReader(), Clock.systemUTC());
    }

    ModelEvaluator(ExperimentTracker tracker, GateDecisionStore decisions, BaselineSource baselines,
            CsvDatasetReader reader, Clock clock) {
        this.tracker = tracker;
        this.decisions = decisions;
        this.baselines = baselines;
        this.artifacts = new ArtifactLoader(tracker);
        this.reader = reader;
        this.clock = clock;
    }

    public GateDecision evaluate(EvaluationRequest request) throws IOException {
        ModelArtifact candidate = artifacts.load(request.runId(), request.artifactPath());
        TabularDataset dataset = reader.read(request.datasetPath());
        Scored scored = score(candidate, dataset, "run " + request.runId());

        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("task", "model_evaluation");
        tags.put("source_run_id", request.runId());
        String evaluationRunId = tracker.startRun("eval-" + request.runId(), tags);
        try {
            GateDecision decision = decide(request, candidate, dataset, scored, evaluationRunId);
            record(request, dataset, candidate, scored, decision);
            decisions.append(decision);
            tracker.finishRun(evaluationRunId, RunStatus.FINISHED);
            log.info("Gate decision {} for run {}: {} {}", decision.decisionId(), request.runId(),
                    decision.passed() ? "PASSED" : "FAILED", decision.reasonMessages());
            return decision;
        } catch (IOException | RuntimeException e) {
            try {
                tracker.finishRun(evaluationRunId, RunStatus.FAILED);
            } catch (IOException | RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    private GateDecision decide(EvaluationRequest request, ModelArtifact candidate, TabularDataset dataset,
            Scored scored, String evaluationRunId) throws IOException {
        EvaluationPolicy policy = request.policy();
        Map<String, Double> metrics = calculator.computeAll(scored.labels(), scored.probabilities());
        List<GateReason> reasons = new ArrayList<>(gate.check(metrics, policy));

        BaselineComparison comparison = null;
        if (request.modelName() != null) {
            Optional<BaselineSource.BaselineReference> reference = baselines.resolve(
                    request.modelName(), request.baselineVersion(), request.baselineAlias());
            if (reference.isPresent()) {
                comparison = compare(reference.get(), dataset, metrics, policy, request.artifactPath());
                if (comparison.regressed()) {
                    reasons.add(new GateReason(
                            GateReason.Type.BASELINE_REGRESSION,
                            comparison.primaryMetric(),
                            comparison.candidateValue(),
                            comparison.baselineValue(),
                            comparison.primaryMetric() + " worse than baseline version " + comparison.baselineVersion()
                                    + " (" + format(comparison.candidateValue()) + " vs "
                                    + format(comparison.baselineValue()) + ", tolerance "
                                    + ThresholdGate.formatBound(comparison.tolerance()) + ")"));
                }
            } else {
                log.info("No baseline bound for model {}; skipping baseline comparison", request.modelName());
            }
        }

        List<FeatureAttribution> attributions = request.attributionFeatures() > 0
                ? attribute(candidate, scored.encoded(), request.attributionFeatures())
                : List.of();

        return new GateDecision(
                UUID.randomUUID().toString(),
                request.runId(),
                reasons.isEmpty(),
                reasons,
                comparison,
                metrics,
                policy.fingerprint(),
                dataset.fingerprint(),
                evaluationRunId,
                attributions,
                clock.instant());
    }

    private BaselineComparison compare(BaselineSource.BaselineReference reference, TabularDataset dataset,
            Map<String, Double> candidateMetrics, EvaluationPolicy policy, String artifactPath) throws IOException {
        ModelArtifact baselineArtifact = artifacts.load(reference.runId(), artifactPath);
        Scored baselineScored = score(baselineArtifact, dataset, "baseline version " + reference.version());
        Map<String, Double> baselineMetrics = calculator.computeAll(baselineScored.labels(),
                baselineScored.probabilities());

        Map<String, Double> deltas = new LinkedHashMap<>();
        candidateMetrics.forEach((metric, value) -> {
            Double baselineValue = baselineMetrics.get(metric);
            if (baselineValue != null && !"example_count".equals(metric)) {
                deltas.put(metric, value - baselineValue);
            }
        });

        String primary = policy.primaryMetric();
        double candidateValue = MetricCalculator.require(candidateMetrics, primary);
        double baselineValue = MetricCalculator.require(baselineMetrics, primary);
        double worseBy = MetricCalculator.isErrorMetric(primary)
                ? candidateValue - baselineValue
                : baselineValue - candidateValue;
        boolean regressed = worseBy > policy.tolerance();
        return new BaselineComparison(
                reference.modelName(),
                reference.version(),
                reference.runId(),
                primary,
                candidateValue,
                baselineValue,
                policy.tolerance(),
                regressed,
                baselineMetrics,
                deltas);
    }

    private void record(EvaluationRequest request, TabularDataset dataset, ModelArtifact candidate, Scored scored,
            GateDecision decision) throws IOException {
        String runId = decision.evaluationRunId();
        Map<String, String> params = new LinkedHashMap<>();
        params.put("source_run_id", request.runId());
        params.put("eval_data_path", String.valueOf(request.datasetPath()));
        params.put("eval_rows", Integer.toString(dataset.size()));
        params.put("policy_fingerprint", decision.policyFingerprint());
        if (decision.baseline() != null) {
            params.put("baseline_version", Integer.toString(decision.baseline().baselineVersion()));
        }
        tracker.logParams(runId, params);

        Map<String, Double> logged = new LinkedHashMap<>(decision.metrics());
        if (decision.baseline() != null) {
            decision.baseline().deltas().forEach((metric, delta) -> logged.put("delta_" + metric, delta));
        }
        tracker.logMetrics(runId, logged);
        tracker.setTag(runId, "validation_passed", Boolean.toString(decision.passed()));
        tracker.logArtifact(runId, DECISION_ARTIFACT, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(decision));

        byte[] predictions = predictionWriter.render(dataset, scored.probabilities(), candidate.labels());
        tracker.logArtifact(runId, PREDICTIONS_ARTIFACT, predictions);
        if (request.predictionsPath() != null) {
            predictionWriter.write(request.predictionsPath(), predictions);
            log.info("Wrote {} predictions to {}", dataset.size(), request.predictionsPath());
        }
    }

    private Scored score(ModelArtifact artifact, TabularDataset dataset, String subject) {
        List<String> missing = new ArrayList<>();
        if (!dataset.hasColumn(artifact.targetColumn())) {
            missing.add(artifact.targetColumn());
        }
        artifact.featureNames().stream().filter(feature -> !dataset.hasColumn(feature)).forEach(missing::add);
        if (!missing.isEmpty()) {
            throw new MetricComputationException("Evaluation data " + dataset.source() + " lacks columns " + missing
                    + " required by " + subject);
        }

        List<String> rawLabels = dataset.column(artifact.targetColumn());
        int[] labels = new int[rawLabels.size()];
        for (int i = 0; i < labels.length; i++) {
            try {
                labels[i] = artifact.labels().encode(rawLabels.get(i));
            } catch (IllegalArgumentException e) {
                throw new MetricComputationException("Row " + (i + 1) + " of " + dataset.source() + ": "
                        + e.getMessage(), e);
            }
        }
        double[][] encoded = artifact.encoder().transform(dataset);
        return new Scored(labels, artifact.score(encoded), encoded);
    }

    static List<FeatureAttribution> attribute(ModelArtifact artifact, double[][] encoded, int limit) {
        List<String> names = artifact.featureNames();
        double[] totals = new double[names.size()];
        for (double[] row : encoded) {
            double[] contributions = artifact.model().contributions(row);
            for (int f = 0; f < totals.length; f++) {
                totals[f] += Math.abs(contributions[f]);
            }
        }
        List<FeatureAttribution> attributions = new ArrayList<>();
        for (int f = 0; f < totals.length; f++) {
            attributions.add(new FeatureAttribution(names.get(f), encoded.length == 0 ? 0.0 : totals[f] / encoded.length));
        }
        attributions.sort(Comparator.comparingDouble(FeatureAttribution::meanAbsoluteContribution).reversed()
                .thenComparing(FeatureAttribution::feature));
        return List.copyOf(attributions.subList(0, Math.min(limit, attributions.size())));
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }

    private record Scored(int[] labels, double[] probabilities, double[][] encoded) {
    }
}
