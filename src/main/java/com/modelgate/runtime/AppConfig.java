package com.modelgate.runtime;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.modelgate.governance.MetricCalculator;

/**
 * Bound form of the YAML configuration document. Unknown keys are rejected by the loader, and
 * {@link #validate()} enumerates every missing or inconsistent value before an operation starts.
 */
public class AppConfig {
    static final Set<String> SUPPORTED_BOOSTERS = Set.of("gbtree", "gblinear");
    static final Set<String> SUPPORTED_OBJECTIVES = Set.of("binary:logistic");
    static final Set<String> SUPPORTED_EVAL_METRICS = Set.of("logloss", "auc", "error");

    private TrackingConfig tracking = new TrackingConfig();
    private RegistryConfig registry = new RegistryConfig();
    private ModelConfig model = new ModelConfig();
    private FeaturesConfig features = new FeaturesConfig();
    private DataConfig data = new DataConfig();
    private EvaluationConfig evaluation = new EvaluationConfig();

    public TrackingConfig getTracking() {
        return tracking;
    }

    public void setTracking(TrackingConfig tracking) {
        this.tracking = tracking == null ? new TrackingConfig() : tracking;
    }

    public RegistryConfig getRegistry() {
        return registry;
    }

    public void setRegistry(RegistryConfig registry) {
        this.registry = registry == null ? new RegistryConfig() : registry;
    }

    public ModelConfig getModel() {
        return model;
    }

    public void setModel(ModelConfig model) {
        this.model = model == null ? new ModelConfig() : model;
    }

    public FeaturesConfig getFeatures() {
        return features;
    }

    public void setFeatures(FeaturesConfig features) {
        this.features = features == null ? new FeaturesConfig() : features;
    }

    public DataConfig getData() {
        return data;
    }

    public void setData(DataConfig data) {
        this.data = data == null ? new DataConfig() : data;
    }

    public EvaluationConfig getEvaluation() {
        return evaluation;
    }

    public void setEvaluation(EvaluationConfig evaluation) {
        this.evaluation = evaluation == null ? new EvaluationConfig() : evaluation;
    }

    public void validate() {
        List<String> problems = new ArrayList<>();
        requireText(problems, "tracking.uri", tracking.getUri());
        requireText(problems, "tracking.experimentName", tracking.getExperimentName());
        requireText(problems, "registry.uri", registry.getUri());
        requireText(problems, "registry.defaultAlias", registry.getDefaultAlias());
        requireText(problems, "model.artifactPath", model.getArtifactPath());
        requireText(problems, "features.targetColumn", features.getTargetColumn());
        if (features.getTrainingFeatures() == null || features.getTrainingFeatures().isEmpty()) {
            problems.add("features.trainingFeatures must list at least one column");
        } else if (features.getTrainingFeatures().contains(features.getTargetColumn())) {
            problems.add("features.trainingFeatures must not contain the target column " + features.getTargetColumn());
        }

        HyperparametersConfig hp = model.getHyperparameters();
        if (!SUPPORTED_BOOSTERS.contains(hp.getBooster())) {
            problems.add("model.hyperparameters.booster must be one of " + SUPPORTED_BOOSTERS + ", got " + hp.getBooster());
        }
        if (!SUPPORTED_OBJECTIVES.contains(hp.getObjective())) {
            problems.add("model.hyperparameters.objective must be one of " + SUPPORTED_OBJECTIVES + ", got " + hp.getObjective());
        }
        if (hp.getEvalMetrics() == null || hp.getEvalMetrics().isEmpty()) {
            problems.add("model.hyperparameters.evalMetrics must list at least one metric");
        } else {
            hp.getEvalMetrics().stream()
                    .filter(metric -> !SUPPORTED_EVAL_METRICS.contains(metric))
                    .forEach(metric -> problems.add("model.hyperparameters.evalMetrics contains unsupported metric " + metric));
        }
        if (hp.getNumRounds() <= 0) {
            problems.add("model.hyperparameters.numRounds must be positive");
        }
        if (hp.getLearningRate() <= 0.0) {
            problems.add("model.hyperparameters.learningRate must be positive");
        }
        if (hp.getL2Regularization() < 0.0) {
            problems.add("model.hyperparameters.l2Regularization must not be negative");
        }
        if (hp.getEarlyStoppingRounds() < 0) {
            problems.add("model.hyperparameters.earlyStoppingRounds must not be negative");
        }
        if (hp.getValidationFraction() <= 0.0 || hp.getValidationFraction() >= 1.0) {
            problems.add("model.hyperparameters.validationFraction must be between 0 and 1 (exclusive)");
        }

        evaluation.getThresholds().forEach((metric, threshold) -> {
            if (!MetricCalculator.isKnown(metric)) {
                problems.add("evaluation.thresholds." + metric + " is not a known metric; expected one of "
                        + MetricCalculator.METRICS);
            } else if (threshold == null || (threshold.getValue() == null && threshold.getMin() == null && threshold.getMax() == null)) {
                problems.add("evaluation.thresholds." + metric + " needs a min or max bound");
            } else if (threshold.getMin() != null && threshold.getMax() != null && threshold.getMin() > threshold.getMax()) {
                problems.add("evaluation.thresholds." + metric + " has min greater than max");
            }
        });
        BaselineConfig baseline = evaluation.getBaseline();
        requireText(problems, "evaluation.baseline.primaryMetric", baseline.getPrimaryMetric());
        if (baseline.getPrimaryMetric() != null && !baseline.getPrimaryMetric().isBlank()
                && !MetricCalculator.isKnown(baseline.getPrimaryMetric())) {
            problems.add("evaluation.baseline.primaryMetric " + baseline.getPrimaryMetric() + " is not a known metric");
        }
        if (baseline.getTolerance() < 0.0) {
            problems.add("evaluation.baseline.tolerance must not be negative");
        }
        if (evaluation.getExplainability().getMaxFeatures() <= 0) {
            problems.add("evaluation.explainability.maxFeatures must be positive");
        }

        if (!problems.isEmpty()) {
            throw new ConfigException("Invalid configuration: " + String.join("; ", problems));
        }
    }

    private static void requireText(List<String> problems, String key, String value) {
        if (value == null || value.isBlank()) {
            problems.add(key + " is required");
        }
    }

    public static class TrackingConfig {
        private String uri;
        private String experimentName;

        public String getUri() {
            return uri;
        }

        public void setUri(String uri) {
            this.uri = uri;
        }

        public String getExperimentName() {
            return experimentName;
        }

        public void setExperimentName(String experimentName) {
            this.experimentName = experimentName;
        }
    }

    public static class RegistryConfig {
        private String uri;
        private String auditLog;
        private String defaultAlias = "champion";

        public String getUri() {
            return uri;
        }

        public void setUri(String uri) {
            this.uri = uri;
        }

        public String getAuditLog() {
            return auditLog;
        }

        public void setAuditLog(String auditLog) {
            this.auditLog = auditLog;
        }

        public String getDefaultAlias() {
            return defaultAlias;
        }

        public void setDefaultAlias(String defaultAlias) {
            this.defaultAlias = defaultAlias;
        }
    }

    public static class ModelConfig {
        private String name;
        private String artifactPath = "model";
        private HyperparametersConfig hyperparameters = new HyperparametersConfig();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getArtifactPath() {
            return artifactPath;
        }

        public void setArtifactPath(String artifactPath) {
            this.artifactPath = artifactPath;
        }

        public HyperparametersConfig getHyperparameters() {
            return hyperparameters;
        }

        public void setHyperparameters(HyperparametersConfig hyperparameters) {
            this.hyperparameters = hyperparameters == null ? new HyperparametersConfig() : hyperparameters;
        }
    }

    public static class HyperparametersConfig {
        private String booster = "gbtree";
        private String objective = "binary:logistic";
        private List<String> evalMetrics = List.of("logloss", "auc");
        private String device = "cpu";
        private int numRounds = 100;
        private double learningRate = 0.3;
        private double l2Regularization = 1.0;
        private int earlyStoppingRounds = 10;
        private double validationFraction = 0.2;
        private long seed = 42L;

        public String getBooster() {
            return booster;
        }

        public void setBooster(String booster) {
            this.booster = booster == null ? null : booster.toLowerCase(Locale.ROOT);
        }

        public String getObjective() {
            return objective;
        }

        public void setObjective(String objective) {
            this.objective = objective;
        }

        public List<String> getEvalMetrics() {
            return evalMetrics;
        }

        public void setEvalMetrics(List<String> evalMetrics) {
            this.evalMetrics = evalMetrics;
        }

        public String getDevice() {
            return device;
        }

        public void setDevice(String device) {
            this.device = device;
        }

        public int getNumRounds() {
            return numRounds;
        }

        public void setNumRounds(int numRounds) {
            this.numRounds = numRounds;
        }

        public double getLearningRate() {
            return learningRate;
        }

        public void setLearningRate(double learningRate) {
            this.learningRate = learningRate;
        }

        public double getL2Regularization() {
            return l2Regularization;
        }

        public void setL2Regularization(double l2Regularization) {
            this.l2Regularization = l2Regularization;
        }

        public int getEarlyStoppingRounds() {
            return earlyStoppingRounds;
        }

        public void setEarlyStoppingRounds(int earlyStoppingRounds) {
            this.earlyStoppingRounds = earlyStoppingRounds;
        }

        public double getValidationFraction() {
            return validationFraction;
        }

        public void setValidationFraction(double validationFraction) {
            this.validationFraction = validationFraction;
        }

        public long getSeed() {
            return seed;
        }

        public void setSeed(long seed) {
            this.seed = seed;
        }
    }

    public static class FeaturesConfig {
        private String targetColumn;
        private List<String> trainingFeatures = new ArrayList<>();
        private String positiveLabel;

        public String getTargetColumn() {
            return targetColumn;
        }

        public void setTargetColumn(String targetColumn) {
            this.targetColumn = targetColumn;
        }

        public List<String> getTrainingFeatures() {
            return trainingFeatures;
        }

        public void setTrainingFeatures(List<String> trainingFeatures) {
            this.trainingFeatures = trainingFeatures == null ? new ArrayList<>() : trainingFeatures;
        }

        public String getPositiveLabel() {
            return positiveLabel;
        }

        public void setPositiveLabel(String positiveLabel) {
            this.positiveLabel = positiveLabel;
        }
    }

    public static class DataConfig {
        private String trainingPath;
        private String evalPath;

        public String getTrainingPath() {
            return trainingPath;
        }

        public void setTrainingPath(String trainingPath) {
            this.trainingPath = trainingPath;
        }

        public String getEvalPath() {
            return evalPath;
        }

        public void setEvalPath(String evalPath) {
            this.evalPath = evalPath;
        }
    }

    public static class EvaluationConfig {
        private Map<String, ThresholdConfig> thresholds = new LinkedHashMap<>();
        private BaselineConfig baseline = new BaselineConfig();
        private ExplainabilityConfig explainability = new ExplainabilityConfig();

        public Map<String, ThresholdConfig> getThresholds() {
            return thresholds;
        }

        public void setThresholds(Map<String, ThresholdConfig> thresholds) {
            this.thresholds = thresholds == null ? new LinkedHashMap<>() : new LinkedHashMap<>(thresholds);
        }

        public BaselineConfig getBaseline() {
            return baseline;
        }

        public void setBaseline(BaselineConfig baseline) {
            this.baseline = baseline == null ? new BaselineConfig() : baseline;
        }

        public ExplainabilityConfig getExplainability() {
            return explainability;
        }

        public void setExplainability(ExplainabilityConfig explainability) {
            this.explainability = explainability == null ? new ExplainabilityConfig() : explainability;
        }
    }

    /**
     * A metric bound. A bare number in YAML is a bound whose direction depends on the metric:
     * a maximum for error-type metrics, a minimum otherwise.
     */
    @JsonDeserialize(using = ThresholdConfigDeserializer.class)
    public static class ThresholdConfig {
        private Double min;
        private Double max;
        private Double value;

        public static ThresholdConfig atLeast(double min) {
            ThresholdConfig config = new ThresholdConfig();
            config.setMin(min);
            return config;
        }

        public static ThresholdConfig atMost(double max) {
            ThresholdConfig config = new ThresholdConfig();
            config.setMax(max);
            return config;
        }

        public Double getMin() {
            return min;
        }

        public void setMin(Double min) {
            this.min = min;
        }

        public Double getMax() {
            return max;
        }

        public void setMax(Double max) {
            this.max = max;
        }

        /** Undirected bound given as a bare number; resolved against the metric when the policy is built. */
        public Double getValue() {
            return value;
        }

        public void setValue(Double value) {
            this.value = value;
        }
    }

    static class ThresholdConfigDeserializer extends StdDeserializer<ThresholdConfig> {
        ThresholdConfigDeserializer() {
            super(ThresholdConfig.class);
        }

        @Override
        public ThresholdConfig deserialize(JsonParser parser, DeserializationContext context) throws IOException {
            JsonNode node = parser.readValueAsTree();
            ThresholdConfig config = new ThresholdConfig();
            if (node.isNumber()) {
                config.setValue(node.asDouble());
                return config;
            }
            if (!node.isObject()) {
                return (ThresholdConfig) context.handleUnexpectedToken(ThresholdConfig.class, parser);
            }
            var fields = node.fieldNames();
            while (fields.hasNext()) {
                String field = fields.next();
                JsonNode value = node.get(field);
                if (!value.isNumber()) {
                    throw context.weirdStringException(value.asText(), ThresholdConfig.class,
                            "threshold bound '" + field + "' must be numeric");
                }
                switch (field) {
                    case "min" -> config.setMin(value.asDouble());
                    case "max" -> config.setMax(value.asDouble());
                    default -> throw context.weirdStringException(field, ThresholdConfig.class,
                            "unknown threshold key, expected min or max");
                }
            }
            return config;
        }
    }

    public static class BaselineConfig {
        private String alias;
        private String primaryMetric = "f1_score";
        private double tolerance = 0.0;

        public String getAlias() {
            return alias;
        }

        public void setAlias(String alias) {
            this.alias = alias;
        }

        public String getPrimaryMetric() {
            return primaryMetric;
        }

        public void setPrimaryMetric(String primaryMetric) {
            this.primaryMetric = primaryMetric;
        }

        public double getTolerance() {
            return tolerance;
        }

        public void setTolerance(double tolerance) {
            this.tolerance = tolerance;
        }
    }

    public static class ExplainabilityConfig {
        private boolean enabled = false;
        private int maxFeatures = 10;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxFeatures() {
            return maxFeatures;
        }

        public void setMaxFeatures(int maxFeatures) {
            this.maxFeatures = maxFeatures;
        }
    }
}
