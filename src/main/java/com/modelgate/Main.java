package com.modelgate;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelgate.governance.ArtifactLoader;
import com.modelgate.governance.EvaluationPolicy;
import com.modelgate.governance.EvaluationRequest;
import com.modelgate.governance.GateDecision;
import com.modelgate.governance.ModelEvaluator;
import com.modelgate.governance.PredictionWriter;
import com.modelgate.ingest.CsvDatasetReader;
import com.modelgate.ingest.TabularDataset;
import com.modelgate.pipeline.ModelArtifact;
import com.modelgate.pipeline.TrainingOutcome;
import com.modelgate.pipeline.TrainingRunner;
import com.modelgate.runtime.AppConfig;
import com.modelgate.runtime.ConfigException;
import com.modelgate.runtime.ConfigLoader;
import com.modelgate.tracking.ExperimentTracker;
import com.modelgate.tracking.ExperimentTrackers;
import com.modelgate.versioning.AliasBinding;
import com.modelgate.versioning.AliasPromotionService;
import com.modelgate.versioning.ExpectedBinding;
import com.modelgate.versioning.FileRegistryStore;
import com.modelgate.versioning.ModelRegistry;
import com.modelgate.versioning.ModelVersion;
import com.modelgate.versioning.PromotionAuditLog;
import com.modelgate.versioning.PromotionRequest;
import com.modelgate.versioning.PromotionResult;
import com.modelgate.versioning.RegisteredModel;
import com.modelgate.versioning.RegistryDecisionStore;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
        name = "model-gate",
        mixinStandardHelpOptions = true,
        version = "model-gate 0.1.0",
        description = "Train, evaluate, register and promote binary classifiers behind a quality gate.",
        subcommands = {
                Main.TrainCommand.class,
                Main.EvalCommand.class,
                Main.RegisterCommand.class,
                Main.PromoteCommand.class,
                Main.SetAliasCommand.class,
                Main.RemoveAliasCommand.class,
                Main.DeleteVersionCommand.class,
                Main.UpdateDescriptionCommand.class,
                Main.ListCommand.class,
                Main.InfoCommand.class,
                Main.PredictCommand.class
        })
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO = 1;
    static final int EXIT_CONFIG = 2;
    static final int EXIT_NOT_FOUND = 3;
    static final int EXIT_GATE_FAILED = 4;
    static final int EXIT_METRICS = 5;
    static final int EXIT_CONFLICT = 6;
    static final int EXIT_TRAINING = 7;
    static final int EXIT_TRACKING = 8;

    private final OkHttpClient httpClient;

    @Spec
    CommandSpec spec;

    public Main() {
        this(new OkHttpClient());
    }

    Main(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    public static void main(String[] args) {
        System.exit(commandLine(new Main()).execute(args));
    }

    static CommandLine commandLine(Main main) {
        return new CommandLine(main).setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            int code = exitCode(ex);
            log.error("{} failed: {}", commandLine.getCommandName(), ex.getMessage());
            log.debug("Failure detail", ex);
            commandLine.getErr().println("error: " + ex.getMessage());
            return code;
        });
    }

    static int exitCode(Throwable failure) {
        if (failure instanceof ModelGateException gateException) {
            return switch (gateException.kind()) {
                case CONFIG -> EXIT_CONFIG;
                case RUN_NOT_FOUND, ARTIFACT_NOT_FOUND, VERSION_NOT_FOUND -> EXIT_NOT_FOUND;
                case METRIC_COMPUTATION -> EXIT_METRICS;
                case REGISTRY_CONFLICT, VERSION_IN_USE -> EXIT_CONFLICT;
                case TRAINING_FAILED -> EXIT_TRAINING;
                case TRACKING -> EXIT_TRACKING;
            };
        }
        return EXIT_IO;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return EXIT_CONFIG;
    }

    static class ConfigOption {
        @Option(names = { "-c", "--config" }, required = true, description = "Path to the YAML config file")
        Path configPath;
    }

    /** Collaborators for one command invocation, built from the loaded config. */
    static final class Services {
        final AppConfig config;
        final ExperimentTracker tracker;
        final FileRegistryStore store;
        final ModelRegistry registry;
        final RegistryDecisionStore decisions;

        Services(AppConfig config, OkHttpClient httpClient) {
            this.config = config;
            this.tracker = ExperimentTrackers.fromConfig(config.getTracking(), httpClient);
            this.store = new FileRegistryStore(Path.of(config.getRegistry().getUri()));
            this.registry = new ModelRegistry(store, tracker, config.getModel().getArtifactPath());
            this.decisions = new RegistryDecisionStore(store);
        }

        AliasPromotionService promotions() {
            String auditLog = config.getRegistry().getAuditLog();
            Path auditPath = auditLog == null || auditLog.isBlank()
                    ? siblingOf(store.path(), "alias-audit.jsonl")
                    : Path.of(auditLog);
            return new AliasPromotionService(store, new PromotionAuditLog(auditPath));
        }

        EvaluationPolicy policy() {
            return EvaluationPolicy.from(config.getEvaluation());
        }

        private static Path siblingOf(Path file, String name) {
            Path parent = file.toAbsolutePath().getParent();
            return parent == null ? Path.of(name) : parent.resolve(name);
        }
    }

    abstract static class GateCommand implements Callable<Integer> {
        @ParentCommand
        Main main;

        @Spec
        CommandSpec spec;

        @Mixin
        ConfigOption configOption;

        @Option(names = { "-h", "--help" }, usageHelp = true, description = "Show this help message and exit.")
        boolean helpRequested;

        @Override
        public Integer call() throws Exception {
            AppConfig config = ConfigLoader.load(configOption.configPath);
            return run(new Services(config, main.httpClient), spec.commandLine().getOut());
        }

        abstract int run(Services services, PrintWriter out) throws IOException;

        static String actor() {
            String user = System.getProperty("user.name");
            return user == null || user.isBlank() ? "unknown" : user;
        }

        static String modelName(String option, AppConfig config) {
            String name = option != null && !option.isBlank() ? option : config.getModel().getName();
            if (name == null || name.isBlank()) {
                throw new ConfigException("--model-name is required (or set model.name in the config)");
            }
            return name;
        }

        static int version(Integer option) {
            if (option == null) {
                throw new ConfigException("--version is required");
            }
            return option;
        }

        static Path dataPath(Path option, String configured, String flag, String key) {
            if (option != null) {
                return option;
            }
            if (configured == null || configured.isBlank()) {
                throw new ConfigException(flag + " is required (or set " + key + " in the config)");
            }
            return Path.of(configured);
        }
    }

    @Command(name = "train", description = "Train a model and log it as a tracked run.")
    static class TrainCommand extends GateCommand {
        @Option(names = "--data-path", description = "Training CSV; defaults to data.trainingPath")
        Path dataPath;

        @Override
        int run(Services services, PrintWriter out) throws IOException {
            Path data = dataPath(dataPath, services.config.getData().getTrainingPath(), "--data-path",
                    "data.trainingPath");
            TrainingOutcome outcome = new TrainingRunner(services.tracker).train(data, services.config);
            log.info("Training run {} finished: {}", outcome.runId(), outcome.metrics());
            out.println(outcome.runId());
            return EXIT_OK;
        }
    }

    @Command(name = "eval", description = "Evaluate a run against the quality gate.")
    static class EvalCommand extends GateCommand {
        @Option(names = "--run-id", required = true, description = "Training run to evaluate")
        String runId;

        @Option(names = "--eval-data-path", description = "Evaluation CSV; defaults to data.evalPath")
        Path evalDataPath;

        @Option(names = "--output-path-prediction", description = "Write scored rows to this CSV")
        Path predictionsPath;

        @Option(names = "--validate-thresholds", description = "Exit with code 4 when the gate fails")
        boolean validateThresholds;

        @Option(names = "--model-name", description = "Registered model holding the baseline; defaults to model.name")
        String modelName;

        @Option(names = "--baseline-version", description = "Compare against this version instead of the baseline alias")
        Integer baselineVersion;

        @Override
        int run(Services services, PrintWriter out) throws IOException {
            AppConfig config = services.config;
            Path data = dataPath(evalDataPath, config.getData().getEvalPath(), "--eval-data-path", "data.evalPath");
            String baselineModel = modelName != null && !modelName.isBlank() ? modelName : config.getModel().getName();
            if (baselineVersion != null && (baselineModel == null || baselineModel.isBlank())) {
                throw new ConfigException("--baseline-version needs --model-name (or model.name in the config)");
            }
            AppConfig.ExplainabilityConfig explainability = config.getEvaluation().getExplainability();
            EvaluationRequest request = new EvaluationRequest(
                    runId,
                    data,
                    predictionsPath,
                    services.policy(),
                    config.getModel().getArtifactPath(),
                    baselineModel == null || baselineModel.isBlank() ? null : baselineModel,
                    baselineVersion,
                    config.getEvaluation().getBaseline().getAlias(),
                    explainability.isEnabled() ? explainability.getMaxFeatures() : 0);
            ModelEvaluator evaluator = new ModelEvaluator(services.tracker, services.decisions,
                    services.registry.baselineSource());
            GateDecision decision = evaluator.evaluate(request);

            out.println(decision.passed() ? "PASSED" : "FAILED");
            decision.reasonMessages().forEach(reason -> out.println("  - " + reason));
            decision.metrics().forEach((metric, value) -> out.printf(Locale.ROOT, "  %s: %.4f%n", metric, value));
            if (decision.baseline() != null) {
                out.printf(Locale.ROOT, "  baseline: version %d %s %.4f%n", decision.baseline().baselineVersion(),
                        decision.baseline().primaryMetric(), decision.baseline().baselineValue());
            }
            out.println("decision: " + decision.decisionId());
            return validateThresholds && !decision.passed() ? EXIT_GATE_FAILED : EXIT_OK;
        }
    }

    @Command(name = "register", description = "Register a finished run as a model version.")
    static class RegisterCommand extends GateCommand {
        @Option(names = "--run-id", required = true, description = "Finished training run")
        String runId;

        @Option(names = "--model-name", description = "Registered model name; defaults to model.name")
        String modelName;

        @Option(names = "--description", description = "Version description")
        String description;

        @Option(names = "--allow-reregister", description = "Create a new version even if the run is already registered")
        boolean allowReregister;

        @Override
        int run(Services services, PrintWriter out) throws IOException {
            ModelVersion version = services.registry.register(runId, modelName(modelName, services.config),
                    description, Map.of(), allowReregister);
            out.println(version.version());
            return EXIT_OK;
        }
    }

    @Command(name = "promote",
            description = "Move an alias to a version whose run passed the gate under the current policy.")
    static class PromoteCommand extends GateCommand {
        @Option(names = "--model-name", description = "Registered model; defaults to model.name")
        String modelName;

        @Option(names = "--version", description = "Version to promote")
        Integer version;

        @Option(names = "--alias", description = "Alias to move; defaults to registry.defaultAlias")
        String alias;

        @Option(names = "--expected-version", description = "Current binding the alias must have: a version number or 'none'")
        String expectedVersion;

        @Option(names = "--override", description = "Skip the gate check; needs --override-reason")
        boolean override;

        @Option(names = "--override-reason", description = "Why the gate is bypassed")
        String overrideReason;

        @Option(names = "--clear-alias", description = "Alias to release if it binds the promoted version")
        String clearAlias;

        @Override
        int run(Services services, PrintWriter out) throws IOException {
            String name = modelName(modelName, services.config);
            int target = version(version);
            String targetAlias = alias == null || alias.isBlank() ? services.config.getRegistry().getDefaultAlias() : alias;
            PromotionRequest request = new PromotionRequest(
                    name,
                    target,
                    targetAlias,
                    ExpectedBinding.parse(expectedVersion),
                    services.policy().fingerprint(),
                    override,
                    overrideReason,
                    clearAlias,
                    actor());
            PromotionResult result = services.promotions().promote(request);
            out.println(result.outcome() + ": " + result.message());
            return result.outcome() == PromotionResult.Outcome.REJECTED ? EXIT_GATE_FAILED : EXIT_OK;
        }
    }

    @Command(name = "set-alias", description = "Bind an unbound alias to a version.")
    static class SetAliasCommand extends GateCommand {
        @Option(names = "--model-name", description = "Registered model; defaults to model.name")
        String modelName;

        @Option(names = "--version", description = "Version to bind")
        Integer version;

        @Option(names = "--alias", required = true, description = "Alias to bind")
        String alias;

        @Override
        int run(Services services, PrintWriter out) throws IOException {
            PromotionResult result = services.promotions()
                    .assign(modelName(modelName, services.config), alias, version(version), actor());
            out.println(result.outcome() + ": " + result.message());
            return EXIT_OK;
        }
    }

    @Command(name = "remove-alias", description = "Release an alias.")
    static class RemoveAliasCommand extends GateCommand {
        @Option(names = "--model-name", description = "Registered model; defaults to model.name")
        String modelName;

        @Option(names = "--alias", required = true, description = "Alias to release")
        String alias;

        @Option(names = "--expected-version", description = "Current binding the alias must have: a version number or 'none'")
        String expectedVersion;

        @Override
        int run(Services services, PrintWriter out) throws IOException {
            PromotionResult result = services.promotions().removeAlias(modelName(modelName, services.config), alias,
                    ExpectedBinding.parse(expectedVersion), actor());
            out.println(result.outcome() + ": " + result.message());
            return EXIT_OK;
        }
    }

    @Command(name = "delete-version", description = "Delete a version no alias binds.")
    static class DeleteVersionCommand extends GateCommand {
        @Option(names = "--model-name", description = "Registered model; defaults to model.name")
        String modelName;

        @Option(names = "--version", description = "Version to delete")
        Integer version;

        @Override
        int run(Services services, PrintWriter out) throws IOException {
            String name = modelName(modelName, services.config);
            int target = version(version);
            services.registry.deleteVersion(name, target);
            out.println("Deleted " + name + " version " + target);
            return EXIT_OK;
        }
    }

    @Command(name = "update-description", description = "Replace a version's description.")
    static class UpdateDescriptionCommand extends GateCommand {
        @Option(names = "--model-name", description = "Registered model; defaults to model.name")
        String modelName;

        @Option(names = "--version", description = "Version to update")
        Integer version;

        @Option(names = "--description", required = true, description = "New description")
        String description;

        @Override
        int run(Services services, PrintWriter out) throws IOException {
            ModelVersion updated = services.registry.updateDescription(modelName(modelName, services.config),
                    version(version), description);
            out.println(updated.modelName() + " version " + updated.version() + ": " + updated.description());
            return EXIT_OK;
        }
    }

    @Command(name = "list", description = "List registered models.")
    static class ListCommand extends GateCommand {
        @Override
        int run(Services services, PrintWriter out) throws IOException {
            List<RegisteredModel> models = services.registry.listModels();
            if (models.isEmpty()) {
                out.println("No registered models");
            }
            for (RegisteredModel model : models) {
                String aliases = model.getAliases().entrySet().stream()
                        .map(entry -> entry.getKey() + "=" + entry.getValue().version())
                        .collect(Collectors.joining(", ", "{", "}"));
                out.println(model.getName() + " versions=" + model.getVersions().keySet() + " aliases=" + aliases);
            }
            return EXIT_OK;
        }
    }

    @Command(name = "info", description = "Show a registered model in detail.")
    static class InfoCommand extends GateCommand {
        @Option(names = "--model-name", description = "Registered model; defaults to model.name")
        String modelName;

        @Override
        int run(Services services, PrintWriter out) throws IOException {
            RegisteredModel model = services.registry.getModel(modelName(modelName, services.config));
            String fingerprint = services.policy().fingerprint();
            out.println("Model: " + model.getName());
            out.println("Description: " + model.getDescription());
            out.println("Created: " + model.getCreatedAt());
            out.println("Updated: " + model.getUpdatedAt());
            out.println("Versions:");
            for (ModelVersion version : model.getVersions().values()) {
                List<String> aliases = model.getAliases().entrySet().stream()
                        .filter(entry -> entry.getValue().version() == version.version())
                        .map(Map.Entry::getKey)
                        .toList();
                Optional<GateDecision> decision = services.decisions.latest(version.runId(), fingerprint);
                String gate = decision.map(d -> d.passed() ? "PASSED" : "FAILED").orElse("not evaluated");
                out.printf("  %d run=%s aliases=%s gate=%s description=%s%n", version.version(), version.runId(),
                        aliases, gate, version.description());
            }
            out.println("Aliases:");
            for (Map.Entry<String, AliasBinding> entry : model.getAliases().entrySet()) {
                AliasBinding binding = entry.getValue();
                out.printf("  %s -> %d (%s by %s at %s)%n", entry.getKey(), binding.version(), binding.reason(),
                        binding.actor(), binding.boundAt());
            }
            return EXIT_OK;
        }
    }

    @Command(name = "predict", description = "Batch-score a CSV with a registered version.")
    static class PredictCommand extends GateCommand {
        @Option(names = "--model-name", description = "Registered model; defaults to model.name")
        String modelName;

        @Option(names = "--alias", description = "Score with the version this alias binds")
        String alias;

        @Option(names = "--version", description = "Score with this version")
        Integer version;

        @Option(names = "--data-path", required = true, description = "Rows to score")
        Path dataPath;

        @Option(names = "--output-path", required = true, description = "Scored CSV to write")
        Path outputPath;

        @Override
        int run(Services services, PrintWriter out) throws IOException {
            String name = modelName(modelName, services.config);
            if ((alias == null) == (version == null)) {
                throw new ConfigException("predict needs exactly one of --alias or --version");
            }
            ModelVersion selected = version != null
                    ? services.registry.getVersion(name, version)
                    : services.registry.resolveAlias(name, alias).orElseThrow(() -> new ConfigException(
                            "Alias " + alias + " of " + name + " is not bound"));
            ModelArtifact artifact = new ArtifactLoader(services.tracker)
                    .load(selected.runId(), services.config.getModel().getArtifactPath());
            TabularDataset dataset = new CsvDatasetReader().read(dataPath);
            List<String> missing = artifact.featureNames().stream().filter(f -> !dataset.hasColumn(f)).toList();
            if (!missing.isEmpty()) {
                throw new ConfigException("Data " + dataPath + " lacks feature columns " + missing);
            }
            PredictionWriter writer = new PredictionWriter();
            writer.write(outputPath, writer.render(dataset, artifact.score(dataset), artifact.labels()));
            log.info("Scored {} rows with {} version {}", dataset.size(), name, selected.version());
            out.println("Scored " + dataset.size() + " rows with " + name + " version " + selected.version()
                    + " -> " + outputPath);
            return EXIT_OK;
        }
    }
}
