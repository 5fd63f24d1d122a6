package com.modelgate.versioning;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelgate.governance.BaselineSource;
import com.modelgate.pipeline.ModelArtifact;
import com.modelgate.runtime.ConfigException;
import com.modelgate.tracking.ExperimentTracker;
import com.modelgate.tracking.TrackedRun;

/**
 * Names trained runs as numbered model versions. Version numbers per model only grow.
 */
public class ModelRegistry {
    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);
    static final String SOURCE_RUN_TAG = "source_run";

    private final RegistryStore store;
    private final ExperimentTracker tracker;
    private final String artifactPath;
    private final Clock clock;

    public ModelRegistry(RegistryStore store, ExperimentTracker tracker, String artifactPath) {
        this(store, tracker, artifactPath, Clock.systemUTC());
    }

    ModelRegistry(RegistryStore store, ExperimentTracker tracker, String artifactPath, Clock clock) {
        this.store = store;
        this.tracker = tracker;
        this.artifactPath = artifactPath;
        this.clock = clock;
    }

    /**
     * Registers the run's model artifact. Registering a run that is already a version of this
     * model returns that version unless {@code allowReregister} asks for a new one.
     */
    public ModelVersion register(String runId, String modelName, String description, Map<String, String> tags,
            boolean allowReregister) throws IOException {
        requireName(modelName);
        TrackedRun run = tracker.getRun(runId);
        if (!run.isFinished()) {
            throw new ArtifactMissingException("Run " + runId + " is " + run.status() + "; only finished runs can be registered");
        }
        String location = ModelArtifact.location(artifactPath);
        if (!tracker.hasArtifact(runId, location)) {
            throw new ArtifactMissingException("Run " + runId + " has no model artifact at " + location);
        }

        Map<String, String> versionTags = new LinkedHashMap<>(tags == null ? Map.of() : tags);
        versionTags.put(SOURCE_RUN_TAG, runId);
        String source = tracker.artifactUri(runId, artifactPath);
        Instant now = clock.instant();

        return store.transact(state -> {
            RegisteredModel model = state.getModels().computeIfAbsent(modelName, name -> {
                log.info("Creating registered model {}", name);
                return new RegisteredModel(name, now);
            });
            Optional<ModelVersion> existing = model.findByRun(runId);
            if (existing.isPresent() && !allowReregister) {
                log.info("Run {} is already version {} of {}; not registering again", runId,
                        existing.get().version(), modelName);
                return existing.get();
            }
            int number = model.allocateVersion();
            ModelVersion version = new ModelVersion(modelName, number, runId, source, description, versionTags, now, now);
            model.getVersions().put(number, version);
            model.setUpdatedAt(now);
            log.info("Registered run {} as {} version {}", runId, modelName, number);
            return version;
        });
    }

    public List<RegisteredModel> listModels() throws IOException {
        return new ArrayList<>(store.snapshot().getModels().values());
    }

    /** Versions in ascending order; empty for an unknown model. */
    public List<ModelVersion> listVersions(String modelName) throws IOException {
        return store.snapshot().findModel(modelName)
                .map(model -> List.copyOf(model.getVersions().values()))
                .orElse(List.of());
    }

    public RegisteredModel getModel(String modelName) throws IOException {
        return store.snapshot().requireModel(modelName);
    }

    public ModelVersion getVersion(String modelName, int version) throws IOException {
        return store.snapshot().requireModel(modelName).requireVersion(version);
    }

    public ModelVersion updateDescription(String modelName, int version, String description) throws IOException {
        Instant now = clock.instant();
        return store.transact(state -> {
            RegisteredModel model = state.requireModel(modelName);
            ModelVersion updated = model.requireVersion(version).withDescription(description, now);
            model.getVersions().put(version, updated);
            model.setUpdatedAt(now);
            return updated;
        });
    }

    public void deleteVersion(String modelName, int version) throws IOException {
        Instant now = clock.instant();
        store.transact(state -> {
            RegisteredModel model = state.requireModel(modelName);
            model.requireVersion(version);
            List<String> aliases = model.aliasesOf(version);
            if (!aliases.isEmpty()) {
                throw new VersionInUseException("Version " + version + " of " + modelName + " is bound by aliases "
                        + aliases + "; reassign or remove them first");
            }
            model.getVersions().remove(version);
            model.setUpdatedAt(now);
            return null;
        });
        log.info("Deleted {} version {}", modelName, version);
    }

    public Optional<ModelVersion> resolveAlias(String modelName, String alias) throws IOException {
        RegistryState state = store.snapshot();
        return state.findModel(modelName).flatMap(model -> {
            AliasBinding binding = model.getAliases().get(alias);
            return binding == null ? Optional.empty() : model.findVersion(binding.version());
        });
    }

    /** Baselines for evaluation: an explicit version, else whatever the alias currently binds. */
    public BaselineSource baselineSource() {
        return (modelName, version, alias) -> {
            ModelVersion baseline;
            if (version != null) {
                baseline = getVersion(modelName, version);
            } else if (alias != null && !alias.isBlank()) {
                Optional<ModelVersion> bound = resolveAlias(modelName, alias);
                if (bound.isEmpty()) {
                    return Optional.empty();
                }
                baseline = bound.get();
            } else {
                return Optional.empty();
            }
            return Optional.of(new BaselineSource.BaselineReference(modelName, baseline.version(), baseline.runId()));
        };
    }

    static void requireName(String modelName) {
        if (modelName == null || modelName.isBlank()) {
            throw new ConfigException("A model name is required");
        }
    }
}
