package com.modelgate.versioning;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.modelgate.governance.BaselineSource;
import com.modelgate.runtime.ConfigException;
import com.modelgate.tracking.LocalExperimentTracker;
import com.modelgate.tracking.RunNotFoundException;
import com.modelgate.tracking.RunStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelRegistryTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2026-02-10T12:00:00Z"), ZoneOffset.UTC);
    private LocalExperimentTracker tracker;
    private FileRegistryStore store;
    private ModelRegistry registry;

    @BeforeEach
    void setUp() {
        tracker = new LocalExperimentTracker(tempDir.resolve("mlruns"), "churn", clock);
        store = new FileRegistryStore(tempDir.resolve("registry.json"));
        registry = new ModelRegistry(store, tracker, "model", clock);
    }

    @Test
    void shouldAssignIncreasingVersionsPerModel() throws Exception {
        String first = trainedRun();
        String second = trainedRun();

        ModelVersion v1 = registry.register(first, "churn_model", "baseline", Map.of("team", "retention"), false);
        ModelVersion v2 = registry.register(second, "churn_model", null, null, false);
        ModelVersion other = registry.register(second, "upsell_model", null, null, false);

        assertEquals(1, v1.version());
        assertEquals(2, v2.version());
        assertEquals(1, other.version());
        assertEquals("runs:/" + first + "/model", v1.source());
        assertEquals(Map.of("team", "retention", "source_run", first), v1.tags());
        assertEquals("baseline", v1.description());
        assertEquals("", v2.description());
        assertEquals(List.of(1, 2), registry.listVersions("churn_model").stream().map(ModelVersion::version).toList());
        assertEquals(List.of("churn_model", "upsell_model"),
                registry.listModels().stream().map(RegisteredModel::getName).toList());
    }

    @Test
    void shouldReturnExistingVersionWhenRunIsRegisteredAgain() throws Exception {
        String runId = trainedRun();
        registry.register(runId, "churn_model", null, null, false);

        ModelVersion again = registry.register(runId, "churn_model", "ignored", null, false);
        ModelVersion forced = registry.register(runId, "churn_model", null, null, true);

        assertEquals(1, again.version());
        assertEquals(2, forced.version());
        assertEquals(runId, forced.runId());
    }

    @Test
    void shouldRefuseRunsWithoutUsableArtifact() throws Exception {
        String failed = tracker.startRun("failed", Map.of());
        tracker.logArtifact(failed, "model/model.json", new byte[] { 1 });
        tracker.finishRun(failed, RunStatus.FAILED);
        String running = tracker.startRun("running", Map.of());
        String empty = tracker.startRun("empty", Map.of());
        tracker.finishRun(empty, RunStatus.FINISHED);

        assertThrows(ArtifactMissingException.class, () -> registry.register(failed, "churn_model", null, null, false));
        assertThrows(ArtifactMissingException.class, () -> registry.register(running, "churn_model", null, null, false));
        assertThrows(ArtifactMissingException.class, () -> registry.register(empty, "churn_model", null, null, false));
        assertThrows(RunNotFoundException.class, () -> registry.register("nope", "churn_model", null, null, false));
        assertThrows(ConfigException.class, () -> registry.register(empty, " ", null, null, false));
        assertTrue(registry.listModels().isEmpty());
    }

    @Test
    void shouldProtectAliasedVersionsFromDeletion() throws Exception {
        registry.register(trainedRun(), "churn_model", null, null, false);
        registry.register(trainedRun(), "churn_model", null, null, false);
        bindAlias("churn_model", "champion", 1);

        VersionInUseException inUse = assertThrows(VersionInUseException.class,
                () -> registry.deleteVersion("churn_model", 1));
        assertTrue(inUse.getMessage().contains("champion"));

        registry.deleteVersion("churn_model", 2);
        ModelVersion third = registry.register(trainedRun(), "churn_model", null, null, false);

        assertEquals(3, third.version());
        assertEquals(List.of(1, 3), registry.listVersions("churn_model").stream().map(ModelVersion::version).toList());
        assertThrows(VersionNotFoundException.class, () -> registry.getVersion("churn_model", 2));

        AliasPromotionService promotions = new AliasPromotionService(store,
                new PromotionAuditLog(tempDir.resolve("alias-audit.jsonl")), clock);
        promotions.removeAlias("churn_model", "champion", ExpectedBinding.version(1), "tester");
        registry.deleteVersion("churn_model", 1);

        assertEquals(List.of(3), registry.listVersions("churn_model").stream().map(ModelVersion::version).toList());
        assertThrows(VersionNotFoundException.class, () -> registry.getVersion("churn_model", 1));
    }

    @Test
    void shouldUpdateDescriptionOnly() throws Exception {
        ModelVersion original = registry.register(trainedRun(), "churn_model", "first cut", null, false);

        ModelVersion updated = registry.updateDescription("churn_model", 1, "retrained on Q3 data");

        assertEquals("retrained on Q3 data", registry.getVersion("churn_model", 1).description());
        assertEquals(original.runId(), updated.runId());
        assertEquals(original.source(), updated.source());
        assertThrows(VersionNotFoundException.class, () -> registry.updateDescription("churn_model", 9, "x"));
    }

    @Test
    void shouldReportUnknownModels() throws Exception {
        assertThrows(ModelNotFoundException.class, () -> registry.getModel("ghost"));
        assertTrue(registry.listVersions("ghost").isEmpty());
        assertTrue(registry.resolveAlias("ghost", "champion").isEmpty());
    }

    @Test
    void shouldResolveBaselinesByVersionOrAlias() throws Exception {
        String first = trainedRun();
        String second = trainedRun();
        registry.register(first, "churn_model", null, null, false);
        registry.register(second, "churn_model", null, null, false);
        BaselineSource baselines = registry.baselineSource();

        assertTrue(baselines.resolve("churn_model", null, "champion").isEmpty());
        bindAlias("churn_model", "champion", 1);

        assertEquals(Optional.of(new BaselineSource.BaselineReference("churn_model", 1, first)),
                baselines.resolve("churn_model", null, "champion"));
        assertEquals(Optional.of(new BaselineSource.BaselineReference("churn_model", 2, second)),
                baselines.resolve("churn_model", 2, "champion"));
        assertTrue(baselines.resolve("churn_model", null, null).isEmpty());
        assertThrows(VersionNotFoundException.class, () -> baselines.resolve("churn_model", 7, null));
    }

    private String trainedRun() throws IOException {
        String runId = tracker.startRun("train", Map.of());
        tracker.logArtifact(runId, "model/model.json", "{}".getBytes(StandardCharsets.UTF_8));
        tracker.finishRun(runId, RunStatus.FINISHED);
        return runId;
    }

    private void bindAlias(String modelName, String alias, int version) throws IOException {
        store.transact(state -> state.requireModel(modelName).getAliases()
                .put(alias, new AliasBinding(version, clock.instant(), "tester", AuditReason.INITIAL_ASSIGNMENT, null)));
    }
}
