package com.modelgate.tracking;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalExperimentTrackerTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2026-02-10T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void shouldRecordRunLifecycle() throws Exception {
        LocalExperimentTracker tracker = new LocalExperimentTracker(tempDir, "churn", clock);

        String runId = tracker.startRun("train-gbtree", Map.of("task", "training"));
        tracker.logParams(runId, Map.of("booster", "gbtree"));
        tracker.logParams(runId, Map.of("seed", "42"));
        tracker.logMetrics(runId, List.of(
                new MetricPoint("validation-logloss", 0.6, 0, 1L),
                new MetricPoint("validation-logloss", 0.4, 1, 2L)));
        tracker.logMetrics(runId, Map.of("validation_accuracy", 0.95));
        tracker.setTag(runId, "validation_passed", "true");
        tracker.logArtifact(runId, "model/model.json", "{}".getBytes(StandardCharsets.UTF_8));
        tracker.finishRun(runId, RunStatus.FINISHED);

        TrackedRun run = tracker.getRun(runId);
        assertEquals("train-gbtree", run.runName());
        assertEquals("churn", run.experimentName());
        assertEquals(RunStatus.FINISHED, run.status());
        assertEquals(Instant.parse("2026-02-10T12:00:00Z"), run.endTime());
        assertEquals(Map.of("booster", "gbtree", "seed", "42"), run.params());
        assertEquals(0.4, run.metrics().get("validation-logloss"));
        assertEquals(0.95, run.metrics().get("validation_accuracy"));
        assertEquals("true", run.tags().get("validation_passed"));
        assertEquals(List.of("model/model.json"), run.artifacts());
        assertTrue(tracker.hasArtifact(runId, "model/model.json"));
        assertArrayEquals("{}".getBytes(StandardCharsets.UTF_8), tracker.readArtifact(runId, "model/model.json").get());
        assertEquals(3, tracker.metricHistory(runId).size());
        assertEquals(1L, tracker.metricHistory(runId).get(1).step());
    }

    @Test
    void shouldRejectWritesToClosedRun() throws Exception {
        LocalExperimentTracker tracker = new LocalExperimentTracker(tempDir, "churn", clock);
        String runId = tracker.startRun("closed", Map.of());
        tracker.finishRun(runId, RunStatus.FINISHED);

        assertThrows(TrackingException.class, () -> tracker.logParams(runId, Map.of("late", "1")));
        assertThrows(TrackingException.class, () -> tracker.logArtifact(runId, "model/model.json", new byte[0]));
    }

    @Test
    void shouldNotReopenFinishedRun() throws Exception {
        LocalExperimentTracker tracker = new LocalExperimentTracker(tempDir, "churn", clock);
        String runId = tracker.startRun("done", Map.of());
        tracker.logArtifact(runId, "model/model.json", new byte[] { 1 });
        tracker.finishRun(runId, RunStatus.FINISHED);

        assertThrows(TrackingException.class, () -> tracker.finishRun(runId, RunStatus.FAILED));
        assertThrows(TrackingException.class, () -> tracker.finishRun(runId, RunStatus.FINISHED));

        TrackedRun run = tracker.getRun(runId);
        assertEquals(RunStatus.FINISHED, run.status());
        assertEquals(List.of("model/model.json"), run.artifacts());
    }

    @Test
    void shouldDiscardArtifactsOfFailedRun() throws Exception {
        LocalExperimentTracker tracker = new LocalExperimentTracker(tempDir, "churn", clock);
        String runId = tracker.startRun("failing", Map.of());
        tracker.logArtifact(runId, "model/model.json", new byte[] { 1 });
        tracker.logMetrics(runId, Map.of("train-logloss", 0.7));

        tracker.finishRun(runId, RunStatus.FAILED);

        TrackedRun run = tracker.getRun(runId);
        assertEquals(RunStatus.FAILED, run.status());
        assertTrue(run.artifacts().isEmpty());
        assertFalse(tracker.hasArtifact(runId, "model/model.json"));
        assertTrue(tracker.readArtifact(runId, "model/model.json").isEmpty());
        assertEquals(0.7, run.metrics().get("train-logloss"));
    }

    @Test
    void shouldReportUnknownRuns() throws Exception {
        LocalExperimentTracker tracker = new LocalExperimentTracker(tempDir, "churn", clock);

        RunNotFoundException missing = assertThrows(RunNotFoundException.class, () -> tracker.getRun("abc123"));
        assertEquals("abc123", missing.runId());
        assertThrows(RunNotFoundException.class, () -> tracker.getRun("../outside"));
        assertThrows(RunNotFoundException.class, () -> tracker.getRun(null));
    }

    @Test
    void shouldKeepArtifactsInsideRunDirectory() throws Exception {
        LocalExperimentTracker tracker = new LocalExperimentTracker(tempDir, "churn", clock);
        String runId = tracker.startRun("escape", Map.of());

        assertThrows(IllegalArgumentException.class,
                () -> tracker.logArtifact(runId, "../../secrets.txt", new byte[] { 1 }));
        assertFalse(Files.exists(tempDir.resolve("secrets.txt")));
    }

    @Test
    void shouldRequireTerminalStatusToFinish() throws Exception {
        LocalExperimentTracker tracker = new LocalExperimentTracker(tempDir, "churn", clock);
        String runId = tracker.startRun(null, null);

        assertThrows(IllegalArgumentException.class, () -> tracker.finishRun(runId, RunStatus.RUNNING));
        assertEquals(runId, tracker.getRun(runId).runName());
        assertEquals(RunStatus.RUNNING, tracker.getRun(runId).status());
    }
}
