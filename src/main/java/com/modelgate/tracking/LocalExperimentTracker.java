package com.modelgate.tracking;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * File-backed tracking store: one directory per run holding {@code run.json},
 * {@code metrics.jsonl} and an {@code artifacts/} tree.
 */
public class LocalExperimentTracker implements ExperimentTracker {
    private static final Logger log = LoggerFactory.getLogger(LocalExperimentTracker.class);
    private static final Pattern RUN_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final Path root;
    private final String experimentName;
    private final Clock clock;
    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();

    public LocalExperimentTracker(Path root, String experimentName) {
        this(root, experimentName, Clock.systemUTC());
    }

    public LocalExperimentTracker(Path root, String experimentName, Clock clock) {
        this.root = root;
        this.experimentName = experimentName;
        this.clock = clock;
    }

    @Override
    public synchronized String startRun(String runName, Map<String, String> tags) throws IOException {
        String runId = UUID.randomUUID().toString().replace("-", "");
        Path runDir = runDirectory(runId);
        Files.createDirectories(runDir.resolve("artifacts"));
        RunMetadata metadata = new RunMetadata(
                runId,
                runName == null || runName.isBlank() ? runId : runName,
                experimentName,
                RunStatus.RUNNING,
                clock.instant(),
                null,
                new LinkedHashMap<>(),
                tags == null ? new LinkedHashMap<>() : new LinkedHashMap<>(tags));
        writeMetadata(metadata);
        log.info("Started run {} name={} experiment={}", runId, metadata.runName(), experimentName);
        return runId;
    }

    @Override
    public synchronized void logParams(String runId, Map<String, String> params) throws IOException {
        RunMetadata metadata = requireRunning(runId);
        Map<String, String> merged = new LinkedHashMap<>(metadata.params());
        merged.putAll(params);
        writeMetadata(metadata.withParams(merged));
        log.debug("Logged {} parameters to run {}", params.size(), runId);
    }

    @Override
    public synchronized void logMetrics(String runId, List<MetricPoint> points) throws IOException {
        requireRunning(runId);
        StringBuilder lines = new StringBuilder();
        for (MetricPoint point : points) {
            lines.append(mapper.writeValueAsString(point)).append(System.lineSeparator());
        }
        Files.writeString(runDirectory(runId).resolve("metrics.jsonl"), lines.toString(),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        log.debug("Logged {} metric points to run {}", points.size(), runId);
    }

    @Override
    public synchronized void setTag(String runId, String key, String value) throws IOException {
        RunMetadata metadata = readMetadata(runId);
        Map<String, String> tags = new LinkedHashMap<>(metadata.tags());
        tags.put(key, value);
        writeMetadata(metadata.withTags(tags));
    }

    @Override
    public synchronized void logArtifact(String runId, String artifactPath, byte[] content) throws IOException {
        requireRunning(runId);
        Path target = artifactFile(runId, artifactPath);
        Files.createDirectories(target.getParent());
        Path temp = Files.createTempFile(target.getParent(), ".artifact", ".tmp");
        Files.write(temp, content);
        moveAtomically(temp, target);
        log.debug("Logged artifact {} ({} bytes) to run {}", artifactPath, content.length, runId);
    }

    @Override
    public boolean hasArtifact(String runId, String artifactPath) throws IOException {
        readMetadata(runId);
        return Files.isRegularFile(artifactFile(runId, artifactPath));
    }

    @Override
    public Optional<byte[]> readArtifact(String runId, String artifactPath) throws IOException {
        readMetadata(runId);
        Path file = artifactFile(runId, artifactPath);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(Files.readAllBytes(file));
    }

    @Override
    public synchronized void finishRun(String runId, RunStatus status) throws IOException {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Run must finish with a terminal status, got " + status);
        }
        RunMetadata metadata = requireRunning(runId);
        if (status == RunStatus.FAILED) {
            discardArtifacts(runId);
        }
        writeMetadata(metadata.finish(status, clock.instant()));
        log.info("Finished run {} status={}", runId, status);
    }

    @Override
    public TrackedRun getRun(String runId) throws IOException {
        RunMetadata metadata = readMetadata(runId);
        return new TrackedRun(
                metadata.runId(),
                metadata.runName(),
                metadata.experimentName(),
                metadata.status(),
                metadata.startTime(),
                metadata.endTime(),
                metadata.params(),
                latestMetrics(runId),
                metadata.tags(),
                listArtifacts(runId));
    }

    /** Full per-step history, in the order it was logged. */
    public List<MetricPoint> metricHistory(String runId) throws IOException {
        readMetadata(runId);
        Path metricsFile = runDirectory(runId).resolve("metrics.jsonl");
        if (!Files.exists(metricsFile)) {
            return List.of();
        }
        try (Stream<String> lines = Files.lines(metricsFile)) {
            return lines.filter(line -> !line.isBlank())
                    .map(this::parsePoint)
                    .toList();
        }
    }

    private Map<String, Double> latestMetrics(String runId) throws IOException {
        Map<String, Double> latest = new LinkedHashMap<>();
        for (MetricPoint point : metricHistory(runId)) {
            latest.put(point.key(), point.value());
        }
        return latest;
    }

    private MetricPoint parsePoint(String line) {
        try {
            return mapper.readValue(line, MetricPoint.class);
        } catch (IOException e) {
            throw new TrackingException("Corrupt metric history line: " + line, e);
        }
    }

    private List<String> listArtifacts(String runId) throws IOException {
        Path artifactsDir = runDirectory(runId).resolve("artifacts");
        if (!Files.isDirectory(artifactsDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.walk(artifactsDir)) {
            return files.filter(Files::isRegularFile)
                    .filter(file -> !file.getFileName().toString().endsWith(".tmp"))
                    .map(file -> artifactsDir.relativize(file).toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        }
    }

    private void discardArtifacts(String runId) throws IOException {
        Path artifactsDir = runDirectory(runId).resolve("artifacts");
        if (!Files.exists(artifactsDir)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(artifactsDir)) {
            paths = walk.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
        log.info("Discarded partial artifacts of failed run {}", runId);
    }

    private RunMetadata requireRunning(String runId) throws IOException {
        RunMetadata metadata = readMetadata(runId);
        if (metadata.status() != RunStatus.RUNNING) {
            throw new TrackingException("Run " + runId + " is already " + metadata.status());
        }
        return metadata;
    }

    private RunMetadata readMetadata(String runId) throws IOException {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new RunNotFoundException(runId);
        }
        Path metadataFile = runDirectory(runId).resolve("run.json");
        if (!Files.isRegularFile(metadataFile)) {
            throw new RunNotFoundException(runId);
        }
        return mapper.readValue(metadataFile.toFile(), RunMetadata.class);
    }

    private void writeMetadata(RunMetadata metadata) throws IOException {
        Path runDir = runDirectory(metadata.runId());
        Files.createDirectories(runDir);
        Path temp = Files.createTempFile(runDir, ".run", ".tmp");
        mapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), metadata);
        moveAtomically(temp, runDir.resolve("run.json"));
    }

    private Path runDirectory(String runId) {
        return root.resolve("runs").resolve(runId);
    }

    private Path artifactFile(String runId, String artifactPath) {
        Path artifactsDir = runDirectory(runId).resolve("artifacts").normalize();
        Path file = artifactsDir.resolve(artifactPath).normalize();
        if (!file.startsWith(artifactsDir) || file.equals(artifactsDir)) {
            throw new IllegalArgumentException("Artifact path escapes the run directory: " + artifactPath);
        }
        return file;
    }

    private static void moveAtomically(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    record RunMetadata(
            String runId,
            String runName,
            String experimentName,
            RunStatus status,
            Instant startTime,
            Instant endTime,
            Map<String, String> params,
            Map<String, String> tags) {
        RunMetadata {
            params = params == null ? new LinkedHashMap<>() : params;
            tags = tags == null ? new LinkedHashMap<>() : tags;
        }

        RunMetadata withParams(Map<String, String> updated) {
            return new RunMetadata(runId, runName, experimentName, status, startTime, endTime, updated, tags);
        }

        RunMetadata withTags(Map<String, String> updated) {
            return new RunMetadata(runId, runName, experimentName, status, startTime, endTime, params, updated);
        }

        RunMetadata finish(RunStatus finalStatus, Instant finishedAt) {
            return new RunMetadata(runId, runName, experimentName, finalStatus, startTime, finishedAt, params, tags);
        }
    }
}
