package com.modelgate.tracking;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Tracker backed by a remote MLflow tracking server through its REST 2.0 API. Artifacts go
 * through the server's {@code mlflow-artifacts} proxy.
 */
public class MlflowExperimentTracker implements ExperimentTracker {
    private static final Logger log = LoggerFactory.getLogger(MlflowExperimentTracker.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final MediaType OCTET_STREAM = MediaType.parse("application/octet-stream");
    private static final String PROXY_SCHEME = "mlflow-artifacts:/";
    private static final int MAX_METRICS_PER_BATCH = 1000;
    private static final int MAX_PARAMS_PER_BATCH = 100;

    private final OkHttpClient httpClient;
    private final HttpUrl baseUrl;
    private final String experimentName;
    private final String token;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, String> artifactRoots = new ConcurrentHashMap<>();
    private volatile String experimentId;

    public MlflowExperimentTracker(OkHttpClient httpClient, String trackingUri, String experimentName, String token) {
        this(httpClient, trackingUri, experimentName, token, Clock.systemUTC());
    }

    MlflowExperimentTracker(OkHttpClient httpClient, String trackingUri, String experimentName, String token,
            Clock clock) {
        HttpUrl parsed = HttpUrl.parse(trackingUri);
        if (parsed == null) {
            throw new IllegalArgumentException("Not an http(s) tracking URI: " + trackingUri);
        }
        this.httpClient = httpClient;
        this.baseUrl = parsed;
        this.experimentName = experimentName;
        this.token = token;
        this.clock = clock;
    }

    @Override
    public String startRun(String runName, Map<String, String> tags) throws IOException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("experiment_id", resolveExperimentId());
        payload.put("start_time", clock.millis());
        if (runName != null && !runName.isBlank()) {
            payload.put("run_name", runName);
        }
        payload.set("tags", keyValues(tags == null ? Map.of() : tags));
        JsonNode info = post("mlflow/runs/create", payload, null).path("run").path("info");
        String runId = info.path("run_id").asText(null);
        if (runId == null) {
            throw new TrackingException("MLflow runs/create answered without a run id");
        }
        artifactRoots.put(runId, info.path("artifact_uri").asText(""));
        log.info("Started MLflow run {} in experiment {}", runId, experimentName);
        return runId;
    }

    @Override
    public void logParams(String runId, Map<String, String> params) throws IOException {
        List<Map.Entry<String, String>> entries = new ArrayList<>(params.entrySet());
        for (int from = 0; from < entries.size(); from += MAX_PARAMS_PER_BATCH) {
            Map<String, String> chunk = new LinkedHashMap<>();
            for (Map.Entry<String, String> entry : entries.subList(from,
                    Math.min(entries.size(), from + MAX_PARAMS_PER_BATCH))) {
                chunk.put(entry.getKey(), entry.getValue());
            }
            ObjectNode payload = mapper.createObjectNode();
            payload.put("run_id", runId);
            payload.set("params", keyValues(chunk));
            post("mlflow/runs/log-batch", payload, runId);
        }
    }

    @Override
    public void logMetrics(String runId, List<MetricPoint> points) throws IOException {
        for (int from = 0; from < points.size(); from += MAX_METRICS_PER_BATCH) {
            ArrayNode metrics = mapper.createArrayNode();
            for (MetricPoint point : points.subList(from, Math.min(points.size(), from + MAX_METRICS_PER_BATCH))) {
                metrics.addObject()
                        .put("key", point.key())
                        .put("value", point.value())
                        .put("timestamp", point.timestampMs())
                        .put("step", point.step());
            }
            ObjectNode payload = mapper.createObjectNode();
            payload.put("run_id", runId);
            payload.set("metrics", metrics);
            post("mlflow/runs/log-batch", payload, runId);
        }
    }

    @Override
    public void setTag(String runId, String key, String value) throws IOException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("run_id", runId);
        payload.put("key", key);
        payload.put("value", value);
        post("mlflow/runs/set-tag", payload, runId);
    }

    @Override
    public void logArtifact(String runId, String artifactPath, byte[] content) throws IOException {
        Request request = authorized(new Request.Builder()
                .url(proxyUrl(runId, artifactPath))
                .put(RequestBody.create(content, OCTET_STREAM)))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            requireSuccess(response, "artifact upload", runId);
        }
        log.debug("Uploaded artifact {} ({} bytes) to MLflow run {}", artifactPath, content.length, runId);
    }

    @Override
    public boolean hasArtifact(String runId, String artifactPath) throws IOException {
        int slash = artifactPath.lastIndexOf('/');
        String parent = slash < 0 ? "" : artifactPath.substring(0, slash);
        for (JsonNode file : listFiles(runId, parent)) {
            if (artifactPath.equals(file.path("path").asText()) && !file.path("is_dir").asBoolean(false)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Optional<byte[]> readArtifact(String runId, String artifactPath) throws IOException {
        Request request = authorized(new Request.Builder().url(proxyUrl(runId, artifactPath)).get()).build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 404) {
                return Optional.empty();
            }
            requireSuccess(response, "artifact download", runId);
            ResponseBody body = response.body();
            return Optional.of(body == null ? new byte[0] : body.bytes());
        }
    }

    @Override
    public void finishRun(String runId, RunStatus status) throws IOException {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Run must finish with a terminal status, got " + status);
        }
        if (status == RunStatus.FAILED) {
            discardArtifacts(runId);
        }
        ObjectNode payload = mapper.createObjectNode();
        payload.put("run_id", runId);
        payload.put("status", status.name());
        payload.put("end_time", clock.millis());
        post("mlflow/runs/update", payload, runId);
        log.info("Finished MLflow run {} status={}", runId, status);
    }

    @Override
    public TrackedRun getRun(String runId) throws IOException {
        HttpUrl url = apiUrl("mlflow/runs/get").newBuilder().addQueryParameter("run_id", runId).build();
        JsonNode run = get(url, runId).path("run");
        JsonNode info = run.path("info");
        JsonNode data = run.path("data");
        artifactRoots.put(runId, info.path("artifact_uri").asText(""));

        Map<String, Double> metrics = new LinkedHashMap<>();
        for (JsonNode metric : data.path("metrics")) {
            metrics.put(metric.path("key").asText(), metric.path("value").asDouble());
        }
        List<String> artifacts = new ArrayList<>();
        collectArtifacts(runId, "", artifacts);
        return new TrackedRun(
                info.path("run_id").asText(runId),
                info.path("run_name").asText(runId),
                experimentName,
                mapStatus(info.path("status").asText("RUNNING")),
                toInstant(info.path("start_time")),
                toInstant(info.path("end_time")),
                toMap(data.path("params")),
                metrics,
                toMap(data.path("tags")),
                artifacts);
    }

    private String resolveExperimentId() throws IOException {
        String cached = experimentId;
        if (cached != null) {
            return cached;
        }
        HttpUrl lookup = apiUrl("mlflow/experiments/get-by-name").newBuilder()
                .addQueryParameter("experiment_name", experimentName)
                .build();
        try (Response response = httpClient.newCall(authorized(new Request.Builder().url(lookup).get()).build())
                .execute()) {
            String body = bodyText(response);
            if (response.isSuccessful()) {
                cached = mapper.readTree(body).path("experiment").path("experiment_id").asText(null);
            } else if (!"RESOURCE_DOES_NOT_EXIST".equals(errorCode(body))) {
                throw new TrackingException("MLflow experiments/get-by-name failed: HTTP " + response.code()
                        + " " + body);
            }
        }
        if (cached == null) {
            ObjectNode payload = mapper.createObjectNode();
            payload.put("name", experimentName);
            cached = post("mlflow/experiments/create", payload, null).path("experiment_id").asText(null);
            log.info("Created MLflow experiment {} id={}", experimentName, cached);
        }
        if (cached == null) {
            throw new TrackingException("MLflow did not return an id for experiment " + experimentName);
        }
        experimentId = cached;
        return cached;
    }

    private void collectArtifacts(String runId, String path, List<String> into) throws IOException {
        for (JsonNode file : listFiles(runId, path)) {
            String filePath = file.path("path").asText();
            if (file.path("is_dir").asBoolean(false)) {
                collectArtifacts(runId, filePath, into);
            } else {
                into.add(filePath);
            }
        }
    }

    private JsonNode listFiles(String runId, String path) throws IOException {
        HttpUrl.Builder url = apiUrl("mlflow/artifacts/list").newBuilder().addQueryParameter("run_id", runId);
        if (!path.isEmpty()) {
            url.addQueryParameter("path", path);
        }
        return get(url.build(), runId).path("files");
    }

    private void discardArtifacts(String runId) throws IOException {
        for (JsonNode file : listFiles(runId, "")) {
            String path = file.path("path").asText();
            Request request = authorized(new Request.Builder().url(proxyUrl(runId, path)).delete()).build();
            try (Response response = httpClient.newCall(request).execute()) {
                requireSuccess(response, "artifact delete", runId);
            }
        }
        log.info("Discarded partial artifacts of failed MLflow run {}", runId);
    }

    private HttpUrl proxyUrl(String runId, String artifactPath) throws IOException {
        String root = artifactRoots.get(runId);
        if (root == null || root.isEmpty()) {
            getRun(runId);
            root = artifactRoots.getOrDefault(runId, "");
        }
        if (!root.startsWith(PROXY_SCHEME)) {
            throw new TrackingException("Run " + runId + " stores artifacts at " + root
                    + "; only the mlflow-artifacts proxy is supported");
        }
        String relativeRoot = root.substring(PROXY_SCHEME.length()).replaceAll("^/+", "");
        HttpUrl.Builder url = baseUrl.newBuilder().addPathSegments("api/2.0/mlflow-artifacts/artifacts");
        if (!relativeRoot.isEmpty()) {
            url.addPathSegments(relativeRoot);
        }
        return url.addPathSegments(artifactPath).build();
    }

    private JsonNode post(String endpoint, JsonNode payload, String runId) throws IOException {
        Request request = authorized(new Request.Builder()
                .url(apiUrl(endpoint))
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON)))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            return readJson(response, endpoint, runId);
        }
    }

    private JsonNode get(HttpUrl url, String runId) throws IOException {
        try (Response response = httpClient.newCall(authorized(new Request.Builder().url(url).get()).build())
                .execute()) {
            return readJson(response, url.encodedPath(), runId);
        }
    }

    private JsonNode readJson(Response response, String endpoint, String runId) throws IOException {
        requireSuccess(response, endpoint, runId);
        String body = bodyText(response);
        return body.isBlank() ? mapper.createObjectNode() : mapper.readTree(body);
    }

    private void requireSuccess(Response response, String operation, String runId) throws IOException {
        if (response.isSuccessful()) {
            return;
        }
        String body = bodyText(response);
        if (runId != null && "RESOURCE_DOES_NOT_EXIST".equals(errorCode(body))) {
            throw new RunNotFoundException(runId);
        }
        throw new TrackingException("MLflow " + operation + " failed: HTTP " + response.code() + " " + body);
    }

    private String errorCode(String body) {
        try {
            return mapper.readTree(body).path("error_code").asText(null);
        } catch (IOException e) {
            log.debug("MLflow error body is not JSON: {}", body);
            return null;
        }
    }

    private static String bodyText(Response response) throws IOException {
        ResponseBody body = response.body();
        return body == null ? "" : body.string();
    }

    private HttpUrl apiUrl(String endpoint) {
        return baseUrl.newBuilder().addPathSegments("api/2.0/" + endpoint).build();
    }

    private Request.Builder authorized(Request.Builder builder) {
        if (token != null && !token.isBlank()) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private ArrayNode keyValues(Map<String, String> values) {
        ArrayNode array = mapper.createArrayNode();
        values.forEach((key, value) -> array.addObject().put("key", key).put("value", value));
        return array;
    }

    private static Map<String, String> toMap(JsonNode keyValues) {
        Map<String, String> out = new LinkedHashMap<>();
        for (JsonNode entry : keyValues) {
            out.put(entry.path("key").asText(), entry.path("value").asText());
        }
        return out;
    }

    private static Instant toInstant(JsonNode millis) {
        return millis.isNumber() || millis.isTextual() && !millis.asText().isBlank()
                ? Instant.ofEpochMilli(millis.asLong())
                : null;
    }

    static RunStatus mapStatus(String mlflowStatus) {
        return switch (mlflowStatus) {
            case "FINISHED" -> RunStatus.FINISHED;
            case "FAILED", "KILLED" -> RunStatus.FAILED;
            default -> RunStatus.RUNNING;
        };
    }
}
