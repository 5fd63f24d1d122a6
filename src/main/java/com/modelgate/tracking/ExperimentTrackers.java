package com.modelgate.tracking;

import java.net.URI;
import java.nio.file.Path;
import java.util.Map;

import com.modelgate.runtime.AppConfig;
import com.modelgate.runtime.ConfigException;

import okhttp3.OkHttpClient;

public final class ExperimentTrackers {
    static final String TOKEN_VARIABLE = "MLFLOW_TRACKING_TOKEN";

    private ExperimentTrackers() {
    }

    public static ExperimentTracker fromConfig(AppConfig.TrackingConfig tracking, OkHttpClient httpClient) {
        return fromConfig(tracking, httpClient, System.getenv());
    }

    static ExperimentTracker fromConfig(AppConfig.TrackingConfig tracking, OkHttpClient httpClient,
            Map<String, String> environment) {
        String uri = tracking.getUri();
        if (uri == null || uri.isBlank()) {
            throw new ConfigException("tracking.uri is required");
        }
        String lower = uri.toLowerCase();
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return new MlflowExperimentTracker(httpClient, uri, tracking.getExperimentName(),
                    environment.get(TOKEN_VARIABLE));
        }
        return new LocalExperimentTracker(localRoot(uri), tracking.getExperimentName());
    }

    static Path localRoot(String uri) {
        if (uri.startsWith("file://")) {
            return Path.of(URI.create(uri));
        }
        if (uri.startsWith("file:")) {
            return Path.of(uri.substring("file:".length()));
        }
        if (uri.matches("^[a-zA-Z][a-zA-Z0-9+.-]+://.*")) {
            throw new ConfigException("Unsupported tracking URI scheme: " + uri);
        }
        return Path.of(uri);
    }
}
