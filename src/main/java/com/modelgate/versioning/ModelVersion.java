package com.modelgate.versioning;

import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable registration of one run's model under a name. Only the description may change.
 */
public record ModelVersion(
        String modelName,
        int version,
        String runId,
        String source,
        String description,
        Map<String, String> tags,
        Instant createdAt,
        Instant updatedAt) {
    public ModelVersion {
        tags = tags == null ? Map.of() : Map.copyOf(new TreeMap<>(tags));
        description = description == null ? "" : description;
    }

    public ModelVersion withDescription(String updated, Instant at) {
        return new ModelVersion(modelName, version, runId, source, updated, tags, createdAt, at);
    }
}
