package com.modelgate.versioning;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Registry entry for one model name: its versions, alias bindings and the counter that hands out
 * version numbers. The counter never goes backwards, so deleted numbers are not reused.
 */
public class RegisteredModel {
    private String name;
    private String description = "";
    private Instant createdAt;
    private Instant updatedAt;
    private int nextVersion = 1;
    private Map<Integer, ModelVersion> versions = new TreeMap<>();
    private Map<String, AliasBinding> aliases = new TreeMap<>();

    public RegisteredModel() {
    }

    public RegisteredModel(String name, Instant createdAt) {
        this.name = name;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public int getNextVersion() {
        return nextVersion;
    }

    public void setNextVersion(int nextVersion) {
        this.nextVersion = nextVersion;
    }

    public Map<Integer, ModelVersion> getVersions() {
        return versions;
    }

    public void setVersions(Map<Integer, ModelVersion> versions) {
        this.versions = versions == null ? new TreeMap<>() : new TreeMap<>(versions);
    }

    public Map<String, AliasBinding> getAliases() {
        return aliases;
    }

    public void setAliases(Map<String, AliasBinding> aliases) {
        this.aliases = aliases == null ? new TreeMap<>() : new TreeMap<>(aliases);
    }

    int allocateVersion() {
        return nextVersion++;
    }

    Optional<ModelVersion> findVersion(int version) {
        return Optional.ofNullable(versions.get(version));
    }

    ModelVersion requireVersion(int version) {
        return findVersion(version).orElseThrow(() -> new VersionNotFoundException(
                "Model " + name + " has no version " + version));
    }

    Optional<ModelVersion> findByRun(String runId) {
        return versions.values().stream().filter(version -> version.runId().equals(runId)).findFirst();
    }

    /** Aliases currently bound to the version, sorted by name. */
    List<String> aliasesOf(int version) {
        return aliases.entrySet().stream()
                .filter(entry -> entry.getValue().version() == version)
                .map(Map.Entry::getKey)
                .toList();
    }
}
