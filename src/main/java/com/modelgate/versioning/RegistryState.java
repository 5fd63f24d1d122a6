package com.modelgate.versioning;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.modelgate.governance.GateDecision;

/**
 * Whole registry document: registered models and the gate decisions recorded per run.
 */
public class RegistryState {
    static final int SCHEMA_VERSION = 1;

    private int schemaVersion = SCHEMA_VERSION;
    private Map<String, RegisteredModel> models = new TreeMap<>();
    private Map<String, List<GateDecision>> decisions = new TreeMap<>();

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(int schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public Map<String, RegisteredModel> getModels() {
        return models;
    }

    public void setModels(Map<String, RegisteredModel> models) {
        this.models = models == null ? new TreeMap<>() : new TreeMap<>(models);
    }

    public Map<String, List<GateDecision>> getDecisions() {
        return decisions;
    }

    public void setDecisions(Map<String, List<GateDecision>> decisions) {
        this.decisions = decisions == null ? new TreeMap<>() : new TreeMap<>(decisions);
    }

    Optional<RegisteredModel> findModel(String name) {
        return Optional.ofNullable(models.get(name));
    }

    RegisteredModel requireModel(String name) {
        return findModel(name).orElseThrow(() -> new ModelNotFoundException("Registered model not found: " + name));
    }

    void appendDecision(GateDecision decision) {
        decisions.computeIfAbsent(decision.runId(), runId -> new ArrayList<>()).add(decision);
    }

    List<GateDecision> decisionsFor(String runId) {
        return List.copyOf(decisions.getOrDefault(runId, List.of()));
    }

    /** Most recent decision for the run under the given policy fingerprint. */
    Optional<GateDecision> latestDecision(String runId, String policyFingerprint) {
        List<GateDecision> history = decisions.getOrDefault(runId, List.of());
        for (int i = history.size() - 1; i >= 0; i--) {
            if (policyFingerprint == null || policyFingerprint.equals(history.get(i).policyFingerprint())) {
                return Optional.of(history.get(i));
            }
        }
        return Optional.empty();
    }
}
