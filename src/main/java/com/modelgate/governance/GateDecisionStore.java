package com.modelgate.governance;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Append-only record of gate decisions per run.
 */
public interface GateDecisionStore {

    void append(GateDecision decision) throws IOException;

    /** Decisions for the run, oldest first. */
    List<GateDecision> history(String runId) throws IOException;

    default Optional<GateDecision> latest(String runId, String policyFingerprint) throws IOException {
        List<GateDecision> history = history(runId);
        for (int i = history.size() - 1; i >= 0; i--) {
            GateDecision decision = history.get(i);
            if (policyFingerprint == null || policyFingerprint.equals(decision.policyFingerprint())) {
                return Optional.of(decision);
            }
        }
        return Optional.empty();
    }
}
