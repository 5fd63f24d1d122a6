package com.modelgate.versioning;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.modelgate.governance.GateDecision;
import com.modelgate.governance.GateDecisionStore;

/**
 * Keeps gate decisions in the registry document, next to the aliases they unlock.
 */
public class RegistryDecisionStore implements GateDecisionStore {
    private final RegistryStore store;

    public RegistryDecisionStore(RegistryStore store) {
        this.store = store;
    }

    @Override
    public void append(GateDecision decision) throws IOException {
        store.transact(state -> {
            state.appendDecision(decision);
            return null;
        });
    }

    @Override
    public List<GateDecision> history(String runId) throws IOException {
        return store.snapshot().decisionsFor(runId);
    }

    @Override
    public Optional<GateDecision> latest(String runId, String policyFingerprint) throws IOException {
        return store.snapshot().latestDecision(runId, policyFingerprint);
    }
}
