package com.modelgate.versioning;

public record PromotionResult(
        Outcome outcome,
        String modelName,
        String alias,
        int version,
        Integer previousVersion,
        AuditReason reason,
        String decisionId,
        String message) {

    public boolean changed() {
        return outcome == Outcome.PROMOTED || outcome == Outcome.ASSIGNED || outcome == Outcome.REMOVED;
    }

    public enum Outcome {
        PROMOTED,
        ASSIGNED,
        REMOVED,
        UNCHANGED,
        REJECTED
    }
}
