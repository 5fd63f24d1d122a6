package com.modelgate.versioning;

import java.time.Instant;

public record PromotionAuditEntry(
        Instant timestamp,
        String actor,
        String action,
        String modelName,
        String alias,
        Integer fromVersion,
        Integer toVersion,
        String outcome,
        AuditReason reason,
        String decisionId,
        String policyFingerprint,
        String details) {
}
