package com.modelgate.versioning;

/** Why an alias was moved. */
public enum AuditReason {
    GATED_PROMOTION,
    OVERRIDE,
    INITIAL_ASSIGNMENT
}
