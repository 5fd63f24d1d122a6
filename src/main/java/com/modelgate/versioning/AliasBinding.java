package com.modelgate.versioning;

import java.time.Instant;

/**
 * Current target of an alias and how it got there.
 *
 * @param note gate decision id for gated promotions, the operator's reason for overrides
 */
public record AliasBinding(int version, Instant boundAt, String actor, AuditReason reason, String note) {
}
