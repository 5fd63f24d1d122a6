package com.modelgate.versioning;

/**
 * @param policyFingerprint fingerprint of the evaluation policy in force; only decisions made
 *                          under it count
 * @param clearAlias        alias to release in the same transaction when it binds the promoted
 *                          version, or null
 */
public record PromotionRequest(
        String modelName,
        int version,
        String alias,
        ExpectedBinding expected,
        String policyFingerprint,
        boolean override,
        String overrideReason,
        String clearAlias,
        String actor) {
    public PromotionRequest {
        expected = expected == null ? ExpectedBinding.any() : expected;
        actor = actor == null || actor.isBlank() ? "unknown" : actor;
    }

    public static PromotionRequest gated(String modelName, int version, String alias, String policyFingerprint,
            String actor) {
        return new PromotionRequest(modelName, version, alias, ExpectedBinding.any(), policyFingerprint, false, null,
                null, actor);
    }
}
