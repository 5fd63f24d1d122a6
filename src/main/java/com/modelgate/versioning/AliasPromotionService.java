package com.modelgate.versioning;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelgate.ModelGateException;
import com.modelgate.governance.GateDecision;
import com.modelgate.runtime.ConfigException;

/**
 * Alias state machine per (model, alias): unbound or bound to one version. Every transition is
 * a single conditional registry transaction, and every attempt lands in the audit log.
 */
public class AliasPromotionService {
    private static final Logger log = LoggerFactory.getLogger(AliasPromotionService.class);

    private final RegistryStore store;
    private final PromotionAuditLog auditLog;
    private final Clock clock;

    public AliasPromotionService(RegistryStore store, PromotionAuditLog auditLog) {
        this(store, auditLog, Clock.systemUTC());
    }

    AliasPromotionService(RegistryStore store, PromotionAuditLog auditLog, Clock clock) {
        this.store = store;
        this.auditLog = auditLog;
        this.clock = clock;
    }

    /**
     * Moves the alias to the requested version when the version's run holds a passing gate
     * decision under the request's policy, or when an override with a reason is given.
     */
    public PromotionResult promote(PromotionRequest request) throws IOException {
        Objects.requireNonNull(request, "request");
        ModelRegistry.requireName(request.modelName());
        requireAlias(request.alias());
        if (request.override() && (request.overrideReason() == null || request.overrideReason().isBlank())) {
            throw new ConfigException("An override promotion needs a reason");
        }
        if (!request.override() && (request.policyFingerprint() == null || request.policyFingerprint().isBlank())) {
            throw new ConfigException("A gated promotion needs the fingerprint of the evaluation policy in force");
        }

        Instant now = clock.instant();
        AuditReason attempted = request.override() ? AuditReason.OVERRIDE : AuditReason.GATED_PROMOTION;
        String overrideNote = request.override() ? "override: " + request.overrideReason() : null;
        PromotionResult result;
        try {
            result = store.transact(state -> applyPromotion(state, request, now));
        } catch (IOException | RuntimeException e) {
            audit(new PromotionAuditEntry(now, request.actor(), "promote", request.modelName(), request.alias(), null,
                    request.version(), failureOutcome(e), attempted, null, request.policyFingerprint(),
                    overrideNote == null ? e.getMessage() : overrideNote + " / " + e.getMessage()), e);
            throw e;
        }
        audit(new PromotionAuditEntry(now, request.actor(), "promote", request.modelName(), request.alias(),
                result.previousVersion(), request.version(), result.outcome().name(), result.reason(),
                result.decisionId(), request.policyFingerprint(), overrideNote == null ? result.message() : overrideNote),
                null);
        return result;
    }

    /** Direct {@code unbound -> bound(v)} assignment; no gate check. */
    public PromotionResult assign(String modelName, String alias, int version, String actor) throws IOException {
        ModelRegistry.requireName(modelName);
        requireAlias(alias);
        Instant now = clock.instant();
        String who = actor == null || actor.isBlank() ? "unknown" : actor;
        PromotionResult result;
        try {
            result = store.transact(state -> {
                RegisteredModel model = state.requireModel(modelName);
                model.requireVersion(version);
                AliasBinding current = model.getAliases().get(alias);
                if (current != null && current.version() == version) {
                    return new PromotionResult(PromotionResult.Outcome.UNCHANGED, modelName, alias, version, version,
                            current.reason(), null, "Alias " + alias + " already binds version " + version);
                }
                if (current != null) {
                    throw new RegistryConflictException("Alias " + alias + " of " + modelName + " is bound to version "
                            + current.version() + "; direct assignment needs an unbound alias, use promote instead");
                }
                model.getAliases().put(alias, new AliasBinding(version, now, who, AuditReason.INITIAL_ASSIGNMENT, null));
                model.setUpdatedAt(now);
                return new PromotionResult(PromotionResult.Outcome.ASSIGNED, modelName, alias, version, null,
                        AuditReason.INITIAL_ASSIGNMENT, null, "Alias " + alias + " assigned to version " + version);
            });
        } catch (IOException | RuntimeException e) {
            audit(new PromotionAuditEntry(now, who, "assign", modelName, alias, null, version, failureOutcome(e),
                    AuditReason.INITIAL_ASSIGNMENT, null, null, e.getMessage()), e);
            throw e;
        }
        log.info("{}", result.message());
        audit(new PromotionAuditEntry(now, who, "assign", modelName, alias, result.previousVersion(), version,
                result.outcome().name(), AuditReason.INITIAL_ASSIGNMENT, null, null, result.message()), null);
        return result;
    }

    /** {@code bound(v) -> unbound}, conditional on the expected current binding. */
    public PromotionResult removeAlias(String modelName, String alias, ExpectedBinding expected, String actor)
            throws IOException {
        ModelRegistry.requireName(modelName);
        requireAlias(alias);
        ExpectedBinding precondition = expected == null ? ExpectedBinding.any() : expected;
        Instant now = clock.instant();
        String who = actor == null || actor.isBlank() ? "unknown" : actor;
        PromotionResult result;
        try {
            result = store.transact(state -> {
                RegisteredModel model = state.requireModel(modelName);
                AliasBinding current = model.getAliases().get(alias);
                requireExpected(modelName, alias, precondition, current);
                if (current == null) {
                    return new PromotionResult(PromotionResult.Outcome.UNCHANGED, modelName, alias, 0, null, null, null,
                            "Alias " + alias + " is already unbound");
                }
                model.getAliases().remove(alias);
                model.setUpdatedAt(now);
                return new PromotionResult(PromotionResult.Outcome.REMOVED, modelName, alias, current.version(),
                        current.version(), current.reason(), null,
                        "Alias " + alias + " released from version " + current.version());
            });
        } catch (IOException | RuntimeException e) {
            audit(new PromotionAuditEntry(now, who, "remove", modelName, alias, null, null, failureOutcome(e),
                    null, null, null, e.getMessage()), e);
            throw e;
        }
        log.info("{}", result.message());
        audit(new PromotionAuditEntry(now, who, "remove", modelName, alias, result.previousVersion(), null,
                result.outcome().name(), null, null, null, result.message()), null);
        return result;
    }

    /**
     * Appends the entry. A write error is attached to {@code failure} as suppressed, or only logged
     * when the change has committed.
     */
    private void audit(PromotionAuditEntry entry, Exception failure) {
        try {
            auditLog.append(entry);
        } catch (IOException | RuntimeException e) {
            if (failure != null) {
                failure.addSuppressed(e);
            } else {
                log.warn("{} of alias {} on {} committed as {} but could not be written to audit log {}",
                        entry.action(), entry.alias(), entry.modelName(), entry.outcome(), auditLog.path(), e);
            }
        }
    }

    private static String failureOutcome(Exception failure) {
        if (failure instanceof ModelGateException gateException) {
            return gateException.kind() == ModelGateException.ErrorKind.REGISTRY_CONFLICT
                    ? "CONFLICT"
                    : gateException.kind().name();
        }
        return "ERROR";
    }

    private PromotionResult applyPromotion(RegistryState state, PromotionRequest request, Instant now) {
        RegisteredModel model = state.requireModel(request.modelName());
        ModelVersion target = model.requireVersion(request.version());
        String alias = request.alias();
        AliasBinding current = model.getAliases().get(alias);
        requireExpected(request.modelName(), alias, request.expected(), current);
        Integer previous = current == null ? null : current.version();

        Optional<GateDecision> decision = state.latestDecision(target.runId(), request.policyFingerprint());
        String decisionId = decision.map(GateDecision::decisionId).orElse(null);
        if (current != null && current.version() == request.version()) {
            return new PromotionResult(PromotionResult.Outcome.UNCHANGED, request.modelName(), alias, request.version(),
                    previous, current.reason(), decisionId, "Alias " + alias + " already binds version " + request.version());
        }

        AuditReason reason;
        String note;
        if (request.override()) {
            reason = AuditReason.OVERRIDE;
            note = request.overrideReason();
            log.warn("Promoting {} version {} to {} by override: {}", request.modelName(), request.version(), alias, note);
        } else if (decision.isEmpty()) {
            return rejected(request, previous, null, "No gate decision for run " + target.runId() + " of version "
                    + request.version() + " under the current evaluation policy");
        } else if (!decision.get().passed()) {
            return rejected(request, previous, decisionId, "Gate decision " + decisionId + " for run "
                    + target.runId() + " failed: " + String.join("; ", decision.get().reasonMessages()));
        } else {
            reason = AuditReason.GATED_PROMOTION;
            note = decisionId;
        }

        model.getAliases().put(alias, new AliasBinding(request.version(), now, request.actor(), reason, note));
        String cleared = "";
        if (request.clearAlias() != null && !request.clearAlias().isBlank() && !request.clearAlias().equals(alias)) {
            AliasBinding clearBinding = model.getAliases().get(request.clearAlias());
            if (clearBinding != null && clearBinding.version() == request.version()) {
                model.getAliases().remove(request.clearAlias());
                cleared = "; cleared " + request.clearAlias();
            }
        }
        model.setUpdatedAt(now);
        String message = "Alias " + alias + " of " + request.modelName() + " moved "
                + (previous == null ? "from unbound" : "from version " + previous) + " to version " + request.version()
                + cleared;
        log.info("{} ({})", message, reason);
        return new PromotionResult(PromotionResult.Outcome.PROMOTED, request.modelName(), alias, request.version(),
                previous, reason, decisionId, message);
    }

    private static PromotionResult rejected(PromotionRequest request, Integer previous, String decisionId,
            String message) {
        log.warn("Promotion of {} version {} to {} rejected: {}", request.modelName(), request.version(),
                request.alias(), message);
        return new PromotionResult(PromotionResult.Outcome.REJECTED, request.modelName(), request.alias(),
                request.version(), previous, AuditReason.GATED_PROMOTION, decisionId, message);
    }

    private static void requireExpected(String modelName, String alias, ExpectedBinding expected,
            AliasBinding current) {
        if (!expected.matches(current)) {
            throw new RegistryConflictException("Alias " + alias + " of " + modelName + " is "
                    + (current == null ? "unbound" : "bound to version " + current.version())
                    + ", expected " + expected.describe());
        }
    }

    private static void requireAlias(String alias) {
        if (alias == null || alias.isBlank()) {
            throw new ConfigException("An alias name is required");
        }
    }
}
