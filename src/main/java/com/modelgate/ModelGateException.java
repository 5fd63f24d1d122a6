package com.modelgate;

/**
 * Base type for the failures an operation reports to its caller. Gate outcomes are not
 * exceptions; they travel inside {@link com.modelgate.governance.GateDecision}.
 */
public class ModelGateException extends RuntimeException {
    private final ErrorKind kind;

    public ModelGateException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ModelGateException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public enum ErrorKind {
        CONFIG,
        RUN_NOT_FOUND,
        ARTIFACT_NOT_FOUND,
        VERSION_NOT_FOUND,
        METRIC_COMPUTATION,
        REGISTRY_CONFLICT,
        VERSION_IN_USE,
        TRAINING_FAILED,
        TRACKING
    }
}
