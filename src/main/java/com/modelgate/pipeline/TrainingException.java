package com.modelgate.pipeline;

import com.modelgate.ModelGateException;

public class TrainingException extends ModelGateException {
    private final String runId;

    public TrainingException(String message) {
        this(null, message, null);
    }

    public TrainingException(String runId, String message, Throwable cause) {
        super(ErrorKind.TRAINING_FAILED, message, cause);
        this.runId = runId;
    }

    /** Id of the run that was closed as failed, or null when no run was opened. */
    public String runId() {
        return runId;
    }
}
