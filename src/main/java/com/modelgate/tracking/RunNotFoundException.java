package com.modelgate.tracking;

import com.modelgate.ModelGateException;

public class RunNotFoundException extends ModelGateException {
    private final String runId;

    public RunNotFoundException(String runId) {
        super(ErrorKind.RUN_NOT_FOUND, "Run not found: " + runId);
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }
}
