package com.modelgate.tracking;

public enum RunStatus {
    RUNNING,
    FINISHED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
