package com.modelgate.governance;

import com.modelgate.ModelGateException;

public class ArtifactNotFoundException extends ModelGateException {
    public ArtifactNotFoundException(String message) {
        super(ErrorKind.ARTIFACT_NOT_FOUND, message);
    }

    public ArtifactNotFoundException(String message, Throwable cause) {
        super(ErrorKind.ARTIFACT_NOT_FOUND, message, cause);
    }
}
