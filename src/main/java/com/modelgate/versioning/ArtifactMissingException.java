package com.modelgate.versioning;

import com.modelgate.ModelGateException;

public class ArtifactMissingException extends ModelGateException {
    public ArtifactMissingException(String message) {
        super(ErrorKind.ARTIFACT_NOT_FOUND, message);
    }
}
