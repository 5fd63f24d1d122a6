package com.modelgate.versioning;

import com.modelgate.ModelGateException;

public class RegistryConflictException extends ModelGateException {
    public RegistryConflictException(String message) {
        super(ErrorKind.REGISTRY_CONFLICT, message);
    }
}
