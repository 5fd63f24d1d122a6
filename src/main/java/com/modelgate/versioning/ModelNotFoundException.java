package com.modelgate.versioning;

import com.modelgate.ModelGateException;

public class ModelNotFoundException extends ModelGateException {
    public ModelNotFoundException(String message) {
        super(ErrorKind.VERSION_NOT_FOUND, message);
    }
}
