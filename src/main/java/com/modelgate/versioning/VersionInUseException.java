package com.modelgate.versioning;

import com.modelgate.ModelGateException;

public class VersionInUseException extends ModelGateException {
    public VersionInUseException(String message) {
        super(ErrorKind.VERSION_IN_USE, message);
    }
}
