package com.modelgate.versioning;

import com.modelgate.ModelGateException;

public class VersionNotFoundException extends ModelGateException {
    public VersionNotFoundException(String message) {
        super(ErrorKind.VERSION_NOT_FOUND, message);
    }
}
