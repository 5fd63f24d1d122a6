package com.modelgate.runtime;

import com.modelgate.ModelGateException;

public class ConfigException extends ModelGateException {
    public ConfigException(String message) {
        super(ErrorKind.CONFIG, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorKind.CONFIG, message, cause);
    }
}
