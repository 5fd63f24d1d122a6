package com.modelgate.tracking;

import com.modelgate.ModelGateException;

public class TrackingException extends ModelGateException {
    public TrackingException(String message) {
        super(ErrorKind.TRACKING, message);
    }

    public TrackingException(String message, Throwable cause) {
        super(ErrorKind.TRACKING, message, cause);
    }
}
