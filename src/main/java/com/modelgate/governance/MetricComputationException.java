package com.modelgate.governance;

import com.modelgate.ModelGateException;

public class MetricComputationException extends ModelGateException {
    public MetricComputationException(String message) {
        super(ErrorKind.METRIC_COMPUTATION, message);
    }

    public MetricComputationException(String message, Throwable cause) {
        super(ErrorKind.METRIC_COMPUTATION, message, cause);
    }
}
