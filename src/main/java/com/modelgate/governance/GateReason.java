package com.modelgate.governance;

/**
 * One recorded reason a gate decision failed.
 *
 * @param bound the violated threshold, or the baseline value for a regression
 */
public record GateReason(Type type, String metric, double actual, double bound, String message) {

    public enum Type {
        THRESHOLD_VIOLATION,
        BASELINE_REGRESSION
    }
}
