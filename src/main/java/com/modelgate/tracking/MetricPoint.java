package com.modelgate.tracking;

public record MetricPoint(String key, double value, long step, long timestampMs) {
}
