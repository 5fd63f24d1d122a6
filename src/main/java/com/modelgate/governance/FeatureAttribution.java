package com.modelgate.governance;

public record FeatureAttribution(String feature, double meanAbsoluteContribution) {
}
