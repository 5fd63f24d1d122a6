package com.modelgate.governance;

import java.nio.file.Path;

/**
 * @param predictionsPath where to write scored rows, or null to skip the file
 * @param modelName       registered model the baseline is looked up in, or null for no baseline
 * @param attributionFeatures number of top features to attribute, 0 to skip attribution
 */
public record EvaluationRequest(
        String runId,
        Path datasetPath,
        Path predictionsPath,
        EvaluationPolicy policy,
        String artifactPath,
        String modelName,
        Integer baselineVersion,
        String baselineAlias,
        int attributionFeatures) {
}
