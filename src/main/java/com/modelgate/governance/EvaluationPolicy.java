package com.modelgate.governance;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import com.modelgate.runtime.AppConfig;

/**
 * The promotion policy in force: ordered metric thresholds plus the baseline rule. Decisions are
 * keyed by {@link #fingerprint()}, so changing any bound invalidates earlier decisions.
 */
public record EvaluationPolicy(List<MetricThreshold> thresholds, String primaryMetric, double tolerance) {

    public EvaluationPolicy {
        thresholds = List.copyOf(thresholds);
        primaryMetric = MetricCalculator.canonical(primaryMetric == null ? "f1_score" : primaryMetric);
    }

    public static EvaluationPolicy from(AppConfig.EvaluationConfig evaluation) {
        List<MetricThreshold> thresholds = new ArrayList<>();
        for (Map.Entry<String, AppConfig.ThresholdConfig> entry : evaluation.getThresholds().entrySet()) {
            thresholds.add(MetricThreshold.from(entry.getKey(), entry.getValue()));
        }
        AppConfig.BaselineConfig baseline = evaluation.getBaseline();
        return new EvaluationPolicy(thresholds, baseline.getPrimaryMetric(), baseline.getTolerance());
    }

    public String fingerprint() {
        StringBuilder canonical = new StringBuilder();
        thresholds.stream()
                .sorted(Comparator.comparing(MetricThreshold::metric))
                .forEach(threshold -> canonical.append(threshold.metric())
                        .append('|').append(plain(threshold.min()))
                        .append('|').append(plain(threshold.max()))
                        .append(';'));
        canonical.append("baseline|").append(primaryMetric).append('|').append(plain(tolerance));
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Missing SHA-256 algorithm", e);
        }
    }

    private static String plain(Double value) {
        return value == null ? "-" : BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
