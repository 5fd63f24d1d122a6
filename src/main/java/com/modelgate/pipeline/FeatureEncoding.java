package com.modelgate.pipeline;

import java.util.List;

/**
 * How one raw column becomes a number: numeric columns impute blanks with the training mean,
 * categorical columns map to their index among the sorted training values (-1 when unseen).
 */
public record FeatureEncoding(String name, Kind kind, double mean, List<String> categories) {
    public static final double UNSEEN = -1.0;

    public FeatureEncoding {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public static FeatureEncoding numeric(String name, double mean) {
        return new FeatureEncoding(name, Kind.NUMERIC, mean, List.of());
    }

    public static FeatureEncoding categorical(String name, List<String> categories) {
        return new FeatureEncoding(name, Kind.CATEGORICAL, 0.0, categories);
    }

    public double encode(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (kind == Kind.NUMERIC) {
            Double parsed = parseNumber(value);
            return parsed == null ? mean : parsed;
        }
        int index = categories.indexOf(value);
        return index < 0 ? UNSEEN : index;
    }

    static Double parseNumber(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public enum Kind {
        NUMERIC,
        CATEGORICAL
    }
}
