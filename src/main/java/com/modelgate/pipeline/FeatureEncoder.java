package com.modelgate.pipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelgate.ingest.TabularDataset;

/**
 * Turns dataset rows into feature vectors. Fitted once on training rows; the resulting
 * encodings travel inside the model artifact so scoring uses the same mapping.
 */
public class FeatureEncoder {
    private static final Logger log = LoggerFactory.getLogger(FeatureEncoder.class);

    private final List<FeatureEncoding> encodings;

    public FeatureEncoder(List<FeatureEncoding> encodings) {
        this.encodings = List.copyOf(encodings);
    }

    public static FeatureEncoder fit(TabularDataset dataset, List<String> features) {
        List<FeatureEncoding> encodings = new ArrayList<>(features.size());
        for (String feature : features) {
            List<String> values = dataset.column(feature);
            double sum = 0.0;
            int numeric = 0;
            boolean allNumeric = true;
            for (String value : values) {
                if (value.isBlank()) {
                    continue;
                }
                Double parsed = FeatureEncoding.parseNumber(value);
                if (parsed == null) {
                    allNumeric = false;
                    break;
                }
                sum += parsed;
                numeric++;
            }
            if (allNumeric && numeric > 0) {
                encodings.add(FeatureEncoding.numeric(feature, sum / numeric));
            } else {
                TreeSet<String> categories = new TreeSet<>();
                for (String value : values) {
                    categories.add(value.trim());
                }
                encodings.add(FeatureEncoding.categorical(feature, new ArrayList<>(categories)));
            }
        }
        return new FeatureEncoder(encodings);
    }

    public List<FeatureEncoding> encodings() {
        return encodings;
    }

    public List<String> featureNames() {
        return encodings.stream().map(FeatureEncoding::name).toList();
    }

    /**
     * @throws IllegalArgumentException when the dataset lacks one of the encoded columns
     */
    public double[][] transform(TabularDataset dataset) {
        int[] columnIndexes = new int[encodings.size()];
        for (int f = 0; f < encodings.size(); f++) {
            String name = encodings.get(f).name();
            if (!dataset.hasColumn(name)) {
                throw new IllegalArgumentException("Missing feature column: " + name);
            }
            columnIndexes[f] = dataset.columnIndex(name);
        }

        double[][] matrix = new double[dataset.size()][encodings.size()];
        int[] unseen = new int[encodings.size()];
        for (int r = 0; r < dataset.size(); r++) {
            List<String> row = dataset.rows().get(r);
            for (int f = 0; f < encodings.size(); f++) {
                double encoded = encodings.get(f).encode(row.get(columnIndexes[f]));
                if (encodings.get(f).kind() == FeatureEncoding.Kind.CATEGORICAL && encoded == FeatureEncoding.UNSEEN) {
                    unseen[f]++;
                }
                matrix[r][f] = encoded;
            }
        }
        for (int f = 0; f < unseen.length; f++) {
            if (unseen[f] > 0) {
                log.warn("{} rows carry values of {} unseen during training", unseen[f], encodings.get(f).name());
            }
        }
        return matrix;
    }
}
