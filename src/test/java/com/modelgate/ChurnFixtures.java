package com.modelgate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Synthetic churn data: the shorter-tenure half of the customers churn on monthly contracts.
 */
public final class ChurnFixtures {

    private ChurnFixtures() {
    }

    public static Path writeChurnCsv(Path file, int rows) throws IOException {
        StringBuilder csv = new StringBuilder(",customer_id,tenure,monthly_charges,contract,churn\n");
        for (int tenure = 0; tenure < rows; tenure++) {
            boolean churns = tenure < rows / 2;
            csv.append(tenure).append(',')
                    .append("C").append(1000 + tenure).append(',')
                    .append(tenure).append(',')
                    .append(20 + (tenure * 37) % 50).append(',')
                    .append(churns ? "month" : "year").append(',')
                    .append(churns ? "Yes" : "No").append('\n');
        }
        Files.createDirectories(file.toAbsolutePath().getParent());
        Files.writeString(file, csv.toString());
        return file;
    }

    /** Same columns, one label only. */
    public static Path writeSingleClassCsv(Path file) throws IOException {
        StringBuilder csv = new StringBuilder("tenure,monthly_charges,contract,churn\n");
        for (int tenure = 0; tenure < 40; tenure++) {
            csv.append(tenure).append(',').append(30 + tenure).append(",month,No\n");
        }
        Files.writeString(file, csv.toString());
        return file;
    }

    public static String config(Path dir, String thresholds) {
        String root = dir.toString().replace('\\', '/');
        return """
                tracking:
                  uri: file:%1$s/mlruns
                  experimentName: churn-test
                registry:
                  uri: %1$s/registry/registry.json
                  defaultAlias: champion
                model:
                  name: churn_model
                  artifactPath: model
                  hyperparameters:
                    booster: gbtree
                    evalMetrics: [logloss, auc]
                    numRounds: 20
                    learningRate: 0.3
                    earlyStoppingRounds: 5
                    validationFraction: 0.2
                    seed: 7
                features:
                  targetColumn: churn
                  positiveLabel: "Yes"
                  trainingFeatures: [contract, tenure, monthly_charges]
                data:
                  trainingPath: %1$s/data/train.csv
                  evalPath: %1$s/data/eval.csv
                evaluation:
                  thresholds:
                %2$s
                  baseline:
                    alias: champion
                    primaryMetric: f1_score
                    tolerance: 0.0
                  explainability:
                    enabled: true
                    maxFeatures: 2
                """.formatted(root, thresholds.indent(4).stripTrailing());
    }

    public static String passingThresholds() {
        return """
                auc: 0.80
                accuracy:
                  min: 0.75""";
    }

    public static String failingThresholds() {
        return """
                accuracy:
                  min: 1.01""";
    }

    public static Path writeConfig(Path dir, String thresholds) throws IOException {
        Path config = dir.resolve("config.yml");
        Files.writeString(config, config(dir, thresholds));
        return config;
    }
}
