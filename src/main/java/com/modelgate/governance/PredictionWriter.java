package com.modelgate.governance;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.modelgate.ingest.TabularDataset;
import com.modelgate.pipeline.BinaryScores;
import com.modelgate.pipeline.LabelEncoding;

/**
 * Writes the evaluation rows back out with the predicted label and positive-class probability.
 */
public class PredictionWriter {
    static final String PREDICTION_COLUMN = "prediction";
    static final String PROBABILITY_COLUMN = "probability";

    private final CsvMapper mapper = new CsvMapper();

    public byte[] render(TabularDataset dataset, double[] probabilities, LabelEncoding labels) throws IOException {
        List<String> columns = new ArrayList<>(dataset.columns());
        columns.remove(PREDICTION_COLUMN);
        columns.remove(PROBABILITY_COLUMN);
        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        columns.forEach(schema::addColumn);
        schema.addColumn(PREDICTION_COLUMN);
        schema.addColumn(PROBABILITY_COLUMN);

        List<Map<String, String>> rows = new ArrayList<>(dataset.size());
        for (int i = 0; i < dataset.size(); i++) {
            Map<String, String> row = new LinkedHashMap<>();
            for (String column : columns) {
                row.put(column, dataset.cell(i, column));
            }
            row.put(PREDICTION_COLUMN, labels.decode(BinaryScores.predict(probabilities[i])));
            row.put(PROBABILITY_COLUMN, Double.toString(probabilities[i]));
            rows.add(row);
        }
        return mapper.writerFor(List.class).with(schema.build()).writeValueAsBytes(rows);
    }

    public void write(Path target, byte[] csv) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, csv);
    }
}
