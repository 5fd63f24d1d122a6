package com.modelgate.ingest;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory table with ordered column names and string cells. Every row has exactly one cell
 * per column.
 */
public record TabularDataset(Path source, List<String> columns, List<List<String>> rows, String fingerprint) {
    public TabularDataset {
        columns = List.copyOf(columns);
        List<List<String>> copied = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row has " + row.size() + " cells but dataset has "
                        + columns.size() + " columns");
            }
            copied.add(List.copyOf(row));
        }
        rows = List.copyOf(copied);
        fingerprint = fingerprint == null ? "" : fingerprint;
    }

    public int size() {
        return rows.size();
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public int columnIndex(String column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return index;
    }

    public List<String> column(String column) {
        int index = columnIndex(column);
        List<String> values = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            values.add(row.get(index));
        }
        return values;
    }

    public String cell(int row, String column) {
        return rows.get(row).get(columnIndex(column));
    }

    /** Subset of rows in the given order; used for train/validation splits. */
    public TabularDataset select(List<Integer> rowIndexes) {
        List<List<String>> selected = new ArrayList<>(rowIndexes.size());
        for (int index : rowIndexes) {
            selected.add(rows.get(index));
        }
        return new TabularDataset(source, columns, selected, fingerprint);
    }
}
