package com.modelgate.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.modelgate.runtime.ConfigException;

/**
 * Loads tabular CSV input. Index columns written by dataframe exports (blank or
 * {@code Unnamed: n} headers) are dropped.
 */
public class CsvDatasetReader {
    private static final Logger log = LoggerFactory.getLogger(CsvDatasetReader.class);

    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();

    public TabularDataset read(Path path) throws IOException {
        if (path == null) {
            throw new ConfigException("Dataset path is required");
        }
        String format = extension(path);
        if (!"csv".equals(format)) {
            throw new ConfigException("Unsupported file format '" + format + "' for " + path + "; expected csv");
        }
        if (!Files.isRegularFile(path)) {
            throw new ConfigException("Dataset not found: " + path);
        }

        List<String[]> records = new ArrayList<>();
        try (MappingIterator<String[]> iterator = mapper.readerFor(String[].class).readValues(path.toFile())) {
            while (iterator.hasNextValue()) {
                records.add(iterator.nextValue());
            }
        }
        if (records.isEmpty()) {
            throw new ConfigException("Dataset is empty: " + path);
        }

        String[] header = records.get(0);
        List<Integer> kept = new ArrayList<>();
        List<String> columns = new ArrayList<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i] == null ? "" : header[i].trim();
            if (isDirtyColumn(name)) {
                log.warn("Dropping column {} ('{}') from {}", i, name, path);
                continue;
            }
            if (columns.contains(name)) {
                throw new ConfigException("Duplicate column '" + name + "' in " + path);
            }
            kept.add(i);
            columns.add(name);
        }

        List<List<String>> rows = new ArrayList<>(records.size() - 1);
        for (int r = 1; r < records.size(); r++) {
            String[] record = records.get(r);
            if (record.length > header.length) {
                throw new ConfigException("Row " + r + " of " + path + " has " + record.length
                        + " cells but the header has " + header.length);
            }
            List<String> row = new ArrayList<>(kept.size());
            for (int index : kept) {
                String cell = index < record.length ? record[index] : null;
                row.add(cell == null ? "" : cell);
            }
            rows.add(row);
        }
        if (rows.isEmpty()) {
            throw new ConfigException("Dataset has a header but no rows: " + path);
        }
        log.debug("Read {} rows x {} columns from {}", rows.size(), columns.size(), path);
        return new TabularDataset(path, columns, rows, fingerprint(path));
    }

    static boolean isDirtyColumn(String name) {
        return name.isBlank() || name.startsWith("Unnamed");
    }

    /** SHA-256 of the raw file bytes. */
    public static String fingerprint(Path path) throws IOException {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(Files.readAllBytes(path)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Missing SHA-256 algorithm", e);
        }
    }

    private static String extension(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
