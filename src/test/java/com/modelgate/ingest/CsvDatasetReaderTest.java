package com.modelgate.ingest;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.modelgate.ChurnFixtures;
import com.modelgate.runtime.ConfigException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvDatasetReaderTest {

    @TempDir
    Path tempDir;

    private final CsvDatasetReader reader = new CsvDatasetReader();

    @Test
    void shouldDropIndexColumnsFromDataframeExports() throws Exception {
        Path csv = tempDir.resolve("export.csv");
        Files.writeString(csv, """
                Unnamed: 0,tenure,churn
                0,12,Yes
                1,40,No
                """);

        TabularDataset dataset = reader.read(csv);

        assertEquals(List.of("tenure", "churn"), dataset.columns());
        assertEquals(2, dataset.size());
        assertEquals("40", dataset.cell(1, "tenure"));
        assertFalse(dataset.hasColumn("Unnamed: 0"));
    }

    @Test
    void shouldDropBlankHeaderColumn() throws Exception {
        TabularDataset dataset = reader.read(ChurnFixtures.writeChurnCsv(tempDir.resolve("churn.csv"), 10));

        assertEquals(List.of("customer_id", "tenure", "monthly_charges", "contract", "churn"), dataset.columns());
        assertEquals(10, dataset.size());
        assertEquals(List.of("Yes", "Yes", "Yes", "Yes", "Yes", "No", "No", "No", "No", "No"), dataset.column("churn"));
    }

    @Test
    void shouldPadShortRowsAndTrimCells() throws Exception {
        Path csv = tempDir.resolve("short.csv");
        Files.writeString(csv, "a,b,c\n 1 , 2\n3,4,5\n");

        TabularDataset dataset = reader.read(csv);

        assertEquals("1", dataset.cell(0, "a"));
        assertEquals("2", dataset.cell(0, "b"));
        assertEquals("", dataset.cell(0, "c"));
    }

    @Test
    void shouldFingerprintFileContent() throws Exception {
        Path first = ChurnFixtures.writeChurnCsv(tempDir.resolve("first.csv"), 10);
        Path same = ChurnFixtures.writeChurnCsv(tempDir.resolve("same.csv"), 10);
        Path other = ChurnFixtures.writeChurnCsv(tempDir.resolve("other.csv"), 12);

        String fingerprint = reader.read(first).fingerprint();

        assertEquals(64, fingerprint.length());
        assertEquals(fingerprint, reader.read(same).fingerprint());
        assertNotEquals(fingerprint, reader.read(other).fingerprint());
    }

    @Test
    void shouldRejectParquetInput() throws Exception {
        Path parquet = Files.write(tempDir.resolve("train.parquet"), new byte[] { 1, 2, 3 });

        ConfigException error = assertThrows(ConfigException.class, () -> reader.read(parquet));

        assertTrue(error.getMessage().contains("Unsupported file format 'parquet'"), error.getMessage());
    }

    @Test
    void shouldRejectMissingAndEmptyFiles() throws Exception {
        assertThrows(ConfigException.class, () -> reader.read(tempDir.resolve("absent.csv")));

        Path empty = Files.writeString(tempDir.resolve("empty.csv"), "");
        assertThrows(ConfigException.class, () -> reader.read(empty));

        Path headerOnly = Files.writeString(tempDir.resolve("header.csv"), "tenure,churn\n");
        ConfigException error = assertThrows(ConfigException.class, () -> reader.read(headerOnly));
        assertTrue(error.getMessage().contains("no rows"));
    }

    @Test
    void shouldRejectDuplicateColumnsAndOverlongRows() throws Exception {
        Path duplicate = Files.writeString(tempDir.resolve("duplicate.csv"), "tenure,tenure\n1,2\n");
        assertThrows(ConfigException.class, () -> reader.read(duplicate));

        Path overlong = Files.writeString(tempDir.resolve("overlong.csv"), "tenure,churn\n1,Yes,extra\n");
        assertThrows(ConfigException.class, () -> reader.read(overlong));
    }
}
