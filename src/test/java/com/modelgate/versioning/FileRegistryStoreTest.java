package com.modelgate.versioning;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileRegistryStoreTest {

    @TempDir
    Path tempDir;

    private static final Instant NOW = Instant.parse("2026-02-10T12:00:00Z");

    @Test
    void shouldStartEmptyAndPersistCommittedChanges() throws Exception {
        FileRegistryStore store = new FileRegistryStore(tempDir.resolve("registry/registry.json"));
        assertTrue(store.snapshot().getModels().isEmpty());

        int version = store.transact(state -> addVersion(state, "churn_model", "run-1"));

        assertEquals(1, version);
        FileRegistryStore reopened = new FileRegistryStore(tempDir.resolve("registry/registry.json"));
        RegisteredModel model = reopened.snapshot().getModels().get("churn_model");
        assertEquals(2, model.getNextVersion());
        assertEquals("run-1", model.getVersions().get(1).runId());
        assertEquals(NOW, model.getVersions().get(1).createdAt());
    }

    @Test
    void shouldLeaveStoreByteIdenticalWhenTransactionThrows() throws Exception {
        FileRegistryStore store = new FileRegistryStore(tempDir.resolve("registry.json"));
        store.transact(state -> addVersion(state, "churn_model", "run-1"));
        byte[] before = Files.readAllBytes(store.path());

        assertThrows(RegistryConflictException.class, () -> store.transact(state -> {
            addVersion(state, "churn_model", "run-2");
            state.getModels().get("churn_model").getAliases()
                    .put("champion", new AliasBinding(2, NOW, "tester", AuditReason.OVERRIDE, "x"));
            throw new RegistryConflictException("simulated conflict");
        }));

        assertArrayEquals(before, Files.readAllBytes(store.path()));
        assertEquals(1, store.snapshot().getModels().get("churn_model").getVersions().size());
    }

    @Test
    void shouldNotRewriteUnchangedState() throws Exception {
        FileRegistryStore store = new FileRegistryStore(tempDir.resolve("registry.json"));
        store.transact(state -> addVersion(state, "churn_model", "run-1"));
        byte[] before = Files.readAllBytes(store.path());

        store.transact(state -> state.findModel("churn_model").isPresent());

        assertArrayEquals(before, Files.readAllBytes(store.path()));
        try (var files = Files.list(tempDir)) {
            assertFalse(files.anyMatch(file -> file.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void shouldSerializeConcurrentTransactionsWithoutLostUpdates() throws Exception {
        Path registryPath = tempDir.resolve("registry.json");
        List<FileRegistryStore> clients = List.of(new FileRegistryStore(registryPath), new FileRegistryStore(registryPath));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 40; i++) {
                FileRegistryStore client = clients.get(i % 2);
                String runId = "run-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return client.transact(state -> addVersion(state, "churn_model", runId));
                }));
            }
            start.countDown();
            List<Integer> versions = new ArrayList<>();
            for (Future<Integer> future : futures) {
                versions.add(future.get(30, TimeUnit.SECONDS));
            }

            assertEquals(40, versions.stream().distinct().count());
            RegisteredModel model = clients.get(0).snapshot().getModels().get("churn_model");
            assertEquals(40, model.getVersions().size());
            assertEquals(41, model.getNextVersion());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void shouldRejectUnknownSchemaVersion() throws Exception {
        Path registryPath = tempDir.resolve("registry.json");
        Files.writeString(registryPath, "{\"schemaVersion\": 99, \"models\": {}}");

        IOException error = assertThrows(IOException.class, () -> new FileRegistryStore(registryPath).snapshot());

        assertTrue(error.getMessage().contains("schema version 99"));
    }

    private static int addVersion(RegistryState state, String modelName, String runId) {
        RegisteredModel model = state.getModels().computeIfAbsent(modelName, name -> new RegisteredModel(name, NOW));
        int number = model.allocateVersion();
        model.getVersions().put(number, new ModelVersion(modelName, number, runId, "runs:/" + runId + "/model", null,
                Map.of("source_run", runId), NOW, NOW));
        return number;
    }
}
