package com.modelgate.versioning;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Registry kept in one JSON document. Transactions serialize on an in-process lock plus an OS
 * lock on a sibling {@code .lock} file, so separate processes sharing the file also take turns.
 * Commits write a temp file and rename it over the document.
 */
public class FileRegistryStore implements RegistryStore {
    private static final Logger log = LoggerFactory.getLogger(FileRegistryStore.class);
    private static final ConcurrentHashMap<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();

    private final Path registryPath;
    private final Path lockPath;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public FileRegistryStore(Path registryPath) {
        this.registryPath = registryPath.toAbsolutePath().normalize();
        this.lockPath = this.registryPath.resolveSibling(this.registryPath.getFileName() + ".lock");
    }

    public Path path() {
        return registryPath;
    }

    @Override
    public RegistryState snapshot() throws IOException {
        byte[] content = Files.exists(registryPath) ? Files.readAllBytes(registryPath) : new byte[0];
        return parse(content);
    }

    @Override
    public <T> T transact(RegistryTransaction<T> transaction) throws IOException {
        ReentrantLock lock = LOCKS.computeIfAbsent(registryPath, path -> new ReentrantLock());
        lock.lock();
        try {
            Files.createDirectories(registryPath.getParent());
            try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                    FileLock fileLock = channel.lock()) {
                byte[] before = Files.exists(registryPath) ? Files.readAllBytes(registryPath) : new byte[0];
                RegistryState state = parse(before);
                T result = transaction.apply(state);
                byte[] after = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(state);
                if (!Arrays.equals(before, after)) {
                    commit(after);
                }
                return result;
            }
        } finally {
            lock.unlock();
        }
    }

    private RegistryState parse(byte[] content) throws IOException {
        if (content.length == 0) {
            return new RegistryState();
        }
        RegistryState state = mapper.readValue(content, RegistryState.class);
        if (state.getSchemaVersion() != RegistryState.SCHEMA_VERSION) {
            throw new IOException("Unsupported registry schema version " + state.getSchemaVersion() + " in "
                    + registryPath);
        }
        return state;
    }

    private void commit(byte[] content) throws IOException {
        Path temp = Files.createTempFile(registryPath.getParent(), registryPath.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, content);
            try {
                Files.move(temp, registryPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic rename unsupported for {}, replacing in place", registryPath);
                Files.move(temp, registryPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
