package com.modelgate.versioning;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * JSON-lines trail of every alias mutation attempt, including rejected and conflicting ones.
 */
public class PromotionAuditLog {
    private final Path auditLogPath;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public PromotionAuditLog(Path auditLogPath) {
        this.auditLogPath = auditLogPath;
    }

    public Path path() {
        return auditLogPath;
    }

    public synchronized void append(PromotionAuditEntry entry) throws IOException {
        if (auditLogPath.toAbsolutePath().getParent() != null) {
            Files.createDirectories(auditLogPath.toAbsolutePath().getParent());
        }
        String line = mapper.writeValueAsString(entry) + System.lineSeparator();
        Files.writeString(auditLogPath, line, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    public List<PromotionAuditEntry> readAll() throws IOException {
        if (!Files.exists(auditLogPath)) {
            return List.of();
        }
        List<PromotionAuditEntry> entries = new ArrayList<>();
        for (String line : Files.readAllLines(auditLogPath)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            entries.add(mapper.readValue(line, PromotionAuditEntry.class));
        }
        return entries;
    }
}
