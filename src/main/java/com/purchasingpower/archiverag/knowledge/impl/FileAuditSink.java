package com.purchasingpower.archiverag.knowledge.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.exception.CollaboratorUnavailableException;
import com.purchasingpower.archiverag.knowledge.AuditSink;
import com.purchasingpower.archiverag.model.CallContext;
import com.purchasingpower.archiverag.model.ServiceType;
import com.purchasingpower.archiverag.model.audit.AuditRecord;
import com.purchasingpower.archiverag.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.regex.Pattern;

/**
 * Writes one {@code query-<id>.json} file per query. Existing files are never replaced.
 */
@Slf4j
@Component
public class FileAuditSink implements AuditSink {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]+");

    private final ObjectMapper objectMapper;
    private final Path directory;

    public FileAuditSink(ObjectMapper objectMapper, AppProperties appProperties) {
        this.objectMapper = objectMapper;
        this.directory = Paths.get(appProperties.getAudit().getDirectory());
    }

    @Override
    public Path append(String queryId, AuditRecord record) {
        Preconditions.checkNotNull(record, "Audit record cannot be null");
        Preconditions.checkArgument(queryId != null && SAFE_ID.matcher(queryId).matches(),
            "Invalid query id for audit entry: %s", queryId);

        Path file = directory.resolve("query-" + queryId + ".json");
        if (Files.exists(file)) {
            log.debug("Audit entry already present for {}", queryId);
            return file;
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.AUDIT, "append", log);
        ctx.logRequest(file.toString());

        try {
            Files.createDirectories(directory);
            try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, record);
            }
            ctx.logResponse(file.toString());
            return file;
        } catch (FileAlreadyExistsException e) {
            log.debug("Audit entry for {} written concurrently, keeping the first", queryId);
            return file;
        } catch (IOException e) {
            ctx.logError(e.getMessage(), e);
            throw new CollaboratorUnavailableException(ServiceType.AUDIT,
                "Failed to write audit entry " + file + ": " + e.getMessage(), e);
        }
    }
}
