package com.purchasingpower.archiverag.knowledge.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.model.audit.AuditRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("File Audit Sink Tests")
class FileAuditSinkTest {

    @TempDir
    Path auditDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FileAuditSink sink;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getAudit().setDirectory(auditDir.resolve("audit_logs").toString());
        sink = new FileAuditSink(objectMapper, properties);
    }

    private static AuditRecord record(String queryId, String answer) {
        return AuditRecord.builder()
            .queryId(queryId)
            .answer(answer)
            .citations(List.of(AuditRecord.CitationEntry.builder()
                .recordId("0f8fad5b-d9cb-469f-a165-70867728950e")
                .date("2025-03-04")
                .groupingName("Archives Workgroup")
                .excerpt("Adopted the tag taxonomy")
                .build()))
            .evidenceFound(true)
            .modelVersion("qwen2.5-coder:7b")
            .timestamp("2025-06-15T12:00:00Z")
            .build();
    }

    @Test
    @DisplayName("Should write one JSON file per query with the stable field set")
    void append_ShouldWriteAuditFile() throws Exception {
        Path path = sink.append("q-1", record("q-1", "The taxonomy was adopted."));

        assertThat(path.getFileName().toString()).isEqualTo("query-q-1.json");
        JsonNode json = objectMapper.readTree(Files.readString(path));
        List<String> fields = new ArrayList<>();
        json.fieldNames().forEachRemaining(fields::add);
        assertThat(fields).containsExactly(
            "queryId", "answer", "citations", "evidenceFound", "modelVersion", "timestamp");
        assertThat(json.get("citations").get(0).get("groupingName").asText()).isEqualTo("Archives Workgroup");
    }

    @Test
    @DisplayName("Appending the same id twice keeps the first entry")
    void append_ShouldNeverOverwrite() throws Exception {
        Path first = sink.append("q-2", record("q-2", "first"));
        Path second = sink.append("q-2", record("q-2", "second"));

        assertThat(second).isEqualTo(first);
        assertThat(objectMapper.readTree(Files.readString(first)).get("answer").asText()).isEqualTo("first");
    }

    @Test
    @DisplayName("Ids that are not safe file names are rejected")
    void append_ShouldRejectUnsafeIds() {
        assertThatThrownBy(() -> sink.append("../escape", record("x", "y")))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
