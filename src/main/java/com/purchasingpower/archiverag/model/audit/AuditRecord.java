package com.purchasingpower.archiverag.model.audit;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.core.QueryResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted projection of a query result, one file per query id.
 *
 * <p>The JSON shape is a stable contract read by compliance tooling; add nothing
 * here without a migration plan for existing readers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"queryId", "answer", "citations", "evidenceFound", "modelVersion", "timestamp"})
public class AuditRecord {

    private String queryId;
    private String answer;

    @Builder.Default
    private List<CitationEntry> citations = new ArrayList<>();

    private boolean evidenceFound;
    private String modelVersion;

    /**
     * ISO-8601 instant.
     */
    private String timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonPropertyOrder({"recordId", "date", "groupingName", "excerpt"})
    public static class CitationEntry {
        private String recordId;
        private String date;
        private String groupingName;
        private String excerpt;

        public static CitationEntry from(Citation citation) {
            return CitationEntry.builder()
                .recordId(citation.getRecordId())
                .date(citation.getDate())
                .groupingName(citation.getGroupingName())
                .excerpt(citation.getExcerpt())
                .build();
        }
    }

    public static AuditRecord from(QueryResult result) {
        List<CitationEntry> entries = new ArrayList<>();
        for (Citation citation : result.getCitations()) {
            entries.add(CitationEntry.from(citation));
        }
        return AuditRecord.builder()
            .queryId(result.getQueryId())
            .answer(result.getAnswer())
            .citations(entries)
            .evidenceFound(result.isEvidenceFound())
            .modelVersion(result.getModelVersion())
            .timestamp(result.getTimestamp() != null ? result.getTimestamp().toString() : null)
            .build();
    }
}
