package com.purchasingpower.archiverag.api;

import com.purchasingpower.archiverag.core.QueryResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Response from the query and relationship endpoints.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private boolean success;
    private String queryId;
    private String answer;
    private boolean evidenceFound;
    private String intent;
    private String outcome;
    private String failure;
    private String modelVersion;
    private long seed;
    private String timestamp;
    private String auditRecordPath;
    private String error;

    @Builder.Default
    private List<Citation> citations = new ArrayList<>();

    public static QueryResponse success(QueryResult result) {
        List<Citation> citations = new ArrayList<>();
        result.getCitations().forEach(c -> citations.add(Citation.builder()
            .recordId(c.getRecordId())
            .date(c.getDate())
            .groupingName(c.getGroupingName())
            .excerpt(c.getExcerpt())
            .build()));

        return QueryResponse.builder()
            .success(true)
            .queryId(result.getQueryId())
            .answer(result.getAnswer())
            .evidenceFound(result.isEvidenceFound())
            .intent(result.getIntent() != null ? result.getIntent().name() : null)
            .outcome(result.getOutcome() != null ? result.getOutcome().name() : null)
            .failure(result.getFailure() != null ? result.getFailure().getLabel() : null)
            .modelVersion(result.getModelVersion())
            .seed(result.getSeed())
            .timestamp(result.getTimestamp() != null ? result.getTimestamp().toString() : null)
            .auditRecordPath(result.getAuditRecordPath())
            .citations(citations)
            .build();
    }

    public static QueryResponse error(String error) {
        return QueryResponse.builder()
            .success(false)
            .error(error)
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Citation {
        private String recordId;
        private String date;
        private String groupingName;
        private String excerpt;
    }
}
