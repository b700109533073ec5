package com.purchasingpower.archiverag.core;

import lombok.Builder;
import lombok.Value;

/**
 * Evidence reference bound into a final answer: {@code [recordId | date | groupingName]}.
 *
 * <p>Only counts as proof when {@link #isValid()} holds.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class Citation {

    private static final int MAX_EXCERPT_LENGTH = 200;

    String recordId;

    /**
     * ISO date (yyyy-MM-dd) or empty when unknown.
     */
    @Builder.Default
    String date = "";

    String groupingName;

    @Builder.Default
    String excerpt = "";

    @Builder.Default
    ExtractionMetadata extraction = ExtractionMetadata.absent();

    public boolean isSentinel() {
        return RecordIds.isSentinel(recordId);
    }

    public boolean isValid() {
        return RecordIds.isValidRecord(recordId);
    }

    public static Citation noEvidence(String reason) {
        return Citation.builder()
            .recordId(RecordIds.NO_EVIDENCE)
            .groupingName("No evidence")
            .excerpt(reason != null ? reason : "")
            .build();
    }

    public static Citation fromEvidence(EvidenceItem item) {
        return Citation.builder()
            .recordId(item.getRecordId())
            .date(item.getDate() != null ? item.getDate().toString() : "")
            .groupingName(item.getGroupingName() != null ? item.getGroupingName() : "Unknown Workgroup")
            .excerpt(truncate(item.getExcerpt()))
            .extraction(item.getExtraction() != null ? item.getExtraction() : ExtractionMetadata.absent())
            .build();
    }

    public static String truncate(String excerpt) {
        if (excerpt == null) {
            return "";
        }
        return excerpt.length() > MAX_EXCERPT_LENGTH
            ? excerpt.substring(0, MAX_EXCERPT_LENGTH) + "..."
            : excerpt;
    }
}
