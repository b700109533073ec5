package com.purchasingpower.archiverag.service.handler;

import com.purchasingpower.archiverag.core.Citation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Candidate answer from a handler, before the evidence gate.
 */
@Value
@Builder
public class HandlerResult {

    /**
     * Model version recorded for answers built from entity store records.
     */
    public static final String ENTITY_QUERY_MODEL = "entity-query";

    /**
     * Model version recorded for counts and statistics.
     */
    public static final String QUANTITATIVE_QUERY_MODEL = "quantitative-query";

    String answer;

    @Builder.Default
    List<Citation> citations = List.of();

    String modelVersion;

    boolean requireEntityExtraction;

    /**
     * True for free-text model answers; only these are checked for negative phrasing.
     */
    boolean generated;

    /**
     * False when the handler found nothing to answer from; the gate is skipped.
     */
    @Builder.Default
    boolean evidenceAvailable = true;

    String noEvidenceReason;

    public static HandlerResult noEvidence(String answer, String reason, String modelVersion) {
        return HandlerResult.builder()
            .answer(answer)
            .modelVersion(modelVersion)
            .evidenceAvailable(false)
            .noEvidenceReason(reason)
            .build();
    }
}
