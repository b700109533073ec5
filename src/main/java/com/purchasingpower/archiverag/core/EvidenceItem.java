package com.purchasingpower.archiverag.core;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * A retrieved excerpt plus its source-record metadata, not yet proven relevant.
 *
 * <p>Immutable; filters produce new lists and never change items in place.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class EvidenceItem {

    String recordId;

    /**
     * Meeting date, null when the retrieval collaborator did not supply one.
     */
    LocalDate date;

    String excerpt;
    double score;
    String groupingName;

    @Builder.Default
    ExtractionMetadata extraction = ExtractionMetadata.absent();

    public boolean hasContent() {
        return excerpt != null && !excerpt.isBlank();
    }
}
