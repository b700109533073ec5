package com.purchasingpower.archiverag.filter;

import com.purchasingpower.archiverag.core.EvidenceItem;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Evidence left after the pipeline, plus what happened to it.
 */
@Value
@Builder
public class FilterOutcome {

    @Builder.Default
    List<EvidenceItem> evidence = List.of();

    int originalCount;

    @Builder.Default
    List<String> appliedFilters = List.of();

    /**
     * Every item of a non-empty input was removed.
     */
    boolean anomaly;

    /**
     * Filter that removed the last item, when {@link #anomaly} is set.
     */
    String anomalyFilter;

    /**
     * Undated evidence kept by the date filter.
     */
    int undatedIncluded;
}
