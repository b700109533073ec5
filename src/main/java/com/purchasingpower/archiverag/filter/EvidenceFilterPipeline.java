package com.purchasingpower.archiverag.filter;

import com.purchasingpower.archiverag.core.EvidenceItem;
import com.purchasingpower.archiverag.core.Query;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the triggered filters in order: record id, whole word, date range.
 *
 * <p>Flags an anomaly when a non-empty evidence set is filtered down to nothing.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvidenceFilterPipeline {

    private final RecordIdFilter recordIdFilter;
    private final WholeWordEntityFilter wholeWordFilter;
    private final DateRangeFilter dateRangeFilter;

    public FilterOutcome apply(Query query, List<EvidenceItem> evidence) {
        List<EvidenceItem> current = evidence != null ? List.copyOf(evidence) : List.of();
        int originalCount = current.size();
        List<String> applied = new ArrayList<>();
        String emptiedBy = null;
        int undated = 0;

        for (EvidenceFilter filter : List.of(recordIdFilter, wholeWordFilter, dateRangeFilter)) {
            if (!filter.appliesTo(query)) {
                continue;
            }
            boolean wasNonEmpty = !current.isEmpty();
            if (filter == dateRangeFilter) {
                DateRangeFilter.Result result = dateRangeFilter.applyCounting(query, current);
                current = result.kept();
                undated = result.undated();
            } else {
                current = filter.apply(query, current);
            }
            applied.add(filter.name());
            if (wasNonEmpty && current.isEmpty() && emptiedBy == null) {
                emptiedBy = filter.name();
            }
        }

        boolean anomaly = originalCount > 0 && current.isEmpty();
        if (anomaly) {
            log.warn("⚠️ All {} evidence items were filtered out (last by '{}') for query: {}",
                originalCount, emptiedBy, query.getText());
        }

        return FilterOutcome.builder()
            .evidence(current)
            .originalCount(originalCount)
            .appliedFilters(List.copyOf(applied))
            .anomaly(anomaly)
            .anomalyFilter(anomaly ? emptiedBy : null)
            .undatedIncluded(undated)
            .build();
    }
}
