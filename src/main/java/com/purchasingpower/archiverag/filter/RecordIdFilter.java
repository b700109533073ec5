package com.purchasingpower.archiverag.filter;

import com.purchasingpower.archiverag.core.EvidenceItem;
import com.purchasingpower.archiverag.core.Query;
import com.purchasingpower.archiverag.core.RecordIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Keeps only evidence from the record named in the question.
 * Ids are compared as UUID values, so case and formatting do not matter.
 */
@Slf4j
@Component
public class RecordIdFilter implements EvidenceFilter {

    @Override
    public String name() {
        return "record-id";
    }

    @Override
    public boolean appliesTo(Query query) {
        return query.recordHint().isPresent();
    }

    @Override
    public List<EvidenceItem> apply(Query query, List<EvidenceItem> evidence) {
        UUID recordId = query.getRecordIdHint();
        List<EvidenceItem> kept = evidence.stream()
            .filter(item -> RecordIds.sameRecord(item.getRecordId(), recordId))
            .toList();

        if (kept.size() < evidence.size()) {
            log.info("🔍 Record filter {}: {} -> {} items", recordId, evidence.size(), kept.size());
        }
        return kept;
    }
}
