package com.purchasingpower.archiverag.filter;

import com.purchasingpower.archiverag.core.DateWindow;
import com.purchasingpower.archiverag.core.EvidenceItem;
import com.purchasingpower.archiverag.core.MeetingRecord;
import com.purchasingpower.archiverag.core.Query;
import com.purchasingpower.archiverag.core.RecordIds;
import com.purchasingpower.archiverag.exception.CollaboratorUnavailableException;
import com.purchasingpower.archiverag.knowledge.EntityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Keeps evidence dated inside the window named in the question.
 *
 * <p>Evidence without a date takes it from the meeting record. Evidence whose date still
 * cannot be determined is kept (fail open) and counted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DateRangeFilter implements EvidenceFilter {

    private final EntityStore entityStore;

    @Override
    public String name() {
        return "date-range";
    }

    @Override
    public boolean appliesTo(Query query) {
        return query.window().isPresent();
    }

    @Override
    public List<EvidenceItem> apply(Query query, List<EvidenceItem> evidence) {
        return applyCounting(query, evidence).kept();
    }

    Result applyCounting(Query query, List<EvidenceItem> evidence) {
        DateWindow window = query.getDateWindow();
        List<EvidenceItem> kept = new ArrayList<>();
        int undated = 0;
        int removed = 0;

        for (EvidenceItem item : evidence) {
            Optional<LocalDate> date = dateOf(item);
            if (date.isEmpty()) {
                log.debug("Keeping undated evidence {} (date unknown)", item.getRecordId());
                kept.add(item);
                undated++;
            } else if (window.contains(date.get())) {
                kept.add(item);
            } else {
                removed++;
                log.debug("Dropped {} dated {} outside [{}, {})",
                    item.getRecordId(), date.get(), window.getStart(), window.getEnd());
            }
        }

        if (removed > 0) {
            log.info("🔍 Date filter {}: {} -> {} items ({} undated kept)",
                window.describe(), evidence.size(), kept.size(), undated);
        }
        return new Result(kept, undated);
    }

    private Optional<LocalDate> dateOf(EvidenceItem item) {
        if (item.getDate() != null) {
            return Optional.of(item.getDate());
        }
        Optional<UUID> id = RecordIds.canonical(item.getRecordId());
        if (id.isEmpty()) {
            return Optional.empty();
        }
        try {
            return entityStore.getMeeting(id.get()).map(MeetingRecord::getDate);
        } catch (CollaboratorUnavailableException e) {
            log.debug("Date lookup failed for {}: {}", id.get(), e.getMessage());
            return Optional.empty();
        }
    }

    record Result(List<EvidenceItem> kept, int undated) {
    }
}
