package com.purchasingpower.archiverag.filter;

import com.purchasingpower.archiverag.core.EvidenceItem;
import com.purchasingpower.archiverag.core.Query;

import java.util.List;

/**
 * One narrowing step of the evidence pipeline. Filters only remove items; they never
 * reorder or change them.
 */
public interface EvidenceFilter {

    String name();

    boolean appliesTo(Query query);

    List<EvidenceItem> apply(Query query, List<EvidenceItem> evidence);
}
