package com.purchasingpower.archiverag.knowledge;

import com.purchasingpower.archiverag.core.EvidenceItem;

import java.util.List;

/**
 * Semantic search over indexed meeting excerpts.
 *
 * @since 1.0.0
 */
public interface EvidenceRetriever {

    /**
     * @param queryText raw query text
     * @param topK maximum number of items
     * @return candidates ordered by relevance, best first; empty when nothing matched
     */
    List<EvidenceItem> search(String queryText, int topK);
}
