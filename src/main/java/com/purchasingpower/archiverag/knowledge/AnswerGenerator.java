package com.purchasingpower.archiverag.knowledge;

import com.purchasingpower.archiverag.core.EvidenceItem;

import java.util.List;

/**
 * Produces answer text from a question and the evidence that survived filtering.
 *
 * @since 1.0.0
 */
public interface AnswerGenerator {

    String generate(String queryText, List<EvidenceItem> evidence);

    /**
     * Identifier recorded in results and audit entries.
     */
    String modelVersion();
}
