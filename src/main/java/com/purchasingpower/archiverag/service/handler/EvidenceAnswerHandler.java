package com.purchasingpower.archiverag.service.handler;

import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.configuration.QueryProperties;
import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.core.EvidenceItem;
import com.purchasingpower.archiverag.core.IntentType;
import com.purchasingpower.archiverag.core.Query;
import com.purchasingpower.archiverag.filter.EvidenceFilterPipeline;
import com.purchasingpower.archiverag.filter.FilterOutcome;
import com.purchasingpower.archiverag.knowledge.AnswerGenerator;
import com.purchasingpower.archiverag.knowledge.EvidenceRetriever;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Generic path: retrieve, filter, generate, cite.
 */
@Slf4j
@Component
public class EvidenceAnswerHandler implements QueryHandler {

    private final EvidenceRetriever evidenceRetriever;
    private final EvidenceFilterPipeline filterPipeline;
    private final AnswerGenerator answerGenerator;
    private final QueryProperties properties;

    public EvidenceAnswerHandler(EvidenceRetriever evidenceRetriever,
                                 EvidenceFilterPipeline filterPipeline,
                                 AnswerGenerator answerGenerator,
                                 AppProperties appProperties) {
        this.evidenceRetriever = evidenceRetriever;
        this.filterPipeline = filterPipeline;
        this.answerGenerator = answerGenerator;
        this.properties = appProperties.getQuery();
    }

    @Override
    public IntentType intent() {
        return IntentType.GENERIC;
    }

    @Override
    public HandlerResult handle(Query query) {
        String modelVersion = answerGenerator.modelVersion();

        List<EvidenceItem> retrieved = evidenceRetriever.search(query.getText(), properties.getTopK());
        if (retrieved.stream().noneMatch(EvidenceItem::hasContent)) {
            log.info("No evidence retrieved for: {}", query.getText());
            return HandlerResult.noEvidence(null, "No matching meeting records", modelVersion);
        }

        FilterOutcome filtered = filterPipeline.apply(query, retrieved);
        if (filtered.isAnomaly()) {
            return HandlerResult.noEvidence(null,
                "All retrieved records were excluded by the " + filtered.getAnomalyFilter() + " filter",
                modelVersion);
        }
        List<EvidenceItem> evidence = filtered.getEvidence();
        if (evidence.stream().noneMatch(EvidenceItem::hasContent)) {
            return HandlerResult.noEvidence(null, "No matching meeting records", modelVersion);
        }

        String answer = answerGenerator.generate(query.getText(), evidence);
        List<Citation> citations = evidence.stream().map(Citation::fromEvidence).toList();

        log.info("💬 Generated answer from {} evidence items (filters: {})",
            evidence.size(), filtered.getAppliedFilters());

        return HandlerResult.builder()
            .answer(answer)
            .citations(citations)
            .modelVersion(modelVersion)
            .requireEntityExtraction(properties.isRequireEntityExtraction())
            .generated(true)
            .build();
    }
}
