package com.purchasingpower.archiverag.service.handler;

import com.purchasingpower.archiverag.core.IntentType;
import com.purchasingpower.archiverag.core.Query;
import com.purchasingpower.archiverag.quantitative.AggregateAnswer;
import com.purchasingpower.archiverag.quantitative.QuantitativeAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Answers counting and statistics questions from the entity store.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuantitativeQueryHandler implements QueryHandler {

    private final QuantitativeAggregator aggregator;

    @Override
    public IntentType intent() {
        return IntentType.QUANTITATIVE;
    }

    @Override
    public HandlerResult handle(Query query) {
        AggregateAnswer aggregate = aggregator.answer(query.getText(), null, query.getDateWindow());

        if (!aggregate.isSupported()) {
            String answer = aggregate.getAnswer() + " Supported questions: "
                + String.join(" ", aggregate.getSupportedQuestions());
            return HandlerResult.noEvidence(answer, "Unsupported quantitative question",
                HandlerResult.QUANTITATIVE_QUERY_MODEL);
        }
        if (aggregate.getCount() == 0 || aggregate.getCitations().isEmpty()) {
            return HandlerResult.noEvidence(aggregate.getAnswer(),
                "Nothing counted by " + aggregate.getMethod(), HandlerResult.QUANTITATIVE_QUERY_MODEL);
        }

        log.info("📊 {} = {} (source: {}, method: {})",
            aggregate.getQuestionType(), aggregate.getCount(), aggregate.getSource(), aggregate.getMethod());

        return HandlerResult.builder()
            .answer(aggregate.getAnswer())
            .citations(aggregate.getCitations())
            .modelVersion(HandlerResult.QUANTITATIVE_QUERY_MODEL)
            .requireEntityExtraction(false)
            .build();
    }
}
