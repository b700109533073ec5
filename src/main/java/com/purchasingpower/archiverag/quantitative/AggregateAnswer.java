package com.purchasingpower.archiverag.quantitative;

import com.purchasingpower.archiverag.core.Citation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Count or statistic with the data source and method that produced it.
 */
@Value
@Builder
public class AggregateAnswer {

    String answer;
    QuestionType questionType;
    int count;

    /**
     * Distinct meetings in the external source, when one was consulted.
     */
    Integer uniqueCount;

    /**
     * Computed statistic (average, median, ...) when the question asks for one.
     */
    Double value;

    String source;
    String method;

    @Builder.Default
    List<Citation> citations = List.of();

    Discrepancy discrepancy;

    @Builder.Default
    List<String> supportedQuestions = List.of();

    public boolean isSupported() {
        return questionType != QuestionType.UNSUPPORTED;
    }
}
