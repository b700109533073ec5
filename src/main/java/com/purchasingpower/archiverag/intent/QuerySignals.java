package com.purchasingpower.archiverag.intent;

import lombok.Builder;
import lombok.Value;

/**
 * Keyword signals found in one query, computed once and shared by all rules.
 */
@Value
@Builder
public class QuerySignals {
    boolean topicKeyword;
    boolean decisionKeyword;
    boolean listingKeyword;
    boolean statisticalKeyword;
    boolean entityKindKeyword;
    boolean countingKeyword;
    boolean countingPhrase;
    boolean listingPhrase;
    boolean groupingMention;
    boolean dateReference;

    public boolean isScoped() {
        return groupingMention || dateReference;
    }
}
