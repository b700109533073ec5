package com.purchasingpower.archiverag.intent;

import com.purchasingpower.archiverag.core.IntentType;

import java.util.function.Predicate;

/**
 * A named predicate and the intent it selects.
 */
public record IntentRule(String name, Predicate<QuerySignals> predicate, IntentType intent) {

    public boolean matches(QuerySignals signals) {
        return predicate.test(signals);
    }
}
