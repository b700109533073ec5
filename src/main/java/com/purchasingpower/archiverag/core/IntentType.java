package com.purchasingpower.archiverag.core;

/**
 * Which handler answers a query.
 */
public enum IntentType {
    /** Topics discussed by a workgroup or in a period. */
    TOPIC,
    /** Decisions made by a workgroup or in a period. */
    DECISION_LIST,
    /** Counts and statistics read from the entity store. */
    QUANTITATIVE,
    /** Structured entity relationship lookup, requested directly by callers. */
    RELATIONSHIP,
    /** Evidence-grounded generated answer. */
    GENERIC
}
