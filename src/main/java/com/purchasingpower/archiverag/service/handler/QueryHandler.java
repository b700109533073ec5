package com.purchasingpower.archiverag.service.handler;

import com.purchasingpower.archiverag.core.IntentType;
import com.purchasingpower.archiverag.core.Query;

/**
 * Produces a candidate answer for one intent.
 */
public interface QueryHandler {

    IntentType intent();

    HandlerResult handle(Query query);
}
