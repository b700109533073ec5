package com.purchasingpower.archiverag.util;

import com.purchasingpower.archiverag.model.CallContext;
import com.purchasingpower.archiverag.model.ServiceType;
import org.slf4j.Logger;

/**
 * Single entry point for collaborator call logging (entity store, vector index, LLM, audit).
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Shortens long text for log lines.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
