package com.purchasingpower.archiverag.knowledge;

import com.purchasingpower.archiverag.model.audit.AuditRecord;

import java.nio.file.Path;

/**
 * Append-only audit trail.
 *
 * @since 1.0.0
 */
public interface AuditSink {

    /**
     * Writes the record for a query id. Writing the same id twice keeps the first
     * entry and returns its location; existing entries are never overwritten.
     *
     * @return location of the entry
     */
    Path append(String queryId, AuditRecord record);
}
