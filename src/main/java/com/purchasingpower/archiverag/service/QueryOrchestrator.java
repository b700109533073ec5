package com.purchasingpower.archiverag.service;

import com.purchasingpower.archiverag.core.QueryResult;

/**
 * Entry point for archive questions.
 *
 * <p>Every result that leaves the orchestrator has passed the evidence gate and has been
 * written to the audit trail (or the audit failure has been logged).
 *
 * <pre>
 * QueryResult result = orchestrator.executeQuery("What topics did the Archives Workgroup discuss in March 2025?", "alice");
 * if (result.isEvidenceFound()) {
 *     result.getCitations().forEach(c -> ...);
 * }
 * </pre>
 *
 * @since 1.0.0
 */
public interface QueryOrchestrator {

    /**
     * Classifies a free-text question, answers it and verifies the answer.
     *
     * @param text question text
     * @param callerId caller identity, may be null
     * @throws com.purchasingpower.archiverag.exception.QueryValidationException for blank,
     *         too short or punctuation-only input, before any collaborator is called
     * @throws com.purchasingpower.archiverag.exception.QueryTimeoutException when answering
     *         takes longer than {@code app.query.timeout-seconds}
     * @throws com.purchasingpower.archiverag.exception.CollaboratorUnavailableException when
     *         the entity store, vector index or generation endpoint cannot be reached
     */
    QueryResult executeQuery(String text, String callerId);

    /**
     * Structured relationship lookup starting from a person, workgroup or meeting.
     *
     * @param kind {@code person}, {@code workgroup} or {@code meeting}
     * @param name entity name, or the meeting id for {@code meeting}
     * @param callerId caller identity, may be null
     */
    QueryResult executeRelationshipQuery(String kind, String name, String callerId);
}
