/**
 * Collaborator boundaries of the query engine.
 *
 * <p>The engine consumes these interfaces and never depends on how they are backed:
 * <ul>
 *   <li>{@code EntityStore} - authoritative people, workgroups, topics and meetings</li>
 *   <li>{@code EvidenceRetriever} - nearest-neighbour search over meeting excerpts</li>
 *   <li>{@code AnswerGenerator} - language-model answer generation</li>
 *   <li>{@code AuditSink} - append-only audit trail, one entry per query</li>
 * </ul>
 *
 * <p>{@code impl} holds the file and HTTP adapters wired by default.
 *
 * @since 1.0.0
 */
package com.purchasingpower.archiverag.knowledge;
