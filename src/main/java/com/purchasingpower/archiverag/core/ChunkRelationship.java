package com.purchasingpower.archiverag.core;

/**
 * Relationship triple attached to a chunk, e.g. {@code Person attended Meeting}.
 */
public record ChunkRelationship(String subject, String relationship, String object) {
}
