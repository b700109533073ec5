package com.purchasingpower.archiverag.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Entity-extraction metadata attached to evidence and citations.
 *
 * <p>Either present or absent; absent metadata is a normal state and means
 * "no extraction metadata", never an error. Use {@link #absent()} instead of null.
 *
 * @since 1.0.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ExtractionMetadata {

    private static final ExtractionMetadata ABSENT =
        new ExtractionMetadata(false, null, List.of(), List.of());

    boolean present;

    /**
     * Semantic chunk classification (meeting_summary, decision_record, action_item, ...).
     */
    String chunkType;

    List<ChunkEntity> entities;
    List<ChunkRelationship> relationships;

    public static ExtractionMetadata absent() {
        return ABSENT;
    }

    public static ExtractionMetadata of(String chunkType,
                                        List<ChunkEntity> entities,
                                        List<ChunkRelationship> relationships) {
        return new ExtractionMetadata(
            true,
            chunkType,
            entities != null ? List.copyOf(entities) : List.of(),
            relationships != null ? List.copyOf(relationships) : List.of());
    }

    public static ExtractionMetadata ofChunkType(String chunkType) {
        return of(chunkType, List.of(), List.of());
    }

    /**
     * True when a non-blank classification or at least one mentioned entity is present.
     * Relationships alone do not count.
     */
    public boolean hasExtraction() {
        if (!present) {
            return false;
        }
        boolean hasChunkType = chunkType != null && !chunkType.isBlank();
        boolean hasEntities = entities != null && !entities.isEmpty();
        return hasChunkType || hasEntities;
    }
}
