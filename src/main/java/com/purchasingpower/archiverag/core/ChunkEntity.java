package com.purchasingpower.archiverag.core;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Entity mention carried in a chunk's extraction metadata.
 */
@Value
@Builder
public class ChunkEntity {
    String entityId;
    String entityType;
    String normalizedName;

    @Builder.Default
    List<String> mentions = List.of();
}
