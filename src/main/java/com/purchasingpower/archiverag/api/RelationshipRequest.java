package com.purchasingpower.archiverag.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for the relationship endpoint.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelationshipRequest {

    /**
     * person, workgroup or meeting.
     */
    private String kind;

    /**
     * Entity name, or the meeting id when kind is meeting.
     */
    private String name;

    private String userId;
}
