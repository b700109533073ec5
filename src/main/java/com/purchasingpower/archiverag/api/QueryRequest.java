package com.purchasingpower.archiverag.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for the query endpoint.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    /**
     * The question, in natural language.
     */
    private String query;

    /**
     * Caller identity (optional).
     */
    private String userId;
}
