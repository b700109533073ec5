/**
 * Core domain models for the archive query engine.
 *
 * <p>Contains the value types that flow through a query:
 * <ul>
 *   <li>Query - immutable request with parsed record/date hints</li>
 *   <li>EvidenceItem - retrieved excerpt plus source-record metadata</li>
 *   <li>Citation - evidence reference bound into an answer</li>
 *   <li>CanonicalEntity / MeetingRecord - entity store projections</li>
 *   <li>QueryResult - the verified outcome of one query</li>
 * </ul>
 *
 * <p>This package has no Spring dependencies.
 *
 * @since 1.0.0
 */
package com.purchasingpower.archiverag.core;
