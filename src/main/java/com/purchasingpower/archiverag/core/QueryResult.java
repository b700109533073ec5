package com.purchasingpower.archiverag.core;

import com.purchasingpower.archiverag.verification.VerificationFailure;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Final answer leaving the orchestrator.
 *
 * <p>When {@code evidenceFound} is true the citation list is non-empty and every
 * citation is a valid record reference. A negative answer carries at most the
 * {@code no-evidence} marker.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class QueryResult {

    String queryId;
    String userInput;
    String userId;
    String answer;

    @Builder.Default
    List<Citation> citations = List.of();

    boolean evidenceFound;
    IntentType intent;
    long seed;

    /**
     * Path of the audit entry, null when the audit write failed.
     */
    String auditRecordPath;

    String modelVersion;
    Instant timestamp;
    QueryOutcome outcome;

    /**
     * Set only when {@code outcome} is {@link QueryOutcome#VERIFICATION_FAILED}.
     */
    VerificationFailure failure;

    public long validCitationCount() {
        return citations.stream().filter(Citation::isValid).count();
    }
}
