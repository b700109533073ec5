package com.purchasingpower.archiverag.verification;

import lombok.Value;

/**
 * Outcome of {@link CitationVerifier#verify}. Derived per query, never persisted.
 */
@Value
public class VerificationResult {

    boolean verified;

    /**
     * Null when verified.
     */
    VerificationFailure failure;

    int citationCount;
    int validCitationCount;

    public static VerificationResult passed(int citationCount, int validCitationCount) {
        return new VerificationResult(true, null, citationCount, validCitationCount);
    }

    public static VerificationResult failed(VerificationFailure failure, int citationCount, int validCitationCount) {
        return new VerificationResult(false, failure, citationCount, validCitationCount);
    }

    /**
     * Explanation for the caller, empty when verified.
     */
    public String getMessage() {
        return failure != null ? failure.getUserMessage() : "";
    }
}
