package com.purchasingpower.archiverag.verification;

/**
 * Why a set of citations could not back an answer.
 */
public enum VerificationFailure {

    MISSING_CITATIONS("missing citations",
        "No citations found. The query did not retrieve any specific meeting records to support the answer. "
            + "Please try rephrasing your question or using more specific search terms."),

    INVALID_CITATIONS("invalid citations",
        "No valid citations found. The query retrieved results, but they don't reference specific meeting records. "
            + "Please try different search terms, or check whether the relevant meetings have been indexed."),

    MISSING_ENTITY_EXTRACTION("missing entity extraction",
        "Citations lack entity extraction verification. The query found meeting records, but they carry no "
            + "entity extraction metadata to verify the information. Please contact an administrator if this persists.");

    private final String label;
    private final String userMessage;

    VerificationFailure(String label, String userMessage) {
        this.label = label;
        this.userMessage = userMessage;
    }

    public String getLabel() {
        return label;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
