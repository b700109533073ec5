package com.purchasingpower.archiverag.core;

public enum QueryOutcome {
    ANSWERED,
    NO_EVIDENCE,
    VERIFICATION_FAILED,
    ERROR
}
