package com.purchasingpower.archiverag.verification;

import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.core.QueryOutcome;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What the evidence gate lets out: final answer text, citations and flags.
 */
@Value
@Builder
public class GateDecision {
    String answer;
    List<Citation> citations;
    boolean evidenceFound;
    QueryOutcome outcome;
    VerificationResult verification;

    public VerificationFailure getFailure() {
        return verification != null ? verification.getFailure() : null;
    }
}
