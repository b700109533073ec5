package com.purchasingpower.archiverag.verification;

import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.core.QueryOutcome;
import com.purchasingpower.archiverag.core.RecordIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Last step before a result leaves the system.
 *
 * <p>A result is marked as having evidence only when the answer is not negative and the
 * citations verify; the released citations are then exactly the valid ones. Anything else
 * goes out with evidence-found false and a {@code no-evidence} marker.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvidenceGate {

    public static final String NO_EVIDENCE_MESSAGE = "No evidence found";

    private final NegativeResponseDetector negativeResponseDetector;
    private final CitationVerifier citationVerifier;

    /**
     * Gates a generated answer, including the negative phrasing check.
     */
    public GateDecision decide(String answer, List<Citation> citations, boolean requireEntityExtraction) {
        return decide(answer, citations, requireEntityExtraction, true);
    }

    /**
     * @param answer candidate answer text
     * @param citations candidate citations, in answer order
     * @param requireEntityExtraction whether valid citations must carry extraction metadata
     * @param generated whether the answer is model text; answers built from entity records
     *                  may start with a name such as "No Code Guild" and skip the negative check
     */
    public GateDecision decide(String answer, List<Citation> citations, boolean requireEntityExtraction,
                               boolean generated) {
        List<Citation> candidates = citations != null ? citations : List.of();

        if (generated && negativeResponseDetector.isNegative(answer)) {
            List<Citation> markers = new ArrayList<>(negativeResponseDetector.filterCitations(candidates, answer)
                .stream()
                .filter(c -> RecordIds.NO_EVIDENCE.equals(c.getRecordId()))
                .toList());
            if (markers.isEmpty()) {
                markers.add(Citation.noEvidence(NO_EVIDENCE_MESSAGE));
            }
            String text = answer == null || answer.isBlank() ? NO_EVIDENCE_MESSAGE : answer;
            return GateDecision.builder()
                .answer(text)
                .citations(List.copyOf(markers))
                .evidenceFound(false)
                .outcome(QueryOutcome.NO_EVIDENCE)
                .build();
        }

        VerificationResult verification = citationVerifier.verify(candidates, requireEntityExtraction);
        if (!verification.isVerified()) {
            log.warn("⚠️ Answer withheld: {} ({} citations, {} valid)",
                verification.getFailure().getLabel(),
                verification.getCitationCount(),
                verification.getValidCitationCount());
            return GateDecision.builder()
                .answer(verification.getMessage())
                .citations(List.of(Citation.noEvidence(verification.getFailure().getLabel())))
                .evidenceFound(false)
                .outcome(QueryOutcome.VERIFICATION_FAILED)
                .verification(verification)
                .build();
        }

        List<Citation> valid = candidates.stream().filter(Citation::isValid).toList();
        return GateDecision.builder()
            .answer(answer)
            .citations(valid)
            .evidenceFound(true)
            .outcome(QueryOutcome.ANSWERED)
            .verification(verification)
            .build();
    }

    /**
     * Result for a query that produced no usable evidence before generation.
     *
     * @param answer explanation for the caller, defaults to {@value #NO_EVIDENCE_MESSAGE}
     * @param reason recorded on the {@code no-evidence} marker
     */
    public GateDecision noEvidence(String answer, String reason) {
        return GateDecision.builder()
            .answer(answer == null || answer.isBlank() ? NO_EVIDENCE_MESSAGE : answer)
            .citations(List.of(Citation.noEvidence(reason)))
            .evidenceFound(false)
            .outcome(QueryOutcome.NO_EVIDENCE)
            .build();
    }
}
