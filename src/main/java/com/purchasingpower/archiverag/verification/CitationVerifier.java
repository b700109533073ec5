package com.purchasingpower.archiverag.verification;

import com.purchasingpower.archiverag.core.Citation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Checks that an answer is backed by citations to real meeting records.
 *
 * <p>Checks run in order and the first failure wins:
 * <ol>
 *   <li>no citations at all</li>
 *   <li>no citation with a well-formed, non-sentinel record id</li>
 *   <li>extraction required, but no valid citation carries extraction metadata</li>
 * </ol>
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class CitationVerifier {

    public VerificationResult verify(List<Citation> citations, boolean requireEntityExtraction) {
        if (citations == null || citations.isEmpty()) {
            log.info("❌ Verification failed: no citations");
            return VerificationResult.failed(VerificationFailure.MISSING_CITATIONS, 0, 0);
        }

        List<Citation> valid = citations.stream().filter(Citation::isValid).toList();
        if (valid.isEmpty()) {
            log.info("❌ Verification failed: none of {} citations references a meeting record", citations.size());
            return VerificationResult.failed(VerificationFailure.INVALID_CITATIONS, citations.size(), 0);
        }

        if (requireEntityExtraction) {
            long withExtraction = valid.stream()
                .filter(c -> c.getExtraction() != null && c.getExtraction().hasExtraction())
                .count();
            if (withExtraction == 0) {
                log.info("❌ Verification failed: {} valid citations, none with entity extraction", valid.size());
                return VerificationResult.failed(
                    VerificationFailure.MISSING_ENTITY_EXTRACTION, citations.size(), valid.size());
            }
            log.info("✅ Citations verified: total={}, valid={}, withExtraction={}",
                citations.size(), valid.size(), withExtraction);
            return VerificationResult.passed(citations.size(), valid.size());
        }

        log.info("✅ Citations verified: total={}, valid={}", citations.size(), valid.size());
        return VerificationResult.passed(citations.size(), valid.size());
    }
}
