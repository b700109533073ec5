package com.purchasingpower.archiverag.verification;

import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Recognizes answers that say nothing was found ("X was not mentioned in the meetings"),
 * even when the retriever returned excerpts.
 */
@Slf4j
@Component
public class NegativeResponseDetector {

    private static final List<Pattern> NEGATIVE_PATTERNS = List.of(
        "no\\s+specific\\s+mention",
        "not\\s+mentioned",
        "no\\s+mention",
        "not\\s+found",
        "no\\s+information",
        "could\\s+not\\s+find",
        "does\\s+not\\s+appear",
        "not\\s+discussed",
        "not\\s+referenced",
        "no\\s+reference",
        "not\\s+present",
        "no\\s+evidence",
        "no\\s+relevant",
        "nothing\\s+about",
        "no\\s+details\\s+about",
        "not\\s+included",
        "not\\s+covered"
    ).stream().map(Pattern::compile).toList();

    private static final Pattern LEADING_NEGATION =
        Pattern.compile("^(?:no|there\\s+(?:is|are|was|were)\\s+no)\\b");

    public boolean isNegative(String answer) {
        if (answer == null || answer.isBlank()) {
            return true;
        }
        String lower = answer.trim().toLowerCase();

        for (Pattern pattern : NEGATIVE_PATTERNS) {
            if (pattern.matcher(lower).find()) {
                log.info("Negative response ({}): {}", pattern.pattern(), ExternalCallLogger.truncate(answer, 100));
                return true;
            }
        }
        if (LEADING_NEGATION.matcher(lower).find()) {
            log.info("Negative response (leading negation): {}", ExternalCallLogger.truncate(answer, 100));
            return true;
        }
        return false;
    }

    /**
     * Keeps only sentinel citations for a negative answer; other answers keep everything.
     */
    public List<Citation> filterCitations(List<Citation> citations, String answer) {
        if (!isNegative(answer)) {
            return citations;
        }
        List<Citation> sentinels = citations.stream().filter(Citation::isSentinel).toList();
        log.info("Dropped {} citations for negative answer, kept {} markers",
            citations.size() - sentinels.size(), sentinels.size());
        return sentinels;
    }
}
