package com.purchasingpower.archiverag.util;

import com.purchasingpower.archiverag.exception.QueryValidationException;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validates query text before any collaborator is touched.
 *
 * Rejected inputs:
 * - null, empty or whitespace only
 * - shorter than the minimum length once trimmed
 * - punctuation and symbols only ("???", "!!", "...")
 */
@Slf4j
public final class QueryInputValidator {

    public static final int DEFAULT_MIN_LENGTH = 3;

    private static final Pattern MEANINGFUL = Pattern.compile("[\\p{L}\\p{N}]");

    private QueryInputValidator() {
    }

    public static String validate(String query) {
        return validate(query, DEFAULT_MIN_LENGTH);
    }

    /**
     * @return the trimmed query text
     * @throws QueryValidationException with a message that suggests a better question
     */
    public static String validate(String query, int minLength) {
        if (query == null || query.isBlank()) {
            throw new QueryValidationException(
                "Please provide a question or query. Example: \"What decisions were made last January?\"",
                query);
        }

        String trimmed = query.trim();
        if (trimmed.length() < minLength) {
            throw new QueryValidationException(
                "Your query seems too short. Please provide more details. "
                    + "Example: \"What decisions were made in the Archives Workgroup?\"",
                query);
        }

        if (!MEANINGFUL.matcher(trimmed).find()) {
            log.warn("⚠️ Rejected query without letters or digits: {}", ExternalCallLogger.truncate(trimmed, 40));
            throw new QueryValidationException(
                "Please provide a meaningful question. Example: \"What is the tag taxonomy?\"",
                query);
        }

        return trimmed;
    }
}
