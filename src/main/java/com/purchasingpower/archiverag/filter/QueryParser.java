package com.purchasingpower.archiverag.filter;

import com.purchasingpower.archiverag.core.Query;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link Query} with the record and date hints found in its text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryParser {

    public static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s<>\"{}|\\\\^`\\[\\]]+");

    public static final Pattern UUID_PATTERN = Pattern.compile(
        "\\b[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}\\b", Pattern.CASE_INSENSITIVE);

    private final DateExpressionParser dateParser;

    public Query parse(String text, String callerId) {
        return Query.builder()
            .text(text)
            .callerId(callerId)
            .recordIdHint(extractRecordId(text).orElse(null))
            .dateWindow(dateParser.parse(text).orElse(null))
            .build();
    }

    public static Optional<String> extractUrl(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = URL_PATTERN.matcher(text);
        return matcher.find() ? Optional.of(matcher.group()) : Optional.empty();
    }

    public Optional<UUID> extractRecordId(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = UUID_PATTERN.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        UUID id = UUID.fromString(matcher.group());
        log.info("Record id found in query: {}", id);
        return Optional.of(id);
    }
}
