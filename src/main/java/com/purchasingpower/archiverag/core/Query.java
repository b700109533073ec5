package com.purchasingpower.archiverag.core;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * Immutable query input. Created per request; only its audit projection is persisted.
 *
 * @since 1.0.0
 */
@Value
@Builder
public class Query {

    String text;
    String callerId;

    /**
     * Explicit record identifier found in the text, if any.
     */
    UUID recordIdHint;

    /**
     * Date window found in the text, if any.
     */
    DateWindow dateWindow;

    public Optional<UUID> recordHint() {
        return Optional.ofNullable(recordIdHint);
    }

    public Optional<DateWindow> window() {
        return Optional.ofNullable(dateWindow);
    }

    public String lowerText() {
        return text == null ? "" : text.toLowerCase();
    }
}
