package com.purchasingpower.archiverag.core;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of entity a relationship lookup starts from.
 */
public enum RelationshipSubject {
    PERSON,
    WORKGROUP,
    MEETING;

    public static Optional<RelationshipSubject> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
