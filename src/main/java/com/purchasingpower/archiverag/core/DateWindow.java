package com.purchasingpower.archiverag.core;

import lombok.Value;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * Inclusive-exclusive date range {@code [start, end)} extracted from query text.
 */
@Value
public class DateWindow {

    LocalDate start;
    LocalDate end;

    /**
     * Year as written in the query, null when only a month was given.
     */
    Integer year;

    /**
     * Month (1-12) as written in the query, null when only a year was given.
     */
    Integer month;

    public boolean contains(LocalDate date) {
        return date != null && !date.isBefore(start) && date.isBefore(end);
    }

    public String describe() {
        if (month != null) {
            return start.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH)
                + " " + start.getYear();
        }
        return String.valueOf(start.getYear());
    }
}
