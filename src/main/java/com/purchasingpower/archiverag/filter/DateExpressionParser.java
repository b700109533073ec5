package com.purchasingpower.archiverag.filter;

import com.purchasingpower.archiverag.core.DateWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds a year and/or month in free text and turns it into a {@code [start, end)} window.
 *
 * <ul>
 *   <li>"March 2025" - March 2025</li>
 *   <li>"in 2025" - the whole year</li>
 *   <li>"meetings in March" - March of the current year</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class DateExpressionParser {

    private static final Pattern YEAR = Pattern.compile("\\b(?:19|20)\\d{2}\\b");

    private static final Map<String, Integer> MONTHS = new LinkedHashMap<>();

    static {
        MONTHS.put("january", 1);
        MONTHS.put("jan", 1);
        MONTHS.put("february", 2);
        MONTHS.put("feb", 2);
        MONTHS.put("march", 3);
        MONTHS.put("mar", 3);
        MONTHS.put("april", 4);
        MONTHS.put("apr", 4);
        MONTHS.put("may", 5);
        MONTHS.put("june", 6);
        MONTHS.put("jun", 6);
        MONTHS.put("july", 7);
        MONTHS.put("jul", 7);
        MONTHS.put("august", 8);
        MONTHS.put("aug", 8);
        MONTHS.put("september", 9);
        MONTHS.put("sept", 9);
        MONTHS.put("sep", 9);
        MONTHS.put("october", 10);
        MONTHS.put("oct", 10);
        MONTHS.put("november", 11);
        MONTHS.put("nov", 11);
        MONTHS.put("december", 12);
        MONTHS.put("dec", 12);
    }

    private static final Pattern MONTH = Pattern.compile(
        "\\b(" + String.join("|", MONTHS.keySet()) + ")\\b", Pattern.CASE_INSENSITIVE);

    private final Clock clock;

    public Optional<DateWindow> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        // years inside links ("/2025/meetings.json") or record ids are not date references
        text = QueryParser.URL_PATTERN.matcher(text).replaceAll(" ");
        text = QueryParser.UUID_PATTERN.matcher(text).replaceAll(" ");

        Integer year = null;
        Matcher yearMatcher = YEAR.matcher(text);
        if (yearMatcher.find()) {
            year = Integer.parseInt(yearMatcher.group());
        }

        Integer month = null;
        Matcher monthMatcher = MONTH.matcher(text);
        if (monthMatcher.find()) {
            month = MONTHS.get(monthMatcher.group(1).toLowerCase());
        }

        if (year == null && month == null) {
            return Optional.empty();
        }

        LocalDate start;
        LocalDate end;
        if (month != null) {
            int effectiveYear = year != null ? year : LocalDate.now(clock).getYear();
            start = LocalDate.of(effectiveYear, month, 1);
            end = start.plusMonths(1);
        } else {
            start = LocalDate.of(year, 1, 1);
            end = start.plusYears(1);
        }
        return Optional.of(new DateWindow(start, end, year, month));
    }

    public boolean hasDateReference(String text) {
        return parse(text).isPresent();
    }
}
