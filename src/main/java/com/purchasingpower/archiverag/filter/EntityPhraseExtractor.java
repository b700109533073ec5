package com.purchasingpower.archiverag.filter;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls candidate entity names out of questions like "What was said about AGI?".
 *
 * <p>Lead-in words match in any case; the captured name must be a run of capitalized
 * or all-caps words, so ordinary lower-case words are never taken for names.
 */
@Component
public class EntityPhraseExtractor {

    private static final String NAME_RUN = "([A-Z][A-Za-z0-9]+(?:\\s+[A-Z][A-Za-z0-9]+)*)";

    private static final Pattern TRIGGER = Pattern.compile(
        "what\\s+was\\s+said\\s+about"
            + "|tell\\s+me\\s+about"
            + "|what\\s+about"
            + "|mentioned\\s+about"
            + "|discussed\\s+about"
            + "|talked\\s+about",
        Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> PHRASE_PATTERNS = List.of(
        Pattern.compile("(?i:(?:said|mentioned|discussed|talked)\\s+about)\\s+" + NAME_RUN),
        Pattern.compile("(?i:\\b(?:about|regarding|concerning))\\s+" + NAME_RUN),
        Pattern.compile("[\"']" + NAME_RUN + "[\"']"),
        Pattern.compile("^" + "([A-Z][A-Za-z0-9]+)" + "\\s+(?:was|is|are)\\b")
    );

    private static final Set<String> STOP_WORDS = Set.of(
        "the", "a", "an", "this", "that", "these", "those",
        "what", "who", "when", "where", "why", "how");

    private static final int MIN_PHRASE_LENGTH = 2;

    /**
     * True when the question asks about a named thing and whole-word matching should apply.
     */
    public boolean isTriggered(String query) {
        return query != null && TRIGGER.matcher(query).find();
    }

    /**
     * Distinct phrases in order of first appearance.
     */
    public List<String> extract(String query) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String text = query.trim();

        Set<String> phrases = new LinkedHashSet<>();
        for (Pattern pattern : PHRASE_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String phrase = matcher.group(1).trim();
                if (phrase.length() >= MIN_PHRASE_LENGTH && !STOP_WORDS.contains(phrase.toLowerCase(Locale.ROOT))) {
                    phrases.add(phrase);
                }
            }
        }
        return new ArrayList<>(phrases);
    }
}
