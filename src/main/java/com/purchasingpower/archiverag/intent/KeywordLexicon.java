package com.purchasingpower.archiverag.intent;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Keyword groups used by the intent rules. Every keyword matches on word boundaries,
 * so "counting" does not hit "count" and "listen" does not hit "list".
 */
public final class KeywordLexicon {

    public static final List<String> TOPIC = List.of(
        "topic", "topics", "discuss", "discussed", "discussion", "discussions");

    public static final List<String> DECISION = List.of("decision", "decisions", "decided");

    public static final List<String> LISTING = List.of("list", "show", "what", "which", "enumerate");

    public static final List<String> STATISTICAL = List.of(
        "average", "mean", "median", "min", "minimum", "max", "maximum",
        "trend", "trends", "statistics", "stats", "distribution");

    public static final List<String> ENTITY_KIND = List.of(
        "meeting", "meetings", "workgroup", "workgroups", "people", "person", "persons",
        "participant", "participants", "topic", "topics", "decision", "decisions");

    public static final List<String> COUNTING = List.of("count", "number", "total", "tally");

    public static final List<String> COUNTING_PHRASES = List.of("how many", "how much", "number of");

    public static final List<String> LISTING_PHRASES = List.of("list all", "show all", "list of", "all the");

    public static final List<String> GROUPING = List.of("workgroup", "workgroups", "working group", "guild");

    private static final Pattern TOPIC_PATTERN = compile(TOPIC);
    private static final Pattern DECISION_PATTERN = compile(DECISION);
    private static final Pattern LISTING_PATTERN = compile(LISTING);
    private static final Pattern STATISTICAL_PATTERN = compile(STATISTICAL);
    private static final Pattern ENTITY_KIND_PATTERN = compile(ENTITY_KIND);
    private static final Pattern COUNTING_PATTERN = compile(COUNTING);
    private static final Pattern COUNTING_PHRASE_PATTERN = compile(COUNTING_PHRASES);
    private static final Pattern LISTING_PHRASE_PATTERN = compile(LISTING_PHRASES);
    private static final Pattern GROUPING_PATTERN = compile(GROUPING);

    private KeywordLexicon() {
    }

    public static boolean hasTopicKeyword(String lower) {
        return TOPIC_PATTERN.matcher(lower).find();
    }

    public static boolean hasDecisionKeyword(String lower) {
        return DECISION_PATTERN.matcher(lower).find();
    }

    public static boolean hasListingKeyword(String lower) {
        return LISTING_PATTERN.matcher(lower).find();
    }

    public static boolean hasStatisticalKeyword(String lower) {
        return STATISTICAL_PATTERN.matcher(lower).find();
    }

    public static boolean hasEntityKindKeyword(String lower) {
        return ENTITY_KIND_PATTERN.matcher(lower).find();
    }

    public static boolean hasCountingKeyword(String lower) {
        return COUNTING_PATTERN.matcher(lower).find();
    }

    public static boolean hasCountingPhrase(String lower) {
        return COUNTING_PHRASE_PATTERN.matcher(lower).find();
    }

    public static boolean hasListingPhrase(String lower) {
        return LISTING_PHRASE_PATTERN.matcher(lower).find();
    }

    public static boolean hasGroupingWord(String lower) {
        return GROUPING_PATTERN.matcher(lower).find();
    }

    /**
     * Whole-word, case-insensitive containment of an arbitrary name.
     */
    public static boolean containsWord(String text, String word) {
        if (text == null || word == null || word.isBlank()) {
            return false;
        }
        return Pattern.compile("\\b" + Pattern.quote(word.trim()) + "\\b", Pattern.CASE_INSENSITIVE)
            .matcher(text)
            .find();
    }

    private static Pattern compile(List<String> words) {
        String alternation = words.stream()
            .map(w -> Pattern.quote(w).replace(" ", "\\E\\s+\\Q"))
            .reduce((a, b) -> a + "|" + b)
            .orElseThrow();
        return Pattern.compile("\\b(?:" + alternation + ")\\b", Pattern.CASE_INSENSITIVE);
    }
}
