package com.purchasingpower.archiverag.intent;

import com.purchasingpower.archiverag.core.IntentType;
import com.purchasingpower.archiverag.filter.DateExpressionParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Picks the handler for a question with an ordered rule list; the first match wins.
 *
 * <ol>
 *   <li>topic: topic keyword, scoped by a workgroup or date</li>
 *   <li>decision-list: decision and listing keywords, scoped by a workgroup or date</li>
 *   <li>quantitative: statistics, counting or "list all" over an entity kind</li>
 *   <li>generic: everything else</li>
 * </ol>
 *
 * Relationship lookups are never inferred from text.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntentClassifier {

    public static final String FALLBACK_RULE = "generic";

    private static final List<IntentRule> RULES = List.of(
        new IntentRule("topic",
            s -> s.isTopicKeyword() && s.isScoped(),
            IntentType.TOPIC),
        new IntentRule("decision-list",
            s -> s.isDecisionKeyword() && s.isListingKeyword() && s.isScoped(),
            IntentType.DECISION_LIST),
        new IntentRule("quantitative",
            s -> s.isStatisticalKeyword()
                || (s.isEntityKindKeyword() && s.isCountingKeyword())
                || s.isCountingPhrase()
                || (s.isListingPhrase() && s.isEntityKindKeyword()),
            IntentType.QUANTITATIVE)
    );

    private final DateExpressionParser dateParser;

    public IntentDecision classify(String text, Collection<String> groupingNames) {
        QuerySignals signals = signals(text, groupingNames);
        for (IntentRule rule : RULES) {
            if (rule.matches(signals)) {
                log.info("🎯 Intent {} (rule '{}')", rule.intent(), rule.name());
                return new IntentDecision(rule.intent(), rule.name(), signals);
            }
        }
        log.info("🎯 Intent {} (rule '{}')", IntentType.GENERIC, FALLBACK_RULE);
        return new IntentDecision(IntentType.GENERIC, FALLBACK_RULE, signals);
    }

    public QuerySignals signals(String text, Collection<String> groupingNames) {
        String lower = text == null ? "" : text.toLowerCase();
        return QuerySignals.builder()
            .topicKeyword(KeywordLexicon.hasTopicKeyword(lower))
            .decisionKeyword(KeywordLexicon.hasDecisionKeyword(lower))
            .listingKeyword(KeywordLexicon.hasListingKeyword(lower))
            .statisticalKeyword(KeywordLexicon.hasStatisticalKeyword(lower))
            .entityKindKeyword(KeywordLexicon.hasEntityKindKeyword(lower))
            .countingKeyword(KeywordLexicon.hasCountingKeyword(lower))
            .countingPhrase(KeywordLexicon.hasCountingPhrase(lower))
            .listingPhrase(KeywordLexicon.hasListingPhrase(lower))
            .groupingMention(mentionsGrouping(lower, groupingNames))
            .dateReference(dateParser.hasDateReference(lower))
            .build();
    }

    public List<IntentRule> rules() {
        return RULES;
    }

    private static boolean mentionsGrouping(String lower, Collection<String> groupingNames) {
        if (KeywordLexicon.hasGroupingWord(lower)) {
            return true;
        }
        if (groupingNames == null) {
            return false;
        }
        return groupingNames.stream().anyMatch(name -> KeywordLexicon.containsWord(lower, name));
    }
}
