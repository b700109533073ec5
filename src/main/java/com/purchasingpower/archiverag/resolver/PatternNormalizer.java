package com.purchasingpower.archiverag.resolver;

import com.google.common.base.Preconditions;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Removes decorative name parts ("Stephen [QADAO]", "Alice (Archives)", "Bob - SNET")
 * with an ordered list of case-insensitive regex rules, then collapses whitespace.
 */
public class PatternNormalizer {

    private final List<Pattern> rules;

    public PatternNormalizer(List<String> patternRules) {
        Preconditions.checkNotNull(patternRules, "patternRules");
        this.rules = patternRules.stream()
            .map(rule -> Pattern.compile(rule, Pattern.CASE_INSENSITIVE))
            .toList();
    }

    public String normalize(String name) {
        String normalized = name == null ? "" : name.trim();
        for (Pattern rule : rules) {
            normalized = rule.matcher(normalized).replaceAll("").trim();
        }
        return String.join(" ", normalized.split("\\s+")).trim();
    }

    public int ruleCount() {
        return rules.size();
    }
}
