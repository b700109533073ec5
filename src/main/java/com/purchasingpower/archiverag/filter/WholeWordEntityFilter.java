package com.purchasingpower.archiverag.filter;

import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.EntityKind;
import com.purchasingpower.archiverag.core.EvidenceItem;
import com.purchasingpower.archiverag.core.Query;
import com.purchasingpower.archiverag.exception.CollaboratorUnavailableException;
import com.purchasingpower.archiverag.resolver.EntityResolver;
import com.purchasingpower.archiverag.resolver.Resolution;
import com.purchasingpower.archiverag.resolver.ResolutionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * For "what was said about X" questions, keeps evidence mentioning X as a whole word,
 * so "AGI" does not match "AGIX".
 *
 * <p>When X is exactly one of a known entity's names, the entity's other names count too.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WholeWordEntityFilter implements EvidenceFilter {

    private static final EntityKind[] RESOLVABLE_KINDS = {EntityKind.PERSON, EntityKind.WORKGROUP, EntityKind.TOPIC};

    private final EntityPhraseExtractor phraseExtractor;
    private final EntityResolver entityResolver;

    @Override
    public String name() {
        return "whole-word";
    }

    @Override
    public boolean appliesTo(Query query) {
        return phraseExtractor.isTriggered(query.getText());
    }

    @Override
    public List<EvidenceItem> apply(Query query, List<EvidenceItem> evidence) {
        List<String> phrases = phraseExtractor.extract(query.getText());
        if (phrases.isEmpty()) {
            log.debug("Whole-word filter triggered but no entity phrase found in: {}", query.getText());
            return evidence;
        }

        List<String> names = expand(phrases);
        List<Pattern> patterns = names.stream()
            .map(name -> Pattern.compile("\\b" + Pattern.quote(name) + "\\b", Pattern.CASE_INSENSITIVE))
            .toList();

        List<EvidenceItem> kept = new ArrayList<>();
        for (EvidenceItem item : evidence) {
            String excerpt = item.getExcerpt() != null ? item.getExcerpt() : "";
            if (patterns.stream().anyMatch(p -> p.matcher(excerpt).find())) {
                kept.add(item);
            } else {
                log.debug("Dropped {}: no whole-word match for {}", item.getRecordId(), names);
            }
        }

        if (kept.size() < evidence.size()) {
            log.info("🔍 Whole-word filter {}: {} -> {} items", names, evidence.size(), kept.size());
        }
        return kept;
    }

    /**
     * Phrases plus every name of entities the phrases exactly name.
     */
    List<String> expand(List<String> phrases) {
        Set<String> names = new LinkedHashSet<>(phrases);
        for (String phrase : phrases) {
            for (EntityKind kind : RESOLVABLE_KINDS) {
                try {
                    Resolution resolution = entityResolver.resolve(phrase, kind, ResolutionContext.none());
                    resolution.entity()
                        .filter(entity -> namesExactly(entity, phrase))
                        .ifPresent(entity -> names.addAll(entity.allNames()));
                } catch (CollaboratorUnavailableException e) {
                    log.warn("⚠️ Entity store unavailable, matching '{}' without aliases: {}", phrase, e.getMessage());
                    return new ArrayList<>(names);
                }
            }
        }
        return new ArrayList<>(names);
    }

    private static boolean namesExactly(CanonicalEntity entity, String phrase) {
        return entity.allNames().stream().anyMatch(n -> n.equalsIgnoreCase(phrase));
    }
}
