package com.purchasingpower.archiverag.service.handler;

import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.EntityKind;
import com.purchasingpower.archiverag.core.MeetingRecord;
import com.purchasingpower.archiverag.core.Query;
import com.purchasingpower.archiverag.intent.KeywordLexicon;
import com.purchasingpower.archiverag.knowledge.EntityStore;
import com.purchasingpower.archiverag.resolver.EntityResolver;
import com.purchasingpower.archiverag.resolver.Resolution;
import com.purchasingpower.archiverag.resolver.ResolutionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Works out which meetings a topic or decision question is about.
 *
 * <p>A workgroup is found by one of its names appearing as a whole word, or else by
 * resolving a capitalized "... Workgroup" / "... Guild" phrase, so "Archive Workgroup"
 * still finds "Archives Workgroup".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MeetingScopeResolver {

    private static final Pattern WORKGROUP_PHRASE = Pattern.compile(
        "((?:[A-Z][\\w&-]*\\s+)+(?:Workgroup|Working\\s+Group|Guild))");

    private final EntityStore entityStore;
    private final EntityResolver entityResolver;

    public MeetingScope resolve(Query query) {
        List<CanonicalEntity> workgroups = entityStore.listEntities(EntityKind.WORKGROUP);
        Map<UUID, String> names = new LinkedHashMap<>();
        workgroups.forEach(w -> names.put(w.getId(), w.getDisplayName()));

        Optional<CanonicalEntity> workgroup = findWorkgroup(query.getText(), workgroups);

        List<MeetingRecord> meetings = entityStore.listMeetings().stream()
            .filter(m -> workgroup.isEmpty() || workgroup.get().getId().equals(m.getWorkgroupId()))
            .filter(m -> query.window().isEmpty() || query.getDateWindow().contains(m.getDate()))
            .toList();

        log.info("📁 Scope: workgroup={}, window={}, meetings={}",
            workgroup.map(CanonicalEntity::getDisplayName).orElse("any"),
            query.window().map(w -> w.describe()).orElse("any"),
            meetings.size());

        return MeetingScope.builder()
            .workgroup(workgroup.orElse(null))
            .window(query.getDateWindow())
            .meetings(meetings)
            .workgroupNames(names)
            .build();
    }

    Optional<CanonicalEntity> findWorkgroup(String text, List<CanonicalEntity> workgroups) {
        CanonicalEntity best = null;
        int bestLength = 0;
        for (CanonicalEntity workgroup : workgroups) {
            for (String name : workgroup.allNames()) {
                if (name.length() > bestLength && KeywordLexicon.containsWord(text, name)) {
                    best = workgroup;
                    bestLength = name.length();
                }
            }
        }
        if (best != null) {
            return Optional.of(best);
        }

        Matcher matcher = WORKGROUP_PHRASE.matcher(text == null ? "" : text);
        while (matcher.find()) {
            String phrase = matcher.group(1).trim();
            Resolution resolution = entityResolver.resolve(phrase, workgroups, ResolutionContext.none());
            if (resolution.isResolved()) {
                log.debug("Workgroup phrase '{}' resolved to {}", phrase, resolution.getCanonicalName());
                return resolution.entity();
            }
        }
        return Optional.empty();
    }
}
