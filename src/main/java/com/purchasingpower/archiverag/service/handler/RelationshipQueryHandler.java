package com.purchasingpower.archiverag.service.handler;

import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.core.EntityKind;
import com.purchasingpower.archiverag.core.MeetingRecord;
import com.purchasingpower.archiverag.core.RecordIds;
import com.purchasingpower.archiverag.core.RelationshipSubject;
import com.purchasingpower.archiverag.knowledge.EntityStore;
import com.purchasingpower.archiverag.resolver.EntityResolver;
import com.purchasingpower.archiverag.resolver.Resolution;
import com.purchasingpower.archiverag.resolver.ResolutionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Answers structured relationship lookups: who attended what, which workgroup held which
 * meetings, what a single meeting covered.
 *
 * <p>Names go through the entity resolver, so "Stephen [QADAO]" finds "Stephen". An
 * unknown name is answered with "did you mean" suggestions, never with a guess.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RelationshipQueryHandler {

    private static final int MAX_CITATIONS = 10;
    private static final int MAX_SUGGESTIONS = 3;
    private static final String UNKNOWN = "Unknown";

    private final EntityStore entityStore;
    private final EntityResolver entityResolver;

    public HandlerResult handle(RelationshipSubject subject, String name) {
        log.info("🔗 Relationship lookup: {} '{}'", subject, name);
        return switch (subject) {
            case PERSON -> person(name);
            case WORKGROUP -> workgroup(name);
            case MEETING -> meeting(name);
        };
    }

    private HandlerResult person(String name) {
        Resolution resolution = entityResolver.resolve(name, EntityKind.PERSON, ResolutionContext.none());
        if (!resolution.isResolved()) {
            return notFound("Person", name, EntityKind.PERSON);
        }
        UUID personId = resolution.getId();
        Map<UUID, String> workgroups = workgroupNames();

        List<MeetingRecord> attended = byDate(entityStore.listMeetings().stream()
            .filter(m -> m.hasParticipant(personId))
            .toList());
        if (attended.isEmpty()) {
            return HandlerResult.noEvidence(
                resolution.getCanonicalName() + " has no recorded meeting attendance.",
                "No meeting records with participant " + resolution.getCanonicalName(),
                HandlerResult.ENTITY_QUERY_MODEL);
        }

        Set<String> memberOf = new LinkedHashSet<>();
        List<String> lines = new ArrayList<>();
        for (MeetingRecord meeting : attended) {
            String workgroup = workgroups.getOrDefault(meeting.getWorkgroupId(), UNKNOWN + " Workgroup");
            memberOf.add(workgroup);
            lines.add(triple(resolution.getCanonicalName(), "ATTENDED", label(workgroup, meeting)));
        }
        memberOf.forEach(workgroup -> lines.add(triple(resolution.getCanonicalName(), "PARTICIPATES_IN", workgroup)));

        String answer = String.format("%s attended %d meetings across %d workgroups:%n%s",
            resolution.getCanonicalName(), attended.size(), memberOf.size(), String.join("\n", lines));
        return answered(answer, citations(attended, workgroups));
    }

    private HandlerResult workgroup(String name) {
        Resolution resolution = entityResolver.resolve(name, EntityKind.WORKGROUP, ResolutionContext.none());
        if (!resolution.isResolved()) {
            return notFound("Workgroup", name, EntityKind.WORKGROUP);
        }
        UUID workgroupId = resolution.getId();
        String workgroup = resolution.getCanonicalName();

        List<MeetingRecord> held = byDate(entityStore.listMeetings().stream()
            .filter(m -> workgroupId.equals(m.getWorkgroupId()))
            .toList());
        if (held.isEmpty()) {
            return HandlerResult.noEvidence(workgroup + " has no recorded meetings.",
                "No meeting records for " + workgroup, HandlerResult.ENTITY_QUERY_MODEL);
        }

        List<String> lines = new ArrayList<>();
        held.forEach(meeting -> lines.add(triple(workgroup, "HELD", label(workgroup, meeting))));
        participants(held).forEach(person -> lines.add(triple(person, "PARTICIPATES_IN", workgroup)));
        topics(held).forEach(topic -> lines.add(triple(workgroup, "DISCUSSED", topic)));

        String answer = String.format("%s held %d meetings:%n%s", workgroup, held.size(), String.join("\n", lines));
        return answered(answer, citations(held, Map.of(workgroupId, workgroup)));
    }

    private HandlerResult meeting(String name) {
        Optional<UUID> id = RecordIds.canonical(name);
        if (id.isEmpty()) {
            return HandlerResult.noEvidence("Meeting '" + name + "' is not a valid meeting id.",
                "Malformed meeting id", HandlerResult.ENTITY_QUERY_MODEL);
        }
        Optional<MeetingRecord> found = entityStore.getMeeting(id.get());
        if (found.isEmpty()) {
            return HandlerResult.noEvidence("Meeting '" + id.get() + "' not found.",
                "Unknown meeting id", HandlerResult.ENTITY_QUERY_MODEL);
        }
        MeetingRecord meeting = found.get();
        Map<UUID, String> workgroups = workgroupNames();
        String workgroup = workgroups.getOrDefault(meeting.getWorkgroupId(), UNKNOWN + " Workgroup");
        String subject = label(workgroup, meeting);

        List<String> lines = new ArrayList<>();
        lines.add(triple(subject, "HELD_BY", workgroup));
        participants(List.of(meeting)).forEach(person -> lines.add(triple(person, "ATTENDED", subject)));
        topics(List.of(meeting)).forEach(topic -> lines.add(triple(subject, "DISCUSSED", topic)));
        meeting.getDecisions().stream()
            .filter(d -> d.getDecision() != null && !d.getDecision().isBlank())
            .forEach(d -> lines.add(triple(subject, "DECIDED", d.getDecision().trim())));

        String answer = String.format("Meeting %s:%n%s", subject, String.join("\n", lines));
        return answered(answer, citations(List.of(meeting), workgroups));
    }

    private HandlerResult notFound(String label, String name, EntityKind kind) {
        List<String> suggestions = entityResolver.suggest(name, kind, MAX_SUGGESTIONS);
        String answer = label + " '" + name + "' not found.";
        if (!suggestions.isEmpty()) {
            answer += " Did you mean: " + String.join(", ", suggestions) + "?";
        }
        log.info("🔍 {} '{}' not resolved, suggestions: {}", label, name, suggestions);
        return HandlerResult.noEvidence(answer, label + " not found", HandlerResult.ENTITY_QUERY_MODEL);
    }

    private static HandlerResult answered(String answer, List<Citation> citations) {
        return HandlerResult.builder()
            .answer(answer)
            .citations(citations)
            .modelVersion(HandlerResult.ENTITY_QUERY_MODEL)
            .requireEntityExtraction(false)
            .build();
    }

    private List<String> participants(List<MeetingRecord> meetings) {
        Set<UUID> ids = new LinkedHashSet<>();
        meetings.forEach(m -> ids.addAll(m.getParticipantIds()));
        return ids.stream()
            .map(id -> entityStore.getEntity(EntityKind.PERSON, id)
                .map(CanonicalEntity::getDisplayName)
                .orElse(id.toString()))
            .toList();
    }

    private static List<String> topics(List<MeetingRecord> meetings) {
        Set<String> topics = new LinkedHashSet<>();
        meetings.forEach(m -> m.getTopics().stream()
            .filter(t -> t != null && !t.isBlank())
            .map(String::trim)
            .forEach(topics::add));
        return List.copyOf(topics);
    }

    private Map<UUID, String> workgroupNames() {
        return entityStore.listEntities(EntityKind.WORKGROUP).stream()
            .collect(Collectors.toMap(CanonicalEntity::getId, CanonicalEntity::getDisplayName, (a, b) -> a));
    }

    private static List<Citation> citations(List<MeetingRecord> meetings, Map<UUID, String> workgroups) {
        Function<MeetingRecord, String> excerpt = m -> m.getPurpose() != null && !m.getPurpose().isBlank()
            ? m.getPurpose()
            : "Topics: " + String.join(", ", m.getTopics());
        return meetings.stream()
            .limit(MAX_CITATIONS)
            .map(meeting -> Citation.builder()
                .recordId(meeting.getId().toString())
                .date(meeting.getDate() != null ? meeting.getDate().toString() : "")
                .groupingName(workgroups.getOrDefault(meeting.getWorkgroupId(), UNKNOWN + " Workgroup"))
                .excerpt(Citation.truncate(excerpt.apply(meeting)))
                .build())
            .toList();
    }

    private static List<MeetingRecord> byDate(List<MeetingRecord> meetings) {
        return meetings.stream()
            .sorted(Comparator.comparing(MeetingRecord::getDate, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();
    }

    private static String label(String workgroup, MeetingRecord meeting) {
        return workgroup + " - " + (meeting.getDate() != null ? meeting.getDate() : "Unknown Date");
    }

    private static String triple(String subject, String relationship, String object) {
        return "(" + subject + ") -[" + relationship + "]-> (" + object + ")";
    }
}
