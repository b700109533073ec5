package com.purchasingpower.archiverag.service.handler;

import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.core.IntentType;
import com.purchasingpower.archiverag.core.MeetingRecord;
import com.purchasingpower.archiverag.core.Query;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Lists the topics recorded for the meetings a question scopes to.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TopicQueryHandler implements QueryHandler {

    private static final int MAX_CITATIONS = 10;

    private final MeetingScopeResolver scopeResolver;

    @Override
    public IntentType intent() {
        return IntentType.TOPIC;
    }

    @Override
    public HandlerResult handle(Query query) {
        MeetingScope scope = scopeResolver.resolve(query);

        // topic -> number of meetings, keyed case-insensitively, first spelling kept
        Map<String, String> spelling = new LinkedHashMap<>();
        Map<String, Integer> counts = new LinkedHashMap<>();
        List<MeetingRecord> withTopics = new ArrayList<>();
        for (MeetingRecord meeting : scope.getMeetings()) {
            if (meeting.getTopics() == null || meeting.getTopics().isEmpty()) {
                continue;
            }
            withTopics.add(meeting);
            meeting.getTopics().stream().map(String::trim).filter(t -> !t.isEmpty()).distinct().forEach(topic -> {
                String key = topic.toLowerCase();
                spelling.putIfAbsent(key, topic);
                counts.merge(key, 1, Integer::sum);
            });
        }

        if (counts.isEmpty()) {
            return HandlerResult.noEvidence(
                "No topics were recorded for meetings" + scope.describe() + ".",
                "No meeting records with topics" + scope.describe(),
                HandlerResult.ENTITY_QUERY_MODEL);
        }

        String topics = counts.entrySet().stream()
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
            .map(e -> spelling.get(e.getKey()) + " (" + e.getValue() + ")")
            .collect(Collectors.joining(", "));

        String answer = String.format("Topics discussed%s across %d meetings: %s.",
            scope.describe(), withTopics.size(), topics);

        List<Citation> citations = withTopics.stream()
            .sorted(Comparator.comparing(MeetingRecord::getDate, Comparator.nullsLast(Comparator.naturalOrder())))
            .limit(MAX_CITATIONS)
            .map(meeting -> Citation.builder()
                .recordId(meeting.getId().toString())
                .date(meeting.getDate() != null ? meeting.getDate().toString() : "")
                .groupingName(scope.workgroupNameOf(meeting))
                .excerpt(Citation.truncate("Topics: " + String.join(", ", meeting.getTopics())))
                .build())
            .toList();

        return HandlerResult.builder()
            .answer(answer)
            .citations(citations)
            .modelVersion(HandlerResult.ENTITY_QUERY_MODEL)
            .requireEntityExtraction(false)
            .build();
    }
}
