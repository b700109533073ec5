package com.purchasingpower.archiverag.service.handler;

import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.core.DecisionItem;
import com.purchasingpower.archiverag.core.IntentType;
import com.purchasingpower.archiverag.core.MeetingRecord;
import com.purchasingpower.archiverag.core.Query;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lists the decisions recorded for the meetings a question scopes to, meeting by meeting.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecisionQueryHandler implements QueryHandler {

    private static final int MAX_MEETINGS = 10;

    private final MeetingScopeResolver scopeResolver;

    @Override
    public IntentType intent() {
        return IntentType.DECISION_LIST;
    }

    @Override
    public HandlerResult handle(Query query) {
        MeetingScope scope = scopeResolver.resolve(query);

        List<MeetingRecord> withDecisions = scope.getMeetings().stream()
            .filter(m -> m.getDecisions() != null
                && m.getDecisions().stream().anyMatch(d -> d.getDecision() != null && !d.getDecision().isBlank()))
            .sorted(Comparator.comparing(MeetingRecord::getDate, Comparator.nullsLast(Comparator.naturalOrder())))
            .toList();

        if (withDecisions.isEmpty()) {
            return HandlerResult.noEvidence(
                "No decisions were recorded for meetings" + scope.describe() + ".",
                "No meeting records with decisions" + scope.describe(),
                HandlerResult.ENTITY_QUERY_MODEL);
        }

        List<MeetingRecord> shown = withDecisions.stream().limit(MAX_MEETINGS).toList();
        StringBuilder answer = new StringBuilder();
        answer.append(String.format("Decisions made%s (%d meetings):", scope.describe(), withDecisions.size()));
        for (MeetingRecord meeting : shown) {
            answer.append("\n\nIn the ").append(label(scope, meeting)).append(" meeting:");
            for (DecisionItem decision : meeting.getDecisions()) {
                if (decision.getDecision() == null || decision.getDecision().isBlank()) {
                    continue;
                }
                answer.append("\n- ").append(format(decision));
            }
        }
        if (withDecisions.size() > shown.size()) {
            answer.append(String.format("%n%n(%d more meetings not shown)", withDecisions.size() - shown.size()));
        }

        List<Citation> citations = shown.stream()
            .map(meeting -> Citation.builder()
                .recordId(meeting.getId().toString())
                .date(meeting.getDate() != null ? meeting.getDate().toString() : "")
                .groupingName(scope.workgroupNameOf(meeting))
                .excerpt(Citation.truncate(meeting.getDecisions().stream()
                    .map(DecisionItem::getDecision)
                    .filter(d -> d != null && !d.isBlank())
                    .collect(Collectors.joining("; "))))
                .build())
            .toList();

        return HandlerResult.builder()
            .answer(answer.toString())
            .citations(citations)
            .modelVersion(HandlerResult.ENTITY_QUERY_MODEL)
            .requireEntityExtraction(false)
            .build();
    }

    private static String label(MeetingScope scope, MeetingRecord meeting) {
        return scope.workgroupNameOf(meeting) + " - " + (meeting.getDate() != null ? meeting.getDate() : "Unknown Date");
    }

    private static String format(DecisionItem decision) {
        String text = decision.getDecision().trim();
        if (decision.getRationale() != null && !decision.getRationale().isBlank()) {
            text += " (Rationale: " + decision.getRationale().trim() + ")";
        }
        return text;
    }
}
