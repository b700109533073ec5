package com.purchasingpower.archiverag.quantitative;

import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.core.DateWindow;
import com.purchasingpower.archiverag.core.EntityKind;
import com.purchasingpower.archiverag.core.MeetingRecord;
import com.purchasingpower.archiverag.exception.CollaboratorUnavailableException;
import com.purchasingpower.archiverag.filter.QueryParser;
import com.purchasingpower.archiverag.intent.KeywordLexicon;
import com.purchasingpower.archiverag.knowledge.EntityStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Answers counting and statistics questions from the entity store, the authoritative
 * source, optionally cross-checked against an external meeting source.
 *
 * <p>Numbers never come from a language model. Every answer names its source and method.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class QuantitativeAggregator {

    static final String STORE_SOURCE = "Entity store meeting records";
    static final String STORE_GROUPING = "Entity store";
    static final String METHOD_MEETING_COUNT =
        "Direct record count from entity store - counted valid meeting records";
    static final String METHOD_SOURCE_COUNT =
        "Direct count from source JSON URL - counted both total array items and unique meetings";
    static final String METHOD_ENTITY_COUNT = "Direct record count from entity store - counted %s records";
    static final String METHOD_WORKGROUP_STATS =
        "Aggregation over per-workgroup meeting counts from entity store records";
    static final String METHOD_MONTHLY =
        "Meeting records from entity store grouped by calendar month";
    static final String UNSUPPORTED_ANSWER =
        "I cannot answer this quantitative question. Please ask about meeting, workgroup, people, "
            + "decision or topic counts, or meeting statistics per workgroup.";

    private static final Pattern AVERAGE = Pattern.compile("\\b(average|mean)\\b");
    private static final Pattern MEDIAN = Pattern.compile("\\bmedian\\b");
    private static final Pattern MINIMUM = Pattern.compile("\\b(min|minimum|fewest|least)\\b");
    private static final Pattern MAXIMUM = Pattern.compile("\\b(max|maximum|most)\\b");
    private static final Pattern TREND = Pattern.compile("\\b(trend|trends|monthly|per\\s+month|by\\s+month)\\b");
    private static final Pattern COUNT_LEAD =
        Pattern.compile("\\b(how\\s+many|number\\s+of|count\\s+of|count|total)\\b");

    private final EntityStore entityStore;
    private final MeetingSource meetingSource;
    private final int citationSampleSize;
    private final String defaultSourceUrl;

    public QuantitativeAggregator(EntityStore entityStore, MeetingSource meetingSource, AppProperties appProperties) {
        this.entityStore = entityStore;
        this.meetingSource = meetingSource;
        this.citationSampleSize = appProperties.getQuantitative().getCitationSampleSize();
        this.defaultSourceUrl = appProperties.getQuantitative().getSourceUrl();
    }

    public AggregateAnswer answer(String question, String externalSourceUrl) {
        return answer(question, externalSourceUrl, null);
    }

    /**
     * @param question the user's question
     * @param externalSourceUrl source to cross-check meeting totals against, may be null
     * @param window restricts the meetings considered, may be null
     */
    public AggregateAnswer answer(String question, String externalSourceUrl, DateWindow window) {
        String lower = question == null ? "" : question.toLowerCase();
        List<CanonicalEntity> workgroups = entityStore.listEntities(EntityKind.WORKGROUP);
        Optional<CanonicalEntity> namedWorkgroup = findNamedWorkgroup(question, workgroups);
        String unscoped = namedWorkgroup.map(workgroup -> withoutNames(lower, workgroup)).orElse(lower);
        QuestionType type = detect(unscoped, namedWorkgroup.isPresent());

        log.info("📊 Quantitative question type {} (window={}, workgroup={})",
            type, window != null ? window.describe() : "none",
            namedWorkgroup.map(CanonicalEntity::getDisplayName).orElse("none"));

        return switch (type) {
            case MEETINGS_TOTAL -> countMeetings(question, externalSourceUrl, window);
            case MEETINGS_BY_WORKGROUP -> countWorkgroupMeetings(namedWorkgroup.orElseThrow(), window);
            case WORKGROUPS_TOTAL -> countEntities(type, EntityKind.WORKGROUP, "workgroup", workgroups);
            case PEOPLE_TOTAL -> countEntities(type, EntityKind.PERSON, "person",
                entityStore.listEntities(EntityKind.PERSON));
            case PEOPLE_BY_WORKGROUP -> countWorkgroupPeople(namedWorkgroup.orElseThrow(), window);
            case TOPICS_TOTAL -> countEntities(type, EntityKind.TOPIC, "topic",
                entityStore.listEntities(EntityKind.TOPIC));
            case TOPICS_BY_WORKGROUP -> countWorkgroupTopics(namedWorkgroup.orElseThrow(), window);
            case DECISIONS_TOTAL -> countDecisions(null, window);
            case DECISIONS_BY_WORKGROUP -> countDecisions(namedWorkgroup.orElseThrow(), window);
            case AVERAGE_MEETINGS_PER_WORKGROUP, MEDIAN_MEETINGS_PER_WORKGROUP,
                 MIN_MEETINGS_PER_WORKGROUP, MAX_MEETINGS_PER_WORKGROUP ->
                workgroupStatistic(type, workgroups, window);
            case MONTHLY_TREND -> monthlyTrend(window);
            case UNSUPPORTED -> unsupported(question);
        };
    }

    /**
     * Picks the type from the noun being counted, then applies a named workgroup as scope.
     *
     * @param lower lower-cased question with the named workgroup's names removed
     */
    QuestionType detect(String lower, boolean namesWorkgroup) {
        if (TREND.matcher(lower).find()) {
            return QuestionType.MONTHLY_TREND;
        }
        boolean counting = COUNT_LEAD.matcher(lower).find();
        Optional<CountedNoun> noun = countedNoun(lower);
        if (noun.isEmpty()) {
            return QuestionType.UNSUPPORTED;
        }

        Optional<QuestionType> statistic = statisticOf(lower);
        if (noun.get() == CountedNoun.MEETINGS || noun.get() == CountedNoun.WORKGROUPS) {
            if (statistic.isPresent()) {
                return statistic.get();
            }
        } else if (statistic.isPresent() && !counting) {
            // rankings of people, decisions or topics are not computed
            return QuestionType.UNSUPPORTED;
        }

        return switch (noun.get()) {
            case MEETINGS -> namesWorkgroup ? QuestionType.MEETINGS_BY_WORKGROUP : QuestionType.MEETINGS_TOTAL;
            case WORKGROUPS -> QuestionType.WORKGROUPS_TOTAL;
            case PEOPLE -> namesWorkgroup ? QuestionType.PEOPLE_BY_WORKGROUP : QuestionType.PEOPLE_TOTAL;
            case DECISIONS -> namesWorkgroup ? QuestionType.DECISIONS_BY_WORKGROUP : QuestionType.DECISIONS_TOTAL;
            case TOPICS -> namesWorkgroup ? QuestionType.TOPICS_BY_WORKGROUP : QuestionType.TOPICS_TOTAL;
        };
    }

    /**
     * The first countable noun after "how many", "number of" and the like, otherwise the
     * first countable noun in the question.
     */
    static Optional<CountedNoun> countedNoun(String lower) {
        Matcher lead = COUNT_LEAD.matcher(lower);
        if (lead.find()) {
            Optional<CountedNoun> afterLead = firstNoun(lower, lead.end());
            if (afterLead.isPresent()) {
                return afterLead;
            }
        }
        return firstNoun(lower, 0);
    }

    private static Optional<CountedNoun> firstNoun(String lower, int from) {
        CountedNoun first = null;
        int firstStart = Integer.MAX_VALUE;
        for (CountedNoun noun : CountedNoun.values()) {
            Matcher matcher = noun.pattern.matcher(lower);
            if (matcher.find(from) && matcher.start() < firstStart) {
                first = noun;
                firstStart = matcher.start();
            }
        }
        return Optional.ofNullable(first);
    }

    private static Optional<QuestionType> statisticOf(String lower) {
        if (AVERAGE.matcher(lower).find()) {
            return Optional.of(QuestionType.AVERAGE_MEETINGS_PER_WORKGROUP);
        }
        if (MEDIAN.matcher(lower).find()) {
            return Optional.of(QuestionType.MEDIAN_MEETINGS_PER_WORKGROUP);
        }
        if (MINIMUM.matcher(lower).find()) {
            return Optional.of(QuestionType.MIN_MEETINGS_PER_WORKGROUP);
        }
        if (MAXIMUM.matcher(lower).find()) {
            return Optional.of(QuestionType.MAX_MEETINGS_PER_WORKGROUP);
        }
        return Optional.empty();
    }

    private AggregateAnswer countMeetings(String question, String externalSourceUrl, DateWindow window) {
        List<MeetingRecord> meetings = meetingsIn(window);
        int storeCount = meetings.size();
        List<Citation> citations = meetingCitations(meetings, METHOD_MEETING_COUNT, STORE_SOURCE);

        String sourceUrl = resolveSourceUrl(question, externalSourceUrl);
        if (sourceUrl != null && window == null) {
            try {
                SourceCount source = meetingSource.count(sourceUrl);
                return withSource(storeCount, source, citations);
            } catch (CollaboratorUnavailableException e) {
                log.warn("⚠️ Meeting source {} unavailable, answering from entity store: {}", sourceUrl, e.getMessage());
            }
        }

        String answer = window == null
            ? String.format("There are %d meetings in the archive.", storeCount)
            : String.format("There are %d meetings in the archive in %s.", storeCount, window.describe());

        return AggregateAnswer.builder()
            .answer(answer)
            .questionType(QuestionType.MEETINGS_TOTAL)
            .count(storeCount)
            .source(STORE_SOURCE)
            .method(METHOD_MEETING_COUNT)
            .citations(citations)
            .build();
    }

    private AggregateAnswer withSource(int storeCount, SourceCount source, List<Citation> storeCitations) {
        Discrepancy discrepancy = Discrepancy.between(storeCount, source);
        int total = source.getTotal();
        int unique = source.getUnique();

        String answer;
        if (discrepancy.getDifference() != 0) {
            String head = unique != total
                ? String.format("There are %d unique meetings in the source data (%s), with %d total entries in the JSON array. ",
                    unique, source.getUrl(), total)
                : String.format("There are %d meetings in the source data (%s). ", total, source.getUrl());
            answer = head + String.format(
                "However, only %d meetings are currently ingested into the entity store. %d meeting(s) have not yet been ingested.",
                storeCount, Math.abs(discrepancy.getDifference()));
        } else if (unique != total && unique > 0) {
            answer = String.format("There are %d unique meetings in the source data (%s), with %d total entries in the JSON array. "
                    + "The difference indicates some meetings appear more than once.",
                unique, source.getUrl(), total);
        } else {
            answer = String.format("There are %d meetings in the archive.", total);
        }

        List<Citation> citations = storeCitations.stream()
            .map(c -> c.toBuilder().excerpt(discrepancy.getExplanation()).build())
            .toList();

        return AggregateAnswer.builder()
            .answer(answer)
            .questionType(QuestionType.MEETINGS_TOTAL)
            .count(total)
            .uniqueCount(unique)
            .source(source.getUrl())
            .method(METHOD_SOURCE_COUNT)
            .citations(citations)
            .discrepancy(discrepancy)
            .build();
    }

    private AggregateAnswer countWorkgroupMeetings(CanonicalEntity workgroup, DateWindow window) {
        List<MeetingRecord> meetings = meetingsIn(window).stream()
            .filter(m -> workgroup.getId().equals(m.getWorkgroupId()))
            .toList();
        String method = "Direct record count from entity store - counted meeting records of workgroup "
            + workgroup.getDisplayName();

        String answer = String.format("The %s held %d meetings%s.",
            workgroup.getDisplayName(), meetings.size(), window != null ? " in " + window.describe() : "");

        return AggregateAnswer.builder()
            .answer(answer)
            .questionType(QuestionType.MEETINGS_BY_WORKGROUP)
            .count(meetings.size())
            .source(STORE_SOURCE)
            .method(method)
            .citations(meetingCitations(meetings, method, STORE_SOURCE))
            .build();
    }

    private AggregateAnswer countEntities(QuestionType type, EntityKind kind, String noun,
                                          List<CanonicalEntity> entities) {
        String method = String.format(METHOD_ENTITY_COUNT, noun);
        String source = "Entity store " + kind.name().toLowerCase() + " records";

        List<Citation> citations = entities.stream()
            .limit(citationSampleSize)
            .map(entity -> Citation.builder()
                .recordId(entity.getId().toString())
                .groupingName(STORE_GROUPING)
                .excerpt(String.format("%s counted by %s from %s", entity.getDisplayName(), method, source))
                .build())
            .toList();

        String plural = kind == EntityKind.PERSON ? "people" : noun + "s";
        return AggregateAnswer.builder()
            .answer(String.format("There are %d %s in the archive.", entities.size(), plural))
            .questionType(type)
            .count(entities.size())
            .source(source)
            .method(method)
            .citations(citations)
            .build();
    }

    private AggregateAnswer countDecisions(CanonicalEntity workgroup, DateWindow window) {
        List<MeetingRecord> withDecisions = meetingsIn(window).stream()
            .filter(m -> workgroup == null || workgroup.getId().equals(m.getWorkgroupId()))
            .filter(m -> m.getDecisions() != null && !m.getDecisions().isEmpty())
            .toList();
        int total = withDecisions.stream().mapToInt(m -> m.getDecisions().size()).sum();
        String method = "Direct record count from entity store - counted decision items in meeting records"
            + (workgroup != null ? " of workgroup " + workgroup.getDisplayName() : "");

        String answer = workgroup == null
            ? String.format("%d decisions were recorded across %d meetings%s.",
                total, withDecisions.size(), window != null ? " in " + window.describe() : "")
            : String.format("The %s recorded %d decisions across %d meetings%s.",
                workgroup.getDisplayName(), total, withDecisions.size(),
                window != null ? " in " + window.describe() : "");

        return AggregateAnswer.builder()
            .answer(answer)
            .questionType(workgroup == null ? QuestionType.DECISIONS_TOTAL : QuestionType.DECISIONS_BY_WORKGROUP)
            .count(total)
            .source(STORE_SOURCE)
            .method(method)
            .citations(total > 0 ? meetingCitations(withDecisions, method, STORE_SOURCE) : List.of())
            .build();
    }

    private AggregateAnswer countWorkgroupPeople(CanonicalEntity workgroup, DateWindow window) {
        List<MeetingRecord> meetings = meetingsOf(meetingsIn(window), workgroup.getId()).stream()
            .filter(m -> m.getParticipantIds() != null && !m.getParticipantIds().isEmpty())
            .toList();
        Set<UUID> people = new LinkedHashSet<>();
        meetings.forEach(m -> people.addAll(m.getParticipantIds()));
        String method = "Direct record count from entity store - counted distinct participants in meeting records of workgroup "
            + workgroup.getDisplayName();

        String answer = String.format("%d people attended meetings of the %s%s.",
            people.size(), workgroup.getDisplayName(), window != null ? " in " + window.describe() : "");

        return AggregateAnswer.builder()
            .answer(answer)
            .questionType(QuestionType.PEOPLE_BY_WORKGROUP)
            .count(people.size())
            .source(STORE_SOURCE)
            .method(method)
            .citations(meetingCitations(meetings, method, STORE_SOURCE))
            .build();
    }

    private AggregateAnswer countWorkgroupTopics(CanonicalEntity workgroup, DateWindow window) {
        List<MeetingRecord> meetings = meetingsOf(meetingsIn(window), workgroup.getId()).stream()
            .filter(m -> m.getTopics() != null && !m.getTopics().isEmpty())
            .toList();
        Set<String> topics = new LinkedHashSet<>();
        meetings.forEach(m -> m.getTopics().forEach(topic -> topics.add(topic.trim().toLowerCase())));
        String method = "Direct record count from entity store - counted distinct topics in meeting records of workgroup "
            + workgroup.getDisplayName();

        String answer = String.format("The %s discussed %d topics across %d meetings%s.",
            workgroup.getDisplayName(), topics.size(), meetings.size(),
            window != null ? " in " + window.describe() : "");

        return AggregateAnswer.builder()
            .answer(answer)
            .questionType(QuestionType.TOPICS_BY_WORKGROUP)
            .count(topics.size())
            .source(STORE_SOURCE)
            .method(method)
            .citations(meetingCitations(meetings, method, STORE_SOURCE))
            .build();
    }

    private AggregateAnswer workgroupStatistic(QuestionType type, List<CanonicalEntity> workgroups, DateWindow window) {
        List<MeetingRecord> meetings = meetingsIn(window);
        Map<UUID, String> names = workgroups.stream()
            .collect(Collectors.toMap(CanonicalEntity::getId, CanonicalEntity::getDisplayName, (a, b) -> a, LinkedHashMap::new));

        // every known workgroup counts, including those without meetings
        Map<UUID, Integer> perWorkgroup = new LinkedHashMap<>();
        names.keySet().forEach(id -> perWorkgroup.put(id, 0));
        for (MeetingRecord meeting : meetings) {
            if (meeting.getWorkgroupId() != null) {
                perWorkgroup.merge(meeting.getWorkgroupId(), 1, Integer::sum);
            }
        }

        if (perWorkgroup.isEmpty()) {
            return AggregateAnswer.builder()
                .answer("There are no workgroups with meetings in the archive.")
                .questionType(type)
                .count(0)
                .value(0.0)
                .source(STORE_SOURCE)
                .method(METHOD_WORKGROUP_STATS)
                .build();
        }

        int totalMeetings = perWorkgroup.values().stream().mapToInt(Integer::intValue).sum();
        Function<UUID, String> nameOf = id -> names.getOrDefault(id, "Unknown Workgroup");
        String scope = window != null ? " in " + window.describe() : "";

        String answer;
        double value;
        List<MeetingRecord> cited = meetings;
        switch (type) {
            case AVERAGE_MEETINGS_PER_WORKGROUP -> {
                value = (double) totalMeetings / perWorkgroup.size();
                answer = String.format("Workgroups held %.2f meetings on average%s (%d meetings across %d workgroups).",
                    value, scope, totalMeetings, perWorkgroup.size());
            }
            case MEDIAN_MEETINGS_PER_WORKGROUP -> {
                value = median(perWorkgroup.values().stream().mapToInt(Integer::intValue).toArray());
                answer = String.format("The median number of meetings per workgroup%s is %.1f (%d workgroups).",
                    scope, value, perWorkgroup.size());
            }
            case MIN_MEETINGS_PER_WORKGROUP -> {
                Map.Entry<UUID, Integer> min = perWorkgroup.entrySet().stream()
                    .min(Map.Entry.comparingByValue()).orElseThrow();
                value = min.getValue();
                answer = String.format("The fewest meetings held by a workgroup%s is %d (%s).",
                    scope, min.getValue(), nameOf.apply(min.getKey()));
                cited = meetingsOf(meetings, min.getKey());
            }
            case MAX_MEETINGS_PER_WORKGROUP -> {
                Map.Entry<UUID, Integer> max = perWorkgroup.entrySet().stream()
                    .max(Map.Entry.comparingByValue()).orElseThrow();
                value = max.getValue();
                answer = String.format("The most meetings held by a workgroup%s is %d (%s).",
                    scope, max.getValue(), nameOf.apply(max.getKey()));
                cited = meetingsOf(meetings, max.getKey());
            }
            default -> throw new IllegalArgumentException("Not a workgroup statistic: " + type);
        }

        return AggregateAnswer.builder()
            .answer(answer)
            .questionType(type)
            .count(totalMeetings)
            .value(value)
            .source(STORE_SOURCE)
            .method(METHOD_WORKGROUP_STATS)
            .citations(meetingCitations(cited, METHOD_WORKGROUP_STATS, STORE_SOURCE))
            .build();
    }

    private AggregateAnswer monthlyTrend(DateWindow window) {
        List<MeetingRecord> meetings = meetingsIn(window).stream()
            .filter(m -> m.getDate() != null)
            .toList();
        Map<YearMonth, Long> perMonth = meetings.stream()
            .collect(Collectors.groupingBy(m -> YearMonth.from(m.getDate()), TreeMap::new, Collectors.counting()));

        String series = perMonth.entrySet().stream()
            .map(e -> e.getKey() + ": " + e.getValue())
            .collect(Collectors.joining(", "));
        String answer = perMonth.isEmpty()
            ? "There are no dated meetings" + (window != null ? " in " + window.describe() : "") + "."
            : "Meetings per month" + (window != null ? " in " + window.describe() : "") + ": " + series + ".";

        return AggregateAnswer.builder()
            .answer(answer)
            .questionType(QuestionType.MONTHLY_TREND)
            .count(meetings.size())
            .source(STORE_SOURCE)
            .method(METHOD_MONTHLY)
            .citations(meetingCitations(meetings, METHOD_MONTHLY, STORE_SOURCE))
            .build();
    }

    private AggregateAnswer unsupported(String question) {
        log.warn("⚠️ Quantitative question not recognized: {}", question);
        List<String> supported = Arrays.stream(QuestionType.values())
            .map(QuestionType::getExample)
            .filter(example -> example != null)
            .toList();
        return AggregateAnswer.builder()
            .answer(UNSUPPORTED_ANSWER)
            .questionType(QuestionType.UNSUPPORTED)
            .count(0)
            .source(STORE_SOURCE)
            .method("No aggregation performed - question not recognized")
            .supportedQuestions(supported)
            .build();
    }

    private List<MeetingRecord> meetingsIn(DateWindow window) {
        List<MeetingRecord> meetings = entityStore.listMeetings();
        if (window == null) {
            return meetings;
        }
        return meetings.stream().filter(m -> window.contains(m.getDate())).toList();
    }

    private static List<MeetingRecord> meetingsOf(List<MeetingRecord> meetings, UUID workgroupId) {
        return meetings.stream().filter(m -> workgroupId.equals(m.getWorkgroupId())).toList();
    }

    private List<Citation> meetingCitations(List<MeetingRecord> meetings, String method, String source) {
        List<Citation> citations = new ArrayList<>();
        for (MeetingRecord meeting : meetings) {
            if (citations.size() >= citationSampleSize) {
                break;
            }
            citations.add(Citation.builder()
                .recordId(meeting.getId().toString())
                .date(meeting.getDate() != null ? meeting.getDate().toString() : "")
                .groupingName(STORE_GROUPING)
                .excerpt(String.format("Counted by %s from %s", method, source))
                .build());
        }
        return citations;
    }

    private String resolveSourceUrl(String question, String explicitUrl) {
        if (explicitUrl != null && !explicitUrl.isBlank()) {
            return explicitUrl;
        }
        Optional<String> fromQuestion = QueryParser.extractUrl(question);
        if (fromQuestion.isPresent()) {
            log.info("Source URL taken from question: {}", fromQuestion.get());
            return fromQuestion.get();
        }
        return defaultSourceUrl != null && !defaultSourceUrl.isBlank() ? defaultSourceUrl : null;
    }

    private static Optional<CanonicalEntity> findNamedWorkgroup(String question, List<CanonicalEntity> workgroups) {
        CanonicalEntity best = null;
        int bestLength = 0;
        for (CanonicalEntity workgroup : workgroups) {
            for (String name : workgroup.allNames()) {
                if (name.length() > bestLength && KeywordLexicon.containsWord(question, name)) {
                    best = workgroup;
                    bestLength = name.length();
                }
            }
        }
        return Optional.ofNullable(best);
    }

    private static String withoutNames(String lower, CanonicalEntity workgroup) {
        String result = lower;
        for (String name : workgroup.allNames()) {
            if (name != null && !name.isBlank()) {
                result = Pattern.compile("\\b" + Pattern.quote(name.trim()) + "\\b", Pattern.CASE_INSENSITIVE)
                    .matcher(result)
                    .replaceAll(" ");
            }
        }
        return result;
    }

    enum CountedNoun {
        MEETINGS("\\bmeetings?\\b"),
        WORKGROUPS("\\b(workgroups?|working\\s+groups?|guilds?)\\b"),
        PEOPLE("\\b(people|persons?|participants?|attendees?)\\b"),
        DECISIONS("\\bdecisions?\\b"),
        TOPICS("\\btopics?\\b");

        private final Pattern pattern;

        CountedNoun(String regex) {
            this.pattern = Pattern.compile(regex);
        }
    }

    private static double median(int[] values) {
        int[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
