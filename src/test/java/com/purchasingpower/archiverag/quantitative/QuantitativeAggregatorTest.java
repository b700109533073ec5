package com.purchasingpower.archiverag.quantitative;

import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.core.DateWindow;
import com.purchasingpower.archiverag.core.DecisionItem;
import com.purchasingpower.archiverag.core.EntityKind;
import com.purchasingpower.archiverag.core.MeetingRecord;
import com.purchasingpower.archiverag.exception.CollaboratorUnavailableException;
import com.purchasingpower.archiverag.model.ServiceType;
import com.purchasingpower.archiverag.support.InMemoryEntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("Quantitative Aggregator Tests")
class QuantitativeAggregatorTest {

    private InMemoryEntityStore store;
    private List<String> fetchedUrls;
    private MeetingSource source;
    private CanonicalEntity archives;
    private CanonicalEntity governance;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        fetchedUrls = new ArrayList<>();
        source = url -> {
            fetchedUrls.add(url);
            return SourceCount.builder().url(url).total(45).unique(44).build();
        };

        // 42 meetings: 30 Archives (Jan-Mar 2025), 12 Governance, plus an empty workgroup
        archives = store.add(EntityKind.WORKGROUP, "Archives Workgroup");
        governance = store.add(EntityKind.WORKGROUP, "Governance Workgroup");
        store.add(EntityKind.WORKGROUP, "Dormant Guild");
        for (int i = 0; i < 30; i++) {
            store.addMeeting(archives, LocalDate.of(2025, 1 + i / 10, 1 + i % 10));
        }
        for (int i = 0; i < 12; i++) {
            store.addMeeting(governance, LocalDate.of(2024, 6, 1 + i));
        }
    }

    private QuantitativeAggregator aggregator(MeetingSource meetingSource) {
        return new QuantitativeAggregator(store, meetingSource, new AppProperties());
    }

    @Test
    @DisplayName("\"How many meetings are there?\" counts 42 store records and says how")
    void meetingTotal_ShouldCountStoreRecords() {
        AggregateAnswer answer = aggregator(source).answer("How many meetings are there?", null);

        assertThat(answer.getQuestionType()).isEqualTo(QuestionType.MEETINGS_TOTAL);
        assertThat(answer.getCount()).isEqualTo(42);
        assertThat(answer.getAnswer()).contains("42");
        assertThat(answer.getMethod()).contains("record count");
        assertThat(answer.getSource()).isEqualTo(QuantitativeAggregator.STORE_SOURCE);
        assertThat(answer.getCitations()).hasSize(10).allMatch(Citation::isValid);
        assertThat(fetchedUrls).isEmpty();
    }

    @Test
    @DisplayName("Source URL in the question is cross-checked and the gap explained")
    void sourceUrl_ShouldReportDiscrepancy() {
        AggregateAnswer answer = aggregator(source)
            .answer("How many meetings are listed at https://example.org/meetings.json ?", null);

        assertThat(fetchedUrls).containsExactly("https://example.org/meetings.json");
        assertThat(answer.getCount()).isEqualTo(45);
        assertThat(answer.getUniqueCount()).isEqualTo(44);
        assertThat(answer.getDiscrepancy().getEntityStoreCount()).isEqualTo(42);
        assertThat(answer.getDiscrepancy().getDifference()).isEqualTo(3);
        assertThat(answer.getDiscrepancy().getExplanation()).contains("3 meeting(s) not yet ingested");
        assertThat(answer.getMethod()).isEqualTo(QuantitativeAggregator.METHOD_SOURCE_COUNT);
        assertThat(answer.getCitations()).isNotEmpty().allMatch(Citation::isValid);
    }

    @Test
    @DisplayName("Unreachable source falls back to the store count")
    void unavailableSource_ShouldFallBackToStore() {
        MeetingSource offline = url -> {
            throw new CollaboratorUnavailableException(ServiceType.SOURCE_URL, "connection refused");
        };

        AggregateAnswer answer = aggregator(offline).answer("How many meetings are there?", "https://example.org/m.json");

        assertThat(answer.getCount()).isEqualTo(42);
        assertThat(answer.getDiscrepancy()).isNull();
        assertThat(answer.getMethod()).isEqualTo(QuantitativeAggregator.METHOD_MEETING_COUNT);
    }

    @Test
    @DisplayName("Named workgroup restricts the count")
    void namedWorkgroup_ShouldCountItsMeetings() {
        AggregateAnswer answer = aggregator(source).answer("How many meetings did the Archives Workgroup hold?", null);

        assertThat(answer.getQuestionType()).isEqualTo(QuestionType.MEETINGS_BY_WORKGROUP);
        assertThat(answer.getCount()).isEqualTo(30);
        assertThat(answer.getAnswer()).contains("Archives Workgroup");
    }

    @Test
    @DisplayName("Date window restricts the meetings counted")
    void window_ShouldRestrictMeetings() {
        DateWindow june2024 = new DateWindow(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 7, 1), 2024, 6);

        AggregateAnswer answer = aggregator(source).answer("How many meetings were held?", null, june2024);

        assertThat(answer.getCount()).isEqualTo(12);
        assertThat(answer.getAnswer()).contains("June 2024");
    }

    @Test
    @DisplayName("Average counts every workgroup, including ones without meetings")
    void average_ShouldIncludeEmptyWorkgroups() {
        AggregateAnswer answer = aggregator(source)
            .answer("What is the average number of meetings per workgroup?", null);

        assertThat(answer.getQuestionType()).isEqualTo(QuestionType.AVERAGE_MEETINGS_PER_WORKGROUP);
        assertThat(answer.getValue()).isCloseTo(14.0, within(1e-9));
        assertThat(answer.getMethod()).isNotBlank();
    }

    @Test
    @DisplayName("Median, minimum and maximum per workgroup")
    void workgroupStatistics() {
        QuantitativeAggregator aggregator = aggregator(source);

        assertThat(aggregator.answer("What is the median number of meetings per workgroup?", null).getValue())
            .isEqualTo(12.0);
        assertThat(aggregator.answer("Which workgroup held the maximum number of meetings?", null).getAnswer())
            .contains("30").contains("Archives Workgroup");
        assertThat(aggregator.answer("Which workgroup held the minimum number of meetings?", null).getAnswer())
            .contains("Dormant Guild");
    }

    @Test
    @DisplayName("Monthly trend groups meetings by calendar month")
    void monthlyTrend_ShouldGroupByMonth() {
        AggregateAnswer answer = aggregator(source).answer("Show the monthly trend of meetings", null);

        assertThat(answer.getQuestionType()).isEqualTo(QuestionType.MONTHLY_TREND);
        assertThat(answer.getAnswer()).contains("2024-06: 12").contains("2025-01: 10");
        assertThat(answer.getCount()).isEqualTo(42);
    }

    @Test
    @DisplayName("Decision totals sum decision items across meetings")
    void decisionTotal_ShouldSumDecisionItems() {
        MeetingRecord meeting = store.addMeeting(archives, LocalDate.of(2025, 5, 1));
        meeting.getDecisions().add(new DecisionItem("Adopt the tag taxonomy", "Consistency", null));
        meeting.getDecisions().add(new DecisionItem("Publish monthly reports", null, null));

        AggregateAnswer answer = aggregator(source).answer("How many decisions were made?", null);

        assertThat(answer.getQuestionType()).isEqualTo(QuestionType.DECISIONS_TOTAL);
        assertThat(answer.getCount()).isEqualTo(2);
        assertThat(answer.getCitations()).extracting(Citation::getRecordId).containsExactly(meeting.getId().toString());
    }

    @Test
    @DisplayName("Entity counts cover workgroups and people")
    void entityCounts() {
        store.add(EntityKind.PERSON, "Stephen");

        assertThat(aggregator(source).answer("How many workgroups are there?", null).getCount()).isEqualTo(3);
        assertThat(aggregator(source).answer("How many people are in the archive?", null).getCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("People counted for a named workgroup are its distinct meeting participants")
    void peopleInNamedWorkgroup_ShouldCountParticipants() {
        // Given
        CanonicalEntity stephen = store.add(EntityKind.PERSON, "Stephen");
        CanonicalEntity vani = store.add(EntityKind.PERSON, "Vani");
        CanonicalEntity andre = store.add(EntityKind.PERSON, "Andre");
        MeetingRecord first = store.addMeeting(archives, LocalDate.of(2025, 4, 1), stephen, vani);
        MeetingRecord second = store.addMeeting(archives, LocalDate.of(2025, 4, 8), vani, andre);
        store.addMeeting(governance, LocalDate.of(2025, 4, 2), stephen);
        QuantitativeAggregator aggregator = aggregator(source);

        // When
        AggregateAnswer attended = aggregator.answer("How many people attended Archives Workgroup meetings?", null);
        AggregateAnswer members = aggregator.answer("How many people are in the Archives Workgroup?", null);

        // Then
        assertThat(attended.getQuestionType()).isEqualTo(QuestionType.PEOPLE_BY_WORKGROUP);
        assertThat(attended.getCount()).isEqualTo(3);
        assertThat(attended.getAnswer()).contains("Archives Workgroup");
        assertThat(attended.getCitations()).extracting(Citation::getRecordId)
            .containsExactly(first.getId().toString(), second.getId().toString());
        assertThat(members.getQuestionType()).isEqualTo(QuestionType.PEOPLE_BY_WORKGROUP);
        assertThat(members.getCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Decisions counted for a named workgroup exclude other workgroups")
    void decisionsOfNamedWorkgroup_ShouldCountOnlyThatWorkgroup() {
        // Given
        MeetingRecord archivesMeeting = store.addMeeting(archives, LocalDate.of(2025, 5, 1));
        archivesMeeting.getDecisions().add(new DecisionItem("Adopt the tag taxonomy", null, null));
        archivesMeeting.getDecisions().add(new DecisionItem("Publish monthly reports", null, null));
        MeetingRecord governanceMeeting = store.addMeeting(governance, LocalDate.of(2025, 5, 2));
        governanceMeeting.getDecisions().add(new DecisionItem("Approve the budget", null, null));
        QuantitativeAggregator aggregator = aggregator(source);

        // When
        AggregateAnswer scoped = aggregator.answer("How many decisions did the Archives Workgroup make?", null);
        AggregateAnswer total = aggregator.answer("How many decisions were made?", null);

        // Then
        assertThat(scoped.getQuestionType()).isEqualTo(QuestionType.DECISIONS_BY_WORKGROUP);
        assertThat(scoped.getCount()).isEqualTo(2);
        assertThat(scoped.getCitations()).extracting(Citation::getRecordId)
            .containsExactly(archivesMeeting.getId().toString());
        assertThat(total.getQuestionType()).isEqualTo(QuestionType.DECISIONS_TOTAL);
        assertThat(total.getCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Topics counted for a named workgroup are distinct, ignoring case")
    void topicsOfNamedWorkgroup_ShouldCountDistinctTopics() {
        MeetingRecord meeting = store.addMeeting(archives, LocalDate.of(2025, 5, 1));
        meeting.getTopics().add("Budget");
        meeting.getTopics().add("Tag taxonomy");
        store.addMeeting(archives, LocalDate.of(2025, 5, 8)).getTopics().add("budget");

        AggregateAnswer answer = aggregator(source).answer("How many topics did the Archives Workgroup discuss?", null);

        assertThat(answer.getQuestionType()).isEqualTo(QuestionType.TOPICS_BY_WORKGROUP);
        assertThat(answer.getCount()).isEqualTo(2);
        assertThat(answer.getCitations()).hasSize(2);
    }

    @Test
    @DisplayName("The counted noun decides the question, not the first noun mentioned")
    void countedNoun_ShouldDecideQuestionType() {
        QuantitativeAggregator aggregator = aggregator(source);

        assertThat(aggregator.answer("How many workgroups are there?", null).getQuestionType())
            .isEqualTo(QuestionType.WORKGROUPS_TOTAL);
        assertThat(aggregator.answer("In the workgroups, how many meetings were held?", null).getQuestionType())
            .isEqualTo(QuestionType.MEETINGS_TOTAL);
        assertThat(aggregator.answer("How many meetings did the Archives Workgroup hold?", null).getQuestionType())
            .isEqualTo(QuestionType.MEETINGS_BY_WORKGROUP);
        assertThat(aggregator.answer("Which person attended the most meetings?", null).getQuestionType())
            .isEqualTo(QuestionType.UNSUPPORTED);
    }

    @Test
    @DisplayName("Unsupported questions say so and list what can be asked")
    void unsupported_ShouldListSupportedQuestions() {
        AggregateAnswer answer = aggregator(source).answer("How many bananas are there?", null);

        assertThat(answer.isSupported()).isFalse();
        assertThat(answer.getCount()).isZero();
        assertThat(answer.getAnswer()).contains("cannot answer");
        assertThat(answer.getSupportedQuestions()).contains(QuestionType.MEETINGS_TOTAL.getExample());
        assertThat(answer.getMethod()).isNotBlank();
    }
}
