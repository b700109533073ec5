package com.purchasingpower.archiverag.verification;

import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.core.RecordIds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Negative Response Detector Tests")
class NegativeResponseDetectorTest {

    private final NegativeResponseDetector detector = new NegativeResponseDetector();

    @Test
    @DisplayName("Negative answers are recognized")
    void negativeAnswers() {
        List<String> answers = List.of(
            "AGI was not mentioned in the retrieved meetings.",
            "There is no specific mention of the budget.",
            "I could not find anything about the treasury.",
            "No decisions were recorded.",
            "There were no meetings in that month.",
            "The topic does not appear in these notes.",
            "   ");

        for (String answer : answers) {
            assertThat(detector.isNegative(answer)).as(answer).isTrue();
        }
    }

    @Test
    @DisplayName("Ordinary answers are not negative")
    void positiveAnswers() {
        List<String> answers = List.of(
            "The Archives Workgroup adopted the tag taxonomy.",
            "November meetings focused on onboarding.",
            "Nothing else was decided, but the roadmap was approved.");

        for (String answer : answers) {
            assertThat(detector.isNegative(answer)).as(answer).isFalse();
        }
    }

    @Test
    @DisplayName("Null answers are negative")
    void nullAnswer_ShouldBeNegative() {
        assertThat(detector.isNegative(null)).isTrue();
    }

    @Test
    @DisplayName("Negative answers keep only sentinel citations")
    void filterCitations_ShouldKeepSentinelsForNegativeAnswers() {
        Citation marker = Citation.noEvidence("nothing relevant");
        Citation record = Citation.builder().recordId(UUID.randomUUID().toString()).build();

        List<Citation> negative = detector.filterCitations(List.of(record, marker), "Not discussed in any meeting.");
        List<Citation> positive = detector.filterCitations(List.of(record, marker), "The roadmap was approved.");

        assertThat(negative).extracting(Citation::getRecordId).containsExactly(RecordIds.NO_EVIDENCE);
        assertThat(positive).containsExactly(record, marker);
    }
}
