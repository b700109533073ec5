package com.purchasingpower.archiverag.quantitative;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Source Count Tests")
class SourceCountTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Duplicate (workgroup, date) pairs count once as unique meetings")
    void duplicates_ShouldCountOnceAsUnique() throws Exception {
        JsonNode root = objectMapper.readTree("""
            [
              {"workgroup_id": "wg-1", "meetingInfo": {"date": "2025-01-07"}},
              {"workgroup_id": "wg-1", "meetingInfo": {"date": "2025-01-07"}},
              {"workgroup_id": "wg-1", "meetingInfo": {"date": "2025-01-14"}},
              {"workgroup_id": "wg-2", "meetingInfo": {"date": "2025-01-07"}}
            ]
            """);

        SourceCount count = SourceCount.from("https://example.org/m.json", root);

        assertThat(count.getTotal()).isEqualTo(4);
        assertThat(count.getUnique()).isEqualTo(3);
        assertThat(count.hasDuplicates()).isTrue();
        assertThat(count.getSampleDates()).startsWith("2025-01-07");
    }

    @Test
    @DisplayName("A single object counts as one meeting")
    void singleObject_ShouldCountAsOne() throws Exception {
        JsonNode root = objectMapper.readTree("{\"workgroup_id\": \"wg-1\", \"meetingInfo\": {\"date\": \"2025-02-01\"}}");

        SourceCount count = SourceCount.from("u", root);

        assertThat(count.getTotal()).isEqualTo(1);
        assertThat(count.getUnique()).isEqualTo(1);
        assertThat(count.hasDuplicates()).isFalse();
    }
}
