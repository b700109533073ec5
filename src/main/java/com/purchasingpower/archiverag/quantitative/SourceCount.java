package com.purchasingpower.archiverag.quantitative;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Meeting counts read from an external bulk source.
 */
@Value
@Builder
public class SourceCount {

    private static final int SAMPLE_SIZE = 5;

    String url;

    /**
     * Items in the source array.
     */
    int total;

    /**
     * Distinct (workgroup_id, meetingInfo.date) pairs.
     */
    int unique;

    @Builder.Default
    List<String> sampleDates = List.of();

    /**
     * Counts a source document: an array of meetings or a single meeting object.
     */
    public static SourceCount from(String url, JsonNode root) {
        List<JsonNode> meetings = new ArrayList<>();
        if (root != null && root.isArray()) {
            root.forEach(meetings::add);
        } else if (root != null && root.isObject()) {
            meetings.add(root);
        }

        Set<List<String>> uniqueMeetings = new HashSet<>();
        List<String> sampleDates = new ArrayList<>();
        for (JsonNode meeting : meetings) {
            if (!meeting.isObject()) {
                continue;
            }
            String workgroupId = text(meeting.get("workgroup_id"));
            JsonNode info = meeting.get("meetingInfo");
            String date = info != null && info.isObject() ? text(info.get("date")) : null;

            if (workgroupId != null) {
                uniqueMeetings.add(Arrays.asList(workgroupId, date));
            } else if (meeting.has("id")) {
                uniqueMeetings.add(Arrays.asList(text(meeting.get("id")), date));
            }
            if (sampleDates.size() < SAMPLE_SIZE) {
                sampleDates.add(date != null ? date : "N/A");
            }
        }

        return SourceCount.builder()
            .url(url)
            .total(meetings.size())
            .unique(uniqueMeetings.size())
            .sampleDates(sampleDates)
            .build();
    }

    public boolean hasDuplicates() {
        return total != unique;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        String value = node.asText();
        return value.isEmpty() ? null : value;
    }
}
