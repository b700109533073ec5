package com.purchasingpower.archiverag.service.handler;

import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.DateWindow;
import com.purchasingpower.archiverag.core.MeetingRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Meetings selected by the workgroup and date named in a question.
 */
@Value
@Builder
public class MeetingScope {

    CanonicalEntity workgroup;
    DateWindow window;
    List<MeetingRecord> meetings;
    Map<UUID, String> workgroupNames;

    public Optional<CanonicalEntity> workgroup() {
        return Optional.ofNullable(workgroup);
    }

    public String workgroupNameOf(MeetingRecord meeting) {
        if (meeting.getWorkgroupId() == null) {
            return "Unknown Workgroup";
        }
        return workgroupNames.getOrDefault(meeting.getWorkgroupId(), "Unknown Workgroup");
    }

    /**
     * Human-readable scope, e.g. " by Archives Workgroup in March 2025".
     */
    public String describe() {
        StringBuilder description = new StringBuilder();
        if (workgroup != null) {
            description.append(" by ").append(workgroup.getDisplayName());
        }
        if (window != null) {
            description.append(" in ").append(window.describe());
        }
        return description.toString();
    }
}
