package com.purchasingpower.archiverag.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Authoritative meeting record as held by the entity store.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeetingRecord {

    private UUID id;
    private UUID workgroupId;
    private LocalDate date;
    private String purpose;

    @Builder.Default
    private List<UUID> participantIds = new ArrayList<>();

    @Builder.Default
    private List<String> topics = new ArrayList<>();

    @Builder.Default
    private List<DecisionItem> decisions = new ArrayList<>();

    public boolean hasParticipant(UUID personId) {
        return participantIds != null && participantIds.contains(personId);
    }
}
