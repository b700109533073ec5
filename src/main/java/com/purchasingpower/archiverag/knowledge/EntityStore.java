package com.purchasingpower.archiverag.knowledge;

import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.EntityKind;
import com.purchasingpower.archiverag.core.MeetingRecord;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only access to the authoritative entity store.
 *
 * <p>Implementations throw
 * {@link com.purchasingpower.archiverag.exception.CollaboratorUnavailableException}
 * when the store cannot be read at all. A missing entity is an empty result, not an error.
 *
 * @since 1.0.0
 */
public interface EntityStore {

    /**
     * All entities of one kind, in a stable order.
     */
    List<CanonicalEntity> listEntities(EntityKind kind);

    Optional<CanonicalEntity> getEntity(EntityKind kind, UUID id);

    /**
     * All meeting records, in a stable order.
     */
    List<MeetingRecord> listMeetings();

    Optional<MeetingRecord> getMeeting(UUID id);
}
