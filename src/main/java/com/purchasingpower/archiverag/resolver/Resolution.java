package com.purchasingpower.archiverag.resolver;

import com.purchasingpower.archiverag.core.CanonicalEntity;
import lombok.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * Result of resolving a name: a canonical identity, or {@link #UNRESOLVED_ID} paired
 * with the pattern-normalized name. Callers decide what an unresolved name means.
 */
@Value
public class Resolution {

    public static final UUID UNRESOLVED_ID = new UUID(0L, 0L);

    UUID id;
    String canonicalName;
    CanonicalEntity entity;

    public static Resolution of(CanonicalEntity entity) {
        return new Resolution(entity.getId(), entity.getDisplayName(), entity);
    }

    public static Resolution unresolved(String normalizedName) {
        return new Resolution(UNRESOLVED_ID, normalizedName, null);
    }

    public boolean isResolved() {
        return !UNRESOLVED_ID.equals(id);
    }

    public Optional<CanonicalEntity> entity() {
        return Optional.ofNullable(entity);
    }
}
