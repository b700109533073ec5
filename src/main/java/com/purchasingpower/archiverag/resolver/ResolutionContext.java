package com.purchasingpower.archiverag.resolver;

import lombok.Value;

import java.util.Optional;
import java.util.UUID;

/**
 * Optional disambiguation hint, currently the workgroup the name was seen in.
 */
@Value
public class ResolutionContext {

    private static final ResolutionContext NONE = new ResolutionContext(null);

    UUID groupingId;

    public static ResolutionContext none() {
        return NONE;
    }

    public static ResolutionContext forGrouping(UUID groupingId) {
        return groupingId == null ? NONE : new ResolutionContext(groupingId);
    }

    public Optional<UUID> grouping() {
        return Optional.ofNullable(groupingId);
    }

    public String cacheScope() {
        return groupingId == null ? "-" : groupingId.toString();
    }
}
