package com.purchasingpower.archiverag.resolver;

import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.EntityKind;

import java.util.List;

/**
 * Maps free-text names to canonical entities despite spelling and decoration variants.
 *
 * <p>Resolution is deterministic and cached: the same name against an unchanged pool
 * always gives the same identity until {@link #clearCache()}.
 *
 * @since 1.0.0
 */
public interface EntityResolver {

    /**
     * Resolves a name against an explicit candidate pool.
     *
     * @throws IllegalArgumentException if the name is null or blank
     */
    Resolution resolve(String name, List<CanonicalEntity> candidatePool, ResolutionContext context);

    /**
     * Resolves a name against every entity of a kind in the entity store.
     *
     * @throws IllegalArgumentException if the name is null or blank
     */
    Resolution resolve(String name, EntityKind kind, ResolutionContext context);

    /**
     * Closest display names for "did you mean" messages, best first.
     */
    List<String> suggest(String name, EntityKind kind, int limit);

    /**
     * Drops cached resolutions and candidate pools.
     */
    void clearCache();
}
