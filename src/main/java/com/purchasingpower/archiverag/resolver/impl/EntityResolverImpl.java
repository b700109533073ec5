package com.purchasingpower.archiverag.resolver.impl;

import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.configuration.ResolverProperties;
import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.EntityKind;
import com.purchasingpower.archiverag.core.MeetingRecord;
import com.purchasingpower.archiverag.knowledge.EntityStore;
import com.purchasingpower.archiverag.resolver.EntityResolver;
import com.purchasingpower.archiverag.resolver.NameSimilarity;
import com.purchasingpower.archiverag.resolver.PatternNormalizer;
import com.purchasingpower.archiverag.resolver.Resolution;
import com.purchasingpower.archiverag.resolver.ResolutionCache;
import com.purchasingpower.archiverag.resolver.ResolutionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Resolver backed by the entity store.
 *
 * <p>Steps: strip decorative patterns, score every candidate name, keep candidates at or
 * above the threshold (best first, ties in pool order), then optionally re-rank by how
 * often each candidate took part in meetings of the context workgroup.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class EntityResolverImpl implements EntityResolver {

    private static final String EXPLICIT_POOL_SCOPE = "pool";
    private static final double SUGGESTION_FLOOR = 0.5;

    private final EntityStore entityStore;
    private final ResolverProperties properties;
    private final PatternNormalizer normalizer;
    private final ResolutionCache cache = new ResolutionCache();

    public EntityResolverImpl(EntityStore entityStore, AppProperties appProperties) {
        this.entityStore = entityStore;
        this.properties = appProperties.getResolver();
        this.normalizer = new PatternNormalizer(properties.getPatternRules());

        log.info("✅ Entity resolver ready: threshold={}, patternRules={}, fuzzy={}, context={}",
            properties.getSimilarityThreshold(),
            normalizer.ruleCount(),
            properties.isEnableFuzzyMatching(),
            properties.isEnableContextDisambiguation());
    }

    @Override
    public Resolution resolve(String name, List<CanonicalEntity> candidatePool, ResolutionContext context) {
        requireName(name);
        ResolutionContext ctx = context != null ? context : ResolutionContext.none();
        String scope = EXPLICIT_POOL_SCOPE + ":" + ResolutionCache.poolFingerprint(candidatePool)
            + "@" + ctx.cacheScope();
        String key = ResolutionCache.key(scope, name);
        return cache.getOrResolve(key, k -> doResolve(name, candidatePool, ctx));
    }

    @Override
    public Resolution resolve(String name, EntityKind kind, ResolutionContext context) {
        requireName(name);
        ResolutionContext ctx = context != null ? context : ResolutionContext.none();
        String key = ResolutionCache.key(kind.name() + "@" + ctx.cacheScope(), name);
        return cache.getOrResolve(key, k -> doResolve(name, pool(kind), ctx));
    }

    @Override
    public List<String> suggest(String name, EntityKind kind, int limit) {
        if (name == null || name.isBlank() || limit <= 0) {
            return List.of();
        }
        String normalized = normalizer.normalize(name);
        String lower = normalized.toLowerCase();

        List<Scored> scored = new ArrayList<>();
        for (CanonicalEntity entity : pool(kind)) {
            double score = bestScore(normalized, entity);
            boolean contains = entity.getDisplayName() != null
                && entity.getDisplayName().toLowerCase().contains(lower);
            if (score >= SUGGESTION_FLOOR || contains) {
                scored.add(new Scored(entity, score));
            }
        }
        scored.sort(Comparator.comparingDouble(Scored::score).reversed());

        Set<String> names = new LinkedHashSet<>();
        for (Scored candidate : scored) {
            names.add(candidate.entity().getDisplayName());
            if (names.size() >= limit) {
                break;
            }
        }
        return List.copyOf(names);
    }

    @Override
    public void clearCache() {
        int entries = cache.size();
        cache.clear();
        log.info("🧹 Entity resolver cache cleared ({} entries)", entries);
    }

    /**
     * Number of cached resolutions.
     */
    public int cacheSize() {
        return cache.size();
    }

    private List<CanonicalEntity> pool(EntityKind kind) {
        return cache.getOrLoadPool(kind, () -> entityStore.listEntities(kind));
    }

    private Resolution doResolve(String name, List<CanonicalEntity> candidatePool, ResolutionContext context) {
        String normalized = normalizer.normalize(name);
        List<CanonicalEntity> pool = candidatePool != null ? candidatePool : List.of();

        List<Scored> survivors = new ArrayList<>();
        for (CanonicalEntity candidate : pool) {
            double score = properties.isEnableFuzzyMatching()
                ? bestScore(normalized, candidate)
                : exactScore(normalized, candidate);
            if (score >= properties.getSimilarityThreshold()) {
                survivors.add(new Scored(candidate, score));
            }
        }
        // List.sort is stable, so equal scores keep pool order
        survivors.sort(Comparator.comparingDouble(Scored::score).reversed());

        if (properties.isEnableContextDisambiguation() && context.grouping().isPresent() && survivors.size() > 1) {
            survivors = rerankByAffinity(survivors, context.getGroupingId());
        }

        if (survivors.isEmpty()) {
            log.debug("Unresolved name '{}' (normalized '{}', pool={})", name, normalized, pool.size());
            return Resolution.unresolved(normalized);
        }

        CanonicalEntity best = survivors.get(0).entity();
        log.debug("Resolved '{}' -> {} ({})", name, best.getDisplayName(), best.getId());
        return Resolution.of(best);
    }

    private List<Scored> rerankByAffinity(List<Scored> survivors, UUID groupingId) {
        List<MeetingRecord> groupingMeetings = entityStore.listMeetings().stream()
            .filter(meeting -> groupingId.equals(meeting.getWorkgroupId()))
            .toList();

        List<Scored> withAffinity = new ArrayList<>();
        boolean anyAffinity = false;
        for (Scored survivor : survivors) {
            long shared = groupingMeetings.stream()
                .filter(meeting -> meeting.hasParticipant(survivor.entity().getId()))
                .count();
            double affinity = shared * properties.getAffinityIncrement();
            anyAffinity |= affinity > 0;
            withAffinity.add(new Scored(survivor.entity(), affinity));
        }

        if (!anyAffinity) {
            return survivors;
        }
        withAffinity.sort(Comparator.comparingDouble(Scored::score).reversed());
        log.debug("Re-ranked {} candidates by workgroup {} affinity", survivors.size(), groupingId);
        return withAffinity;
    }

    private double bestScore(String normalized, CanonicalEntity candidate) {
        double best = 0.0;
        for (String candidateName : candidate.allNames()) {
            best = Math.max(best, NameSimilarity.ratio(normalized, candidateName));
        }
        return best;
    }

    private double exactScore(String normalized, CanonicalEntity candidate) {
        return candidate.allNames().stream().anyMatch(n -> n.equalsIgnoreCase(normalized)) ? 1.0 : 0.0;
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity name cannot be empty");
        }
    }

    private record Scored(CanonicalEntity entity, double score) {
    }
}
