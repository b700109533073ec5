package com.purchasingpower.archiverag.resolver.impl;

import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.EntityKind;
import com.purchasingpower.archiverag.resolver.Resolution;
import com.purchasingpower.archiverag.resolver.ResolutionContext;
import com.purchasingpower.archiverag.support.InMemoryEntityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Entity Resolver Tests")
class EntityResolverImplTest {

    private InMemoryEntityStore store;
    private AppProperties properties;
    private EntityResolverImpl resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        properties = new AppProperties();
        resolver = new EntityResolverImpl(store, properties);
    }

    @Test
    @DisplayName("Decorated name resolves to the canonical person (\"Stephen [QADAO]\" -> Stephen)")
    void decoratedName_ShouldResolveToCanonicalEntity() {
        // Given
        CanonicalEntity stephen = store.add(EntityKind.PERSON, "Stephen");
        store.add(EntityKind.PERSON, "Stephanie");

        // When
        Resolution resolution = resolver.resolve("Stephen [QADAO]", EntityKind.PERSON, ResolutionContext.none());

        // Then
        assertThat(resolution.isResolved()).isTrue();
        assertThat(resolution.getId()).isEqualTo(stephen.getId());
        assertThat(resolution.getCanonicalName()).isEqualTo("Stephen");
    }

    @Test
    @DisplayName("Alternate names count as candidate names")
    void alternateName_ShouldResolve() {
        CanonicalEntity archives = store.add(EntityKind.WORKGROUP, "Archives Workgroup", "Archive WG");

        Resolution resolution = resolver.resolve("archive wg", EntityKind.WORKGROUP, ResolutionContext.none());

        assertThat(resolution.getId()).isEqualTo(archives.getId());
        assertThat(resolution.getCanonicalName()).isEqualTo("Archives Workgroup");
    }

    @Test
    @DisplayName("Unknown name returns the nil identity with the normalized name")
    void unknownName_ShouldReturnUnresolved() {
        store.add(EntityKind.PERSON, "Stephen");

        Resolution resolution = resolver.resolve("Zoe (Guest)", EntityKind.PERSON, ResolutionContext.none());

        assertThat(resolution.isResolved()).isFalse();
        assertThat(resolution.getId()).isEqualTo(Resolution.UNRESOLVED_ID);
        assertThat(resolution.getCanonicalName()).isEqualTo("Zoe");
    }

    @Test
    @DisplayName("Resolving the same name twice gives the same identity and loads the pool once")
    void resolve_ShouldBeIdempotentAndCached() {
        store.add(EntityKind.PERSON, "Stephen");

        Resolution first = resolver.resolve("Stephen [QADAO]", EntityKind.PERSON, ResolutionContext.none());
        Resolution second = resolver.resolve("  stephen [qadao] ", EntityKind.PERSON, ResolutionContext.none());

        assertThat(second).isEqualTo(first);
        assertThat(store.listEntityCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("Equal scores keep pool order")
    void ties_ShouldKeepPoolOrder() {
        CanonicalEntity first = CanonicalEntity.builder().id(UUID.randomUUID()).displayName("Alex").kind(EntityKind.PERSON).build();
        CanonicalEntity second = CanonicalEntity.builder().id(UUID.randomUUID()).displayName("Alex").kind(EntityKind.PERSON).build();

        Resolution resolution = resolver.resolve("Alex", List.of(first, second), ResolutionContext.none());

        assertThat(resolution.getId()).isEqualTo(first.getId());
    }

    @Test
    @DisplayName("Explicit pools are cached per pool, so a different pool is resolved again")
    void explicitPools_ShouldNotShareCachedResults() {
        // Given
        CanonicalEntity first = CanonicalEntity.builder().id(UUID.randomUUID()).displayName("Stephen").kind(EntityKind.PERSON).build();
        CanonicalEntity second = CanonicalEntity.builder().id(UUID.randomUUID()).displayName("Stephen").kind(EntityKind.PERSON).build();

        // When
        Resolution fromFirst = resolver.resolve("Stephen", List.of(first), ResolutionContext.none());
        Resolution fromSecond = resolver.resolve("Stephen", List.of(second), ResolutionContext.none());
        Resolution fromEmpty = resolver.resolve("Stephen", List.of(), ResolutionContext.none());
        Resolution fromFirstAgain = resolver.resolve("Stephen", List.of(first), ResolutionContext.none());

        // Then
        assertThat(fromFirst.getId()).isEqualTo(first.getId());
        assertThat(fromSecond.getId()).isEqualTo(second.getId());
        assertThat(fromEmpty.isResolved()).isFalse();
        assertThat(fromFirstAgain).isEqualTo(fromFirst);
        assertThat(resolver.cacheSize()).isEqualTo(3);
    }

    @Test
    @DisplayName("Concurrent resolutions share one cache entry per name and one pool load")
    void concurrentResolutions_ShouldBeConsistent() throws Exception {
        // Given
        store.add(EntityKind.PERSON, "Stephen");
        store.add(EntityKind.PERSON, "Vani");
        store.add(EntityKind.PERSON, "Andre");
        List<String> names = List.of("Stephen", " stephen ", "Vani", "VANI", "Andre", "Zoe");
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        Map<String, Set<Resolution>> seen = new ConcurrentHashMap<>();
        List<Future<?>> futures = new ArrayList<>();

        // When
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int round = 0; round < 50; round++) {
                        for (String name : names) {
                            Resolution resolution = resolver.resolve(name, EntityKind.PERSON, ResolutionContext.none());
                            seen.computeIfAbsent(name.trim().toLowerCase(), k -> ConcurrentHashMap.newKeySet())
                                .add(resolution);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(seen).hasSize(4);
        assertThat(seen.values()).allSatisfy(results -> assertThat(results).hasSize(1));
        assertThat(seen.get("stephen").iterator().next().getCanonicalName()).isEqualTo("Stephen");
        assertThat(seen.get("zoe").iterator().next().isResolved()).isFalse();
        assertThat(resolver.cacheSize()).isEqualTo(4);
        assertThat(store.listEntityCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("Workgroup context prefers the candidate who attends that workgroup's meetings")
    void context_ShouldRerankByAffinity() {
        // Given two people with the same name, the second active in the Archives Workgroup
        CanonicalEntity archives = store.add(EntityKind.WORKGROUP, "Archives Workgroup");
        CanonicalEntity firstAlex = store.add(EntityKind.PERSON, "Alex");
        CanonicalEntity secondAlex = store.add(EntityKind.PERSON, "Alex");
        store.addMeeting(archives, LocalDate.of(2025, 3, 1), secondAlex);
        store.addMeeting(archives, LocalDate.of(2025, 3, 8), secondAlex);

        // When
        Resolution withoutContext = resolver.resolve("Alex", EntityKind.PERSON, ResolutionContext.none());
        Resolution withContext = resolver.resolve("Alex", EntityKind.PERSON,
            ResolutionContext.forGrouping(archives.getId()));

        // Then
        assertThat(withoutContext.getId()).isEqualTo(firstAlex.getId());
        assertThat(withContext.getId()).isEqualTo(secondAlex.getId());
    }

    @Test
    @DisplayName("Context without any affinity keeps the similarity order")
    void contextWithoutAffinity_ShouldKeepSimilarityOrder() {
        CanonicalEntity archives = store.add(EntityKind.WORKGROUP, "Archives Workgroup");
        CanonicalEntity firstAlex = store.add(EntityKind.PERSON, "Alex");
        store.add(EntityKind.PERSON, "Alex");

        Resolution resolution = resolver.resolve("Alex", EntityKind.PERSON,
            ResolutionContext.forGrouping(archives.getId()));

        assertThat(resolution.getId()).isEqualTo(firstAlex.getId());
    }

    @Test
    @DisplayName("Blank names are rejected before the store is touched")
    void blankName_ShouldBeRejected() {
        assertThatThrownBy(() -> resolver.resolve("   ", EntityKind.PERSON, ResolutionContext.none()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be empty");
        assertThatThrownBy(() -> resolver.resolve(null, List.of(), ResolutionContext.none()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.listEntityCalls()).isZero();
    }

    @Test
    @DisplayName("Cached results survive store changes until the cache is cleared")
    void clearCache_ShouldPickUpStoreChanges() {
        Resolution before = resolver.resolve("Zoe", EntityKind.PERSON, ResolutionContext.none());
        CanonicalEntity zoe = store.add(EntityKind.PERSON, "Zoe");

        Resolution cached = resolver.resolve("Zoe", EntityKind.PERSON, ResolutionContext.none());
        resolver.clearCache();
        Resolution after = resolver.resolve("Zoe", EntityKind.PERSON, ResolutionContext.none());

        assertThat(before.isResolved()).isFalse();
        assertThat(cached.isResolved()).isFalse();
        assertThat(after.getId()).isEqualTo(zoe.getId());
    }

    @Test
    @DisplayName("With fuzzy matching off only exact names resolve")
    void fuzzyDisabled_ShouldRequireExactName() {
        properties.getResolver().setEnableFuzzyMatching(false);
        EntityResolverImpl exactResolver = new EntityResolverImpl(store, properties);
        store.add(EntityKind.PERSON, "Stephen Smith");

        assertThat(exactResolver.resolve("Stephen Smyth", EntityKind.PERSON, ResolutionContext.none()).isResolved())
            .isFalse();
        assertThat(exactResolver.resolve("stephen smith", EntityKind.PERSON, ResolutionContext.none()).isResolved())
            .isTrue();
    }

    @Test
    @DisplayName("Suggestions list close display names, best first")
    void suggest_ShouldReturnCloseNames() {
        store.add(EntityKind.WORKGROUP, "Archives Workgroup");
        store.add(EntityKind.WORKGROUP, "Ambassador Program");
        store.add(EntityKind.WORKGROUP, "Governance Workgroup");

        List<String> suggestions = resolver.suggest("Archive", EntityKind.WORKGROUP, 3);

        assertThat(suggestions).first().isEqualTo("Archives Workgroup");
        assertThat(suggestions).doesNotContain("Governance Workgroup");
    }
}
