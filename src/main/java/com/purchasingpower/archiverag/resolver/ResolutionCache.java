package com.purchasingpower.archiverag.resolver;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.EntityKind;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resolution and candidate-pool cache owned by one resolver instance.
 *
 * <p>Entries live until {@link #clear()}; call it whenever the entity store changes.
 * Safe for concurrent readers and writers.
 */
@Slf4j
public class ResolutionCache {

    private final Map<String, Resolution> resolutions = new ConcurrentHashMap<>();
    private final Map<EntityKind, List<CanonicalEntity>> pools = new ConcurrentHashMap<>();

    /**
     * Key for a name within a scope (entity kind or explicit pool, plus context grouping).
     * Names are compared lower-cased and trimmed.
     */
    public static String key(String scope, String name) {
        return scope + "|" + name.trim().toLowerCase();
    }

    /**
     * Stable fingerprint of an explicit candidate pool: its entity ids in pool order.
     */
    public static String poolFingerprint(List<CanonicalEntity> pool) {
        if (pool == null || pool.isEmpty()) {
            return "empty";
        }
        Hasher hasher = Hashing.murmur3_128().newHasher();
        for (CanonicalEntity candidate : pool) {
            hasher.putString(String.valueOf(candidate.getId()), StandardCharsets.UTF_8).putChar(',');
        }
        return pool.size() + ":" + hasher.hash();
    }

    public Resolution getOrResolve(String key, Function<String, Resolution> resolver) {
        Resolution cached = resolutions.get(key);
        if (cached != null) {
            log.debug("Resolution cache hit: {}", key);
            return cached;
        }
        return resolutions.computeIfAbsent(key, resolver);
    }

    public List<CanonicalEntity> getOrLoadPool(EntityKind kind, Supplier<List<CanonicalEntity>> loader) {
        return pools.computeIfAbsent(kind, k -> List.copyOf(loader.get()));
    }

    public int size() {
        return resolutions.size();
    }

    public void clear() {
        resolutions.clear();
        pools.clear();
        log.debug("Resolution cache cleared");
    }
}
