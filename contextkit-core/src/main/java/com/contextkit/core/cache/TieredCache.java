package com.contextkit.core.cache;

import com.contextkit.common.util.SizeEstimator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Three-tier context cache.
 *
 * <ul>
 *   <li>static: loaded once, kept until explicitly invalidated (ttl 0)</li>
 *   <li>semi-static: refreshed after a medium ttl or on preference changes</li>
 *   <li>retrieval: memory search results keyed by (event type, keywords)</li>
 * </ul>
 *
 * Lookups never throw; a miss is an empty {@link Optional}. Safe for concurrent
 * use: last writer wins on set, and entries are immutable so a reader racing an
 * invalidation sees either the old content or nothing.
 */
@Slf4j
public class TieredCache {

    private final Clock clock;
    private final PartitionStore<String> staticStore = new PartitionStore<>(CachePartition.STATIC);
    private final PartitionStore<String> semiStaticStore = new PartitionStore<>(CachePartition.SEMI_STATIC);
    private final PartitionStore<RetrievalKey> retrievalStore = new PartitionStore<>(CachePartition.RETRIEVAL);

    public TieredCache(Clock clock) {
        this.clock = clock;
    }

    // ========== Static ==========

    public void setStatic(String key, String content) {
        setStatic(key, content, CachePartition.STATIC.getDefaultTtl(), null);
    }

    public void setStatic(String key, String content, Duration ttl) {
        setStatic(key, content, ttl, null);
    }

    public void setStatic(String key, String content, Duration ttl, Integer estimatedSize) {
        staticStore.put(key, newEntry(content, ttl, estimatedSize));
    }

    public Optional<String> getStatic(String key) {
        return lookup(staticStore, key);
    }

    public void invalidateStatic(String key) {
        if (staticStore.remove(key)) {
            log.debug("[CACHE] Static entry invalidated | key={}", key);
        }
    }

    // ========== Semi-static ==========

    public void setSemiStatic(String key, String content) {
        setSemiStatic(key, content, CachePartition.SEMI_STATIC.getDefaultTtl(), null);
    }

    public void setSemiStatic(String key, String content, Duration ttl) {
        setSemiStatic(key, content, ttl, null);
    }

    public void setSemiStatic(String key, String content, Duration ttl, Integer estimatedSize) {
        semiStaticStore.put(key, newEntry(content, ttl, estimatedSize));
    }

    public Optional<String> getSemiStatic(String key) {
        return lookup(semiStaticStore, key);
    }

    public void invalidateSemiStatic(String key) {
        if (semiStaticStore.remove(key)) {
            log.debug("[CACHE] Semi-static entry invalidated | key={}", key);
        }
    }

    // ========== Retrieval ==========

    public void setRetrieval(String eventType, String keywords, String content) {
        setRetrieval(eventType, keywords, content, CachePartition.RETRIEVAL.getDefaultTtl(), null);
    }

    public void setRetrieval(String eventType, String keywords, String content, Duration ttl) {
        setRetrieval(eventType, keywords, content, ttl, null);
    }

    public void setRetrieval(String eventType, String keywords, String content, Duration ttl, Integer estimatedSize) {
        retrievalStore.put(RetrievalKey.of(eventType, keywords), newEntry(content, ttl, estimatedSize));
    }

    public Optional<String> getRetrieval(String eventType, String keywords) {
        return lookup(retrievalStore, RetrievalKey.of(eventType, keywords));
    }

    public void invalidateRetrieval(String eventType, String keywords) {
        retrievalStore.remove(RetrievalKey.of(eventType, keywords));
    }

    public void clearRetrievalCache() {
        retrievalStore.clear();
        log.debug("[CACHE] Retrieval partition cleared");
    }

    // ========== Whole cache ==========

    public void clearPartition(CachePartition partition) {
        if (partition == CachePartition.STATIC) {
            staticStore.clear();
        } else if (partition == CachePartition.SEMI_STATIC) {
            semiStaticStore.clear();
        } else {
            retrievalStore.clear();
        }
        log.debug("[CACHE] Partition cleared | partition={}", partition);
    }

    public void clearAll() {
        staticStore.clear();
        semiStaticStore.clear();
        retrievalStore.clear();
        log.info("[CACHE] All partitions cleared");
    }

    /**
     * Evicts every expired entry.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        return staticStore.sweep(now) + semiStaticStore.sweep(now) + retrievalStore.sweep(now);
    }

    /**
     * Per-partition entry counts and sizes, taken after a full expiry sweep.
     */
    public CacheStats stats() {
        int evicted = sweepExpired();
        if (evicted > 0) {
            log.debug("[CACHE] Expired entries evicted during stats | evicted={}", evicted);
        }
        return CacheStats.builder()
            .staticPartition(staticStore.stats())
            .semiStaticPartition(semiStaticStore.stats())
            .retrievalPartition(retrievalStore.stats())
            .build();
    }

    private <K> Optional<String> lookup(PartitionStore<K> store, K key) {
        Optional<String> content = store.get(key, clock.instant()).map(CacheEntry::getContent);
        if (log.isDebugEnabled()) {
            log.debug("[CACHE] {} | partition={} | key={}", content.isPresent() ? "Hit" : "Miss", store.partition(), key);
        }
        return content;
    }

    private CacheEntry newEntry(String content, Duration ttl, Integer estimatedSize) {
        String safeContent = content == null ? "" : content;
        return CacheEntry.builder()
            .content(safeContent)
            .createdAt(clock.instant())
            .ttl(ttl == null ? Duration.ZERO : ttl)
            .estimatedSize(estimatedSize != null ? estimatedSize : SizeEstimator.estimate(safeContent))
            .build();
    }
}
