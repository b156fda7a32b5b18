package com.contextkit.core.cache;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One namespace of the tiered cache. Expiry is lazy: an expired entry is
 * removed by whichever read or sweep sees it first.
 */
class PartitionStore<K> {

    private final CachePartition partition;
    private final Map<K, CacheEntry> entries = new ConcurrentHashMap<>();

    PartitionStore(CachePartition partition) {
        this.partition = partition;
    }

    CachePartition partition() {
        return partition;
    }

    void put(K key, CacheEntry entry) {
        entries.put(key, entry);
    }

    Optional<CacheEntry> get(K key, Instant now) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpired(now)) {
            // Only drop the instance we inspected; a concurrent set may already have replaced it.
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    boolean remove(K key) {
        return entries.remove(key) != null;
    }

    void clear() {
        entries.clear();
    }

    int sweep(Instant now) {
        int evicted = 0;
        for (Map.Entry<K, CacheEntry> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                evicted++;
            }
        }
        return evicted;
    }

    CacheStats.PartitionStats stats() {
        int count = 0;
        long size = 0;
        for (CacheEntry entry : entries.values()) {
            count++;
            size += entry.getEstimatedSize();
        }
        return CacheStats.PartitionStats.builder()
            .entryCount(count)
            .estimatedSize(size)
            .build();
    }
}
