package com.contextkit.core.cache;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable cached fragment. A zero ttl means the entry only leaves the cache
 * through explicit invalidation.
 */
@Getter
@Builder
public class CacheEntry {
    private final String content;
    private final Instant createdAt;
    private final Duration ttl;
    private final int estimatedSize;

    public boolean neverExpires() {
        return ttl == null || ttl.isZero();
    }

    public boolean isExpired(Instant now) {
        if (neverExpires()) {
            return false;
        }
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }
}
