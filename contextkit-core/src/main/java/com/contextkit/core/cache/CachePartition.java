package com.contextkit.core.cache;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;

/**
 * Cache namespaces, one per context volatility tier.
 */
@Getter
@RequiredArgsConstructor
public enum CachePartition {

    STATIC(Duration.ZERO),                 // identity, reloaded only on file change
    SEMI_STATIC(Duration.ofMinutes(10)),   // facts summary
    RETRIEVAL(Duration.ofMinutes(5));      // long-term memory search results

    private final Duration defaultTtl;
}
