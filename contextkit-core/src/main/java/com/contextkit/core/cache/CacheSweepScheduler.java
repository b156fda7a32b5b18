package com.contextkit.core.cache;

import com.contextkit.core.prompt.ContextAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Periodically evicts expired cache entries so memory does not depend on reads.
 */
@Slf4j
@RequiredArgsConstructor
public class CacheSweepScheduler {

    private final ContextAssembler contextAssembler;

    @Scheduled(fixedDelayString = "${contextkit.cache.sweep-interval-ms:60000}")
    public void sweep() {
        int evicted = contextAssembler.sweepExpiredCache();
        if (evicted > 0) {
            CacheStats stats = contextAssembler.cacheStats();
            log.info("[CACHE] Sweep evicted expired entries | evicted={} | entries={} | estimatedSize={}",
                evicted, stats.getTotalEntries(), stats.getTotalEstimatedSize());
        } else {
            log.debug("[CACHE] Sweep found nothing to evict");
        }
    }
}
