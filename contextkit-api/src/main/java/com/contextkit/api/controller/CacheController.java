package com.contextkit.api.controller;

import com.contextkit.core.cache.CacheStats;
import com.contextkit.core.prompt.ContextAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/cache")
@RequiredArgsConstructor
@Slf4j
public class CacheController {

    private final ContextAssembler contextAssembler;

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStatistics() {
        CacheStats stats = contextAssembler.cacheStats();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("static", partition(stats.getStaticPartition()));
        response.put("semiStatic", partition(stats.getSemiStaticPartition()));
        response.put("retrieval", partition(stats.getRetrievalPartition()));
        response.put("totalEntries", stats.getTotalEntries());
        response.put("totalEstimatedSize", stats.getTotalEstimatedSize());
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/static/{key}")
    public ResponseEntity<Void> invalidateStatic(@PathVariable String key) {
        log.info("[API] Invalidate static cache entry | key={}", key);
        contextAssembler.invalidateStatic(key);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/semi-static/{key}")
    public ResponseEntity<Void> invalidateSemiStatic(@PathVariable String key) {
        log.info("[API] Invalidate semi-static cache entry | key={}", key);
        contextAssembler.invalidateSemiStatic(key);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/retrieval")
    public ResponseEntity<Void> clearRetrieval() {
        log.info("[API] Clear retrieval cache");
        contextAssembler.clearRetrievalCache();
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping
    public ResponseEntity<Void> clearAll() {
        log.info("[API] Clear all cache partitions");
        contextAssembler.clearCache();
        return ResponseEntity.noContent().build();
    }

    private static Map<String, Object> partition(CacheStats.PartitionStats stats) {
        return Map.of(
            "entryCount", stats.getEntryCount(),
            "estimatedSize", stats.getEstimatedSize()
        );
    }
}
