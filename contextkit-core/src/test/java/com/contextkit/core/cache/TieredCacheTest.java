package com.contextkit.core.cache;

import com.contextkit.core.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TieredCacheTest {

    private MutableClock clock;
    private TieredCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T08:00:00Z"));
        cache = new TieredCache(clock);
    }

    @Test
    void zeroTtlEntrySurvivesUntilInvalidated() {
        cache.setStatic("identity", "hello");
        clock.advance(Duration.ofDays(365));

        assertThat(cache.getStatic("identity")).contains("hello");

        cache.invalidateStatic("identity");
        assertThat(cache.getStatic("identity")).isEmpty();
    }

    @Test
    void entryExpiresOnlyAfterTtlElapsed() {
        cache.setSemiStatic("facts_summary", "likes tea", Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(10));
        assertThat(cache.getSemiStatic("facts_summary")).contains("likes tea");

        clock.advance(Duration.ofMillis(1));
        assertThat(cache.getSemiStatic("facts_summary")).isEmpty();
    }

    @Test
    void expiredEntryIsRemovedOnRead() {
        cache.setSemiStatic("facts_summary", "likes tea", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(11));

        assertThat(cache.getSemiStatic("facts_summary")).isEmpty();
        assertThat(cache.stats().getSemiStaticPartition().getEntryCount()).isZero();
    }

    @Test
    void setOverwritesAndRestartsTtl() {
        cache.setRetrieval("conversation", "work", "first", Duration.ofSeconds(5));
        clock.advance(Duration.ofSeconds(4));
        cache.setRetrieval("conversation", "work", "second", Duration.ofSeconds(5));
        clock.advance(Duration.ofSeconds(4));

        assertThat(cache.getRetrieval("conversation", "work")).contains("second");
    }

    @Test
    void retrievalKeyIsDeterministic() {
        cache.setRetrieval("conversation", "work stress", "memories");

        assertThat(cache.getRetrieval("conversation", "work stress")).contains("memories");
        assertThat(cache.getRetrieval("conversation", "work")).isEmpty();
        assertThat(cache.getRetrieval("click", "work stress")).isEmpty();
    }

    @Test
    void retrievalKeyKeepsFieldsApart() {
        cache.setRetrieval("ab", "c", "one");
        cache.setRetrieval("a", "bc", "two");

        assertThat(cache.getRetrieval("ab", "c")).contains("one");
        assertThat(cache.getRetrieval("a", "bc")).contains("two");
    }

    @Test
    void partitionsAreIndependent() {
        cache.setStatic("k", "static");
        cache.setSemiStatic("k", "semi");

        cache.invalidateSemiStatic("k");

        assertThat(cache.getStatic("k")).contains("static");
        assertThat(cache.getSemiStatic("k")).isEmpty();
    }

    @Test
    void invalidatingMissingKeyIsNoop() {
        cache.invalidateStatic("missing");
        cache.invalidateRetrieval("none", "none");

        assertThat(cache.stats().getTotalEntries()).isZero();
    }

    @Test
    void nullContentIsStoredAsEmpty() {
        cache.setStatic("identity", null);

        assertThat(cache.getStatic("identity")).contains("");
    }

    @Test
    void statsSweepsExpiredEntriesFirst() {
        cache.setStatic("identity", "hello world");
        cache.setSemiStatic("facts_summary", "a b c", Duration.ofSeconds(1));
        cache.setRetrieval("conversation", "x", "one two", Duration.ofSeconds(100));
        clock.advance(Duration.ofSeconds(2));

        CacheStats stats = cache.stats();

        assertThat(stats.getStaticPartition().getEntryCount()).isEqualTo(1);
        assertThat(stats.getStaticPartition().getEstimatedSize()).isEqualTo(2);
        assertThat(stats.getSemiStaticPartition().getEntryCount()).isZero();
        assertThat(stats.getRetrievalPartition().getEntryCount()).isEqualTo(1);
        assertThat(stats.getTotalEntries()).isEqualTo(2);
        assertThat(stats.getTotalEstimatedSize()).isEqualTo(4);
    }

    @Test
    void explicitSizeOverridesEstimate() {
        cache.setStatic("identity", "hello", Duration.ZERO, 42);

        assertThat(cache.stats().getStaticPartition().getEstimatedSize()).isEqualTo(42);
    }

    @Test
    void sweepReturnsEvictedCount() {
        cache.setSemiStatic("a", "x", Duration.ofSeconds(1));
        cache.setRetrieval("e", "k", "y", Duration.ofSeconds(1));
        cache.setStatic("s", "z");
        clock.advance(Duration.ofSeconds(5));

        assertThat(cache.sweepExpired()).isEqualTo(2);
        assertThat(cache.sweepExpired()).isZero();
        assertThat(cache.getStatic("s")).contains("z");
    }

    @Test
    void clearRetrievalLeavesOtherPartitions() {
        cache.setStatic("s", "1");
        cache.setSemiStatic("m", "2");
        cache.setRetrieval("e", "k", "3");

        cache.clearRetrievalCache();

        assertThat(cache.getRetrieval("e", "k")).isEmpty();
        assertThat(cache.getStatic("s")).contains("1");
        assertThat(cache.getSemiStatic("m")).contains("2");
    }

    @Test
    void clearPartitionAndClearAll() {
        cache.setStatic("s", "1");
        cache.setSemiStatic("m", "2");
        cache.setRetrieval("e", "k", "3");

        cache.clearPartition(CachePartition.STATIC);
        assertThat(cache.getStatic("s")).isEmpty();
        assertThat(cache.getSemiStatic("m")).contains("2");

        cache.clearAll();
        assertThat(cache.stats().getTotalEntries()).isZero();
    }

    @Test
    void concurrentWritersAndReadersNeverSeeForeignContent() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        for (int t = 0; t < 8; t++) {
            final String key = "key-" + (t % 4);
            final String content = "content-" + (t % 4);
            results.add(executor.submit(() -> {
                start.await();
                boolean consistent = true;
                for (int i = 0; i < 1000; i++) {
                    cache.setSemiStatic(key, content);
                    String seen = cache.getSemiStatic(key).orElse(content);
                    consistent &= seen.equals(content);
                    if (i % 100 == 0) {
                        cache.invalidateSemiStatic(key);
                    }
                }
                return consistent;
            }));
        }

        start.countDown();
        for (Future<Boolean> result : results) {
            assertThat(result.get(10, TimeUnit.SECONDS)).isTrue();
        }
        executor.shutdown();
        assertThat(cache.stats().getSemiStaticPartition().getEntryCount()).isLessThanOrEqualTo(4);
    }
}
