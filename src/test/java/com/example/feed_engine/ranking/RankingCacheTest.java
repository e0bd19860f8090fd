package com.example.feed_engine.ranking;

import com.example.feed_engine.config.FeedProperties;
import com.example.feed_engine.paging.FeedCriteria;
import com.example.feed_engine.util.RankingMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.example.feed_engine.support.TestClips.NOW;
import static com.example.feed_engine.support.TestClips.clip;
import static org.assertj.core.api.Assertions.assertThat;

class RankingCacheTest {

    private static RankingCache cache(boolean enabled) {
        FeedProperties properties = new FeedProperties();
        properties.getCache().setEnabled(enabled);
        properties.getCache().setTtl(Duration.ofMinutes(1));
        properties.getCache().setTimeBucket(Duration.ofSeconds(10));
        return new RankingCache(properties, new ObjectMapper());
    }

    @Test
    void disabledCacheAlwaysComputes() {
        RankingCache cache = cache(false);
        AtomicInteger calls = new AtomicInteger();
        RankingCache.Key key = cache.keyFor(FeedCriteria.of(RankingMode.HOT), "me", Set.of(), false, null, NOW, List.of("a"));

        cache.getOrCompute(key, () -> {
            calls.incrementAndGet();
            return List.of();
        });
        cache.getOrCompute(key, () -> {
            calls.incrementAndGet();
            return List.of();
        });

        assertThat(calls).hasValue(2);
        assertThat(cache.isEnabled()).isFalse();
    }

    @Test
    void enabledCacheServesSameKeyOnce() {
        RankingCache cache = cache(true);
        AtomicInteger calls = new AtomicInteger();
        List<ScoredClip> ranked = List.of(new ScoredClip(clip("a").build(), 1.0, "x"));
        RankingCache.Key key = cache.keyFor(FeedCriteria.of(RankingMode.HOT), "me", Set.of("b", "a"), false, "Porto", NOW, List.of("a"));

        List<ScoredClip> first = cache.getOrCompute(key, () -> {
            calls.incrementAndGet();
            return ranked;
        });
        List<ScoredClip> second = cache.getOrCompute(key, () -> {
            calls.incrementAndGet();
            return List.of();
        });

        assertThat(calls).hasValue(1);
        assertThat(second).isEqualTo(first).isEqualTo(ranked);
        assertThat(cache.size()).isEqualTo(1);

        cache.invalidateAll();
        assertThat(cache.size()).isZero();
    }

    @Test
    void keyNormalizesViewerAndBucketsTime() {
        RankingCache cache = cache(true);
        FeedCriteria criteria = FeedCriteria.of(RankingMode.TOP);

        RankingCache.Key k1 = cache.keyFor(criteria, "me", Set.of("b", "a"), true, "PORTO", NOW, List.of());
        RankingCache.Key k2 = cache.keyFor(criteria, "me", Set.of("a", "b"), true, "porto", NOW.plusSeconds(3), List.of());
        RankingCache.Key later = cache.keyFor(criteria, "me", Set.of("a", "b"), true, "porto", NOW.plusSeconds(30), List.of());
        RankingCache.Key otherMode = cache.keyFor(FeedCriteria.of(RankingMode.HOT), "me", Set.of("a", "b"), true, "porto", NOW, List.of());

        assertThat(k1).isEqualTo(k2);
        assertThat(k1.city()).isEqualTo("porto");
        assertThat(later).isNotEqualTo(k1);
        assertThat(otherMode).isNotEqualTo(k1);
    }

    @Test
    void fingerprintIgnoresMapOrderButNotContent() {
        RankingCache cache = cache(true);
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("b", 2);
        first.put("a", List.of(1, 2));
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("a", List.of(1, 2));
        second.put("b", 2);

        assertThat(cache.fingerprint(first)).isEqualTo(cache.fingerprint(second)).hasSize(40);
        assertThat(cache.fingerprint(Map.of("a", List.of(2, 1), "b", 2))).isNotEqualTo(cache.fingerprint(first));
    }

    @Test
    void concurrentCallersShareOneComputation() throws Exception {
        RankingCache cache = cache(true);
        RankingCache.Key key = cache.keyFor(FeedCriteria.of(RankingMode.RISING), "me", Set.of(), false, null, NOW, List.of("a"));
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<List<ScoredClip>>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return cache.getOrCompute(key, () -> {
                        calls.incrementAndGet();
                        try {
                            Thread.sleep(100);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return List.of(new ScoredClip(clip("a").build(), 2.0, "x"));
                    });
                }));
            }
            start.countDown();
            for (Future<List<ScoredClip>> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).hasSize(1);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(calls).hasValue(1);
    }
}
