package com.example.feed_engine.ranking;

import com.example.feed_engine.config.FeedProperties;
import com.example.feed_engine.paging.FeedCriteria;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Short-lived memoization of assembled rankings. Keys cover the criteria, the viewer filter parameters,
 * a time bucket and a fingerprint of the input snapshot, so a stale entry can only be served within one bucket.
 */
@Component
public class RankingCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(RankingCache.class);

    private final boolean enabled;
    private final long bucketSeconds;
    private final ObjectMapper objectMapper;
    private final Cache<Key, List<ScoredClip>> cache;

    /**
     * Cache key.
     *
     * @param criteria        mode, window and feed filters.
     * @param viewerId        viewer id, relevant for followed/unheard filters.
     * @param blockedCreators blocked creator ids, sorted.
     * @param sensitive       viewer's sensitive content flag.
     * @param city            viewer city in lower case.
     * @param timeBucket      {@code now} divided into buckets.
     * @param fingerprint     hash over the input snapshot.
     */
    public record Key(FeedCriteria criteria,
                      String viewerId,
                      Set<String> blockedCreators,
                      boolean sensitive,
                      String city,
                      long timeBucket,
                      String fingerprint) {
    }

    public RankingCache(FeedProperties properties, ObjectMapper objectMapper) {
        FeedProperties.Cache cfg = properties.getCache();
        this.enabled = cfg.isEnabled();
        this.bucketSeconds = Math.max(1, cfg.getTimeBucket().toSeconds());
        this.objectMapper = objectMapper;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cfg.getTtl())
                .maximumSize(cfg.getMaximumSize())
                .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<ScoredClip> getOrCompute(Key key, Supplier<List<ScoredClip>> loader) {
        if (!enabled) {
            return loader.get();
        }
        // computed at most once per key, concurrent callers wait for the same load
        boolean[] loaded = {false};
        List<ScoredClip> ranked = cache.get(key, k -> {
            loaded[0] = true;
            return List.copyOf(loader.get());
        });
        if (!loaded[0]) {
            LOGGER.debug("RankingCache hit mode={} bucket={}", key.criteria().mode().toJson(), key.timeBucket());
        }
        return ranked;
    }

    public Key keyFor(FeedCriteria criteria,
                      String viewerId,
                      Set<String> blockedCreators,
                      boolean sensitive,
                      String city,
                      Instant now,
                      Object snapshot) {
        return new Key(criteria,
                viewerId,
                new TreeSet<>(blockedCreators),
                sensitive,
                city == null ? null : city.toLowerCase(Locale.ROOT),
                now.getEpochSecond() / bucketSeconds,
                fingerprint(snapshot));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    String fingerprint(Object snapshot) {
        try {
            String json = objectMapper.writer()
                    .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                    .writeValueAsString(canonicalize(snapshot));
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            byte[] hash = digest.digest(json.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                builder.append(String.format(Locale.ROOT, "%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 unavailable", e);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("SNAPSHOT_FINGERPRINT_FAILED", e);
        }
    }

    private static Object canonicalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                sorted.put(String.valueOf(entry.getKey()), canonicalize(entry.getValue()));
            }
            return sorted;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(RankingCache::canonicalize).toList();
        }
        return value;
    }
}
