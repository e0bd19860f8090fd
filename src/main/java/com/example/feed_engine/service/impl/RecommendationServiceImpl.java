package com.example.feed_engine.service.impl;

import com.example.feed_engine.config.FeedProperties;
import com.example.feed_engine.model.Clip;
import com.example.feed_engine.model.ListenEvent;
import com.example.feed_engine.ranking.ClipSignals;
import com.example.feed_engine.ranking.ScoredClip;
import com.example.feed_engine.service.RecommendationService;
import com.example.feed_engine.util.ClipStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Default implementation of {@link RecommendationService} working purely on the supplied snapshot.
 */
@Service
public class RecommendationServiceImpl implements RecommendationService {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecommendationServiceImpl.class);
    private static final double RECENCY_WINDOW_HOURS = 168.0;
    private static final double CONTENT_TOPIC_MATCH = 3.0;
    private static final double CONTENT_TAG_MATCH = 2.0;
    private static final double CONTENT_CREATOR_MATCH = 2.0;
    private static final double CREATOR_TAG_MATCH = 3.0;
    private static final double CREATOR_TOPIC_MATCH = 2.0;

    private final FeedProperties.Recommendations cfg;

    public RecommendationServiceImpl(FeedProperties properties) {
        this.cfg = properties.getRecommendations();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<ScoredClip> recommendContent(List<ListenEvent> listenHistory, List<Clip> catalog, Instant now) {
        Objects.requireNonNull(now, "now");
        Set<String> listenedIds = recentClipIds(listenHistory, cfg.getContentHistoryLimit());
        if (listenedIds.isEmpty() || catalog == null || catalog.isEmpty()) {
            return List.of();
        }
        Map<String, Clip> byId = indexLive(catalog);
        List<Clip> listened = resolve(listenedIds, byId);
        if (listened.isEmpty()) {
            LOGGER.debug("RecommendationService content skipped reason=no-live-listened-clips history={}", listenedIds.size());
            return List.of();
        }

        Set<String> topicIds = new HashSet<>();
        Set<String> tags = new HashSet<>();
        Set<String> creatorIds = new HashSet<>();
        for (Clip clip : listened) {
            if (clip.topicId() != null) {
                topicIds.add(clip.topicId());
            }
            tags.addAll(clip.tags());
            if (clip.creatorId() != null) {
                creatorIds.add(clip.creatorId());
            }
        }

        List<Clip> candidates = new ArrayList<>();
        for (Clip clip : byId.values()) {
            if (listenedIds.contains(clip.id())) {
                continue;
            }
            boolean topicMatch = clip.topicId() != null && topicIds.contains(clip.topicId());
            boolean creatorMatch = clip.creatorId() != null && creatorIds.contains(clip.creatorId());
            if (topicMatch || creatorMatch) {
                candidates.add(clip);
            }
        }
        candidates = newestFirst(candidates, cfg.getContentCandidateLimit());

        List<ScoredClip> scored = new ArrayList<>(candidates.size());
        for (Clip clip : candidates) {
            double topic = clip.topicId() != null && topicIds.contains(clip.topicId()) ? CONTENT_TOPIC_MATCH : 0.0;
            double tag = countMatches(clip.tags(), tags) * CONTENT_TAG_MATCH;
            double creator = clip.creatorId() != null && creatorIds.contains(clip.creatorId()) ? CONTENT_CREATOR_MATCH : 0.0;
            double recency = recencyBonus(clip, now);
            double score = topic + tag + creator + recency;
            scored.add(new ScoredClip(clip, score, String.format(Locale.ROOT,
                    "topic=%.0f tags=%.0f creator=%.0f recency=%.3f -> %.3f", topic, tag, creator, recency, score)));
        }
        List<ScoredClip> top = top(scored);
        LOGGER.debug("RecommendationService content history={} listened={} candidates={} returned={}",
                listenedIds.size(), listened.size(), candidates.size(), top.size());
        return top;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<ScoredClip> recommendCreators(List<ListenEvent> listenHistory, List<Clip> catalog, Instant now) {
        Objects.requireNonNull(now, "now");
        Set<String> listenedIds = recentClipIds(listenHistory, cfg.getCreatorHistoryLimit());
        if (listenedIds.isEmpty() || catalog == null || catalog.isEmpty()) {
            return List.of();
        }
        Map<String, Clip> byId = indexLive(catalog);
        List<Clip> listened = resolve(listenedIds, byId);

        Map<String, Integer> plays = new LinkedHashMap<>();
        for (Clip clip : listened) {
            if (clip.creatorId() != null) {
                plays.merge(clip.creatorId(), 1, Integer::sum);
            }
        }
        List<String> favorites = topKeys(plays, cfg.getFavoriteCreators());
        if (favorites.isEmpty()) {
            LOGGER.debug("RecommendationService creators skipped reason=no-favorites history={}", listenedIds.size());
            return List.of();
        }
        Set<String> favoriteSet = new HashSet<>(favorites);

        List<Clip> favoriteClips = byId.values().stream()
                .filter(c -> c.creatorId() != null && favoriteSet.contains(c.creatorId()))
                .limit(cfg.getFavoriteClipSample())
                .toList();
        Set<String> favoriteTopics = new HashSet<>();
        Set<String> favoriteTags = new HashSet<>();
        for (Clip clip : favoriteClips) {
            if (clip.topicId() != null) {
                favoriteTopics.add(clip.topicId());
            }
            favoriteTags.addAll(clip.tags());
        }
        if (favoriteTopics.isEmpty()) {
            LOGGER.debug("RecommendationService creators skipped reason=no-favorite-topics favorites={}", favorites);
            return List.of();
        }

        Map<String, Integer> similarCounts = new LinkedHashMap<>();
        byId.values().stream()
                .filter(c -> c.creatorId() != null && !favoriteSet.contains(c.creatorId()))
                .filter(c -> c.topicId() != null && favoriteTopics.contains(c.topicId()))
                .limit(cfg.getSimilarCreatorPool())
                .forEach(c -> similarCounts.merge(c.creatorId(), 1, Integer::sum));
        Set<String> similarCreators = new HashSet<>(topKeys(similarCounts, cfg.getSimilarCreators()));
        if (similarCreators.isEmpty()) {
            LOGGER.debug("RecommendationService creators skipped reason=no-similar-creators favorites={}", favorites);
            return List.of();
        }

        List<Clip> candidates = newestFirst(byId.values().stream()
                .filter(c -> similarCreators.contains(c.creatorId()))
                .filter(c -> !listenedIds.contains(c.id()))
                .collect(Collectors.toList()), cfg.getCreatorCandidateLimit());

        List<ScoredClip> scored = new ArrayList<>(candidates.size());
        for (Clip clip : candidates) {
            double tag = countMatches(clip.tags(), favoriteTags) * CREATOR_TAG_MATCH;
            double topic = clip.topicId() != null && favoriteTopics.contains(clip.topicId()) ? CREATOR_TOPIC_MATCH : 0.0;
            double recency = recencyBonus(clip, now);
            double score = tag + topic + recency;
            scored.add(new ScoredClip(clip, score, String.format(Locale.ROOT,
                    "tags=%.0f topic=%.0f recency=%.3f -> %.3f", tag, topic, recency, score)));
        }
        List<ScoredClip> top = top(scored);
        LOGGER.debug("RecommendationService creators favorites={} similar={} candidates={} returned={}",
                favorites.size(), similarCreators.size(), candidates.size(), top.size());
        return top;
    }

    /** Most recent distinct clip ids, newest first, bounded by {@code limit} events. */
    static Set<String> recentClipIds(List<ListenEvent> history, int limit) {
        if (history == null || history.isEmpty()) {
            return Set.of();
        }
        Comparator<ListenEvent> newestFirst = Comparator.comparing(ListenEvent::listenedAt,
                Comparator.nullsLast(Comparator.reverseOrder()));
        Set<String> ids = new LinkedHashSet<>();
        history.stream()
                .filter(e -> e != null && e.clipId() != null)
                .sorted(newestFirst)
                .limit(limit)
                .forEach(e -> ids.add(e.clipId()));
        return ids;
    }

    private static Map<String, Clip> indexLive(List<Clip> catalog) {
        Map<String, Clip> byId = new LinkedHashMap<>();
        for (Clip clip : catalog) {
            if (clip != null && clip.id() != null && clip.status() == ClipStatus.LIVE) {
                byId.putIfAbsent(clip.id(), clip);
            }
        }
        return byId;
    }

    private static List<Clip> resolve(Set<String> ids, Map<String, Clip> byId) {
        List<Clip> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Clip clip = byId.get(id);
            if (clip != null) {
                out.add(clip);
            }
        }
        return out;
    }

    private static List<Clip> newestFirst(List<Clip> clips, int limit) {
        List<Clip> sorted = new ArrayList<>(clips);
        sorted.sort(Comparator.comparing(Clip::createdAt, Comparator.nullsLast(Comparator.reverseOrder())));
        if (limit > 0 && sorted.size() > limit) {
            return new ArrayList<>(sorted.subList(0, limit));
        }
        return sorted;
    }

    private static int countMatches(List<String> clipTags, Set<String> pool) {
        int matches = 0;
        for (String tag : clipTags) {
            if (tag != null && pool.contains(tag)) {
                matches++;
            }
        }
        return matches;
    }

    private static double recencyBonus(Clip clip, Instant now) {
        return Math.max(0.0, 1 - ClipSignals.hoursOld(clip, now) / RECENCY_WINDOW_HOURS);
    }

    /** Keys ordered by count descending; ties keep first-seen order. */
    private static List<String> topKeys(Map<String, Integer> counts, int limit) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        List<String> keys = new ArrayList<>(Math.min(limit, entries.size()));
        for (int i = 0; i < entries.size() && i < limit; i++) {
            keys.add(entries.get(i).getKey());
        }
        return keys;
    }

    private List<ScoredClip> top(List<ScoredClip> scored) {
        scored.sort(Comparator.comparingDouble(ScoredClip::score).reversed());
        if (scored.size() > cfg.getResultLimit()) {
            return new ArrayList<>(scored.subList(0, cfg.getResultLimit()));
        }
        return scored;
    }
}
