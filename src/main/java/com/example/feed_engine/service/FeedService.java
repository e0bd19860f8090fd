package com.example.feed_engine.service;

import com.example.feed_engine.api.dto.PageResponse;
import com.example.feed_engine.config.FeedProperties;
import com.example.feed_engine.curation.TopicCuration;
import com.example.feed_engine.curation.TopicCurationService;
import com.example.feed_engine.curation.TopicMetricsAggregator;
import com.example.feed_engine.filter.FeedFilter;
import com.example.feed_engine.filter.VisibilityFilter;
import com.example.feed_engine.model.Clip;
import com.example.feed_engine.model.ListenEvent;
import com.example.feed_engine.model.Topic;
import com.example.feed_engine.model.TopicMetrics;
import com.example.feed_engine.model.ViewerProfile;
import com.example.feed_engine.paging.FeedCriteria;
import com.example.feed_engine.paging.Paginator;
import com.example.feed_engine.ranking.ClipRanker;
import com.example.feed_engine.ranking.RankingCache;
import com.example.feed_engine.ranking.RankingParams;
import com.example.feed_engine.ranking.ScoredClip;
import com.example.feed_engine.util.RankingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the ranking and curation engine. Stateless: every call works on the snapshot it is given.
 */
@Service
public class FeedService {
    private static final Logger LOGGER = LoggerFactory.getLogger(FeedService.class);

    private final VisibilityFilter visibilityFilter;
    private final FeedFilter feedFilter;
    private final ClipRanker ranker;
    private final ClipThreads clipThreads;
    private final TopicMetricsAggregator metricsAggregator;
    private final TopicCurationService curationService;
    private final RecommendationService recommendationService;
    private final RankingCache rankingCache;
    private final FeedProperties properties;
    private final Clock clock;

    public FeedService(VisibilityFilter visibilityFilter,
                       FeedFilter feedFilter,
                       ClipRanker ranker,
                       ClipThreads clipThreads,
                       TopicMetricsAggregator metricsAggregator,
                       TopicCurationService curationService,
                       RecommendationService recommendationService,
                       RankingCache rankingCache,
                       FeedProperties properties,
                       Clock clock) {
        this.visibilityFilter = visibilityFilter;
        this.feedFilter = feedFilter;
        this.ranker = ranker;
        this.clipThreads = clipThreads;
        this.metricsAggregator = metricsAggregator;
        this.curationService = curationService;
        this.recommendationService = recommendationService;
        this.rankingCache = rankingCache;
        this.properties = properties;
        this.clock = clock;
    }

    public List<Clip> filterVisible(List<Clip> clips, ViewerProfile viewer) {
        return visibilityFilter.filterVisible(clips, viewer);
    }

    public List<ScoredClip> scoreAndSort(List<Clip> clips, RankingMode mode, RankingParams params, Instant now) {
        return ranker.rank(clips, mode, params, now);
    }

    /**
     * Same as {@link #scoreAndSort(List, RankingMode, RankingParams, Instant)} with the mode given by name.
     *
     * @throws IllegalArgumentException when {@code mode} is not a known ranking mode.
     */
    public List<ScoredClip> scoreAndSort(List<Clip> clips, String mode, RankingParams params, Instant now) {
        return ranker.rank(clips, RankingMode.fromValue(mode), params, now);
    }

    public TopicCuration curateTopics(List<Topic> topics, Map<String, TopicMetrics> metrics, Instant now) {
        return curationService.curate(topics, metrics, now);
    }

    /**
     * Display fallback for a missing spotlight; not part of curation itself.
     */
    public Optional<Topic> spotlightFallback(List<Topic> topics, Instant now) {
        return curationService.displayFallback(topics, LocalDate.ofInstant(now, ZoneOffset.UTC));
    }

    public List<Clip> recommendContent(List<ListenEvent> listenHistory, List<Clip> candidatePool, Instant now) {
        return recommendationService.recommendContent(listenHistory, candidatePool, now).stream()
                .map(ScoredClip::clip)
                .toList();
    }

    public List<Clip> recommendCreators(List<ListenEvent> listenHistory, List<Clip> candidatePool, Instant now) {
        return recommendationService.recommendCreators(listenHistory, candidatePool, now).stream()
                .map(ScoredClip::clip)
                .toList();
    }

    public <T> PageResponse<T> paginate(List<T> ordered, int pageSize, int pageCount) {
        return Paginator.window(ordered, pageSize, pageCount);
    }

    /**
     * Runs the whole pipeline: thread folding, visibility, feed filters, ranking and windowing.
     *
     * @param request snapshot and window to assemble.
     * @return visible page plus the window it belongs to.
     */
    public FeedResult assemble(FeedRequest request) {
        Objects.requireNonNull(request, "request");
        long started = System.nanoTime();
        Instant now = request.now() != null ? request.now() : Instant.now(clock);
        FeedCriteria criteria = request.window().criteria();
        ViewerProfile viewer = request.viewer();

        List<ScoredClip> ranked;
        if (rankingCache.isEnabled()) {
            Map<String, Object> snapshot = new LinkedHashMap<>();
            snapshot.put("clips", request.clips());
            snapshot.put("metrics", request.topicMetrics());
            snapshot.put("listens", request.listens());
            snapshot.put("follows", request.follows());
            RankingCache.Key key = rankingCache.keyFor(criteria, viewer.id(), viewer.blockedCreatorIds(),
                    viewer.sensitiveContentAllowed(), viewer.city(), now, snapshot);
            ranked = rankingCache.getOrCompute(key, () -> rankAll(request, criteria, now));
        } else {
            ranked = rankAll(request, criteria, now);
        }

        PageResponse<ScoredClip> page = Paginator.window(ranked, properties.getPageSize(), request.window().pageCount());
        LOGGER.debug("FeedService assemble mode={} pages={} shown={} total={} hasMore={} durationMs={}",
                criteria.mode().toJson(), page.pages(), page.content().size(), page.total(), page.hasMore(),
                Duration.ofNanos(System.nanoTime() - started).toMillis());
        return new FeedResult(page, request.window());
    }

    private List<ScoredClip> rankAll(FeedRequest request, FeedCriteria criteria, Instant now) {
        Map<String, TopicMetrics> metrics = request.topicMetrics() != null
                ? request.topicMetrics()
                : metricsAggregator.aggregate(request.clips());
        List<Clip> candidates = clipThreads.topLevel(request.clips());
        List<Clip> visible = visibilityFilter.filterVisible(candidates, request.viewer());
        List<Clip> filtered = feedFilter.apply(visible, criteria.filters(), request.viewer(),
                request.follows(), request.listens());
        RankingParams params = new RankingParams(criteria.timeWindow(), request.viewer().city(), metrics,
                properties.getJitterAmplitude());
        return ranker.rank(filtered, criteria.mode(), params, now);
    }
}
