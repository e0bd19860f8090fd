package com.example.feed_engine.service;

import com.example.feed_engine.classify.KeywordClipClassifier;
import com.example.feed_engine.config.FeedProperties;
import com.example.feed_engine.curation.TopicCuration;
import com.example.feed_engine.curation.TopicCurationService;
import com.example.feed_engine.curation.TopicMetricsAggregator;
import com.example.feed_engine.filter.FeedFilter;
import com.example.feed_engine.filter.FeedFilters;
import com.example.feed_engine.filter.VisibilityFilter;
import com.example.feed_engine.model.Clip;
import com.example.feed_engine.model.ListenEvent;
import com.example.feed_engine.model.Topic;
import com.example.feed_engine.model.ViewerProfile;
import com.example.feed_engine.paging.FeedCriteria;
import com.example.feed_engine.paging.FeedWindow;
import com.example.feed_engine.ranking.ClipRanker;
import com.example.feed_engine.ranking.HeuristicClipRanker;
import com.example.feed_engine.ranking.RankingCache;
import com.example.feed_engine.ranking.RankingParams;
import com.example.feed_engine.ranking.ScoredClip;
import com.example.feed_engine.service.impl.RecommendationServiceImpl;
import com.example.feed_engine.util.RankingMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.feed_engine.support.TestClips.NOW;
import static com.example.feed_engine.support.TestClips.clip;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FeedServiceTest {

    private FeedProperties properties;
    private FeedService feedService;

    private final Clip a = clip("A").creator("alice").hoursAgo(1).listens(10).reaction("🔥", 2).build();
    private final Clip b = clip("B").creator("bob").hoursAgo(30).listens(100).build();
    private final Clip c = clip("C").creator("carol").hoursAgo(0.5).build();
    private final Clip replyToA = clip("reply").creator("dave").replyTo("A").listens(5000).build();
    private final Clip sensitive = clip("sensitive").creator("erin").sensitive().listens(5000).build();
    private final Clip blocked = clip("blocked").creator("troll").listens(5000).build();
    private final List<Clip> snapshot = List.of(a, b, c, replyToA, sensitive, blocked);
    private final ViewerProfile viewer = new ViewerProfile("me", false, null, Set.of("troll"));

    @BeforeEach
    void setUp() {
        properties = new FeedProperties();
        properties.setPageSize(2);
        feedService = newService(HeuristicClipRanker.withDefaultScorers(), properties);
    }

    static FeedService newService(ClipRanker ranker, FeedProperties properties) {
        ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
        return new FeedService(new VisibilityFilter(),
                new FeedFilter(new KeywordClipClassifier()),
                ranker,
                new ClipThreads(),
                new TopicMetricsAggregator(),
                new TopicCurationService(properties),
                new RecommendationServiceImpl(properties),
                new RankingCache(properties, mapper),
                properties,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void assemblesVisibleTopLevelFeedInPages() {
        FeedWindow window = FeedWindow.start(FeedCriteria.of(RankingMode.HOT));

        FeedResult first = feedService.assemble(FeedRequest.of(snapshot, viewer, window, NOW));

        assertThat(first.page().content()).extracting(sc -> sc.clip().id()).containsExactly("B", "A");
        assertThat(first.page().hasMore()).isTrue();
        assertThat(first.page().total()).isEqualTo(3);
        assertThat(first.page().content().get(0).score()).isCloseTo(1.7801238424800827, within(1e-9));
        assertThat(first.page().content().get(1).clip().replyCount()).isEqualTo(1);

        FeedResult second = feedService.assemble(FeedRequest.of(snapshot, viewer, window.next(), NOW));

        assertThat(second.page().content()).extracting(sc -> sc.clip().id()).containsExactly("B", "A", "C");
        assertThat(second.page().hasMore()).isFalse();
        assertThat(second.window().pageCount()).isEqualTo(2);
    }

    @Test
    void missingNowFallsBackToClock() {
        FeedWindow window = FeedWindow.start(FeedCriteria.of(RankingMode.HOT)).next();

        FeedResult withClock = feedService.assemble(FeedRequest.of(snapshot, viewer, window, null));
        FeedResult explicit = feedService.assemble(FeedRequest.of(snapshot, viewer, window, NOW));

        assertThat(withClock.page()).isEqualTo(explicit.page());
    }

    @Test
    void sensitiveClipNeverAppearsForRestrictedViewerInAnyMode() {
        for (RankingMode mode : RankingMode.values()) {
            FeedWindow window = new FeedWindow(FeedCriteria.of(mode), 10);
            FeedResult result = feedService.assemble(FeedRequest.of(snapshot, viewer, window, NOW));

            assertThat(result.page().content()).extracting(sc -> sc.clip().id())
                    .doesNotContain("sensitive", "blocked", "reply");
        }
    }

    @Test
    void feedFiltersNarrowAssembledFeed() {
        FeedCriteria criteria = new FeedCriteria(RankingMode.TOP, null, FeedFilters.none().withUnheardOnly(true));
        List<ListenEvent> listens = List.of(new ListenEvent("me", "B", NOW));
        FeedRequest request = new FeedRequest(snapshot, viewer, FeedWindow.start(criteria), Map.of(), listens, List.of(), NOW);

        FeedResult result = feedService.assemble(request);

        assertThat(result.page().content()).extracting(sc -> sc.clip().id()).containsExactly("A", "C");
    }

    @Test
    void scoreAndSortParsesModeNames() {
        List<ScoredClip> ranked = feedService.scoreAndSort(List.of(a, b, c), "Hot", RankingParams.defaults(), NOW);

        assertThat(ranked).extracting(sc -> sc.clip().id()).containsExactly("B", "A", "C");
        assertThatThrownBy(() -> feedService.scoreAndSort(List.of(a), "newest", RankingParams.defaults(), NOW))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("newest");
    }

    @Test
    void filterVisibleDelegatesToVisibilityRules() {
        assertThat(feedService.filterVisible(snapshot, viewer)).extracting(Clip::id)
                .containsExactly("A", "B", "C", "reply");
    }

    @Test
    void curatesTopicsAndFallsBackForDisplay() {
        Topic today = new Topic("today", "Today", null, LocalDate.parse("2026-10-17"), true, null);
        Topic old = new Topic("old", "Old", null, LocalDate.parse("2026-10-10"), true, null);

        TopicCuration curation = feedService.curateTopics(List.of(old, today), Map.of(), NOW);

        assertThat(curation.spotlight()).isEqualTo(today);
        assertThat(curation.secondary()).containsExactly(old);
        assertThat(feedService.spotlightFallback(List.of(old), NOW)).contains(old);
    }

    @Test
    void recommendationsReturnPlainClips() {
        Clip heard = clip("heard").creator("alice").topic("t1").build();
        Clip next = clip("next").creator("zoe").topic("t1").build();

        List<Clip> recs = feedService.recommendContent(List.of(new ListenEvent("me", "heard", NOW)), List.of(heard, next), NOW);

        assertThat(recs).containsExactly(next);
        assertThat(feedService.recommendCreators(List.of(), List.of(heard, next), NOW)).isEmpty();
    }

    @Test
    void paginateUsesRequestedPageSize() {
        assertThat(feedService.paginate(List.of(1, 2, 3, 4, 5), 2, 2).content()).containsExactly(1, 2, 3, 4);
    }
}
