package com.example.feed_engine.curation;

import com.example.feed_engine.config.FeedProperties;
import com.example.feed_engine.model.Topic;
import com.example.feed_engine.model.TopicMetrics;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.example.feed_engine.support.TestClips.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TopicCurationServiceTest {

    private static final LocalDate TODAY = LocalDate.parse("2026-10-17");

    private final TopicCurationService service = new TopicCurationService(new FeedProperties());

    private static Topic topic(String id, LocalDate date) {
        return new Topic(id, "Topic " + id, null, date, true, null);
    }

    private static Topic inactive(String id, LocalDate date) {
        return new Topic(id, "Topic " + id, null, date, false, null);
    }

    @Test
    void todaysTopicIsSpotlightEvenWithoutActivity() {
        Topic today = topic("today", TODAY);
        Topic yesterday = topic("yesterday", TODAY.minusDays(1));

        TopicCuration curation = service.curate(List.of(yesterday, today),
                Map.of("yesterday", new TopicMetrics(40, 3000)), NOW);

        assertThat(curation.spotlight()).isEqualTo(today);
        assertThat(curation.secondary()).containsExactly(yesterday);
    }

    @Test
    void inactiveTopicCannotBeSpotlightAndFirstActiveWins() {
        Topic off = inactive("off", TODAY);
        Topic first = topic("first", TODAY);
        Topic second = topic("second", TODAY);

        TopicCuration curation = service.curate(List.of(off, first, second), Map.of(), TODAY, NOW);

        assertThat(curation.spotlight()).isEqualTo(first);
        assertThat(curation.secondary()).contains(off, second).doesNotContain(first);
    }

    @Test
    void noTopicForTodayMeansNoSpotlight() {
        TopicCuration curation = service.curate(List.of(topic("old", TODAY.minusDays(2))), null, NOW);

        assertThat(curation.spotlight()).isNull();
        assertThat(curation.secondary()).extracting(Topic::id).containsExactly("old");
        assertThat(service.curate(List.of(), Map.of(), NOW)).isEqualTo(TopicCuration.empty());
    }

    @Test
    void secondaryIsBoundedAndUnique() {
        for (int size : new int[]{0, 1, 2, 5, 6, 7, 13, 100, 1000}) {
            List<Topic> topics = new ArrayList<>();
            Map<String, TopicMetrics> metrics = new HashMap<>();
            topics.add(topic("spot", TODAY));
            for (int i = 0; i < size; i++) {
                topics.add(topic("t" + i, TODAY.minusDays(i % 40)));
                if (i % 3 == 0) {
                    metrics.put("t" + i, new TopicMetrics(i % 7, i));
                }
            }

            TopicCuration curation = service.curate(topics, metrics, TODAY, NOW);

            assertThat(curation.secondary()).hasSize(Math.min(6, size));
            assertThat(curation.secondary()).doesNotContain(curation.spotlight()).doesNotHaveDuplicates();
        }
    }

    @Test
    void staleQuietTopicsStillFillMinimum() {
        List<Topic> topics = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            topics.add(topic("stale" + i, TODAY.minusDays(30 + i)));
        }

        TopicCuration curation = service.curate(topics, Map.of(), TODAY, NOW);

        assertThat(curation.secondary()).hasSize(6);
        assertThat(curation.secondary()).extracting(Topic::id)
                .containsExactly("stale0", "stale1", "stale2", "stale3", "stale4", "stale5");
    }

    @Test
    void rejectedTopicsAreBackfilledAfterAcceptedOnes() {
        Topic f1 = topic("f1", TODAY.minusDays(1));
        Topic f2 = topic("f2", TODAY.minusDays(1));
        Topic f3 = topic("f3", TODAY.minusDays(1));
        Topic stale = topic("stale", TODAY.minusDays(20));
        Topic freshButDisabled = inactive("fresh-disabled", TODAY.minusDays(1));

        TopicCuration curation = service.curate(List.of(f1, f2, f3, stale, freshButDisabled), Map.of(), TODAY, NOW);

        assertThat(curation.secondary()).containsExactly(f1, f2, f3, freshButDisabled, stale);
    }

    @Test
    void activeTopicsOutrankQuietOnes() {
        Topic quiet = topic("quiet", TODAY.minusDays(1));
        Topic busy = topic("busy", TODAY.minusDays(5));

        TopicCuration curation = service.curate(List.of(quiet, busy), Map.of("busy", new TopicMetrics(12, 400)), TODAY, NOW);

        assertThat(curation.secondary()).containsExactly(busy, quiet);
    }

    @Test
    void scoreFollowsRecencyEngagementAndActivity() {
        Topic t = topic("t", TODAY.minusDays(2));

        TopicCurationService.ScoredTopic scored = service.score(t, new TopicMetrics(1, 20), NOW);

        double ageDays = 2.5;
        double expected = 0.55 * Math.exp(-ageDays / 4) + 0.35 * (1 - Math.exp(-2)) + 0.1;
        assertThat(scored.ageDays()).isCloseTo(ageDays, within(1e-9));
        assertThat(scored.score()).isCloseTo(expected, within(1e-9));
        assertThat(scored.hasActivity()).isTrue();

        TopicCurationService.ScoredTopic disabled = service.score(inactive("d", TODAY.minusDays(2)), TopicMetrics.EMPTY, NOW);
        assertThat(disabled.score()).isCloseTo(0.55 * Math.exp(-ageDays / 4) - 0.05 - 0.4, within(1e-9));
    }

    @Test
    void displayFallbackPrefersLatestPastTopic() {
        Topic older = topic("older", TODAY.minusDays(3));
        Topic latestPast = topic("latest-past", TODAY.minusDays(1));
        Topic future = topic("future", TODAY.plusDays(2));

        assertThat(service.displayFallback(List.of(older, future, latestPast), TODAY)).contains(latestPast);
        assertThat(service.displayFallback(List.of(future, topic("later", TODAY.plusDays(5))), TODAY))
                .get().extracting(Topic::id).isEqualTo("later");
        assertThat(service.displayFallback(List.of(), TODAY)).isEmpty();
    }
}
