package com.example.feed_engine.curation;

import com.example.feed_engine.config.FeedProperties;
import com.example.feed_engine.model.Topic;
import com.example.feed_engine.model.TopicMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Picks the spotlight topic for today and a bounded list of secondary topics.
 */
@Service
public class TopicCurationService {
    private static final Logger LOGGER = LoggerFactory.getLogger(TopicCurationService.class);
    private static final double MS_PER_DAY = 86_400_000.0;
    private static final double RECENCY_DECAY_DAYS = 4.0;
    private static final double LISTENS_PER_POST = 20.0;
    private static final double W_RECENCY = 0.55;
    private static final double W_ENGAGEMENT = 0.35;
    private static final double ACTIVITY_BONUS = 0.1;
    private static final double INACTIVITY_PENALTY = 0.05;
    private static final double INACTIVE_TOPIC_PENALTY = 0.4;

    private final FeedProperties.Curation cfg;

    public TopicCurationService(FeedProperties properties) {
        this.cfg = properties.getCuration();
    }

    record ScoredTopic(Topic topic, double score, boolean hasActivity, double ageDays) {
    }

    /**
     * Curates with "today" taken as the UTC calendar date of {@code now}.
     */
    public TopicCuration curate(List<Topic> topics, Map<String, TopicMetrics> metrics, Instant now) {
        Objects.requireNonNull(now, "now");
        return curate(topics, metrics, LocalDate.ofInstant(now, ZoneOffset.UTC), now);
    }

    /**
     * @param topics  candidate topics.
     * @param metrics activity per topic id; missing entries count as no activity.
     * @param today   calendar date that marks the spotlight.
     * @param now     reference time for topic age.
     * @return spotlight (possibly {@code null}) and at most {@code maxSecondary} secondary topics.
     */
    public TopicCuration curate(List<Topic> topics, Map<String, TopicMetrics> metrics, LocalDate today, Instant now) {
        Objects.requireNonNull(today, "today");
        Objects.requireNonNull(now, "now");
        if (topics == null || topics.isEmpty()) {
            return TopicCuration.empty();
        }
        Map<String, TopicMetrics> effectiveMetrics = metrics == null ? Map.of() : metrics;

        Topic spotlight = null;
        for (Topic topic : topics) {
            if (topic != null && today.equals(topic.date()) && topic.isActive()) {
                spotlight = topic;
                break;
            }
        }

        List<ScoredTopic> scored = new ArrayList<>();
        for (Topic topic : topics) {
            if (topic == null || (spotlight != null && Objects.equals(topic.id(), spotlight.id()))) {
                continue;
            }
            ScoredTopic st = score(topic, effectiveMetrics.getOrDefault(topic.id(), TopicMetrics.EMPTY), now);
            LOGGER.trace("curation topic={} score={} active={} ageDays={}", topic.id(),
                    String.format(Locale.ROOT, "%.3f", st.score()), st.hasActivity(),
                    String.format(Locale.ROOT, "%.2f", st.ageDays()));
            scored.add(st);
        }
        scored.sort(Comparator.comparingDouble(ScoredTopic::score).reversed());

        List<Topic> secondary = select(scored);
        LOGGER.debug("TopicCurationService topics={} spotlight={} secondary={}",
                topics.size(), spotlight == null ? "-" : spotlight.id(), secondary.size());
        return new TopicCuration(spotlight, secondary);
    }

    /**
     * Display fallback for when there is no topic for today: the most recent topic dated on or before
     * {@code today}, else the most recent topic overall.
     */
    public Optional<Topic> displayFallback(List<Topic> topics, LocalDate today) {
        if (topics == null || topics.isEmpty()) {
            return Optional.empty();
        }
        Comparator<LocalDate> dates = Comparator.nullsFirst(Comparator.naturalOrder());
        Comparator<Topic> byDateDesc = Comparator.comparing(Topic::date, dates).reversed();
        List<Topic> sorted = topics.stream().filter(Objects::nonNull).sorted(byDateDesc).toList();
        return sorted.stream()
                .filter(t -> t.date() != null && !t.date().isAfter(today))
                .findFirst()
                .or(() -> sorted.stream().findFirst());
    }

    ScoredTopic score(Topic topic, TopicMetrics metric, Instant now) {
        double ageDays = 0.0;
        if (topic.date() != null) {
            long ageMs = Duration.between(topic.date().atStartOfDay(ZoneOffset.UTC).toInstant(), now).toMillis();
            ageDays = Math.max(0.0, ageMs / MS_PER_DAY);
        }
        double recency = Math.exp(-ageDays / RECENCY_DECAY_DAYS);
        double engagementSignal = metric.posts() + metric.listens() / LISTENS_PER_POST;
        double engagement = 1 - Math.exp(-engagementSignal);
        boolean hasActivity = metric.hasActivity();
        double base = W_RECENCY * recency + W_ENGAGEMENT * engagement;
        double activityAdj = hasActivity ? ACTIVITY_BONUS : -INACTIVITY_PENALTY;
        double qualityPenalty = topic.isActive() ? 0.0 : INACTIVE_TOPIC_PENALTY;
        return new ScoredTopic(topic, base + activityAdj - qualityPenalty, hasActivity, ageDays);
    }

    private List<Topic> select(List<ScoredTopic> ranked) {
        int max = cfg.getMaxSecondary();
        List<Topic> curated = new ArrayList<>(Math.min(max, ranked.size()));
        Set<String> taken = new HashSet<>();
        for (ScoredTopic entry : ranked) {
            if (curated.size() >= max) {
                break;
            }
            boolean accept = entry.hasActivity() || entry.ageDays() <= cfg.getFreshDays() || curated.size() < cfg.getMinSecondary();
            if (accept && taken.add(entry.topic().id())) {
                curated.add(entry.topic());
            }
        }
        // backfill with the best remaining topics
        for (ScoredTopic entry : ranked) {
            if (curated.size() >= max) {
                break;
            }
            if (taken.add(entry.topic().id())) {
                curated.add(entry.topic());
            }
        }
        return curated;
    }
}
