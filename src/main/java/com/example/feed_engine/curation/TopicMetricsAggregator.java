package com.example.feed_engine.curation;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.model.TopicMetrics;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Derives per-topic post and listen counts from the raw clip set.
 */
@Component
public class TopicMetricsAggregator {

    /**
     * Counts live and processing clips per topic and sums their listens.
     *
     * @param clips raw clips, replies included.
     * @return metrics keyed by topic id; topics without clips are absent.
     */
    public Map<String, TopicMetrics> aggregate(Collection<Clip> clips) {
        Map<String, TopicMetrics> metrics = new HashMap<>();
        if (clips == null) {
            return metrics;
        }
        for (Clip clip : clips) {
            if (clip == null || clip.topicId() == null || clip.status() == null || !clip.status().isPublished()) {
                continue;
            }
            metrics.merge(clip.topicId(), TopicMetrics.EMPTY.plus(clip.listensCount()),
                    (a, b) -> new TopicMetrics(a.posts() + b.posts(), a.listens() + b.listens()));
        }
        return metrics;
    }
}
