package com.example.feed_engine.ranking;

import com.example.feed_engine.model.TopicMetrics;
import com.example.feed_engine.util.DeterministicJitter;
import com.example.feed_engine.util.TimeWindow;

import java.util.Map;

/**
 * Mode parameters and viewer context for a ranking pass.
 *
 * @param timeWindow      window for the {@code top} mode.
 * @param viewerCity      viewer city for the local boost of the {@code hot} mode, may be {@code null}.
 * @param topicMetrics    metrics per topic id for the topic boost of the {@code hot} mode.
 * @param jitterAmplitude amplitude of the deterministic tie-break jitter.
 */
public record RankingParams(TimeWindow timeWindow,
                            String viewerCity,
                            Map<String, TopicMetrics> topicMetrics,
                            double jitterAmplitude) {

    public RankingParams {
        timeWindow = timeWindow == null ? TimeWindow.ALL : timeWindow;
        topicMetrics = topicMetrics == null ? Map.of() : topicMetrics;
    }

    public static RankingParams defaults() {
        return new RankingParams(TimeWindow.ALL, null, Map.of(), DeterministicJitter.DEFAULT_AMPLITUDE);
    }

    public RankingParams withTimeWindow(TimeWindow window) {
        return new RankingParams(window, viewerCity, topicMetrics, jitterAmplitude);
    }

    public RankingParams withViewerCity(String city) {
        return new RankingParams(timeWindow, city, topicMetrics, jitterAmplitude);
    }

    public RankingParams withTopicMetrics(Map<String, TopicMetrics> metrics) {
        return new RankingParams(timeWindow, viewerCity, metrics, jitterAmplitude);
    }
}
