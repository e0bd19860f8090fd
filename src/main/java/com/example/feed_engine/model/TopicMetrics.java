package com.example.feed_engine.model;

/**
 * Aggregated activity for a topic.
 *
 * @param posts   number of live or processing clips referencing the topic.
 * @param listens summed listens of those clips.
 */
public record TopicMetrics(long posts, long listens) {
    public static final TopicMetrics EMPTY = new TopicMetrics(0, 0);

    public boolean hasActivity() {
        return posts > 0 || listens > 0;
    }

    public TopicMetrics plus(long listenCount) {
        return new TopicMetrics(posts + 1, listens + listenCount);
    }
}
