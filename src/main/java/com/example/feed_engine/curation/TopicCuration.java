package com.example.feed_engine.curation;

import com.example.feed_engine.model.Topic;

import java.util.List;

/**
 * Outcome of topic curation.
 *
 * @param spotlight today's topic, {@code null} when no active topic is dated today.
 * @param secondary ranked secondary topics, never containing the spotlight.
 */
public record TopicCuration(Topic spotlight, List<Topic> secondary) {
    public TopicCuration {
        secondary = secondary == null ? List.of() : List.copyOf(secondary);
    }

    public static TopicCuration empty() {
        return new TopicCuration(null, List.of());
    }
}
