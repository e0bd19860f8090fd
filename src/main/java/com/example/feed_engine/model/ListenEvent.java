package com.example.feed_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A viewer having consumed a clip.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ListenEvent(@JsonProperty("profile_id") String viewerId,
                          @JsonProperty("clip_id") String clipId,
                          @JsonProperty("listened_at") Instant listenedAt) {
}
