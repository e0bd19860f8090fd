package com.example.feed_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directed follow relation, {@code followerId} follows {@code followingId}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FollowEdge(@JsonProperty("follower_id") String followerId,
                         @JsonProperty("following_id") String followingId) {
}
