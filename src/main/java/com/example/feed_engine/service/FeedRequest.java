package com.example.feed_engine.service;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.model.FollowEdge;
import com.example.feed_engine.model.ListenEvent;
import com.example.feed_engine.model.TopicMetrics;
import com.example.feed_engine.model.ViewerProfile;
import com.example.feed_engine.paging.FeedWindow;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Input snapshot for one feed assembly.
 *
 * @param clips        raw clips, replies included.
 * @param viewer       viewer capabilities.
 * @param window       criteria and number of pages loaded.
 * @param topicMetrics precomputed topic metrics, {@code null} to derive them from {@code clips}.
 * @param listens      viewer listen history, used by the unheard filter.
 * @param follows      follow edges, used by the followed-creators filter.
 * @param now          reference time, {@code null} to read the injected clock.
 */
public record FeedRequest(List<Clip> clips,
                          ViewerProfile viewer,
                          FeedWindow window,
                          Map<String, TopicMetrics> topicMetrics,
                          List<ListenEvent> listens,
                          List<FollowEdge> follows,
                          Instant now) {
    public FeedRequest {
        Objects.requireNonNull(clips, "clips");
        Objects.requireNonNull(window, "window");
        viewer = viewer == null ? ViewerProfile.anonymous() : viewer;
        listens = listens == null ? List.of() : listens;
        follows = follows == null ? List.of() : follows;
    }

    public static FeedRequest of(List<Clip> clips, ViewerProfile viewer, FeedWindow window, Instant now) {
        return new FeedRequest(clips, viewer, window, null, List.of(), List.of(), now);
    }
}
