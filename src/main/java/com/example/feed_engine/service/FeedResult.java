package com.example.feed_engine.service;

import com.example.feed_engine.api.dto.PageResponse;
import com.example.feed_engine.paging.FeedWindow;
import com.example.feed_engine.ranking.ScoredClip;

/**
 * Page of an assembled feed and the window it was built for.
 */
public record FeedResult(PageResponse<ScoredClip> page, FeedWindow window) {
}
