package com.example.feed_engine.paging;

import com.example.feed_engine.filter.FeedFilters;
import com.example.feed_engine.util.RankingMode;
import com.example.feed_engine.util.TimeWindow;

import java.util.Objects;

/**
 * Everything that determines the feed ordering. A change in any field restarts paging.
 *
 * @param mode       ranking mode.
 * @param timeWindow window for the {@code top} mode.
 * @param filters    feed filters, including topic focus.
 */
public record FeedCriteria(RankingMode mode, TimeWindow timeWindow, FeedFilters filters) {
    public FeedCriteria {
        Objects.requireNonNull(mode, "mode");
        timeWindow = timeWindow == null ? TimeWindow.ALL : timeWindow;
        filters = filters == null ? FeedFilters.none() : filters;
    }

    public static FeedCriteria of(RankingMode mode) {
        return new FeedCriteria(mode, TimeWindow.ALL, FeedFilters.none());
    }
}
