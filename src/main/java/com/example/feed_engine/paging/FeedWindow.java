package com.example.feed_engine.paging;

import java.util.Objects;

/**
 * How many pages a viewer has loaded for a given {@link FeedCriteria}. Grows forward only and
 * starts over at one page when the criteria change.
 */
public record FeedWindow(FeedCriteria criteria, int pageCount) {
    public FeedWindow {
        Objects.requireNonNull(criteria, "criteria");
        if (pageCount < 1) {
            throw new IllegalArgumentException("pageCount must be at least 1, got " + pageCount);
        }
    }

    public static FeedWindow start(FeedCriteria criteria) {
        return new FeedWindow(criteria, 1);
    }

    public FeedWindow next() {
        return new FeedWindow(criteria, pageCount + 1);
    }

    /**
     * Keeps this window when the criteria are unchanged, otherwise resets to the first page.
     */
    public FeedWindow forCriteria(FeedCriteria newCriteria) {
        return criteria.equals(newCriteria) ? this : start(newCriteria);
    }
}
