package com.example.feed_engine.filter;

import com.example.feed_engine.util.CityScope;

import java.time.LocalDate;

/**
 * Caller-selected narrowing of the feed. {@code null} fields are not applied.
 *
 * @param cityScope          global or viewer-local feed; ignored when {@code city} is set.
 * @param city               only clips from this city.
 * @param topicId            only clips on this topic.
 * @param moodEmoji          only clips with this mood.
 * @param minDurationSeconds minimum duration, inclusive.
 * @param maxDurationSeconds maximum duration, inclusive.
 * @param dateFrom           created on or after the start of this UTC day.
 * @param dateTo             created on or before the end of this UTC day.
 * @param searchText         case-insensitive substring over the clip's text fields.
 * @param category           only clips the classifier puts in this category.
 * @param followedOnly       only clips by creators the viewer follows.
 * @param unheardOnly        only clips the viewer has not listened to.
 */
public record FeedFilters(CityScope cityScope,
                          String city,
                          String topicId,
                          String moodEmoji,
                          Double minDurationSeconds,
                          Double maxDurationSeconds,
                          LocalDate dateFrom,
                          LocalDate dateTo,
                          String searchText,
                          String category,
                          boolean followedOnly,
                          boolean unheardOnly) {

    public FeedFilters {
        cityScope = cityScope == null ? CityScope.GLOBAL : cityScope;
        if (minDurationSeconds != null && maxDurationSeconds != null && minDurationSeconds > maxDurationSeconds) {
            throw new IllegalArgumentException("minDurationSeconds must be <= maxDurationSeconds");
        }
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            throw new IllegalArgumentException("dateFrom must not be after dateTo");
        }
    }

    public static FeedFilters none() {
        return new FeedFilters(CityScope.GLOBAL, null, null, null, null, null, null, null, null, null, false, false);
    }

    public FeedFilters withTopic(String topic) {
        return new FeedFilters(cityScope, city, topic, moodEmoji, minDurationSeconds, maxDurationSeconds,
                dateFrom, dateTo, searchText, category, followedOnly, unheardOnly);
    }

    public FeedFilters withCityScope(CityScope scope) {
        return new FeedFilters(scope, city, topicId, moodEmoji, minDurationSeconds, maxDurationSeconds,
                dateFrom, dateTo, searchText, category, followedOnly, unheardOnly);
    }

    public FeedFilters withSearchText(String text) {
        return new FeedFilters(cityScope, city, topicId, moodEmoji, minDurationSeconds, maxDurationSeconds,
                dateFrom, dateTo, text, category, followedOnly, unheardOnly);
    }

    public FeedFilters withCategory(String cat) {
        return new FeedFilters(cityScope, city, topicId, moodEmoji, minDurationSeconds, maxDurationSeconds,
                dateFrom, dateTo, searchText, cat, followedOnly, unheardOnly);
    }

    public FeedFilters withFollowedOnly(boolean enabled) {
        return new FeedFilters(cityScope, city, topicId, moodEmoji, minDurationSeconds, maxDurationSeconds,
                dateFrom, dateTo, searchText, category, enabled, unheardOnly);
    }

    public FeedFilters withUnheardOnly(boolean enabled) {
        return new FeedFilters(cityScope, city, topicId, moodEmoji, minDurationSeconds, maxDurationSeconds,
                dateFrom, dateTo, searchText, category, followedOnly, enabled);
    }
}
