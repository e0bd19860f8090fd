package com.example.feed_engine.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContentRating {
    GENERAL,
    SENSITIVE;

    @JsonCreator
    public static ContentRating fromJson(String value) {
        if (value == null || value.isBlank()) {
            return GENERAL;
        }
        String normalized = value.trim();
        for (ContentRating rating : values()) {
            if (rating.name().equalsIgnoreCase(normalized)) {
                return rating;
            }
        }
        // unrecognized ratings are treated as sensitive
        return SENSITIVE;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
