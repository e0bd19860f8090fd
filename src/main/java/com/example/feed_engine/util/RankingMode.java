package com.example.feed_engine.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The five feed orderings a viewer can pick.
 */
public enum RankingMode {
    HOT,
    TOP,
    CONTROVERSIAL,
    RISING,
    TRENDING;

    /**
     * Parses a mode name case-insensitively.
     *
     * @param value incoming mode, e.g. {@code "hot"}.
     * @return matching {@link RankingMode}.
     * @throws IllegalArgumentException when the value is blank or not a known mode.
     */
    @JsonCreator
    public static RankingMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Ranking mode is required");
        }
        String normalized = value.trim();
        for (RankingMode mode : values()) {
            if (mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported ranking mode: " + value);
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
