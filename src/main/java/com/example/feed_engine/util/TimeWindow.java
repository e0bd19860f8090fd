package com.example.feed_engine.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Look-back window for the {@code top} ranking mode.
 */
public enum TimeWindow {
    ALL(null),
    WEEK(Duration.ofDays(7)),
    MONTH(Duration.ofDays(30));

    private final Duration length;

    TimeWindow(Duration length) {
        this.length = length;
    }

    /**
     * Oldest creation time still inside the window.
     *
     * @param now reference time.
     * @return cutoff instant, empty for {@link #ALL}.
     */
    public Optional<Instant> cutoff(Instant now) {
        return length == null ? Optional.empty() : Optional.of(now.minus(length));
    }

    /**
     * Parses a window name; {@code null} or blank means {@link #ALL}.
     */
    @JsonCreator
    public static TimeWindow fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        String normalized = value.trim();
        for (TimeWindow window : values()) {
            if (window.name().equalsIgnoreCase(normalized)) {
                return window;
            }
        }
        throw new IllegalArgumentException("Unsupported time window: " + value);
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
