package com.example.feed_engine.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a clip as reported by the content store.
 */
public enum ClipStatus {
    DRAFT,
    PROCESSING,
    LIVE,
    HIDDEN,
    REMOVED;

    /**
     * Tolerant, case-insensitive parsing of the store value.
     *
     * @param value raw status string, e.g. {@code "live"}.
     * @return matching status, or {@code null} when the value is blank or unknown; {@code null} is never published.
     */
    @JsonCreator
    public static ClipStatus fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim();
        for (ClipStatus status : values()) {
            if (status.name().equalsIgnoreCase(normalized)) {
                return status;
            }
        }
        return null;
    }

    /** Statuses that count towards topic metrics and thread counts. */
    public boolean isPublished() {
        return this == LIVE || this == PROCESSING;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
