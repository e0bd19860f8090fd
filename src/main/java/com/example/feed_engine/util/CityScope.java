package com.example.feed_engine.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Whether the feed shows every city or only the viewer's own.
 */
public enum CityScope {
    GLOBAL,
    LOCAL;

    @JsonCreator
    public static CityScope fromValue(String value) {
        if (value == null || value.isBlank()) {
            return GLOBAL;
        }
        String normalized = value.trim();
        for (CityScope scope : values()) {
            if (scope.name().equalsIgnoreCase(normalized)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unsupported city scope: " + value);
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
