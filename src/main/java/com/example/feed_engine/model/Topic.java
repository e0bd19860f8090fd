package com.example.feed_engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Daily discussion prompt.
 *
 * @param id          topic id.
 * @param title       prompt title.
 * @param description longer prompt text.
 * @param date        calendar date the topic belongs to.
 * @param active      active flag; {@code null} counts as active.
 * @param creatorId   submitting profile for user topics, else {@code null}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Topic(String id,
                    String title,
                    String description,
                    LocalDate date,
                    @JsonProperty("is_active") Boolean active,
                    @JsonProperty("user_created_by") String creatorId) {

    public boolean isActive() {
        return active == null || active;
    }
}
