package com.example.feed_engine.model;

import com.example.feed_engine.util.ClipStatus;
import com.example.feed_engine.util.ContentRating;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a clip row as delivered by the content store.
 *
 * @param id              unique clip id.
 * @param creatorId       owning profile, {@code null} for anonymized clips.
 * @param creator         joined creator profile (handle, avatar), may be {@code null}.
 * @param createdAt       creation time.
 * @param status          lifecycle status.
 * @param listensCount    number of listens.
 * @param reactions       emoji to count; values are loose and coerced when scored.
 * @param completionRate  average completion between 0 and 1, {@code null} when unknown.
 * @param topicId         referenced topic, may be {@code null}.
 * @param tags            free-text tags.
 * @param contentRating   general or sensitive.
 * @param moderation      raw moderation verdict object, see {@link ModerationVerdict}.
 * @param parentClipId    parent clip when this clip is a reply.
 * @param remixOfClipId   source clip when this clip is a remix.
 * @param chainId         chain the clip belongs to.
 * @param trendingScore   server-computed trending score.
 * @param city            city the clip was recorded in.
 * @param moodEmoji       mood picked by the creator.
 * @param durationSeconds audio length.
 * @param title           optional title.
 * @param summary         optional generated summary.
 * @param captions        optional captions.
 * @param replyCount      replies aggregated onto this clip.
 * @param remixCount      remixes aggregated onto this clip.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Clip(
        String id,
        @JsonProperty("profile_id") String creatorId,
        @JsonProperty("profiles") CreatorRef creator,
        @JsonProperty("created_at") Instant createdAt,
        ClipStatus status,
        @JsonProperty("listens_count") long listensCount,
        Map<String, Object> reactions,
        @JsonProperty("completion_rate") Double completionRate,
        @JsonProperty("topic_id") String topicId,
        List<String> tags,
        @JsonProperty("content_rating") ContentRating contentRating,
        JsonNode moderation,
        @JsonProperty("parent_clip_id") String parentClipId,
        @JsonProperty("remix_of_clip_id") String remixOfClipId,
        @JsonProperty("chain_id") String chainId,
        @JsonProperty("trending_score") Double trendingScore,
        String city,
        @JsonProperty("mood_emoji") String moodEmoji,
        @JsonProperty("duration_seconds") double durationSeconds,
        String title,
        String summary,
        String captions,
        @JsonProperty("reply_count") int replyCount,
        @JsonProperty("remix_count") int remixCount
) {
    public Clip {
        reactions = reactions == null ? Map.of() : reactions;
        tags = tags == null ? List.of() : tags;
        contentRating = contentRating == null ? ContentRating.GENERAL : contentRating;
        listensCount = Math.max(0, listensCount);
    }

    /**
     * Joined creator profile columns.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CreatorRef(String handle, @JsonProperty("emoji_avatar") String emojiAvatar) {
    }

    public boolean isReply() {
        return parentClipId != null;
    }

    public ModerationVerdict moderationVerdict() {
        return ModerationVerdict.from(moderation);
    }

    public Clip withThreadCounts(int replies, int remixes) {
        return new Clip(id, creatorId, creator, createdAt, status, listensCount, reactions, completionRate,
                topicId, tags, contentRating, moderation, parentClipId, remixOfClipId, chainId, trendingScore,
                city, moodEmoji, durationSeconds, title, summary, captions, replies, remixes);
    }
}
