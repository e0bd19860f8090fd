package com.example.feed_engine.filter;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.model.ModerationVerdict;
import com.example.feed_engine.model.ViewerProfile;
import com.example.feed_engine.util.ClipStatus;
import com.example.feed_engine.util.ContentRating;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Removes clips a viewer must never see. Every rule is an exclusion, so the filter is idempotent
 * and the order of the rules does not change the outcome.
 */
@Component
public class VisibilityFilter {
    private static final Logger LOGGER = LoggerFactory.getLogger(VisibilityFilter.class);

    public List<Clip> filterVisible(List<Clip> clips, ViewerProfile viewer) {
        Objects.requireNonNull(clips, "clips");
        ViewerProfile effective = viewer == null ? ViewerProfile.anonymous() : viewer;
        List<Clip> visible = new ArrayList<>(clips.size());
        for (Clip clip : clips) {
            if (clip == null) {
                continue;
            }
            String reason = exclusionReason(clip, effective);
            if (reason != null) {
                LOGGER.trace("visibility skip clip={} reason={}", clip.id(), reason);
                continue;
            }
            visible.add(clip);
        }
        LOGGER.debug("VisibilityFilter input={} visible={}", clips.size(), visible.size());
        return visible;
    }

    private static String exclusionReason(Clip clip, ViewerProfile viewer) {
        if (clip.creatorId() != null && viewer.blockedCreatorIds().contains(clip.creatorId())) {
            return "blocked-creator";
        }
        if (clip.status() == ClipStatus.HIDDEN || clip.status() == ClipStatus.REMOVED) {
            return "status-" + clip.status().toJson();
        }
        ModerationVerdict verdict = clip.moderationVerdict();
        if (verdict.isBlockedDecision()) {
            return "moderation-decision";
        }
        if (verdict.isHighRiskFlag()) {
            return "moderation-risk";
        }
        if (clip.contentRating() == ContentRating.SENSITIVE && !viewer.sensitiveContentAllowed()) {
            return "sensitive";
        }
        return null;
    }
}
