package com.example.feed_engine.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Normalized reading of the loose moderation object attached to a clip.
 * <p>
 * Risk is kept on a 0..1 scale; values above 1 (up to 10) come from the older 0..10 scale and are divided by ten.
 * The decision is read from {@code decision}, falling back to {@code status}; anything that is not text is ignored.
 *
 * @param risk     normalized risk between 0 and 1.
 * @param decision moderation decision or {@code null}.
 * @param flagged  whether the verdict carries {@code flag=true}.
 */
public record ModerationVerdict(double risk, String decision, boolean flagged) {
    public static final ModerationVerdict NONE = new ModerationVerdict(0.0, null, false);
    public static final double HIGH_RISK_THRESHOLD = 0.7;
    private static final double LEGACY_SCALE_MAX = 10.0;

    public static ModerationVerdict from(JsonNode node) {
        if (node == null || node.isNull() || !node.isObject()) {
            return NONE;
        }
        return new ModerationVerdict(normalizeRisk(node.get("risk")), readDecision(node), readFlag(node.get("flag")));
    }

    public boolean isBlockedDecision() {
        if (decision == null) {
            return false;
        }
        String d = decision.trim().toLowerCase(Locale.ROOT);
        return d.equals("blocked") || d.equals("reject");
    }

    public boolean isHighRiskFlag() {
        return flagged && risk >= HIGH_RISK_THRESHOLD;
    }

    private static double normalizeRisk(JsonNode riskNode) {
        if (riskNode == null || !riskNode.isNumber()) {
            return 0.0;
        }
        double raw = riskNode.doubleValue();
        if (Double.isNaN(raw) || raw <= 0) {
            return 0.0;
        }
        if (raw > 1.0) {
            raw = Math.min(raw, LEGACY_SCALE_MAX) / LEGACY_SCALE_MAX;
        }
        return Math.min(1.0, raw);
    }

    private static String readDecision(JsonNode node) {
        JsonNode decision = node.get("decision");
        if (decision != null && decision.isTextual()) {
            return decision.textValue();
        }
        JsonNode status = node.get("status");
        if (status != null && status.isTextual()) {
            return status.textValue();
        }
        return null;
    }

    private static boolean readFlag(JsonNode flag) {
        return flag != null && flag.isBoolean() && flag.booleanValue();
    }
}
