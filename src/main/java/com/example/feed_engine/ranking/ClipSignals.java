package com.example.feed_engine.ranking;

import com.example.feed_engine.model.Clip;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Derived quantities shared by the mode scorers. None of these throw on messy data.
 */
public final class ClipSignals {
    static final double UNKNOWN_COMPLETION = 0.5;
    private static final double MS_PER_HOUR = 3_600_000.0;

    private ClipSignals() {
    }

    /** Sum of reaction counts; values that are not numbers count as zero. */
    public static double reactionTotal(Clip clip) {
        double total = 0;
        for (double count : reactionCounts(clip)) {
            total += count;
        }
        return total;
    }

    /** Coerced reaction counts in map order. */
    public static List<Double> reactionCounts(Clip clip) {
        List<Double> counts = new ArrayList<>(clip.reactions().size());
        for (Object value : clip.reactions().values()) {
            counts.add(coerce(value));
        }
        return counts;
    }

    /** Hours since creation, never negative. A missing creation time counts as brand new. */
    public static double hoursOld(Clip clip, Instant now) {
        if (clip.createdAt() == null) {
            return 0.0;
        }
        long ms = Duration.between(clip.createdAt(), now).toMillis();
        return Math.max(0.0, ms / MS_PER_HOUR);
    }

    /** Completion rate clamped to 0..1, 0.5 when unknown. */
    public static double completionScore(Clip clip) {
        Double rate = clip.completionRate();
        if (rate == null || rate.isNaN()) {
            return UNKNOWN_COMPLETION;
        }
        return Math.max(0.0, Math.min(1.0, rate));
    }

    static double coerce(Object value) {
        double numeric;
        if (value instanceof Number n) {
            numeric = n.doubleValue();
        } else if (value instanceof String s) {
            try {
                numeric = s.isBlank() ? 0.0 : Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                numeric = 0.0;
            }
        } else {
            numeric = 0.0;
        }
        return Double.isFinite(numeric) ? numeric : 0.0;
    }
}
