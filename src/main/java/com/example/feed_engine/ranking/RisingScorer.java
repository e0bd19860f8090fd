package com.example.feed_engine.ranking;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.util.RankingMode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Engagement velocity of clips from the last 48 hours. Older clips are not ranked.
 */
@Component
public class RisingScorer implements ModeScorer {
    static final double MAX_AGE_HOURS = 48.0;

    @Override
    public RankingMode mode() {
        return RankingMode.RISING;
    }

    @Override
    public Optional<ScoredClip> score(Clip clip, RankingParams params, Instant now) {
        double hoursOld = ClipSignals.hoursOld(clip, now);
        if (hoursOld > MAX_AGE_HOURS) {
            return Optional.empty();
        }
        double reactions = ClipSignals.reactionTotal(clip);
        long listens = clip.listensCount();
        double completion = ClipSignals.completionScore(clip);

        double ageWeight = Math.max(0.0, 1 - hoursOld / MAX_AGE_HOURS);
        double performanceRatio = (reactions + listens) / Math.max(1.0, hoursOld);
        double base = Math.sqrt(reactions + 1) + Math.sqrt(listens + 1) + completion * 5;
        double score = base * ageWeight * (1 + Math.log1p(performanceRatio));

        String explanation = String.format(Locale.ROOT, "base=%.3f age=%.3f perf=%.3f -> %.4f",
                base, ageWeight, performanceRatio, score);
        return Optional.of(new ScoredClip(clip, score, explanation));
    }
}
