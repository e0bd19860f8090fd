package com.example.feed_engine.ranking;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.util.RankingMode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Pure engagement inside the selected time window. Clips created before the window are not ranked.
 */
@Component
public class TopScorer implements ModeScorer {
    private static final double REACTION_WEIGHT = 2.0;
    private static final double LISTEN_WEIGHT = 1.0;
    private static final double COMPLETION_WEIGHT = 10.0;

    @Override
    public RankingMode mode() {
        return RankingMode.TOP;
    }

    @Override
    public Optional<ScoredClip> score(Clip clip, RankingParams params, Instant now) {
        Optional<Instant> cutoff = params.timeWindow().cutoff(now);
        if (cutoff.isPresent() && clip.createdAt() != null && clip.createdAt().isBefore(cutoff.get())) {
            return Optional.empty();
        }
        double reactions = ClipSignals.reactionTotal(clip);
        double completion = ClipSignals.completionScore(clip);
        double score = reactions * REACTION_WEIGHT + clip.listensCount() * LISTEN_WEIGHT + completion * COMPLETION_WEIGHT;
        String explanation = String.format(Locale.ROOT, "R=%.0f L=%d C=%.2f window=%s -> %.3f",
                reactions, clip.listensCount(), completion, params.timeWindow().toJson(), score);
        return Optional.of(new ScoredClip(clip, score, explanation));
    }
}
