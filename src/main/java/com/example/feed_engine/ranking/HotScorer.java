package com.example.feed_engine.ranking;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.model.TopicMetrics;
import com.example.feed_engine.util.ClipStatus;
import com.example.feed_engine.util.ContentRating;
import com.example.feed_engine.util.DeterministicJitter;
import com.example.feed_engine.util.RankingMode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Recency-weighted engagement with a smooth 12 hour decay.
 */
@Component
public class HotScorer implements ModeScorer {
    private static final double DECAY_HOURS = 12.0;
    private static final double W_FRESHNESS = 0.5;
    private static final double W_REACTIONS = 0.2;
    private static final double W_LISTENS = 0.15;
    private static final double W_COMPLETION = 0.15;
    private static final double MAX_TOPIC_BOOST = 0.4;
    private static final double LOCAL_BOOST = 0.08;
    private static final double SENSITIVE_PENALTY = 0.15;
    private static final double MODERATION_WEIGHT = 0.5;
    private static final double PROCESSING_PENALTY = 0.2;

    @Override
    public RankingMode mode() {
        return RankingMode.HOT;
    }

    @Override
    public Optional<ScoredClip> score(Clip clip, RankingParams params, Instant now) {
        double hoursOld = ClipSignals.hoursOld(clip, now);
        double freshness = Math.exp(-hoursOld / DECAY_HOURS);
        double reactionScore = Math.sqrt(ClipSignals.reactionTotal(clip) + 1);
        double listenScore = Math.sqrt(clip.listensCount() + 1);
        double completion = ClipSignals.completionScore(clip);
        double topicBoost = topicBoost(clip, params);
        double localBoost = isLocal(clip, params.viewerCity()) ? LOCAL_BOOST : 0.0;
        double sensitivePenalty = clip.contentRating() == ContentRating.SENSITIVE ? SENSITIVE_PENALTY : 0.0;
        double moderationPenalty = clip.moderationVerdict().risk() * MODERATION_WEIGHT;
        double processingPenalty = clip.status() == ClipStatus.PROCESSING ? PROCESSING_PENALTY : 0.0;
        double jitter = DeterministicJitter.of(clip.id(), params.jitterAmplitude());

        double score = W_FRESHNESS * freshness
                + W_REACTIONS * reactionScore
                + W_LISTENS * listenScore
                + W_COMPLETION * completion
                + topicBoost
                + localBoost
                + jitter
                - processingPenalty
                - moderationPenalty
                - sensitivePenalty;

        String explanation = String.format(Locale.ROOT,
                "F=%.3f R=%.3f L=%.3f C=%.2f topic=%.3f local=%.2f jit=%.4f proc=%.2f mod=%.3f sens=%.2f -> %.4f",
                freshness, reactionScore, listenScore, completion, topicBoost, localBoost, jitter,
                processingPenalty, moderationPenalty, sensitivePenalty, score);
        return Optional.of(new ScoredClip(clip, score, explanation));
    }

    static double topicBoost(Clip clip, RankingParams params) {
        if (clip.topicId() == null) {
            return 0.0;
        }
        TopicMetrics metrics = params.topicMetrics().get(clip.topicId());
        if (metrics == null) {
            return 0.0;
        }
        double boost = Math.log1p(Math.max(0, metrics.posts())) * 0.12 + Math.log1p(Math.max(0, metrics.listens())) * 0.05;
        return Math.min(MAX_TOPIC_BOOST, boost);
    }

    private static boolean isLocal(Clip clip, String viewerCity) {
        return viewerCity != null && !viewerCity.isBlank()
                && clip.city() != null && clip.city().equalsIgnoreCase(viewerCity);
    }
}
