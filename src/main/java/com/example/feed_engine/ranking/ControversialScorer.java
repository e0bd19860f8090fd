package com.example.feed_engine.ranking;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.util.RankingMode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Rewards high engagement spread over many reaction types, with a mild 48 hour freshness preference.
 */
@Component
public class ControversialScorer implements ModeScorer {
    private static final double DECAY_HOURS = 48.0;

    @Override
    public RankingMode mode() {
        return RankingMode.CONTROVERSIAL;
    }

    @Override
    public Optional<ScoredClip> score(Clip clip, RankingParams params, Instant now) {
        List<Double> counts = ClipSignals.reactionCounts(clip);
        double total = 0;
        for (double c : counts) {
            total += c;
        }
        double variance = populationVariance(counts, total);
        int uniqueTypes = counts.size();

        double engagement = Math.log1p(total + clip.listensCount());
        double diversityBonus = Math.min(uniqueTypes * 0.3, 1.5);
        double varianceBonus = Math.min(Math.sqrt(variance) * 0.2, 1.0);
        double freshness = Math.exp(-ClipSignals.hoursOld(clip, now) / DECAY_HOURS);

        double score = engagement * (1 + diversityBonus + varianceBonus) * (0.7 + 0.3 * freshness);
        String explanation = String.format(Locale.ROOT, "E=%.3f types=%d div=%.2f var=%.3f F=%.3f -> %.4f",
                engagement, uniqueTypes, diversityBonus, varianceBonus, freshness, score);
        return Optional.of(new ScoredClip(clip, score, explanation));
    }

    static double populationVariance(List<Double> counts, double total) {
        if (counts.size() <= 1) {
            return 0.0;
        }
        double mean = total / counts.size();
        double sum = 0;
        for (double c : counts) {
            sum += (c - mean) * (c - mean);
        }
        return sum / counts.size();
    }
}
