package com.example.feed_engine.ranking;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.util.RankingMode;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Exposes the server-computed trending score as is; absent scores count as zero.
 */
@Component
public class TrendingScorer implements ModeScorer {

    @Override
    public RankingMode mode() {
        return RankingMode.TRENDING;
    }

    @Override
    public Optional<ScoredClip> score(Clip clip, RankingParams params, Instant now) {
        double score = clip.trendingScore() == null ? 0.0 : clip.trendingScore();
        return Optional.of(new ScoredClip(clip, score, "trending=" + score));
    }
}
