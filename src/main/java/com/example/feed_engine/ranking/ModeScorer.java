package com.example.feed_engine.ranking;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.util.RankingMode;

import java.time.Instant;
import java.util.Optional;

/**
 * Scoring formula for a single {@link RankingMode}.
 */
public interface ModeScorer {

    RankingMode mode();

    /**
     * Scores a clip.
     *
     * @param clip   clip that already passed visibility filtering.
     * @param params mode parameters and viewer context.
     * @param now    reference time.
     * @return scored clip, or empty when the mode excludes the clip from ranking.
     */
    Optional<ScoredClip> score(Clip clip, RankingParams params, Instant now);
}
