package com.example.feed_engine.ranking;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.util.RankingMode;

import java.time.Instant;
import java.util.List;

/**
 * Orders clips for one of the feed ranking modes.
 */
public interface ClipRanker {
    /**
     * Scores every eligible clip and sorts by score in descending order.
     * The sort is stable, so clips with equal scores keep their input order.
     *
     * @param clips  visible clips, typically newest first.
     * @param mode   ranking mode.
     * @param params mode parameters; {@code null} means {@link RankingParams#defaults()}.
     * @param now    reference time for all age-dependent terms.
     * @return ranked clips; replies and clips the mode excludes are left out.
     */
    List<ScoredClip> rank(List<Clip> clips, RankingMode mode, RankingParams params, Instant now);
}
