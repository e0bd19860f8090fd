package com.example.feed_engine.ranking;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.util.RankingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Default ranker that dispatches to the {@link ModeScorer} registered for the requested mode.
 */
@Component
public class HeuristicClipRanker implements ClipRanker {
    private static final Logger LOGGER = LoggerFactory.getLogger(HeuristicClipRanker.class);

    private final Map<RankingMode, ModeScorer> scorers;

    public HeuristicClipRanker(List<ModeScorer> scorers) {
        Map<RankingMode, ModeScorer> byMode = new EnumMap<>(RankingMode.class);
        for (ModeScorer scorer : scorers) {
            ModeScorer previous = byMode.put(scorer.mode(), scorer);
            if (previous != null) {
                throw new IllegalStateException("Duplicate scorer for mode " + scorer.mode());
            }
        }
        this.scorers = byMode;
    }

    /**
     * Ranker wired with the built-in scorer for every mode.
     */
    public static HeuristicClipRanker withDefaultScorers() {
        return new HeuristicClipRanker(List.of(new HotScorer(), new TopScorer(), new ControversialScorer(),
                new RisingScorer(), new TrendingScorer()));
    }

    @Override
    public List<ScoredClip> rank(List<Clip> clips, RankingMode mode, RankingParams params, Instant now) {
        Objects.requireNonNull(clips, "clips");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(now, "now");
        RankingParams effective = params == null ? RankingParams.defaults() : params;
        ModeScorer scorer = scorers.get(mode);
        if (scorer == null) {
            throw new IllegalArgumentException("No scorer registered for mode " + mode);
        }

        List<ScoredClip> scored = new ArrayList<>(clips.size());
        int excluded = 0;
        for (Clip clip : clips) {
            if (clip == null) {
                continue;
            }
            if (clip.isReply()) {
                LOGGER.trace("ranker skip clip={} reason=reply parent={}", clip.id(), clip.parentClipId());
                continue;
            }
            Optional<ScoredClip> result = scorer.score(clip, effective, now);
            if (result.isEmpty()) {
                excluded++;
                LOGGER.trace("ranker skip clip={} mode={} reason=outside-mode", clip.id(), mode.toJson());
                continue;
            }
            ScoredClip sc = result.get();
            if (!Double.isFinite(sc.score())) {
                LOGGER.trace("ranker clip={} non-finite score {} replaced by 0", clip.id(), sc.score());
                sc = new ScoredClip(sc.clip(), 0.0, sc.explanation());
            }
            LOGGER.trace("ranker clip={} mode={} {}", clip.id(), mode.toJson(), sc.explanation());
            scored.add(sc);
        }

        // List.sort is stable, so equal scores keep the incoming order
        scored.sort(Comparator.comparingDouble(ScoredClip::score).reversed());
        LOGGER.debug("HeuristicClipRanker mode={} clips={} ranked={} excluded={} topScore={}",
                mode.toJson(), clips.size(), scored.size(), excluded,
                scored.isEmpty() ? "-" : String.format(Locale.ROOT, "%.3f", scored.get(0).score()));
        return scored;
    }
}
