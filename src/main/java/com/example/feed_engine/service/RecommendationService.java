package com.example.feed_engine.service;

import com.example.feed_engine.model.Clip;
import com.example.feed_engine.model.ListenEvent;
import com.example.feed_engine.ranking.ScoredClip;

import java.time.Instant;
import java.util.List;

/**
 * History based recommendations for the "you might like" and "similar voices" rails.
 * Both methods return an empty list, never an error, when history or candidates are missing.
 */
public interface RecommendationService {

    /**
     * Recommends clips sharing topics, tags or creators with the viewer's recent listens.
     *
     * @param listenHistory the viewer's listen events, any order.
     * @param catalog       clips to resolve listened clips and draw candidates from.
     * @param now           reference time for the recency bonus.
     * @return at most {@code result-limit} clips, best first.
     */
    List<ScoredClip> recommendContent(List<ListenEvent> listenHistory, List<Clip> catalog, Instant now);

    /**
     * Recommends clips by creators who publish on the same topics as the viewer's favorite creators.
     *
     * @param listenHistory the viewer's listen events, any order.
     * @param catalog       clips to resolve listened clips and draw candidates from.
     * @param now           reference time for the recency bonus.
     * @return at most {@code result-limit} clips, best first.
     */
    List<ScoredClip> recommendCreators(List<ListenEvent> listenHistory, List<Clip> catalog, Instant now);
}
