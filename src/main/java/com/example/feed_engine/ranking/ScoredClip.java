package com.example.feed_engine.ranking;

import com.example.feed_engine.model.Clip;

/**
 * Clip paired with the score it was ranked by.
 *
 * @param clip        ranked clip.
 * @param score       mode-specific score, higher ranks first.
 * @param explanation compact breakdown of the formula terms.
 */
public record ScoredClip(Clip clip, double score, String explanation) {
}
