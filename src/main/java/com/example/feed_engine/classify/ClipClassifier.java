package com.example.feed_engine.classify;

import com.example.feed_engine.model.Clip;

import java.util.Optional;
import java.util.Set;

/**
 * Assigns a browse category to a clip.
 */
public interface ClipClassifier {
    /**
     * @param clip clip to classify.
     * @return category tag, empty when the clip fits none.
     */
    Optional<String> classify(Clip clip);

    /**
     * @return every category this classifier can return.
     */
    Set<String> categories();
}
