package com.example.feed_engine.classify;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.example.feed_engine.support.TestClips.clip;
import static org.assertj.core.api.Assertions.assertThat;

class KeywordClipClassifierTest {

    private final KeywordClipClassifier classifier = new KeywordClipClassifier();

    @Test
    void picksCategoryWithMostKeywordHits() {
        assertThat(classifier.classify(clip("c").title("Breaking news").summary("election report").build()))
                .contains("news");
        assertThat(classifier.classify(clip("c").tags("guitar", "song").build())).contains("music");
    }

    @Test
    void matchesWholeWordsOnly() {
        // "gameplay" and "goalkeeper" must not count as sports keywords
        assertThat(classifier.classify(clip("c").title("gameplay goalkeeper").build())).isEmpty();
        assertThat(classifier.classify(clip("c").title("What a GOAL!").build())).contains("sports");
    }

    @Test
    void tiesGoToFirstDeclaredCategory() {
        Map<String, Set<String>> categories = new LinkedHashMap<>();
        categories.put("alpha", Set.of("one"));
        categories.put("beta", Set.of("two"));
        KeywordClipClassifier custom = new KeywordClipClassifier(categories);

        assertThat(custom.classify(clip("c").summary("two and one").build())).contains("alpha");
        assertThat(custom.categories()).containsExactly("alpha", "beta");
    }

    @Test
    void clipsWithoutTextAreUnclassified() {
        assertThat(classifier.classify(clip("c").build())).isEmpty();
        assertThat(classifier.classify(null)).isEmpty();
    }
}
