package com.example.feed_engine.classify;

import com.example.feed_engine.model.Clip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword based classifier. Counts whole-word keyword hits per category over title, summary, captions and tags;
 * the category with the most hits wins, ties go to the category declared first.
 */
@Component
public class KeywordClipClassifier implements ClipClassifier {
    private static final Logger LOGGER = LoggerFactory.getLogger(KeywordClipClassifier.class);

    static final Map<String, Set<String>> DEFAULT_CATEGORIES = defaultCategories();

    private final Map<String, List<Pattern>> patterns;

    public KeywordClipClassifier() {
        this(DEFAULT_CATEGORIES);
    }

    public KeywordClipClassifier(Map<String, Set<String>> categories) {
        Map<String, List<Pattern>> compiled = new LinkedHashMap<>();
        categories.forEach((category, keywords) -> {
            List<Pattern> list = new ArrayList<>(keywords.size());
            for (String keyword : keywords) {
                // match on word boundaries so "art" does not hit "party"
                list.add(Pattern.compile("\\b" + Pattern.quote(keyword.toLowerCase(Locale.ROOT)) + "\\b"));
            }
            compiled.put(category.toLowerCase(Locale.ROOT), List.copyOf(list));
        });
        this.patterns = Collections.unmodifiableMap(compiled);
    }

    @Override
    public Optional<String> classify(Clip clip) {
        if (clip == null) {
            return Optional.empty();
        }
        String text = haystack(clip);
        if (text.isBlank()) {
            return Optional.empty();
        }
        String best = null;
        int bestHits = 0;
        for (Map.Entry<String, List<Pattern>> entry : patterns.entrySet()) {
            int hits = 0;
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(text).find()) {
                    hits++;
                }
            }
            if (hits > bestHits) {
                best = entry.getKey();
                bestHits = hits;
            }
        }
        LOGGER.trace("classify clip={} category={} hits={}", clip.id(), best, bestHits);
        return Optional.ofNullable(best);
    }

    @Override
    public Set<String> categories() {
        return patterns.keySet();
    }

    private static String haystack(Clip clip) {
        StringBuilder sb = new StringBuilder();
        append(sb, clip.title());
        append(sb, clip.summary());
        append(sb, clip.captions());
        for (String tag : clip.tags()) {
            append(sb, tag);
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static void append(StringBuilder sb, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(value).append(' ');
        }
    }

    private static Map<String, Set<String>> defaultCategories() {
        Map<String, Set<String>> m = new LinkedHashMap<>();
        m.put("comedy", ordered("funny", "joke", "jokes", "laugh", "lol", "prank", "comedy", "standup", "humor"));
        m.put("music", ordered("song", "music", "beat", "melody", "cover", "sing", "singing", "guitar", "rap", "lyrics"));
        m.put("news", ordered("news", "breaking", "update", "election", "headline", "report", "politics"));
        m.put("sports", ordered("game", "match", "goal", "team", "football", "basketball", "soccer", "sports"));
        m.put("tech", ordered("ai", "code", "coding", "app", "startup", "software", "tech", "gadget"));
        m.put("wellness", ordered("meditation", "sleep", "calm", "anxiety", "mindfulness", "breathe", "wellness"));
        m.put("stories", ordered("story", "storytime", "remember", "happened", "childhood"));
        return Collections.unmodifiableMap(m);
    }

    private static Set<String> ordered(String... keywords) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(keywords)));
    }
}
