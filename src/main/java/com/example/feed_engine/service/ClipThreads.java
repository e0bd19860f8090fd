package com.example.feed_engine.service;

import com.example.feed_engine.model.Clip;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds replies and remixes into counts on their source clips and keeps the top-level clips as feed candidates.
 */
@Component
public class ClipThreads {

    /**
     * @param clips raw clip set, replies included.
     * @return published top-level clips carrying reply and remix counts, newest first.
     */
    public List<Clip> topLevel(Collection<Clip> clips) {
        if (clips == null || clips.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> replies = new HashMap<>();
        Map<String, Integer> remixes = new HashMap<>();
        for (Clip clip : clips) {
            if (!isPublished(clip)) {
                continue;
            }
            if (clip.parentClipId() != null) {
                replies.merge(clip.parentClipId(), 1, Integer::sum);
            }
            if (clip.remixOfClipId() != null) {
                remixes.merge(clip.remixOfClipId(), 1, Integer::sum);
            }
        }

        List<Clip> out = new ArrayList<>();
        for (Clip clip : clips) {
            if (!isPublished(clip) || clip.isReply()) {
                continue;
            }
            out.add(clip.withThreadCounts(replies.getOrDefault(clip.id(), 0), remixes.getOrDefault(clip.id(), 0)));
        }
        out.sort(Comparator.comparing(Clip::createdAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return out;
    }

    private static boolean isPublished(Clip clip) {
        return clip != null && clip.status() != null && clip.status().isPublished();
    }
}
