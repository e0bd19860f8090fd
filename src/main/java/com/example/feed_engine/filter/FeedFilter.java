package com.example.feed_engine.filter;

import com.example.feed_engine.classify.ClipClassifier;
import com.example.feed_engine.model.Clip;
import com.example.feed_engine.model.FollowEdge;
import com.example.feed_engine.model.ListenEvent;
import com.example.feed_engine.model.ViewerProfile;
import com.example.feed_engine.util.CityScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Applies {@link FeedFilters} to an already visible clip list, keeping the input order.
 */
@Component
public class FeedFilter {
    private static final Logger LOGGER = LoggerFactory.getLogger(FeedFilter.class);

    private final ClipClassifier classifier;

    public FeedFilter(ClipClassifier classifier) {
        this.classifier = classifier;
    }

    public List<Clip> apply(List<Clip> clips,
                            FeedFilters filters,
                            ViewerProfile viewer,
                            Collection<FollowEdge> follows,
                            Collection<ListenEvent> listens) {
        Objects.requireNonNull(clips, "clips");
        if (filters == null) {
            return List.copyOf(clips);
        }
        Predicate<Clip> predicate = buildPredicate(filters, viewer, follows, listens);
        List<Clip> out = new ArrayList<>(clips.size());
        for (Clip clip : clips) {
            if (predicate.test(clip)) {
                out.add(clip);
            }
        }
        LOGGER.debug("FeedFilter input={} kept={} filters={}", clips.size(), out.size(), filters);
        return out;
    }

    private Predicate<Clip> buildPredicate(FeedFilters f,
                                           ViewerProfile viewer,
                                           Collection<FollowEdge> follows,
                                           Collection<ListenEvent> listens) {
        Predicate<Clip> p = clip -> true;

        if (f.city() != null && !f.city().isBlank()) {
            String city = f.city();
            p = p.and(clip -> sameCity(clip.city(), city));
        } else if (f.cityScope() == CityScope.LOCAL && viewer != null && viewer.hasCity()) {
            String city = viewer.city();
            p = p.and(clip -> sameCity(clip.city(), city));
        }
        if (f.topicId() != null) {
            String topic = f.topicId();
            p = p.and(clip -> topic.equals(clip.topicId()));
        }
        if (f.moodEmoji() != null) {
            String mood = f.moodEmoji();
            p = p.and(clip -> mood.equals(clip.moodEmoji()));
        }
        if (f.minDurationSeconds() != null) {
            double min = f.minDurationSeconds();
            p = p.and(clip -> clip.durationSeconds() >= min);
        }
        if (f.maxDurationSeconds() != null) {
            double max = f.maxDurationSeconds();
            p = p.and(clip -> clip.durationSeconds() <= max);
        }
        if (f.dateFrom() != null) {
            Instant from = f.dateFrom().atStartOfDay(ZoneOffset.UTC).toInstant();
            p = p.and(clip -> clip.createdAt() != null && !clip.createdAt().isBefore(from));
        }
        if (f.dateTo() != null) {
            Instant toExclusive = f.dateTo().plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            p = p.and(clip -> clip.createdAt() != null && clip.createdAt().isBefore(toExclusive));
        }
        if (f.searchText() != null && !f.searchText().isBlank()) {
            String needle = f.searchText().trim().toLowerCase(Locale.ROOT);
            p = p.and(clip -> searchText(clip).contains(needle));
        }
        if (f.category() != null && !f.category().isBlank()) {
            String category = f.category().trim().toLowerCase(Locale.ROOT);
            p = p.and(clip -> classifier.classify(clip).map(category::equals).orElse(false));
        }
        if (f.followedOnly()) {
            Set<String> followed = followedCreators(viewer, follows);
            p = p.and(clip -> clip.creatorId() != null && followed.contains(clip.creatorId()));
        }
        if (f.unheardOnly()) {
            Set<String> heard = heardClips(viewer, listens);
            p = p.and(clip -> !heard.contains(clip.id()));
        }
        return p;
    }

    private static boolean sameCity(String clipCity, String city) {
        return clipCity != null && clipCity.equalsIgnoreCase(city);
    }

    static String searchText(Clip clip) {
        StringBuilder sb = new StringBuilder();
        for (String part : new String[]{clip.summary(), clip.captions(), clip.moodEmoji(), clip.city(), clip.title()}) {
            if (part != null && !part.isEmpty()) {
                sb.append(part).append(' ');
            }
        }
        if (!clip.tags().isEmpty()) {
            sb.append(String.join(" ", clip.tags())).append(' ');
        }
        if (clip.creator() != null && clip.creator().handle() != null) {
            sb.append(clip.creator().handle());
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static Set<String> followedCreators(ViewerProfile viewer, Collection<FollowEdge> follows) {
        Set<String> followed = new HashSet<>();
        if (viewer == null || viewer.id() == null || follows == null) {
            return followed;
        }
        for (FollowEdge edge : follows) {
            if (edge != null && viewer.id().equals(edge.followerId()) && edge.followingId() != null) {
                followed.add(edge.followingId());
            }
        }
        return followed;
    }

    private static Set<String> heardClips(ViewerProfile viewer, Collection<ListenEvent> listens) {
        Set<String> heard = new HashSet<>();
        if (listens == null) {
            return heard;
        }
        for (ListenEvent event : listens) {
            if (event == null || event.clipId() == null) {
                continue;
            }
            // events without a viewer id are taken to belong to the current viewer
            if (event.viewerId() == null || viewer == null || viewer.id() == null || viewer.id().equals(event.viewerId())) {
                heard.add(event.clipId());
            }
        }
        return heard;
    }
}
