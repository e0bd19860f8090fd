package com.example.feed_engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tunables for ranking, curation, recommendations and result caching.
 */
@Validated
@ConfigurationProperties(prefix = "feed")
public class FeedProperties {

    @Min(1)
    private int pageSize = 20;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double jitterAmplitude = 0.05;

    @Valid
    private Recommendations recommendations = new Recommendations();
    @Valid
    private Curation curation = new Curation();
    @Valid
    private Cache cache = new Cache();

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public double getJitterAmplitude() {
        return jitterAmplitude;
    }

    public void setJitterAmplitude(double jitterAmplitude) {
        this.jitterAmplitude = jitterAmplitude;
    }

    public Recommendations getRecommendations() {
        return recommendations;
    }

    public void setRecommendations(Recommendations recommendations) {
        this.recommendations = recommendations;
    }

    public Curation getCuration() {
        return curation;
    }

    public void setCuration(Curation curation) {
        this.curation = curation;
    }

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    /**
     * Bounds used by the content and similar-creator recommenders.
     * Candidate limits of {@code 0} mean unbounded.
     */
    public static class Recommendations {
        @Min(1)
        private int contentHistoryLimit = 50;
        @Min(1)
        private int creatorHistoryLimit = 30;
        @Min(1)
        private int favoriteCreators = 3;
        @Min(1)
        private int favoriteClipSample = 20;
        @Min(1)
        private int similarCreatorPool = 50;
        @Min(1)
        private int similarCreators = 5;
        @Min(0)
        private int contentCandidateLimit = 0;
        @Min(0)
        private int creatorCandidateLimit = 0;
        @Min(1)
        private int resultLimit = 6;

        public int getContentHistoryLimit() { return contentHistoryLimit; }
        public void setContentHistoryLimit(int contentHistoryLimit) { this.contentHistoryLimit = contentHistoryLimit; }

        public int getCreatorHistoryLimit() { return creatorHistoryLimit; }
        public void setCreatorHistoryLimit(int creatorHistoryLimit) { this.creatorHistoryLimit = creatorHistoryLimit; }

        public int getFavoriteCreators() { return favoriteCreators; }
        public void setFavoriteCreators(int favoriteCreators) { this.favoriteCreators = favoriteCreators; }

        public int getFavoriteClipSample() { return favoriteClipSample; }
        public void setFavoriteClipSample(int favoriteClipSample) { this.favoriteClipSample = favoriteClipSample; }

        public int getSimilarCreatorPool() { return similarCreatorPool; }
        public void setSimilarCreatorPool(int similarCreatorPool) { this.similarCreatorPool = similarCreatorPool; }

        public int getSimilarCreators() { return similarCreators; }
        public void setSimilarCreators(int similarCreators) { this.similarCreators = similarCreators; }

        public int getContentCandidateLimit() { return contentCandidateLimit; }
        public void setContentCandidateLimit(int contentCandidateLimit) { this.contentCandidateLimit = contentCandidateLimit; }

        public int getCreatorCandidateLimit() { return creatorCandidateLimit; }
        public void setCreatorCandidateLimit(int creatorCandidateLimit) { this.creatorCandidateLimit = creatorCandidateLimit; }

        public int getResultLimit() { return resultLimit; }
        public void setResultLimit(int resultLimit) { this.resultLimit = resultLimit; }
    }

    /**
     * Secondary topic selection bounds.
     */
    public static class Curation {
        @Min(0)
        private int maxSecondary = 6;
        @Min(0)
        private int minSecondary = 3;
        @DecimalMin("0.0")
        private double freshDays = 3.0;

        public int getMaxSecondary() { return maxSecondary; }
        public void setMaxSecondary(int maxSecondary) { this.maxSecondary = maxSecondary; }

        public int getMinSecondary() { return minSecondary; }
        public void setMinSecondary(int minSecondary) { this.minSecondary = minSecondary; }

        public double getFreshDays() { return freshDays; }
        public void setFreshDays(double freshDays) { this.freshDays = freshDays; }
    }

    /**
     * Memoization of assembled rankings. Off unless enabled.
     */
    public static class Cache {
        private boolean enabled = false;
        @NotNull
        private Duration ttl = Duration.ofSeconds(5);
        @NotNull
        private Duration timeBucket = Duration.ofSeconds(5);
        @Min(1)
        private long maximumSize = 1_000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public Duration getTimeBucket() { return timeBucket; }
        public void setTimeBucket(Duration timeBucket) { this.timeBucket = timeBucket; }

        public long getMaximumSize() { return maximumSize; }
        public void setMaximumSize(long maximumSize) { this.maximumSize = maximumSize; }
    }
}
