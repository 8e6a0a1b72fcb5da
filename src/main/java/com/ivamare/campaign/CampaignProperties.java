package com.ivamare.campaign;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the campaign engine.
 *
 * <p>Example configuration:
 * <pre>
 * campaign:
 *   enabled: true
 *   cache:
 *     backend: jdbc
 *     default-ttl: 10m
 *     document-ttl: 5m
 *     aggregate-ttl: 15m
 *   dispatch:
 *     default-chunk-size: 50
 *     max-chunk-size: 1000
 *     min-inter-chunk-delay: 0s
 *     rate-limit-enabled: false
 *     rate-limit-resource: campaign_dispatch
 *   scheduler:
 *     auto-start: false
 *     poll-interval-ms: 1000
 *     jobs-per-tick: 20
 *     janitor-interval: 1h
 *     resilience:
 *       initial-backoff-ms: 1000
 *       max-backoff-ms: 30000
 *       backoff-multiplier: 2.0
 *       error-threshold: 5
 * </pre>
 */
@ConfigurationProperties(prefix = "campaign")
public class CampaignProperties {

    /**
     * Enable/disable campaign engine auto-configuration.
     */
    private boolean enabled = true;

    private CacheProperties cache = new CacheProperties();

    private DispatchProperties dispatch = new DispatchProperties();

    private SchedulerProperties scheduler = new SchedulerProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public CacheProperties getCache() {
        return cache;
    }

    public void setCache(CacheProperties cache) {
        this.cache = cache;
    }

    public DispatchProperties getDispatch() {
        return dispatch;
    }

    public void setDispatch(DispatchProperties dispatch) {
        this.dispatch = dispatch;
    }

    public SchedulerProperties getScheduler() {
        return scheduler;
    }

    public void setScheduler(SchedulerProperties scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Where cache entries and group epochs live.
     */
    public enum CacheBackendType {
        /** Shared across instances through the campaign schema */
        JDBC,

        /** Per-process, lost on restart */
        MEMORY
    }

    public static class CacheProperties {

        private CacheBackendType backend = CacheBackendType.JDBC;

        /**
         * TTL for entries stored without an explicit one.
         */
        private Duration defaultTtl = Duration.ofMinutes(10);

        /**
         * TTL of single-document entries.
         */
        private Duration documentTtl = Duration.ofMinutes(5);

        /**
         * TTL of lists, counts and statistics.
         */
        private Duration aggregateTtl = Duration.ofMinutes(15);

        public CacheBackendType getBackend() {
            return backend;
        }

        public void setBackend(CacheBackendType backend) {
            this.backend = backend;
        }

        public Duration getDefaultTtl() {
            return defaultTtl;
        }

        public void setDefaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
        }

        public Duration getDocumentTtl() {
            return documentTtl;
        }

        public void setDocumentTtl(Duration documentTtl) {
            this.documentTtl = documentTtl;
        }

        public Duration getAggregateTtl() {
            return aggregateTtl;
        }

        public void setAggregateTtl(Duration aggregateTtl) {
            this.aggregateTtl = aggregateTtl;
        }
    }

    public static class DispatchProperties {

        /**
         * Chunk size used by split tests.
         */
        private int defaultChunkSize = 50;

        /**
         * Largest chunk size a job may be submitted with.
         */
        private int maxChunkSize = 1000;

        /**
         * Minimum time between two chunks of the same job, enforced by the scheduler.
         */
        private Duration minInterChunkDelay = Duration.ZERO;

        /**
         * Take a Bucket4j ticket per chunk from a PostgreSQL-backed bucket.
         */
        private boolean rateLimitEnabled = false;

        /**
         * Resource key of the chunk bucket in rate_limit_config.
         */
        private String rateLimitResource = "campaign_dispatch";

        public int getDefaultChunkSize() {
            return defaultChunkSize;
        }

        public void setDefaultChunkSize(int defaultChunkSize) {
            this.defaultChunkSize = defaultChunkSize;
        }

        public int getMaxChunkSize() {
            return maxChunkSize;
        }

        public void setMaxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
        }

        public Duration getMinInterChunkDelay() {
            return minInterChunkDelay;
        }

        public void setMinInterChunkDelay(Duration minInterChunkDelay) {
            this.minInterChunkDelay = minInterChunkDelay;
        }

        public boolean isRateLimitEnabled() {
            return rateLimitEnabled;
        }

        public void setRateLimitEnabled(boolean rateLimitEnabled) {
            this.rateLimitEnabled = rateLimitEnabled;
        }

        public String getRateLimitResource() {
            return rateLimitResource;
        }

        public void setRateLimitResource(String rateLimitResource) {
            this.rateLimitResource = rateLimitResource;
        }
    }

    public static class SchedulerProperties {

        /**
         * Start the dispatch scheduler when the application is ready.
         */
        private boolean autoStart = false;

        /**
         * Delay between ticks in milliseconds.
         */
        private long pollIntervalMs = 1000;

        /**
         * Maximum jobs advanced per tick.
         */
        private int jobsPerTick = 20;

        /**
         * Time between purges of expired cache entries.
         */
        private Duration janitorInterval = Duration.ofHours(1);

        /**
         * Backoff on database errors.
         */
        private ResilienceProperties resilience = new ResilienceProperties();

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getJobsPerTick() {
            return jobsPerTick;
        }

        public void setJobsPerTick(int jobsPerTick) {
            this.jobsPerTick = jobsPerTick;
        }

        public Duration getJanitorInterval() {
            return janitorInterval;
        }

        public void setJanitorInterval(Duration janitorInterval) {
            this.janitorInterval = janitorInterval;
        }

        public ResilienceProperties getResilience() {
            return resilience;
        }

        public void setResilience(ResilienceProperties resilience) {
            this.resilience = resilience;
        }
    }

    /**
     * Resilience configuration for database error recovery.
     */
    public static class ResilienceProperties {

        /**
         * Initial backoff in milliseconds after the first database error.
         */
        private long initialBackoffMs = 1000;

        /**
         * Cap on the exponential backoff in milliseconds.
         */
        private long maxBackoffMs = 30000;

        /**
         * Each consecutive error multiplies the delay by this factor.
         */
        private double backoffMultiplier = 2.0;

        /**
         * Consecutive errors before logging at ERROR instead of WARN.
         */
        private int errorThreshold = 5;

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public int getErrorThreshold() {
            return errorThreshold;
        }

        public void setErrorThreshold(int errorThreshold) {
            this.errorThreshold = errorThreshold;
        }
    }
}
