package com.ivamare.campaign.dispatch;

import com.ivamare.campaign.CampaignProperties.ResilienceProperties;
import com.ivamare.campaign.cache.CacheStore;
import com.ivamare.campaign.dispatch.ratelimit.DispatchRateLimiter;
import com.ivamare.campaign.exception.CampaignException;
import com.ivamare.campaign.exception.DatabaseExceptionClassifier;
import com.ivamare.campaign.splittest.SplitTestEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background driver for dispatch jobs.
 *
 * <p>Each {@link #tick()}:
 * <ul>
 *   <li>advances every runnable job by one chunk, honoring the minimum inter-chunk delay
 *       and the optional distributed rate limit</li>
 *   <li>completes decided split tests whose remainder job has finished</li>
 *   <li>purges expired cache entries once per janitor interval</li>
 * </ul>
 *
 * <p>Transient database errors back off exponentially; a failing job never stops the others.
 * {@link #tick()} may also be called directly by applications with their own scheduling.
 */
public class DispatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(DispatchScheduler.class);

    private final BatchDispatcher dispatcher;
    private final SplitTestEngine splitTestEngine;
    private final CacheStore cacheStore;
    private final DispatchRateLimiter rateLimiter;
    private final String rateLimitResource;
    private final Clock clock;
    private final int jobsPerTick;
    private final long pollIntervalMs;
    private final Duration minInterChunkDelay;
    private final Duration janitorInterval;

    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final double backoffMultiplier;
    private final int errorThreshold;
    private final AtomicInteger consecutiveErrors = new AtomicInteger(0);
    private final AtomicLong chunksAdvanced = new AtomicLong(0);

    private volatile Instant lastJanitorRun;
    private volatile Instant lastTickAt;
    private volatile boolean running = false;
    private ScheduledExecutorService executor;

    /**
     * @param dispatcher dispatcher to advance
     * @param splitTestEngine engine to reconcile (nullable)
     * @param cacheStore cache to purge (nullable)
     * @param rateLimiter chunk rate limiter (nullable for no limit)
     * @param rateLimitResource resource key passed to the rate limiter
     * @param clock time source
     * @param jobsPerTick maximum jobs advanced per tick
     * @param pollIntervalMs delay between ticks when started
     * @param minInterChunkDelay minimum time between two chunks of the same job
     * @param janitorInterval time between cache purges
     * @param resilience backoff settings for database errors
     */
    public DispatchScheduler(BatchDispatcher dispatcher, SplitTestEngine splitTestEngine, CacheStore cacheStore,
                             DispatchRateLimiter rateLimiter, String rateLimitResource, Clock clock,
                             int jobsPerTick, long pollIntervalMs, Duration minInterChunkDelay,
                             Duration janitorInterval, ResilienceProperties resilience) {
        this.dispatcher = dispatcher;
        this.splitTestEngine = splitTestEngine;
        this.cacheStore = cacheStore;
        this.rateLimiter = rateLimiter;
        this.rateLimitResource = rateLimitResource;
        this.clock = clock;
        this.jobsPerTick = jobsPerTick;
        this.pollIntervalMs = pollIntervalMs;
        this.minInterChunkDelay = minInterChunkDelay;
        this.janitorInterval = janitorInterval;
        this.initialBackoffMs = resilience.getInitialBackoffMs();
        this.maxBackoffMs = resilience.getMaxBackoffMs();
        this.backoffMultiplier = resilience.getBackoffMultiplier();
        this.errorThreshold = resilience.getErrorThreshold();
    }

    /**
     * Start ticking every poll interval on a single background thread.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "campaign-dispatch-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::safeTick, 0, pollIntervalMs, TimeUnit.MILLISECONDS);
        log.info("DispatchScheduler started (pollIntervalMs={}, jobsPerTick={})", pollIntervalMs, jobsPerTick);
    }

    /**
     * Stop the scheduler, letting a chunk in flight complete.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("DispatchScheduler stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run one scheduling pass.
     *
     * @return number of chunks advanced
     */
    public int tick() {
        lastTickAt = clock.instant();
        int advanced = advanceRunnableJobs();
        reconcileSplitTests();
        runJanitor();
        return advanced;
    }

    public int getConsecutiveErrorCount() {
        return consecutiveErrors.get();
    }

    public long getChunksAdvanced() {
        return chunksAdvanced.get();
    }

    public Instant getLastTickAt() {
        return lastTickAt;
    }

    // ========== Internal Methods ==========

    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("DispatchScheduler tick failed: {}", e.getMessage(), e);
        }
    }

    private int advanceRunnableJobs() {
        List<DispatchJob> runnable;
        try {
            runnable = dispatcher.findRunnable(jobsPerTick);
            consecutiveErrors.set(0);
        } catch (RuntimeException e) {
            handleError("findRunnable", e);
            return 0;
        }

        int advanced = 0;
        for (DispatchJob job : runnable) {
            if (!dueForChunk(job)) {
                log.trace("Dispatch job {} not due yet", job.jobId());
                continue;
            }
            if (rateLimiter != null && !rateLimiter.tryAcquire(rateLimitResource)) {
                log.debug("Rate limit reached for {}, deferring remaining jobs", rateLimitResource);
                break;
            }
            try {
                AdvanceResult result = dispatcher.advance(job.jobId());
                advanced++;
                chunksAdvanced.incrementAndGet();
                consecutiveErrors.set(0);
                log.trace("Advanced job {}: cursor {}/{}", job.jobId(), result.cursor(), result.total());
            } catch (CampaignException e) {
                if (DatabaseExceptionClassifier.isTransient(e)) {
                    handleError("advance", e);
                    break;
                }
                log.error("Failed to advance dispatch job {} ({}): {}", job.jobId(), e.kind(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to advance dispatch job {}: {}", job.jobId(), e.getMessage(), e);
            }
        }
        return advanced;
    }

    private boolean dueForChunk(DispatchJob job) {
        if (minInterChunkDelay.isZero() || job.lastAdvancedAt() == null) {
            return true;
        }
        return !clock.instant().isBefore(job.lastAdvancedAt().plus(minInterChunkDelay));
    }

    private void reconcileSplitTests() {
        if (splitTestEngine == null) {
            return;
        }
        try {
            int completed = splitTestEngine.reconcileDecided(jobsPerTick);
            if (completed > 0) {
                log.debug("Completed {} split tests", completed);
            }
        } catch (RuntimeException e) {
            handleError("reconcileSplitTests", e);
        }
    }

    private void runJanitor() {
        if (cacheStore == null) {
            return;
        }
        Instant now = clock.instant();
        if (lastJanitorRun != null && now.isBefore(lastJanitorRun.plus(janitorInterval))) {
            return;
        }
        lastJanitorRun = now;
        try {
            cacheStore.purgeExpired();
        } catch (RuntimeException e) {
            handleError("purgeExpired", e);
        }
    }

    /**
     * Handle errors with exponential backoff for transient database errors.
     */
    private void handleError(String operation, RuntimeException e) {
        int errors = consecutiveErrors.incrementAndGet();

        var reason = DatabaseExceptionClassifier.transientReason(e);
        if (reason.isPresent()) {
            long backoff = calculateBackoff(errors);
            if (errors >= errorThreshold) {
                log.error("DispatchScheduler {} database error (count={}, reason={}), backing off {}ms: {}",
                    operation, errors, reason.get(), backoff, e.getMessage());
            } else {
                log.warn("DispatchScheduler {} database error (count={}, reason={}), backing off {}ms: {}",
                    operation, errors, reason.get(), backoff, e.getMessage());
            }
            sleep(backoff);
        } else {
            log.error("DispatchScheduler {} non-transient error: {}", operation, e.getMessage());
        }
    }

    /**
     * Exponential backoff with +/- 10% jitter.
     */
    long calculateBackoff(int errorCount) {
        if (errorCount <= 0) {
            return initialBackoffMs;
        }
        double delay = initialBackoffMs * Math.pow(backoffMultiplier, errorCount - 1);
        double jitter = delay * 0.1 * (Math.random() * 2 - 1);
        return Math.min((long) (delay + jitter), maxBackoffMs);
    }

    private void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
