package com.ivamare.campaign.dispatch;

import com.ivamare.campaign.CampaignProperties.ResilienceProperties;
import com.ivamare.campaign.cache.CacheStore;
import com.ivamare.campaign.dispatch.ratelimit.DispatchRateLimiter;
import com.ivamare.campaign.exception.InvalidOperationException;
import com.ivamare.campaign.splittest.SplitTestEngine;
import com.ivamare.campaign.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("DispatchScheduler")
class DispatchSchedulerTest {

    @Mock
    private BatchDispatcher dispatcher;

    @Mock
    private SplitTestEngine splitTestEngine;

    @Mock
    private CacheStore cacheStore;

    @Mock
    private DispatchRateLimiter rateLimiter;

    private MutableClock clock;
    private ResilienceProperties resilience;
    private DispatchScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-06-01T12:00:00Z");
        resilience = new ResilienceProperties();
        resilience.setInitialBackoffMs(1);
        resilience.setMaxBackoffMs(5);
        resilience.setErrorThreshold(3);
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    private DispatchScheduler scheduler(Duration minInterChunkDelay, DispatchRateLimiter limiter,
                                        SplitTestEngine engine, CacheStore cache) {
        return new DispatchScheduler(dispatcher, engine, cache, limiter, "campaign_dispatch", clock,
            20, 50, minInterChunkDelay, Duration.ofHours(1), resilience);
    }

    private DispatchJob runningJob(Instant lastAdvancedAt) {
        Instant created = Instant.parse("2024-06-01T11:00:00Z");
        return new DispatchJob(UUID.randomUUID(), null, new DispatchPayload("s", "b"), List.of("a@x.org", "b@x.org"),
            1, 0, 0, 0, 0, DispatchStatus.RUNNING, created, created, lastAdvancedAt, null);
    }

    private static AdvanceResult progress(DispatchJob job) {
        return new AdvanceResult(job.jobId(), 1, 0, 0, 1, 2, DispatchStatus.RUNNING, false);
    }

    @Nested
    @DisplayName("tick")
    class TickTests {

        @Test
        void shouldAdvanceEveryRunnableJobOnce() {
            DispatchJob first = runningJob(null);
            DispatchJob second = runningJob(null);
            when(dispatcher.findRunnable(20)).thenReturn(List.of(first, second));
            when(dispatcher.advance(first.jobId())).thenReturn(progress(first));
            when(dispatcher.advance(second.jobId())).thenReturn(progress(second));
            scheduler = scheduler(Duration.ZERO, null, null, null);

            assertEquals(2, scheduler.tick());

            assertEquals(2, scheduler.getChunksAdvanced());
            assertEquals(clock.instant(), scheduler.getLastTickAt());
        }

        @Test
        @DisplayName("should wait out the minimum delay between chunks of a job")
        void shouldHonorMinimumInterChunkDelay() {
            DispatchJob job = runningJob(clock.instant().minusSeconds(2));
            when(dispatcher.findRunnable(20)).thenReturn(List.of(job));
            scheduler = scheduler(Duration.ofSeconds(5), null, null, null);

            assertEquals(0, scheduler.tick());
            verify(dispatcher, never()).advance(job.jobId());

            clock.advance(Duration.ofSeconds(3));
            when(dispatcher.advance(job.jobId())).thenReturn(progress(job));

            assertEquals(1, scheduler.tick());
        }

        @Test
        @DisplayName("should stop advancing for the tick once the rate limit is reached")
        void shouldStopWhenRateLimited() {
            DispatchJob first = runningJob(null);
            DispatchJob second = runningJob(null);
            when(dispatcher.findRunnable(20)).thenReturn(List.of(first, second));
            when(rateLimiter.tryAcquire("campaign_dispatch")).thenReturn(true, false);
            when(dispatcher.advance(first.jobId())).thenReturn(progress(first));
            scheduler = scheduler(Duration.ZERO, rateLimiter, null, null);

            assertEquals(1, scheduler.tick());

            verify(dispatcher, never()).advance(second.jobId());
        }

        @Test
        void shouldKeepGoingWhenOneJobFails() {
            DispatchJob broken = runningJob(null);
            DispatchJob healthy = runningJob(null);
            when(dispatcher.findRunnable(20)).thenReturn(List.of(broken, healthy));
            when(dispatcher.advance(broken.jobId()))
                .thenThrow(new InvalidOperationException("cursor moved concurrently"));
            when(dispatcher.advance(healthy.jobId())).thenReturn(progress(healthy));
            scheduler = scheduler(Duration.ZERO, null, null, null);

            assertEquals(1, scheduler.tick());
            assertEquals(0, scheduler.getConsecutiveErrorCount());
        }

        @Test
        void shouldCountConsecutiveDatabaseErrors() {
            when(dispatcher.findRunnable(20)).thenThrow(new DataAccessResourceFailureException("connection refused"));
            scheduler = scheduler(Duration.ZERO, null, null, null);

            scheduler.tick();
            scheduler.tick();

            assertEquals(2, scheduler.getConsecutiveErrorCount());
        }

        @Test
        void shouldReconcileDecidedSplitTests() {
            when(dispatcher.findRunnable(20)).thenReturn(List.of());
            when(splitTestEngine.reconcileDecided(20)).thenReturn(1);
            scheduler = scheduler(Duration.ZERO, null, splitTestEngine, null);

            scheduler.tick();

            verify(splitTestEngine).reconcileDecided(20);
        }

        @Test
        @DisplayName("should purge the cache at most once per janitor interval")
        void shouldPurgeCacheOncePerInterval() {
            when(dispatcher.findRunnable(20)).thenReturn(List.of());
            scheduler = scheduler(Duration.ZERO, null, null, cacheStore);

            scheduler.tick();
            clock.advance(Duration.ofMinutes(30));
            scheduler.tick();
            verify(cacheStore, times(1)).purgeExpired();

            clock.advance(Duration.ofMinutes(30));
            scheduler.tick();
            verify(cacheStore, times(2)).purgeExpired();
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class LifecycleTests {

        @Test
        void shouldStartAndStop() {
            scheduler = scheduler(Duration.ZERO, null, null, null);

            scheduler.start();
            assertTrue(scheduler.isRunning());
            scheduler.start();

            scheduler.stop();
            assertFalse(scheduler.isRunning());
        }
    }

    @Nested
    @DisplayName("calculateBackoff")
    class BackoffTests {

        @Test
        void shouldGrowExponentiallyUpToMaximum() {
            resilience.setInitialBackoffMs(100);
            resilience.setMaxBackoffMs(1000);
            resilience.setBackoffMultiplier(2.0);
            scheduler = scheduler(Duration.ZERO, null, null, null);

            long first = scheduler.calculateBackoff(1);
            long third = scheduler.calculateBackoff(3);

            assertTrue(first >= 90 && first <= 110, "first=" + first);
            assertTrue(third >= 360 && third <= 440, "third=" + third);
            assertEquals(1000, scheduler.calculateBackoff(10));
            assertEquals(100, scheduler.calculateBackoff(0));
        }
    }
}
