package com.ivamare.campaign.dispatch.ratelimit;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.BucketConfiguration;
import io.github.bucket4j.distributed.BucketProxy;
import io.github.bucket4j.distributed.jdbc.PrimaryKeyMapper;
import io.github.bucket4j.postgresql.Bucket4jPostgreSQL;
import io.github.bucket4j.postgresql.PostgreSQLadvisoryLockBasedProxyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Distributed chunk rate limiter using Bucket4j with a PostgreSQL backend.
 *
 * <p>Buckets are shared by all instances through advisory locks, so the configured rate holds
 * for the whole deployment rather than per scheduler.
 */
public class Bucket4jDispatchRateLimiter implements DispatchRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(Bucket4jDispatchRateLimiter.class);

    /** Chunks per second when a resource has no row in rate_limit_config */
    public static final int DEFAULT_CHUNKS_PER_SECOND = 5;

    private final PostgreSQLadvisoryLockBasedProxyManager<String> proxyManager;
    private final RateLimitConfigRepository configRepository;
    private final ConcurrentHashMap<String, BucketConfiguration> configCache = new ConcurrentHashMap<>();

    public Bucket4jDispatchRateLimiter(DataSource dataSource, RateLimitConfigRepository configRepository) {
        this.configRepository = configRepository;
        this.proxyManager = Bucket4jPostgreSQL
            .advisoryLockBasedBuilder(dataSource)
            .primaryKeyMapper(PrimaryKeyMapper.STRING)
            .build();
    }

    @Override
    public boolean tryAcquire(String resourceKey) {
        BucketConfiguration config = configCache.computeIfAbsent(resourceKey, this::loadConfig);
        BucketProxy bucket = proxyManager.getProxy(resourceKey, () -> config);
        return bucket.tryConsume(1);
    }

    @Override
    public void refreshConfig(String resourceKey) {
        configCache.remove(resourceKey);
        log.debug("Refreshed rate limit config for resource: {}", resourceKey);
    }

    private BucketConfiguration loadConfig(String resourceKey) {
        int chunksPerSecond = configRepository.findByResourceKey(resourceKey)
            .map(RateLimitConfig::chunksPerSecond)
            .orElseGet(() -> {
                log.debug("No rate limit config for {}, using default: {}/sec",
                    resourceKey, DEFAULT_CHUNKS_PER_SECOND);
                return DEFAULT_CHUNKS_PER_SECOND;
            });

        return BucketConfiguration.builder()
            .addLimit(Bandwidth.builder()
                .capacity(chunksPerSecond)
                .refillGreedy(chunksPerSecond, Duration.ofSeconds(1))
                .build())
            .build();
    }
}
