package com.ivamare.campaign.dispatch.ratelimit;

import java.util.Optional;

/**
 * Repository for dispatch rate limit configurations.
 */
public interface RateLimitConfigRepository {

    /**
     * Insert or replace the configuration of a resource.
     */
    void save(RateLimitConfig config);

    Optional<RateLimitConfig> findByResourceKey(String resourceKey);
}
