package com.ivamare.campaign.dispatch.ratelimit;

import java.time.Instant;

/**
 * Chunk rate for a dispatch resource.
 *
 * @param resourceKey Rate-limited resource (e.g., "campaign_dispatch")
 * @param chunksPerSecond Maximum chunks advanced per second across all instances
 * @param description Human-readable description (nullable)
 * @param createdAt When this config was created
 * @param updatedAt When this config was last updated
 */
public record RateLimitConfig(
    String resourceKey,
    int chunksPerSecond,
    String description,
    Instant createdAt,
    Instant updatedAt
) {

    public static RateLimitConfig create(String resourceKey, int chunksPerSecond, String description, Instant now) {
        if (chunksPerSecond < 1) {
            throw new IllegalArgumentException("chunksPerSecond must be positive: " + chunksPerSecond);
        }
        return new RateLimitConfig(resourceKey, chunksPerSecond, description, now, now);
    }
}
