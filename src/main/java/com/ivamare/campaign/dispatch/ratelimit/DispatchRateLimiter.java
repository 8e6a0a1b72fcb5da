package com.ivamare.campaign.dispatch.ratelimit;

/**
 * Grants permission to advance one chunk.
 */
public interface DispatchRateLimiter {

    /**
     * Try to take a ticket without waiting.
     *
     * @param resourceKey the rate-limited resource
     * @return true if the chunk may be advanced now
     */
    boolean tryAcquire(String resourceKey);

    /**
     * Drop any cached configuration for a resource so the next acquire reloads it.
     */
    void refreshConfig(String resourceKey);
}
