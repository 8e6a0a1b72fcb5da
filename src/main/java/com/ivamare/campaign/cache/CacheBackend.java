package com.ivamare.campaign.cache;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Storage for cache entries and invalidation-group epochs.
 *
 * <p>Backends store and return entries as-is; TTL and epoch validation happen in
 * {@link CacheStore} at read time.
 */
public interface CacheBackend {

    /**
     * @param key cache key
     * @return the stored entry, valid or not
     */
    Optional<CacheEntry> find(String key);

    /**
     * Insert or replace an entry.
     *
     * @param entry the entry to store
     */
    void store(CacheEntry entry);

    /**
     * Remove a single entry.
     *
     * @param key cache key
     */
    void delete(String key);

    /**
     * Current epochs of the given groups. Groups that were never invalidated may be omitted
     * (their epoch is 0).
     *
     * @param groups group names
     * @return epoch per group
     */
    Map<String, Long> currentEpochs(Collection<String> groups);

    /**
     * Atomically increment a group's epoch.
     *
     * @param group group name
     * @return the new epoch
     */
    long incrementEpoch(String group);

    /**
     * Delete entries whose TTL elapsed before {@code now}.
     *
     * @param now reference time
     * @return number of entries deleted
     */
    int purgeExpired(Instant now);
}
