package com.ivamare.campaign.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * A cached value together with what is needed to validate it at read time.
 *
 * @param key Cache key
 * @param value JSON-serialized value
 * @param createdAt When the value was stored
 * @param ttl Time-to-live measured from {@code createdAt}
 * @param groupEpochs Epoch of every invalidation group the entry belongs to, as seen before
 *                    the value was computed
 */
public record CacheEntry(
    String key,
    String value,
    Instant createdAt,
    Duration ttl,
    Map<String, Long> groupEpochs
) {
    public CacheEntry {
        groupEpochs = groupEpochs != null ? Map.copyOf(groupEpochs) : Map.of();
    }

    /**
     * @return true once {@code now} is at or past {@code createdAt + ttl}
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(createdAt.plus(ttl));
    }

    /**
     * @param currentEpochs current epoch per group (groups never invalidated may be absent)
     * @return true if no group of this entry has been invalidated since the entry was computed
     */
    public boolean matchesEpochs(Map<String, Long> currentEpochs) {
        for (Map.Entry<String, Long> group : groupEpochs.entrySet()) {
            long current = currentEpochs.getOrDefault(group.getKey(), 0L);
            if (current != group.getValue()) {
                return false;
            }
        }
        return true;
    }
}
