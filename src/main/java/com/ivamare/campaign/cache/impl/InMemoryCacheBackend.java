package com.ivamare.campaign.cache.impl;

import com.ivamare.campaign.cache.CacheBackend;
import com.ivamare.campaign.cache.CacheEntry;

import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local cache backend for single-node deployments and tests.
 */
public final class InMemoryCacheBackend implements CacheBackend {

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> epochs = new ConcurrentHashMap<>();

    @Override
    public Optional<CacheEntry> find(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void store(CacheEntry entry) {
        entries.put(entry.key(), entry);
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    @Override
    public Map<String, Long> currentEpochs(Collection<String> groups) {
        Map<String, Long> result = new HashMap<>();
        for (String group : groups) {
            Long epoch = epochs.get(group);
            if (epoch != null) {
                result.put(group, epoch);
            }
        }
        return result;
    }

    @Override
    public long incrementEpoch(String group) {
        return epochs.merge(group, 1L, Long::sum);
    }

    @Override
    public int purgeExpired(Instant now) {
        int[] purged = {0};
        entries.forEach((key, entry) -> {
            if (entry.isExpired(now) || !entry.matchesEpochs(currentEpochs(entry.groupEpochs().keySet()))) {
                if (entries.remove(key, entry)) {
                    purged[0]++;
                }
            }
        });
        return purged[0];
    }

    public int size() {
        return entries.size();
    }
}
