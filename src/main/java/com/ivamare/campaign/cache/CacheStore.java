package com.ivamare.campaign.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.campaign.exception.InvalidOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Read-through cache with TTL and group-scoped invalidation.
 *
 * <p>Every entry records the epoch of each of its invalidation groups as they were before its
 * value was computed. {@link #invalidateGroup(String)} bumps a group's epoch, which makes all
 * entries of that group stale in O(1); staleness and TTL are both checked on read, so no
 * background sweep is needed for correctness.
 *
 * <p>{@link #getOrCompute} runs at most one compute per key at a time in this process.
 * Concurrent missers wait for the running compute and receive its value, unless the running
 * compute started before an invalidation they have already observed, in which case they wait
 * for it to finish and compute again.
 *
 * <p>Backend failures never fail a read: they are logged and the value is computed fresh.
 */
public class CacheStore {

    private static final Logger log = LoggerFactory.getLogger(CacheStore.class);

    private final CacheBackend backend;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration defaultTtl;

    private final ConcurrentHashMap<String, InFlight> computations = new ConcurrentHashMap<>();

    public CacheStore(CacheBackend backend, ObjectMapper objectMapper, Clock clock, Duration defaultTtl) {
        this.backend = backend;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultTtl = defaultTtl;
    }

    // --- Plain get / set ---

    /**
     * @param key cache key
     * @param type value type
     * @return the value, or empty on miss, expiry, group invalidation or backend failure
     */
    public <T> Optional<T> get(String key, Class<T> type) {
        return read(key, objectMapper.constructType(type));
    }

    public <T> Optional<T> get(String key, TypeReference<T> type) {
        return read(key, objectMapper.getTypeFactory().constructType(type));
    }

    /**
     * Store a value under the current epochs of its groups.
     *
     * @param key cache key
     * @param value value to store (serialized with Jackson)
     * @param ttl time-to-live, or null for the default
     * @param groups invalidation groups the value depends on
     */
    public void set(String key, Object value, Duration ttl, Set<String> groups) {
        Duration effectiveTtl = resolveTtl(ttl);
        Map<String, Long> epochs = snapshotEpochs(groups);
        if (epochs != null) {
            write(key, value, effectiveTtl, epochs);
        }
    }

    // --- Read-through ---

    public <T> T getOrCompute(String key, Class<T> type, Duration ttl, Set<String> groups, Supplier<T> compute) {
        return getOrCompute(key, objectMapper.constructType(type), ttl, groups, compute);
    }

    public <T> T getOrCompute(String key, TypeReference<T> type, Duration ttl, Set<String> groups,
                              Supplier<T> compute) {
        return getOrCompute(key, objectMapper.getTypeFactory().constructType(type), ttl, groups, compute);
    }

    private <T> T getOrCompute(String key, JavaType type, Duration ttl, Set<String> groups, Supplier<T> compute) {
        Duration effectiveTtl = resolveTtl(ttl);
        while (true) {
            Optional<T> cached = read(key, type);
            if (cached.isPresent()) {
                return cached.get();
            }

            Map<String, Long> epochs = snapshotEpochs(groups);
            if (epochs == null) {
                // Epochs unknown: the value cannot be tagged safely, so it is neither shared nor stored
                return compute.get();
            }

            InFlight mine = new InFlight(new CompletableFuture<>(), epochs);
            InFlight running = computations.putIfAbsent(key, mine);
            if (running == null) {
                return computeAndPublish(key, type, effectiveTtl, compute, mine);
            }
            if (running.epochs().equals(epochs)) {
                log.debug("Joining in-flight compute for cache key {}", key);
                return await(running);
            }
            awaitQuietly(running);
        }
    }

    private <T> T computeAndPublish(String key, JavaType type, Duration ttl, Supplier<T> compute, InFlight mine) {
        try {
            Optional<T> raced = read(key, type);
            if (raced.isPresent()) {
                mine.future().complete(raced.get());
                return raced.get();
            }
            log.debug("Cache miss for key {}, computing", key);
            T value = compute.get();
            if (value != null) {
                write(key, value, ttl, mine.epochs());
            }
            mine.future().complete(value);
            return value;
        } catch (RuntimeException | Error e) {
            mine.future().completeExceptionally(e);
            throw e;
        } finally {
            computations.remove(key, mine);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T await(InFlight running) {
        try {
            return (T) running.future().join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }

    private static void awaitQuietly(InFlight running) {
        // The outcome belongs to the compute's own caller; this waiter only needs it to be done
        running.future().handle((value, error) -> null).join();
    }

    // --- Invalidation ---

    /**
     * Logically remove every entry of a group. Readers that start after this returns never see
     * a value computed before it.
     *
     * @param group group name
     * @return the group's new epoch
     */
    public long invalidateGroup(String group) {
        long epoch = backend.incrementEpoch(group);
        log.debug("Invalidated cache group {} (epoch={})", group, epoch);
        return epoch;
    }

    /**
     * Remove a single key synchronously.
     *
     * @param key cache key
     */
    public void evict(String key) {
        backend.delete(key);
        log.debug("Evicted cache key {}", key);
    }

    /**
     * Delete expired entries. Purely an optimization: reads validate TTL themselves.
     *
     * @return number of entries deleted
     */
    public int purgeExpired() {
        int purged = backend.purgeExpired(clock.instant());
        if (purged > 0) {
            log.info("Purged {} expired cache entries", purged);
        }
        return purged;
    }

    // --- Internals ---

    private <T> Optional<T> read(String key, JavaType type) {
        Optional<CacheEntry> found;
        Map<String, Long> current;
        try {
            found = backend.find(key);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            CacheEntry entry = found.get();
            if (entry.isExpired(clock.instant())) {
                log.debug("Cache entry {} expired", key);
                return Optional.empty();
            }
            current = entry.groupEpochs().isEmpty()
                ? Map.of()
                : backend.currentEpochs(entry.groupEpochs().keySet());
        } catch (RuntimeException e) {
            log.warn("Cache read failed for key {}, computing fresh: {}", key, e.getMessage());
            return Optional.empty();
        }

        CacheEntry entry = found.get();
        if (!entry.matchesEpochs(current)) {
            log.debug("Cache entry {} belongs to an invalidated group", key);
            return Optional.empty();
        }
        try {
            T value = objectMapper.readValue(entry.value(), type);
            log.debug("Cache hit for key {}", key);
            return Optional.ofNullable(value);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private Duration resolveTtl(Duration ttl) {
        Duration effectiveTtl = ttl != null ? ttl : defaultTtl;
        if (effectiveTtl.isZero() || effectiveTtl.isNegative()) {
            throw new InvalidOperationException("Cache TTL must be positive: " + effectiveTtl);
        }
        return effectiveTtl;
    }

    private void write(String key, Object value, Duration ttl, Map<String, Long> epochs) {
        try {
            String json = objectMapper.writeValueAsString(value);
            backend.store(new CacheEntry(key, json, clock.instant(), ttl, epochs));
        } catch (JsonProcessingException e) {
            log.warn("Value for cache key {} is not serializable, not caching: {}", key, e.getOriginalMessage());
        } catch (RuntimeException e) {
            log.warn("Cache write failed for key {}: {}", key, e.getMessage());
        }
    }

    private Map<String, Long> snapshotEpochs(Set<String> groups) {
        if (groups == null || groups.isEmpty()) {
            return Map.of();
        }
        try {
            Map<String, Long> current = backend.currentEpochs(groups);
            Map<String, Long> snapshot = new HashMap<>();
            for (String group : groups) {
                snapshot.put(group, current.getOrDefault(group, 0L));
            }
            return Map.copyOf(snapshot);
        } catch (RuntimeException e) {
            log.warn("Could not read epochs for groups {}: {}", groups, e.getMessage());
            return null;
        }
    }

    int inFlightCount() {
        return computations.size();
    }

    private record InFlight(CompletableFuture<Object> future, Map<String, Long> epochs) {
        InFlight {
            Objects.requireNonNull(epochs);
        }
    }
}
