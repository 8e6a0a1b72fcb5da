package com.ivamare.campaign.cache.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.campaign.cache.CacheBackend;
import com.ivamare.campaign.cache.CacheEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL cache backend.
 *
 * <p>Tables: {@code campaign.cache_entry} (one row per key, group epochs as JSONB) and
 * {@code campaign.cache_group_epoch} (one row per group that has ever been invalidated).
 */
public class JdbcCacheBackend implements CacheBackend {

    private static final Logger log = LoggerFactory.getLogger(JdbcCacheBackend.class);
    private static final TypeReference<Map<String, Long>> EPOCHS_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<CacheEntry> entryMapper;

    public JdbcCacheBackend(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.entryMapper = (rs, rowNum) -> new CacheEntry(
            rs.getString("cache_key"),
            rs.getString("value"),
            rs.getTimestamp("created_at").toInstant(),
            Duration.ofMillis(rs.getLong("ttl_ms")),
            readEpochs(rs.getString("group_epochs"))
        );
    }

    @Override
    public Optional<CacheEntry> find(String key) {
        List<CacheEntry> results = jdbcTemplate.query(
            "SELECT cache_key, value, created_at, ttl_ms, group_epochs FROM campaign.cache_entry WHERE cache_key = ?",
            entryMapper,
            key
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public void store(CacheEntry entry) {
        jdbcTemplate.update("""
            INSERT INTO campaign.cache_entry (cache_key, value, created_at, ttl_ms, group_epochs)
            VALUES (?, ?, ?, ?, ?::jsonb)
            ON CONFLICT (cache_key) DO UPDATE SET
                value = EXCLUDED.value,
                created_at = EXCLUDED.created_at,
                ttl_ms = EXCLUDED.ttl_ms,
                group_epochs = EXCLUDED.group_epochs
            """,
            entry.key(),
            entry.value(),
            Timestamp.from(entry.createdAt()),
            entry.ttl().toMillis(),
            writeEpochs(entry.groupEpochs())
        );
    }

    @Override
    public void delete(String key) {
        jdbcTemplate.update("DELETE FROM campaign.cache_entry WHERE cache_key = ?", key);
    }

    @Override
    public Map<String, Long> currentEpochs(Collection<String> groups) {
        if (groups.isEmpty()) {
            return Map.of();
        }
        String placeholders = String.join(", ", Collections.nCopies(groups.size(), "?"));
        Map<String, Long> result = new HashMap<>();
        jdbcTemplate.query(
            "SELECT group_name, epoch FROM campaign.cache_group_epoch WHERE group_name IN (" + placeholders + ")",
            (RowCallbackHandler) rs -> {
                result.put(rs.getString("group_name"), rs.getLong("epoch"));
            },
            groups.toArray()
        );
        return result;
    }

    @Override
    public long incrementEpoch(String group) {
        Long epoch = jdbcTemplate.queryForObject("""
            INSERT INTO campaign.cache_group_epoch (group_name, epoch, updated_at)
            VALUES (?, 1, now())
            ON CONFLICT (group_name) DO UPDATE SET
                epoch = campaign.cache_group_epoch.epoch + 1,
                updated_at = now()
            RETURNING epoch
            """,
            Long.class,
            group
        );
        return epoch != null ? epoch : 0L;
    }

    @Override
    public int purgeExpired(Instant now) {
        return jdbcTemplate.update(
            "DELETE FROM campaign.cache_entry WHERE created_at + ttl_ms * INTERVAL '1 millisecond' <= ?",
            Timestamp.from(now)
        );
    }

    private Map<String, Long> readEpochs(String json) {
        if (json == null) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, EPOCHS_TYPE);
        } catch (JsonProcessingException e) {
            // An entry whose epochs cannot be read must never validate; a sentinel epoch ensures that
            log.warn("Unreadable group epochs on cache entry: {}", e.getOriginalMessage());
            return Map.of("__unreadable__", -1L);
        }
    }

    private String writeEpochs(Map<String, Long> epochs) {
        try {
            return objectMapper.writeValueAsString(epochs);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize group epochs", e);
        }
    }
}
