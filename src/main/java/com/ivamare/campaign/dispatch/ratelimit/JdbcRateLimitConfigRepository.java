package com.ivamare.campaign.dispatch.ratelimit;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of RateLimitConfigRepository.
 */
public class JdbcRateLimitConfigRepository implements RateLimitConfigRepository {

    private static final RowMapper<RateLimitConfig> ROW_MAPPER = (rs, rowNum) -> new RateLimitConfig(
        rs.getString("resource_key"),
        rs.getInt("chunks_per_second"),
        rs.getString("description"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("updated_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcRateLimitConfigRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void save(RateLimitConfig config) {
        jdbcTemplate.update("""
            INSERT INTO campaign.rate_limit_config
                (resource_key, chunks_per_second, description, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?)
            ON CONFLICT (resource_key) DO UPDATE SET
                chunks_per_second = EXCLUDED.chunks_per_second,
                description = EXCLUDED.description,
                updated_at = EXCLUDED.updated_at
            """,
            config.resourceKey(),
            config.chunksPerSecond(),
            config.description(),
            Timestamp.from(config.createdAt()),
            Timestamp.from(config.updatedAt())
        );
    }

    @Override
    public Optional<RateLimitConfig> findByResourceKey(String resourceKey) {
        List<RateLimitConfig> results = jdbcTemplate.query("""
            SELECT resource_key, chunks_per_second, description, created_at, updated_at
            FROM campaign.rate_limit_config
            WHERE resource_key = ?
            """,
            ROW_MAPPER,
            resourceKey
        );
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }
}
