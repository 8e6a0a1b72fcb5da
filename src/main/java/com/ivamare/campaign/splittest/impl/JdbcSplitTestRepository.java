package com.ivamare.campaign.splittest.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.campaign.dispatch.DispatchPayload;
import com.ivamare.campaign.splittest.EngagementMetric;
import com.ivamare.campaign.splittest.SplitTest;
import com.ivamare.campaign.splittest.SplitTestOutcome;
import com.ivamare.campaign.splittest.SplitTestRepository;
import com.ivamare.campaign.splittest.Variant;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of SplitTestRepository. Variants and the remainder list are JSONB.
 */
public class JdbcSplitTestRepository implements SplitTestRepository {

    private static final TypeReference<List<String>> RECIPIENTS_TYPE = new TypeReference<>() {};

    private static final String SELECT_COLUMNS = """
        SELECT test_id, name, variant_a, variant_b, sample_fraction, metric, segment, chunk_size,
               sample_a_job_id, sample_b_job_id, remainder_recipients, outcome, winner,
               score_a, score_b, remainder_job_id, created_at, decided_at, completed_at
        FROM campaign.split_test
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<SplitTest> rowMapper = this::mapRow;

    public JdbcSplitTestRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(SplitTest test) {
        String sql = """
            INSERT INTO campaign.split_test
                (test_id, name, variant_a, variant_b, sample_fraction, metric, segment, chunk_size,
                 sample_a_job_id, sample_b_job_id, remainder_recipients, outcome, winner,
                 score_a, score_b, remainder_job_id, created_at, decided_at, completed_at)
            VALUES (?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            test.testId(),
            test.name(),
            toJson(test.variantA()),
            toJson(test.variantB()),
            test.sampleFraction(),
            test.metric().name(),
            test.segment(),
            test.chunkSize(),
            test.sampleAJobId(),
            test.sampleBJobId(),
            toJson(test.remainderRecipients()),
            test.outcome().name(),
            test.winner() != null ? test.winner().name() : null,
            test.scoreA(),
            test.scoreB(),
            test.remainderJobId(),
            Timestamp.from(test.createdAt()),
            toTimestamp(test.decidedAt()),
            toTimestamp(test.completedAt())
        );
    }

    @Override
    public Optional<SplitTest> findById(UUID testId) {
        List<SplitTest> results = jdbcTemplate.query(SELECT_COLUMNS + " WHERE test_id = ?", rowMapper, testId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public boolean markDecided(UUID testId, Variant winner, double scoreA, double scoreB, UUID remainderJobId,
                               Instant now) {
        int rows = jdbcTemplate.update("""
            UPDATE campaign.split_test
            SET outcome = 'DECIDED', winner = ?, score_a = ?, score_b = ?, remainder_job_id = ?, decided_at = ?
            WHERE test_id = ? AND outcome = 'SAMPLING'
            """,
            winner.name(), scoreA, scoreB, remainderJobId, Timestamp.from(now), testId);
        return rows > 0;
    }

    @Override
    public boolean markCompleted(UUID testId, Instant now) {
        int rows = jdbcTemplate.update("""
            UPDATE campaign.split_test
            SET outcome = 'COMPLETED', completed_at = ?
            WHERE test_id = ? AND outcome = 'DECIDED'
            """,
            Timestamp.from(now), testId);
        return rows > 0;
    }

    @Override
    public List<SplitTest> findByOutcome(SplitTestOutcome outcome, int limit) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE outcome = ? ORDER BY created_at LIMIT ?",
            rowMapper,
            outcome.name(),
            limit
        );
    }

    private SplitTest mapRow(ResultSet rs, int rowNum) throws SQLException {
        String winner = rs.getString("winner");
        return new SplitTest(
            rs.getObject("test_id", UUID.class),
            rs.getString("name"),
            fromJson(rs.getString("variant_a")),
            fromJson(rs.getString("variant_b")),
            rs.getDouble("sample_fraction"),
            EngagementMetric.fromValue(rs.getString("metric")),
            rs.getString("segment"),
            rs.getInt("chunk_size"),
            rs.getObject("sample_a_job_id", UUID.class),
            rs.getObject("sample_b_job_id", UUID.class),
            readRecipients(rs.getString("remainder_recipients")),
            SplitTestOutcome.fromValue(rs.getString("outcome")),
            winner != null ? Variant.valueOf(winner) : null,
            rs.getObject("score_a", Double.class),
            rs.getObject("score_b", Double.class),
            rs.getObject("remainder_job_id", UUID.class),
            rs.getTimestamp("created_at").toInstant(),
            toInstant(rs.getTimestamp("decided_at")),
            toInstant(rs.getTimestamp("completed_at"))
        );
    }

    private DispatchPayload fromJson(String json) {
        try {
            return objectMapper.readValue(json, DispatchPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable variant column: " + e.getOriginalMessage(), e);
        }
    }

    private List<String> readRecipients(String json) {
        try {
            return objectMapper.readValue(json, RECIPIENTS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable remainder_recipients column: " + e.getOriginalMessage(), e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize split test column", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
