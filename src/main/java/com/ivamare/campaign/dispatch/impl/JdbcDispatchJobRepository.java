package com.ivamare.campaign.dispatch.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.campaign.dispatch.DispatchJob;
import com.ivamare.campaign.dispatch.DispatchJobRepository;
import com.ivamare.campaign.dispatch.DispatchPayload;
import com.ivamare.campaign.dispatch.DispatchStatus;
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
 * JDBC implementation of DispatchJobRepository.
 *
 * <p>The recipient list is stored once as a JSONB array; chunks are sliced from it in memory
 * using the persisted cursor.
 */
public class JdbcDispatchJobRepository implements DispatchJobRepository {

    private static final TypeReference<List<String>> RECIPIENTS_TYPE = new TypeReference<>() {};

    private static final String SELECT_COLUMNS = """
        SELECT job_id, label, subject, body, recipient_ids, chunk_size, cursor_position,
               sent_count, failed_count, skipped_count, status,
               created_at, updated_at, last_advanced_at, completed_at
        FROM campaign.dispatch_job
        """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<DispatchJob> rowMapper = this::mapRow;

    public JdbcDispatchJobRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void save(DispatchJob job) {
        String sql = """
            INSERT INTO campaign.dispatch_job
                (job_id, label, subject, body, recipient_ids, chunk_size, cursor_position,
                 sent_count, failed_count, skipped_count, status,
                 created_at, updated_at, last_advanced_at, completed_at)
            VALUES (?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        jdbcTemplate.update(sql,
            job.jobId(),
            job.label(),
            job.payload().subject(),
            job.payload().body(),
            writeRecipients(job.recipientIds()),
            job.chunkSize(),
            job.cursor(),
            job.sentCount(),
            job.failedCount(),
            job.skippedCount(),
            job.status().name(),
            Timestamp.from(job.createdAt()),
            Timestamp.from(job.updatedAt()),
            toTimestamp(job.lastAdvancedAt()),
            toTimestamp(job.completedAt())
        );
    }

    @Override
    public Optional<DispatchJob> findById(UUID jobId) {
        List<DispatchJob> results = jdbcTemplate.query(SELECT_COLUMNS + " WHERE job_id = ?", rowMapper, jobId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public boolean advance(UUID jobId, int expectedCursor, int newCursor, int sentDelta, int failedDelta,
                           int skippedDelta, DispatchStatus newStatus, Instant now) {
        String sql = """
            UPDATE campaign.dispatch_job SET
                cursor_position = ?,
                sent_count = sent_count + ?,
                failed_count = failed_count + ?,
                skipped_count = skipped_count + ?,
                status = CASE WHEN status = 'CANCELLED' THEN status ELSE ? END,
                updated_at = ?,
                last_advanced_at = ?,
                completed_at = COALESCE(completed_at, ?)
            WHERE job_id = ? AND cursor_position = ?
            """;

        Timestamp timestamp = Timestamp.from(now);
        int rows = jdbcTemplate.update(sql,
            newCursor,
            sentDelta,
            failedDelta,
            skippedDelta,
            newStatus.name(),
            timestamp,
            timestamp,
            newStatus.isTerminal() ? timestamp : null,
            jobId,
            expectedCursor
        );
        return rows > 0;
    }

    @Override
    public boolean cancel(UUID jobId, Instant now) {
        Timestamp timestamp = Timestamp.from(now);
        int rows = jdbcTemplate.update("""
            UPDATE campaign.dispatch_job
            SET status = 'CANCELLED', updated_at = ?, completed_at = ?
            WHERE job_id = ? AND status IN ('PENDING', 'RUNNING')
            """,
            timestamp, timestamp, jobId);
        return rows > 0;
    }

    @Override
    public List<DispatchJob> findRunnable(int limit) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE status IN ('PENDING', 'RUNNING') ORDER BY created_at, job_id LIMIT ?",
            rowMapper,
            limit
        );
    }

    @Override
    public List<DispatchJob> list(DispatchStatus status, int limit) {
        if (status == null) {
            return jdbcTemplate.query(SELECT_COLUMNS + " ORDER BY created_at DESC LIMIT ?", rowMapper, limit);
        }
        return jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE status = ? ORDER BY created_at DESC LIMIT ?",
            rowMapper,
            status.name(),
            limit
        );
    }

    @Override
    public int countByStatus(DispatchStatus status) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM campaign.dispatch_job WHERE status = ?",
            Integer.class,
            status.name()
        );
        return count != null ? count : 0;
    }

    private DispatchJob mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new DispatchJob(
            rs.getObject("job_id", UUID.class),
            rs.getString("label"),
            new DispatchPayload(rs.getString("subject"), rs.getString("body")),
            readRecipients(rs.getString("recipient_ids")),
            rs.getInt("chunk_size"),
            rs.getInt("cursor_position"),
            rs.getInt("sent_count"),
            rs.getInt("failed_count"),
            rs.getInt("skipped_count"),
            DispatchStatus.fromValue(rs.getString("status")),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant(),
            toInstant(rs.getTimestamp("last_advanced_at")),
            toInstant(rs.getTimestamp("completed_at"))
        );
    }

    private List<String> readRecipients(String json) {
        try {
            return objectMapper.readValue(json, RECIPIENTS_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable recipient_ids column: " + e.getOriginalMessage(), e);
        }
    }

    private String writeRecipients(List<String> recipientIds) {
        try {
            return objectMapper.writeValueAsString(recipientIds);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize recipient list", e);
        }
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
