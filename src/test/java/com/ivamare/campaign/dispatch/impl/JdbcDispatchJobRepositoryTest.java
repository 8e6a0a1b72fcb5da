package com.ivamare.campaign.dispatch.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.campaign.dispatch.DispatchJob;
import com.ivamare.campaign.dispatch.DispatchPayload;
import com.ivamare.campaign.dispatch.DispatchStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcDispatchJobRepository")
class JdbcDispatchJobRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    private JdbcDispatchJobRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcDispatchJobRepository(jdbcTemplate, new ObjectMapper());
    }

    @Test
    void shouldStoreRecipientsAsJsonArray() {
        DispatchJob job = DispatchJob.create("weekly", new DispatchPayload("Hi", "Body"),
            List.of("a@x.org", "b@x.org"), 10, NOW);

        repository.save(job);

        verify(jdbcTemplate).update(contains("?::jsonb"),
            eq(job.jobId()), eq("weekly"), eq("Hi"), eq("Body"), eq("[\"a@x.org\",\"b@x.org\"]"),
            eq(10), eq(0), eq(0), eq(0), eq(0), eq("PENDING"),
            any(Timestamp.class), any(Timestamp.class), isNull(), isNull());
    }

    @Nested
    @DisplayName("advance")
    class AdvanceTests {

        @Test
        void shouldGuardOnExpectedCursorAndPreserveCancellation() {
            UUID jobId = UUID.randomUUID();
            when(jdbcTemplate.update(
                argThat((String sql) -> sql.contains("WHERE job_id = ? AND cursor_position = ?")
                    && sql.contains("CASE WHEN status = 'CANCELLED' THEN status ELSE ? END")),
                eq(10), eq(3), eq(1), eq(1), eq("RUNNING"),
                any(Timestamp.class), any(Timestamp.class), isNull(), eq(jobId), eq(5)))
                .thenReturn(1);

            assertTrue(repository.advance(jobId, 5, 10, 3, 1, 1, DispatchStatus.RUNNING, NOW));
        }

        @Test
        void shouldStampCompletionOnTerminalStatus() {
            UUID jobId = UUID.randomUUID();
            Timestamp timestamp = Timestamp.from(NOW);
            when(jdbcTemplate.update(contains("completed_at = COALESCE(completed_at, ?)"),
                eq(4), eq(4), eq(0), eq(0), eq("COMPLETED"),
                eq(timestamp), eq(timestamp), eq(timestamp), eq(jobId), eq(0)))
                .thenReturn(1);

            assertTrue(repository.advance(jobId, 0, 4, 4, 0, 0, DispatchStatus.COMPLETED, NOW));
        }

        @Test
        void shouldReportLostRace() {
            UUID jobId = UUID.randomUUID();
            when(jdbcTemplate.update(anyString(), any(), any(), any(), any(), any(), any(), any(), any(),
                any(), any())).thenReturn(0);

            assertFalse(repository.advance(jobId, 0, 4, 4, 0, 0, DispatchStatus.COMPLETED, NOW));
        }
    }

    @Test
    void shouldOnlyCancelActiveJobs() {
        UUID jobId = UUID.randomUUID();
        when(jdbcTemplate.update(contains("status IN ('PENDING', 'RUNNING')"),
            any(Timestamp.class), any(Timestamp.class), eq(jobId)))
            .thenReturn(0);

        assertFalse(repository.cancel(jobId, NOW));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldMapRowIncludingRecipientList() throws Exception {
        UUID jobId = UUID.randomUUID();
        ArgumentCaptor<RowMapper<DispatchJob>> mapperCaptor = ArgumentCaptor.forClass(RowMapper.class);
        when(jdbcTemplate.query(contains("WHERE job_id = ?"), mapperCaptor.capture(), eq(jobId)))
            .thenReturn(List.of());

        assertEquals(Optional.empty(), repository.findById(jobId));

        ResultSet rs = mock(ResultSet.class);
        when(rs.getObject("job_id", UUID.class)).thenReturn(jobId);
        when(rs.getString("label")).thenReturn(null);
        when(rs.getString("subject")).thenReturn("Hi");
        when(rs.getString("body")).thenReturn("Body");
        when(rs.getString("recipient_ids")).thenReturn("[\"a@x.org\",\"b@x.org\",\"c@x.org\"]");
        when(rs.getInt("chunk_size")).thenReturn(2);
        when(rs.getInt("cursor_position")).thenReturn(2);
        when(rs.getInt("sent_count")).thenReturn(1);
        when(rs.getInt("failed_count")).thenReturn(0);
        when(rs.getInt("skipped_count")).thenReturn(1);
        when(rs.getString("status")).thenReturn("RUNNING");
        when(rs.getTimestamp("created_at")).thenReturn(Timestamp.from(NOW));
        when(rs.getTimestamp("updated_at")).thenReturn(Timestamp.from(NOW));
        when(rs.getTimestamp("last_advanced_at")).thenReturn(Timestamp.from(NOW));
        when(rs.getTimestamp("completed_at")).thenReturn(null);

        DispatchJob job = mapperCaptor.getValue().mapRow(rs, 0);

        assertEquals(List.of("a@x.org", "b@x.org", "c@x.org"), job.recipientIds());
        assertEquals(1, job.remainingCount());
        assertEquals(DispatchStatus.RUNNING, job.status());
        assertEquals(NOW, job.lastAdvancedAt());
        assertNull(job.completedAt());
    }

    @Test
    void shouldListRunnableOldestFirst() {
        when(jdbcTemplate.query(contains("ORDER BY created_at, job_id LIMIT ?"), any(RowMapper.class), eq(5)))
            .thenReturn(List.of());

        assertTrue(repository.findRunnable(5).isEmpty());
    }

    @Test
    void shouldTreatMissingCountAsZero() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Integer.class), eq("FAILED"))).thenReturn(null);

        assertEquals(0, repository.countByStatus(DispatchStatus.FAILED));
    }
}
