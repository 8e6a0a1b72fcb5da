package com.ivamare.campaign.splittest.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.campaign.dispatch.DispatchPayload;
import com.ivamare.campaign.splittest.EngagementMetric;
import com.ivamare.campaign.splittest.SplitTest;
import com.ivamare.campaign.splittest.SplitTestOutcome;
import com.ivamare.campaign.splittest.Variant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JdbcSplitTestRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock(strictness = Mock.Strictness.LENIENT)
    private ResultSet rs;

    private JdbcSplitTestRepository repository;

    @BeforeEach
    void setUp() {
        repository = new JdbcSplitTestRepository(jdbcTemplate, new ObjectMapper());
    }

    @Test
    void shouldDecideOnlyWhileSampling() {
        UUID testId = UUID.randomUUID();
        UUID remainderJobId = UUID.randomUUID();
        when(jdbcTemplate.update(contains("WHERE test_id = ? AND outcome = 'SAMPLING'"),
            eq("B"), eq(0.1), eq(0.4), eq(remainderJobId), any(Timestamp.class), eq(testId)))
            .thenReturn(0);

        assertFalse(repository.markDecided(testId, Variant.B, 0.1, 0.4, remainderJobId, NOW));
    }

    @Test
    void shouldCompleteOnlyDecidedTests() {
        UUID testId = UUID.randomUUID();
        when(jdbcTemplate.update(contains("WHERE test_id = ? AND outcome = 'DECIDED'"),
            any(Timestamp.class), eq(testId)))
            .thenReturn(1);

        assertTrue(repository.markCompleted(testId, NOW));
    }

    @Test
    void shouldReadVariantsAndRemainderFromJson() throws Exception {
        UUID testId = UUID.randomUUID();
        when(jdbcTemplate.query(contains("WHERE test_id = ?"), any(RowMapper.class), eq(testId)))
            .thenAnswer(invocation -> {
                RowMapper<SplitTest> mapper = invocation.getArgument(1);
                return List.of(mapper.mapRow(rs, 0));
            });
        when(rs.getObject("test_id", UUID.class)).thenReturn(testId);
        when(rs.getString("name")).thenReturn("gotv");
        when(rs.getString("variant_a")).thenReturn("{\"subject\":\"A\",\"body\":\"a\"}");
        when(rs.getString("variant_b")).thenReturn("{\"subject\":\"B\",\"body\":\"b\"}");
        when(rs.getDouble("sample_fraction")).thenReturn(0.2);
        when(rs.getString("metric")).thenReturn("CLICK_RATE");
        when(rs.getString("remainder_recipients")).thenReturn("[\"x@y.org\"]");
        when(rs.getString("outcome")).thenReturn("SAMPLING");
        when(rs.getTimestamp("created_at")).thenReturn(Timestamp.from(NOW));

        SplitTest test = repository.findById(testId).orElseThrow();

        assertEquals(new DispatchPayload("B", "b"), test.variantB());
        assertEquals(EngagementMetric.CLICK_RATE, test.metric());
        assertEquals(List.of("x@y.org"), test.remainderRecipients());
        assertEquals(SplitTestOutcome.SAMPLING, test.outcome());
        assertNull(test.winner());
        assertNull(test.scoreA());
        assertNull(test.decidedAt());
    }

    @Test
    void shouldWriteVariantsAsJson() {
        SplitTest test = new SplitTest(UUID.randomUUID(), "gotv", new DispatchPayload("A", "a"),
            new DispatchPayload("B", "b"), 0.2, EngagementMetric.OPEN_RATE, null, 50,
            UUID.randomUUID(), UUID.randomUUID(), List.of("x@y.org"), SplitTestOutcome.SAMPLING,
            null, null, null, null, NOW, null, null);

        repository.save(test);

        verify(jdbcTemplate).update(contains("INSERT INTO campaign.split_test"),
            eq(test.testId()), eq("gotv"),
            eq("{\"subject\":\"A\",\"body\":\"a\"}"), eq("{\"subject\":\"B\",\"body\":\"b\"}"),
            eq(0.2), eq("OPEN_RATE"), isNull(), eq(50),
            eq(test.sampleAJobId()), eq(test.sampleBJobId()), eq("[\"x@y.org\"]"), eq("SAMPLING"),
            isNull(), isNull(), isNull(), isNull(), any(Timestamp.class), isNull(), isNull());
    }
}
