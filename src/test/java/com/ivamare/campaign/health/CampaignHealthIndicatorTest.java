package com.ivamare.campaign.health;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("CampaignHealthIndicator")
class CampaignHealthIndicatorTest {

    private JdbcTemplate jdbcTemplate;
    private CampaignHealthIndicator healthIndicator;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        healthIndicator = new CampaignHealthIndicator(jdbcTemplate);
    }

    private void givenSchemaExists() {
        when(jdbcTemplate.queryForObject(contains("information_schema"), eq(Boolean.class)))
            .thenReturn(true);
    }

    @Test
    @DisplayName("should return UP with dispatch and split test counts")
    void shouldReturnUpWithCounts() {
        givenSchemaExists();
        when(jdbcTemplate.queryForObject(contains("campaign.dispatch_job"), eq(Integer.class)))
            .thenReturn(4);
        when(jdbcTemplate.queryForObject(contains("campaign.split_test"), eq(Integer.class)))
            .thenReturn(1);

        Health health = healthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("campaign", health.getDetails().get("schema"));
        assertEquals(4, health.getDetails().get("activeDispatchJobs"));
        assertEquals(1, health.getDetails().get("samplingSplitTests"));
    }

    @Test
    @DisplayName("should report zero when counts are null")
    void shouldReportZeroWhenCountsAreNull() {
        givenSchemaExists();
        when(jdbcTemplate.queryForObject(contains("COUNT(*)"), eq(Integer.class))).thenReturn(null);

        Health health = healthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals(0, health.getDetails().get("activeDispatchJobs"));
    }

    @Test
    @DisplayName("should return DOWN when campaign schema not found")
    void shouldReturnDownWhenSchemaMissing() {
        when(jdbcTemplate.queryForObject(contains("information_schema"), eq(Boolean.class)))
            .thenReturn(false);

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("campaign schema not found", health.getDetails().get("error"));
    }

    @Test
    @DisplayName("should return DOWN when the database is unreachable")
    void shouldReturnDownOnDatabaseError() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Boolean.class)))
            .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        Health health = healthIndicator.health();

        assertEquals(Status.DOWN, health.getStatus());
        assertEquals("Connection refused", health.getDetails().get("error"));
    }

    @Nested
    @DisplayName("with DataSource")
    class WithDataSourceTests {

        @Test
        @DisplayName("should return DOWN when connection is invalid")
        void shouldReturnDownWhenConnectionInvalid() throws SQLException {
            DataSource dataSource = mock(DataSource.class);
            Connection connection = mock(Connection.class);
            when(dataSource.getConnection()).thenReturn(connection);
            when(connection.isValid(anyInt())).thenReturn(false);

            Health health = new CampaignHealthIndicator(jdbcTemplate, dataSource).health();

            assertEquals(Status.DOWN, health.getStatus());
            assertEquals("Database connection invalid", health.getDetails().get("error"));
            verifyNoInteractions(jdbcTemplate);
        }

        @Test
        @DisplayName("should return DOWN when a connection cannot be obtained")
        void shouldReturnDownWhenConnectionFails() throws SQLException {
            DataSource dataSource = mock(DataSource.class);
            when(dataSource.getConnection()).thenThrow(new SQLException("too many connections"));

            Health health = new CampaignHealthIndicator(jdbcTemplate, dataSource).health();

            assertEquals(Status.DOWN, health.getStatus());
        }

        @Test
        @DisplayName("should include Hikari pool statistics")
        void shouldIncludePoolStats() throws SQLException {
            HikariDataSource dataSource = mock(HikariDataSource.class);
            HikariPoolMXBean pool = mock(HikariPoolMXBean.class);
            Connection connection = mock(Connection.class);
            when(dataSource.getConnection()).thenReturn(connection);
            when(connection.isValid(anyInt())).thenReturn(true);
            when(dataSource.getHikariPoolMXBean()).thenReturn(pool);
            when(pool.getActiveConnections()).thenReturn(2);
            when(pool.getIdleConnections()).thenReturn(8);
            when(pool.getTotalConnections()).thenReturn(10);
            when(pool.getThreadsAwaitingConnection()).thenReturn(0);
            givenSchemaExists();

            Health health = new CampaignHealthIndicator(jdbcTemplate, dataSource).health();

            assertEquals(Status.UP, health.getStatus());
            assertEquals(2, health.getDetails().get("pool.active"));
            assertEquals(10, health.getDetails().get("pool.total"));
        }
    }
}
