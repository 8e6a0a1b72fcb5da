package com.ivamare.campaign.health;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Health indicator for campaign engine database connectivity.
 *
 * <p>Checks that the campaign schema exists and reports active dispatch jobs and split tests
 * still sampling.
 */
public class CampaignHealthIndicator implements HealthIndicator {

    private static final int CONNECTION_VALIDITY_TIMEOUT_SECONDS = 3;

    private final JdbcTemplate jdbcTemplate;
    private final DataSource dataSource;

    public CampaignHealthIndicator(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, null);
    }

    public CampaignHealthIndicator(JdbcTemplate jdbcTemplate, DataSource dataSource) {
        this.jdbcTemplate = jdbcTemplate;
        this.dataSource = dataSource;
    }

    @Override
    public Health health() {
        try {
            if (dataSource != null && !isConnectionValid()) {
                return Health.down()
                    .withDetail("error", "Database connection invalid")
                    .build();
            }

            Boolean schemaExists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM information_schema.schemata WHERE schema_name = 'campaign')",
                Boolean.class
            );
            if (!Boolean.TRUE.equals(schemaExists)) {
                return Health.down()
                    .withDetail("error", "campaign schema not found")
                    .build();
            }

            Integer activeJobs = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM campaign.dispatch_job WHERE status IN ('PENDING', 'RUNNING')",
                Integer.class
            );
            Integer samplingTests = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM campaign.split_test WHERE outcome = 'SAMPLING'",
                Integer.class
            );

            Health.Builder builder = Health.up()
                .withDetail("schema", "campaign")
                .withDetail("activeDispatchJobs", activeJobs != null ? activeJobs : 0)
                .withDetail("samplingSplitTests", samplingTests != null ? samplingTests : 0);
            addPoolStats(builder);
            return builder.build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private boolean isConnectionValid() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(CONNECTION_VALIDITY_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            return false;
        }
    }

    private void addPoolStats(Health.Builder builder) {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                builder.withDetail("pool.active", pool.getActiveConnections());
                builder.withDetail("pool.idle", pool.getIdleConnections());
                builder.withDetail("pool.total", pool.getTotalConnections());
                builder.withDetail("pool.pending", pool.getThreadsAwaitingConnection());
            }
        }
    }
}
