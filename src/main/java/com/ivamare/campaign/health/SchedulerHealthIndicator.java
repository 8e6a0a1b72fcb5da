package com.ivamare.campaign.health;

import com.ivamare.campaign.dispatch.DispatchScheduler;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Health indicator for the dispatch scheduler.
 *
 * <p>UNKNOWN while the scheduler is not started (applications may tick it themselves), DOWN
 * once consecutive errors reach the threshold.
 */
public class SchedulerHealthIndicator implements HealthIndicator {

    private final DispatchScheduler scheduler;
    private final int errorThreshold;

    public SchedulerHealthIndicator(DispatchScheduler scheduler, int errorThreshold) {
        this.scheduler = scheduler;
        this.errorThreshold = errorThreshold;
    }

    @Override
    public Health health() {
        int consecutiveErrors = scheduler.getConsecutiveErrorCount();
        Health.Builder builder;
        if (!scheduler.isRunning()) {
            builder = Health.unknown().withDetail("message", "Scheduler not started");
        } else if (consecutiveErrors >= errorThreshold) {
            builder = Health.down();
        } else {
            builder = Health.up();
        }

        builder.withDetail("running", scheduler.isRunning())
            .withDetail("consecutiveErrors", consecutiveErrors)
            .withDetail("chunksAdvanced", scheduler.getChunksAdvanced());
        if (scheduler.getLastTickAt() != null) {
            builder.withDetail("lastTickAt", scheduler.getLastTickAt().toString());
        }
        return builder.build();
    }
}
