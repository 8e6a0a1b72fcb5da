package com.ivamare.campaign;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CampaignProperties")
class CampaignPropertiesTest {

    @Test
    @DisplayName("should have default values")
    void shouldHaveDefaultValues() {
        CampaignProperties properties = new CampaignProperties();

        assertTrue(properties.isEnabled());
        assertEquals(CampaignProperties.CacheBackendType.JDBC, properties.getCache().getBackend());
        assertEquals(Duration.ofMinutes(10), properties.getCache().getDefaultTtl());
        assertEquals(50, properties.getDispatch().getDefaultChunkSize());
        assertEquals(1000, properties.getDispatch().getMaxChunkSize());
        assertEquals(Duration.ZERO, properties.getDispatch().getMinInterChunkDelay());
        assertFalse(properties.getDispatch().isRateLimitEnabled());
        assertFalse(properties.getScheduler().isAutoStart());
        assertEquals(5, properties.getScheduler().getResilience().getErrorThreshold());
    }

    @Test
    @DisplayName("should set scheduler properties")
    void shouldSetSchedulerProperties() {
        CampaignProperties properties = new CampaignProperties();
        CampaignProperties.SchedulerProperties scheduler = new CampaignProperties.SchedulerProperties();
        scheduler.setPollIntervalMs(250);
        scheduler.setJanitorInterval(Duration.ofMinutes(5));
        properties.setScheduler(scheduler);

        assertEquals(250, properties.getScheduler().getPollIntervalMs());
        assertEquals(Duration.ofMinutes(5), properties.getScheduler().getJanitorInterval());
    }
}
