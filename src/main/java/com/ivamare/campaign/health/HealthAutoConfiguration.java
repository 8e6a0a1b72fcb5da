package com.ivamare.campaign.health;

import com.ivamare.campaign.CampaignAutoConfiguration;
import com.ivamare.campaign.CampaignProperties;
import com.ivamare.campaign.dispatch.DispatchScheduler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Auto-configuration for campaign engine health indicators.
 */
@AutoConfiguration(after = CampaignAutoConfiguration.class)
@ConditionalOnClass({HealthIndicator.class, JdbcTemplate.class})
@ConditionalOnProperty(prefix = "campaign", name = "enabled", havingValue = "true", matchIfMissing = true)
public class HealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(CampaignHealthIndicator.class)
    public CampaignHealthIndicator campaignHealthIndicator(JdbcTemplate jdbcTemplate,
                                                           ObjectProvider<DataSource> dataSource) {
        return new CampaignHealthIndicator(jdbcTemplate, dataSource.getIfAvailable());
    }

    @Bean
    @ConditionalOnBean(DispatchScheduler.class)
    @ConditionalOnMissingBean(SchedulerHealthIndicator.class)
    public SchedulerHealthIndicator schedulerHealthIndicator(DispatchScheduler dispatchScheduler,
                                                             CampaignProperties properties) {
        return new SchedulerHealthIndicator(dispatchScheduler,
            properties.getScheduler().getResilience().getErrorThreshold());
    }
}
