package com.ivamare.campaign;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.campaign.access.AccessPolicy;
import com.ivamare.campaign.cache.CacheBackend;
import com.ivamare.campaign.cache.CacheStore;
import com.ivamare.campaign.cache.impl.InMemoryCacheBackend;
import com.ivamare.campaign.cache.impl.JdbcCacheBackend;
import com.ivamare.campaign.catalog.DocumentCatalog;
import com.ivamare.campaign.dispatch.BatchDispatcher;
import com.ivamare.campaign.dispatch.DispatchScheduler;
import com.ivamare.campaign.dispatch.RefusingTransport;
import com.ivamare.campaign.dispatch.Transport;
import com.ivamare.campaign.dispatch.ratelimit.DispatchRateLimiter;
import com.ivamare.campaign.dispatch.ratelimit.RateLimitConfigRepository;
import com.ivamare.campaign.download.DownloadTracker;
import com.ivamare.campaign.recipient.RecipientRegistry;
import com.ivamare.campaign.splittest.EngagementReporter;
import com.ivamare.campaign.splittest.NoEngagementReporter;
import com.ivamare.campaign.splittest.SplitTestEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("CampaignAutoConfiguration")
class CampaignAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(CampaignAutoConfiguration.class))
        .withUserConfiguration(MockDataSourceConfig.class);

    @Test
    @DisplayName("should create all beans when enabled")
    void shouldCreateAllBeansWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ObjectMapper.class);
            assertThat(context).hasSingleBean(AccessPolicy.class);
            assertThat(context).hasSingleBean(CacheStore.class);
            assertThat(context).hasSingleBean(DocumentCatalog.class);
            assertThat(context).hasSingleBean(DownloadTracker.class);
            assertThat(context).hasSingleBean(RecipientRegistry.class);
            assertThat(context).hasSingleBean(BatchDispatcher.class);
            assertThat(context).hasSingleBean(SplitTestEngine.class);
            assertThat(context).hasSingleBean(DispatchScheduler.class);
            assertThat(context).doesNotHaveBean(SchedulerAutoStartConfiguration.class);
        });
    }

    @Test
    @DisplayName("should not create beans when disabled")
    void shouldNotCreateBeansWhenDisabled() {
        contextRunner
            .withPropertyValues("campaign.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(DocumentCatalog.class);
                assertThat(context).doesNotHaveBean(BatchDispatcher.class);
                assertThat(context).doesNotHaveBean(DispatchScheduler.class);
            });
    }

    @Test
    @DisplayName("should default to the JDBC cache backend")
    void shouldDefaultToJdbcCacheBackend() {
        contextRunner.run(context ->
            assertThat(context.getBean(CacheBackend.class)).isInstanceOf(JdbcCacheBackend.class));
    }

    @Test
    @DisplayName("should use the in-memory cache backend when configured")
    void shouldUseInMemoryCacheBackendWhenConfigured() {
        contextRunner
            .withPropertyValues("campaign.cache.backend=memory")
            .run(context -> {
                assertThat(context).hasSingleBean(CacheBackend.class);
                assertThat(context.getBean(CacheBackend.class)).isInstanceOf(InMemoryCacheBackend.class);
            });
    }

    @Test
    @DisplayName("should fall back to a refusing transport and zero engagement")
    void shouldProvideFallbacks() {
        contextRunner.run(context -> {
            assertThat(context.getBean(Transport.class)).isInstanceOf(RefusingTransport.class);
            assertThat(context.getBean(EngagementReporter.class)).isInstanceOf(NoEngagementReporter.class);
        });
    }

    @Test
    @DisplayName("should use custom Transport if provided")
    void shouldUseCustomTransportIfProvided() {
        contextRunner
            .withUserConfiguration(CustomTransportConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(Transport.class);
                assertThat(context.getBean(Transport.class)).isSameAs(CustomTransportConfig.CUSTOM_TRANSPORT);
            });
    }

    @Test
    @DisplayName("should only create rate limit beans when enabled")
    void shouldOnlyCreateRateLimitBeansWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).doesNotHaveBean(DispatchRateLimiter.class);
            assertThat(context).doesNotHaveBean(RateLimitConfigRepository.class);
        });

        contextRunner
            .withUserConfiguration(CustomRateLimiterConfig.class)
            .withPropertyValues("campaign.dispatch.rate-limit-enabled=true")
            .run(context -> {
                assertThat(context).hasSingleBean(RateLimitConfigRepository.class);
                assertThat(context.getBean(DispatchRateLimiter.class))
                    .isSameAs(CustomRateLimiterConfig.CUSTOM_LIMITER);
            });
    }

    @Test
    @DisplayName("should bind properties")
    void shouldBindProperties() {
        contextRunner
            .withPropertyValues(
                "campaign.cache.default-ttl=30s",
                "campaign.dispatch.max-chunk-size=200",
                "campaign.dispatch.min-inter-chunk-delay=2s",
                "campaign.scheduler.jobs-per-tick=5"
            )
            .run(context -> {
                CampaignProperties properties = context.getBean(CampaignProperties.class);
                assertThat(properties.getCache().getDefaultTtl()).isEqualTo(Duration.ofSeconds(30));
                assertThat(properties.getDispatch().getMaxChunkSize()).isEqualTo(200);
                assertThat(properties.getDispatch().getMinInterChunkDelay()).isEqualTo(Duration.ofSeconds(2));
                assertThat(properties.getScheduler().getJobsPerTick()).isEqualTo(5);
            });
    }

    @Test
    @DisplayName("should register auto-start configuration when enabled")
    void shouldRegisterAutoStartWhenEnabled() {
        contextRunner
            .withPropertyValues("campaign.scheduler.auto-start=true")
            .run(context -> assertThat(context).hasSingleBean(SchedulerAutoStartConfiguration.class));
    }

    @Configuration
    static class MockDataSourceConfig {
        @Bean
        public DataSource dataSource() {
            return mock(DataSource.class);
        }

        @Bean
        public JdbcTemplate jdbcTemplate() {
            return mock(JdbcTemplate.class);
        }

        @Bean
        public PlatformTransactionManager transactionManager() {
            return mock(PlatformTransactionManager.class);
        }
    }

    @Configuration
    static class CustomTransportConfig {
        static final Transport CUSTOM_TRANSPORT = (address, payload) -> true;

        @Bean
        public Transport transport() {
            return CUSTOM_TRANSPORT;
        }
    }

    @Configuration
    static class CustomRateLimiterConfig {
        static final DispatchRateLimiter CUSTOM_LIMITER = mock(DispatchRateLimiter.class);

        @Bean
        public DispatchRateLimiter dispatchRateLimiter() {
            return CUSTOM_LIMITER;
        }
    }
}
