package com.ivamare.campaign;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.campaign.access.AccessPolicy;
import com.ivamare.campaign.cache.CacheBackend;
import com.ivamare.campaign.cache.CacheStore;
import com.ivamare.campaign.cache.impl.InMemoryCacheBackend;
import com.ivamare.campaign.cache.impl.JdbcCacheBackend;
import com.ivamare.campaign.catalog.DocumentCatalog;
import com.ivamare.campaign.catalog.DocumentRepository;
import com.ivamare.campaign.catalog.impl.DefaultDocumentCatalog;
import com.ivamare.campaign.catalog.impl.JdbcDocumentRepository;
import com.ivamare.campaign.dispatch.BatchDispatcher;
import com.ivamare.campaign.dispatch.DispatchJobRepository;
import com.ivamare.campaign.dispatch.DispatchScheduler;
import com.ivamare.campaign.dispatch.RefusingTransport;
import com.ivamare.campaign.dispatch.Transport;
import com.ivamare.campaign.dispatch.impl.DefaultBatchDispatcher;
import com.ivamare.campaign.dispatch.impl.JdbcDispatchJobRepository;
import com.ivamare.campaign.dispatch.ratelimit.Bucket4jDispatchRateLimiter;
import com.ivamare.campaign.dispatch.ratelimit.DispatchRateLimiter;
import com.ivamare.campaign.dispatch.ratelimit.JdbcRateLimitConfigRepository;
import com.ivamare.campaign.dispatch.ratelimit.RateLimitConfigRepository;
import com.ivamare.campaign.download.DownloadTracker;
import com.ivamare.campaign.recipient.RecipientRegistry;
import com.ivamare.campaign.recipient.RecipientRepository;
import com.ivamare.campaign.recipient.impl.JdbcRecipientRepository;
import com.ivamare.campaign.splittest.EngagementReporter;
import com.ivamare.campaign.splittest.NoEngagementReporter;
import com.ivamare.campaign.splittest.SplitTestEngine;
import com.ivamare.campaign.splittest.SplitTestRepository;
import com.ivamare.campaign.splittest.impl.DefaultSplitTestEngine;
import com.ivamare.campaign.splittest.impl.JdbcSplitTestRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Auto-configuration for the campaign engine.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Cache store (JDBC or in-memory backend)</li>
 *   <li>Document catalog and download tracker</li>
 *   <li>Recipient registry</li>
 *   <li>Batch dispatcher and its scheduler</li>
 *   <li>Split test engine</li>
 * </ul>
 *
 * <p>Applications supply a {@link Transport} and an {@link EngagementReporter}; without them the
 * fallbacks decline every send and report zero engagement.
 *
 * <p>To disable auto-configuration:
 * <pre>
 * campaign.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "campaign", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CampaignProperties.class)
@Import(SchedulerAutoStartConfiguration.class)
public class CampaignAutoConfiguration {

    // --- Infrastructure ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper campaignObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock campaignClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public TransactionOperations campaignTransactionOperations(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    // --- Access and cache ---

    @Bean
    @ConditionalOnMissingBean
    public AccessPolicy accessPolicy() {
        return new AccessPolicy();
    }

    @Bean
    @ConditionalOnMissingBean(CacheBackend.class)
    @ConditionalOnProperty(prefix = "campaign.cache", name = "backend", havingValue = "memory")
    public CacheBackend inMemoryCacheBackend() {
        return new InMemoryCacheBackend();
    }

    @Bean
    @ConditionalOnMissingBean(CacheBackend.class)
    @ConditionalOnProperty(prefix = "campaign.cache", name = "backend", havingValue = "jdbc", matchIfMissing = true)
    public CacheBackend jdbcCacheBackend(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcCacheBackend(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheStore cacheStore(CacheBackend cacheBackend, ObjectMapper objectMapper, Clock clock,
                                 CampaignProperties properties) {
        return new CacheStore(cacheBackend, objectMapper, clock, properties.getCache().getDefaultTtl());
    }

    // --- Catalog ---

    @Bean
    @ConditionalOnMissingBean
    public DocumentRepository documentRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcDocumentRepository(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public DownloadTracker downloadTracker(DocumentRepository documentRepository, CacheStore cacheStore) {
        return new DownloadTracker(documentRepository, cacheStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public DocumentCatalog documentCatalog(
            DocumentRepository documentRepository,
            AccessPolicy accessPolicy,
            CacheStore cacheStore,
            DownloadTracker downloadTracker,
            Clock clock,
            CampaignProperties properties) {
        return new DefaultDocumentCatalog(
            documentRepository,
            accessPolicy,
            cacheStore,
            downloadTracker,
            clock,
            properties.getCache().getDocumentTtl(),
            properties.getCache().getAggregateTtl()
        );
    }

    // --- Recipients ---

    @Bean
    @ConditionalOnMissingBean
    public RecipientRepository recipientRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcRecipientRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecipientRegistry recipientRegistry(RecipientRepository recipientRepository, Clock clock) {
        return new RecipientRegistry(recipientRepository, clock);
    }

    // --- Dispatch ---

    @Bean
    @ConditionalOnMissingBean
    public DispatchJobRepository dispatchJobRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcDispatchJobRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public Transport transport() {
        return new RefusingTransport();
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchDispatcher batchDispatcher(
            DispatchJobRepository dispatchJobRepository,
            RecipientRepository recipientRepository,
            Transport transport,
            Clock clock,
            CampaignProperties properties) {
        return new DefaultBatchDispatcher(
            dispatchJobRepository,
            recipientRepository,
            transport,
            clock,
            properties.getDispatch().getMaxChunkSize()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "campaign.dispatch", name = "rate-limit-enabled", havingValue = "true")
    public RateLimitConfigRepository rateLimitConfigRepository(JdbcTemplate jdbcTemplate) {
        return new JdbcRateLimitConfigRepository(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "campaign.dispatch", name = "rate-limit-enabled", havingValue = "true")
    public DispatchRateLimiter dispatchRateLimiter(DataSource dataSource,
                                                   RateLimitConfigRepository rateLimitConfigRepository) {
        return new Bucket4jDispatchRateLimiter(dataSource, rateLimitConfigRepository);
    }

    // --- Split tests ---

    @Bean
    @ConditionalOnMissingBean
    public SplitTestRepository splitTestRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcSplitTestRepository(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public EngagementReporter engagementReporter() {
        return new NoEngagementReporter();
    }

    @Bean
    @ConditionalOnMissingBean
    public SplitTestEngine splitTestEngine(
            SplitTestRepository splitTestRepository,
            RecipientRepository recipientRepository,
            BatchDispatcher batchDispatcher,
            EngagementReporter engagementReporter,
            TransactionOperations transactionOperations,
            Clock clock,
            CampaignProperties properties) {
        return new DefaultSplitTestEngine(
            splitTestRepository,
            recipientRepository,
            batchDispatcher,
            engagementReporter,
            transactionOperations,
            clock,
            properties.getDispatch().getDefaultChunkSize()
        );
    }

    // --- Scheduler ---

    @Bean
    @ConditionalOnMissingBean
    public DispatchScheduler dispatchScheduler(
            BatchDispatcher batchDispatcher,
            SplitTestEngine splitTestEngine,
            CacheStore cacheStore,
            ObjectProvider<DispatchRateLimiter> rateLimiter,
            Clock clock,
            CampaignProperties properties) {
        CampaignProperties.DispatchProperties dispatch = properties.getDispatch();
        CampaignProperties.SchedulerProperties scheduler = properties.getScheduler();
        return new DispatchScheduler(
            batchDispatcher,
            splitTestEngine,
            cacheStore,
            rateLimiter.getIfAvailable(),
            dispatch.getRateLimitResource(),
            clock,
            scheduler.getJobsPerTick(),
            scheduler.getPollIntervalMs(),
            dispatch.getMinInterChunkDelay(),
            scheduler.getJanitorInterval(),
            scheduler.getResilience()
        );
    }
}
