package com.ivamare.campaign;

import com.ivamare.campaign.dispatch.DispatchScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;

/**
 * Auto-start configuration for the dispatch scheduler.
 *
 * <p>Enable with:
 * <pre>
 * campaign:
 *   scheduler:
 *     auto-start: true
 * </pre>
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnProperty(prefix = "campaign.scheduler", name = "auto-start", havingValue = "true")
public class SchedulerAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SchedulerAutoStartConfiguration.class);

    private final DispatchScheduler dispatchScheduler;

    public SchedulerAutoStartConfiguration(DispatchScheduler dispatchScheduler) {
        this.dispatchScheduler = dispatchScheduler;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startScheduler() {
        log.info("Auto-starting dispatch scheduler");
        dispatchScheduler.start();
    }

    @PreDestroy
    public void stopScheduler() {
        dispatchScheduler.stop();
    }
}
