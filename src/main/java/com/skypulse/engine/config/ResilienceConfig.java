package com.skypulse.engine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resilience4j registries (CircuitBreakerRegistry, RetryRegistry) come from the
 * resilience4j-spring-boot3 auto-configuration, driven by the
 * resilience4j.* section of application.yml.
 *
 * This class only adds the scheduler the asynchronous Retry needs to wait
 * between summary attempts without parking an event-loop thread.
 */
@Configuration
public class ResilienceConfig {

    @Bean(destroyMethod = "shutdown")
    public ScheduledExecutorService summaryRetryScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "summary-retry-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
