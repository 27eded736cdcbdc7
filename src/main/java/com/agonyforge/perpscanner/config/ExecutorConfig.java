package com.agonyforge.perpscanner.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Configuration for the scheduler that runs connector timers, polls and throttles, and for the clock
 * everything reads the time from.
 */
@Configuration
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService scannerScheduler() {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("scanner-pool-");

        threadFactory.setDaemon(true);

        // polls block on HTTP so leave room for every venue to poll at once
        return Executors.newScheduledThreadPool(Runtime.getRuntime().availableProcessors() + 4, threadFactory);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
