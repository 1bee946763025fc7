package com.reviewtrack.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

/**
 * Named thread pools: aggregation-executor runs one roll-up per track in parallel; housekeeping-scheduler runs
 * the @Scheduled expired-lease cleanup on a single thread.
 */
@Configuration
@EnableAsync
@EnableScheduling
@EnableConfigurationProperties(AggregationProperties.class)
@Slf4j
public class AsyncConfig {

    public static final String AGGREGATION_EXECUTOR = "aggregation-executor";
    public static final String HOUSEKEEPING_SCHEDULER = "housekeeping-scheduler";

    @Bean(name = AGGREGATION_EXECUTOR)
    public Executor aggregationExecutor(AggregationProperties properties) {
        int parallelism = Math.max(1, properties.getParallelism());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(parallelism);
        e.setMaxPoolSize(parallelism);
        e.setThreadNamePrefix("aggregation-");
        e.initialize();
        return e;
    }

    /** Single thread: the only scheduled job is the expired-lease delete on publish_leases. */
    @Bean(name = HOUSEKEEPING_SCHEDULER)
    public ThreadPoolTaskScheduler housekeepingScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("housekeeping-");
        s.setErrorHandler(t -> log.warn("Scheduled housekeeping task failed: {}", t.getMessage(), t));
        s.initialize();
        return s;
    }
}
