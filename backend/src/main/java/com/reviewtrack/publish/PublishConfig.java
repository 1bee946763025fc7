package com.reviewtrack.publish;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the HTTP publish collaborator and the rate limiter in front of it.
 */
@Configuration
@EnableConfigurationProperties(PublishProperties.class)
@Slf4j
public class PublishConfig {

    public static final String PUBLISH_RATE_LIMITER = "publishRateLimiter";

    @Bean
    public PublishClient publishClient(WebClient.Builder webClientBuilder, PublishProperties properties) {
        if (properties.getLeaseTtlMs() <= properties.getTimeoutMs()) {
            log.warn("reviewtrack.publish.lease-ttl-ms ({}) should exceed timeout-ms ({})",
                    properties.getLeaseTtlMs(), properties.getTimeoutMs());
        }
        return new WebClientPublishClient(webClientBuilder, properties);
    }

    @Bean(name = PUBLISH_RATE_LIMITER)
    public RateLimiter publishRateLimiter(PublishProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of(PUBLISH_RATE_LIMITER, config);
    }
}
