package com.ruteberegner.distance.infrastructure.retry;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Set;

/**
 * Retry policies for the two outbound services.
 *
 * Routing retries timeouts, connection failures and 429/502/503/504.
 * Geocoding only retries timeouts and 429/503.
 */
@Configuration
public class RetryConfig {

    public static final String ROUTING = "routingRetryPolicy";
    public static final String GEOCODING = "geocodingRetryPolicy";

    @Bean
    @Qualifier(ROUTING)
    public RetryPolicy routingRetryPolicy(
        @Value("${app.retry.routing.max-attempts:3}") int maxAttempts,
        @Value("${app.retry.routing.initial-delay-ms:1000}") long initialDelayMs,
        @Value("${app.retry.routing.max-delay-ms:60000}") long maxDelayMs
    ) {
        return RetryPolicy.builder()
            .name("routing")
            .maxAttempts(maxAttempts)
            .initialDelay(Duration.ofMillis(initialDelayMs))
            .maxDelay(Duration.ofMillis(maxDelayMs))
            .retryable(RetryPredicates.transientFailure(RetryPredicates.TRANSIENT_HTTP_STATUSES))
            .build();
    }

    @Bean
    @Qualifier(GEOCODING)
    public RetryPolicy geocodingRetryPolicy(
        @Value("${app.retry.geocoding.max-attempts:2}") int maxAttempts,
        @Value("${app.retry.geocoding.initial-delay-ms:1000}") long initialDelayMs,
        @Value("${app.retry.geocoding.max-delay-ms:60000}") long maxDelayMs
    ) {
        return RetryPolicy.builder()
            .name("geocoding")
            .maxAttempts(maxAttempts)
            .initialDelay(Duration.ofMillis(initialDelayMs))
            .maxDelay(Duration.ofMillis(maxDelayMs))
            .retryable(RetryPredicates.timeoutOrStatus(Set.of(429, 503)))
            .build();
    }
}
