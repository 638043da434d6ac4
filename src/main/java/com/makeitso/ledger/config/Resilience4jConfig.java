package com.makeitso.ledger.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named instance, "alertSink", guards delivery of critical security alerts
 * (see AlertDispatcher). While the breaker is OPEN, alerts are parked and
 * redelivered later instead of hammering a dead channel.
 */
@Configuration
public class Resilience4jConfig {

    static final String ALERT_SINK = "alertSink";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 deliveries fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(RuntimeException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(ALERT_SINK);
        return registry;
    }

    @Bean
    public CircuitBreaker alertSinkCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(ALERT_SINK);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(500))
                .retryExceptions(RuntimeException.class)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(ALERT_SINK);
        return registry;
    }

    @Bean
    public Retry alertSinkRetry(RetryRegistry registry) {
        return registry.retry(ALERT_SINK);
    }
}
