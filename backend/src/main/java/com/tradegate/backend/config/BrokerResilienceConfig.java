package com.tradegate.backend.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Order placement is not idempotent, so the gateway gets a breaker and a rate limiter but no retry.
 */
@Configuration
public class BrokerResilienceConfig {

    @Bean
    public CircuitBreaker gatewayCircuitBreaker(
            @Value("${trading.gateway.resilience.circuit.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${trading.gateway.resilience.circuit.wait-open-seconds:30}") long waitOpenSeconds,
            @Value("${trading.gateway.resilience.circuit.sliding-window-size:20}") int slidingWindowSize
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofSeconds(waitOpenSeconds))
                .slidingWindowSize(slidingWindowSize)
                .build();
        return CircuitBreaker.of("gateway", config);
    }

    @Bean
    public RateLimiter gatewayRateLimiter(
            @Value("${trading.gateway.resilience.rate.limit-per-second:10}") int limitPerSecond,
            @Value("${trading.gateway.resilience.rate.timeout-ms:500}") long timeoutMs
    ) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(limitPerSecond)
                .timeoutDuration(Duration.ofMillis(timeoutMs))
                .build();
        return RateLimiter.of("gateway", config);
    }

    @Bean
    public TimeLimiter brokerCallTimeLimiter(TradingProperties tradingProperties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(tradingProperties.getBrokerCallTimeoutMs()))
                .cancelRunningFuture(false)
                .build();
        return TimeLimiter.of("broker-call", config);
    }
}
