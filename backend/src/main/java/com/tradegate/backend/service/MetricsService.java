package com.tradegate.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Execution and risk meters. Plain counters mirror the Micrometer ones so callers can read them
 * without a registry query.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final AtomicLong ordersPlaced = new AtomicLong();
    private final AtomicLong ordersFilled = new AtomicLong();
    private final AtomicLong brokerFailures = new AtomicLong();
    private final AtomicReference<Double> pnlDaily = new AtomicReference<>(0.0);
    private final AtomicInteger circuitBreakerActive = new AtomicInteger();

    private Counter ordersPlacedCounter;
    private Counter ordersFilledCounter;
    private Counter brokerErrorsCounter;

    @PostConstruct
    void init() {
        ordersPlacedCounter = Counter.builder("orders_placed_total").register(meterRegistry);
        ordersFilledCounter = Counter.builder("orders_filled_total").register(meterRegistry);
        brokerErrorsCounter = Counter.builder("broker_errors_total").register(meterRegistry);
        Gauge.builder("pnl_daily", pnlDaily, value -> value.get()).register(meterRegistry);
        Gauge.builder("risk_circuit_breaker_active", circuitBreakerActive, AtomicInteger::get).register(meterRegistry);
    }

    public void incrementOrdersPlaced() {
        ordersPlaced.incrementAndGet();
        if (ordersPlacedCounter != null) {
            ordersPlacedCounter.increment();
        }
    }

    public void recordOrderFilled() {
        ordersFilled.incrementAndGet();
        if (ordersFilledCounter != null) {
            ordersFilledCounter.increment();
        }
    }

    public void incrementBrokerFailures() {
        brokerFailures.incrementAndGet();
        if (brokerErrorsCounter != null) {
            brokerErrorsCounter.increment();
        }
    }

    public void recordReject(String reason) {
        Counter.builder("order_rejects_total")
                .tag("reason", reason == null || reason.isBlank() ? "UNKNOWN" : reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordBrokerLatency(String operation, long elapsedNanos, boolean success) {
        Timer.builder("broker_call_latency")
                .tag("operation", operation)
                .tag("status", success ? "success" : "error")
                .register(meterRegistry)
                .record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void updateDailyPnl(double value) {
        pnlDaily.set(value);
    }

    public void updateCircuitBreaker(boolean active) {
        circuitBreakerActive.set(active ? 1 : 0);
    }

    public long getOrdersPlaced() {
        return ordersPlaced.get();
    }

    public long getOrdersFilled() {
        return ordersFilled.get();
    }

    public long getBrokerFailures() {
        return brokerFailures.get();
    }
}
