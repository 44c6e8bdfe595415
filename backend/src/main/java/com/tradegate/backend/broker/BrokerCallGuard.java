package com.tradegate.backend.broker;

import com.tradegate.backend.model.Order;
import com.tradegate.backend.model.TradeResult;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs broker calls on the trading pool under a per-call deadline. A call that overruns is
 * reported as a failure instead of blocking the batch; the underlying request is left to finish.
 */
@Slf4j
@Component
public class BrokerCallGuard {

    static final String SATURATED = "Broker call pool saturated";

    private final TimeLimiter timeLimiter;
    private final ThreadPoolTaskExecutor tradingExecutor;

    public BrokerCallGuard(TimeLimiter brokerCallTimeLimiter,
                           @Qualifier("tradingExecutor") ThreadPoolTaskExecutor tradingExecutor) {
        this.timeLimiter = brokerCallTimeLimiter;
        this.tradingExecutor = tradingExecutor;
    }

    public TradeResult submit(BrokerPort broker, Order order) {
        try {
            return run(() -> broker.submitOrder(order));
        } catch (TimeoutException e) {
            log.error("Order submit for {} timed out after {}", order.symbol(), timeout());
            return TradeResult.failed(order, "Broker call timed out after " + timeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Order submit for {} failed: {}", order.symbol(), cause.getMessage(), cause);
            return TradeResult.failed(order, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TradeResult.failed(order, "Interrupted while waiting for broker");
        } catch (RejectedExecutionException e) {
            log.error("Order submit for {} rejected by trading pool: {}", order.symbol(), e.getMessage());
            return TradeResult.failed(order, SATURATED);
        }
    }

    public <T> BrokerResult<T> call(String operation, Supplier<BrokerResult<T>> supplier) {
        try {
            return run(supplier);
        } catch (TimeoutException e) {
            log.warn("Broker {} timed out after {}", operation, timeout());
            return BrokerResult.fail(BrokerFailure.TIMEOUT, operation + " timed out after " + timeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Broker {} failed: {}", operation, cause.getMessage());
            return BrokerResult.fail(BrokerFailure.UNAVAILABLE, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BrokerResult.fail(BrokerFailure.UNAVAILABLE, "Interrupted while waiting for broker");
        } catch (RejectedExecutionException e) {
            log.warn("Broker {} rejected by trading pool: {}", operation, e.getMessage());
            return BrokerResult.fail(BrokerFailure.UNAVAILABLE, SATURATED);
        }
    }

    public boolean connect(BrokerPort broker) {
        BrokerResult<Boolean> connected = call("connect", () -> BrokerResult.ok(broker.connect()));
        return connected.isSuccess() && connected.value();
    }

    private <T> T run(Supplier<T> supplier) throws TimeoutException, ExecutionException, InterruptedException {
        try {
            return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(supplier, tradingExecutor));
        } catch (TimeoutException | ExecutionException | InterruptedException | RejectedExecutionException e) {
            throw e;
        } catch (Exception e) {
            throw new ExecutionException(e);
        }
    }

    private Duration timeout() {
        return timeLimiter.getTimeLimiterConfig().getTimeoutDuration();
    }
}
