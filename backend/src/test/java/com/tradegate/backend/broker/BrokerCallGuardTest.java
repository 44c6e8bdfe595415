package com.tradegate.backend.broker;

import com.tradegate.backend.model.Order;
import com.tradegate.backend.model.OrderStatus;
import com.tradegate.backend.model.TradeResult;
import com.tradegate.backend.model.TradeSide;
import com.tradegate.backend.support.TestBrokers;
import io.github.resilience4j.timelimiter.TimeLimiter;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BrokerCallGuardTest {

    private final Order order = Order.builder().symbol("AAPL").side(TradeSide.BUY).quantity(5).build();

    @Test
    void slowSubmitIsReportedAsFailedAfterDeadline() {
        BrokerCallGuard guard = TestBrokers.guard(Duration.ofMillis(100));
        BrokerPort broker = mock(BrokerPort.class);
        CountDownLatch release = new CountDownLatch(1);
        when(broker.submitOrder(order)).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return TradeResult.failed(order, "late");
        });

        TradeResult result = guard.submit(broker, order);
        release.countDown();

        assertThat(result.status()).isEqualTo(OrderStatus.FAILED);
        assertThat(result.errorMsg()).isEqualTo("Broker call timed out after 100ms");
    }

    @Test
    void submitExceptionBecomesFailedResult() {
        BrokerCallGuard guard = TestBrokers.guard();
        BrokerPort broker = mock(BrokerPort.class);
        when(broker.submitOrder(order)).thenThrow(new IllegalStateException("socket closed"));

        TradeResult result = guard.submit(broker, order);

        assertThat(result.status()).isEqualTo(OrderStatus.FAILED);
        assertThat(result.errorMsg()).isEqualTo("socket closed");
    }

    @Test
    void slowReadIsReportedAsTimeout() {
        BrokerCallGuard guard = TestBrokers.guard(Duration.ofMillis(100));
        CountDownLatch release = new CountDownLatch(1);

        BrokerResult<String> result = guard.call("positions", () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return BrokerResult.ok("late");
        });
        release.countDown();

        assertThat(result.failure()).isEqualTo(BrokerFailure.TIMEOUT);
        assertThat(result.message()).isEqualTo("positions timed out after 100ms");
    }

    @Test
    void readResultPassesThrough() {
        BrokerCallGuard guard = TestBrokers.guard();

        assertThat(guard.call("quote", () -> BrokerResult.ok("150")).value()).isEqualTo("150");
        assertThat(guard.call("quote", () -> { throw new IllegalStateException("boom"); }).failure())
                .isEqualTo(BrokerFailure.UNAVAILABLE);
    }

    @Test
    void connectReportsBrokerOutcome() {
        BrokerCallGuard guard = TestBrokers.guard();
        BrokerPort up = mock(BrokerPort.class);
        BrokerPort down = mock(BrokerPort.class);
        when(up.connect()).thenReturn(true);
        when(down.connect()).thenReturn(false);

        assertThat(guard.connect(up)).isTrue();
        assertThat(guard.connect(down)).isFalse();
    }

    @Test
    void saturatedPoolFailsInsteadOfThrowing() throws Exception {
        ThreadPoolTaskExecutor single = new ThreadPoolTaskExecutor();
        single.setCorePoolSize(1);
        single.setMaxPoolSize(1);
        single.setQueueCapacity(0);
        single.initialize();
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        single.execute(() -> {
            running.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();
        BrokerCallGuard guard = new BrokerCallGuard(TimeLimiter.of(Duration.ofSeconds(1)), single);
        BrokerPort broker = mock(BrokerPort.class);

        try {
            TradeResult submitted = guard.submit(broker, order);
            BrokerResult<String> read = guard.call("positions", () -> BrokerResult.ok("unused"));

            assertThat(submitted.status()).isEqualTo(OrderStatus.FAILED);
            assertThat(submitted.errorMsg()).isEqualTo(BrokerCallGuard.SATURATED);
            assertThat(read.failure()).isEqualTo(BrokerFailure.UNAVAILABLE);
            assertThat(read.message()).isEqualTo(BrokerCallGuard.SATURATED);
            verify(broker, never()).submitOrder(order);
        } finally {
            release.countDown();
            single.shutdown();
        }
    }
}
