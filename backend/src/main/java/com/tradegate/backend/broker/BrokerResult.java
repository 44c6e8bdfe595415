package com.tradegate.backend.broker;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a broker read: either a value or a typed failure with a message. Callers pick the
 * fallback themselves.
 */
public record BrokerResult<T>(T value, BrokerFailure failure, String message) {

    public BrokerResult {
        if (failure == null) {
            Objects.requireNonNull(value, "value");
        }
    }

    public static <T> BrokerResult<T> ok(T value) {
        return new BrokerResult<>(value, null, null);
    }

    public static <T> BrokerResult<T> fail(BrokerFailure failure, String message) {
        return new BrokerResult<>(null, Objects.requireNonNull(failure, "failure"), message);
    }

    public static <T> BrokerResult<T> notConnected() {
        return fail(BrokerFailure.NOT_CONNECTED, "Not connected to broker");
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }

    public <R> BrokerResult<R> map(Function<T, R> mapper) {
        if (!isSuccess()) {
            return fail(failure, message);
        }
        return ok(mapper.apply(value));
    }
}
