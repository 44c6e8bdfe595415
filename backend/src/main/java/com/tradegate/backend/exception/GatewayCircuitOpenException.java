package com.tradegate.backend.exception;

public class GatewayCircuitOpenException extends RuntimeException {
    public GatewayCircuitOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
