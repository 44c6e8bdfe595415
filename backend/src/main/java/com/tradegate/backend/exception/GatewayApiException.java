package com.tradegate.backend.exception;

/**
 * Raised by the gateway HTTP client for non-2xx responses and unreadable payloads.
 */
public class GatewayApiException extends RuntimeException {
    private final int statusCode;

    public GatewayApiException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public GatewayApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public GatewayApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
