package com.protocolguide.application.ports;

/**
 * The billing provider could not be reached or answered with an error.
 */
public class BillingGatewayException extends RuntimeException {

    private final int statusCode;

    public BillingGatewayException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public BillingGatewayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status from the provider, or -1 when no response was received.
     */
    public int statusCode() {
        return statusCode;
    }
}
