package com.protocolguide.api.billing;

/**
 * Inbound event could not be authenticated. The message is safe to return to the caller.
 */
public class SignatureException extends Exception {

    public SignatureException(String message) {
        super(message);
    }

    public SignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
