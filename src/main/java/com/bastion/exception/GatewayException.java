package com.bastion.exception;

/**
 * Base class for every failure surfaced by the gateway layer.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
