package com.bastion.exception;

/**
 * The cache store capability failed. Never fatal to a request.
 */
public class CacheStoreException extends GatewayException {

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
