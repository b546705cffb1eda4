package com.bastion.exception;

import lombok.Getter;

/**
 * The call reached the provider and it answered with a failure.
 */
@Getter
public class ProviderException extends GatewayException {

    private final String providerId;
    private final ProviderErrorType type;
    private final Integer status;

    public ProviderException(String providerId, ProviderErrorType type, String message) {
        this(providerId, type, null, message, null);
    }

    public ProviderException(String providerId, ProviderErrorType type, Integer status,
                             String message, Throwable cause) {
        super(providerId + ": " + message, cause);
        this.providerId = providerId;
        this.type = type;
        this.status = status;
    }
}
