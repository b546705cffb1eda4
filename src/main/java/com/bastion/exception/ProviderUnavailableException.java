package com.bastion.exception;

import lombok.Getter;

/**
 * Provider was not attempted: its circuit is open or the health registry marked it down.
 */
@Getter
public class ProviderUnavailableException extends GatewayException {

    private final String providerId;

    public ProviderUnavailableException(String providerId, String reason) {
        super("Service temporarily unavailable: " + providerId + " (" + reason + ")");
        this.providerId = providerId;
    }
}
