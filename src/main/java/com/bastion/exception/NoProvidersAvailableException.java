package com.bastion.exception;

import lombok.Getter;

import java.util.List;

/**
 * Every provider of a route was ineligible or failed. The individual failures are
 * attached as suppressed exceptions.
 */
@Getter
public class NoProvidersAvailableException extends GatewayException {

    private final List<String> attemptedProviders;

    public NoProvidersAvailableException(String route, List<String> attemptedProviders, List<Throwable> failures) {
        super("No providers available for " + route + " (attempted: " + attemptedProviders + ")",
                failures.isEmpty() ? null : failures.get(failures.size() - 1));
        this.attemptedProviders = List.copyOf(attemptedProviders);
        failures.forEach(this::addSuppressed);
    }
}
