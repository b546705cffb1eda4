package com.bastion.service;

import com.bastion.exception.ProviderException;
import com.bastion.exception.RateLimitedException;

import java.util.concurrent.TimeoutException;

/**
 * Decides which provider failures are worth another attempt: throttling and timeouts only.
 */
public final class RetryClassifier {

    private RetryClassifier() {
    }

    public static boolean isRetryable(Throwable error) {
        if (error instanceof RateLimitedException || error instanceof TimeoutException) {
            return true;
        }
        if (error instanceof ProviderException) {
            return ((ProviderException) error).getType().isTransient();
        }
        return false;
    }
}
