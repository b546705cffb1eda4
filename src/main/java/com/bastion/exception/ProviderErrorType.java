package com.bastion.exception;

public enum ProviderErrorType {
    RATE_LIMITED,
    TIMEOUT,
    AUTHENTICATION,
    INVALID_REQUEST,
    UPSTREAM,
    NETWORK,
    MALFORMED_RESPONSE;

    /**
     * Only throttling and timeouts are worth another attempt.
     */
    public boolean isTransient() {
        return this == RATE_LIMITED || this == TIMEOUT;
    }

    public static ProviderErrorType fromStatus(int status) {
        if (status == 429) {
            return RATE_LIMITED;
        }
        if (status == 408 || status == 504) {
            return TIMEOUT;
        }
        if (status == 401 || status == 403) {
            return AUTHENTICATION;
        }
        if (status >= 400 && status < 500) {
            return INVALID_REQUEST;
        }
        return UPSTREAM;
    }
}
