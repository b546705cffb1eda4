package com.bastion.resilience;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of a limiter's admission window.
 */
@Value
@Builder
public class RateLimitWindow {

    int requestCount;

    /**
     * Oldest admission still inside the window, or the snapshot time when the window is empty.
     */
    Instant windowStartTime;

    Instant lastRequestTime;
}
