package com.bastion.resilience;

import com.bastion.telemetry.GatewayEventListener;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Sliding-window admission control for one provider, with exponential-backoff retry.
 *
 * <p>Every caller reserves its admission time on arrival: immediately when the window has
 * room, otherwise exactly one window after the admission {@code maxRequests} places ahead of
 * it. Callers are therefore admitted in arrival order and wait at most once. The limiter
 * never fails a caller; it only delays. A caller that cancels while waiting gives its slot back.
 *
 * <p>Time is read from, and waits are scheduled on, the injected {@link Scheduler}.
 */
@Slf4j
public class RateLimiter {

    @Getter
    private final String providerId;
    private final int maxRequests;
    private final long windowMs;
    private final int maxRetries;
    private final Duration baseBackoff;
    private final Scheduler scheduler;
    private final GatewayEventListener listener;

    // admission times (epoch ms), ascending; entries after "now" are reservations of waiting callers
    private final List<Long> admissions = new ArrayList<>();
    private long lastExpiredAdmission = -1;

    public RateLimiter(String providerId, int maxRequests, Duration window, int maxRetries,
                       Duration baseBackoff, Scheduler scheduler, GatewayEventListener listener) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.providerId = providerId;
        this.maxRequests = maxRequests;
        this.windowMs = window.toMillis();
        this.maxRetries = maxRetries;
        this.baseBackoff = baseBackoff;
        this.scheduler = scheduler;
        this.listener = listener;
    }

    /**
     * Completes once the caller has been admitted.
     */
    public Mono<Void> acquire() {
        return Mono.defer(() -> {
            long admitAt = reserve();
            long waitMs = admitAt - now();
            if (waitMs <= 0) {
                return Mono.empty();
            }
            int waiting = pending();
            log.debug("Admission for {} delayed {}ms, {} callers waiting", providerId, waitMs, waiting);
            listener.onAdmissionDelayed(providerId, waitMs, waiting);
            return Mono.delay(Duration.ofMillis(waitMs), scheduler)
                    .doOnCancel(() -> release(admitAt))
                    .then();
        });
    }

    /**
     * Admits and runs {@code operation}, retrying failures accepted by {@code retryPredicate}
     * after {@code baseBackoff * 2^attempt}. Every attempt is admitted separately. When the
     * predicate rejects an error or retries run out the last error is rethrown unchanged.
     */
    public <T> Mono<T> executeWithRetry(Supplier<Mono<T>> operation, Predicate<Throwable> retryPredicate) {
        return Mono.defer(() -> acquire().then(Mono.defer(operation)))
                .retryWhen(Retry.backoff(maxRetries, baseBackoff)
                        .jitter(0d)
                        .filter(retryPredicate)
                        .scheduler(scheduler)
                        .doBeforeRetry(signal -> log.warn("Retrying {} (attempt {}/{}): {}",
                                providerId, signal.totalRetries() + 1, maxRetries,
                                signal.failure().getMessage()))
                        .onRetryExhaustedThrow((spec, signal) -> signal.failure()));
    }

    /**
     * Books the earliest admission time that keeps at most {@code maxRequests} admissions in
     * any window, counting the reservations already handed out.
     *
     * @return the caller's admission time in epoch milliseconds
     */
    synchronized long reserve() {
        long now = now();
        evictExpired(now);
        long admitAt = now;
        if (admissions.size() >= maxRequests) {
            admitAt = Math.max(now, admissions.get(admissions.size() - maxRequests) + windowMs);
        }
        int position = admissions.size();
        while (position > 0 && admissions.get(position - 1) > admitAt) {
            position--;
        }
        admissions.add(position, admitAt);
        return admitAt;
    }

    private synchronized void release(long admitAt) {
        admissions.remove(Long.valueOf(admitAt));
    }

    private synchronized int pending() {
        long now = now();
        int count = 0;
        for (Long admission : admissions) {
            if (admission > now) {
                count++;
            }
        }
        return count;
    }

    public synchronized RateLimitWindow window() {
        long now = now();
        evictExpired(now);
        int count = 0;
        long first = now;
        long last = lastExpiredAdmission;
        for (Long admission : admissions) {
            if (admission > now) {
                break;
            }
            if (count == 0) {
                first = admission;
            }
            last = admission;
            count++;
        }
        return RateLimitWindow.builder()
                .requestCount(count)
                .windowStartTime(Instant.ofEpochMilli(first))
                .lastRequestTime(last < 0 ? null : Instant.ofEpochMilli(last))
                .build();
    }

    private void evictExpired(long now) {
        while (!admissions.isEmpty() && now - admissions.get(0) >= windowMs) {
            lastExpiredAdmission = admissions.remove(0);
        }
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }
}
