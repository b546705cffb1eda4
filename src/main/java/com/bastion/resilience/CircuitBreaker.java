package com.bastion.resilience;

import com.bastion.exception.ProviderUnavailableException;
import com.bastion.telemetry.GatewayEventListener;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Failure-isolation state machine guarding one call path.
 *
 * <p>The breaker only decides whether an attempt may start. It never retries and always
 * rethrows the operation's own error. While open, calls fail with
 * {@link ProviderUnavailableException} without subscribing to the operation. In half-open
 * exactly one trial call is let through, and only its outcome closes or reopens the circuit.
 * A call that completes after a transition it was not part of leaves the state untouched.
 */
@Slf4j
public class CircuitBreaker {

    @Getter
    private final String name;
    private final int failureThreshold;
    private final Duration cooldown;
    private final Clock clock;
    private final GatewayEventListener listener;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures;
    private Instant lastFailureTime;
    private boolean trialInFlight;
    // bumped on every transition; outcomes of calls admitted under an older generation are ignored
    private long generation;

    public CircuitBreaker(String name, int failureThreshold, Duration cooldown,
                          Clock clock, GatewayEventListener listener) {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException("failureThreshold must be positive");
        }
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.clock = clock;
        this.listener = listener;
    }

    public <T> Mono<T> execute(Supplier<Mono<T>> operation) {
        return Mono.defer(() -> {
            Permit permit = tryAcquirePermission();
            if (permit == null) {
                return Mono.error(new ProviderUnavailableException(name, "circuit " + currentState().name().toLowerCase()));
            }
            AtomicBoolean settled = new AtomicBoolean();
            return Mono.defer(operation)
                    .doOnSuccess(value -> {
                        if (settled.compareAndSet(false, true)) {
                            onSuccess(permit);
                        }
                    })
                    .doOnError(error -> {
                        if (settled.compareAndSet(false, true)) {
                            onFailure(permit, error);
                        }
                    })
                    .doOnCancel(() -> {
                        if (settled.compareAndSet(false, true)) {
                            releaseTrial(permit);
                        }
                    });
        });
    }

    /**
     * @return the permit for one call, or null when the call is rejected
     */
    synchronized Permit tryAcquirePermission() {
        switch (state) {
            case CLOSED:
                return new Permit(generation, false);
            case OPEN:
                if (Duration.between(lastFailureTime, clock.instant()).compareTo(cooldown) < 0) {
                    return null;
                }
                transitionTo(CircuitState.HALF_OPEN);
                trialInFlight = true;
                return new Permit(generation, true);
            case HALF_OPEN:
                if (trialInFlight) {
                    return null;
                }
                trialInFlight = true;
                return new Permit(generation, true);
            default:
                throw new IllegalStateException("Unknown state " + state);
        }
    }

    private synchronized void onSuccess(Permit permit) {
        if (permit.generation != generation) {
            log.debug("Breaker {} ignoring success of a call admitted before the last transition", name);
            return;
        }
        consecutiveFailures = 0;
        if (permit.trial) {
            trialInFlight = false;
            transitionTo(CircuitState.CLOSED);
        }
    }

    private synchronized void onFailure(Permit permit, Throwable error) {
        if (permit.generation != generation) {
            log.debug("Breaker {} ignoring failure of a call admitted before the last transition: {}",
                    name, error.getMessage());
            return;
        }
        consecutiveFailures++;
        lastFailureTime = clock.instant();
        log.debug("Breaker {} recorded failure {}/{}: {}", name, consecutiveFailures, failureThreshold,
                error.getMessage());
        if (permit.trial) {
            trialInFlight = false;
            transitionTo(CircuitState.OPEN);
        } else if (consecutiveFailures >= failureThreshold) {
            transitionTo(CircuitState.OPEN);
        }
    }

    private synchronized void releaseTrial(Permit permit) {
        if (permit.trial && permit.generation == generation) {
            trialInFlight = false;
        }
    }

    private void transitionTo(CircuitState next) {
        CircuitState previous = state;
        state = next;
        generation++;
        listener.onCircuitTransition(name, previous, next);
    }

    public synchronized CircuitState currentState() {
        return state;
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return CircuitBreakerSnapshot.builder()
                .name(name)
                .state(state)
                .consecutiveFailures(consecutiveFailures)
                .lastFailureTime(lastFailureTime)
                .build();
    }

    static final class Permit {
        private final long generation;
        private final boolean trial;

        private Permit(long generation, boolean trial) {
            this.generation = generation;
            this.trial = trial;
        }
    }
}
