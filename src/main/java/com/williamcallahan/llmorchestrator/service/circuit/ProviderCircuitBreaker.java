package com.williamcallahan.llmorchestrator.service.circuit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed / open / half-open state machine guarding one provider.
 *
 * <p>Closed opens after {@code failureThreshold} consecutive failures. Open refuses calls until
 * the cool-down elapses, then the first permission request moves it to half-open and is granted
 * the single trial call. A successful trial closes the breaker and resets the failure count; a
 * failed trial reopens it with the cool-down doubled, bounded by {@code maxCoolDown}. Apart from
 * {@link #forceClose()}, no other transition exists.</p>
 *
 * <p>State changes are short synchronized sections; no lock is held during a provider call.
 * Listeners are notified after the lock is released.</p>
 */
public class ProviderCircuitBreaker {
    private final String provider;
    private final CircuitBreakerSettings settings;
    private final Clock clock;
    private final CircuitTransitionListener listener;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureAt;
    private Instant nextTrialAt;
    private Duration currentCoolDown;
    private boolean trialInFlight;
    private long successfulCalls;
    private long failedCalls;
    private long rejectedCalls;

    public ProviderCircuitBreaker(
            String provider, CircuitBreakerSettings settings, Clock clock, CircuitTransitionListener listener) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.currentCoolDown = settings.coolDown();
    }

    /**
     * Requests permission for one call.
     *
     * <p>In half-open state only one caller at a time receives the {@link CallPermission#TRIAL};
     * that caller must report {@link #recordSuccess(CallPermission)},
     * {@link #recordFailure(CallPermission)} or {@link #releaseTrial()}.</p>
     *
     * @return whether the call may proceed, and whether it is the half-open trial
     */
    public CallPermission tryAcquirePermission() {
        CircuitState previous;
        CircuitState current;
        CallPermission permission;
        synchronized (this) {
            previous = state;
            permission = switch (state) {
                case CLOSED -> CallPermission.GRANTED;
                case OPEN -> {
                    if (clock.instant().isBefore(nextTrialAt)) {
                        yield CallPermission.DENIED;
                    }
                    state = CircuitState.HALF_OPEN;
                    nextTrialAt = null;
                    trialInFlight = true;
                    yield CallPermission.TRIAL;
                }
                case HALF_OPEN -> {
                    if (trialInFlight) {
                        yield CallPermission.DENIED;
                    }
                    trialInFlight = true;
                    yield CallPermission.TRIAL;
                }
            };
            if (permission == CallPermission.DENIED) {
                rejectedCalls++;
            }
            current = state;
        }
        notifyIfChanged(previous, current);
        return permission;
    }

    /**
     * Returns whether a call would currently be permitted, without changing state.
     */
    public synchronized boolean isCallPermitted() {
        return switch (state) {
            case CLOSED -> true;
            case OPEN -> !clock.instant().isBefore(nextTrialAt);
            case HALF_OPEN -> !trialInFlight;
        };
    }

    /**
     * Records a successful call. Only the holder of the half-open trial closes the breaker; a
     * call admitted earlier that finishes during half-open is counted but changes nothing.
     *
     * @param permission permission the call was admitted under
     */
    public void recordSuccess(CallPermission permission) {
        requireAdmitted(permission);
        CircuitState previous;
        CircuitState current;
        synchronized (this) {
            previous = state;
            successfulCalls++;
            if (state == CircuitState.HALF_OPEN && permission == CallPermission.TRIAL) {
                state = CircuitState.CLOSED;
                currentCoolDown = settings.coolDown();
                trialInFlight = false;
                failureCount = 0;
            } else if (state == CircuitState.CLOSED) {
                failureCount = 0;
            }
            current = state;
        }
        notifyIfChanged(previous, current);
    }

    /**
     * Records a failed call, including timeouts. Opens a closed breaker at the threshold. While
     * half-open only the trial holder's failure reopens it; late failures of other calls are
     * counted without a transition.
     *
     * @param permission permission the call was admitted under
     */
    public void recordFailure(CallPermission permission) {
        requireAdmitted(permission);
        CircuitState previous;
        CircuitState current;
        synchronized (this) {
            previous = state;
            Instant now = clock.instant();
            failedCalls++;
            lastFailureAt = now;
            if (state == CircuitState.CLOSED) {
                failureCount++;
                if (failureCount >= settings.failureThreshold()) {
                    state = CircuitState.OPEN;
                    nextTrialAt = now.plus(currentCoolDown);
                }
            } else if (state == CircuitState.HALF_OPEN && permission == CallPermission.TRIAL) {
                failureCount++;
                Duration doubled = currentCoolDown.multipliedBy(2);
                currentCoolDown = doubled.compareTo(settings.maxCoolDown()) > 0 ? settings.maxCoolDown() : doubled;
                state = CircuitState.OPEN;
                nextTrialAt = now.plus(currentCoolDown);
                trialInFlight = false;
            }
            current = state;
        }
        notifyIfChanged(previous, current);
    }

    /**
     * Gives back a half-open trial whose outcome will never be known, for example because the
     * caller cancelled. The next permission request gets the trial instead.
     */
    public synchronized void releaseTrial() {
        if (state == CircuitState.HALF_OPEN) {
            trialInFlight = false;
        }
    }

    /**
     * Administrative override: closes the breaker and clears its failure history.
     */
    public void forceClose() {
        CircuitState previous;
        synchronized (this) {
            previous = state;
            state = CircuitState.CLOSED;
            failureCount = 0;
            nextTrialAt = null;
            trialInFlight = false;
            currentCoolDown = settings.coolDown();
        }
        notifyIfChanged(previous, CircuitState.CLOSED);
    }

    public synchronized CircuitState state() {
        return state;
    }

    public synchronized int failureCount() {
        return failureCount;
    }

    public String provider() {
        return provider;
    }

    public synchronized CircuitBreakerSnapshot snapshot() {
        return new CircuitBreakerSnapshot(
                provider,
                state,
                failureCount,
                lastFailureAt,
                nextTrialAt,
                currentCoolDown,
                successfulCalls,
                failedCalls,
                rejectedCalls);
    }

    private static void requireAdmitted(CallPermission permission) {
        if (permission == null || !permission.isGranted()) {
            throw new IllegalArgumentException("Outcome reported for a call that was not admitted: " + permission);
        }
    }

    private void notifyIfChanged(CircuitState previous, CircuitState current) {
        if (previous != current) {
            listener.onTransition(provider, previous, current);
        }
    }
}
