/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.resilience;

import com.trialgate.domain.model.CircuitBreakerOptions;
import com.trialgate.domain.model.CircuitState;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Circuit breaker shared by every call of one registration.
 *
 * <p>Counters live in a resilience4j time-based sliding window, so concurrent callers record
 * outcomes without a lock on the hot path. Open state is left lazily: the first permission
 * request after {@code breakDuration} moves the breaker to half-open and lets one trial call through.
 */
public class TrialCircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(TrialCircuitBreaker.class);

    private final String name;
    private final CircuitBreakerOptions options;
    private final CircuitBreaker breaker;

    public TrialCircuitBreaker(String name, CircuitBreakerOptions options) {
        this.name = name;
        this.options = options;

        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold((float) (options.failureRatioThreshold() * 100.0))
                .slidingWindowType(SlidingWindowType.TIME_BASED)
                .slidingWindowSize((int) options.samplingDuration().toSeconds())
                .minimumNumberOfCalls(options.minimumThroughput())
                .waitDurationInOpenState(options.breakDuration())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
        this.breaker = CircuitBreaker.of(name, config);
        this.breaker.getEventPublisher().onStateTransition(event -> log.warn(
                "Circuit breaker {} transition {} -> {}",
                name,
                event.getStateTransition().getFromState(),
                event.getStateTransition().getToState()
        ));
    }

    public String name() {
        return name;
    }

    public CircuitBreakerOptions options() {
        return options;
    }

    /**
     * Asks for permission to run one attempt. A granted permission must be followed by
     * exactly one of {@link #recordSuccess}, {@link #recordFailure} or {@link #release}.
     */
    public boolean tryAcquire() {
        return breaker.tryAcquirePermission();
    }

    public void recordSuccess(long elapsedNanos) {
        breaker.onSuccess(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordFailure(long elapsedNanos, Throwable error) {
        breaker.onError(elapsedNanos, TimeUnit.NANOSECONDS, error);
    }

    public void release() {
        breaker.releasePermission();
    }

    public CircuitState state() {
        return toCircuitState(breaker.getState());
    }

    /**
     * Registers a listener called with the previous and the new state on every transition.
     */
    public void onStateTransition(BiConsumer<CircuitState, CircuitState> listener) {
        breaker.getEventPublisher().onStateTransition(event -> listener.accept(
                toCircuitState(event.getStateTransition().getFromState()),
                toCircuitState(event.getStateTransition().getToState())
        ));
    }

    public float failureRate() {
        return breaker.getMetrics().getFailureRate();
    }

    /** Outcomes recorded in the current window. */
    public int bufferedCalls() {
        return breaker.getMetrics().getNumberOfBufferedCalls();
    }

    public int failedCalls() {
        return breaker.getMetrics().getNumberOfFailedCalls();
    }

    /** Permission requests refused while open. */
    public long notPermittedCalls() {
        return breaker.getMetrics().getNumberOfNotPermittedCalls();
    }

    private static CircuitState toCircuitState(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> CircuitState.OPEN;
            case HALF_OPEN -> CircuitState.HALF_OPEN;
            default -> CircuitState.CLOSED;
        };
    }
}
