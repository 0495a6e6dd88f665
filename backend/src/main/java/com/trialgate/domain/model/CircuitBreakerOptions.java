/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.domain.model;

import java.time.Duration;

/**
 * Settings of the per-registration circuit breaker.
 *
 * <p>The breaker opens when, within the last {@code samplingDuration}, at least
 * {@code minimumThroughput} calls were recorded and the share of failures reached
 * {@code failureRatioThreshold}. It stays open for {@code breakDuration}, then lets a single
 * trial call through.
 */
public record CircuitBreakerOptions(
        double failureRatioThreshold,
        int minimumThroughput,
        Duration samplingDuration,
        Duration breakDuration,
        FallbackAction onCircuitOpen,
        String fallbackKey
) {
    public CircuitBreakerOptions {
        if (failureRatioThreshold <= 0 || failureRatioThreshold > 1) {
            throw new IllegalArgumentException("failureRatioThreshold must be in (0, 1], was " + failureRatioThreshold);
        }
        if (minimumThroughput < 1) {
            throw new IllegalArgumentException("minimumThroughput must be >= 1, was " + minimumThroughput);
        }
        samplingDuration = samplingDuration == null ? Duration.ofSeconds(10) : samplingDuration;
        breakDuration = breakDuration == null ? Duration.ofSeconds(30) : breakDuration;
        if (samplingDuration.toSeconds() < 1) {
            throw new IllegalArgumentException("samplingDuration must be at least one second, was " + samplingDuration);
        }
        if (breakDuration.isNegative() || breakDuration.isZero()) {
            throw new IllegalArgumentException("breakDuration must be positive, was " + breakDuration);
        }
        onCircuitOpen = onCircuitOpen == null ? FallbackAction.THROW_EXCEPTION : onCircuitOpen;
        if (onCircuitOpen == FallbackAction.FALLBACK_TO_SPECIFIC_TRIAL && (fallbackKey == null || fallbackKey.isBlank())) {
            throw new IllegalArgumentException("FALLBACK_TO_SPECIFIC_TRIAL requires a fallback key");
        }
    }

    public static CircuitBreakerOptions defaults() {
        return new CircuitBreakerOptions(0.5, 10, Duration.ofSeconds(10), Duration.ofSeconds(30), FallbackAction.THROW_EXCEPTION, null);
    }
}
