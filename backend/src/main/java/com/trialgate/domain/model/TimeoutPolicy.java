/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.domain.model;

import java.time.Duration;
import java.util.Objects;

public record TimeoutPolicy(
        Duration timeout,
        FallbackAction onTimeout,
        String fallbackKey
) {
    public TimeoutPolicy {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, was " + timeout);
        }
        onTimeout = onTimeout == null ? FallbackAction.THROW_EXCEPTION : onTimeout;
        if (onTimeout == FallbackAction.FALLBACK_TO_SPECIFIC_TRIAL && (fallbackKey == null || fallbackKey.isBlank())) {
            throw new IllegalArgumentException("FALLBACK_TO_SPECIFIC_TRIAL requires a fallback key");
        }
    }

    public static TimeoutPolicy throwAfter(Duration timeout) {
        return new TimeoutPolicy(timeout, FallbackAction.THROW_EXCEPTION, null);
    }

    public static TimeoutPolicy fallbackToDefaultAfter(Duration timeout) {
        return new TimeoutPolicy(timeout, FallbackAction.FALLBACK_TO_DEFAULT, null);
    }
}
