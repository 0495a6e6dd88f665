/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.errors;

import java.time.Duration;

public class TrialTimeoutException extends TrialgateException {
    private final Duration timeout;

    public TrialTimeoutException(Class<?> serviceType, String trialKey, String methodName, Duration timeout, Throwable cause) {
        super(serviceType, trialKey, TrialErrorType.TIMEOUT,
                "Trial '" + trialKey + "' for " + serviceType.getSimpleName() + "." + methodName
                        + " exceeded timeout of " + timeout.toMillis() + "ms", cause);
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
