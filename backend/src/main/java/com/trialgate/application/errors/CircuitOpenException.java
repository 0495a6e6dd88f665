/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.errors;

public class CircuitOpenException extends TrialgateException {
    public CircuitOpenException(Class<?> serviceType, String trialKey) {
        super(serviceType, trialKey, TrialErrorType.CIRCUIT_OPEN,
                "Circuit breaker is open for trial '" + trialKey + "' of " + serviceType.getSimpleName(), null);
    }
}
