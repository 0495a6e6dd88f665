/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.errors;

/**
 * Base of the errors raised by the routing engine itself, as opposed to errors thrown by a
 * trial implementation, which reach the caller unchanged.
 */
public abstract class TrialgateException extends RuntimeException {
    private final Class<?> serviceType;
    private final String trialKey;
    private final TrialErrorType type;

    protected TrialgateException(Class<?> serviceType, String trialKey, TrialErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.serviceType = serviceType;
        this.trialKey = trialKey;
        this.type = type;
    }

    public Class<?> getServiceType() {
        return serviceType;
    }

    /**
     * Trial the error relates to, or {@code null} when it concerns the whole experiment.
     */
    public String getTrialKey() {
        return trialKey;
    }

    public TrialErrorType getType() {
        return type;
    }
}
