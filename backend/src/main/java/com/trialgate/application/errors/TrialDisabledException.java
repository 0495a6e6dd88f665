/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.errors;

public class TrialDisabledException extends TrialgateException {
    public TrialDisabledException(Class<?> serviceType, String trialKey) {
        super(serviceType, trialKey, TrialErrorType.TRIAL_DISABLED,
                "Trial '" + trialKey + "' for " + serviceType.getSimpleName() + " is disabled by kill switch", null);
    }
}
