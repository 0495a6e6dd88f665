/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.errors;

public class ExperimentDisabledException extends TrialgateException {
    public ExperimentDisabledException(Class<?> serviceType) {
        super(serviceType, null, TrialErrorType.EXPERIMENT_DISABLED,
                "Experiment for " + serviceType.getSimpleName() + " is disabled by kill switch", null);
    }
}
