/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.resilience;

import java.util.Set;

/**
 * Out-of-band switch that disables a whole experiment or a single trial of it.
 */
public interface KillSwitchProvider {
    boolean isExperimentDisabled(Class<?> serviceType);

    boolean isTrialDisabled(Class<?> serviceType, String trialKey);

    void disableExperiment(Class<?> serviceType);

    void enableExperiment(Class<?> serviceType);

    void disableTrial(Class<?> serviceType, String trialKey);

    void enableTrial(Class<?> serviceType, String trialKey);

    Set<String> disabledTrials(Class<?> serviceType);
}
