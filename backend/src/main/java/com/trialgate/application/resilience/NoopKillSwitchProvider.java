/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.application.resilience;

import java.util.Set;

public final class NoopKillSwitchProvider implements KillSwitchProvider {
    public static final NoopKillSwitchProvider INSTANCE = new NoopKillSwitchProvider();

    private NoopKillSwitchProvider() {}

    @Override
    public boolean isExperimentDisabled(Class<?> serviceType) {
        return false;
    }

    @Override
    public boolean isTrialDisabled(Class<?> serviceType, String trialKey) {
        return false;
    }

    @Override
    public void disableExperiment(Class<?> serviceType) {
        throw new UnsupportedOperationException("No kill switch configured for " + serviceType.getName());
    }

    @Override
    public void enableExperiment(Class<?> serviceType) {}

    @Override
    public void disableTrial(Class<?> serviceType, String trialKey) {
        throw new UnsupportedOperationException("No kill switch configured for " + serviceType.getName());
    }

    @Override
    public void enableTrial(Class<?> serviceType, String trialKey) {}

    @Override
    public Set<String> disabledTrials(Class<?> serviceType) {
        return Set.of();
    }
}
