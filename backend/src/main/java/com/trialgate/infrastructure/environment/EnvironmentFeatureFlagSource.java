/*
 * Copyright (C) 2025 Trialgate
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.trialgate.infrastructure.environment;

import com.trialgate.application.selection.FeatureFlagSource;
import org.springframework.core.env.Environment;

import java.util.Optional;

/**
 * Flags from the Spring environment under {@code trials.features.<flag>}.
 */
public class EnvironmentFeatureFlagSource implements FeatureFlagSource {
    public static final String PREFIX = "trials.features.";

    private final Environment environment;

    public EnvironmentFeatureFlagSource(Environment environment) {
        this.environment = environment;
    }

    @Override
    public Optional<Boolean> isEnabled(String flagName) {
        return Optional.ofNullable(environment.getProperty(PREFIX + flagName, Boolean.class));
    }
}
